/*
 * JBoss, Home of Professional Open Source.
 * Copyright 2024 Red Hat, Inc., and individual contributors
 * as indicated by the @author tags.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */

package io.routekit.routing;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import io.routekit.RouteKitMessages;
import io.routekit.middleware.Middleware;
import io.routekit.server.RouteHandler;
import io.routekit.util.HttpMethod;
import io.routekit.validation.RouteSchema;

/**
 * The compiled form of one route file: a pattern plus the handlers, middleware, schemas and documentation declared
 * for it. Instances are immutable once built.
 */
public final class RouteDescriptor {

    private final RoutePattern pattern;
    private final Map<HttpMethod, RouteHandler> handlers;
    private final List<Middleware> middleware;
    private final Map<HttpMethod, RouteSchema> schemas;
    private final Map<String, Object> documentation;
    private final Path source;

    private RouteDescriptor(final Builder builder) {
        this.pattern = builder.pattern;
        this.handlers = Collections.unmodifiableMap(new EnumMap<>(builder.handlers));
        this.middleware = Collections.unmodifiableList(new ArrayList<>(builder.middleware));
        this.schemas = Collections.unmodifiableMap(new EnumMap<>(builder.schemas));
        this.documentation = Collections.unmodifiableMap(new LinkedHashMap<>(builder.documentation));
        this.source = builder.source;
    }

    public static Builder builder(final RoutePattern pattern) {
        return new Builder(pattern);
    }

    public static Builder builder(final String pattern) {
        return new Builder(RoutePattern.parse(pattern));
    }

    public RoutePattern getPattern() {
        return pattern;
    }

    public int getSpecificity() {
        return pattern.getSpecificity();
    }

    /**
     * @return the handler for the method, or null if the route does not implement it
     */
    public RouteHandler getHandler(final HttpMethod method) {
        return method == null ? null : handlers.get(method);
    }

    public boolean hasHandler(final HttpMethod method) {
        return method != null && handlers.containsKey(method);
    }

    public Map<HttpMethod, RouteHandler> getHandlers() {
        return handlers;
    }

    public Set<HttpMethod> getAllowedMethods() {
        return handlers.isEmpty() ? EnumSet.noneOf(HttpMethod.class) : EnumSet.copyOf(handlers.keySet());
    }

    /**
     * @return the route specific middleware, in declaration order
     */
    public List<Middleware> getMiddleware() {
        return middleware;
    }

    /**
     * @return the schema declared for the method, or null if requests with that method are not validated
     */
    public RouteSchema getSchema(final HttpMethod method) {
        return method == null ? null : schemas.get(method);
    }

    public Map<HttpMethod, RouteSchema> getSchemas() {
        return schemas;
    }

    /**
     * Documentation metadata keyed by lower case method name. The dispatcher never reads it.
     */
    public Map<String, Object> getDocumentation() {
        return documentation;
    }

    /**
     * @return the route file this descriptor was compiled from, or null for routes built in code
     */
    public Path getSource() {
        return source;
    }

    @Override
    public String toString() {
        return "RouteDescriptor{" + pattern + " " + handlers.keySet() + "}";
    }

    public static final class Builder {

        private final RoutePattern pattern;
        private final Map<HttpMethod, RouteHandler> handlers = new EnumMap<>(HttpMethod.class);
        private final List<Middleware> middleware = new ArrayList<>();
        private final Map<HttpMethod, RouteSchema> schemas = new EnumMap<>(HttpMethod.class);
        private final Map<String, Object> documentation = new LinkedHashMap<>();
        private Path source;

        private Builder(final RoutePattern pattern) {
            if (pattern == null) {
                throw RouteKitMessages.MESSAGES.argumentCannotBeNull("pattern");
            }
            this.pattern = pattern;
        }

        public Builder handler(final HttpMethod method, final RouteHandler handler) {
            if (method == null) {
                throw RouteKitMessages.MESSAGES.argumentCannotBeNull("method");
            }
            if (handler == null) {
                throw RouteKitMessages.MESSAGES.argumentCannotBeNull("handler");
            }
            handlers.put(method, handler);
            return this;
        }

        public Builder handlers(final Map<HttpMethod, RouteHandler> handlers) {
            for (Map.Entry<HttpMethod, RouteHandler> entry : handlers.entrySet()) {
                handler(entry.getKey(), entry.getValue());
            }
            return this;
        }

        public Builder middleware(final List<Middleware> middleware) {
            for (Middleware m : middleware) {
                if (m == null) {
                    throw RouteKitMessages.MESSAGES.argumentCannotBeNull("middleware");
                }
                this.middleware.add(m);
            }
            return this;
        }

        public Builder schema(final HttpMethod method, final RouteSchema schema) {
            if (method == null) {
                throw RouteKitMessages.MESSAGES.argumentCannotBeNull("method");
            }
            if (schema != null && !schema.isEmpty()) {
                schemas.put(method, schema);
            }
            return this;
        }

        public Builder schemas(final Map<HttpMethod, RouteSchema> schemas) {
            for (Map.Entry<HttpMethod, RouteSchema> entry : schemas.entrySet()) {
                schema(entry.getKey(), entry.getValue());
            }
            return this;
        }

        public Builder documentation(final Map<String, Object> documentation) {
            this.documentation.putAll(documentation);
            return this;
        }

        public Builder source(final Path source) {
            this.source = source;
            return this;
        }

        public RouteDescriptor build() {
            return new RouteDescriptor(this);
        }
    }
}
