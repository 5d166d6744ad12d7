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

package io.routekit.compiler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.routekit.RouteKitMessages;
import io.routekit.middleware.Middleware;
import io.routekit.server.RouteHandler;
import io.routekit.util.HttpMethod;
import io.routekit.validation.RouteSchema;

/**
 * A {@link RouteModule} assembled with a builder. Route classes can extend it and pass a configured builder to the
 * constructor.
 */
public class SimpleRouteModule implements RouteModule {

    private final Map<HttpMethod, RouteHandler> handlers;
    private final List<Middleware> middleware;
    private final Map<HttpMethod, RouteSchema> schemas;
    private final Map<String, Object> documentation;

    protected SimpleRouteModule(final Builder builder) {
        this.handlers = Collections.unmodifiableMap(new EnumMap<>(builder.handlers));
        this.middleware = Collections.unmodifiableList(new ArrayList<>(builder.middleware));
        this.schemas = Collections.unmodifiableMap(new EnumMap<>(builder.schemas));
        this.documentation = Collections.unmodifiableMap(new LinkedHashMap<>(builder.documentation));
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public Map<HttpMethod, RouteHandler> getHandlers() {
        return handlers;
    }

    @Override
    public List<Middleware> getMiddleware() {
        return middleware;
    }

    @Override
    public Map<HttpMethod, RouteSchema> getSchemas() {
        return schemas;
    }

    @Override
    public Map<String, Object> getDocumentation() {
        return documentation;
    }

    public static final class Builder {

        private final Map<HttpMethod, RouteHandler> handlers = new EnumMap<>(HttpMethod.class);
        private final List<Middleware> middleware = new ArrayList<>();
        private final Map<HttpMethod, RouteSchema> schemas = new EnumMap<>(HttpMethod.class);
        private final Map<String, Object> documentation = new LinkedHashMap<>();

        private Builder() {
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

        public Builder get(final RouteHandler handler) {
            return handler(HttpMethod.GET, handler);
        }

        public Builder post(final RouteHandler handler) {
            return handler(HttpMethod.POST, handler);
        }

        public Builder put(final RouteHandler handler) {
            return handler(HttpMethod.PUT, handler);
        }

        public Builder delete(final RouteHandler handler) {
            return handler(HttpMethod.DELETE, handler);
        }

        public Builder patch(final RouteHandler handler) {
            return handler(HttpMethod.PATCH, handler);
        }

        public Builder head(final RouteHandler handler) {
            return handler(HttpMethod.HEAD, handler);
        }

        public Builder options(final RouteHandler handler) {
            return handler(HttpMethod.OPTIONS, handler);
        }

        public Builder middleware(final Middleware... middleware) {
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
            schemas.put(method, schema);
            return this;
        }

        public Builder documentation(final HttpMethod method, final Object documentation) {
            this.documentation.put(method.lowerCaseName(), documentation);
            return this;
        }

        public SimpleRouteModule build() {
            return new SimpleRouteModule(this);
        }
    }
}
