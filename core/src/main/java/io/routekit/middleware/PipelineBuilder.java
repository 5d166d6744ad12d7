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

package io.routekit.middleware;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import io.routekit.RouteKitMessages;
import io.routekit.routing.RouteDescriptor;
import io.routekit.routing.RouteTable;
import io.routekit.server.RouteHandler;
import io.routekit.util.HttpMethod;
import io.routekit.validation.RouteSchema;
import io.routekit.validation.ValidationMiddleware;

/**
 * Flattens global, validation and route specific middleware into one array per route and method.
 * <p>
 * The order is: global middleware in registration order, then the validation middleware if the route declares a
 * schema for the method, then the route's own middleware in declaration order.
 */
public final class PipelineBuilder {

    private final List<Middleware> globalMiddleware;

    public PipelineBuilder(final List<Middleware> globalMiddleware) {
        if (globalMiddleware == null) {
            throw RouteKitMessages.MESSAGES.argumentCannotBeNull("globalMiddleware");
        }
        this.globalMiddleware = Collections.unmodifiableList(new ArrayList<>(globalMiddleware));
    }

    public MiddlewarePipeline build(final RouteDescriptor route, final HttpMethod method) {
        final RouteHandler handler = route.getHandler(method);
        if (handler == null) {
            throw RouteKitMessages.MESSAGES.argumentCannotBeNull("handler");
        }
        final RouteSchema schema = route.getSchema(method);
        final List<Middleware> routeMiddleware = route.getMiddleware();
        final Middleware[] chain = new Middleware[globalMiddleware.size() + (schema == null ? 0 : 1) + routeMiddleware.size()];
        int pos = 0;
        for (Middleware middleware : globalMiddleware) {
            chain[pos++] = middleware;
        }
        if (schema != null) {
            chain[pos++] = new ValidationMiddleware(schema);
        }
        for (Middleware middleware : routeMiddleware) {
            chain[pos++] = middleware;
        }
        return new MiddlewarePipeline(route, method, chain, handler);
    }

    /**
     * Builds the pipeline of every method of every route in the table.
     *
     * @return an unmodifiable map keyed by route identity
     */
    public Map<RouteDescriptor, Map<HttpMethod, MiddlewarePipeline>> buildAll(final RouteTable table) {
        final Map<RouteDescriptor, Map<HttpMethod, MiddlewarePipeline>> result = new IdentityHashMap<>();
        for (RouteDescriptor route : table.getRoutes()) {
            final Map<HttpMethod, MiddlewarePipeline> byMethod = new EnumMap<>(HttpMethod.class);
            for (HttpMethod method : route.getHandlers().keySet()) {
                byMethod.put(method, build(route, method));
            }
            result.put(route, Collections.unmodifiableMap(byMethod));
        }
        return Collections.unmodifiableMap(result);
    }

    public List<Middleware> getGlobalMiddleware() {
        return globalMiddleware;
    }
}
