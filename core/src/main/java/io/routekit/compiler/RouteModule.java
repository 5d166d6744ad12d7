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

import java.util.Collections;
import java.util.List;
import java.util.Map;

import io.routekit.middleware.Middleware;
import io.routekit.server.RouteHandler;
import io.routekit.util.HttpMethod;
import io.routekit.validation.RouteSchema;

/**
 * What a route file exports: its handlers and, optionally, middleware, schemas and documentation.
 * <p>
 * The compiler reads a module exactly once and copies its contents into an immutable descriptor.
 */
public interface RouteModule {

    /**
     * @return the handler of each implemented method
     */
    Map<HttpMethod, RouteHandler> getHandlers();

    /**
     * @return middleware that runs for every method of this route, after global and validation middleware
     */
    default List<Middleware> getMiddleware() {
        return Collections.emptyList();
    }

    default Map<HttpMethod, RouteSchema> getSchemas() {
        return Collections.emptyMap();
    }

    /**
     * @return documentation metadata for external generators, keyed by lower case method name
     */
    default Map<String, Object> getDocumentation() {
        return Collections.emptyMap();
    }
}
