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

package io.routekit.server;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * The terminal stage of a route: produces the response for one HTTP method of one route.
 */
@FunctionalInterface
public interface RouteHandler {

    /**
     * Handle the request.
     *
     * @param context the per-request context
     * @return the eventual response, never null
     */
    CompletionStage<Response> handleRequest(RequestContext context) throws Exception;

    /**
     * Adapts a handler that produces its response directly.
     */
    static RouteHandler of(final Simple handler) {
        return context -> CompletableFuture.completedFuture(handler.handleRequest(context));
    }

    /**
     * A handler that produces its response without suspending.
     */
    @FunctionalInterface
    interface Simple {

        Response handleRequest(RequestContext context) throws Exception;
    }
}
