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

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import io.routekit.server.RequestContext;
import io.routekit.server.Response;

/**
 * A step of the request pipeline that runs before the route handler.
 * <p>
 * Each invocation resolves to exactly one {@link MiddlewareResult}: a finished response that ends the request,
 * a plain "proceed", or a transform that is applied to the response once the handler has produced it.
 */
@FunctionalInterface
public interface Middleware {

    /**
     * @param context the per-request context
     * @return the eventual outcome, never null
     */
    CompletionStage<MiddlewareResult> handle(RequestContext context) throws Exception;

    static CompletionStage<MiddlewareResult> proceed() {
        return CompletableFuture.completedFuture(MiddlewareResult.proceed());
    }

    static CompletionStage<MiddlewareResult> respond(final Response response) {
        return CompletableFuture.completedFuture(MiddlewareResult.shortCircuit(response));
    }

    static CompletionStage<MiddlewareResult> transform(final ResponseTransformer transformer) {
        return CompletableFuture.completedFuture(MiddlewareResult.transform(transformer));
    }

    /**
     * Adapts a middleware that decides without suspending.
     */
    static Middleware of(final Simple middleware) {
        return context -> CompletableFuture.completedFuture(middleware.handle(context));
    }

    @FunctionalInterface
    interface Simple {

        MiddlewareResult handle(RequestContext context) throws Exception;
    }
}
