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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import io.routekit.RouteKitLogger;
import io.routekit.RouteKitMessages;
import io.routekit.routing.RouteDescriptor;
import io.routekit.server.RequestContext;
import io.routekit.server.Response;
import io.routekit.server.RouteHandler;
import io.routekit.util.HttpMethod;

/**
 * The precomputed middleware chain of one route and method, ending in the route's handler.
 * <p>
 * The chain array is built once by {@link PipelineBuilder} and never changes, so a pipeline can serve any number of
 * concurrent requests. Per-request state (the cursor and the collected transforms) lives on the call stack and in
 * the completion stages of that request only.
 * <p>
 * Execution walks the chain front to back:
 * <ul>
 * <li>a short-circuit result is returned as is, nothing after it runs and no collected transform is applied;</li>
 * <li>a transform result is remembered and the walk continues;</li>
 * <li>once the chain is exhausted the handler runs and the remembered transforms are applied to its response,
 * the most recently registered first.</li>
 * </ul>
 * Failures are never handled here. A middleware, handler or transform that throws or completes exceptionally makes
 * the returned stage complete exceptionally, and the dispatcher turns that into a 500.
 */
public final class MiddlewarePipeline {

    private final RouteDescriptor route;
    private final HttpMethod method;
    private final Middleware[] chain;
    private final RouteHandler handler;

    MiddlewarePipeline(final RouteDescriptor route, final HttpMethod method, final Middleware[] chain, final RouteHandler handler) {
        this.route = route;
        this.method = method;
        this.chain = chain;
        this.handler = handler;
    }

    public CompletionStage<Response> execute(final RequestContext context) {
        return next(context, 0, null);
    }

    private CompletionStage<Response> next(final RequestContext context, final int cursor, final Deque<ResponseTransformer> transforms) {
        if (cursor == chain.length) {
            return invokeHandler(context, transforms);
        }
        return invoke(cursor, context).thenCompose(result -> {
            if (result == null) {
                throw RouteKitMessages.MESSAGES.middlewareReturnedNoResult(cursor, method.name(), route.getPattern().toString());
            }
            switch (result.getKind()) {
                case SHORT_CIRCUIT:
                    if (RouteKitLogger.REQUEST_LOGGER.isDebugEnabled()) {
                        RouteKitLogger.REQUEST_LOGGER.debugf("Middleware %s short-circuited %s %s with status %s", cursor, method, route.getPattern(), result.getResponse().getStatus());
                    }
                    return CompletableFuture.completedFuture(result.getResponse());
                case TRANSFORM:
                    final Deque<ResponseTransformer> collected = transforms == null ? new ArrayDeque<>(4) : transforms;
                    collected.push(result.getTransformer());
                    return next(context, cursor + 1, collected);
                default:
                    return next(context, cursor + 1, transforms);
            }
        });
    }

    private CompletionStage<MiddlewareResult> invoke(final int cursor, final RequestContext context) {
        try {
            CompletionStage<MiddlewareResult> stage = chain[cursor].handle(context);
            if (stage == null) {
                throw RouteKitMessages.MESSAGES.middlewareReturnedNoResult(cursor, method.name(), route.getPattern().toString());
            }
            return stage;
        } catch (Throwable t) {
            return CompletableFuture.failedFuture(t);
        }
    }

    private CompletionStage<Response> invokeHandler(final RequestContext context, final Deque<ResponseTransformer> transforms) {
        CompletionStage<Response> stage;
        try {
            stage = handler.handleRequest(context);
            if (stage == null) {
                throw RouteKitMessages.MESSAGES.handlerReturnedNoResponse(method.name(), route.getPattern().toString());
            }
        } catch (Throwable t) {
            return CompletableFuture.failedFuture(t);
        }
        stage = stage.thenApply(response -> {
            if (response == null) {
                throw RouteKitMessages.MESSAGES.handlerReturnedNoResponse(method.name(), route.getPattern().toString());
            }
            return response;
        });
        if (transforms == null) {
            return stage;
        }
        //the deque is used as a stack, so iteration starts with the last registered transform
        int depth = 0;
        for (ResponseTransformer transformer : transforms) {
            final int currentDepth = depth++;
            stage = stage.thenCompose(response -> applyTransform(transformer, response, currentDepth));
        }
        return stage;
    }

    private CompletionStage<Response> applyTransform(final ResponseTransformer transformer, final Response response, final int depth) {
        CompletionStage<Response> stage;
        try {
            stage = transformer.transform(response);
            if (stage == null) {
                throw RouteKitMessages.MESSAGES.transformReturnedNoResponse(depth, method.name(), route.getPattern().toString());
            }
        } catch (Throwable t) {
            return CompletableFuture.failedFuture(t);
        }
        return stage.thenApply(transformed -> {
            if (transformed == null) {
                throw RouteKitMessages.MESSAGES.transformReturnedNoResponse(depth, method.name(), route.getPattern().toString());
            }
            return transformed;
        });
    }

    public RouteDescriptor getRoute() {
        return route;
    }

    public HttpMethod getMethod() {
        return method;
    }

    /**
     * @return the number of middleware before the handler
     */
    public int size() {
        return chain.length;
    }

    /**
     * @return the middleware at the given position of the chain
     */
    public Middleware get(final int index) {
        return chain[index];
    }

    @Override
    public String toString() {
        return "MiddlewarePipeline{" + method + " " + route.getPattern() + ", " + chain.length + " middleware}";
    }
}
