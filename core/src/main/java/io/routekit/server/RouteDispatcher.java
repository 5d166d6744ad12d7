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

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;

import io.routekit.RouteKitLogger;
import io.routekit.RouteKitMessages;
import io.routekit.middleware.MiddlewarePipeline;
import io.routekit.middleware.PipelineBuilder;
import io.routekit.routing.RouteDescriptor;
import io.routekit.routing.RouteMatch;
import io.routekit.routing.RouteTable;
import io.routekit.util.HttpMethod;
import io.routekit.util.URLUtils;

/**
 * The request entry point. Classifies each request against the route table and either answers it directly
 * (404, 405) or runs the precomputed pipeline of the matched route and method.
 * <p>
 * Every failure raised while running a pipeline is contained here and turned into a 500, so one broken handler never
 * takes down the dispatcher. The table and pipelines are read only after construction, which makes a dispatcher safe
 * to share between any number of concurrent requests.
 */
public final class RouteDispatcher {

    private final RouteTable routeTable;
    private final DispatcherConfig config;
    private final Map<RouteDescriptor, Map<HttpMethod, MiddlewarePipeline>> pipelines;

    public RouteDispatcher(final RouteTable routeTable, final DispatcherConfig config) {
        if (routeTable == null) {
            throw RouteKitMessages.MESSAGES.argumentCannotBeNull("routeTable");
        }
        if (config == null) {
            throw RouteKitMessages.MESSAGES.argumentCannotBeNull("config");
        }
        this.routeTable = routeTable;
        this.config = config;
        this.pipelines = new PipelineBuilder(config.getGlobalMiddleware()).buildAll(routeTable);
    }

    /**
     * Dispatches a request.
     *
     * @return the eventual response. The stage never completes exceptionally.
     */
    public CompletionStage<Response> dispatch(final Request request) {
        final RouteMatch match = routeTable.match(URLUtils.normalizePath(request.getRawPath()), request.getMethod());
        switch (match.getOutcome()) {
            case NOT_FOUND:
                return CompletableFuture.completedFuture(ErrorResponses.notFound());
            case METHOD_NOT_ALLOWED:
                return CompletableFuture.completedFuture(ErrorResponses.methodNotAllowed(match.getAllowedMethods()));
            default:
                break;
        }
        final MiddlewarePipeline pipeline = pipelines.get(match.getRoute()).get(match.getMethod());
        final RequestContext context = new RequestContext(request, match);
        CompletionStage<Response> stage;
        try {
            stage = pipeline.execute(context);
        } catch (Throwable t) {
            stage = CompletableFuture.failedFuture(t);
        }
        return stage.handle((response, failure) -> {
            if (failure == null) {
                return response;
            }
            return handleFailure(request, unwrap(failure));
        });
    }

    /**
     * Dispatches a request and waits for the response.
     */
    public Response dispatchAndWait(final Request request) throws InterruptedException {
        try {
            return dispatch(request).toCompletableFuture().get();
        } catch (ExecutionException e) {
            //dispatch contains every failure, this only happens if a response listener itself failed
            throw new CompletionException(e.getCause());
        }
    }

    private Response handleFailure(final Request request, final Throwable failure) {
        if (config.isDebug()) {
            RouteKitLogger.REQUEST_LOGGER.exceptionProcessingRequest(request.getMethod(), request.getRequestTarget(), failure);
        } else {
            RouteKitLogger.REQUEST_LOGGER.exceptionProcessingRequestWithoutTrace(request.getMethod(), request.getRequestTarget(), String.valueOf(failure));
        }
        return ErrorResponses.internalError(request, failure, config.isDebug());
    }

    private static Throwable unwrap(final Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException) && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    public RouteTable getRouteTable() {
        return routeTable;
    }

    public DispatcherConfig getConfig() {
        return config;
    }

    /**
     * @return the pipeline serving the given route and method, null if the route does not implement the method
     */
    public MiddlewarePipeline getPipeline(final RouteDescriptor route, final HttpMethod method) {
        final Map<HttpMethod, MiddlewarePipeline> byMethod = pipelines.get(route);
        return byMethod == null ? null : byMethod.get(method);
    }
}
