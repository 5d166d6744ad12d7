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

package io.routekit.examples.products.middleware;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import org.jboss.logging.Logger;

import io.routekit.middleware.Middleware;
import io.routekit.middleware.MiddlewareResult;
import io.routekit.server.RequestContext;

/**
 * Global middleware that logs every routed request and stamps the response with the time it took.
 */
public class RequestLogger implements Middleware {

    public static final String RESPONSE_TIME_HEADER = "X-Response-Time";

    private static final Logger log = Logger.getLogger(RequestLogger.class);

    @Override
    public CompletionStage<MiddlewareResult> handle(final RequestContext context) {
        final long start = System.nanoTime();
        log.infof("%s %s", context.getRequest().getMethod(), context.getRequest().getRequestTarget());
        return CompletableFuture.completedFuture(MiddlewareResult.transform(response -> {
            long micros = (System.nanoTime() - start) / 1000;
            log.debugf("%s %s -> %s in %sus", context.getRequest().getMethod(), context.getRequest().getRequestTarget(), response.getStatus(), micros);
            return CompletableFuture.completedFuture(response.toBuilder()
                    .header(RESPONSE_TIME_HEADER, micros + "us")
                    .build());
        }));
    }
}
