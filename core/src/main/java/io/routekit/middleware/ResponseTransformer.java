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
import java.util.function.UnaryOperator;

import io.routekit.server.Response;

/**
 * Rewrites the response produced by the handler. Registered through {@link MiddlewareResult#transform}.
 */
@FunctionalInterface
public interface ResponseTransformer {

    CompletionStage<Response> transform(Response response) throws Exception;

    static ResponseTransformer of(final UnaryOperator<Response> transformer) {
        return response -> CompletableFuture.completedFuture(transformer.apply(response));
    }
}
