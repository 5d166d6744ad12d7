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

import io.routekit.RouteKitMessages;
import io.routekit.server.Response;

/**
 * The outcome of one middleware invocation.
 */
public final class MiddlewareResult {

    public enum Kind {
        /**
         * Stop here and send {@link #getResponse()}. Nothing downstream runs and no transform is applied.
         */
        SHORT_CIRCUIT,
        /**
         * Continue with the next middleware.
         */
        PROCEED,
        /**
         * Continue, and hand the eventual response to {@link #getTransformer()}.
         */
        TRANSFORM
    }

    private static final MiddlewareResult PROCEED = new MiddlewareResult(Kind.PROCEED, null, null);

    private final Kind kind;
    private final Response response;
    private final ResponseTransformer transformer;

    private MiddlewareResult(final Kind kind, final Response response, final ResponseTransformer transformer) {
        this.kind = kind;
        this.response = response;
        this.transformer = transformer;
    }

    public static MiddlewareResult shortCircuit(final Response response) {
        if (response == null) {
            throw RouteKitMessages.MESSAGES.argumentCannotBeNull("response");
        }
        return new MiddlewareResult(Kind.SHORT_CIRCUIT, response, null);
    }

    public static MiddlewareResult proceed() {
        return PROCEED;
    }

    public static MiddlewareResult transform(final ResponseTransformer transformer) {
        if (transformer == null) {
            throw RouteKitMessages.MESSAGES.argumentCannotBeNull("transformer");
        }
        return new MiddlewareResult(Kind.TRANSFORM, null, transformer);
    }

    public Kind getKind() {
        return kind;
    }

    public Response getResponse() {
        return response;
    }

    public ResponseTransformer getTransformer() {
        return transformer;
    }

    @Override
    public String toString() {
        return "MiddlewareResult{" + kind + "}";
    }
}
