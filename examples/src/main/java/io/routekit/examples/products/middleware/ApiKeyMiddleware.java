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

import java.util.Map;

import io.routekit.middleware.Middleware;
import io.routekit.middleware.MiddlewareResult;
import io.routekit.server.Response;
import io.routekit.util.AttachmentKey;
import io.routekit.util.StatusCodes;

/**
 * Route middleware that only lets requests carrying the expected API key through. The key is attached to the
 * context for the handler.
 */
public final class ApiKeyMiddleware {

    public static final String API_KEY_HEADER = "X-Api-Key";
    public static final String DEFAULT_KEY = "secret-key";

    public static final AttachmentKey<String> API_KEY = AttachmentKey.create(String.class);

    private ApiKeyMiddleware() {
    }

    public static Middleware require(final String expectedKey) {
        return Middleware.of(context -> {
            String key = context.getHeader(API_KEY_HEADER);
            if (!expectedKey.equals(key)) {
                return MiddlewareResult.shortCircuit(Response.json(StatusCodes.UNAUTHORIZED, Map.of("error", StatusCodes.UNAUTHORIZED_STRING)));
            }
            context.putAttachment(API_KEY, key);
            return MiddlewareResult.proceed();
        });
    }
}
