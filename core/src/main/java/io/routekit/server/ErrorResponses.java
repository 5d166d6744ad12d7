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

import java.io.PrintWriter;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;

import io.routekit.util.Headers;
import io.routekit.util.HttpMethod;
import io.routekit.util.StatusCodes;
import io.routekit.validation.FieldError;

/**
 * The responses the dispatcher produces on its own: unmatched routes, unsupported methods, rejected input and
 * handler failures.
 */
public final class ErrorResponses {

    public static final String ROUTE_NOT_FOUND = "Route not found";
    public static final String GENERIC_ERROR_MESSAGE = "An unexpected error occurred";

    private ErrorResponses() {
    }

    public static Response notFound() {
        return Response.json(StatusCodes.NOT_FOUND, error(ROUTE_NOT_FOUND));
    }

    /**
     * @param allowed the methods the matched path does support, listed in the {@code Allow} header
     */
    public static Response methodNotAllowed(final Set<HttpMethod> allowed) {
        final StringJoiner allow = new StringJoiner(", ");
        for (HttpMethod method : allowed) {
            allow.add(method.name());
        }
        return Response.builder()
                .status(StatusCodes.METHOD_NOT_ALLOWED)
                .header(Headers.ALLOW, allow.toString())
                .json(error(StatusCodes.METHOD_NOT_ALLOWED_STRING))
                .build();
    }

    public static Response validationFailed(final List<FieldError> errors) {
        try {
            return Response.json(StatusCodes.BAD_REQUEST, errorList(errors));
        } catch (UncheckedIOException e) {
            // a validator's error detail Jackson cannot write is reported by its string form
            final List<FieldError> described = new ArrayList<>(errors.size());
            for (FieldError error : errors) {
                described.add(error.describeError());
            }
            return Response.json(StatusCodes.BAD_REQUEST, errorList(described));
        }
    }

    private static Map<String, Object> errorList(final List<FieldError> errors) {
        final Map<String, Object> body = new LinkedHashMap<>();
        body.put("errors", errors);
        return body;
    }

    /**
     * @param request the failed request, only echoed back in debug mode
     * @param cause   the failure, only described in debug mode
     * @param debug   whether to expose the failure details to the client
     */
    public static Response internalError(final Request request, final Throwable cause, final boolean debug) {
        final Map<String, Object> body = error(StatusCodes.INTERNAL_SERVER_ERROR_STRING);
        body.put("message", GENERIC_ERROR_MESSAGE);
        if (debug && cause != null) {
            if (cause.getMessage() != null) {
                body.put("message", cause.getMessage());
            }
            body.put("exception", cause.getClass().getName());
            body.put("stack", stackTrace(cause));
            final Map<String, Object> req = new LinkedHashMap<>();
            req.put("method", request.getMethod());
            req.put("url", request.getRequestTarget());
            body.put("request", req);
        }
        return Response.json(StatusCodes.INTERNAL_SERVER_ERROR, body);
    }

    private static Map<String, Object> error(final String error) {
        final Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        return body;
    }

    private static String stackTrace(final Throwable cause) {
        final StringWriter out = new StringWriter();
        try (PrintWriter writer = new PrintWriter(out)) {
            cause.printStackTrace(writer);
        }
        return out.toString();
    }
}
