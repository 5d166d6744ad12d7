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

package io.routekit.validation;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.routekit.RouteKitLogger;
import io.routekit.RouteKitMessages;
import io.routekit.middleware.Middleware;
import io.routekit.middleware.MiddlewareResult;
import io.routekit.server.ErrorResponses;
import io.routekit.server.RequestContext;
import io.routekit.util.Headers;
import io.routekit.util.Json;
import io.routekit.util.QueryParameterUtils;

/**
 * Middleware that runs the validators of a {@link RouteSchema} against a request.
 * <p>
 * Every declared slice is validated, even after an earlier one failed, so the client sees all problems at once.
 * If anything fails the request is answered with a 400 listing one {@link FieldError} per failing slice. Otherwise
 * the validators' outputs are stored on the context and the chain continues.
 * <p>
 * A context that has already been validated is passed through untouched.
 */
public final class ValidationMiddleware implements Middleware {

    private final RouteSchema schema;

    public ValidationMiddleware(final RouteSchema schema) {
        if (schema == null) {
            throw RouteKitMessages.MESSAGES.argumentCannotBeNull("schema");
        }
        this.schema = schema;
    }

    @Override
    public CompletionStage<MiddlewareResult> handle(final RequestContext context) {
        if (context.isValidated()) {
            return Middleware.proceed();
        }
        final List<FieldError> errors = new ArrayList<>(3);

        Object params = null;
        if (schema.getParams() != null) {
            params = apply(schema.getParams(), context.getParams(), FieldError.Field.PARAMS, errors);
        }
        Object query = null;
        if (schema.getQuery() != null) {
            query = apply(schema.getQuery(), QueryParameterUtils.lastValues(context.getQueryParameters()), FieldError.Field.QUERY, errors);
        }
        Object body = null;
        if (schema.getBody() != null) {
            body = validateBody(context, errors);
        }

        if (!errors.isEmpty()) {
            RouteKitLogger.VALIDATION_LOGGER.validationFailed(context.getRequest().getMethod(), context.getRequest().getRequestTarget(), errors.size());
            return CompletableFuture.completedFuture(MiddlewareResult.shortCircuit(ErrorResponses.validationFailed(errors)));
        }
        context.setValidated(new ValidatedData(params, query, body, schema.getBody() != null));
        return Middleware.proceed();
    }

    private Object validateBody(final RequestContext context, final List<FieldError> errors) {
        final String contentType = context.getHeader(Headers.CONTENT_TYPE);
        if (contentType == null || !contentType.toLowerCase(Locale.ENGLISH).contains(Headers.APPLICATION_JSON)) {
            errors.add(issue(FieldError.Field.BODY, RouteKitMessages.MESSAGES.unexpectedContentType(String.valueOf(contentType))));
            return null;
        }
        final Object raw;
        try {
            JsonNode tree = context.readJsonTree();
            if (tree.isMissingNode()) {
                errors.add(issue(FieldError.Field.BODY, RouteKitMessages.MESSAGES.invalidJsonBody("empty body")));
                return null;
            }
            raw = Json.mapper().treeToValue(tree, Object.class);
        } catch (IOException e) {
            errors.add(issue(FieldError.Field.BODY, RouteKitMessages.MESSAGES.invalidJsonBody(e instanceof JsonProcessingException ? ((JsonProcessingException) e).getOriginalMessage() : e.getMessage())));
            return null;
        }
        return apply(schema.getBody(), raw, FieldError.Field.BODY, errors);
    }

    private static Object apply(final Schema<?> validator, final Object value, final FieldError.Field field, final List<FieldError> errors) {
        final ParseResult<?> result;
        try {
            result = validator.parse(value);
        } catch (RuntimeException e) {
            //a validator that blows up is reported like any other rejection
            errors.add(issue(field, String.valueOf(e.getMessage())));
            return null;
        }
        if (result == null) {
            errors.add(issue(field, "Validator returned no result"));
            return null;
        }
        if (!result.isSuccess()) {
            errors.add(new FieldError(field, result.getError()));
            return null;
        }
        return result.getValue();
    }

    private static FieldError issue(final FieldError.Field field, final String message) {
        return new FieldError(field, Collections.singletonList(new ValidationIssue("", message)));
    }

    public RouteSchema getSchema() {
        return schema;
    }
}
