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

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Deque;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import io.routekit.RouteKitMessages;
import io.routekit.routing.RouteDescriptor;
import io.routekit.routing.RouteMatch;
import io.routekit.util.AbstractAttachable;
import io.routekit.util.HttpMethod;
import io.routekit.util.Json;
import io.routekit.util.QueryParameterUtils;
import io.routekit.validation.ValidatedData;

/**
 * The state of one matched request as it travels through the middleware pipeline to its handler.
 * <p>
 * A context belongs to exactly one request and is never shared, so none of its state is synchronized.
 * Middleware can pass data downstream through typed attachments.
 */
public final class RequestContext extends AbstractAttachable {

    private final Request request;
    private final RouteDescriptor route;
    private final HttpMethod method;
    private final Map<String, String> params;

    private Map<String, Deque<String>> queryParameters;
    private ValidatedData validated;
    private byte[] body;
    private JsonNode jsonBody;

    public RequestContext(final Request request, final RouteMatch match) {
        this(request, match.getRoute(), match.getMethod(), match.getParameters());
    }

    public RequestContext(final Request request, final RouteDescriptor route, final HttpMethod method, final Map<String, String> params) {
        if (request == null) {
            throw RouteKitMessages.MESSAGES.argumentCannotBeNull("request");
        }
        this.request = request;
        this.route = route;
        this.method = method;
        this.params = params == null ? Collections.emptyMap() : params;
    }

    public Request getRequest() {
        return request;
    }

    public RouteDescriptor getRoute() {
        return route;
    }

    public HttpMethod getMethod() {
        return method;
    }

    /**
     * @return the decoded path parameters
     */
    public Map<String, String> getParams() {
        return params;
    }

    public String getParam(final String name) {
        return params.get(name);
    }

    /**
     * @return the parsed query string, parsed on first access
     */
    public Map<String, Deque<String>> getQueryParameters() {
        if (queryParameters == null) {
            queryParameters = Collections.unmodifiableMap(QueryParameterUtils.parseQueryString(request.getQueryString()));
        }
        return queryParameters;
    }

    /**
     * @return the first value of the query parameter, or null if it is absent
     */
    public String getQueryParameter(final String name) {
        Deque<String> values = getQueryParameters().get(name);
        return values == null ? null : values.peekFirst();
    }

    public String getHeader(final String name) {
        return request.getHeader(name);
    }

    public boolean isValidated() {
        return validated != null;
    }

    /**
     * @return the validated namespace, or null if the request has not been validated
     */
    public ValidatedData getValidated() {
        return validated;
    }

    /**
     * Populates the validated namespace. It can be populated only once per request.
     *
     * @throws IllegalStateException if the namespace is already populated
     */
    public void setValidated(final ValidatedData validated) {
        if (validated == null) {
            throw RouteKitMessages.MESSAGES.argumentCannotBeNull("validated");
        }
        if (this.validated != null) {
            throw new IllegalStateException("Request " + request + " has already been validated");
        }
        this.validated = validated;
    }

    /**
     * Reads the whole request body. The underlying stream is read once and the bytes are kept, so this can be called
     * any number of times.
     */
    public byte[] readBody() throws IOException {
        if (body == null) {
            try (InputStream in = request.getInputStream()) {
                body = in.readAllBytes();
            }
        }
        return body;
    }

    public String readBodyAsString() throws IOException {
        return new String(readBody(), StandardCharsets.UTF_8);
    }

    /**
     * Parses the body as a JSON tree, once.
     *
     * @return the tree, a {@code MissingNode} for an empty body
     * @throws IOException if the body is not valid JSON
     */
    public JsonNode readJsonTree() throws IOException {
        if (jsonBody == null) {
            JsonNode tree = Json.readTree(readBody());
            jsonBody = tree == null ? MissingNode.getInstance() : tree;
        }
        return jsonBody;
    }

    /**
     * Returns the JSON body. If a body schema validated the request, the validator's output is returned and the
     * request stream is not touched again.
     */
    public Object readJson() throws IOException {
        if (validated != null && validated.hasBody()) {
            return validated.getBody();
        }
        return readJsonTree();
    }

    /**
     * Returns the JSON body as the given type, reusing the validated body when it already has that type.
     */
    public <T> T readJson(final Class<T> type) throws IOException {
        if (validated != null && type.isInstance(validated.getBody())) {
            return type.cast(validated.getBody());
        }
        return Json.mapper().treeToValue(readJsonTree(), type);
    }

    @Override
    public String toString() {
        return "RequestContext{" + request + (route == null ? "" : " -> " + route.getPattern()) + "}";
    }
}
