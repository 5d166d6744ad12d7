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
import java.nio.charset.StandardCharsets;

import com.fasterxml.jackson.databind.JsonNode;
import io.routekit.RouteKitMessages;
import io.routekit.util.HeaderMap;
import io.routekit.util.Headers;
import io.routekit.util.Json;
import io.routekit.util.StatusCodes;

/**
 * An immutable response. Transforms produce a modified copy through {@link #toBuilder()}.
 */
public final class Response {

    private static final byte[] NO_BODY = new byte[0];

    private final int status;
    private final HeaderMap headers;
    private final byte[] body;

    private Response(final int status, final HeaderMap headers, final byte[] body) {
        this.status = status;
        this.headers = headers;
        this.body = body;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Response status(final int status) {
        return builder().status(status).build();
    }

    public static Response json(final Object data) {
        return json(StatusCodes.OK, data);
    }

    public static Response json(final int status, final Object data) {
        return builder().status(status).json(data).build();
    }

    public static Response text(final String text) {
        return text(StatusCodes.OK, text);
    }

    public static Response text(final int status, final String text) {
        return builder().status(status).header(Headers.CONTENT_TYPE, Headers.TEXT_PLAIN).body(text).build();
    }

    public static Response html(final String html) {
        return builder().header(Headers.CONTENT_TYPE, Headers.TEXT_HTML).body(html).build();
    }

    public static Response redirect(final String location) {
        return redirect(location, StatusCodes.FOUND);
    }

    public static Response redirect(final String location, final int status) {
        return builder().status(status).header(Headers.LOCATION, location).build();
    }

    public int getStatus() {
        return status;
    }

    /**
     * @return a copy of the response headers
     */
    public HeaderMap getHeaders() {
        return new HeaderMap(headers);
    }

    public String getHeader(final String name) {
        return headers.getFirst(name);
    }

    public byte[] getBody() {
        return body.clone();
    }

    public String getBodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    /**
     * Parses the body as JSON.
     *
     * @throws IOException if the body is not valid JSON
     */
    public JsonNode readJson() throws IOException {
        return Json.readTree(body);
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.status = status;
        builder.headers = new HeaderMap(headers);
        builder.body = body;
        return builder;
    }

    @Override
    public String toString() {
        return "Response{" + status + " " + headers + " " + body.length + " bytes}";
    }

    public static final class Builder {

        private int status = StatusCodes.OK;
        private HeaderMap headers = new HeaderMap();
        private byte[] body = NO_BODY;

        private Builder() {
        }

        public Builder status(final int status) {
            if (status < 100 || status > 999) {
                throw RouteKitMessages.MESSAGES.invalidStatusCode(status);
            }
            this.status = status;
            return this;
        }

        /**
         * Sets a header, replacing any existing values.
         */
        public Builder header(final String name, final String value) {
            headers.put(name, value);
            return this;
        }

        public Builder addHeader(final String name, final String value) {
            headers.add(name, value);
            return this;
        }

        public Builder removeHeader(final String name) {
            headers.remove(name);
            return this;
        }

        public Builder body(final byte[] body) {
            this.body = body == null ? NO_BODY : body.clone();
            return this;
        }

        public Builder body(final String body) {
            this.body = body == null ? NO_BODY : body.getBytes(StandardCharsets.UTF_8);
            return this;
        }

        /**
         * Serializes the value with Jackson and sets the JSON content type, unless one is already present.
         */
        public Builder json(final Object data) {
            this.body = Json.toBytes(data);
            if (!headers.contains(Headers.CONTENT_TYPE)) {
                headers.put(Headers.CONTENT_TYPE, Headers.APPLICATION_JSON);
            }
            return this;
        }

        public Response build() {
            return new Response(status, new HeaderMap(headers), body);
        }
    }
}
