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

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicBoolean;

import io.routekit.RouteKitMessages;
import io.routekit.util.HeaderMap;
import io.routekit.util.Headers;
import io.routekit.util.URLUtils;

/**
 * An inbound request as handed over by the transport. The body stream can be obtained exactly once.
 */
public final class Request {

    private final String method;
    private final String requestTarget;
    private final String rawPath;
    private final String queryString;
    private final HeaderMap headers;
    private final InputStream body;
    private final AtomicBoolean bodyTaken = new AtomicBoolean();

    private Request(final Builder builder) {
        this.method = builder.method;
        this.requestTarget = builder.requestTarget;
        this.rawPath = URLUtils.getRawPath(builder.requestTarget);
        this.queryString = URLUtils.getQueryString(builder.requestTarget);
        this.headers = new HeaderMap(builder.headers);
        this.body = builder.body;
    }

    public static Builder builder(final String method, final String requestTarget) {
        return new Builder(method, requestTarget);
    }

    public String getMethod() {
        return method;
    }

    /**
     * @return the request target exactly as received, either an absolute URL or a path with optional query
     */
    public String getRequestTarget() {
        return requestTarget;
    }

    /**
     * @return the path component, not decoded and not normalized
     */
    public String getRawPath() {
        return rawPath;
    }

    /**
     * @return the query string without the {@code ?}, empty if there is none
     */
    public String getQueryString() {
        return queryString;
    }

    public HeaderMap getHeaders() {
        return headers;
    }

    public String getHeader(final String name) {
        return headers.getFirst(name);
    }

    public String getContentType() {
        return headers.getFirst(Headers.CONTENT_TYPE);
    }

    /**
     * Returns the body stream. Transports provide the body as a stream that cannot be rewound, so this may only be
     * called once.
     *
     * @return the body stream
     * @throws IllegalStateException if the body has already been taken
     */
    public InputStream getInputStream() {
        if (!bodyTaken.compareAndSet(false, true)) {
            throw RouteKitMessages.MESSAGES.requestBodyAlreadyConsumed();
        }
        return body;
    }

    public boolean isBodyConsumed() {
        return bodyTaken.get();
    }

    @Override
    public String toString() {
        return method + " " + requestTarget;
    }

    public static final class Builder {

        private final String method;
        private final String requestTarget;
        private final HeaderMap headers = new HeaderMap();
        private InputStream body = new ByteArrayInputStream(new byte[0]);

        private Builder(final String method, final String requestTarget) {
            if (method == null) {
                throw RouteKitMessages.MESSAGES.argumentCannotBeNull("method");
            }
            if (requestTarget == null) {
                throw RouteKitMessages.MESSAGES.argumentCannotBeNull("requestTarget");
            }
            this.method = method;
            this.requestTarget = requestTarget;
        }

        public Builder header(final String name, final String value) {
            headers.add(name, value);
            return this;
        }

        public Builder body(final InputStream body) {
            if (body == null) {
                throw RouteKitMessages.MESSAGES.argumentCannotBeNull("body");
            }
            this.body = body;
            return this;
        }

        public Builder body(final byte[] body) {
            return body(new ByteArrayInputStream(body));
        }

        public Builder body(final String body) {
            return body(body.getBytes(StandardCharsets.UTF_8));
        }

        /**
         * Sets a JSON body together with the matching content type.
         */
        public Builder jsonBody(final String json) {
            headers.put(Headers.CONTENT_TYPE, Headers.APPLICATION_JSON);
            return body(json);
        }

        public Request build() {
            return new Request(this);
        }
    }
}
