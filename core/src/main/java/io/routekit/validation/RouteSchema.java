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

/**
 * The validators declared for one HTTP method of a route. Any of them may be absent.
 */
public final class RouteSchema {

    private final Schema<?> params;
    private final Schema<?> query;
    private final Schema<?> body;

    private RouteSchema(final Builder builder) {
        this.params = builder.params;
        this.query = builder.query;
        this.body = builder.body;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static RouteSchema params(final Schema<?> params) {
        return builder().params(params).build();
    }

    public static RouteSchema query(final Schema<?> query) {
        return builder().query(query).build();
    }

    public static RouteSchema body(final Schema<?> body) {
        return builder().body(body).build();
    }

    public Schema<?> getParams() {
        return params;
    }

    public Schema<?> getQuery() {
        return query;
    }

    public Schema<?> getBody() {
        return body;
    }

    public boolean isEmpty() {
        return params == null && query == null && body == null;
    }

    public static final class Builder {

        private Schema<?> params;
        private Schema<?> query;
        private Schema<?> body;

        private Builder() {
        }

        public Builder params(final Schema<?> params) {
            this.params = params;
            return this;
        }

        public Builder query(final Schema<?> query) {
            this.query = query;
            return this;
        }

        public Builder body(final Schema<?> body) {
            this.body = body;
            return this;
        }

        public RouteSchema build() {
            return new RouteSchema(this);
        }
    }
}
