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
 * The validated namespace of a request: the output of each validator that ran, by slice.
 */
public final class ValidatedData {

    private final Object params;
    private final Object query;
    private final Object body;
    private final boolean hasBody;

    public ValidatedData(final Object params, final Object query, final Object body, final boolean hasBody) {
        this.params = params;
        this.query = query;
        this.body = body;
        this.hasBody = hasBody;
    }

    public Object getParams() {
        return params;
    }

    public Object getQuery() {
        return query;
    }

    public Object getBody() {
        return body;
    }

    /**
     * @return true if a body validator ran, even if its output is null
     */
    public boolean hasBody() {
        return hasBody;
    }

    public <T> T getParams(final Class<T> type) {
        return type.cast(params);
    }

    public <T> T getQuery(final Class<T> type) {
        return type.cast(query);
    }

    public <T> T getBody(final Class<T> type) {
        return type.cast(body);
    }

    @Override
    public String toString() {
        return "ValidatedData{params=" + params + ", query=" + query + ", body=" + body + "}";
    }
}
