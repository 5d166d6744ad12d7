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
 * The result of {@link Schema#parse(Object)}: a value on success, an error detail on failure.
 *
 * @param <T> the type of the parsed value
 */
public final class ParseResult<T> {

    private final boolean success;
    private final T value;
    private final Object error;

    private ParseResult(final boolean success, final T value, final Object error) {
        this.success = success;
        this.value = value;
        this.error = error;
    }

    public static <T> ParseResult<T> success(final T value) {
        return new ParseResult<>(true, value, null);
    }

    /**
     * @param error the validator specific error detail, serialized as is into the 400 response
     */
    public static <T> ParseResult<T> failure(final Object error) {
        return new ParseResult<>(false, null, error);
    }

    public boolean isSuccess() {
        return success;
    }

    public T getValue() {
        return value;
    }

    public Object getError() {
        return error;
    }

    @Override
    public String toString() {
        return success ? "ParseResult{success " + value + "}" : "ParseResult{failure " + error + "}";
    }
}
