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

import java.util.Locale;
import java.util.Objects;

/**
 * One failing slice of a request, as reported in the body of a 400 response.
 */
public final class FieldError {

    public enum Field {
        PARAMS,
        QUERY,
        BODY;

        private final String jsonName = name().toLowerCase(Locale.ENGLISH);

        public String jsonName() {
            return jsonName;
        }
    }

    private final Field field;
    private final Object error;

    public FieldError(final Field field, final Object error) {
        this.field = field;
        this.error = error;
    }

    /**
     * @return {@code params}, {@code query} or {@code body}
     */
    public String getField() {
        return field.jsonName();
    }

    public Object getError() {
        return error;
    }

    /**
     * @return a copy whose error detail is replaced by its {@link String#valueOf(Object) string form}
     */
    public FieldError describeError() {
        return new FieldError(field, String.valueOf(error));
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FieldError)) {
            return false;
        }
        FieldError that = (FieldError) o;
        return field == that.field && Objects.equals(error, that.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, error);
    }

    @Override
    public String toString() {
        return getField() + ": " + error;
    }
}
