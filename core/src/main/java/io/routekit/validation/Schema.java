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
 * An opaque validator. Implementations check a raw value and return either the parsed (possibly coerced) value or a
 * structured description of what is wrong with it.
 *
 * @param <T> the type of the parsed value
 */
@FunctionalInterface
public interface Schema<T> {

    /**
     * @param value the raw value: a map of strings for params and query, the parsed JSON (maps, lists, strings,
     *              numbers, booleans, null) for a body
     * @return the result, never null
     */
    ParseResult<T> parse(Object value);
}
