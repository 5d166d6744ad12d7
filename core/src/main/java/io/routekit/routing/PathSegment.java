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

package io.routekit.routing;

import java.util.Objects;

import io.routekit.RouteKitMessages;

/**
 * A single segment of a route pattern, either literal text or a named parameter.
 */
public final class PathSegment {

    public enum Type {
        LITERAL,
        PARAM
    }

    static final char PARAM_PREFIX = ':';

    private final Type type;
    private final String value;

    private PathSegment(final Type type, final String value) {
        if (value == null) {
            throw RouteKitMessages.MESSAGES.argumentCannotBeNull("value");
        }
        this.type = type;
        this.value = value;
    }

    public static PathSegment literal(final String text) {
        return new PathSegment(Type.LITERAL, text);
    }

    public static PathSegment param(final String name) {
        return new PathSegment(Type.PARAM, name);
    }

    public Type getType() {
        return type;
    }

    public boolean isParam() {
        return type == Type.PARAM;
    }

    /**
     * @return the literal text, or the parameter name for a parameter segment
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PathSegment)) {
            return false;
        }
        PathSegment that = (PathSegment) o;
        return type == that.type && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value);
    }

    @Override
    public String toString() {
        return type == Type.PARAM ? PARAM_PREFIX + value : value;
    }
}
