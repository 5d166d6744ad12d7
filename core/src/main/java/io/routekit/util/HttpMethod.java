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

package io.routekit.util;

import java.util.Locale;

/**
 * The closed set of HTTP methods a route file can declare a handler for.
 * <p>
 * Method names outside this set are never dispatched; a request that uses one against an existing path
 * is answered as a method mismatch.
 */
public enum HttpMethod {

    GET,
    POST,
    PUT,
    DELETE,
    PATCH,
    HEAD,
    OPTIONS;

    private final String lowerCaseName = name().toLowerCase(Locale.ENGLISH);

    /**
     * @return the lower case form used as the key of schema and documentation maps
     */
    public String lowerCaseName() {
        return lowerCaseName;
    }

    /**
     * Looks up a method by name, ignoring case.
     *
     * @param method the method name, may be null
     * @return the method, or null if the name is not one of the supported methods
     */
    public static HttpMethod fromString(final String method) {
        if (method == null) {
            return null;
        }
        switch (method.toUpperCase(Locale.ENGLISH)) {
            case "GET":
                return GET;
            case "POST":
                return POST;
            case "PUT":
                return PUT;
            case "DELETE":
                return DELETE;
            case "PATCH":
                return PATCH;
            case "HEAD":
                return HEAD;
            case "OPTIONS":
                return OPTIONS;
            default:
                return null;
        }
    }
}
