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

import java.util.Collections;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import io.routekit.util.HttpMethod;

/**
 * The classification of a request path and method against a {@link RouteTable}.
 */
public final class RouteMatch {

    public enum Outcome {
        /**
         * A route matched the path and implements the method.
         */
        MATCHED,
        /**
         * No route matched the path.
         */
        NOT_FOUND,
        /**
         * At least one route matched the path, but none of them implements the method.
         */
        METHOD_NOT_ALLOWED
    }

    private static final RouteMatch NOT_FOUND = new RouteMatch(Outcome.NOT_FOUND, null, null, Collections.emptyMap(), EnumSet.noneOf(HttpMethod.class));

    private final Outcome outcome;
    private final RouteDescriptor route;
    private final HttpMethod method;
    private final Map<String, String> parameters;
    private final Set<HttpMethod> allowedMethods;

    private RouteMatch(final Outcome outcome, final RouteDescriptor route, final HttpMethod method, final Map<String, String> parameters, final Set<HttpMethod> allowedMethods) {
        this.outcome = outcome;
        this.route = route;
        this.method = method;
        this.parameters = parameters;
        this.allowedMethods = allowedMethods;
    }

    static RouteMatch matched(final RouteDescriptor route, final HttpMethod method, final Map<String, String> parameters) {
        return new RouteMatch(Outcome.MATCHED, route, method, Collections.unmodifiableMap(parameters), route.getAllowedMethods());
    }

    static RouteMatch methodNotAllowed(final RouteDescriptor route, final Set<HttpMethod> allowedMethods) {
        return new RouteMatch(Outcome.METHOD_NOT_ALLOWED, route, null, Collections.emptyMap(), Collections.unmodifiableSet(allowedMethods));
    }

    static RouteMatch notFound() {
        return NOT_FOUND;
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public boolean isMatched() {
        return outcome == Outcome.MATCHED;
    }

    /**
     * @return the matched route, the first route whose path matched on a method mismatch, or null when not found
     */
    public RouteDescriptor getRoute() {
        return route;
    }

    /**
     * @return the matched method, null unless the outcome is {@link Outcome#MATCHED}
     */
    public HttpMethod getMethod() {
        return method;
    }

    /**
     * @return the decoded path parameters, in pattern order
     */
    public Map<String, String> getParameters() {
        return parameters;
    }

    /**
     * @return the union of methods implemented by every route that matched the path
     */
    public Set<HttpMethod> getAllowedMethods() {
        return allowedMethods;
    }

    @Override
    public String toString() {
        return "RouteMatch{" + outcome + (route == null ? "" : " " + route.getPattern()) + " " + parameters + "}";
    }
}
