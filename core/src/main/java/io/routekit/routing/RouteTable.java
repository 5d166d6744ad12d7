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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import io.routekit.util.HttpMethod;

/**
 * The ordered, immutable set of compiled routes.
 * <p>
 * Routes are sorted once, by specificity (the number of literal segments) descending and then by the rendered pattern
 * ascending, so that a linear "first match wins" scan always prefers {@code /product/featured} over
 * {@code /product/:id}. Instances are never mutated after construction and can be read from any number of threads
 * without synchronization.
 */
public final class RouteTable {

    /**
     * The precedence order of the table.
     */
    public static final Comparator<RouteDescriptor> PRECEDENCE = Comparator.comparing(RouteDescriptor::getPattern);

    private static final RouteTable EMPTY = new RouteTable(Collections.emptyList());

    private final List<RouteDescriptor> routes;

    private RouteTable(final List<RouteDescriptor> routes) {
        this.routes = routes;
    }

    public static RouteTable of(final Collection<RouteDescriptor> routes) {
        if (routes.isEmpty()) {
            return EMPTY;
        }
        final List<RouteDescriptor> sorted = new ArrayList<>(routes);
        sorted.sort(PRECEDENCE);
        return new RouteTable(Collections.unmodifiableList(sorted));
    }

    public static RouteTable empty() {
        return EMPTY;
    }

    /**
     * Classifies a request.
     * <p>
     * The first route, in table order, whose pattern matches the path and that implements the method wins. If some
     * routes match the path but none implements the method the result is a method mismatch; the first of those routes
     * is reported, together with the union of their methods.
     *
     * @param normalizedPath the request path, already normalized and still percent-encoded
     * @param method         the request method name
     * @return the classification, never null
     */
    public RouteMatch match(final String normalizedPath, final String method) {
        return match(normalizedPath, HttpMethod.fromString(method));
    }

    /**
     * @param normalizedPath the request path, already normalized and still percent-encoded
     * @param method         the request method, null for a method outside the supported set
     * @return the classification, never null
     * @see #match(String, String)
     */
    public RouteMatch match(final String normalizedPath, final HttpMethod method) {
        final String[] segments = RoutePattern.splitPath(normalizedPath);
        final StringBuilder buffer = new StringBuilder();
        RouteDescriptor firstPathMatch = null;
        Set<HttpMethod> allowed = null;
        for (RouteDescriptor route : routes) {
            final Map<String, String> params = route.getPattern().match(segments, buffer);
            if (params == null) {
                continue;
            }
            if (route.hasHandler(method)) {
                return RouteMatch.matched(route, method, params);
            }
            if (firstPathMatch == null) {
                firstPathMatch = route;
                allowed = EnumSet.noneOf(HttpMethod.class);
            }
            allowed.addAll(route.getHandlers().keySet());
        }
        if (firstPathMatch != null) {
            return RouteMatch.methodNotAllowed(firstPathMatch, allowed);
        }
        return RouteMatch.notFound();
    }

    /**
     * @return the routes in precedence order, for documentation generators and diagnostics
     */
    public List<RouteDescriptor> getRoutes() {
        return routes;
    }

    public int size() {
        return routes.size();
    }

    public boolean isEmpty() {
        return routes.isEmpty();
    }

    @Override
    public String toString() {
        return "RouteTable" + routes;
    }
}
