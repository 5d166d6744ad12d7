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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.routekit.RouteKitMessages;
import io.routekit.util.URLUtils;

/**
 * An immutable route pattern such as {@code /api/product/:id}.
 * <p>
 * A pattern matches a request path when both have the same number of segments, every literal segment is equal to the
 * corresponding request segment and every parameter segment binds the percent-decoded request segment.
 */
public final class RoutePattern implements Comparable<RoutePattern> {

    private static final RoutePattern ROOT = new RoutePattern(Collections.emptyList());

    private final List<PathSegment> segments;
    private final int specificity;
    private final String rendered;
    private final String shape;

    private RoutePattern(final List<PathSegment> segments) {
        this.segments = segments;
        int literals = 0;
        final StringBuilder text = new StringBuilder();
        final StringBuilder shape = new StringBuilder();
        for (PathSegment segment : segments) {
            text.append('/').append(segment);
            if (segment.isParam()) {
                shape.append('/').append(PathSegment.PARAM_PREFIX);
            } else {
                literals++;
                shape.append('/').append(segment.getValue());
            }
        }
        this.specificity = literals;
        this.rendered = segments.isEmpty() ? "/" : text.toString();
        this.shape = segments.isEmpty() ? "/" : shape.toString();
    }

    public static RoutePattern of(final List<PathSegment> segments) {
        if (segments.isEmpty()) {
            return ROOT;
        }
        return new RoutePattern(Collections.unmodifiableList(new ArrayList<>(segments)));
    }

    /**
     * Parses the textual form of a pattern, where segments starting with {@code ':'} are parameters.
     *
     * @param pattern the pattern, for example {@code /api/product/:id}
     * @return the parsed pattern
     */
    public static RoutePattern parse(final String pattern) {
        if (pattern == null) {
            throw RouteKitMessages.MESSAGES.argumentCannotBeNull("pattern");
        }
        if (pattern.isEmpty() || pattern.charAt(0) != '/') {
            throw RouteKitMessages.MESSAGES.patternMustStartWithSlash(pattern);
        }
        final List<PathSegment> segments = new ArrayList<>();
        for (String part : splitPath(pattern)) {
            if (part.length() > 1 && part.charAt(0) == PathSegment.PARAM_PREFIX) {
                segments.add(PathSegment.param(part.substring(1)));
            } else {
                segments.add(PathSegment.literal(part));
            }
        }
        return of(segments);
    }

    /**
     * Splits a path into its non-empty segments.
     *
     * @param path the path
     * @return the segments, empty for the root path
     */
    public static String[] splitPath(final String path) {
        final List<String> parts = new ArrayList<>();
        int start = 0;
        for (int i = 0; i <= path.length(); ++i) {
            if (i == path.length() || path.charAt(i) == '/') {
                if (i > start) {
                    parts.add(path.substring(start, i));
                }
                start = i + 1;
            }
        }
        return parts.toArray(new String[0]);
    }

    /**
     * Matches already split request segments against this pattern.
     *
     * @param requestSegments the request path segments
     * @param buffer          scratch buffer for percent-decoding
     * @return the bound parameters in pattern order, or null if the pattern does not match
     */
    Map<String, String> match(final String[] requestSegments, final StringBuilder buffer) {
        if (requestSegments.length != segments.size()) {
            return null;
        }
        Map<String, String> params = null;
        for (int i = 0; i < requestSegments.length; ++i) {
            final PathSegment segment = segments.get(i);
            if (segment.isParam()) {
                if (params == null) {
                    params = new LinkedHashMap<>();
                }
                try {
                    params.put(segment.getValue(), URLUtils.decodePathSegment(requestSegments[i], buffer));
                } catch (IllegalArgumentException e) {
                    return null;
                }
            } else if (!segment.getValue().equals(requestSegments[i])) {
                return null;
            }
        }
        return params == null ? Collections.emptyMap() : params;
    }

    public List<PathSegment> getSegments() {
        return segments;
    }

    /**
     * @return the number of literal segments, parameters contribute nothing
     */
    public int getSpecificity() {
        return specificity;
    }

    public List<String> getParameterNames() {
        final List<String> names = new ArrayList<>();
        for (PathSegment segment : segments) {
            if (segment.isParam()) {
                names.add(segment.getValue());
            }
        }
        return names;
    }

    /**
     * Two patterns with the same shape match exactly the same request paths. The shape is the rendered pattern
     * with every parameter name erased.
     *
     * @return the shape of this pattern
     */
    public String getShape() {
        return shape;
    }

    /**
     * Orders by specificity, highest first, then by the rendered pattern.
     */
    @Override
    public int compareTo(final RoutePattern other) {
        int result = Integer.compare(other.specificity, specificity);
        if (result != 0) {
            return result;
        }
        return rendered.compareTo(other.rendered);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RoutePattern)) {
            return false;
        }
        return segments.equals(((RoutePattern) o).segments);
    }

    @Override
    public int hashCode() {
        return segments.hashCode();
    }

    @Override
    public String toString() {
        return rendered;
    }
}
