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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import io.routekit.RouteKitMessages;

/**
 * A case-insensitive, multi-valued header map that remembers the spelling a header was first added with.
 *
 * @author <a href="mailto:david.lloyd@redhat.com">David M. Lloyd</a>
 */
public final class HeaderMap implements Iterable<HeaderMap.HeaderValues> {

    private final Map<String, HeaderValues> entries = new LinkedHashMap<>();

    public HeaderMap() {
    }

    public HeaderMap(final HeaderMap other) {
        for (HeaderValues values : other) {
            addAll(values.getHeaderName(), values);
        }
    }

    private static String key(final String headerName) {
        if (headerName == null) {
            throw RouteKitMessages.MESSAGES.argumentCannotBeNull("headerName");
        }
        return headerName.toLowerCase(Locale.ENGLISH);
    }

    public HeaderValues get(final String headerName) {
        return entries.get(key(headerName));
    }

    public String getFirst(final String headerName) {
        HeaderValues values = get(headerName);
        return values == null ? null : values.getFirst();
    }

    public String getLast(final String headerName) {
        HeaderValues values = get(headerName);
        return values == null ? null : values.getLast();
    }

    public boolean contains(final String headerName) {
        return entries.containsKey(key(headerName));
    }

    public HeaderMap add(final String headerName, final String headerValue) {
        String key = key(headerName);
        HeaderValues values = entries.get(key);
        if (values == null) {
            values = new HeaderValues(headerName);
            entries.put(key, values);
        }
        values.values.add(headerValue);
        return this;
    }

    public HeaderMap addAll(final String headerName, final Collection<String> headerValues) {
        for (String value : headerValues) {
            add(headerName, value);
        }
        return this;
    }

    public HeaderMap put(final String headerName, final String headerValue) {
        HeaderValues values = new HeaderValues(headerName);
        values.values.add(headerValue);
        entries.put(key(headerName), values);
        return this;
    }

    public HeaderValues remove(final String headerName) {
        return entries.remove(key(headerName));
    }

    public int size() {
        return entries.size();
    }

    @Override
    public Iterator<HeaderValues> iterator() {
        return Collections.unmodifiableCollection(entries.values()).iterator();
    }

    @Override
    public String toString() {
        return entries.values().toString();
    }

    /**
     * The values of a single header, in the order they were added.
     */
    public static final class HeaderValues extends java.util.AbstractList<String> {

        private final String headerName;
        private final List<String> values = new ArrayList<>(1);

        HeaderValues(final String headerName) {
            this.headerName = headerName;
        }

        public String getHeaderName() {
            return headerName;
        }

        public String getFirst() {
            return values.isEmpty() ? null : values.get(0);
        }

        public String getLast() {
            return values.isEmpty() ? null : values.get(values.size() - 1);
        }

        @Override
        public String get(final int index) {
            return values.get(index);
        }

        @Override
        public int size() {
            return values.size();
        }

        @Override
        public String toString() {
            return headerName + "=" + values;
        }
    }
}
