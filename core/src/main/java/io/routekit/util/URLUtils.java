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

import java.nio.charset.StandardCharsets;

import io.routekit.RouteKitMessages;

/**
 * Utilities for dealing with URLs
 *
 * @author Stuart Douglas
 */
public class URLUtils {

    private static final char PATH_SEPARATOR = '/';
    private static final String SCHEME_SEPARATOR = "://";

    private URLUtils() {

    }

    /**
     * Decodes a single percent-encoded path segment as UTF-8. Unlike form decoding a {@code '+'} is kept as is.
     * If the decoding fails for any reason then an IllegalArgumentException will be thrown.
     *
     * @param s      The segment to decode
     * @param buffer The string builder to use as a buffer.
     * @return The decoded segment
     */
    public static String decodePathSegment(final String s, final StringBuilder buffer) {
        if (s.indexOf('%') == -1) {
            return s;
        }
        buffer.setLength(0);
        final int numChars = s.length();
        byte[] bytes = null;
        int i = 0;
        while (i < numChars) {
            char c = s.charAt(i);
            if (c != '%') {
                buffer.append(c);
                i++;
                continue;
            }
            /*
             * Starting with this instance of %, process all
             * consecutive substrings of the form %xy. Each
             * substring %xy will yield a byte, and the bytes
             * are converted to characters in one go so that
             * multi byte sequences survive.
             */
            if (bytes == null) {
                bytes = new byte[(numChars - i) / 3 + 1];
            }
            int pos = 0;
            while (i < numChars && s.charAt(i) == '%') {
                if (i + 2 >= numChars) {
                    throw RouteKitMessages.MESSAGES.failedToDecodeURL(s, StandardCharsets.UTF_8.name(), null);
                }
                int high = Character.digit(s.charAt(i + 1), 16);
                int low = Character.digit(s.charAt(i + 2), 16);
                if (high == -1 || low == -1) {
                    throw RouteKitMessages.MESSAGES.failedToDecodeURL(s, StandardCharsets.UTF_8.name(), null);
                }
                bytes[pos++] = (byte) ((high << 4) + low);
                i += 3;
            }
            buffer.append(decodeUtf8Strict(s, bytes, pos));
        }
        return buffer.toString();
    }

    private static String decodeUtf8Strict(final String original, final byte[] bytes, final int length) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .decode(java.nio.ByteBuffer.wrap(bytes, 0, length))
                    .toString();
        } catch (java.nio.charset.CharacterCodingException e) {
            throw RouteKitMessages.MESSAGES.failedToDecodeURL(original, StandardCharsets.UTF_8.name(), e);
        }
    }

    /**
     * Collapses runs of slashes into a single slash and removes a trailing slash, unless the path is the root.
     * An empty path is treated as the root.
     *
     * @param path the path to normalize
     * @return the normalized path
     */
    public static String normalizePath(final String path) {
        if (path == null || path.isEmpty()) {
            return "/";
        }
        final StringBuilder sb = new StringBuilder(path.length() + 1);
        if (path.charAt(0) != PATH_SEPARATOR) {
            sb.append(PATH_SEPARATOR);
        }
        char last = 0;
        for (int i = 0; i < path.length(); ++i) {
            char c = path.charAt(i);
            if (c == PATH_SEPARATOR && last == PATH_SEPARATOR) {
                continue;
            }
            sb.append(c);
            last = c;
        }
        if (sb.length() > 1 && sb.charAt(sb.length() - 1) == PATH_SEPARATOR) {
            sb.setLength(sb.length() - 1);
        }
        return sb.toString();
    }

    /**
     * Removes all leading and trailing slashes from a route prefix.
     *
     * @param prefix the prefix, may be null
     * @return the cleaned prefix, empty if there is none
     */
    public static String cleanPrefix(final String prefix) {
        if (prefix == null) {
            return "";
        }
        int start = 0;
        int end = prefix.length();
        while (start < end && prefix.charAt(start) == PATH_SEPARATOR) {
            start++;
        }
        while (end > start && prefix.charAt(end - 1) == PATH_SEPARATOR) {
            end--;
        }
        return prefix.substring(start, end);
    }

    /**
     * Extracts the raw (still encoded) path from a request target. The target may be an absolute URL or an
     * origin-form target such as {@code /products/42?sort=asc}.
     *
     * @param requestTarget the request target
     * @return the raw path, never empty
     */
    public static String getRawPath(final String requestTarget) {
        int start = pathStart(requestTarget);
        if (start == -1) {
            return "/";
        }
        int end = requestTarget.length();
        for (int i = start; i < end; ++i) {
            char c = requestTarget.charAt(i);
            if (c == '?' || c == '#') {
                end = i;
                break;
            }
        }
        String path = requestTarget.substring(start, end);
        return path.isEmpty() ? "/" : path;
    }

    /**
     * Extracts the raw query string from a request target.
     *
     * @param requestTarget the request target
     * @return the query string without the leading {@code ?}, empty if there is none
     */
    public static String getQueryString(final String requestTarget) {
        int question = requestTarget.indexOf('?');
        if (question == -1) {
            return "";
        }
        int fragment = requestTarget.indexOf('#', question);
        return fragment == -1 ? requestTarget.substring(question + 1) : requestTarget.substring(question + 1, fragment);
    }

    private static int pathStart(final String requestTarget) {
        int scheme = requestTarget.indexOf(SCHEME_SEPARATOR);
        int query = requestTarget.indexOf('?');
        if (scheme == -1 || (query != -1 && query < scheme)) {
            return requestTarget.isEmpty() || requestTarget.charAt(0) == '?' ? -1 : 0;
        }
        int authorityStart = scheme + SCHEME_SEPARATOR.length();
        for (int i = authorityStart; i < requestTarget.length(); ++i) {
            char c = requestTarget.charAt(i);
            if (c == PATH_SEPARATOR) {
                return i;
            }
            if (c == '?' || c == '#') {
                return -1;
            }
        }
        return -1;
    }
}
