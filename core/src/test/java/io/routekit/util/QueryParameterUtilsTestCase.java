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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Deque;
import java.util.Map;

import org.junit.Test;
import org.junit.experimental.categories.Category;

import io.routekit.testutils.category.UnitTest;

@Category(UnitTest.class)
public class QueryParameterUtilsTestCase {

    @Test
    public void testParseQueryString() {
        Map<String, Deque<String>> params = QueryParameterUtils.parseQueryString("a=1&b=hello+world&a=2&flag&c=%C3%A9&&");
        assertEquals(4, params.size());
        assertEquals("1", params.get("a").getFirst());
        assertEquals("2", params.get("a").getLast());
        assertEquals("hello world", params.get("b").getFirst());
        assertEquals("", params.get("flag").getFirst());
        assertEquals("é", params.get("c").getFirst());
    }

    @Test
    public void testEmptyQueryString() {
        assertTrue(QueryParameterUtils.parseQueryString("").isEmpty());
        assertTrue(QueryParameterUtils.parseQueryString(null).isEmpty());
    }

    @Test
    public void testMalformedValueIsKeptRaw() {
        Map<String, Deque<String>> params = QueryParameterUtils.parseQueryString("q=%zz");
        assertEquals("%zz", params.get("q").getFirst());
    }

    @Test
    public void testLastValueWins() {
        Map<String, String> flat = QueryParameterUtils.lastValues(QueryParameterUtils.parseQueryString("sort=asc&page=1&sort=desc"));
        assertEquals(2, flat.size());
        assertEquals("desc", flat.get("sort"));
        assertEquals("1", flat.get("page"));
    }
}
