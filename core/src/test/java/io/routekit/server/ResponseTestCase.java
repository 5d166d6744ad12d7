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

package io.routekit.server;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import java.util.Map;

import org.junit.Test;
import org.junit.experimental.categories.Category;

import io.routekit.testutils.category.UnitTest;
import io.routekit.util.Headers;

@Category(UnitTest.class)
public class ResponseTestCase {

    @Test
    public void testFactories() throws Exception {
        Response json = Response.json(201, Map.of("id", 7));
        assertEquals(201, json.getStatus());
        assertEquals(Headers.APPLICATION_JSON, json.getHeader(Headers.CONTENT_TYPE));
        assertEquals(7, json.readJson().get("id").asInt());

        Response text = Response.text("hi");
        assertEquals(200, text.getStatus());
        assertEquals(Headers.TEXT_PLAIN, text.getHeader(Headers.CONTENT_TYPE));
        assertEquals("hi", text.getBodyAsString());

        Response redirect = Response.redirect("/login");
        assertEquals(302, redirect.getStatus());
        assertEquals("/login", redirect.getHeader(Headers.LOCATION));
        assertEquals(0, redirect.getBody().length);
    }

    @Test
    public void testToBuilderLeavesOriginalUntouched() {
        Response original = Response.text("hi");
        Response changed = original.toBuilder().status(202).header("X-Extra", "1").removeHeader(Headers.CONTENT_TYPE).build();
        assertEquals(200, original.getStatus());
        assertNull(original.getHeader("X-Extra"));
        assertEquals(Headers.TEXT_PLAIN, original.getHeader(Headers.CONTENT_TYPE));
        assertEquals(202, changed.getStatus());
        assertEquals("1", changed.getHeader("X-Extra"));
        assertNull(changed.getHeader(Headers.CONTENT_TYPE));
        assertEquals("hi", changed.getBodyAsString());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidStatus() {
        Response.status(42);
    }
}
