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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.InputStream;
import java.util.Map;

import org.junit.Test;
import org.junit.experimental.categories.Category;

import com.fasterxml.jackson.databind.JsonNode;
import io.routekit.testutils.TestUtils;
import io.routekit.testutils.category.UnitTest;
import io.routekit.util.AttachmentKey;
import io.routekit.validation.ValidatedData;

@Category(UnitTest.class)
public class RequestContextTestCase {

    private static final AttachmentKey<String> USER = AttachmentKey.create(String.class);

    @Test
    public void testBodyCanBeReadRepeatedly() throws Exception {
        Request request = Request.builder("POST", "/products").jsonBody("{\"name\":\"Laptop\"}").build();
        RequestContext context = TestUtils.context(request, null);
        assertEquals("{\"name\":\"Laptop\"}", context.readBodyAsString());
        JsonNode tree = context.readJsonTree();
        assertEquals("Laptop", tree.get("name").asText());
        assertSame(tree, context.readJson());
        assertTrue(request.isBodyConsumed());
    }

    @Test
    public void testRequestStreamCanOnlyBeTakenOnce() throws Exception {
        Request request = Request.builder("POST", "/products").body("abc").build();
        try (InputStream in = request.getInputStream()) {
            assertEquals('a', in.read());
        }
        try {
            request.getInputStream();
            fail();
        } catch (IllegalStateException expected) {
        }
        try {
            TestUtils.context(request, null).readBody();
            fail();
        } catch (IllegalStateException expected) {
        }
    }

    @Test
    public void testValidatedNamespaceIsWrittenOnce() {
        RequestContext context = TestUtils.context(Request.builder("GET", "/").build(), null);
        assertFalse(context.isValidated());
        assertNull(context.getValidated());
        context.setValidated(new ValidatedData(null, null, null, false));
        assertTrue(context.isValidated());
        try {
            context.setValidated(new ValidatedData(null, null, null, false));
            fail();
        } catch (IllegalStateException expected) {
        }
    }

    @Test
    public void testQueryParametersAndHeaders() {
        Request request = Request.builder("GET", "/search?q=java&tag=a&tag=b")
                .header("X-Request-Id", "abc")
                .build();
        RequestContext context = TestUtils.context(request, null, Map.of("id", "1"));
        assertEquals("java", context.getQueryParameter("q"));
        assertEquals(2, context.getQueryParameters().get("tag").size());
        assertNull(context.getQueryParameter("missing"));
        assertEquals("abc", context.getHeader("x-request-id"));
        assertEquals("1", context.getParam("id"));
    }

    @Test
    public void testAttachments() {
        RequestContext context = TestUtils.context(Request.builder("GET", "/").build(), null);
        assertNull(context.getAttachment(USER));
        context.putAttachment(USER, "alice");
        assertEquals("alice", context.getAttachment(USER));
        assertEquals("alice", context.removeAttachment(USER));
        assertNull(context.getAttachment(USER));
    }
}
