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
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Test;
import org.junit.experimental.categories.Category;

import com.fasterxml.jackson.databind.JsonNode;
import io.routekit.middleware.Middleware;
import io.routekit.routing.RouteDescriptor;
import io.routekit.routing.RouteTable;
import io.routekit.testutils.TestUtils;
import io.routekit.testutils.category.UnitTest;
import io.routekit.util.Headers;
import io.routekit.util.HttpMethod;
import io.routekit.validation.ParseResult;
import io.routekit.validation.RouteSchema;

@Category(UnitTest.class)
public class RouteDispatcherTestCase {

    private static RouteDispatcher dispatcher(final boolean debug, final RouteDescriptor... routes) {
        return new RouteDispatcher(RouteTable.of(Arrays.asList(routes)), DispatcherConfig.builder().setDebug(debug).build());
    }

    private static Response dispatch(final RouteDispatcher dispatcher, final String method, final String target) throws Exception {
        return TestUtils.await(dispatcher.dispatch(Request.builder(method, target).build()));
    }

    @Test
    public void testMatchedRouteReceivesDecodedParams() throws Exception {
        RouteDispatcher dispatcher = dispatcher(false, RouteDescriptor.builder("/api/users/:userId/posts/:postId")
                .handler(HttpMethod.GET, RouteHandler.of(context -> Response.json(context.getParams())))
                .build());

        Response response = dispatch(dispatcher, "GET", "http://localhost:3000/api//users/42/posts/hello%20world/?x=1");
        assertEquals(200, response.getStatus());
        JsonNode body = response.readJson();
        assertEquals("42", body.get("userId").asText());
        assertEquals("hello world", body.get("postId").asText());
    }

    @Test
    public void testNotFound() throws Exception {
        RouteDispatcher dispatcher = dispatcher(false, RouteDescriptor.builder("/api/products")
                .handler(HttpMethod.GET, RouteHandler.of(context -> Response.text("ok")))
                .build());
        Response response = dispatch(dispatcher, "GET", "/api/missing");
        assertEquals(404, response.getStatus());
        assertEquals(Headers.APPLICATION_JSON, response.getHeader(Headers.CONTENT_TYPE));
        assertEquals("Route not found", response.readJson().get("error").asText());
    }

    @Test
    public void testMethodNotAllowed() throws Exception {
        RouteDispatcher dispatcher = dispatcher(false, RouteDescriptor.builder("/api/products")
                .handler(HttpMethod.GET, RouteHandler.of(context -> Response.text("ok")))
                .handler(HttpMethod.POST, RouteHandler.of(context -> Response.status(201)))
                .build());
        Response response = dispatch(dispatcher, "DELETE", "/api/products");
        assertEquals(405, response.getStatus());
        assertEquals("GET, POST", response.getHeader(Headers.ALLOW));
        assertEquals("Method Not Allowed", response.readJson().get("error").asText());
    }

    public static class EmptyDetail {
    }

    @Test
    public void testValidatorErrorWithoutPropertiesIs400() throws Exception {
        AtomicInteger invocations = new AtomicInteger();
        RouteDispatcher dispatcher = dispatcher(false, RouteDescriptor.builder("/x/:id")
                .handler(HttpMethod.GET, RouteHandler.of(context -> {
                    invocations.incrementAndGet();
                    return Response.text("ok");
                }))
                .schema(HttpMethod.GET, RouteSchema.params(value -> ParseResult.failure(new EmptyDetail())))
                .build());
        Response response = dispatch(dispatcher, "GET", "/x/1");
        assertEquals(400, response.getStatus());
        JsonNode errors = response.readJson().get("errors");
        assertEquals(1, errors.size());
        assertEquals("params", errors.get(0).get("field").asText());
        assertEquals(0, invocations.get());
    }

    @Test
    public void testHandlerExceptionBecomes500() throws Exception {
        RouteDispatcher dispatcher = dispatcher(false, RouteDescriptor.builder("/boom")
                .handler(HttpMethod.GET, context -> {
                    throw new IllegalStateException("secret detail");
                })
                .build());
        Response response = dispatch(dispatcher, "GET", "/boom");
        assertEquals(500, response.getStatus());
        JsonNode body = response.readJson();
        assertEquals("Internal Server Error", body.get("error").asText());
        assertEquals("An unexpected error occurred", body.get("message").asText());
        assertNull(body.get("stack"));
        assertFalse(response.getBodyAsString().contains("secret detail"));
    }

    @Test
    public void testExceptionallyCompletedStageBecomes500() throws Exception {
        RouteDispatcher dispatcher = dispatcher(false, RouteDescriptor.builder("/boom")
                .handler(HttpMethod.GET, context -> CompletableFuture.supplyAsync(() -> {
                    throw new IllegalStateException("async failure");
                }))
                .build());
        assertEquals(500, dispatch(dispatcher, "GET", "/boom").getStatus());
    }

    @Test
    public void testDebugModeExposesDetails() throws Exception {
        RouteDispatcher dispatcher = dispatcher(true, RouteDescriptor.builder("/boom")
                .handler(HttpMethod.GET, context -> {
                    throw new IllegalStateException("detail");
                })
                .build());
        JsonNode body = dispatch(dispatcher, "GET", "/boom?q=1").readJson();
        assertEquals("detail", body.get("message").asText());
        assertEquals(IllegalStateException.class.getName(), body.get("exception").asText());
        assertTrue(body.get("stack").asText().contains("IllegalStateException"));
        assertEquals("GET", body.get("request").get("method").asText());
        assertEquals("/boom?q=1", body.get("request").get("url").asText());
    }

    @Test
    public void testFailingMiddlewareBecomes500() throws Exception {
        Middleware boom = context -> {
            throw new IllegalStateException("middleware");
        };
        RouteDispatcher dispatcher = new RouteDispatcher(
                RouteTable.of(Collections.singletonList(RouteDescriptor.builder("/x")
                        .handler(HttpMethod.GET, RouteHandler.of(context -> Response.text("ok")))
                        .build())),
                DispatcherConfig.builder().addGlobalMiddleware(boom).setDebug(false).build());
        assertEquals(500, dispatch(dispatcher, "GET", "/x").getStatus());
    }

    @Test
    public void testDispatcherKeepsServingAfterFailure() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        RouteDispatcher dispatcher = dispatcher(false, RouteDescriptor.builder("/flaky")
                .handler(HttpMethod.GET, RouteHandler.of(context -> {
                    if (calls.incrementAndGet() == 1) {
                        throw new IllegalStateException("first call fails");
                    }
                    return Response.text("ok");
                }))
                .build());
        assertEquals(500, dispatch(dispatcher, "GET", "/flaky").getStatus());
        assertEquals(200, dispatch(dispatcher, "GET", "/flaky").getStatus());
    }

    @Test
    public void testConcurrentRequestsGetTheirOwnContext() throws Exception {
        RouteDispatcher dispatcher = dispatcher(false, RouteDescriptor.builder("/items/:id")
                .handler(HttpMethod.GET, RouteHandler.of(context -> Response.text(context.getParam("id"))))
                .build());
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            CountDownLatch start = new CountDownLatch(1);
            List<Future<String>> results = new ArrayList<>();
            for (int i = 0; i < 64; ++i) {
                final String id = Integer.toString(i);
                results.add(executor.submit(() -> {
                    start.await();
                    return dispatcher.dispatchAndWait(Request.builder("GET", "/items/" + id).build()).getBodyAsString();
                }));
            }
            start.countDown();
            for (int i = 0; i < 64; ++i) {
                assertEquals(Integer.toString(i), results.get(i).get(10, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void testConfigDefaults() {
        String previous = System.getProperty(DispatcherConfig.DEBUG_PROPERTY);
        try {
            System.setProperty(DispatcherConfig.DEBUG_PROPERTY, "true");
            assertTrue(DispatcherConfig.builder().build().isDebug());
            assertFalse(DispatcherConfig.builder().setDebug(false).build().isDebug());
            System.clearProperty(DispatcherConfig.DEBUG_PROPERTY);
            DispatcherConfig config = DispatcherConfig.builder().setPrefix("/api/").build();
            assertFalse(config.isDebug());
            assertEquals("api", config.getPrefix());
            assertEquals("API", config.getTitle());
            assertEquals("1.0.0", config.getVersion());
            assertTrue(config.getGlobalMiddleware().isEmpty());
        } finally {
            if (previous == null) {
                System.clearProperty(DispatcherConfig.DEBUG_PROPERTY);
            } else {
                System.setProperty(DispatcherConfig.DEBUG_PROPERTY, previous);
            }
        }
    }
}
