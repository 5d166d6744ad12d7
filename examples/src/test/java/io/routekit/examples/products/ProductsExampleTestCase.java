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

package io.routekit.examples.products;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.BeforeClass;
import org.junit.Test;
import org.junit.experimental.categories.Category;

import com.fasterxml.jackson.databind.JsonNode;
import io.routekit.RouteKit;
import io.routekit.examples.products.middleware.ApiKeyMiddleware;
import io.routekit.examples.products.middleware.RequestLogger;
import io.routekit.server.Request;
import io.routekit.server.Response;
import io.routekit.testutils.category.UnitTest;
import io.routekit.util.Headers;

@Category(UnitTest.class)
public class ProductsExampleTestCase {

    private static RouteKit api;

    @BeforeClass
    public static void setup() throws Exception {
        api = ProductsExample.create(ProductsExample.routesDirectory());
    }

    private static Response send(final Request request) {
        return api.dispatch(request).toCompletableFuture().join();
    }

    @Test
    public void testRouteTreeCompiles() {
        assertEquals(4, api.getRouteTable().size());
        assertEquals("/api/products/featured", api.getRouteTable().getRoutes().get(0).getPattern().toString());
        assertEquals("Products API", api.getConfig().getTitle());
    }

    @Test
    public void testHealth() throws Exception {
        Response response = send(Request.builder("GET", "/api/health").build());
        assertEquals(200, response.getStatus());
        assertEquals("UP", response.readJson().get("status").asText());
        assertNotNull(response.getHeader(RequestLogger.RESPONSE_TIME_HEADER));
    }

    @Test
    public void testGetProductById() throws Exception {
        Response response = send(Request.builder("GET", "/api/products/1").build());
        assertEquals(200, response.getStatus());
        assertEquals("Laptop", response.readJson().get("name").asText());

        response = send(Request.builder("GET", "/api/products/999999").build());
        assertEquals(404, response.getStatus());

        response = send(Request.builder("GET", "/api/products/abc").build());
        assertEquals(400, response.getStatus());
        assertEquals("params", response.readJson().get("errors").get(0).get("field").asText());
    }

    @Test
    public void testSearch() throws Exception {
        JsonNode products = send(Request.builder("GET", "/api/products?search=HEAD").build()).readJson().get("products");
        assertEquals(1, products.size());
        assertEquals("Headphones", products.get(0).get("name").asText());

        Response response = send(Request.builder("GET", "/api/products?limit=0").build());
        assertEquals(400, response.getStatus());
        assertEquals("query", response.readJson().get("errors").get(0).get("field").asText());
    }

    @Test
    public void testFeaturedRequiresApiKey() throws Exception {
        Response response = send(Request.builder("GET", "/api/products/featured").build());
        assertEquals(401, response.getStatus());
        assertNull(response.getHeader(RequestLogger.RESPONSE_TIME_HEADER));

        response = send(Request.builder("GET", "/api/products/featured")
                .header(ApiKeyMiddleware.API_KEY_HEADER, ApiKeyMiddleware.DEFAULT_KEY)
                .build());
        assertEquals(200, response.getStatus());
        assertTrue(response.readJson().get("featured").isArray());
    }

    @Test
    public void testCreateReplaceAndDelete() throws Exception {
        Response created = send(Request.builder("POST", "/api/products").jsonBody("{\"name\":\"Keyboard\",\"price\":49.5}").build());
        assertEquals(201, created.getStatus());
        long id = created.readJson().get("id").asLong();
        assertEquals("/api/products/" + id, created.getHeader(Headers.LOCATION));

        Response replaced = send(Request.builder("PUT", "/api/products/" + id).jsonBody("{\"name\":\"Mechanical Keyboard\",\"price\":89}").build());
        assertEquals(200, replaced.getStatus());
        assertEquals("Mechanical Keyboard", replaced.readJson().get("name").asText());

        assertEquals(204, send(Request.builder("DELETE", "/api/products/" + id).build()).getStatus());
        assertEquals(404, send(Request.builder("GET", "/api/products/" + id).build()).getStatus());
    }

    @Test
    public void testInvalidBody() throws Exception {
        Response response = send(Request.builder("POST", "/api/products").jsonBody("{\"name\":\"\",\"price\":-1}").build());
        assertEquals(400, response.getStatus());
        JsonNode issues = response.readJson().get("errors").get(0).get("error");
        assertEquals(2, issues.size());
        assertEquals("Name is required", issues.get(0).get("message").asText());
        assertEquals("Price must be positive", issues.get(1).get("message").asText());
    }

    @Test
    public void testUnroutedRequests() throws Exception {
        Response response = send(Request.builder("PATCH", "/api/products/1").build());
        assertEquals(405, response.getStatus());
        assertEquals("GET, PUT, DELETE", response.getHeader(Headers.ALLOW));

        response = send(Request.builder("GET", "/api/catalog/products").build());
        assertEquals(404, response.getStatus());
        assertEquals("Route not found", response.readJson().get("error").asText());
    }
}
