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

package io.routekit.middleware;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;

import org.junit.Test;
import org.junit.experimental.categories.Category;

import io.routekit.routing.RouteDescriptor;
import io.routekit.routing.RouteTable;
import io.routekit.server.Response;
import io.routekit.server.RouteHandler;
import io.routekit.testutils.category.UnitTest;
import io.routekit.util.HttpMethod;
import io.routekit.validation.ParseResult;
import io.routekit.validation.RouteSchema;
import io.routekit.validation.ValidationMiddleware;

@Category(UnitTest.class)
public class PipelineBuilderTestCase {

    private static final RouteHandler OK = RouteHandler.of(context -> Response.text("ok"));

    @Test
    public void testValidationSitsBetweenGlobalAndRouteMiddleware() {
        Middleware global = context -> Middleware.proceed();
        Middleware local = context -> Middleware.proceed();
        RouteSchema schema = RouteSchema.query(value -> ParseResult.success(value));
        RouteDescriptor route = RouteDescriptor.builder("/products")
                .handler(HttpMethod.GET, OK)
                .handler(HttpMethod.POST, OK)
                .schema(HttpMethod.GET, schema)
                .middleware(Collections.singletonList(local))
                .build();
        PipelineBuilder builder = new PipelineBuilder(Collections.singletonList(global));

        MiddlewarePipeline get = builder.build(route, HttpMethod.GET);
        assertEquals(3, get.size());
        assertSame(global, get.get(0));
        assertTrue(get.get(1) instanceof ValidationMiddleware);
        assertSame(schema, ((ValidationMiddleware) get.get(1)).getSchema());
        assertSame(local, get.get(2));

        MiddlewarePipeline post = builder.build(route, HttpMethod.POST);
        assertEquals(2, post.size());
        assertSame(local, post.get(1));
    }

    @Test
    public void testEmptySchemaAddsNoValidation() {
        RouteDescriptor route = RouteDescriptor.builder("/products")
                .handler(HttpMethod.GET, OK)
                .schema(HttpMethod.GET, RouteSchema.builder().build())
                .build();
        assertEquals(0, new PipelineBuilder(Collections.emptyList()).build(route, HttpMethod.GET).size());
    }

    @Test
    public void testBuildAll() {
        RouteDescriptor products = RouteDescriptor.builder("/products").handler(HttpMethod.GET, OK).handler(HttpMethod.DELETE, OK).build();
        RouteDescriptor product = RouteDescriptor.builder("/products/:id").handler(HttpMethod.GET, OK).build();
        Map<RouteDescriptor, Map<HttpMethod, MiddlewarePipeline>> all = new PipelineBuilder(Collections.emptyList())
                .buildAll(RouteTable.of(Arrays.asList(products, product)));
        assertEquals(2, all.size());
        assertEquals(2, all.get(products).size());
        assertEquals(1, all.get(product).size());
        assertNull(all.get(product).get(HttpMethod.DELETE));
        assertSame(product, all.get(product).get(HttpMethod.GET).getRoute());
    }
}
