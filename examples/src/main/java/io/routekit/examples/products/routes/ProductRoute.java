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

package io.routekit.examples.products.routes;

import java.util.Map;

import io.routekit.compiler.SimpleRouteModule;
import io.routekit.examples.products.Product;
import io.routekit.examples.products.ProductCatalog;
import io.routekit.examples.products.ProductInput;
import io.routekit.server.RequestContext;
import io.routekit.server.Response;
import io.routekit.server.RouteHandler;
import io.routekit.util.HttpMethod;
import io.routekit.util.StatusCodes;
import io.routekit.validation.BeanValidationSchema;
import io.routekit.validation.RouteSchema;

/**
 * {@code /api/products/:id}: reads, replaces and deletes a single product.
 */
public class ProductRoute extends SimpleRouteModule {

    public ProductRoute() {
        super(builder()
                .get(RouteHandler.of(ProductRoute::get))
                .put(RouteHandler.of(ProductRoute::replace))
                .delete(RouteHandler.of(ProductRoute::delete))
                .schema(HttpMethod.GET, RouteSchema.params(ProductIdSchema.INSTANCE))
                .schema(HttpMethod.PUT, RouteSchema.builder()
                        .params(ProductIdSchema.INSTANCE)
                        .body(BeanValidationSchema.of(ProductInput.class))
                        .build())
                .schema(HttpMethod.DELETE, RouteSchema.params(ProductIdSchema.INSTANCE))
                .documentation(HttpMethod.GET, "Get a product by id"));
    }

    private static long id(final RequestContext context) {
        return context.getValidated().getParams(Long.class);
    }

    private static Response get(final RequestContext context) {
        Product product = ProductCatalog.getDefault().get(id(context));
        return product == null ? notFound(context) : Response.json(product);
    }

    private static Response replace(final RequestContext context) throws Exception {
        Product product = ProductCatalog.getDefault().replace(id(context), context.readJson(ProductInput.class));
        return product == null ? notFound(context) : Response.json(product);
    }

    private static Response delete(final RequestContext context) {
        return ProductCatalog.getDefault().delete(id(context)) ? Response.status(StatusCodes.NO_CONTENT) : notFound(context);
    }

    private static Response notFound(final RequestContext context) {
        return Response.json(StatusCodes.NOT_FOUND, Map.of("error", "Product " + context.getParam("id") + " not found"));
    }
}
