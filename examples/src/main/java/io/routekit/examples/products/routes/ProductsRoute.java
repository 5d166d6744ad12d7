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

import java.util.LinkedHashMap;
import java.util.Map;

import io.routekit.compiler.SimpleRouteModule;
import io.routekit.examples.products.Product;
import io.routekit.examples.products.ProductCatalog;
import io.routekit.examples.products.ProductInput;
import io.routekit.examples.products.ProductSearch;
import io.routekit.server.RequestContext;
import io.routekit.server.Response;
import io.routekit.server.RouteHandler;
import io.routekit.util.Headers;
import io.routekit.util.HttpMethod;
import io.routekit.util.StatusCodes;
import io.routekit.validation.BeanValidationSchema;
import io.routekit.validation.RouteSchema;

/**
 * {@code /api/products}: lists and creates products.
 */
public class ProductsRoute extends SimpleRouteModule {

    private static final int DEFAULT_LIMIT = 20;

    public ProductsRoute() {
        super(builder()
                .get(RouteHandler.of(ProductsRoute::list))
                .post(RouteHandler.of(ProductsRoute::create))
                .schema(HttpMethod.GET, RouteSchema.query(BeanValidationSchema.of(ProductSearch.class)))
                .schema(HttpMethod.POST, RouteSchema.body(BeanValidationSchema.of(ProductInput.class)))
                .documentation(HttpMethod.GET, "List products, optionally filtered by name")
                .documentation(HttpMethod.POST, "Create a product"));
    }

    private static Response list(final RequestContext context) {
        ProductSearch search = context.getValidated().getQuery(ProductSearch.class);
        int limit = search.getLimit() == null ? DEFAULT_LIMIT : search.getLimit();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("products", ProductCatalog.getDefault().list(search.getSearch(), limit));
        return Response.json(body);
    }

    private static Response create(final RequestContext context) throws Exception {
        ProductInput input = context.readJson(ProductInput.class);
        Product product = ProductCatalog.getDefault().create(input.getName(), input.getPrice(), input.getDescription());
        return Response.builder()
                .status(StatusCodes.CREATED)
                .header(Headers.LOCATION, "/api/products/" + product.getId())
                .json(product)
                .build();
    }
}
