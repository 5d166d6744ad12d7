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
import io.routekit.examples.products.ProductCatalog;
import io.routekit.examples.products.middleware.ApiKeyMiddleware;
import io.routekit.server.Response;
import io.routekit.server.RouteHandler;

/**
 * {@code /api/products/featured}: takes precedence over {@code /api/products/:id} and requires an API key.
 */
public class FeaturedProductsRoute extends SimpleRouteModule {

    public FeaturedProductsRoute() {
        super(builder()
                .middleware(ApiKeyMiddleware.require(ApiKeyMiddleware.DEFAULT_KEY))
                .get(RouteHandler.of(context -> Response.json(Map.of("featured", ProductCatalog.getDefault().featured())))));
    }
}
