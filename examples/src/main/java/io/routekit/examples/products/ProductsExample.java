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

import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import org.jboss.logging.Logger;

import io.routekit.RouteKit;
import io.routekit.examples.RouteKitExample;
import io.routekit.examples.products.middleware.RequestLogger;
import io.routekit.routing.RouteDescriptor;
import io.routekit.server.Request;
import io.routekit.server.Response;

/**
 * A product catalogue API compiled from the {@code routes} directory on the class path:
 *
 * <pre>
 * routes/
 *   health/route.properties                  GET  /api/health
 *   (catalog)/products/route.properties      GET, POST /api/products
 *   (catalog)/products/[id]/route.properties GET, PUT, DELETE /api/products/:id
 *   (catalog)/products/featured/...          GET  /api/products/featured (API key required)
 * </pre>
 *
 * There is no socket transport, so {@link #main(String[])} replays a few requests and prints the responses.
 */
@RouteKitExample("Products API")
public class ProductsExample {

    public static final String ROUTES_RESOURCE = "routes";
    public static final String PREFIX = "api";

    private static final Logger log = Logger.getLogger(ProductsExample.class);

    public static RouteKit create(final Path routesDirectory) {
        return RouteKit.builder()
                .setRoutesDirectory(routesDirectory)
                .setPrefix(PREFIX)
                .addGlobalMiddleware(new RequestLogger())
                .setTitle("Products API")
                .setVersion("1.0.0")
                .setDescription("A file based product catalogue")
                .build();
    }

    public static Path routesDirectory() throws URISyntaxException {
        URL url = ProductsExample.class.getClassLoader().getResource(ROUTES_RESOURCE);
        if (url == null) {
            throw new IllegalStateException("Could not locate the " + ROUTES_RESOURCE + " directory on the class path");
        }
        return Paths.get(url.toURI());
    }

    public static void main(final String[] args) throws Exception {
        final Path routes = args.length > 0 ? Paths.get(args[0]) : routesDirectory();
        final RouteKit api = create(routes);
        for (RouteDescriptor route : api.getRouteTable().getRoutes()) {
            log.infof("%s %s", route.getAllowedMethods(), route.getPattern());
        }

        final List<Request> requests = List.of(
                Request.builder("GET", "/api/health").build(),
                Request.builder("GET", "/api/products?search=phone").build(),
                Request.builder("GET", "/api/products/1").build(),
                Request.builder("GET", "/api/products/featured").build(),
                Request.builder("GET", "/api/products/featured").header("X-Api-Key", "secret-key").build(),
                Request.builder("POST", "/api/products").jsonBody("{\"name\":\"Monitor\",\"price\":249.0}").build(),
                Request.builder("POST", "/api/products").jsonBody("{}").build(),
                Request.builder("PATCH", "/api/products/1").build(),
                Request.builder("GET", "/api/orders").build());
        for (Request request : requests) {
            Response response = api.dispatch(request).toCompletableFuture().join();
            System.out.println(request + " -> " + response.getStatus() + " " + response.getBodyAsString());
        }
    }
}
