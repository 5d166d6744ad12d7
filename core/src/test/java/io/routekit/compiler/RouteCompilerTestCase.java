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

package io.routekit.compiler;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.experimental.categories.Category;
import org.junit.rules.TemporaryFolder;

import io.routekit.middleware.Middleware;
import io.routekit.routing.RouteDescriptor;
import io.routekit.routing.RouteMatch;
import io.routekit.routing.RouteTable;
import io.routekit.server.Response;
import io.routekit.server.RouteHandler;
import io.routekit.testutils.MapRouteModuleLoader;
import io.routekit.testutils.RouteTree;
import io.routekit.testutils.category.UnitTest;
import io.routekit.util.HttpMethod;
import io.routekit.validation.ParseResult;
import io.routekit.validation.RouteSchema;

@Category(UnitTest.class)
public class RouteCompilerTestCase {

    private static final RouteHandler OK = RouteHandler.of(context -> Response.text("ok"));

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private RouteTree tree;
    private MapRouteModuleLoader loader;

    @Before
    public void setup() {
        tree = new RouteTree(folder.getRoot().toPath());
        loader = new MapRouteModuleLoader();
    }

    private static RouteModule get() {
        return SimpleRouteModule.builder().get(OK).build();
    }

    private RouteTable compile(final String prefix) {
        CompilationResult result = new RouteCompiler(tree.getRoot(), prefix, loader).compile();
        if (!result.isSuccess()) {
            fail("Compilation failed: " + result.getErrors());
        }
        return result.getRouteTable();
    }

    private List<String> patterns(final RouteTable table) {
        List<String> result = new ArrayList<>();
        for (RouteDescriptor route : table.getRoutes()) {
            result.add(route.getPattern().toString());
        }
        return result;
    }

    @Test
    public void testDirectoryLayoutBecomesUrlPatterns() throws Exception {
        tree.route("products").route("products/[id]").route("products/featured").route("");
        loader.with("products", get()).with("products/[id]", get()).with("products/featured", get()).with("", get());

        RouteTable table = compile("api");
        assertEquals(List.of("/api/products/featured", "/api/products", "/api/products/:id", "/api"), patterns(table));
        assertEquals(3, table.getRoutes().get(0).getSpecificity());
        assertEquals(2, table.getRoutes().get(2).getSpecificity());
    }

    @Test
    public void testGroupingFoldersAreInvisible() throws Exception {
        tree.route("(catalog)/product/[id]").route("(account)/profile");
        loader.with("(catalog)/product/[id]", get()).with("(account)/profile", get());

        RouteTable table = compile("/api/");
        assertEquals(List.of("/api/product/:id", "/api/profile"), patterns(table));
        RouteMatch match = table.match("/api/product/7", "GET");
        assertTrue(match.isMatched());
        assertEquals("7", match.getParameters().get("id"));
    }

    @Test
    public void testPrefixForms() throws Exception {
        tree.route("users");
        loader.with("users", get());
        for (String prefix : new String[]{"api", "/api/", "api//"}) {
            assertEquals(List.of("/api/users"), patterns(compile(prefix)));
        }
        assertEquals(List.of("/users"), patterns(compile(null)));
        assertEquals(List.of("/v1/api/users"), patterns(compile("v1/api")));
    }

    @Test
    public void testTwoDynamicSiblingsAreRejected() throws Exception {
        tree.route("users/[id]").route("users/[name]");
        loader.with("users/[id]", get()).with("users/[name]", get());

        CompilationResult result = new RouteCompiler(tree.getRoot(), "api", loader).compile();
        assertFalse(result.isSuccess());
        assertNull(result.getRouteTable());
        assertEquals(1, result.getErrors().size());
        ConfigurationError error = result.getErrors().get(0);
        assertEquals(ConfigurationError.Kind.AMBIGUOUS_DYNAMIC_SEGMENT, error.getKind());
        assertTrue(error.getMessage(), error.getMessage().contains("[name]"));
        assertTrue(error.getMessage(), error.getMessage().contains("[id]"));
        assertEquals(tree.getRoot().resolve("users"), error.getDirectory());
    }

    @Test
    public void testGetOrThrowCarriesAllErrors() throws Exception {
        tree.route("a/[x]").route("a/[y]").route("b/[]").directory("c/[p]/[p]");
        loader.with("a/[x]", get()).with("a/[y]", get()).with("b/[]", get());
        tree.route("c/[p]/[p]");

        CompilationResult result = new RouteCompiler(tree.getRoot(), null, loader).compile();
        try {
            result.getOrThrow();
            fail("Expected a configuration exception");
        } catch (RouteConfigurationException e) {
            assertEquals(3, e.getErrors().size());
            assertEquals(ConfigurationError.Kind.AMBIGUOUS_DYNAMIC_SEGMENT, e.getErrors().get(0).getKind());
            assertEquals(ConfigurationError.Kind.INVALID_SEGMENT, e.getErrors().get(1).getKind());
            assertEquals(ConfigurationError.Kind.INVALID_SEGMENT, e.getErrors().get(2).getKind());
        }
    }

    @Test
    public void testDynamicFoldersInDifferentParentsAreFine() throws Exception {
        tree.route("users/[id]").route("posts/[slug]");
        loader.with("users/[id]", get()).with("posts/[slug]", get());
        assertEquals(List.of("/posts/:slug", "/users/:id"), patterns(compile(null)));
    }

    @Test
    public void testDuplicateRoutesThroughGroups() throws Exception {
        tree.route("(a)/products").route("(b)/products");
        loader.with("(a)/products", get()).with("(b)/products", get());

        CompilationResult result = new RouteCompiler(tree.getRoot(), null, loader).compile();
        assertFalse(result.isSuccess());
        assertEquals(ConfigurationError.Kind.DUPLICATE_ROUTE, result.getErrors().get(0).getKind());
    }

    @Test
    public void testSameShapeWithDifferentParameterNamesIsADuplicate() throws Exception {
        tree.route("(a)/users/[id]").route("(b)/users/[userId]");
        loader.with("(a)/users/[id]", get()).with("(b)/users/[userId]", get());

        CompilationResult result = new RouteCompiler(tree.getRoot(), null, loader).compile();
        assertFalse(result.isSuccess());
        assertEquals(ConfigurationError.Kind.DUPLICATE_ROUTE, result.getErrors().get(0).getKind());
    }

    @Test
    public void testEmptyTreeYieldsEmptyTable() throws Exception {
        tree.directory("nothing/here");
        tree.file("README.txt", "not a route");
        RouteTable table = compile("api");
        assertTrue(table.isEmpty());
        assertEquals(RouteMatch.Outcome.NOT_FOUND, table.match("/api/nothing/here", "GET").getOutcome());
    }

    @Test
    public void testMissingRootIsAnError() {
        CompilationResult result = new RouteCompiler(tree.getRoot().resolve("missing"), null, loader).compile();
        assertFalse(result.isSuccess());
        assertEquals(ConfigurationError.Kind.UNREADABLE_DIRECTORY, result.getErrors().get(0).getKind());
    }

    @Test
    public void testModuleLoadFailure() throws Exception {
        tree.route("broken");
        CompilationResult result = new RouteCompiler(tree.getRoot(), null, loader).compile();
        assertFalse(result.isSuccess());
        ConfigurationError error = result.getErrors().get(0);
        assertEquals(ConfigurationError.Kind.MODULE_LOAD_FAILURE, error.getKind());
        assertTrue(error.getMessage(), error.getMessage().contains("No module registered"));
    }

    @Test
    public void testModuleContentsAreCopiedToDescriptor() throws Exception {
        Middleware middleware = context -> Middleware.proceed();
        RouteSchema schema = RouteSchema.body(value -> ParseResult.success(value));
        tree.route("products");
        loader.with("products", SimpleRouteModule.builder()
                .get(OK)
                .post(OK)
                .middleware(middleware)
                .schema(HttpMethod.POST, schema)
                .documentation(HttpMethod.GET, "List products")
                .build());

        RouteDescriptor route = compile(null).getRoutes().get(0);
        assertEquals(EnumSet.of(HttpMethod.GET, HttpMethod.POST), route.getAllowedMethods());
        assertSame(OK, route.getHandler(HttpMethod.GET));
        assertEquals(List.of(middleware), route.getMiddleware());
        assertSame(schema, route.getSchema(HttpMethod.POST));
        assertNull(route.getSchema(HttpMethod.GET));
        assertEquals("List products", route.getDocumentation().get("get"));
        assertEquals(tree.getRoot().resolve("products").resolve(RouteCompiler.ROUTE_FILE_NAME), route.getSource());
    }

    @Test
    public void testRouteWithoutHandlersAnswersWithMethodNotAllowed() throws Exception {
        tree.route("empty");
        loader.with("empty", SimpleRouteModule.builder().build());
        RouteTable table = compile(null);
        assertEquals(RouteMatch.Outcome.METHOD_NOT_ALLOWED, table.match("/empty", "GET").getOutcome());
    }
}
