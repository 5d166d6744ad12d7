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

import java.io.IOException;
import java.lang.reflect.InvocationTargetException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import io.routekit.RouteKitLogger;
import io.routekit.RouteKitMessages;
import io.routekit.routing.PathSegment;
import io.routekit.routing.RouteDescriptor;
import io.routekit.routing.RoutePattern;
import io.routekit.routing.RouteTable;
import io.routekit.util.URLUtils;

/**
 * Compiles a routes directory into a {@link RouteTable}.
 * <p>
 * Folder names map to URL segments:
 * <ul>
 * <li>{@code (name)} groups routes on disk and does not appear in the URL;</li>
 * <li>{@code [name]} is a parameter segment, at most one per parent folder;</li>
 * <li>anything else is a literal segment.</li>
 * </ul>
 * A folder holding a {@value #ROUTE_FILE_NAME} file is a route. Entries are visited in name order, so the same tree
 * always compiles to the same table and reports the same errors.
 * <p>
 * Compilation never stops at the first problem. Every error is collected and returned in the
 * {@link CompilationResult}, and a result with errors carries no table at all.
 */
public class RouteCompiler {

    public static final String ROUTE_FILE_NAME = "route.properties";

    private final Path root;
    private final List<PathSegment> prefix;
    private final RouteModuleLoader loader;

    public RouteCompiler(final Path root) {
        this(root, null, new ClassNameRouteModuleLoader());
    }

    /**
     * @param root   the routes directory
     * @param prefix the URL prefix, leading and trailing slashes are ignored
     * @param loader turns route files into modules
     */
    public RouteCompiler(final Path root, final String prefix, final RouteModuleLoader loader) {
        if (root == null) {
            throw RouteKitMessages.MESSAGES.routesDirectoryRequired();
        }
        if (loader == null) {
            throw RouteKitMessages.MESSAGES.argumentCannotBeNull("loader");
        }
        this.root = root;
        this.loader = loader;
        this.prefix = new ArrayList<>();
        for (String part : RoutePattern.splitPath(URLUtils.cleanPrefix(prefix))) {
            this.prefix.add(PathSegment.literal(part));
        }
    }

    public CompilationResult compile() {
        RouteKitLogger.COMPILER_LOGGER.compilingRoutes(root);
        final Compilation compilation = new Compilation();
        if (!Files.isDirectory(root)) {
            compilation.error(ConfigurationError.Kind.UNREADABLE_DIRECTORY, root,
                    RouteKitMessages.MESSAGES.directoryUnreadable(root, "not a directory"));
        } else {
            scan(root, new ArrayList<>(prefix), compilation);
        }
        if (!compilation.errors.isEmpty()) {
            return CompilationResult.failure(compilation.errors);
        }
        final RouteTable table = RouteTable.of(compilation.routes);
        if (table.isEmpty()) {
            RouteKitLogger.COMPILER_LOGGER.emptyRouteTable(root);
        } else {
            RouteKitLogger.COMPILER_LOGGER.routesCompiled(table.size(), root);
        }
        return CompilationResult.success(table);
    }

    private void scan(final Path directory, final List<PathSegment> segments, final Compilation compilation) {
        final List<Path> entries = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
            for (Path entry : stream) {
                entries.add(entry);
            }
        } catch (IOException | SecurityException e) {
            compilation.error(ConfigurationError.Kind.UNREADABLE_DIRECTORY, directory,
                    RouteKitMessages.MESSAGES.directoryUnreadable(relative(directory), String.valueOf(e.getMessage())));
            return;
        }
        entries.sort((a, b) -> a.getFileName().toString().compareTo(b.getFileName().toString()));

        String dynamicFolder = null;
        for (Path entry : entries) {
            final String name = entry.getFileName().toString();
            if (!Files.isDirectory(entry)) {
                if (name.equals(ROUTE_FILE_NAME) && Files.isRegularFile(entry)) {
                    register(entry, RoutePattern.of(segments), compilation);
                }
                continue;
            }
            if (isGroup(name)) {
                scan(entry, segments, compilation);
            } else if (isDynamic(name)) {
                if (dynamicFolder != null) {
                    compilation.error(ConfigurationError.Kind.AMBIGUOUS_DYNAMIC_SEGMENT, directory,
                            RouteKitMessages.MESSAGES.multipleDynamicSegments(name, dynamicFolder, relative(directory)));
                    continue;
                }
                dynamicFolder = name;
                final String param = name.substring(1, name.length() - 1);
                if (param.isEmpty()) {
                    compilation.error(ConfigurationError.Kind.INVALID_SEGMENT, entry,
                            RouteKitMessages.MESSAGES.emptyParameterName(name, relative(directory)));
                    continue;
                }
                if (hasParameter(segments, param)) {
                    compilation.error(ConfigurationError.Kind.INVALID_SEGMENT, entry,
                            RouteKitMessages.MESSAGES.duplicateParameterName(param, relative(entry)));
                    continue;
                }
                scan(entry, append(segments, PathSegment.param(param)), compilation);
            } else {
                scan(entry, append(segments, PathSegment.literal(name)), compilation);
            }
        }
    }

    private void register(final Path routeFile, final RoutePattern pattern, final Compilation compilation) {
        final Path directory = routeFile.getParent();
        RouteKitLogger.COMPILER_LOGGER.debugf("Found route file %s", routeFile);
        final RouteModule module;
        try {
            module = loader.load(routeFile, root.relativize(directory));
            if (module == null) {
                throw new IllegalStateException("no module returned");
            }
        } catch (Exception | LinkageError e) {
            compilation.error(ConfigurationError.Kind.MODULE_LOAD_FAILURE, directory,
                    RouteKitMessages.MESSAGES.moduleLoadFailed(relative(routeFile), describe(e)));
            return;
        }
        final RouteDescriptor route;
        try {
            route = RouteDescriptor.builder(pattern)
                    .handlers(nonNull(module.getHandlers()))
                    .middleware(module.getMiddleware() == null ? List.of() : module.getMiddleware())
                    .schemas(nonNull(module.getSchemas()))
                    .documentation(nonNull(module.getDocumentation()))
                    .source(routeFile)
                    .build();
        } catch (RuntimeException e) {
            compilation.error(ConfigurationError.Kind.MODULE_LOAD_FAILURE, directory,
                    RouteKitMessages.MESSAGES.moduleLoadFailed(relative(routeFile), describe(e)));
            return;
        }
        final RouteDescriptor existing = compilation.shapes.putIfAbsent(pattern.getShape(), route);
        if (existing != null) {
            compilation.error(ConfigurationError.Kind.DUPLICATE_ROUTE, directory,
                    RouteKitMessages.MESSAGES.duplicateRoutePattern(pattern.toString(), relative(directory),
                            existing.getPattern().toString(), relative(existing.getSource().getParent())));
            return;
        }
        if (route.getHandlers().isEmpty()) {
            RouteKitLogger.COMPILER_LOGGER.routeWithoutHandlers(routeFile, pattern.toString());
        }
        RouteKitLogger.COMPILER_LOGGER.routeRegistered(pattern.toString(), route.getAllowedMethods(), routeFile);
        compilation.routes.add(route);
    }

    private Path relative(final Path path) {
        return path.equals(root) ? root : root.relativize(path);
    }

    private static boolean isGroup(final String name) {
        return name.length() >= 2 && name.charAt(0) == '(' && name.charAt(name.length() - 1) == ')';
    }

    private static boolean isDynamic(final String name) {
        return name.length() >= 2 && name.charAt(0) == '[' && name.charAt(name.length() - 1) == ']';
    }

    private static boolean hasParameter(final List<PathSegment> segments, final String name) {
        for (PathSegment segment : segments) {
            if (segment.isParam() && segment.getValue().equals(name)) {
                return true;
            }
        }
        return false;
    }

    private static List<PathSegment> append(final List<PathSegment> segments, final PathSegment segment) {
        final List<PathSegment> result = new ArrayList<>(segments.size() + 1);
        result.addAll(segments);
        result.add(segment);
        return result;
    }

    private static <K, V> Map<K, V> nonNull(final Map<K, V> map) {
        return map == null ? Map.of() : map;
    }

    private static String describe(final Throwable e) {
        Throwable cause = e;
        if ((cause instanceof InvocationTargetException || cause instanceof ExceptionInInitializerError) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return String.valueOf(cause);
    }

    public Path getRoot() {
        return root;
    }

    private static final class Compilation {

        final List<RouteDescriptor> routes = new ArrayList<>();
        final Map<String, RouteDescriptor> shapes = new HashMap<>();
        final List<ConfigurationError> errors = new ArrayList<>();

        void error(final ConfigurationError.Kind kind, final Path directory, final String message) {
            RouteKitLogger.COMPILER_LOGGER.configurationError(message);
            errors.add(new ConfigurationError(kind, directory, message));
        }
    }
}
