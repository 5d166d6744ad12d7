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

package io.routekit.testutils;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import io.routekit.compiler.RouteModule;
import io.routekit.compiler.RouteModuleLoader;

/**
 * Serves route modules from a map keyed by the route directory, relative to the routes root and written with
 * {@code /} separators.
 */
public final class MapRouteModuleLoader implements RouteModuleLoader {

    private final Map<String, RouteModule> modules = new HashMap<>();

    public MapRouteModuleLoader with(final String directory, final RouteModule module) {
        modules.put(directory, module);
        return this;
    }

    @Override
    public RouteModule load(final Path routeFile, final Path relativeDirectory) {
        String key = relativeDirectory.toString().replace(relativeDirectory.getFileSystem().getSeparator(), "/");
        RouteModule module = modules.get(key);
        if (module == null) {
            throw new IllegalStateException("No module registered for '" + key + "'");
        }
        return module;
    }
}
