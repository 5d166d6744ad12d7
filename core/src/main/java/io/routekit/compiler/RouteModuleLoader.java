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

import java.nio.file.Path;

/**
 * Turns a route file into a {@link RouteModule}.
 */
@FunctionalInterface
public interface RouteModuleLoader {

    /**
     * @param routeFile         the route file
     * @param relativeDirectory the directory holding the file, relative to the routes root, with grouping and dynamic
     *                          folder names as they appear on disk
     * @return the module, never null
     * @throws Exception if the module cannot be loaded. The compiler reports it as a configuration error.
     */
    RouteModule load(Path routeFile, Path relativeDirectory) throws Exception;
}
