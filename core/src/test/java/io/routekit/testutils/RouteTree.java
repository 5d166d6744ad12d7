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

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import io.routekit.compiler.RouteCompiler;

/**
 * Builds a routes directory on disk.
 */
public final class RouteTree {

    private final Path root;

    public RouteTree(final Path root) {
        this.root = root;
    }

    /**
     * Creates the directory and an empty route file inside it.
     *
     * @param directory the directory relative to the root, using {@code /} as separator, empty for the root itself
     */
    public RouteTree route(final String directory) throws IOException {
        return route(directory, "");
    }

    public RouteTree route(final String directory, final String routeFileContent) throws IOException {
        Path dir = directory(directory);
        Files.write(dir.resolve(RouteCompiler.ROUTE_FILE_NAME), routeFileContent.getBytes(StandardCharsets.UTF_8));
        return this;
    }

    public RouteTree file(final String file, final String content) throws IOException {
        Path path = resolve(file);
        Files.createDirectories(path.getParent());
        Files.write(path, content.getBytes(StandardCharsets.UTF_8));
        return this;
    }

    public Path directory(final String directory) throws IOException {
        return Files.createDirectories(resolve(directory));
    }

    public Path getRoot() {
        return root;
    }

    private Path resolve(final String relative) {
        Path path = root;
        for (String part : relative.split("/")) {
            if (!part.isEmpty()) {
                path = path.resolve(part);
            }
        }
        return path;
    }
}
