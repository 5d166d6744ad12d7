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
 * A problem found while compiling a routes directory. Errors are values so that one compilation can report all of
 * them together.
 */
public final class ConfigurationError {

    public enum Kind {
        /**
         * Two dynamic folders in the same parent directory.
         */
        AMBIGUOUS_DYNAMIC_SEGMENT,
        /**
         * Two route files that compile to the same pattern, up to parameter names.
         */
        DUPLICATE_ROUTE,
        /**
         * A dynamic folder with an empty name, or a parameter name used twice in one pattern.
         */
        INVALID_SEGMENT,
        UNREADABLE_DIRECTORY,
        MODULE_LOAD_FAILURE
    }

    private final Kind kind;
    private final Path directory;
    private final String message;

    public ConfigurationError(final Kind kind, final Path directory, final String message) {
        this.kind = kind;
        this.directory = directory;
        this.message = message;
    }

    public Kind getKind() {
        return kind;
    }

    public Path getDirectory() {
        return directory;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
