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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.StringJoiner;

import io.routekit.RouteKitMessages;
import io.routekit.routing.RouteTable;

/**
 * The outcome of {@link RouteCompiler#compile()}: a route table, or the configuration errors that prevent one.
 */
public final class CompilationResult {

    private final RouteTable routeTable;
    private final List<ConfigurationError> errors;

    private CompilationResult(final RouteTable routeTable, final List<ConfigurationError> errors) {
        this.routeTable = routeTable;
        this.errors = errors;
    }

    public static CompilationResult success(final RouteTable routeTable) {
        if (routeTable == null) {
            throw RouteKitMessages.MESSAGES.argumentCannotBeNull("routeTable");
        }
        return new CompilationResult(routeTable, Collections.emptyList());
    }

    public static CompilationResult failure(final List<ConfigurationError> errors) {
        if (errors == null || errors.isEmpty()) {
            throw RouteKitMessages.MESSAGES.emptyCompilationResult();
        }
        return new CompilationResult(null, Collections.unmodifiableList(new ArrayList<>(errors)));
    }

    public boolean isSuccess() {
        return routeTable != null;
    }

    /**
     * @return the table, null if compilation failed
     */
    public RouteTable getRouteTable() {
        return routeTable;
    }

    public List<ConfigurationError> getErrors() {
        return errors;
    }

    /**
     * @return the table
     * @throws RouteConfigurationException if compilation failed
     */
    public RouteTable getOrThrow() {
        if (routeTable != null) {
            return routeTable;
        }
        final StringJoiner joiner = new StringJoiner("; ");
        for (ConfigurationError error : errors) {
            joiner.add(error.getMessage());
        }
        throw new RouteConfigurationException(RouteKitMessages.MESSAGES.routeCompilationFailed(errors.size(), joiner.toString()), errors);
    }
}
