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

package io.routekit;

import java.nio.file.Path;
import java.util.concurrent.CompletionStage;

import io.routekit.compiler.ClassNameRouteModuleLoader;
import io.routekit.compiler.RouteCompiler;
import io.routekit.compiler.RouteConfigurationException;
import io.routekit.compiler.RouteModuleLoader;
import io.routekit.middleware.Middleware;
import io.routekit.routing.RouteTable;
import io.routekit.server.DispatcherConfig;
import io.routekit.server.Request;
import io.routekit.server.Response;
import io.routekit.server.RouteDispatcher;

/**
 * Convenience class used to assemble a file based API from a routes directory.
 * <p>
 * Typical use:
 *
 * <pre>
 * RouteKit api = RouteKit.builder()
 *         .setRoutesDirectory(Paths.get("api"))
 *         .setPrefix("api")
 *         .addGlobalMiddleware(logger)
 *         .build();
 * Response response = api.dispatch(request).toCompletableFuture().join();
 * </pre>
 */
public final class RouteKit {

    private final RouteTable routeTable;
    private final DispatcherConfig config;
    private final RouteDispatcher dispatcher;

    private RouteKit(final RouteTable routeTable, final DispatcherConfig config) {
        this.routeTable = routeTable;
        this.config = config;
        this.dispatcher = new RouteDispatcher(routeTable, config);
    }

    public static Builder builder() {
        return new Builder();
    }

    public CompletionStage<Response> dispatch(final Request request) {
        return dispatcher.dispatch(request);
    }

    public RouteTable getRouteTable() {
        return routeTable;
    }

    public DispatcherConfig getConfig() {
        return config;
    }

    public RouteDispatcher getDispatcher() {
        return dispatcher;
    }

    public static final class Builder {

        private Path routesDirectory;
        private RouteModuleLoader moduleLoader = new ClassNameRouteModuleLoader();
        private final DispatcherConfig.Builder config = DispatcherConfig.builder();

        private Builder() {
        }

        public Builder setRoutesDirectory(final Path routesDirectory) {
            this.routesDirectory = routesDirectory;
            return this;
        }

        public Builder setPrefix(final String prefix) {
            config.setPrefix(prefix);
            return this;
        }

        public Builder addGlobalMiddleware(final Middleware middleware) {
            config.addGlobalMiddleware(middleware);
            return this;
        }

        public Builder setDebug(final boolean debug) {
            config.setDebug(debug);
            return this;
        }

        public Builder setModuleLoader(final RouteModuleLoader moduleLoader) {
            if (moduleLoader == null) {
                throw RouteKitMessages.MESSAGES.argumentCannotBeNull("moduleLoader");
            }
            this.moduleLoader = moduleLoader;
            return this;
        }

        public Builder setTitle(final String title) {
            config.setTitle(title);
            return this;
        }

        public Builder setVersion(final String version) {
            config.setVersion(version);
            return this;
        }

        public Builder setDescription(final String description) {
            config.setDescription(description);
            return this;
        }

        /**
         * Compiles the routes directory and builds every pipeline.
         *
         * @throws RouteConfigurationException if the routes directory has configuration errors
         */
        public RouteKit build() {
            if (routesDirectory == null) {
                throw RouteKitMessages.MESSAGES.routesDirectoryRequired();
            }
            final DispatcherConfig dispatcherConfig = config.build();
            final RouteTable table = new RouteCompiler(routesDirectory, dispatcherConfig.getPrefix(), moduleLoader)
                    .compile()
                    .getOrThrow();
            return new RouteKit(table, dispatcherConfig);
        }
    }
}
