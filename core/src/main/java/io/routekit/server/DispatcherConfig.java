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

package io.routekit.server;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import io.routekit.RouteKitMessages;
import io.routekit.middleware.Middleware;
import io.routekit.util.URLUtils;

/**
 * The immutable settings shared by the pipeline builder and the dispatcher.
 */
public final class DispatcherConfig {

    /**
     * System property that switches on debug error responses when the builder does not set the flag explicitly.
     */
    public static final String DEBUG_PROPERTY = "io.routekit.debug";

    private final String prefix;
    private final boolean debug;
    private final List<Middleware> globalMiddleware;
    private final String title;
    private final String version;
    private final String description;

    private DispatcherConfig(final Builder builder) {
        this.prefix = builder.prefix;
        this.debug = builder.debug;
        this.globalMiddleware = Collections.unmodifiableList(new ArrayList<>(builder.globalMiddleware));
        this.title = builder.title;
        this.version = builder.version;
        this.description = builder.description;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return the URL prefix without leading or trailing slashes, empty if there is none
     */
    public String getPrefix() {
        return prefix;
    }

    public boolean isDebug() {
        return debug;
    }

    public List<Middleware> getGlobalMiddleware() {
        return globalMiddleware;
    }

    public String getTitle() {
        return title;
    }

    public String getVersion() {
        return version;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public String toString() {
        return "DispatcherConfig{prefix='" + prefix + "', debug=" + debug + ", globalMiddleware=" + globalMiddleware.size() + "}";
    }

    public static final class Builder {

        private String prefix = "";
        private boolean debug = Boolean.getBoolean(DEBUG_PROPERTY);
        private final List<Middleware> globalMiddleware = new ArrayList<>();
        private String title = "API";
        private String version = "1.0.0";
        private String description;

        private Builder() {
        }

        public Builder setPrefix(final String prefix) {
            this.prefix = URLUtils.cleanPrefix(prefix);
            return this;
        }

        public Builder setDebug(final boolean debug) {
            this.debug = debug;
            return this;
        }

        public Builder addGlobalMiddleware(final Middleware middleware) {
            if (middleware == null) {
                throw RouteKitMessages.MESSAGES.argumentCannotBeNull("middleware");
            }
            globalMiddleware.add(middleware);
            return this;
        }

        public Builder setTitle(final String title) {
            this.title = title;
            return this;
        }

        public Builder setVersion(final String version) {
            this.version = version;
            return this;
        }

        public Builder setDescription(final String description) {
            this.description = description;
            return this;
        }

        public DispatcherConfig build() {
            return new DispatcherConfig(this);
        }
    }
}
