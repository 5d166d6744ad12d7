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

import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import io.routekit.RouteKitMessages;

/**
 * Loads route modules from {@code route.properties} files of the form
 *
 * <pre>
 * class=com.example.api.products.ProductsRoute
 * </pre>
 *
 * The named class must implement {@link RouteModule} and have a public no-arg constructor.
 */
public class ClassNameRouteModuleLoader implements RouteModuleLoader {

    public static final String CLASS_PROPERTY = "class";

    private final ClassLoader classLoader;

    public ClassNameRouteModuleLoader() {
        this(ClassNameRouteModuleLoader.class.getClassLoader());
    }

    public ClassNameRouteModuleLoader(final ClassLoader classLoader) {
        if (classLoader == null) {
            throw RouteKitMessages.MESSAGES.argumentCannotBeNull("classLoader");
        }
        this.classLoader = classLoader;
    }

    @Override
    public RouteModule load(final Path routeFile, final Path relativeDirectory) throws Exception {
        final Properties properties = new Properties();
        try (Reader reader = Files.newBufferedReader(routeFile, StandardCharsets.UTF_8)) {
            properties.load(reader);
        }
        final String className = properties.getProperty(CLASS_PROPERTY);
        if (className == null || className.trim().isEmpty()) {
            throw new IllegalStateException(RouteKitMessages.MESSAGES.missingModuleClassProperty(CLASS_PROPERTY));
        }
        final Class<?> type = Class.forName(className.trim(), true, classLoader);
        if (!RouteModule.class.isAssignableFrom(type)) {
            throw new IllegalStateException(RouteKitMessages.MESSAGES.notARouteModule(type.getName(), RouteModule.class.getName()));
        }
        return type.asSubclass(RouteModule.class).getDeclaredConstructor().newInstance();
    }
}
