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

import org.jboss.logging.BasicLogger;
import org.jboss.logging.Logger;
import org.jboss.logging.annotations.Cause;
import org.jboss.logging.annotations.LogMessage;
import org.jboss.logging.annotations.Message;
import org.jboss.logging.annotations.MessageLogger;

import static org.jboss.logging.Logger.Level.DEBUG;
import static org.jboss.logging.Logger.Level.ERROR;
import static org.jboss.logging.Logger.Level.INFO;
import static org.jboss.logging.Logger.Level.WARN;

/**
 * log messages start at 5000
 */
@MessageLogger(projectCode = "RK")
public interface RouteKitLogger extends BasicLogger {

    RouteKitLogger COMPILER_LOGGER = Logger.getMessageLogger(RouteKitLogger.class, RouteKitLogger.class.getPackage().getName() + ".compiler");
    RouteKitLogger REQUEST_LOGGER = Logger.getMessageLogger(RouteKitLogger.class, RouteKitLogger.class.getPackage().getName() + ".request");
    /**
     * Logger for validation failures. These are client errors, so they only ever show up at debug level.
     */
    RouteKitLogger VALIDATION_LOGGER = Logger.getMessageLogger(RouteKitLogger.class, RouteKitLogger.class.getPackage().getName() + ".request.validation");

    @LogMessage(level = ERROR)
    @Message(id = 5001, value = "An exception occurred processing the request %s %s")
    void exceptionProcessingRequest(String method, String url, @Cause Throwable cause);

    @LogMessage(level = ERROR)
    @Message(id = 5002, value = "An exception occurred processing the request %s %s: %s")
    void exceptionProcessingRequestWithoutTrace(String method, String url, String message);

    @LogMessage(level = INFO)
    @Message(id = 5003, value = "Compiled %s route(s) from %s")
    void routesCompiled(int count, Path root);

    @LogMessage(level = ERROR)
    @Message(id = 5004, value = "Route configuration error: %s")
    void configurationError(String error);

    @LogMessage(level = DEBUG)
    @Message(id = 5005, value = "Registered route %s %s from %s")
    void routeRegistered(String pattern, Object methods, Path routeFile);

    @LogMessage(level = WARN)
    @Message(id = 5006, value = "Route file %s declares no handlers, every request to %s will be answered with 405")
    void routeWithoutHandlers(Path routeFile, String pattern);

    @LogMessage(level = DEBUG)
    @Message(id = 5007, value = "Request %s %s failed validation with %s field error(s)")
    void validationFailed(String method, String url, int errorCount);

    @LogMessage(level = WARN)
    @Message(id = 5008, value = "Route directory %s contains no route files, the route table is empty")
    void emptyRouteTable(Path root);

    @LogMessage(level = INFO)
    @Message(id = 5009, value = "Compiling routes from %s")
    void compilingRoutes(Path root);
}
