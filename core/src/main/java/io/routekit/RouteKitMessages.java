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

import org.jboss.logging.Messages;
import org.jboss.logging.annotations.Cause;
import org.jboss.logging.annotations.Message;
import org.jboss.logging.annotations.MessageBundle;

@MessageBundle(projectCode = "RK")
public interface RouteKitMessages {

    RouteKitMessages MESSAGES = Messages.getBundle(RouteKitMessages.class);

    @Message(id = 1, value = "Argument %s cannot be null")
    IllegalArgumentException argumentCannotBeNull(String argument);

    @Message(id = 2, value = "Routes directory path is required")
    IllegalArgumentException routesDirectoryRequired();

    @Message(id = 3, value = "Multiple dynamic route folders found in the same directory: '%s' conflicts with '%s' in '%s'")
    String multipleDynamicSegments(String second, String first, Path directory);

    @Message(id = 4, value = "Route '%s' in '%s' has the same pattern as route '%s' in '%s'")
    String duplicateRoutePattern(String pattern, Path directory, String existingPattern, Path existingDirectory);

    @Message(id = 5, value = "Failed to scan directory '%s': %s")
    String directoryUnreadable(Path directory, String reason);

    @Message(id = 6, value = "Failed to load route module '%s': %s")
    String moduleLoadFailed(Path routeFile, String reason);

    @Message(id = 7, value = "Dynamic route folder '%s' in '%s' has an empty parameter name")
    String emptyParameterName(String folder, Path directory);

    @Message(id = 8, value = "Parameter name '%s' is used more than once in the path of '%s'")
    String duplicateParameterName(String name, Path directory);

    @Message(id = 9, value = "The request body has already been consumed")
    IllegalStateException requestBodyAlreadyConsumed();

    @Message(id = 10, value = "Handler for %s %s returned no response")
    IllegalStateException handlerReturnedNoResponse(String method, String pattern);

    @Message(id = 11, value = "Middleware at position %s for %s %s returned no result")
    IllegalStateException middlewareReturnedNoResult(int position, String method, String pattern);

    @Message(id = 12, value = "Route compilation failed with %s error(s): %s")
    String routeCompilationFailed(int count, String errors);

    @Message(id = 13, value = "Failed to decode url %s to %s")
    IllegalArgumentException failedToDecodeURL(String s, String enc, @Cause Exception e);

    @Message(id = 14, value = "Route file does not declare the '%s' property")
    String missingModuleClassProperty(String property);

    @Message(id = 15, value = "Class %s does not implement %s")
    String notARouteModule(String className, String expected);

    @Message(id = 16, value = "Expected Content-Type application/json but received %s")
    String unexpectedContentType(String contentType);

    @Message(id = 17, value = "Invalid JSON body: %s")
    String invalidJsonBody(String reason);

    @Message(id = 18, value = "Compilation result holds neither a route table nor errors")
    IllegalStateException emptyCompilationResult();

    @Message(id = 19, value = "Transform at depth %s for %s %s returned no response")
    IllegalStateException transformReturnedNoResponse(int depth, String method, String pattern);

    @Message(id = 20, value = "Route pattern must start with '/': %s")
    IllegalArgumentException patternMustStartWithSlash(String pattern);

    @Message(id = 21, value = "Invalid status code %s")
    IllegalArgumentException invalidStatusCode(int status);
}
