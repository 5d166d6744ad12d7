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

package io.routekit.examples.products.routes;

import java.util.List;
import java.util.Map;

import io.routekit.validation.ParseResult;
import io.routekit.validation.Schema;
import io.routekit.validation.ValidationIssue;

/**
 * Validates the {@code id} path parameter and turns it into a {@code Long}.
 */
final class ProductIdSchema implements Schema<Long> {

    static final ProductIdSchema INSTANCE = new ProductIdSchema();

    private ProductIdSchema() {
    }

    @Override
    public ParseResult<Long> parse(final Object value) {
        Object raw = value instanceof Map ? ((Map<?, ?>) value).get("id") : null;
        long id;
        try {
            id = Long.parseLong(String.valueOf(raw));
        } catch (NumberFormatException e) {
            return invalid();
        }
        return id > 0 ? ParseResult.success(id) : invalid();
    }

    private static ParseResult<Long> invalid() {
        return ParseResult.failure(List.of(new ValidationIssue("id", "must be a positive integer")));
    }
}
