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

package io.routekit.validation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.routekit.RouteKitMessages;
import io.routekit.util.Json;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.hibernate.validator.messageinterpolation.ParameterMessageInterpolator;

/**
 * A {@link Schema} that binds the raw value to a Java type with Jackson and then checks its Jakarta Bean Validation
 * constraints.
 * <p>
 * A value that cannot be bound is reported as a single issue with an empty path. Constraint violations are reported
 * one issue each, ordered by property path.
 *
 * @param <T> the bound type
 */
public final class BeanValidationSchema<T> implements Schema<T> {

    private static final Comparator<ValidationIssue> ISSUE_ORDER = Comparator.comparing(ValidationIssue::getPath)
            .thenComparing(ValidationIssue::getMessage, Comparator.nullsFirst(Comparator.naturalOrder()));

    private static volatile Validator defaultValidator;

    private final Class<T> type;
    private final Validator validator;
    private final ObjectMapper mapper;

    private BeanValidationSchema(final Class<T> type, final Validator validator, final ObjectMapper mapper) {
        this.type = type;
        this.validator = validator;
        this.mapper = mapper;
    }

    public static <T> BeanValidationSchema<T> of(final Class<T> type) {
        return of(type, defaultValidator());
    }

    public static <T> BeanValidationSchema<T> of(final Class<T> type, final Validator validator) {
        if (type == null) {
            throw RouteKitMessages.MESSAGES.argumentCannotBeNull("type");
        }
        if (validator == null) {
            throw RouteKitMessages.MESSAGES.argumentCannotBeNull("validator");
        }
        return new BeanValidationSchema<>(type, validator, Json.mapper());
    }

    @Override
    public ParseResult<T> parse(final Object value) {
        if (value == null) {
            return ParseResult.failure(List.of(new ValidationIssue("", "must not be null")));
        }
        final T bound;
        try {
            bound = mapper.convertValue(value, type);
        } catch (IllegalArgumentException e) {
            final Throwable cause = e.getCause();
            final String message = cause instanceof JsonProcessingException ? ((JsonProcessingException) cause).getOriginalMessage() : e.getMessage();
            return ParseResult.failure(List.of(new ValidationIssue("", message)));
        }
        final Set<ConstraintViolation<T>> violations = validator.validate(bound);
        if (violations.isEmpty()) {
            return ParseResult.success(bound);
        }
        final List<ValidationIssue> issues = new ArrayList<>(violations.size());
        for (ConstraintViolation<T> violation : violations) {
            issues.add(new ValidationIssue(violation.getPropertyPath().toString(), violation.getMessage()));
        }
        issues.sort(ISSUE_ORDER);
        return ParseResult.failure(issues);
    }

    public Class<T> getType() {
        return type;
    }

    private static Validator defaultValidator() {
        Validator validator = defaultValidator;
        if (validator == null) {
            synchronized (BeanValidationSchema.class) {
                validator = defaultValidator;
                if (validator == null) {
                    //no expression language on the class path, so messages are interpolated from parameters only
                    ValidatorFactory factory = Validation.byDefaultProvider()
                            .configure()
                            .messageInterpolator(new ParameterMessageInterpolator())
                            .buildValidatorFactory();
                    defaultValidator = validator = factory.getValidator();
                }
            }
        }
        return validator;
    }
}
