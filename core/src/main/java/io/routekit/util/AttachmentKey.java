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

package io.routekit.util;

/**
 * An immutable, type-safe object attachment key.  Such a key has no value outside of its object identity.
 *
 * @param <T> the attachment type
 * @author Stuart Douglas
 */
public final class AttachmentKey<T> {

    private final Class<? super T> valueClass;

    private AttachmentKey(final Class<? super T> valueClass) {
        this.valueClass = valueClass;
    }

    /**
     * Cast the value to the type of this attachment key.
     *
     * @param value the value
     * @return the cast value
     */
    @SuppressWarnings("unchecked")
    public T cast(final Object value) {
        return (T) valueClass.cast(value);
    }

    /**
     * Construct a new attachment key.
     *
     * @param valueClass the value class
     * @param <T>        the attachment type
     * @return the new instance
     */
    public static <T> AttachmentKey<T> create(final Class<? super T> valueClass) {
        return new AttachmentKey<>(valueClass);
    }

    @Override
    public String toString() {
        return "AttachmentKey<" + valueClass.getName() + ">";
    }
}
