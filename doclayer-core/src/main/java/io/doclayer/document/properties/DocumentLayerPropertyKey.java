/*
 * DocumentLayerPropertyKey.java
 *
 * This source file is part of the FoundationDB open source project
 *
 * Copyright 2015-2024 Apple Inc. and the FoundationDB project authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.doclayer.document.properties;

import io.doclayer.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * A typed key for a property that tunes the behavior of a {@link io.doclayer.document.DocumentLayer}.
 * Values for the keys are held by a {@link DocumentLayerPropertyStorage}; a key that has no value there resolves to
 * its default value.
 *
 * @param <T> the type of the property's values
 */
@API(API.Status.EXPERIMENTAL)
public final class DocumentLayerPropertyKey<T> {
    @Nonnull
    private final String name;
    @Nonnull
    private final Class<T> type;
    @Nullable
    private final T defaultValue;

    public DocumentLayerPropertyKey(@Nonnull String name, @Nonnull Class<T> type, @Nullable T defaultValue) {
        this.name = name;
        this.type = type;
        this.defaultValue = defaultValue;
    }

    @Nonnull
    public String getName() {
        return name;
    }

    @Nonnull
    public Class<T> getType() {
        return type;
    }

    @Nullable
    public T getDefaultValue() {
        return defaultValue;
    }

    @Nonnull
    public static DocumentLayerPropertyKey<Boolean> booleanPropertyKey(@Nonnull String name, boolean defaultValue) {
        return new DocumentLayerPropertyKey<>(name, Boolean.class, defaultValue);
    }

    @Nonnull
    public static DocumentLayerPropertyKey<Integer> integerPropertyKey(@Nonnull String name, int defaultValue) {
        return new DocumentLayerPropertyKey<>(name, Integer.class, defaultValue);
    }

    @Nonnull
    public static DocumentLayerPropertyKey<Long> longPropertyKey(@Nonnull String name, long defaultValue) {
        return new DocumentLayerPropertyKey<>(name, Long.class, defaultValue);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        DocumentLayerPropertyKey<?> that = (DocumentLayerPropertyKey<?>)o;
        return name.equals(that.name) && type.equals(that.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type);
    }

    @Override
    public String toString() {
        return name + "(" + type.getSimpleName() + ")";
    }
}
