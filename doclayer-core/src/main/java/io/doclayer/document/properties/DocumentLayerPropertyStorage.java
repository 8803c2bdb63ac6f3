/*
 * DocumentLayerPropertyStorage.java
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

import com.google.common.collect.ImmutableMap;
import io.doclayer.annotation.API;
import io.doclayer.document.DocumentLayerArgumentException;
import io.doclayer.document.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.HashMap;
import java.util.Map;

/**
 * An immutable set of property values for a {@link io.doclayer.document.DocumentLayer}.
 * Create one with {@link #newBuilder()}; {@link #getEmptyInstance()} holds no values, so every key resolves to its
 * default.
 */
@API(API.Status.EXPERIMENTAL)
public final class DocumentLayerPropertyStorage {
    private static final DocumentLayerPropertyStorage EMPTY = new DocumentLayerPropertyStorage(ImmutableMap.of());

    @Nonnull
    private final ImmutableMap<DocumentLayerPropertyKey<?>, Object> propertyMap;

    private DocumentLayerPropertyStorage(@Nonnull ImmutableMap<DocumentLayerPropertyKey<?>, Object> propertyMap) {
        this.propertyMap = propertyMap;
    }

    @Nonnull
    public static DocumentLayerPropertyStorage getEmptyInstance() {
        return EMPTY;
    }

    @Nonnull
    public static Builder newBuilder() {
        return new Builder();
    }

    @Nonnull
    public ImmutableMap<DocumentLayerPropertyKey<?>, Object> getPropertyMap() {
        return propertyMap;
    }

    /**
     * Get the value of a property, falling back to the key's default value when none was set.
     *
     * @param propertyKey the key of the property
     * @param <T> the type of the property's value
     * @return the value of the property
     */
    @Nullable
    public <T> T getPropertyValue(@Nonnull DocumentLayerPropertyKey<T> propertyKey) {
        final Object value = propertyMap.get(propertyKey);
        if (value == null) {
            return propertyKey.getDefaultValue();
        }
        return propertyKey.getType().cast(value);
    }

    @Nonnull
    public Builder toBuilder() {
        return new Builder(propertyMap);
    }

    /**
     * Builder for {@link DocumentLayerPropertyStorage}.
     */
    public static class Builder {
        @Nonnull
        private final Map<DocumentLayerPropertyKey<?>, Object> propertyMap;

        private Builder() {
            this.propertyMap = new HashMap<>();
        }

        private Builder(@Nonnull Map<DocumentLayerPropertyKey<?>, Object> propertyMap) {
            this.propertyMap = new HashMap<>(propertyMap);
        }

        /**
         * Set the value of a property. Setting a property twice replaces the earlier value.
         *
         * @param propertyKey the key of the property
         * @param value the new value
         * @param <T> the type of the property's value
         * @return this builder
         */
        @Nonnull
        public <T> Builder addProp(@Nonnull DocumentLayerPropertyKey<T> propertyKey, @Nonnull T value) {
            if (!propertyKey.getType().isInstance(value)) {
                throw new DocumentLayerArgumentException("property value does not match the type of its key",
                        LogMessageKeys.PROPERTY_NAME, propertyKey.getName(),
                        LogMessageKeys.PROPERTY_TYPE, propertyKey.getType().getSimpleName());
            }
            propertyMap.put(propertyKey, value);
            return this;
        }

        @Nonnull
        public Builder removeProp(@Nonnull DocumentLayerPropertyKey<?> propertyKey) {
            propertyMap.remove(propertyKey);
            return this;
        }

        @Nonnull
        public DocumentLayerPropertyStorage build() {
            return new DocumentLayerPropertyStorage(ImmutableMap.copyOf(propertyMap));
        }
    }
}
