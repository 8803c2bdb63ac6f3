/*
 * Schema.java
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

package io.doclayer.document.metadata;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableMap;
import io.doclayer.annotation.API;
import io.doclayer.document.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An ordered, immutable mapping from field name to {@link FieldDescriptor}.
 *
 * <p>
 * Every {@link DocumentType} owns a schema that merges the fields of all its ancestors with its own, and every
 * embedded field owns the schema of its embedded documents. Embedded schemas are created directly with
 * {@link #newBuilder(String)}; document type schemas are created when the type is registered.
 * </p>
 */
@API(API.Status.STABLE)
public class Schema {
    /**
     * The in-memory name of the identity field of every document type.
     */
    public static final String ID_FIELD = "id";
    /**
     * The storage attribute of the identity field.
     */
    public static final String ID_ATTRIBUTE = "_id";
    /**
     * The storage attribute holding the name of the concrete type of a document in a polymorphic collection.
     */
    public static final String DISCRIMINATOR_ATTRIBUTE = "_cls";

    private static final Splitter PATH_SPLITTER = Splitter.on('.');

    @Nonnull
    private final String name;
    @Nonnull
    private final ImmutableMap<String, FieldDescriptor> fields;
    @Nonnull
    private final ImmutableMap<String, FieldDescriptor> fieldsByAttribute;

    private Schema(@Nonnull String name, @Nonnull Map<String, FieldDescriptor> fields) {
        this.name = name;
        this.fields = ImmutableMap.copyOf(fields);
        final Map<String, FieldDescriptor> byAttribute = new LinkedHashMap<>();
        for (FieldDescriptor field : fields.values()) {
            final FieldDescriptor other = byAttribute.put(field.getAttribute(), field);
            if (other != null) {
                throw new MetaDataException("two fields are stored under the same attribute",
                        LogMessageKeys.SCHEMA_NAME, name,
                        LogMessageKeys.STORAGE_ATTRIBUTE, field.getAttribute(),
                        LogMessageKeys.FIELD_NAMES, List.of(other.getName(), field.getName()));
            }
        }
        this.fieldsByAttribute = ImmutableMap.copyOf(byAttribute);
    }

    @Nonnull
    public static Builder newBuilder(@Nonnull String name) {
        return new Builder(name);
    }

    @Nonnull
    public String getName() {
        return name;
    }

    @Nonnull
    public Map<String, FieldDescriptor> getFields() {
        return fields;
    }

    @Nonnull
    public Collection<FieldDescriptor> getFieldDescriptors() {
        return fields.values();
    }

    public boolean hasField(@Nonnull String fieldName) {
        return fields.containsKey(fieldName);
    }

    @Nullable
    public FieldDescriptor getField(@Nonnull String fieldName) {
        return fields.get(fieldName);
    }

    @Nullable
    public FieldDescriptor getFieldByAttribute(@Nonnull String attribute) {
        return fieldsByAttribute.get(attribute);
    }

    public boolean hasAsyncValidation() {
        return fields.values().stream().anyMatch(FieldDescriptor::hasAsyncValidation);
    }

    /**
     * Translate a dotted path of in-memory field names into the dotted path of storage attributes. The path may
     * descend through embedded fields and lists of embedded documents; list positions are kept as they are. Once the
     * path leaves the fields described by schemas (for example, into a dictionary field), the remaining segments are
     * kept as they are.
     *
     * @param path the in-memory path
     * @return the storage path, or {@code null} if the first segment is not a field of this schema
     */
    @Nullable
    public String toStoragePath(@Nonnull String path) {
        final ResolvedPath resolved = resolvePath(path);
        return resolved == null ? null : resolved.getStoragePath();
    }

    /**
     * Resolve a dotted path of in-memory field names.
     *
     * @param path the in-memory path
     * @return the resolved path, or {@code null} if the first segment is not a field of this schema
     */
    @Nullable
    public ResolvedPath resolvePath(@Nonnull String path) {
        final StringBuilder storagePath = new StringBuilder();
        Schema current = this;
        FieldDescriptor leaf = null;
        boolean described = true;
        boolean first = true;
        for (String segment : PATH_SPLITTER.split(path)) {
            if (!first) {
                storagePath.append('.');
            }
            if (!described || current == null) {
                storagePath.append(segment);
                described = false;
            } else if (leaf != null && leaf.getKind() == FieldKind.LIST && isPosition(segment)) {
                storagePath.append(segment);
            } else {
                final FieldDescriptor field = current.getField(segment);
                if (field == null) {
                    if (first) {
                        return null;
                    }
                    storagePath.append(segment);
                    described = false;
                } else {
                    storagePath.append(field.getAttribute());
                    leaf = field;
                    current = nestedSchemaOf(field);
                }
            }
            first = false;
        }
        return new ResolvedPath(storagePath.toString(), described ? leaf : null);
    }

    @Nullable
    private static Schema nestedSchemaOf(@Nonnull FieldDescriptor field) {
        if (field.getKind() == FieldKind.EMBEDDED) {
            return field.getNestedSchema();
        }
        if (field.getKind() == FieldKind.LIST && field.getElementField().getKind() == FieldKind.EMBEDDED) {
            return field.getElementField().getNestedSchema();
        }
        return null;
    }

    private static boolean isPosition(@Nonnull String segment) {
        return !segment.isEmpty() && segment.chars().allMatch(Character::isDigit);
    }

    @Override
    public String toString() {
        return name + fields.values();
    }

    /**
     * A path resolved by {@link #resolvePath(String)}.
     */
    public static class ResolvedPath {
        @Nonnull
        private final String storagePath;
        @Nullable
        private final FieldDescriptor field;

        ResolvedPath(@Nonnull String storagePath, @Nullable FieldDescriptor field) {
            this.storagePath = storagePath;
            this.field = field;
        }

        @Nonnull
        public String getStoragePath() {
            return storagePath;
        }

        /**
         * Get the descriptor of the last segment of the path.
         * @return the descriptor, or {@code null} if the path ends outside the described fields
         */
        @Nullable
        public FieldDescriptor getField() {
            return field;
        }
    }

    /**
     * A builder for {@link Schema}.
     */
    public static class Builder {
        @Nonnull
        private final String name;
        @Nonnull
        private final Map<String, FieldDescriptor> fields = new LinkedHashMap<>();

        private Builder(@Nonnull String name) {
            this.name = name;
        }

        /**
         * Add a field. Fields keep the order in which they were added.
         * @param fieldName the in-memory name of the field
         * @param field the builder describing the field
         * @return this builder
         */
        @Nonnull
        public Builder addField(@Nonnull String fieldName, @Nonnull FieldDescriptor.Builder field) {
            return addField(field.build(fieldName));
        }

        @Nonnull
        Builder addField(@Nonnull FieldDescriptor field) {
            if (fields.containsKey(field.getName())) {
                throw new MetaDataException("field declared twice",
                        LogMessageKeys.SCHEMA_NAME, name,
                        LogMessageKeys.FIELD_NAME, field.getName());
            }
            fields.put(field.getName(), field);
            return this;
        }

        @Nonnull
        Builder replaceField(@Nonnull FieldDescriptor field) {
            fields.put(field.getName(), field);
            return this;
        }

        @Nullable
        FieldDescriptor getField(@Nonnull String fieldName) {
            return fields.get(fieldName);
        }

        /**
         * Freeze the fields into a schema.
         * @return the new schema
         * @throws MetaDataException if two fields are stored under the same attribute
         */
        @Nonnull
        public Schema build() {
            return new Schema(name, fields);
        }
    }
}
