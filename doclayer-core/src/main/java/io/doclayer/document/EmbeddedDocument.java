/*
 * EmbeddedDocument.java
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

package io.doclayer.document;

import io.doclayer.annotation.API;
import io.doclayer.document.logging.LogMessageKeys;
import io.doclayer.document.metadata.FieldDescriptor;
import io.doclayer.document.metadata.Schema;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The value of an embedded field: a nested set of values described by the field's {@link Schema}, stored inside the
 * owning document. Changes to an embedded document make the owning field dirty.
 *
 * <p>
 * Embedded documents are usually created by assigning a plain map to an embedded field. The keys of the map are
 * in-memory field names of the nested schema.
 * </p>
 */
@API(API.Status.STABLE)
public class EmbeddedDocument {
    @Nonnull
    private final Schema schema;
    @Nonnull
    private final PayloadTranslator translator;
    @Nonnull
    private final Map<String, Object> values = new LinkedHashMap<>();
    private boolean modified;

    EmbeddedDocument(@Nonnull Schema schema, @Nonnull PayloadTranslator translator) {
        this.schema = schema;
        this.translator = translator;
    }

    @Nonnull
    public Schema getSchema() {
        return schema;
    }

    @Nullable
    public Object get(@Nonnull String fieldName) {
        requireField(fieldName);
        return values.get(fieldName);
    }

    /**
     * Set a field of the embedded document. Setting {@code null} removes the value.
     * @param fieldName the in-memory name of the field
     * @param value the new value
     * @return this embedded document
     * @throws DocumentLayerArgumentException if the schema has no such field
     */
    @Nonnull
    public EmbeddedDocument set(@Nonnull String fieldName, @Nullable Object value) {
        final FieldDescriptor field = requireField(fieldName);
        if (value == null) {
            values.remove(fieldName);
        } else {
            values.put(fieldName, translator.toFieldValue(field, value));
        }
        modified = true;
        return this;
    }

    @Nonnull
    public EmbeddedDocument unset(@Nonnull String fieldName) {
        return set(fieldName, null);
    }

    @Nonnull
    public Map<String, Object> getValues() {
        return Collections.unmodifiableMap(values);
    }

    public boolean isModified() {
        if (modified) {
            return true;
        }
        for (Object value : values.values()) {
            if (value instanceof EmbeddedDocument && ((EmbeddedDocument)value).isModified()
                    || value instanceof TrackedList && ((TrackedList)value).isModified()) {
                return true;
            }
        }
        return false;
    }

    void load(@Nonnull String fieldName, @Nullable Object value) {
        if (value != null) {
            values.put(fieldName, value);
        }
    }

    void clearModified() {
        modified = false;
        for (Object value : values.values()) {
            if (value instanceof EmbeddedDocument) {
                ((EmbeddedDocument)value).clearModified();
            } else if (value instanceof TrackedList) {
                ((TrackedList)value).clearModified();
            }
        }
    }

    /**
     * Get the storage representation: storage attributes mapped to storage values.
     * @return a new map with the values of this embedded document
     */
    @Nonnull
    public Map<String, Object> toStorage() {
        return translator.toStorage(schema, values);
    }

    @Nonnull
    private FieldDescriptor requireField(@Nonnull String fieldName) {
        final FieldDescriptor field = schema.getField(fieldName);
        if (field == null) {
            throw new DocumentLayerArgumentException("unknown field of embedded document",
                    LogMessageKeys.SCHEMA_NAME, schema.getName(),
                    LogMessageKeys.FIELD_NAME, fieldName);
        }
        return field;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        EmbeddedDocument that = (EmbeddedDocument)o;
        return schema.getName().equals(that.schema.getName()) && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(schema.getName(), values);
    }

    @Override
    public String toString() {
        return schema.getName() + values;
    }
}
