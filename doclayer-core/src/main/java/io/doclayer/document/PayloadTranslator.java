/*
 * PayloadTranslator.java
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
import io.doclayer.document.metadata.FieldKind;
import io.doclayer.document.metadata.Schema;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts field values between three forms: values as the application assigns them (maps, collections, documents),
 * values as documents hold them ({@link EmbeddedDocument}, {@link TrackedList}, {@link Reference}), and values as the
 * store holds them (nested maps keyed by storage attribute, lists, identities).
 *
 * <p>
 * Values that cannot be converted are kept as they are, so that structural validation can report them against the
 * field instead of failing the assignment.
 * </p>
 */
@API(API.Status.INTERNAL)
public class PayloadTranslator {
    @Nonnull
    private final DocumentLayer layer;

    PayloadTranslator(@Nonnull DocumentLayer layer) {
        this.layer = layer;
    }

    /**
     * Convert a value assigned by the application into the form a document holds.
     * @param field the field the value is assigned to
     * @param value the assigned value
     * @return the converted value
     */
    @Nullable
    public Object toFieldValue(@Nonnull FieldDescriptor field, @Nullable Object value) {
        if (value == null) {
            return null;
        }
        switch (field.getKind()) {
            case EMBEDDED:
                return value instanceof Map ? toEmbedded(field.getNestedSchema(), (Map<?, ?>)value) : value;
            case LIST:
                return value instanceof Collection ? toList(field.getElementField(), (Collection<?>)value) : value;
            case REFERENCE:
                return toReference(field, value);
            default:
                return value;
        }
    }

    @Nonnull
    EmbeddedDocument newEmbedded(@Nonnull Schema schema) {
        final EmbeddedDocument embedded = new EmbeddedDocument(schema, this);
        for (FieldDescriptor field : schema.getFieldDescriptors()) {
            final Object initial = initialValue(field);
            if (initial != null) {
                embedded.load(field.getName(), initial);
            }
        }
        return embedded;
    }

    /**
     * Get the value a field starts out with: its default if it has one, otherwise an implicit empty list for list
     * fields.
     * @param field the field
     * @return the initial value, or {@code null}
     */
    @Nullable
    Object initialValue(@Nonnull FieldDescriptor field) {
        if (field.hasDefaultValue()) {
            return toFieldValue(field, field.newDefaultValue());
        }
        if (field.getKind() == FieldKind.LIST) {
            return new TrackedList(field.getElementField(), this, true);
        }
        return null;
    }

    @Nonnull
    private EmbeddedDocument toEmbedded(@Nonnull Schema schema, @Nonnull Map<?, ?> values) {
        final EmbeddedDocument embedded = newEmbedded(schema);
        for (Map.Entry<?, ?> entry : values.entrySet()) {
            embedded.set(String.valueOf(entry.getKey()), entry.getValue());
        }
        return embedded;
    }

    @Nonnull
    private TrackedList toList(@Nonnull FieldDescriptor elementField, @Nonnull Collection<?> elements) {
        final TrackedList list = new TrackedList(elementField, this, false);
        for (Object element : elements) {
            list.load(toFieldValue(elementField, element));
        }
        return list;
    }

    @Nonnull
    private Object toReference(@Nonnull FieldDescriptor field, @Nonnull Object value) {
        if (value instanceof Reference || value instanceof Map || value instanceof Collection) {
            return value;
        }
        if (value instanceof Document) {
            final Document document = (Document)value;
            if (!document.isCreated()) {
                throw new DocumentLayerArgumentException("a referenced document must be created first",
                        LogMessageKeys.FIELD_NAME, field.getName(),
                        LogMessageKeys.DOCUMENT_TYPE, document.getType().getName());
            }
            return new Reference(document.getCollection(), document.getId());
        }
        return new Reference(layer.collection(field.getReferenceType()), value);
    }

    /**
     * Convert the values held by a document or embedded document into a storage map.
     * @param schema the schema describing the values
     * @param values the values, keyed by in-memory field name
     * @return a new map keyed by storage attribute, without absent values and untouched implicit lists
     */
    @Nonnull
    public Map<String, Object> toStorage(@Nonnull Schema schema, @Nonnull Map<String, Object> values) {
        final Map<String, Object> stored = new LinkedHashMap<>();
        for (FieldDescriptor field : schema.getFieldDescriptors()) {
            final Object value = values.get(field.getName());
            if (value == null || value instanceof TrackedList && ((TrackedList)value).isImplicit()) {
                continue;
            }
            stored.put(field.getAttribute(), toStorageValue(field, value));
        }
        return stored;
    }

    /**
     * Convert one value held by a document into its storage form.
     * @param field the field holding the value
     * @param value the value
     * @return the storage value
     */
    @Nullable
    public Object toStorageValue(@Nonnull FieldDescriptor field, @Nullable Object value) {
        if (value instanceof EmbeddedDocument) {
            return ((EmbeddedDocument)value).toStorage();
        }
        if (value instanceof TrackedList) {
            final List<Object> stored = new ArrayList<>();
            for (Object element : (TrackedList)value) {
                stored.add(toStorageValue(field.getKind() == FieldKind.LIST ? field.getElementField() : field, element));
            }
            return stored;
        }
        if (value instanceof Reference) {
            return ((Reference)value).getId();
        }
        if (value instanceof Document) {
            return ((Document)value).getId();
        }
        return value;
    }

    /**
     * Convert a storage map into the values held by a document or embedded document. Attributes the schema does not
     * describe are dropped. List fields missing from the store get an implicit empty list.
     * @param schema the schema describing the values
     * @param stored the storage map
     * @return a new map keyed by in-memory field name
     */
    @Nonnull
    public Map<String, Object> fromStorage(@Nonnull Schema schema, @Nonnull Map<?, ?> stored) {
        final Map<String, Object> values = new LinkedHashMap<>();
        for (FieldDescriptor field : schema.getFieldDescriptors()) {
            final Object value = fromStorageValue(field, stored.get(field.getAttribute()));
            if (value != null) {
                values.put(field.getName(), value);
            } else if (field.getKind() == FieldKind.LIST) {
                values.put(field.getName(), new TrackedList(field.getElementField(), this, true));
            }
        }
        return values;
    }

    @Nullable
    private Object fromStorageValue(@Nonnull FieldDescriptor field, @Nullable Object stored) {
        if (stored == null) {
            return null;
        }
        switch (field.getKind()) {
            case EMBEDDED:
                if (stored instanceof Map) {
                    final EmbeddedDocument embedded = new EmbeddedDocument(field.getNestedSchema(), this);
                    fromStorage(field.getNestedSchema(), (Map<?, ?>)stored).forEach(embedded::load);
                    return embedded;
                }
                return stored;
            case LIST:
                if (stored instanceof Collection) {
                    final TrackedList list = new TrackedList(field.getElementField(), this, false);
                    for (Object element : (Collection<?>)stored) {
                        list.load(fromStorageValue(field.getElementField(), element));
                    }
                    return list;
                }
                return stored;
            case REFERENCE:
                if (stored instanceof Map || stored instanceof Collection) {
                    return stored;
                }
                return new Reference(layer.collection(field.getReferenceType()), stored);
            default:
                return stored;
        }
    }
}
