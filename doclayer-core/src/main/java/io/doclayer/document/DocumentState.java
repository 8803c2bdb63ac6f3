/*
 * DocumentState.java
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
import io.doclayer.document.metadata.DocumentType;
import io.doclayer.document.metadata.FieldDescriptor;
import io.doclayer.document.metadata.FieldKind;
import io.doclayer.document.metadata.Schema;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * The mutable state behind a {@link Document}: its field values, the set of fields changed since the last load or
 * commit, and whether it exists in the store.
 *
 * <p>
 * Field values are mutated by the application through the document. Everything else (the created flag, the
 * identity after an insert, the dirty set after a write) is only changed by the transition methods, which the
 * lifecycle controller calls from the final stage of an operation. There is no locking: a document is not meant to
 * be mutated by several threads at once.
 * </p>
 */
@API(API.Status.INTERNAL)
public class DocumentState {
    @Nonnull
    private final DocumentType type;
    @Nonnull
    private final PayloadTranslator translator;
    @Nonnull
    private Map<String, Object> values;
    @Nonnull
    private volatile Set<String> dirtyFields = new LinkedHashSet<>();
    private volatile boolean created;

    private DocumentState(@Nonnull DocumentType type, @Nonnull PayloadTranslator translator,
                          @Nonnull Map<String, Object> values, boolean created) {
        this.type = type;
        this.translator = translator;
        this.values = values;
        this.created = created;
    }

    /**
     * Create the state of a new document. Defaults are applied first, then the given values are assigned and marked
     * dirty.
     * @param type the type of the document
     * @param translator the translator converting assigned values
     * @param initialValues values keyed by in-memory field name
     * @return a new transient state
     */
    @Nonnull
    static DocumentState newTransient(@Nonnull DocumentType type, @Nonnull PayloadTranslator translator,
                                      @Nonnull Map<String, ?> initialValues) {
        final Map<String, Object> values = new LinkedHashMap<>();
        for (FieldDescriptor field : type.getSchema().getFieldDescriptors()) {
            final Object initial = translator.initialValue(field);
            if (initial != null) {
                values.put(field.getName(), initial);
            }
        }
        final DocumentState state = new DocumentState(type, translator, values, false);
        initialValues.forEach(state::set);
        return state;
    }

    /**
     * Create the state of a document read from the store.
     * @param type the concrete type of the document
     * @param translator the translator converting stored values
     * @param stored the stored document
     * @return a new created state with no dirty fields
     */
    @Nonnull
    static DocumentState loaded(@Nonnull DocumentType type, @Nonnull PayloadTranslator translator,
                                @Nonnull Map<String, Object> stored) {
        return new DocumentState(type, translator, translator.fromStorage(type.getSchema(), stored), true);
    }

    @Nonnull
    public DocumentType getType() {
        return type;
    }

    public boolean isCreated() {
        return created;
    }

    @Nullable
    public Object getIdentity() {
        return values.get(Schema.ID_FIELD);
    }

    @Nullable
    public Object get(@Nonnull String fieldName) {
        requireField(fieldName);
        return values.get(fieldName);
    }

    /**
     * Get the values held by the document, keyed by in-memory field name.
     * @return an unmodifiable view of the values
     */
    @Nonnull
    public Map<String, Object> getValues() {
        return Collections.unmodifiableMap(values);
    }

    /**
     * Assign a field and mark it dirty. Assigning {@code null} removes the value.
     * @param fieldName the in-memory field name
     * @param value the new value
     * @throws DocumentLayerArgumentException if the type has no such field, or if the identity of a created document
     * is changed
     */
    public void set(@Nonnull String fieldName, @Nullable Object value) {
        final FieldDescriptor field = requireField(fieldName);
        if (field.getKind() == FieldKind.IDENTITY && created) {
            throw new DocumentLayerArgumentException("the identity of a created document cannot be changed",
                    LogMessageKeys.DOCUMENT_TYPE, type.getName(),
                    LogMessageKeys.IDENTITY, getIdentity());
        }
        if (value == null) {
            values.remove(fieldName);
        } else {
            values.put(fieldName, translator.toFieldValue(field, value));
        }
        dirtyFields.add(fieldName);
    }

    /**
     * Mark a field as changed without assigning it, for example after changing a mutable value in place.
     * @param fieldName the in-memory field name
     */
    public void markDirty(@Nonnull String fieldName) {
        requireField(fieldName);
        dirtyFields.add(fieldName);
    }

    /**
     * Get the fields changed since the document was loaded or last committed, in schema order. Fields holding a
     * modified {@link TrackedList} or {@link EmbeddedDocument} count as changed.
     * @return the names of the dirty fields
     */
    @Nonnull
    public Set<String> getDirtyFields() {
        final Set<String> explicit = dirtyFields;
        final Set<String> dirty = new LinkedHashSet<>();
        for (String fieldName : type.getSchema().getFields().keySet()) {
            final Object value = values.get(fieldName);
            if (explicit.contains(fieldName)
                    || value instanceof TrackedList && ((TrackedList)value).isModified()
                    || value instanceof EmbeddedDocument && ((EmbeddedDocument)value).isModified()) {
                dirty.add(fieldName);
            }
        }
        return dirty;
    }

    public boolean isDirty() {
        return !getDirtyFields().isEmpty();
    }

    /**
     * Build the storage payload of the document.
     *
     * <p>
     * The full payload ({@code partial == false}) holds every present value under its storage attribute, the
     * identity once one is assigned and, for polymorphic types, the discriminator. The partial payload is an update
     * directive with the dirty fields only: present values under {@code $set}, removed values under {@code $unset}.
     * </p>
     *
     * @param partial whether to build the update directive instead of the full payload
     * @return the payload, or {@code null} for a partial payload of a document with no dirty fields
     */
    @Nullable
    public Map<String, Object> toPayload(boolean partial) {
        if (!partial) {
            final Map<String, Object> payload = translator.toStorage(type.getSchema(), values);
            if (type.isPolymorphic()) {
                payload.put(Schema.DISCRIMINATOR_ATTRIBUTE, type.getDiscriminator());
            }
            return payload;
        }
        final Set<String> dirty = getDirtyFields();
        if (dirty.isEmpty()) {
            return null;
        }
        final Map<String, Object> setValues = new LinkedHashMap<>();
        final Map<String, Object> unsetValues = new LinkedHashMap<>();
        for (String fieldName : dirty) {
            final FieldDescriptor field = type.getSchema().getField(fieldName);
            final Object value = values.get(fieldName);
            if (value == null) {
                unsetValues.put(field.getAttribute(), "");
            } else {
                setValues.put(field.getAttribute(), translator.toStorageValue(field, value));
            }
        }
        final Map<String, Object> payload = new LinkedHashMap<>();
        if (!setValues.isEmpty()) {
            payload.put("$set", setValues);
        }
        if (!unsetValues.isEmpty()) {
            payload.put("$unset", unsetValues);
        }
        return payload;
    }

    /**
     * Record a successful insert.
     * @param identity the identity the document was stored under
     * @param committedFields the fields whose values were written
     */
    void markCreated(@Nonnull Object identity, @Nonnull Collection<String> committedFields) {
        values.put(Schema.ID_FIELD, identity);
        created = true;
        markClean(committedFields);
    }

    /**
     * Record a successful write of some fields. Fields changed again since the payload was built stay dirty.
     * @param committedFields the fields whose values were written
     */
    void markClean(@Nonnull Collection<String> committedFields) {
        for (String fieldName : committedFields) {
            final Object value = values.get(fieldName);
            if (value instanceof TrackedList) {
                ((TrackedList)value).clearModified();
            } else if (value instanceof EmbeddedDocument) {
                ((EmbeddedDocument)value).clearModified();
            }
        }
        final Set<String> remaining = new LinkedHashSet<>(dirtyFields);
        remaining.removeAll(committedFields);
        dirtyFields = remaining;
    }

    /**
     * Record a successful delete. The document keeps its values and can be inserted again.
     */
    void markDeleted() {
        values.remove(Schema.ID_FIELD);
        created = false;
    }

    /**
     * Replace all values with those read from the store.
     * @param stored the stored document
     */
    void reloadFrom(@Nonnull Map<String, Object> stored) {
        values = translator.fromStorage(type.getSchema(), stored);
        dirtyFields = new LinkedHashSet<>();
        created = true;
    }

    @Nonnull
    private FieldDescriptor requireField(@Nonnull String fieldName) {
        final FieldDescriptor field = type.getSchema().getField(fieldName);
        if (field == null) {
            throw new DocumentLayerArgumentException("unknown field",
                    LogMessageKeys.DOCUMENT_TYPE, type.getName(),
                    LogMessageKeys.FIELD_NAME, fieldName);
        }
        return field;
    }

    @Override
    public String toString() {
        return type.getName() + (created ? "" : "(transient)") + values;
    }
}
