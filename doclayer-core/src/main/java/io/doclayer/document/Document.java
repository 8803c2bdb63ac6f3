/*
 * Document.java
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
import io.doclayer.document.driver.DeleteResult;
import io.doclayer.document.driver.WriteResult;
import io.doclayer.document.logging.LogMessageKeys;
import io.doclayer.document.metadata.DocumentType;
import io.doclayer.document.metadata.Schema;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * An instance of a registered {@link DocumentType}. Documents are created through
 * {@link DocumentCollection#create(Map)} or read through the {@code find} methods of a collection.
 *
 * <p>
 * A document is either <em>transient</em> (never written, or deleted) or <em>created</em>. Assignments are tracked,
 * so that committing a created document only writes the changed fields. Every store operation is asynchronous; see
 * {@link DocumentLayer#asyncToSync(CompletableFuture)} for waiting on one.
 * </p>
 *
 * <pre>
 * Document student = students.create(Map.of("name", "Ada"));
 * layer.asyncToSync(student.commit());
 * student.set("name", "Ada Lovelace");
 * layer.asyncToSync(student.commit());
 * </pre>
 *
 * <p>
 * Two created documents are equal when they have the same concrete type and identity. A transient document is only
 * equal to itself, so its hash code changes when it is inserted.
 * </p>
 */
@API(API.Status.STABLE)
public class Document {
    @Nonnull
    private final DocumentCollection collection;
    @Nonnull
    private final DocumentState state;

    Document(@Nonnull DocumentCollection collection, @Nonnull DocumentState state) {
        this.collection = collection;
        this.state = state;
    }

    /**
     * Get the collection of the concrete type of this document.
     * @return the collection of this document's type
     */
    @Nonnull
    public DocumentCollection getCollection() {
        return collection;
    }

    @Nonnull
    public DocumentType getType() {
        return state.getType();
    }

    @API(API.Status.INTERNAL)
    @Nonnull
    public DocumentState getState() {
        return state;
    }

    @Nullable
    public Object getId() {
        return state.getIdentity();
    }

    public boolean isCreated() {
        return state.isCreated();
    }

    @Nullable
    public Object get(@Nonnull String fieldName) {
        return state.get(fieldName);
    }

    @Nullable
    public TrackedList getList(@Nonnull String fieldName) {
        return valueAs(fieldName, TrackedList.class);
    }

    @Nullable
    public EmbeddedDocument getEmbedded(@Nonnull String fieldName) {
        return valueAs(fieldName, EmbeddedDocument.class);
    }

    @Nullable
    public Reference getReference(@Nonnull String fieldName) {
        return valueAs(fieldName, Reference.class);
    }

    /**
     * Assign a field. Maps assigned to embedded fields become {@link EmbeddedDocument}s, collections assigned to list
     * fields become {@link TrackedList}s, and documents or identities assigned to reference fields become
     * {@link Reference}s. Values are not validated until the document is validated or committed.
     * @param fieldName the in-memory field name
     * @param value the new value; {@code null} removes the value
     * @return this document
     * @throws DocumentLayerArgumentException if the type has no such field, or the identity of a created document
     * is assigned
     */
    @Nonnull
    public Document set(@Nonnull String fieldName, @Nullable Object value) {
        state.set(fieldName, value);
        return this;
    }

    @Nonnull
    public Document unset(@Nonnull String fieldName) {
        state.set(fieldName, null);
        return this;
    }

    public boolean isDirty() {
        return state.isDirty();
    }

    @Nonnull
    public Set<String> getDirtyFields() {
        return state.getDirtyFields();
    }

    /**
     * Build the storage payload of this document.
     * @param partial whether to build the update directive for the dirty fields instead of the full payload
     * @return the payload, or {@code null} for a partial payload when nothing is dirty
     * @see DocumentState#toPayload(boolean)
     */
    @Nullable
    public Map<String, Object> toPayload(boolean partial) {
        return state.toPayload(partial);
    }

    /**
     * Insert this document if it is transient, or write its dirty fields if it is created. Committing a created
     * document without dirty fields does nothing.
     * @return a future with the result of the write, or {@code null} if nothing was written
     */
    @Nonnull
    public CompletableFuture<WriteResult> commit() {
        return commit(null);
    }

    /**
     * Write the dirty fields of this created document, provided the stored document also matches the given
     * conditions. If it does not, the future fails with {@link UpdateException} and the document stays dirty.
     * @param conditions a query in in-memory field names, or {@code null}
     * @return a future with the result of the write, or {@code null} if nothing was written
     * @throws DocumentLayerArgumentException if conditions are given for a transient document
     */
    @Nonnull
    public CompletableFuture<WriteResult> commit(@Nullable Map<String, ?> conditions) {
        return lifecycle().commit(this, conditions);
    }

    @Nonnull
    public CompletableFuture<DeleteResult> delete() {
        return delete(null);
    }

    /**
     * Delete this created document from the store, provided the stored document also matches the given conditions.
     * A deleted document is transient again and a later commit inserts it under a new identity.
     * @param conditions a query in in-memory field names, or {@code null}
     * @return a future with the result of the delete
     */
    @Nonnull
    public CompletableFuture<DeleteResult> delete(@Nullable Map<String, ?> conditions) {
        return lifecycle().delete(this, conditions);
    }

    /**
     * Replace the values of this created document with those in the store, discarding uncommitted changes.
     * @return a future that completes when the values have been replaced
     */
    @Nonnull
    public CompletableFuture<Void> reload() {
        return lifecycle().reload(this);
    }

    /**
     * Run structural and asynchronous validation without writing: every field of a transient document, the dirty
     * fields of a created one. Uniqueness is only checked on commit.
     * @return a future that fails with {@link io.doclayer.document.validation.ValidationException} if the document
     * is not valid
     */
    @Nonnull
    public CompletableFuture<Void> ioValidate() {
        return ioValidate(false);
    }

    @Nonnull
    public CompletableFuture<Void> ioValidate(boolean validateAll) {
        return lifecycle().ioValidate(this, validateAll);
    }

    @Nonnull
    private DocumentLifecycleController lifecycle() {
        return collection.getLayer().getLifecycleController();
    }

    @Nullable
    private <T> T valueAs(@Nonnull String fieldName, @Nonnull Class<T> valueClass) {
        final Object value = state.get(fieldName);
        if (value != null && !valueClass.isInstance(value)) {
            throw new DocumentLayerArgumentException("field does not hold the requested kind of value",
                    LogMessageKeys.DOCUMENT_TYPE, getType().getName(),
                    LogMessageKeys.FIELD_NAME, fieldName,
                    LogMessageKeys.FIELD_KIND, getType().getSchema().getField(fieldName).getKind());
        }
        return valueClass.cast(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final Document document = (Document)o;
        return isCreated() && document.isCreated()
               && getType().getName().equals(document.getType().getName())
               && Objects.equals(getId(), document.getId());
    }

    @Override
    public int hashCode() {
        return isCreated() ? Objects.hash(getType().getName(), getId()) : System.identityHashCode(this);
    }

    @Override
    public String toString() {
        return getType().getName() + "(" + Schema.ID_FIELD + "=" + getId() + ")";
    }
}
