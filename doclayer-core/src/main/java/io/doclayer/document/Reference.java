/*
 * Reference.java
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
import io.doclayer.document.metadata.DocumentType;
import io.doclayer.document.metadata.Schema;

import javax.annotation.Nonnull;
import java.util.Collections;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * A lazy pointer to a document: the collection of the referenced type and the identity of the document. The
 * referenced document is only read by {@link #fetch()}; assigning or validating a reference never loads it.
 */
@API(API.Status.STABLE)
public class Reference {
    @Nonnull
    private final DocumentCollection collection;
    @Nonnull
    private final Object id;

    Reference(@Nonnull DocumentCollection collection, @Nonnull Object id) {
        this.collection = collection;
        this.id = id;
    }

    /**
     * Get the type the reference points to. Documents of subtypes are reachable through the reference as well.
     * @return the referenced type
     */
    @Nonnull
    public DocumentType getDocumentType() {
        return collection.getType();
    }

    @Nonnull
    public DocumentCollection getCollection() {
        return collection;
    }

    @Nonnull
    public Object getId() {
        return id;
    }

    /**
     * Load the referenced document.
     * @return a future with the document, which fails with {@link ReferenceNotFoundException} if it does not exist
     */
    @Nonnull
    public CompletableFuture<Document> fetch() {
        return collection.findOne(id).thenApply(document -> {
            if (document == null) {
                throw new ReferenceNotFoundException(collection.getType().getName(), id);
            }
            return document;
        });
    }

    /**
     * Check whether the referenced document exists, counting only documents of the referenced type and its
     * subtypes.
     * @return a future that completes with whether the document exists
     */
    @Nonnull
    public CompletableFuture<Boolean> exists() {
        return collection.count(Collections.singletonMap(Schema.ID_FIELD, id)).thenApply(count -> count > 0);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Reference reference = (Reference)o;
        return collection.getCollectionName().equals(reference.collection.getCollectionName()) && id.equals(reference.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(collection.getCollectionName(), id);
    }

    @Override
    public String toString() {
        return "Reference(" + collection.getType().getName() + ", " + id + ")";
    }
}
