/*
 * DocumentDriver.java
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

package io.doclayer.document.driver;

import io.doclayer.annotation.API;
import io.doclayer.document.metadata.IndexDescriptor;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * The contract between the document layer and a document store.
 *
 * <p>
 * Documents, queries and update directives are plain maps in storage form: storage attribute names as keys, nested
 * maps for embedded documents, lists for arrays, and {@code $}-prefixed operators. Every call names its collection;
 * the layer keeps no implicit connection state.
 * </p>
 *
 * <p>
 * Failures are reported by completing the returned future exceptionally, normally with a
 * {@link DocumentDriverException}. The layer passes such failures through unchanged.
 * </p>
 */
@API(API.Status.STABLE)
public interface DocumentDriver {
    /**
     * Insert one document.
     * @param collection the name of the collection
     * @param document the document, which must contain the identity attribute
     * @return a future with the identity of the inserted document
     */
    @Nonnull
    CompletableFuture<InsertResult> insert(@Nonnull String collection, @Nonnull Map<String, Object> document);

    /**
     * Apply an update directive to the first document matching a query.
     * @param collection the name of the collection
     * @param query the query selecting the document
     * @param update an update directive such as <code>{"$set": {...}, "$unset": {...}}</code>
     * @param upsert whether to insert a document built from the query and the directive if none matches
     * @return a future with the number of matched and modified documents
     */
    @Nonnull
    CompletableFuture<UpdateResult> update(@Nonnull String collection, @Nonnull Map<String, Object> query,
                                           @Nonnull Map<String, Object> update, boolean upsert);

    /**
     * Delete the first document matching a query.
     * @param collection the name of the collection
     * @param query the query selecting the document
     * @return a future with the number of deleted documents
     */
    @Nonnull
    CompletableFuture<DeleteResult> delete(@Nonnull String collection, @Nonnull Map<String, Object> query);

    /**
     * Read all documents matching a query, in store order, honoring the limit and skip of the options.
     * @param collection the name of the collection
     * @param query the query
     * @param options limit and skip
     * @return a future with the matching documents
     */
    @Nonnull
    CompletableFuture<List<Map<String, Object>>> find(@Nonnull String collection, @Nonnull Map<String, Object> query,
                                                      @Nonnull FindOptions options);

    /**
     * Read one batch of documents matching a query.
     * @param collection the name of the collection
     * @param query the query, which must be the same for every batch of one read
     * @param options limit, skip and batch size, which must be the same for every batch of one read
     * @param continuation {@code null} for the first batch, otherwise the continuation of the previous batch
     * @return a future with the batch
     */
    @Nonnull
    CompletableFuture<DriverBatch> findBatch(@Nonnull String collection, @Nonnull Map<String, Object> query,
                                             @Nonnull FindOptions options, @Nullable byte[] continuation);

    @Nonnull
    CompletableFuture<Long> count(@Nonnull String collection, @Nonnull Map<String, Object> query);

    /**
     * Create an index. Creating an index identical to an existing one does nothing; creating an index under the
     * name of an existing index with a different definition fails with {@link IndexConflictException}.
     *
     * <p>
     * A {@linkplain IndexDescriptor#isSparse() sparse} index must leave out every document that lacks any one of its
     * key paths. A store whose native sparse indexes only skip documents lacking all key paths has to express the
     * index differently, for example as a partial index that requires every key path to exist.
     * </p>
     *
     * @param collection the name of the collection
     * @param index the index to create
     * @return a future that completes when the index exists
     */
    @Nonnull
    CompletableFuture<Void> createIndex(@Nonnull String collection, @Nonnull IndexDescriptor index);

    /**
     * List the indexes of a collection, including {@link IndexDescriptor#ID_INDEX} once the collection exists.
     * @param collection the name of the collection
     * @return a future with the indexes
     */
    @Nonnull
    CompletableFuture<Set<IndexDescriptor>> listIndexes(@Nonnull String collection);

    /**
     * Drop every index of a collection except {@link IndexDescriptor#ID_INDEX}.
     * @param collection the name of the collection
     * @return a future that completes when the indexes are gone
     */
    @Nonnull
    CompletableFuture<Void> dropIndexes(@Nonnull String collection);

    /**
     * Drop a collection with all its documents and indexes.
     * @param collection the name of the collection
     * @return a future that completes when the collection is gone
     */
    @Nonnull
    CompletableFuture<Void> drop(@Nonnull String collection);
}
