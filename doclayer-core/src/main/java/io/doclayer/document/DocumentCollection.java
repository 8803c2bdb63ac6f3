/*
 * DocumentCollection.java
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
import io.doclayer.async.MoreAsyncUtil;
import io.doclayer.document.driver.FindOptions;
import io.doclayer.document.logging.KeyValueLogMessage;
import io.doclayer.document.logging.LogMessageKeys;
import io.doclayer.document.metadata.BoundIndex;
import io.doclayer.document.metadata.DocumentType;
import io.doclayer.document.metadata.IndexDescriptor;
import io.doclayer.document.metadata.Schema;
import io.doclayer.document.properties.DocumentLayerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * The entry point for the documents of one {@link DocumentType}: creating new documents, querying stored ones, and
 * managing indexes. Obtained from {@link DocumentLayer#register(io.doclayer.document.metadata.DocumentTypeBuilder)} or
 * {@link DocumentLayer#collection(String)}.
 *
 * <p>
 * Types in one hierarchy share a store collection. Queries through the collection of a polymorphic type only see
 * documents of that type and its descendants, each hydrated as its concrete type.
 * </p>
 *
 * <p>
 * Queries are maps from in-memory field paths to values or operator maps, e.g.
 * <code>{"age": {"$gte": 18}, "address.city": "Paris"}</code>; see {@link QueryTranslator}.
 * </p>
 */
@API(API.Status.STABLE)
public class DocumentCollection {
    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentCollection.class);

    @Nonnull
    private final DocumentLayer layer;
    @Nonnull
    private final DocumentType type;

    DocumentCollection(@Nonnull DocumentLayer layer, @Nonnull DocumentType type) {
        this.layer = layer;
        this.type = type;
    }

    @Nonnull
    public DocumentLayer getLayer() {
        return layer;
    }

    @Nonnull
    public DocumentType getType() {
        return type;
    }

    @Nonnull
    public String getCollectionName() {
        return type.getCollectionName();
    }

    @Nonnull
    public Document create() {
        return create(Collections.emptyMap());
    }

    /**
     * Create a transient document. Nothing is written until the document is committed.
     * @param values initial values keyed by in-memory field name
     * @return a new document
     * @throws DocumentLayerArgumentException if a key is not a field of the type
     */
    @Nonnull
    public Document create(@Nonnull Map<String, ?> values) {
        return new Document(this, DocumentState.newTransient(type, layer.getPayloadTranslator(), values));
    }

    /**
     * Create a reference to a document of this type by identity, without reading it.
     * @param id the identity of the referenced document
     * @return a new reference
     */
    @Nonnull
    public Reference reference(@Nonnull Object id) {
        return new Reference(this, id);
    }

    @Nonnull
    public CompletableFuture<List<Document>> find() {
        return find(Collections.emptyMap());
    }

    @Nonnull
    public CompletableFuture<List<Document>> find(@Nonnull Map<String, ?> query) {
        return find(query, FindOptions.UNLIMITED, 0);
    }

    /**
     * Read the documents matching a query, in store order.
     * @param query the query
     * @param limit the maximum number of documents, or {@link FindOptions#UNLIMITED}
     * @param skip the number of matching documents to skip
     * @return a future with the matching documents
     */
    @Nonnull
    public CompletableFuture<List<Document>> find(@Nonnull Map<String, ?> query, int limit, int skip) {
        final FindOptions options = FindOptions.newBuilder().setLimit(limit).setSkip(skip).build();
        return MoreAsyncUtil.invokeSafely(() -> {
            final Map<String, Object> storageQuery = storageQuery(query);
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug(KeyValueLogMessage.of("find documents",
                        LogMessageKeys.DOCUMENT_TYPE, type.getName(),
                        LogMessageKeys.QUERY, storageQuery,
                        LogMessageKeys.LIMIT, limit,
                        LogMessageKeys.SKIP, skip));
            }
            return layer.getDriver().find(getCollectionName(), storageQuery, options);
        }).thenApply(this::hydrateAll);
    }

    /**
     * Read the first document matching a query.
     * @param query the query
     * @return a future with the document, or {@code null} if none matches
     */
    @Nonnull
    public CompletableFuture<Document> findOne(@Nonnull Map<String, ?> query) {
        return find(query, 1, 0).thenApply(documents -> documents.isEmpty() ? null : documents.get(0));
    }

    /**
     * Read a document by identity.
     * @param id the identity
     * @return a future with the document, or {@code null} if there is no document of this type with the identity
     */
    @Nonnull
    public CompletableFuture<Document> findOne(@Nonnull Object id) {
        return findOne(Collections.singletonMap(Schema.ID_FIELD, id));
    }

    @Nonnull
    public CompletableFuture<FindPage> findPage(@Nonnull Map<String, ?> query, int limit, int skip) {
        return findPage(query, limit, skip, null);
    }

    /**
     * Read one page of the documents matching a query. The size of a page is set by
     * {@link DocumentLayerProperties#FIND_BATCH_SIZE}.
     * @param query the query
     * @param limit the maximum number of documents over all pages, or {@link FindOptions#UNLIMITED}
     * @param skip the number of matching documents to skip before the first page
     * @param continuation {@code null} for the first page, otherwise the serialized continuation of the previous
     * page, which must have been read with the same query, limit and skip
     * @return a future with the page
     */
    @Nonnull
    public CompletableFuture<FindPage> findPage(@Nonnull Map<String, ?> query, int limit, int skip,
                                                @Nullable byte[] continuation) {
        final FindOptions options = FindOptions.newBuilder()
                .setLimit(limit)
                .setSkip(skip)
                .setBatchSize(layer.getProperties().getPropertyValue(DocumentLayerProperties.FIND_BATCH_SIZE))
                .build();
        return MoreAsyncUtil.invokeSafely(() -> layer.getDriver().findBatch(getCollectionName(), storageQuery(query), options, continuation))
                .thenApply(batch -> new FindPage(this, query, limit, skip, hydrateAll(batch.getDocuments()),
                        FindContinuation.fromBytes(batch.getContinuation())));
    }

    /**
     * Count the documents matching a query.
     * @param query the query
     * @return a future with the number of matching documents of this type and its descendants
     */
    @Nonnull
    public CompletableFuture<Long> count(@Nonnull Map<String, ?> query) {
        return MoreAsyncUtil.invokeSafely(() -> layer.getDriver().count(getCollectionName(), storageQuery(query)));
    }

    @Nonnull
    public CompletableFuture<Boolean> exists(@Nonnull Object id) {
        return count(Collections.singletonMap(Schema.ID_FIELD, id)).thenApply(count -> count > 0);
    }

    /**
     * Get the indexes this type needs, including those derived from unique fields and those inherited from
     * ancestors.
     * @return the indexes, without the identity index
     * @see PolymorphicMapper#indexesFor(DocumentType)
     */
    @Nonnull
    public List<IndexDescriptor> getIndexes() {
        final List<IndexDescriptor> indexes = new ArrayList<>();
        for (BoundIndex index : layer.getPolymorphicMapper().indexesFor(type)) {
            indexes.add(index.getDescriptor());
        }
        return indexes;
    }

    /**
     * Create the indexes this type needs. Indexes that already exist with the same definition are left alone, so
     * the call can be repeated.
     * @return a future that completes when every index exists
     */
    @Nonnull
    public CompletableFuture<Void> ensureIndexes() {
        final List<IndexDescriptor> indexes = getIndexes();
        return MoreAsyncUtil.forEachSequentially(indexes, index -> layer.getDriver().createIndex(getCollectionName(), index))
                .thenRun(() -> {
                    if (LOGGER.isInfoEnabled()) {
                        LOGGER.info(KeyValueLogMessage.of("ensured indexes",
                                LogMessageKeys.DOCUMENT_TYPE, type.getName(),
                                LogMessageKeys.COLLECTION, getCollectionName(),
                                LogMessageKeys.INDEX_NAME, indexes));
                    }
                });
    }

    /**
     * List the indexes of the store collection, which is shared by every type of the hierarchy.
     * @return a future with the indexes, including the identity index
     */
    @Nonnull
    public CompletableFuture<Set<IndexDescriptor>> listIndexes() {
        return MoreAsyncUtil.invokeSafely(() -> layer.getDriver().listIndexes(getCollectionName()));
    }

    @Nonnull
    public CompletableFuture<Void> dropIndexes() {
        return MoreAsyncUtil.invokeSafely(() -> layer.getDriver().dropIndexes(getCollectionName()));
    }

    /**
     * Drop the store collection, with the documents of every type of the hierarchy.
     * @return a future that completes when the collection is gone
     */
    @Nonnull
    public CompletableFuture<Void> drop() {
        return MoreAsyncUtil.invokeSafely(() -> layer.getDriver().drop(getCollectionName()));
    }

    @Nonnull
    Map<String, Object> storageQuery(@Nonnull Map<String, ?> query) {
        return layer.getPolymorphicMapper().augmentQuery(type, layer.getQueryTranslator().translate(type, query));
    }

    @Nonnull
    Document hydrate(@Nonnull Map<String, Object> stored) {
        final DocumentType concrete = layer.getPolymorphicMapper().resolveType(type, stored);
        return new Document(layer.collection(concrete.getName()),
                DocumentState.loaded(concrete, layer.getPayloadTranslator(), stored));
    }

    @Nonnull
    private List<Document> hydrateAll(@Nonnull List<Map<String, Object>> stored) {
        final List<Document> documents = new ArrayList<>(stored.size());
        for (Map<String, Object> document : stored) {
            documents.add(hydrate(document));
        }
        return documents;
    }

    @Override
    public String toString() {
        return "DocumentCollection(" + type.getName() + " in " + getCollectionName() + ")";
    }
}
