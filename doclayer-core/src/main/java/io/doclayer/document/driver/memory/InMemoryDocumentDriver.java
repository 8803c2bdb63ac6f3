/*
 * InMemoryDocumentDriver.java
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

package io.doclayer.document.driver.memory;

import io.doclayer.annotation.API;
import io.doclayer.document.driver.DeleteResult;
import io.doclayer.document.driver.DocumentDriver;
import io.doclayer.document.driver.DriverBatch;
import io.doclayer.document.driver.FindOptions;
import io.doclayer.document.driver.InsertResult;
import io.doclayer.document.driver.UpdateResult;
import io.doclayer.document.logging.KeyValueLogMessage;
import io.doclayer.document.logging.LogMessageKeys;
import io.doclayer.document.metadata.IndexDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.function.Function;

/**
 * A {@link DocumentDriver} that keeps collections in memory. It enforces unique and sparse indexes and the identity
 * index, supports limit, skip and batched reads, and evaluates the query subset described by {@link QueryMatcher}.
 *
 * <p>
 * Every call runs on the given executor, so callers see the same asynchronous completion they would see with a
 * remote store. Collections spring into existence on the first write or index creation.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public class InMemoryDocumentDriver implements DocumentDriver {
    @Nonnull
    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryDocumentDriver.class);

    @Nonnull
    private final Map<String, InMemoryCollection> collections = new ConcurrentHashMap<>();
    @Nonnull
    private final Executor executor;

    public InMemoryDocumentDriver() {
        this(ForkJoinPool.commonPool());
    }

    public InMemoryDocumentDriver(@Nonnull Executor executor) {
        this.executor = executor;
    }

    @Nonnull
    public Executor getExecutor() {
        return executor;
    }

    @Nonnull
    private InMemoryCollection getOrCreate(@Nonnull String collection) {
        return collections.computeIfAbsent(collection, name -> {
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug(KeyValueLogMessage.of("creating collection", LogMessageKeys.COLLECTION, name));
            }
            return new InMemoryCollection(name);
        });
    }

    @Nonnull
    private <T> CompletableFuture<T> onCollection(@Nonnull String collection, @Nonnull Function<InMemoryCollection, T> operation) {
        return CompletableFuture.supplyAsync(() -> operation.apply(getOrCreate(collection)), executor);
    }

    @Nonnull
    private <T> CompletableFuture<T> onExistingCollection(@Nonnull String collection, @Nonnull Function<InMemoryCollection, T> operation,
                                                          @Nullable T ifMissing) {
        return CompletableFuture.supplyAsync(() -> {
            final InMemoryCollection existing = collections.get(collection);
            return existing == null ? ifMissing : operation.apply(existing);
        }, executor);
    }

    @Nonnull
    @Override
    public CompletableFuture<InsertResult> insert(@Nonnull String collection, @Nonnull Map<String, Object> document) {
        return onCollection(collection, coll -> coll.insert(document));
    }

    @Nonnull
    @Override
    public CompletableFuture<UpdateResult> update(@Nonnull String collection, @Nonnull Map<String, Object> query,
                                                  @Nonnull Map<String, Object> update, boolean upsert) {
        if (upsert) {
            return onCollection(collection, coll -> coll.update(query, update, true));
        }
        return onExistingCollection(collection, coll -> coll.update(query, update, false), new UpdateResult(0, 0, null));
    }

    @Nonnull
    @Override
    public CompletableFuture<DeleteResult> delete(@Nonnull String collection, @Nonnull Map<String, Object> query) {
        return onExistingCollection(collection, coll -> coll.delete(query), new DeleteResult(0));
    }

    @Nonnull
    @Override
    public CompletableFuture<List<Map<String, Object>>> find(@Nonnull String collection, @Nonnull Map<String, Object> query,
                                                             @Nonnull FindOptions options) {
        return onExistingCollection(collection, coll -> coll.find(query, options), Collections.emptyList());
    }

    @Nonnull
    @Override
    public CompletableFuture<DriverBatch> findBatch(@Nonnull String collection, @Nonnull Map<String, Object> query,
                                                    @Nonnull FindOptions options, @Nullable byte[] continuation) {
        return onExistingCollection(collection, coll -> coll.findBatch(query, options, continuation),
                new DriverBatch(Collections.emptyList(), null));
    }

    @Nonnull
    @Override
    public CompletableFuture<Long> count(@Nonnull String collection, @Nonnull Map<String, Object> query) {
        return onExistingCollection(collection, coll -> coll.count(query), 0L);
    }

    @Nonnull
    @Override
    public CompletableFuture<Void> createIndex(@Nonnull String collection, @Nonnull IndexDescriptor index) {
        return onCollection(collection, coll -> {
            coll.createIndex(index);
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug(KeyValueLogMessage.of("ensured index",
                        LogMessageKeys.COLLECTION, collection,
                        LogMessageKeys.INDEX_NAME, index.getName()));
            }
            return null;
        });
    }

    @Nonnull
    @Override
    public CompletableFuture<Set<IndexDescriptor>> listIndexes(@Nonnull String collection) {
        return onExistingCollection(collection, InMemoryCollection::listIndexes, Collections.emptySet());
    }

    @Nonnull
    @Override
    public CompletableFuture<Void> dropIndexes(@Nonnull String collection) {
        return onExistingCollection(collection, coll -> {
            coll.dropIndexes();
            return null;
        }, null);
    }

    @Nonnull
    @Override
    public CompletableFuture<Void> drop(@Nonnull String collection) {
        return CompletableFuture.runAsync(() -> {
            if (collections.remove(collection) != null && LOGGER.isDebugEnabled()) {
                LOGGER.debug(KeyValueLogMessage.of("dropped collection", LogMessageKeys.COLLECTION, collection));
            }
        }, executor);
    }
}
