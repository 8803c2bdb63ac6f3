/*
 * RecordingDocumentDriver.java
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

import io.doclayer.document.driver.DeleteResult;
import io.doclayer.document.driver.DocumentDriver;
import io.doclayer.document.driver.DriverBatch;
import io.doclayer.document.driver.FindOptions;
import io.doclayer.document.driver.InsertResult;
import io.doclayer.document.driver.UpdateResult;
import io.doclayer.document.metadata.IndexDescriptor;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * A driver that records the writes it is asked to do before passing them on to another driver.
 */
public class RecordingDocumentDriver implements DocumentDriver {
    @Nonnull
    private final DocumentDriver delegate;
    @Nonnull
    private final List<String> writes = Collections.synchronizedList(new ArrayList<>());
    @Nonnull
    private final List<Map<String, Object>> updates = Collections.synchronizedList(new ArrayList<>());

    public RecordingDocumentDriver(@Nonnull DocumentDriver delegate) {
        this.delegate = delegate;
    }

    /**
     * Get the writes so far, each as {@code operation:collection}.
     * @return the recorded writes
     */
    @Nonnull
    public List<String> getWrites() {
        return new ArrayList<>(writes);
    }

    @Nonnull
    public List<Map<String, Object>> getUpdates() {
        return new ArrayList<>(updates);
    }

    public void clear() {
        writes.clear();
        updates.clear();
    }

    @Nonnull
    @Override
    public CompletableFuture<InsertResult> insert(@Nonnull String collection, @Nonnull Map<String, Object> document) {
        writes.add("insert:" + collection);
        return delegate.insert(collection, document);
    }

    @Nonnull
    @Override
    public CompletableFuture<UpdateResult> update(@Nonnull String collection, @Nonnull Map<String, Object> query,
                                                  @Nonnull Map<String, Object> update, boolean upsert) {
        writes.add("update:" + collection);
        updates.add(update);
        return delegate.update(collection, query, update, upsert);
    }

    @Nonnull
    @Override
    public CompletableFuture<DeleteResult> delete(@Nonnull String collection, @Nonnull Map<String, Object> query) {
        writes.add("delete:" + collection);
        return delegate.delete(collection, query);
    }

    @Nonnull
    @Override
    public CompletableFuture<List<Map<String, Object>>> find(@Nonnull String collection, @Nonnull Map<String, Object> query,
                                                             @Nonnull FindOptions options) {
        return delegate.find(collection, query, options);
    }

    @Nonnull
    @Override
    public CompletableFuture<DriverBatch> findBatch(@Nonnull String collection, @Nonnull Map<String, Object> query,
                                                    @Nonnull FindOptions options, @Nullable byte[] continuation) {
        return delegate.findBatch(collection, query, options, continuation);
    }

    @Nonnull
    @Override
    public CompletableFuture<Long> count(@Nonnull String collection, @Nonnull Map<String, Object> query) {
        return delegate.count(collection, query);
    }

    @Nonnull
    @Override
    public CompletableFuture<Void> createIndex(@Nonnull String collection, @Nonnull IndexDescriptor index) {
        return delegate.createIndex(collection, index);
    }

    @Nonnull
    @Override
    public CompletableFuture<Set<IndexDescriptor>> listIndexes(@Nonnull String collection) {
        return delegate.listIndexes(collection);
    }

    @Nonnull
    @Override
    public CompletableFuture<Void> dropIndexes(@Nonnull String collection) {
        return delegate.dropIndexes(collection);
    }

    @Nonnull
    @Override
    public CompletableFuture<Void> drop(@Nonnull String collection) {
        return delegate.drop(collection);
    }
}
