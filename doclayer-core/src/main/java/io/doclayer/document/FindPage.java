/*
 * FindPage.java
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

import com.google.common.collect.ImmutableList;
import io.doclayer.annotation.API;
import io.doclayer.document.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * One page of the documents matching a query, along with the continuation to the next page. A page may be empty
 * without being the last one; the end is only known once {@link #isExhausted()} returns {@code true}.
 */
@API(API.Status.STABLE)
public class FindPage {
    @Nonnull
    private final DocumentCollection collection;
    @Nonnull
    private final Map<String, ?> query;
    private final int limit;
    private final int skip;
    @Nonnull
    private final ImmutableList<Document> documents;
    @Nonnull
    private final FindContinuation continuation;

    FindPage(@Nonnull DocumentCollection collection, @Nonnull Map<String, ?> query, int limit, int skip,
             @Nonnull List<Document> documents, @Nonnull FindContinuation continuation) {
        this.collection = collection;
        this.query = query;
        this.limit = limit;
        this.skip = skip;
        this.documents = ImmutableList.copyOf(documents);
        this.continuation = continuation;
    }

    @Nonnull
    public List<Document> getDocuments() {
        return documents;
    }

    @Nonnull
    public FindContinuation getContinuation() {
        return continuation;
    }

    public boolean isExhausted() {
        return continuation.isEnd();
    }

    /**
     * Read the next page.
     * @return a future with the next page, which fails with {@link DocumentLayerArgumentException} if this page is
     * exhausted
     */
    @Nonnull
    public CompletableFuture<FindPage> next() {
        if (isExhausted()) {
            return CompletableFuture.failedFuture(new DocumentLayerArgumentException("no page follows an exhausted page",
                    LogMessageKeys.DOCUMENT_TYPE, collection.getType().getName()));
        }
        return collection.findPage(query, limit, skip, continuation.toBytes());
    }

    @Override
    public String toString() {
        return "FindPage(" + documents.size() + " documents, " + continuation + ")";
    }
}
