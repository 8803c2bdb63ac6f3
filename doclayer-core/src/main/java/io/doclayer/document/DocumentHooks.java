/*
 * DocumentHooks.java
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
import io.doclayer.document.driver.DeleteResult;
import io.doclayer.document.driver.InsertResult;
import io.doclayer.document.driver.UpdateResult;

import javax.annotation.Nonnull;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Callbacks invoked around the store writes of a document. Every callback may do asynchronous work; the lifecycle
 * waits for the returned future before it moves on to the next step. Callbacks that are not overridden do nothing.
 *
 * <p>
 * A failed pre-write callback aborts the operation before the store is touched and the document keeps its state.
 * A failed post-write callback fails the operation after the write was applied; the document then also keeps its
 * previous in-memory state.
 * </p>
 *
 * <p>
 * Subtypes inherit the hooks of their parent type unless they set their own.
 * </p>
 */
@API(API.Status.STABLE)
public interface DocumentHooks {
    /**
     * Hooks that do nothing.
     */
    DocumentHooks NONE = new DocumentHooks() {
    };

    /**
     * Called before a new document is inserted.
     * @param document the document being inserted
     * @param payload the storage representation about to be written; changes made here are written
     * @return a future that completes when the hook is done
     */
    @Nonnull
    default CompletableFuture<Void> preInsert(@Nonnull Document document, @Nonnull Map<String, Object> payload) {
        return MoreAsyncUtil.DONE;
    }

    @Nonnull
    default CompletableFuture<Void> postInsert(@Nonnull Document document, @Nonnull InsertResult result,
                                               @Nonnull Map<String, Object> payload) {
        return MoreAsyncUtil.DONE;
    }

    /**
     * Called before the modified fields of a document are written.
     * @param document the document being updated
     * @param query the storage query selecting the document, including any commit conditions
     * @param payload the update directive about to be written
     * @return a future that completes when the hook is done
     */
    @Nonnull
    default CompletableFuture<Void> preUpdate(@Nonnull Document document, @Nonnull Map<String, Object> query,
                                              @Nonnull Map<String, Object> payload) {
        return MoreAsyncUtil.DONE;
    }

    @Nonnull
    default CompletableFuture<Void> postUpdate(@Nonnull Document document, @Nonnull UpdateResult result,
                                               @Nonnull Map<String, Object> payload) {
        return MoreAsyncUtil.DONE;
    }

    @Nonnull
    default CompletableFuture<Void> preDelete(@Nonnull Document document) {
        return MoreAsyncUtil.DONE;
    }

    @Nonnull
    default CompletableFuture<Void> postDelete(@Nonnull Document document, @Nonnull DeleteResult result) {
        return MoreAsyncUtil.DONE;
    }
}
