/*
 * DriverBatch.java
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

import com.google.common.collect.ImmutableList;
import io.doclayer.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Map;

/**
 * One batch of raw documents returned by {@link DocumentDriver#findBatch}, with the continuation to pass back to
 * read the next batch. A batch with documents always has a continuation, even if it happens to be the last one; only
 * reading past the end returns an empty batch without a continuation.
 */
@API(API.Status.STABLE)
public class DriverBatch {
    @Nonnull
    private final ImmutableList<Map<String, Object>> documents;
    @Nullable
    private final byte[] continuation;

    public DriverBatch(@Nonnull List<Map<String, Object>> documents, @Nullable byte[] continuation) {
        this.documents = ImmutableList.copyOf(documents);
        this.continuation = continuation == null ? null : continuation.clone();
    }

    @Nonnull
    public List<Map<String, Object>> getDocuments() {
        return documents;
    }

    /**
     * Get the continuation for the next batch.
     * @return an opaque continuation, or {@code null} if there are no more documents
     */
    @Nullable
    public byte[] getContinuation() {
        return continuation == null ? null : continuation.clone();
    }
}
