/*
 * FindOptions.java
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
import io.doclayer.document.DocumentLayerArgumentException;
import io.doclayer.document.logging.LogMessageKeys;

import javax.annotation.Nonnull;

/**
 * Limits applied to a find: how many matching documents to skip, how many to return at most, and how many to
 * return per batch when reading in batches.
 */
@API(API.Status.STABLE)
public class FindOptions {
    /**
     * A limit of zero means no limit.
     */
    public static final int UNLIMITED = 0;
    public static final int DEFAULT_BATCH_SIZE = 100;
    public static final FindOptions ALL = newBuilder().build();

    private final int limit;
    private final int skip;
    private final int batchSize;

    private FindOptions(int limit, int skip, int batchSize) {
        this.limit = limit;
        this.skip = skip;
        this.batchSize = batchSize;
    }

    @Nonnull
    public static Builder newBuilder() {
        return new Builder();
    }

    public int getLimit() {
        return limit;
    }

    public boolean hasLimit() {
        return limit != UNLIMITED;
    }

    public int getSkip() {
        return skip;
    }

    public int getBatchSize() {
        return batchSize;
    }

    @Override
    public String toString() {
        return "FindOptions(limit=" + limit + ", skip=" + skip + ", batchSize=" + batchSize + ")";
    }

    /**
     * A builder for {@link FindOptions}.
     */
    public static class Builder {
        private int limit = UNLIMITED;
        private int skip;
        private int batchSize = DEFAULT_BATCH_SIZE;

        private Builder() {
        }

        @Nonnull
        public Builder setLimit(int limit) {
            if (limit < 0) {
                throw new DocumentLayerArgumentException("limit cannot be negative", LogMessageKeys.LIMIT, limit);
            }
            this.limit = limit;
            return this;
        }

        @Nonnull
        public Builder setSkip(int skip) {
            if (skip < 0) {
                throw new DocumentLayerArgumentException("skip cannot be negative", LogMessageKeys.SKIP, skip);
            }
            this.skip = skip;
            return this;
        }

        @Nonnull
        public Builder setBatchSize(int batchSize) {
            if (batchSize <= 0) {
                throw new DocumentLayerArgumentException("batch size must be positive", LogMessageKeys.BATCH_SIZE, batchSize);
            }
            this.batchSize = batchSize;
            return this;
        }

        @Nonnull
        public FindOptions build() {
            return new FindOptions(limit, skip, batchSize);
        }
    }
}
