/*
 * UpdateResult.java
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

import javax.annotation.Nullable;
import java.util.Objects;

/**
 * The result of updating at most one document.
 */
@API(API.Status.STABLE)
public class UpdateResult implements WriteResult {
    private final long matchedCount;
    private final long modifiedCount;
    @Nullable
    private final Object upsertedId;

    public UpdateResult(long matchedCount, long modifiedCount, @Nullable Object upsertedId) {
        this.matchedCount = matchedCount;
        this.modifiedCount = modifiedCount;
        this.upsertedId = upsertedId;
    }

    public long getMatchedCount() {
        return matchedCount;
    }

    public long getModifiedCount() {
        return modifiedCount;
    }

    @Nullable
    public Object getUpsertedId() {
        return upsertedId;
    }

    @Override
    public boolean isAcknowledged() {
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        UpdateResult that = (UpdateResult)o;
        return matchedCount == that.matchedCount && modifiedCount == that.modifiedCount && Objects.equals(upsertedId, that.upsertedId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(matchedCount, modifiedCount, upsertedId);
    }

    @Override
    public String toString() {
        return "UpdateResult(matched=" + matchedCount + ", modified=" + modifiedCount + ")";
    }
}
