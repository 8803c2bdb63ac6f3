/*
 * DeleteResult.java
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

/**
 * The result of deleting at most one document.
 */
@API(API.Status.STABLE)
public class DeleteResult {
    private final long deletedCount;

    public DeleteResult(long deletedCount) {
        this.deletedCount = deletedCount;
    }

    public long getDeletedCount() {
        return deletedCount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return deletedCount == ((DeleteResult)o).deletedCount;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(deletedCount);
    }

    @Override
    public String toString() {
        return "DeleteResult(" + deletedCount + ")";
    }
}
