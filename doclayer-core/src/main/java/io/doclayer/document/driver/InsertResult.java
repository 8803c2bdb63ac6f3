/*
 * InsertResult.java
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

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * The result of inserting one document.
 */
@API(API.Status.STABLE)
public class InsertResult implements WriteResult {
    @Nonnull
    private final Object insertedId;

    public InsertResult(@Nonnull Object insertedId) {
        this.insertedId = insertedId;
    }

    @Nonnull
    public Object getInsertedId() {
        return insertedId;
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
        return insertedId.equals(((InsertResult)o).insertedId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(insertedId);
    }

    @Override
    public String toString() {
        return "InsertResult(" + insertedId + ")";
    }
}
