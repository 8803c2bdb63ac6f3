/*
 * FindContinuation.java
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

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Arrays;

/**
 * The position after a {@link FindPage}, from which the next page is read. A continuation can be saved with
 * {@link #toBytes()} and passed back to {@link DocumentCollection#findPage(java.util.Map, int, int, byte[])} later.
 */
@API(API.Status.STABLE)
public class FindContinuation {
    public static final FindContinuation END = new FindContinuation(null);

    @Nullable
    private final byte[] bytes;

    private FindContinuation(@Nullable byte[] bytes) {
        this.bytes = bytes;
    }

    @Nonnull
    public static FindContinuation fromBytes(@Nullable byte[] bytes) {
        return bytes == null ? END : new FindContinuation(Arrays.copyOf(bytes, bytes.length));
    }

    /**
     * Whether there is nothing left to read.
     * @return {@code true} if the page this continuation follows was the last one
     */
    public boolean isEnd() {
        return bytes == null;
    }

    /**
     * Serialize the continuation.
     * @return the serialized continuation, or {@code null} at the end
     */
    @Nullable
    public byte[] toBytes() {
        return bytes == null ? null : Arrays.copyOf(bytes, bytes.length);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return Arrays.equals(bytes, ((FindContinuation)o).bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return isEnd() ? "FindContinuation(END)" : "FindContinuation(" + bytes.length + " bytes)";
    }
}
