/*
 * BoundIndex.java
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

package io.doclayer.document.metadata;

import com.google.common.collect.ImmutableList;
import io.doclayer.annotation.API;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * An {@link IndexDescriptor} together with the in-memory field paths it covers. The discriminator key of an index
 * that is scoped to a subtype has no field path.
 */
@API(API.Status.INTERNAL)
public class BoundIndex {
    @Nonnull
    private final IndexDescriptor descriptor;
    @Nonnull
    private final ImmutableList<String> fieldPaths;

    public BoundIndex(@Nonnull IndexDescriptor descriptor, @Nonnull List<String> fieldPaths) {
        this.descriptor = descriptor;
        this.fieldPaths = ImmutableList.copyOf(fieldPaths);
    }

    @Nonnull
    public IndexDescriptor getDescriptor() {
        return descriptor;
    }

    @Nonnull
    public List<String> getFieldPaths() {
        return fieldPaths;
    }

    /**
     * Whether any of the covered field paths starts at one of the given top-level fields.
     * @param fieldNames top-level field names
     * @return whether the index covers one of the fields
     */
    public boolean coversAny(@Nonnull Iterable<String> fieldNames) {
        for (String fieldName : fieldNames) {
            for (String path : fieldPaths) {
                if (path.equals(fieldName) || path.startsWith(fieldName + ".")) {
                    return true;
                }
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return descriptor.toString();
    }
}
