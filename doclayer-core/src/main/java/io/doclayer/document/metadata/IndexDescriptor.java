/*
 * IndexDescriptor.java
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
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * An index as the store sees it: storage attribute paths with directions, a name derived from them, and the unique
 * and sparse options. Two descriptors are equal when all of these are equal, which is how an ensure that finds an
 * identical index already present becomes a no-op.
 *
 * <p>
 * A sparse index leaves out every document that is missing <em>any</em> of its key paths, not only documents missing
 * all of them. Documents that are left out never take part in the uniqueness of a unique sparse index. Subtype unique
 * indexes on {@code [field, _cls]} rely on this: documents without the field are not indexed even though they always
 * have a discriminator.
 * </p>
 */
@API(API.Status.STABLE)
public class IndexDescriptor {
    /**
     * The index every collection has on the identity attribute.
     */
    public static final IndexDescriptor ID_INDEX = new IndexDescriptor("_id_", ImmutableList.of(new Key(Schema.ID_ATTRIBUTE, 1)), false, false);

    @Nonnull
    private final String name;
    @Nonnull
    private final ImmutableList<Key> keys;
    private final boolean unique;
    private final boolean sparse;

    public IndexDescriptor(@Nonnull String name, @Nonnull List<Key> keys, boolean unique, boolean sparse) {
        this.name = name;
        this.keys = ImmutableList.copyOf(keys);
        this.unique = unique;
        this.sparse = sparse;
    }

    /**
     * Create a descriptor named after its keys, in the form {@code path_direction} joined by underscores, e.g.
     * {@code compound1_1_compound2_-1}.
     * @param keys the keys of the index
     * @param unique whether the index is unique
     * @param sparse whether documents missing any one of the keys are left out of the index
     * @return a new descriptor
     */
    @Nonnull
    public static IndexDescriptor of(@Nonnull List<Key> keys, boolean unique, boolean sparse) {
        final String name = keys.stream().map(key -> key.getPath() + "_" + key.getDirection()).collect(Collectors.joining("_"));
        return new IndexDescriptor(name, keys, unique, sparse);
    }

    @Nonnull
    public String getName() {
        return name;
    }

    @Nonnull
    public List<Key> getKeys() {
        return keys;
    }

    @Nonnull
    public List<String> getKeyPaths() {
        return keys.stream().map(Key::getPath).collect(Collectors.toList());
    }

    public boolean isUnique() {
        return unique;
    }

    public boolean isSparse() {
        return sparse;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        IndexDescriptor that = (IndexDescriptor)o;
        return unique == that.unique && sparse == that.sparse && name.equals(that.name) && keys.equals(that.keys);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, keys, unique, sparse);
    }

    @Override
    public String toString() {
        return name + keys + (unique ? " unique" : "") + (sparse ? " sparse" : "");
    }

    /**
     * One key of an index: a storage path and a direction, {@code 1} for ascending or {@code -1} for descending.
     */
    public static class Key {
        @Nonnull
        private final String path;
        private final int direction;

        public Key(@Nonnull String path, int direction) {
            if (direction != 1 && direction != -1) {
                throw new MetaDataException("index direction must be 1 or -1");
            }
            this.path = path;
            this.direction = direction;
        }

        @Nonnull
        public String getPath() {
            return path;
        }

        public int getDirection() {
            return direction;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (o == null || getClass() != o.getClass()) {
                return false;
            }
            Key key = (Key)o;
            return direction == key.direction && path.equals(key.path);
        }

        @Override
        public int hashCode() {
            return Objects.hash(path, direction);
        }

        @Override
        public String toString() {
            return path + ":" + direction;
        }
    }
}
