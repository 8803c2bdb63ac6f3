/*
 * IndexDeclaration.java
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
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * An index declared explicitly on a document type, in terms of in-memory field paths.
 *
 * <p>
 * A key is a dotted field path; prefixing it with {@code -} makes that key descending. Declarations on a subtype
 * are compounded with the discriminator when they are turned into {@link IndexDescriptor}s, so that they only
 * range over documents of that subtype.
 * </p>
 *
 * <pre>
 * IndexDeclaration.keys("compound1", "compound2").unique()
 * IndexDeclaration.keys("-created")
 * </pre>
 */
@API(API.Status.STABLE)
public class IndexDeclaration {
    @Nonnull
    private final ImmutableList<String> keys;
    private final boolean unique;
    private final boolean sparse;

    private IndexDeclaration(@Nonnull List<String> keys, boolean unique, boolean sparse) {
        if (keys.isEmpty()) {
            throw new MetaDataException("index declaration must have at least one key");
        }
        this.keys = ImmutableList.copyOf(keys);
        this.unique = unique;
        this.sparse = sparse;
    }

    @Nonnull
    public static IndexDeclaration keys(@Nonnull String... keys) {
        return new IndexDeclaration(Arrays.asList(keys), false, false);
    }

    @Nonnull
    public IndexDeclaration unique() {
        return new IndexDeclaration(keys, true, sparse);
    }

    @Nonnull
    public IndexDeclaration sparse() {
        return new IndexDeclaration(keys, unique, true);
    }

    /**
     * Get the keys as declared, including any {@code -} prefix.
     * @return the declared keys
     */
    @Nonnull
    public List<String> getKeys() {
        return keys;
    }

    public boolean isUnique() {
        return unique;
    }

    public boolean isSparse() {
        return sparse;
    }

    @Nonnull
    public static String fieldPathOf(@Nonnull String key) {
        return isDescending(key) ? key.substring(1) : key;
    }

    public static boolean isDescending(@Nonnull String key) {
        return key.startsWith("-");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        IndexDeclaration that = (IndexDeclaration)o;
        return unique == that.unique && sparse == that.sparse && keys.equals(that.keys);
    }

    @Override
    public int hashCode() {
        return Objects.hash(keys, unique, sparse);
    }

    @Override
    public String toString() {
        return keys + (unique ? " unique" : "") + (sparse ? " sparse" : "");
    }
}
