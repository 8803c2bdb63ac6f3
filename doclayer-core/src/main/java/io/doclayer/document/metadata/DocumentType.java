/*
 * DocumentType.java
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
import com.google.common.collect.ImmutableSet;
import io.doclayer.annotation.API;
import io.doclayer.document.DocumentHooks;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/**
 * A registered document type: an immutable schema (including the fields of all ancestors), the collection its
 * documents live in, its own index declarations, and its lifecycle hooks.
 *
 * <p>
 * A type is <em>polymorphic</em> when it allows inheritance or has a parent. Documents of polymorphic types carry their
 * concrete type name in the {@link Schema#DISCRIMINATOR_ATTRIBUTE} attribute.
 * </p>
 */
@API(API.Status.STABLE)
public class DocumentType {
    @Nonnull
    private final String name;
    @Nullable
    private final DocumentType parent;
    @Nonnull
    private final String collectionName;
    private final boolean allowInheritance;
    @Nonnull
    private final Schema schema;
    @Nonnull
    private final ImmutableSet<String> ownFieldNames;
    @Nonnull
    private final ImmutableList<IndexDeclaration> ownIndexes;
    @Nonnull
    private final DocumentHooks hooks;
    @Nonnull
    private final Supplier<?> identityGenerator;

    @SuppressWarnings("squid:S00107") // too many parameters
    DocumentType(@Nonnull String name, @Nullable DocumentType parent, @Nonnull String collectionName,
                 boolean allowInheritance, @Nonnull Schema schema, @Nonnull Collection<String> ownFieldNames,
                 @Nonnull Collection<IndexDeclaration> ownIndexes, @Nonnull DocumentHooks hooks,
                 @Nonnull Supplier<?> identityGenerator) {
        this.name = name;
        this.parent = parent;
        this.collectionName = collectionName;
        this.allowInheritance = allowInheritance;
        this.schema = schema;
        this.ownFieldNames = ImmutableSet.copyOf(ownFieldNames);
        this.ownIndexes = ImmutableList.copyOf(ownIndexes);
        this.hooks = hooks;
        this.identityGenerator = identityGenerator;
    }

    @Nonnull
    public String getName() {
        return name;
    }

    @Nullable
    public DocumentType getParent() {
        return parent;
    }

    @Nonnull
    public DocumentType getRoot() {
        DocumentType current = this;
        while (current.parent != null) {
            current = current.parent;
        }
        return current;
    }

    public boolean isRoot() {
        return parent == null;
    }

    /**
     * Get this type and its ancestors, root first.
     * @return the ancestry of this type, ending with this type
     */
    @Nonnull
    public List<DocumentType> getAncestry() {
        final List<DocumentType> ancestry = new ArrayList<>();
        for (DocumentType current = this; current != null; current = current.parent) {
            ancestry.add(current);
        }
        Collections.reverse(ancestry);
        return ancestry;
    }

    /**
     * Whether this type is the given type or one of its descendants.
     * @param other the possible ancestor
     * @return whether documents of this type are also documents of {@code other}
     */
    public boolean isSubtypeOf(@Nonnull DocumentType other) {
        for (DocumentType current = this; current != null; current = current.parent) {
            if (current.name.equals(other.name)) {
                return true;
            }
        }
        return false;
    }

    @Nonnull
    public String getCollectionName() {
        return collectionName;
    }

    public boolean isAllowInheritance() {
        return allowInheritance;
    }

    public boolean isPolymorphic() {
        return allowInheritance || parent != null;
    }

    /**
     * Get the value stored in the discriminator attribute of documents of this type.
     * @return the discriminator value
     */
    @Nonnull
    public String getDiscriminator() {
        return name;
    }

    @Nonnull
    public Schema getSchema() {
        return schema;
    }

    /**
     * Get the fields this type declares itself, including redeclared ancestor fields.
     * @return the names of the fields declared by this type
     */
    @Nonnull
    public Set<String> getOwnFieldNames() {
        return ownFieldNames;
    }

    @Nonnull
    public List<IndexDeclaration> getOwnIndexes() {
        return ownIndexes;
    }

    @Nonnull
    public DocumentHooks getHooks() {
        return hooks;
    }

    @Nonnull
    public Supplier<?> getIdentityGenerator() {
        return identityGenerator;
    }

    @Nonnull
    public Object newIdentity() {
        return identityGenerator.get();
    }

    /**
     * Find the type in the ancestry of this type that first makes the given field unique.
     * @param fieldName the name of a field of this type
     * @return the highest type whose declaration of the field is unique, or {@code null} if the field is not unique
     */
    @Nullable
    public DocumentType getUniqueOrigin(@Nonnull String fieldName) {
        for (DocumentType type : getAncestry()) {
            final FieldDescriptor field = type.schema.getField(fieldName);
            if (field != null && field.isUnique()) {
                return type;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return name + (parent == null ? "" : "(" + parent.name + ")");
    }
}
