/*
 * DocumentTypeBuilder.java
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

import com.google.common.base.CaseFormat;
import io.doclayer.annotation.API;
import io.doclayer.document.DocumentHooks;
import io.doclayer.document.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * A builder for {@link DocumentType}. The builder only records the declaration; it is resolved against its parent
 * type and frozen when it is passed to {@link DocumentRegistry#register(DocumentTypeBuilder)}.
 */
@API(API.Status.STABLE)
public class DocumentTypeBuilder {
    @Nonnull
    private final String name;
    @Nullable
    private String parentName;
    @Nullable
    private String collectionName;
    private boolean allowInheritance;
    @Nonnull
    private final Map<String, FieldDescriptor.Builder> fields = new LinkedHashMap<>();
    @Nonnull
    private final List<IndexDeclaration> indexes = new ArrayList<>();
    @Nullable
    private DocumentHooks hooks;
    @Nullable
    private Supplier<?> identityGenerator;

    private DocumentTypeBuilder(@Nonnull String name) {
        this.name = name;
    }

    @Nonnull
    public static DocumentTypeBuilder newBuilder(@Nonnull String name) {
        return new DocumentTypeBuilder(name);
    }

    @Nonnull
    public String getName() {
        return name;
    }

    @Nullable
    public String getParentName() {
        return parentName;
    }

    /**
     * Make this type a subtype of an already registered type that allows inheritance. The subtype inherits all
     * fields, indexes and hooks of the parent and is stored in the same collection.
     * @param parentName the name of the parent type
     * @return this builder
     */
    @Nonnull
    public DocumentTypeBuilder setParent(@Nonnull String parentName) {
        this.parentName = parentName;
        return this;
    }

    /**
     * Set the name of the collection documents of a root type are stored in. Defaults to the type name in snake case.
     * @param collectionName the collection name
     * @return this builder
     */
    @Nonnull
    public DocumentTypeBuilder setCollectionName(@Nonnull String collectionName) {
        this.collectionName = collectionName;
        return this;
    }

    @Nonnull
    public DocumentTypeBuilder setAllowInheritance(boolean allowInheritance) {
        this.allowInheritance = allowInheritance;
        return this;
    }

    @Nonnull
    public DocumentTypeBuilder addField(@Nonnull String fieldName, @Nonnull FieldDescriptor.Builder field) {
        if (fields.put(fieldName, field) != null) {
            throw new MetaDataException("field declared twice",
                    LogMessageKeys.DOCUMENT_TYPE, name,
                    LogMessageKeys.FIELD_NAME, fieldName);
        }
        return this;
    }

    @Nonnull
    public DocumentTypeBuilder addIndex(@Nonnull IndexDeclaration index) {
        indexes.add(index);
        return this;
    }

    @Nonnull
    public DocumentTypeBuilder setHooks(@Nonnull DocumentHooks hooks) {
        this.hooks = hooks;
        return this;
    }

    /**
     * Set how identities are generated for new documents that were not given one. Defaults to random
     * {@link UUID}s, or the parent's generator for a subtype.
     * @param identityGenerator the generator
     * @return this builder
     */
    @Nonnull
    public DocumentTypeBuilder setIdentityGenerator(@Nonnull Supplier<?> identityGenerator) {
        this.identityGenerator = identityGenerator;
        return this;
    }

    @Nonnull
    static String defaultCollectionName(@Nonnull String typeName) {
        return CaseFormat.UPPER_CAMEL.to(CaseFormat.LOWER_UNDERSCORE, typeName);
    }

    /**
     * Resolve this declaration against its parent.
     * @param parent the registered parent type, or {@code null} for a root type
     * @return the frozen type
     */
    @Nonnull
    DocumentType build(@Nullable DocumentType parent) {
        final Schema.Builder schemaBuilder = Schema.newBuilder(name);
        if (parent == null) {
            schemaBuilder.addField(Fields.identity().build(Schema.ID_FIELD));
        } else {
            parent.getSchema().getFieldDescriptors().forEach(schemaBuilder::addField);
        }
        for (Map.Entry<String, FieldDescriptor.Builder> entry : fields.entrySet()) {
            if (entry.getKey().equals(Schema.ID_FIELD)) {
                throw new MetaDataException("the identity field cannot be redeclared",
                        LogMessageKeys.DOCUMENT_TYPE, name,
                        LogMessageKeys.FIELD_NAME, entry.getKey());
            }
            final FieldDescriptor field = entry.getValue().build(entry.getKey());
            final FieldDescriptor inherited = schemaBuilder.getField(field.getName());
            if (inherited == null) {
                schemaBuilder.addField(field);
            } else if (inherited.isCompatibleWith(field)) {
                schemaBuilder.replaceField(field);
            } else {
                throw new MetaDataException("field redeclared with an incompatible kind",
                        LogMessageKeys.DOCUMENT_TYPE, name,
                        LogMessageKeys.PARENT_TYPE, parent.getName(),
                        LogMessageKeys.FIELD_NAME, field.getName(),
                        LogMessageKeys.FIELD_KIND, field.getKind(),
                        LogMessageKeys.EXPECTED_KIND, inherited.getKind());
            }
        }

        final String resolvedCollectionName;
        if (parent == null) {
            resolvedCollectionName = collectionName == null ? defaultCollectionName(name) : collectionName;
        } else {
            if (collectionName != null && !collectionName.equals(parent.getCollectionName())) {
                throw new MetaDataException("subtype must be stored in the collection of its parent",
                        LogMessageKeys.DOCUMENT_TYPE, name,
                        LogMessageKeys.COLLECTION, collectionName,
                        LogMessageKeys.PARENT_TYPE, parent.getName());
            }
            resolvedCollectionName = parent.getCollectionName();
        }

        final DocumentHooks resolvedHooks;
        if (hooks != null) {
            resolvedHooks = hooks;
        } else {
            resolvedHooks = parent == null ? DocumentHooks.NONE : parent.getHooks();
        }
        final Supplier<?> resolvedGenerator;
        if (identityGenerator != null) {
            resolvedGenerator = identityGenerator;
        } else {
            resolvedGenerator = parent == null ? UUID::randomUUID : parent.getIdentityGenerator();
        }

        return new DocumentType(name, parent, resolvedCollectionName, allowInheritance, schemaBuilder.build(),
                fields.keySet(), indexes, resolvedHooks, resolvedGenerator);
    }
}
