/*
 * DocumentRegistry.java
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

import io.doclayer.annotation.API;
import io.doclayer.document.logging.KeyValueLogMessage;
import io.doclayer.document.logging.LogMessageKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * The set of registered {@link DocumentType}s. Registration is serialized; lookups can happen concurrently with it.
 */
@API(API.Status.STABLE)
public class DocumentRegistry {
    @Nonnull
    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentRegistry.class);

    @Nonnull
    private final Map<String, DocumentType> types = new ConcurrentHashMap<>();
    @Nonnull
    private final Map<String, List<DocumentType>> children = new ConcurrentHashMap<>();

    /**
     * Resolve, validate and register a document type.
     * @param builder the declaration of the type
     * @return the registered type
     * @throws MetaDataException if the type is not well formed or its name is taken
     */
    @Nonnull
    public synchronized DocumentType register(@Nonnull DocumentTypeBuilder builder) {
        if (types.containsKey(builder.getName())) {
            throw new MetaDataException("document type already registered",
                    LogMessageKeys.DOCUMENT_TYPE, builder.getName());
        }
        DocumentType parent = null;
        if (builder.getParentName() != null) {
            parent = types.get(builder.getParentName());
            if (parent == null) {
                throw new MetaDataException("parent type is not registered",
                        LogMessageKeys.DOCUMENT_TYPE, builder.getName(),
                        LogMessageKeys.PARENT_TYPE, builder.getParentName());
            }
            if (!parent.isAllowInheritance()) {
                throw new MetaDataException("parent type does not allow inheritance",
                        LogMessageKeys.DOCUMENT_TYPE, builder.getName(),
                        LogMessageKeys.PARENT_TYPE, parent.getName());
            }
        }
        final DocumentType documentType = builder.build(parent);
        new MetaDataValidator(documentType).validate();
        types.put(documentType.getName(), documentType);
        if (parent != null) {
            children.computeIfAbsent(parent.getName(), ignore -> new CopyOnWriteArrayList<>()).add(documentType);
        }
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("registered document type",
                    LogMessageKeys.DOCUMENT_TYPE, documentType.getName(),
                    LogMessageKeys.PARENT_TYPE, parent == null ? null : parent.getName(),
                    LogMessageKeys.COLLECTION, documentType.getCollectionName()));
        }
        return documentType;
    }

    @Nullable
    public DocumentType getTypeOrNull(@Nonnull String name) {
        return types.get(name);
    }

    @Nonnull
    public DocumentType getType(@Nonnull String name) {
        final DocumentType documentType = types.get(name);
        if (documentType == null) {
            throw new MetaDataException("unknown document type", LogMessageKeys.DOCUMENT_TYPE, name);
        }
        return documentType;
    }

    @Nonnull
    public Collection<DocumentType> getTypes() {
        return Collections.unmodifiableCollection(types.values());
    }

    /**
     * Get all registered descendants of a type, depth first in registration order.
     * @param documentType the ancestor
     * @return the descendants, not including the type itself
     */
    @Nonnull
    public List<DocumentType> getDescendants(@Nonnull DocumentType documentType) {
        final List<DocumentType> descendants = new ArrayList<>();
        addDescendants(documentType, descendants);
        return descendants;
    }

    private void addDescendants(@Nonnull DocumentType documentType, @Nonnull List<DocumentType> descendants) {
        for (DocumentType child : children.getOrDefault(documentType.getName(), Collections.emptyList())) {
            descendants.add(child);
            addDescendants(child, descendants);
        }
    }
}
