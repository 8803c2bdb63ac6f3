/*
 * PolymorphicMapper.java
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

import com.google.common.collect.ImmutableList;
import io.doclayer.annotation.API;
import io.doclayer.document.logging.KeyValueLogMessage;
import io.doclayer.document.logging.LogMessageKeys;
import io.doclayer.document.metadata.BoundIndex;
import io.doclayer.document.metadata.DocumentRegistry;
import io.doclayer.document.metadata.DocumentType;
import io.doclayer.document.metadata.FieldDescriptor;
import io.doclayer.document.metadata.IndexDeclaration;
import io.doclayer.document.metadata.IndexDescriptor;
import io.doclayer.document.metadata.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps type hierarchies onto single collections. Documents of polymorphic types carry their type name in the
 * {@link Schema#DISCRIMINATOR_ATTRIBUTE} attribute; the mapper uses it to restrict queries to a type and its
 * descendants, to pick the concrete type of a stored document, and to keep indexes declared by subtypes apart.
 *
 * <p>
 * The indexes of a type are derived from its whole ancestry:
 * </p>
 * <ul>
 *     <li>A field that becomes unique in the root type gets a single-field unique index, sparse unless the field is
 *     required.</li>
 *     <li>A field that becomes unique in a subtype gets a unique index on the field and the discriminator. It is
 *     always sparse, so that documents of other types in the collection, which do not have the field, never
 *     conflict. This needs a sparse index to skip documents missing any key, as {@link IndexDescriptor} describes.</li>
 *     <li>Indexes declared by the root type are used as declared; indexes declared by a subtype get the
 *     discriminator as an additional last key.</li>
 * </ul>
 */
@API(API.Status.INTERNAL)
public class PolymorphicMapper {
    private static final Logger LOGGER = LoggerFactory.getLogger(PolymorphicMapper.class);

    @Nonnull
    private final DocumentRegistry registry;

    public PolymorphicMapper(@Nonnull DocumentRegistry registry) {
        this.registry = registry;
    }

    /**
     * Get the discriminator values of a type and all its descendants.
     * @param documentType the type
     * @return the type names, the type itself first
     */
    @Nonnull
    public List<String> getDiscriminators(@Nonnull DocumentType documentType) {
        final List<String> names = new ArrayList<>();
        names.add(documentType.getDiscriminator());
        registry.getDescendants(documentType).forEach(descendant -> names.add(descendant.getDiscriminator()));
        return names;
    }

    /**
     * Get the condition on the discriminator attribute that selects the documents of a type.
     * @param documentType the type
     * @return the condition, or {@code null} if the type is not polymorphic
     */
    @Nullable
    public Object discriminatorFilter(@Nonnull DocumentType documentType) {
        if (!documentType.isPolymorphic()) {
            return null;
        }
        final List<String> names = getDiscriminators(documentType);
        if (names.size() == 1) {
            return names.get(0);
        }
        return Collections.singletonMap("$in", names);
    }

    /**
     * Restrict a storage query to the documents of a type.
     * @param documentType the type
     * @param storageQuery a query in storage attributes
     * @return the restricted query, or the query itself if the type is not polymorphic
     */
    @Nonnull
    public Map<String, Object> augmentQuery(@Nonnull DocumentType documentType, @Nonnull Map<String, Object> storageQuery) {
        final Object filter = discriminatorFilter(documentType);
        if (filter == null) {
            return storageQuery;
        }
        final Map<String, Object> augmented = new LinkedHashMap<>();
        if (storageQuery.containsKey(Schema.DISCRIMINATOR_ATTRIBUTE)) {
            augmented.put("$and", ImmutableList.of(storageQuery,
                    Collections.singletonMap(Schema.DISCRIMINATOR_ATTRIBUTE, filter)));
        } else {
            augmented.putAll(storageQuery);
            augmented.put(Schema.DISCRIMINATOR_ATTRIBUTE, filter);
        }
        return augmented;
    }

    /**
     * Pick the type to hydrate a stored document as.
     * @param queriedType the type the document was read through
     * @param stored the stored document
     * @return the type named by the discriminator, or the queried type if the discriminator is missing or does not
     * name a registered descendant
     */
    @Nonnull
    public DocumentType resolveType(@Nonnull DocumentType queriedType, @Nonnull Map<String, Object> stored) {
        if (!queriedType.isPolymorphic()) {
            return queriedType;
        }
        final Object discriminator = stored.get(Schema.DISCRIMINATOR_ATTRIBUTE);
        if (discriminator instanceof String) {
            final DocumentType concrete = registry.getTypeOrNull((String)discriminator);
            if (concrete != null && concrete.isSubtypeOf(queriedType)) {
                return concrete;
            }
        }
        if (LOGGER.isWarnEnabled()) {
            LOGGER.warn(KeyValueLogMessage.of("stored document has no usable discriminator",
                    LogMessageKeys.DOCUMENT_TYPE, queriedType.getName(),
                    LogMessageKeys.DISCRIMINATOR, discriminator,
                    LogMessageKeys.IDENTITY, stored.get(Schema.ID_ATTRIBUTE)));
        }
        return queriedType;
    }

    /**
     * Derive the indexes a type needs, including those inherited from its ancestors. The index on the identity is
     * not included; every store keeps it anyway.
     * @param documentType the type
     * @return the indexes, each bound to the in-memory field paths it covers
     */
    @Nonnull
    public List<BoundIndex> indexesFor(@Nonnull DocumentType documentType) {
        final Map<String, BoundIndex> indexes = new LinkedHashMap<>();
        for (DocumentType type : documentType.getAncestry()) {
            for (String fieldName : type.getOwnFieldNames()) {
                final FieldDescriptor field = type.getSchema().getField(fieldName);
                if (field == null || !field.isUnique() || type.getUniqueOrigin(fieldName) != type) {
                    continue;
                }
                final List<IndexDescriptor.Key> keys = new ArrayList<>();
                keys.add(new IndexDescriptor.Key(field.getAttribute(), 1));
                if (!type.isRoot()) {
                    keys.add(new IndexDescriptor.Key(Schema.DISCRIMINATOR_ATTRIBUTE, 1));
                }
                final boolean sparse = !type.isRoot() || !field.isRequired();
                addIndex(indexes, IndexDescriptor.of(keys, true, sparse), ImmutableList.of(fieldName));
            }
            for (IndexDeclaration declaration : type.getOwnIndexes()) {
                final List<IndexDescriptor.Key> keys = new ArrayList<>();
                final List<String> fieldPaths = new ArrayList<>();
                for (String key : declaration.getKeys()) {
                    final String fieldPath = IndexDeclaration.fieldPathOf(key);
                    final String storagePath = type.getSchema().toStoragePath(fieldPath);
                    keys.add(new IndexDescriptor.Key(storagePath == null ? fieldPath : storagePath,
                            IndexDeclaration.isDescending(key) ? -1 : 1));
                    fieldPaths.add(fieldPath);
                }
                if (!type.isRoot()) {
                    keys.add(new IndexDescriptor.Key(Schema.DISCRIMINATOR_ATTRIBUTE, 1));
                }
                addIndex(indexes, IndexDescriptor.of(keys, declaration.isUnique(), declaration.isSparse()), fieldPaths);
            }
        }
        return ImmutableList.copyOf(indexes.values());
    }

    private static void addIndex(@Nonnull Map<String, BoundIndex> indexes, @Nonnull IndexDescriptor descriptor,
                                 @Nonnull List<String> fieldPaths) {
        indexes.putIfAbsent(descriptor.getName(), new BoundIndex(descriptor, fieldPaths));
    }
}
