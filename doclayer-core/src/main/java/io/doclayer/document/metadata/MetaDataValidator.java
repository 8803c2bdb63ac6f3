/*
 * MetaDataValidator.java
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
import io.doclayer.document.logging.LogMessageKeys;

import javax.annotation.Nonnull;

/**
 * Validator for a {@link DocumentType} that is about to be registered.
 * @see MetaDataException
 */
@API(API.Status.MAINTAINED)
public class MetaDataValidator {
    @Nonnull
    protected final DocumentType documentType;

    public MetaDataValidator(@Nonnull DocumentType documentType) {
        this.documentType = documentType;
    }

    public void validate() {
        for (String fieldName : documentType.getOwnFieldNames()) {
            validateField(documentType.getSchema().getField(fieldName), true);
        }
        documentType.getOwnIndexes().forEach(this::validateIndex);
    }

    protected void validateField(@Nonnull FieldDescriptor field, boolean topLevel) {
        if (topLevel && (Schema.ID_ATTRIBUTE.equals(field.getAttribute()) || Schema.DISCRIMINATOR_ATTRIBUTE.equals(field.getAttribute()))) {
            throw new MetaDataException("field is stored under a reserved attribute",
                    LogMessageKeys.DOCUMENT_TYPE, documentType.getName(),
                    LogMessageKeys.FIELD_NAME, field.getName(),
                    LogMessageKeys.STORAGE_ATTRIBUTE, field.getAttribute());
        }
        if (field.isUnique()) {
            if (!topLevel) {
                throw new MetaDataException("unique fields are not supported inside embedded documents",
                        LogMessageKeys.DOCUMENT_TYPE, documentType.getName(),
                        LogMessageKeys.FIELD_NAME, field.getName());
            }
            if (field.getKind().isContainer()) {
                throw new MetaDataException("field of this kind cannot be unique",
                        LogMessageKeys.DOCUMENT_TYPE, documentType.getName(),
                        LogMessageKeys.FIELD_NAME, field.getName(),
                        LogMessageKeys.FIELD_KIND, field.getKind());
            }
        }
        if (field.getKind() == FieldKind.EMBEDDED) {
            field.getNestedSchema().getFieldDescriptors().forEach(nested -> validateField(nested, false));
        } else if (field.getKind() == FieldKind.LIST) {
            final FieldDescriptor element = field.getElementField();
            if (element.isUnique() || element.isRequired()) {
                throw new MetaDataException("list elements cannot be unique or required",
                        LogMessageKeys.DOCUMENT_TYPE, documentType.getName(),
                        LogMessageKeys.FIELD_NAME, field.getName());
            }
            if (element.getKind() == FieldKind.EMBEDDED) {
                element.getNestedSchema().getFieldDescriptors().forEach(nested -> validateField(nested, false));
            }
        }
    }

    protected void validateIndex(@Nonnull IndexDeclaration index) {
        for (String key : index.getKeys()) {
            final String path = IndexDeclaration.fieldPathOf(key);
            final Schema.ResolvedPath resolved = documentType.getSchema().resolvePath(path);
            if (resolved == null || resolved.getField() == null) {
                throw new MetaDataException("index names an unknown field",
                        LogMessageKeys.DOCUMENT_TYPE, documentType.getName(),
                        LogMessageKeys.INDEX_KEYS, index.getKeys(),
                        LogMessageKeys.FIELD_NAME, path);
            }
        }
    }
}
