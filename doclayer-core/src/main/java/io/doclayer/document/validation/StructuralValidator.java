/*
 * StructuralValidator.java
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

package io.doclayer.document.validation;

import io.doclayer.annotation.API;
import io.doclayer.document.EmbeddedDocument;
import io.doclayer.document.Reference;
import io.doclayer.document.TrackedList;
import io.doclayer.document.metadata.DocumentRegistry;
import io.doclayer.document.metadata.DocumentType;
import io.doclayer.document.metadata.FieldDescriptor;
import io.doclayer.document.metadata.FieldKind;
import io.doclayer.document.metadata.Schema;

import javax.annotation.Nonnull;
import java.util.Collection;
import java.util.Map;

/**
 * The synchronous half of validation: value kinds, required fields and {@link FieldValidator}s.
 *
 * <p>
 * Every selected field is checked, so a single pass reports all failing fields. For one field, a value of the wrong
 * kind is reported on its own; otherwise nested values are checked first (every field of an embedded document, every
 * element of a list) and then each synchronous validator of the field runs in declaration order, all of their
 * messages being kept.
 * </p>
 */
@API(API.Status.INTERNAL)
public class StructuralValidator {
    public static final String NULL_ELEMENT_MESSAGE = "Field may not be null.";

    @Nonnull
    private final DocumentRegistry registry;

    public StructuralValidator(@Nonnull DocumentRegistry registry) {
        this.registry = registry;
    }

    /**
     * Validate some fields of a set of values.
     * @param schema the schema describing the values
     * @param values the values, keyed by in-memory field name
     * @param fieldNames the fields to validate; fields the schema does not describe are ignored
     * @return the messages per field, empty if the values are valid
     */
    @Nonnull
    public ValidationMessages validate(@Nonnull Schema schema, @Nonnull Map<String, Object> values,
                                       @Nonnull Collection<String> fieldNames) {
        final ValidationMessages messages = new ValidationMessages();
        for (FieldDescriptor field : schema.getFieldDescriptors()) {
            if (!fieldNames.contains(field.getName())) {
                continue;
            }
            final Object value = values.get(field.getName());
            if (value == null || isMissingList(field, value)) {
                if (field.isRequired()) {
                    messages.add(field.getName(), RequiredFieldException.MISSING_MESSAGE);
                }
                continue;
            }
            validateValue(field, value, field.getName(), messages);
        }
        return messages;
    }

    private static boolean isMissingList(@Nonnull FieldDescriptor field, @Nonnull Object value) {
        return field.isRequired() && value instanceof TrackedList && ((TrackedList)value).isEmpty();
    }

    private void validateValue(@Nonnull FieldDescriptor field, @Nonnull Object value, @Nonnull String key,
                               @Nonnull ValidationMessages messages) {
        if (!field.getKind().accepts(value) || !conformsToDeclaration(field, value)) {
            messages.add(key, field.getKind().getInvalidMessage());
            return;
        }
        if (field.getKind() == FieldKind.EMBEDDED) {
            final EmbeddedDocument embedded = (EmbeddedDocument)value;
            messages.addNested(key, validate(embedded.getSchema(), embedded.getValues(), embedded.getSchema().getFields().keySet()));
        } else if (field.getKind() == FieldKind.LIST) {
            for (Object element : (TrackedList)value) {
                if (element == null) {
                    messages.add(key, NULL_ELEMENT_MESSAGE);
                } else {
                    validateValue(field.getElementField(), element, key, messages);
                }
            }
        }
        for (FieldValidator validator : field.getValidators()) {
            try {
                validator.validate(field, value);
            } catch (ValidationException e) {
                messages.add(key, e);
            }
        }
    }

    private boolean conformsToDeclaration(@Nonnull FieldDescriptor field, @Nonnull Object value) {
        switch (field.getKind()) {
            case EMBEDDED:
                return ((EmbeddedDocument)value).getSchema() == field.getNestedSchema();
            case LIST:
                return ((TrackedList)value).getElementField() == field.getElementField();
            case REFERENCE:
                final DocumentType target = registry.getType(field.getReferenceType());
                return ((Reference)value).getDocumentType().isSubtypeOf(target);
            default:
                return true;
        }
    }
}
