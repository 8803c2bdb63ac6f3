/*
 * FieldDescriptor.java
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
import io.doclayer.document.logging.LogMessageKeys;
import io.doclayer.document.validation.AsyncFieldValidator;
import io.doclayer.document.validation.FieldValidator;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * The immutable description of one field of a {@link Schema}: its kind, its constraints, how it is stored, and the
 * validators that check its values.
 *
 * <p>
 * Descriptors are created from a {@link Builder}, usually obtained from one of the factory methods of {@link Fields}.
 * The name is bound when the field is added to a schema or document type.
 * </p>
 */
@API(API.Status.STABLE)
public class FieldDescriptor {
    @Nonnull
    private final String name;
    @Nonnull
    private final FieldKind kind;
    private final boolean required;
    private final boolean unique;
    @Nullable
    private final Supplier<?> defaultValue;
    @Nonnull
    private final String attribute;
    @Nullable
    private final Schema nestedSchema;
    @Nullable
    private final FieldDescriptor elementField;
    @Nullable
    private final String referenceType;
    private final boolean checkReference;
    @Nonnull
    private final ImmutableList<FieldValidator> validators;
    @Nonnull
    private final ImmutableList<AsyncFieldValidator> asyncValidators;

    private FieldDescriptor(@Nonnull String name, @Nonnull Builder builder) {
        this.name = name;
        this.kind = builder.kind;
        this.required = builder.required;
        this.unique = builder.unique;
        this.defaultValue = builder.defaultValue;
        this.attribute = builder.attribute == null ? name : builder.attribute;
        this.nestedSchema = builder.nestedSchema;
        this.elementField = builder.elementBuilder == null ? null : builder.elementBuilder.build(name);
        this.referenceType = builder.referenceType;
        this.checkReference = builder.checkReference;
        this.validators = ImmutableList.copyOf(builder.validators);
        this.asyncValidators = ImmutableList.copyOf(builder.asyncValidators);
    }

    @Nonnull
    public String getName() {
        return name;
    }

    @Nonnull
    public FieldKind getKind() {
        return kind;
    }

    public boolean isRequired() {
        return required;
    }

    public boolean isUnique() {
        return unique;
    }

    public boolean hasDefaultValue() {
        return defaultValue != null;
    }

    /**
     * Get a fresh default value for this field.
     * @return the default value, or {@code null} if the field has no default
     */
    @Nullable
    public Object newDefaultValue() {
        return defaultValue == null ? null : defaultValue.get();
    }

    /**
     * Get the name under which this field is stored.
     * @return the storage attribute name, which is the field name unless an alias was declared
     */
    @Nonnull
    public String getAttribute() {
        return attribute;
    }

    /**
     * Get the schema of an {@link FieldKind#EMBEDDED} field.
     * @return the nested schema
     * @throws MetaDataException if this is not an embedded field
     */
    @Nonnull
    public Schema getNestedSchema() {
        if (nestedSchema == null) {
            throw new MetaDataException("field is not an embedded document", LogMessageKeys.FIELD_NAME, name);
        }
        return nestedSchema;
    }

    /**
     * Get the descriptor of the elements of a {@link FieldKind#LIST} field.
     * @return the element descriptor, which has the same name as the list field
     * @throws MetaDataException if this is not a list field
     */
    @Nonnull
    public FieldDescriptor getElementField() {
        if (elementField == null) {
            throw new MetaDataException("field is not a list", LogMessageKeys.FIELD_NAME, name);
        }
        return elementField;
    }

    /**
     * Get the name of the document type a {@link FieldKind#REFERENCE} field points to.
     * @return the referenced type name
     * @throws MetaDataException if this is not a reference field
     */
    @Nonnull
    public String getReferenceType() {
        if (referenceType == null) {
            throw new MetaDataException("field is not a reference", LogMessageKeys.FIELD_NAME, name);
        }
        return referenceType;
    }

    public boolean isCheckReference() {
        return checkReference;
    }

    @Nonnull
    public List<FieldValidator> getValidators() {
        return validators;
    }

    @Nonnull
    public List<AsyncFieldValidator> getAsyncValidators() {
        return asyncValidators;
    }

    /**
     * Whether any asynchronous work happens when a value of this field is validated: its own asynchronous
     * validators, a reference existence check, or asynchronous validation of nested values.
     * @return whether the field takes part in asynchronous validation
     */
    public boolean hasAsyncValidation() {
        if (!asyncValidators.isEmpty()) {
            return true;
        }
        switch (kind) {
            case REFERENCE:
                return checkReference;
            case LIST:
                return getElementField().hasAsyncValidation();
            case EMBEDDED:
                return getNestedSchema().hasAsyncValidation();
            default:
                return false;
        }
    }

    /**
     * Whether a redeclaration of this field in a child type may replace it. The kinds must match, and so must the
     * shape of embedded, list, and reference fields.
     * @param other the redeclared field
     * @return whether the two declarations are compatible
     */
    public boolean isCompatibleWith(@Nonnull FieldDescriptor other) {
        if (kind != other.kind) {
            return false;
        }
        switch (kind) {
            case EMBEDDED:
                return getNestedSchema().getName().equals(other.getNestedSchema().getName());
            case LIST:
                return getElementField().isCompatibleWith(other.getElementField());
            case REFERENCE:
                return getReferenceType().equals(other.getReferenceType());
            default:
                return true;
        }
    }

    @Override
    public String toString() {
        StringBuilder str = new StringBuilder();
        str.append(name).append(':').append(kind);
        if (kind == FieldKind.LIST) {
            str.append('<').append(getElementField().getKind()).append('>');
        } else if (kind == FieldKind.EMBEDDED) {
            str.append('<').append(getNestedSchema().getName()).append('>');
        } else if (kind == FieldKind.REFERENCE) {
            str.append('<').append(referenceType).append('>');
        }
        if (!attribute.equals(name)) {
            str.append(" as ").append(attribute);
        }
        if (required) {
            str.append(" required");
        }
        if (unique) {
            str.append(" unique");
        }
        return str.toString();
    }

    /**
     * A builder for {@link FieldDescriptor}.
     */
    public static class Builder {
        @Nonnull
        private final FieldKind kind;
        private boolean required;
        private boolean unique;
        @Nullable
        private Supplier<?> defaultValue;
        @Nullable
        private String attribute;
        @Nullable
        private Schema nestedSchema;
        @Nullable
        private Builder elementBuilder;
        @Nullable
        private String referenceType;
        private boolean checkReference;
        @Nonnull
        private final List<FieldValidator> validators = new ArrayList<>();
        @Nonnull
        private final List<AsyncFieldValidator> asyncValidators = new ArrayList<>();

        Builder(@Nonnull FieldKind kind) {
            this.kind = kind;
        }

        Builder setNestedSchema(@Nonnull Schema nestedSchema) {
            this.nestedSchema = nestedSchema;
            return this;
        }

        Builder setElementBuilder(@Nonnull Builder elementBuilder) {
            this.elementBuilder = elementBuilder;
            return this;
        }

        Builder setReferenceType(@Nonnull String referenceType) {
            this.referenceType = referenceType;
            this.checkReference = true;
            return this;
        }

        @Nonnull
        public FieldKind getKind() {
            return kind;
        }

        /**
         * Mark the field as required: committing a document without a value for it fails validation.
         * @return this builder
         */
        @Nonnull
        public Builder required() {
            this.required = true;
            return this;
        }

        /**
         * Mark the field as unique. A unique index is derived from the flag; it is sparse unless the field is also
         * required.
         * @return this builder
         */
        @Nonnull
        public Builder unique() {
            this.unique = true;
            return this;
        }

        /**
         * Use the given value as the default for documents that do not set the field. The value is shared between
         * documents, so it should be immutable; see {@link #withDefaultSupplier(Supplier)} otherwise.
         * @param value the default value
         * @return this builder
         */
        @Nonnull
        public Builder withDefault(@Nonnull Object value) {
            this.defaultValue = () -> value;
            return this;
        }

        @Nonnull
        public Builder withDefaultSupplier(@Nonnull Supplier<?> supplier) {
            this.defaultValue = supplier;
            return this;
        }

        /**
         * Store the field under a different name than the one used in memory.
         * @param attribute the storage attribute name
         * @return this builder
         */
        @Nonnull
        public Builder attribute(@Nonnull String attribute) {
            this.attribute = attribute;
            return this;
        }

        /**
         * Add synchronous validators, which run in the order given after the type of the value has been checked.
         * @param fieldValidators the validators to add
         * @return this builder
         */
        @Nonnull
        public Builder validate(@Nonnull FieldValidator... fieldValidators) {
            validators.addAll(Arrays.asList(fieldValidators));
            return this;
        }

        /**
         * Add asynchronous validators. The validators of one field run one after the other in the order given.
         * @param fieldValidators the validators to add
         * @return this builder
         */
        @Nonnull
        public Builder ioValidate(@Nonnull AsyncFieldValidator... fieldValidators) {
            asyncValidators.addAll(Arrays.asList(fieldValidators));
            return this;
        }

        /**
         * Set whether a reference field checks that the referenced document exists. Checking is on by default.
         * @param checkReference whether to check that the referenced document exists
         * @return this builder
         */
        @Nonnull
        public Builder checkReference(boolean checkReference) {
            if (kind != FieldKind.REFERENCE) {
                throw new MetaDataException("only reference fields can check references", LogMessageKeys.FIELD_KIND, kind);
            }
            this.checkReference = checkReference;
            return this;
        }

        @Nonnull
        public FieldDescriptor build(@Nonnull String name) {
            Objects.requireNonNull(name);
            return new FieldDescriptor(name, this);
        }
    }
}
