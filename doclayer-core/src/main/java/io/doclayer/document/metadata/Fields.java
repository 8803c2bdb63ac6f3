/*
 * Fields.java
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

import javax.annotation.Nonnull;

/**
 * Factory methods for {@link FieldDescriptor.Builder}s, one per {@link FieldKind}.
 *
 * <pre>
 * DocumentTypeBuilder.newBuilder("Student")
 *         .addField("name", Fields.string().required())
 *         .addField("courses", Fields.list(Fields.reference("Course")));
 * </pre>
 */
@API(API.Status.STABLE)
public class Fields {

    private Fields() {
    }

    @Nonnull
    public static FieldDescriptor.Builder string() {
        return new FieldDescriptor.Builder(FieldKind.STRING);
    }

    @Nonnull
    public static FieldDescriptor.Builder integer() {
        return new FieldDescriptor.Builder(FieldKind.INTEGER);
    }

    @Nonnull
    public static FieldDescriptor.Builder number() {
        return new FieldDescriptor.Builder(FieldKind.NUMBER);
    }

    @Nonnull
    public static FieldDescriptor.Builder bool() {
        return new FieldDescriptor.Builder(FieldKind.BOOLEAN);
    }

    @Nonnull
    public static FieldDescriptor.Builder dateTime() {
        return new FieldDescriptor.Builder(FieldKind.DATETIME);
    }

    @Nonnull
    public static FieldDescriptor.Builder uuid() {
        return new FieldDescriptor.Builder(FieldKind.UUID);
    }

    @Nonnull
    public static FieldDescriptor.Builder dict() {
        return new FieldDescriptor.Builder(FieldKind.DICT);
    }

    /**
     * A field holding one embedded document of the given schema. Plain maps assigned to the field are converted.
     * @param schema the schema of the embedded document
     * @return a new field builder
     */
    @Nonnull
    public static FieldDescriptor.Builder embedded(@Nonnull Schema schema) {
        return new FieldDescriptor.Builder(FieldKind.EMBEDDED).setNestedSchema(schema);
    }

    /**
     * A field holding a list whose elements are described by the given builder. The element builder may carry its
     * own validators; they run once per element.
     * @param element the builder for the elements
     * @return a new field builder
     */
    @Nonnull
    public static FieldDescriptor.Builder list(@Nonnull FieldDescriptor.Builder element) {
        if (element.getKind() == FieldKind.LIST) {
            throw new MetaDataException("lists of lists are not supported");
        }
        return new FieldDescriptor.Builder(FieldKind.LIST).setElementBuilder(element);
    }

    /**
     * A field referencing a document of the given type (or one of its subtypes).
     * @param documentType the name of the referenced document type
     * @return a new field builder
     */
    @Nonnull
    public static FieldDescriptor.Builder reference(@Nonnull String documentType) {
        return new FieldDescriptor.Builder(FieldKind.REFERENCE).setReferenceType(documentType);
    }

    @Nonnull
    static FieldDescriptor.Builder identity() {
        return new FieldDescriptor.Builder(FieldKind.IDENTITY).attribute(Schema.ID_ATTRIBUTE);
    }
}
