/*
 * FieldKind.java
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
import io.doclayer.document.EmbeddedDocument;
import io.doclayer.document.Reference;
import io.doclayer.document.TrackedList;

import javax.annotation.Nonnull;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.Collection;
import java.util.Date;
import java.util.Map;
import java.util.function.Predicate;

/**
 * The kinds of value a document field can hold, along with the message reported when a value does not conform.
 */
@API(API.Status.STABLE)
public enum FieldKind {
    STRING("Not a valid string.", value -> value instanceof String),
    INTEGER("Not a valid integer.", value -> value instanceof Integer || value instanceof Long
                                             || value instanceof Short || value instanceof Byte || value instanceof BigInteger),
    NUMBER("Not a valid number.", value -> value instanceof Number),
    BOOLEAN("Not a valid boolean.", value -> value instanceof Boolean),
    DATETIME("Not a valid datetime.", value -> value instanceof LocalDateTime || value instanceof Instant
                                               || value instanceof OffsetDateTime || value instanceof ZonedDateTime
                                               || value instanceof LocalDate || value instanceof Date),
    UUID("Not a valid UUID.", value -> value instanceof java.util.UUID),
    DICT("Not a valid mapping type.", value -> value instanceof Map),
    EMBEDDED("Not a valid embedded document.", value -> value instanceof EmbeddedDocument),
    LIST("Not a valid list.", value -> value instanceof TrackedList),
    REFERENCE("Not a valid reference.", value -> value instanceof Reference),
    /**
     * The kind of the identity field. Any scalar value can serve as an identity.
     */
    IDENTITY("Not a valid identity.", value -> !(value instanceof Map) && !(value instanceof Collection)
                                               && !(value instanceof EmbeddedDocument));

    @Nonnull
    private final String invalidMessage;
    @Nonnull
    private final Predicate<Object> conformance;

    FieldKind(@Nonnull String invalidMessage, @Nonnull Predicate<Object> conformance) {
        this.invalidMessage = invalidMessage;
        this.conformance = conformance;
    }

    /**
     * Get the validation message reported for a value that does not conform to this kind.
     * @return the message for a non-conforming value
     */
    @Nonnull
    public String getInvalidMessage() {
        return invalidMessage;
    }

    /**
     * Check whether a (non-null) value has the Java type this kind stores. Embedded documents, lists and references
     * are checked against their declared shape separately.
     * @param value the value to check
     * @return whether the value conforms
     */
    public boolean accepts(@Nonnull Object value) {
        return conformance.test(value);
    }

    public boolean isContainer() {
        return this == EMBEDDED || this == LIST || this == DICT;
    }
}
