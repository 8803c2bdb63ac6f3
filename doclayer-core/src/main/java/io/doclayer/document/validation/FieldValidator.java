/*
 * FieldValidator.java
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
import io.doclayer.document.metadata.FieldDescriptor;

import javax.annotation.Nonnull;

/**
 * A synchronous check of a field value. The validator fails by throwing a {@link ValidationException} whose message
 * is reported for the field; returning normally means the value is valid.
 * @see Validators
 */
@API(API.Status.STABLE)
@FunctionalInterface
public interface FieldValidator {
    /**
     * Check a value.
     * @param field the field being validated; for list elements, the element descriptor
     * @param value the value, which is never {@code null} and already has the Java type of the field's kind
     * @throws ValidationException if the value is not valid
     */
    void validate(@Nonnull FieldDescriptor field, @Nonnull Object value);
}
