/*
 * AsyncFieldValidator.java
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
import java.util.concurrent.CompletableFuture;

/**
 * An asynchronous check of a field value, typically one that needs to consult the store or another service.
 *
 * <p>
 * The validator fails by completing the returned future exceptionally with a {@link ValidationException} (throwing
 * one directly works as well). The validators of one field run one at a time, in declaration order, and the first
 * failure ends the chain for that field. Validators of different fields run concurrently. Any other exception fails
 * the whole validation, after all chains have finished.
 * </p>
 */
@API(API.Status.STABLE)
@FunctionalInterface
public interface AsyncFieldValidator {
    /**
     * Check a value.
     * @param field the field being validated; for list elements, the element descriptor
     * @param value the value, which is never {@code null}
     * @return a future that completes when the check has passed
     */
    @Nonnull
    CompletableFuture<Void> validate(@Nonnull FieldDescriptor field, @Nonnull Object value);
}
