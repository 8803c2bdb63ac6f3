/*
 * ValidationMessages.java
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

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An accumulator of validation messages keyed by field. Keys keep the order in which their first message arrived.
 */
@API(API.Status.INTERNAL)
public class ValidationMessages {
    @Nonnull
    private final Map<String, List<String>> messages = new LinkedHashMap<>();

    @Nonnull
    public ValidationMessages add(@Nonnull String key, @Nonnull String message) {
        messages.computeIfAbsent(key, k -> new ArrayList<>()).add(message);
        return this;
    }

    /**
     * File the messages of a validator failure under a field. Messages the exception keys by field are filed under
     * the dotted path {@code key.field}.
     * @param key the field being validated
     * @param failure the failure raised by a validator
     * @return this accumulator
     */
    @Nonnull
    public ValidationMessages add(@Nonnull String key, @Nonnull ValidationException failure) {
        for (Map.Entry<String, List<String>> entry : failure.getMessages().entrySet()) {
            final String target = ValidationException.GENERAL_KEY.equals(entry.getKey()) ? key : key + "." + entry.getKey();
            entry.getValue().forEach(message -> add(target, message));
        }
        return this;
    }

    /**
     * Add the messages of a nested validation under a field, prefixing each nested key with the field.
     * @param key the field holding the nested values
     * @param nested the messages of the nested values
     * @return this accumulator
     */
    @Nonnull
    public ValidationMessages addNested(@Nonnull String key, @Nonnull ValidationMessages nested) {
        for (Map.Entry<String, List<String>> entry : nested.messages.entrySet()) {
            entry.getValue().forEach(message -> add(key + "." + entry.getKey(), message));
        }
        return this;
    }

    @Nonnull
    public ValidationMessages addAll(@Nonnull ValidationMessages other) {
        other.messages.forEach((key, keyMessages) -> keyMessages.forEach(message -> add(key, message)));
        return this;
    }

    public boolean isEmpty() {
        return messages.isEmpty();
    }

    /**
     * Whether there are messages for a field or for anything nested in it.
     * @param fieldName a top-level field name
     * @return whether the field failed validation
     */
    public boolean hasMessagesFor(@Nonnull String fieldName) {
        for (String key : messages.keySet()) {
            if (key.equals(fieldName) || key.startsWith(fieldName + ".")) {
                return true;
            }
        }
        return false;
    }

    @Nonnull
    public Map<String, List<String>> getMessages() {
        return Collections.unmodifiableMap(messages);
    }

    /**
     * Build the exception reporting these messages. When every message is about a missing required value, the
     * exception is a {@link RequiredFieldException}.
     * @return the exception to fail validation with
     */
    @Nonnull
    public ValidationException toException() {
        final boolean onlyRequired = messages.values().stream()
                .allMatch(keyMessages -> keyMessages.stream().allMatch(RequiredFieldException.MISSING_MESSAGE::equals));
        return onlyRequired ? new RequiredFieldException(messages) : new ValidationException(messages);
    }

    @Override
    public String toString() {
        return messages.toString();
    }
}
