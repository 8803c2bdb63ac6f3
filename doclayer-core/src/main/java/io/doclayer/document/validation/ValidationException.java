/*
 * ValidationException.java
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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.doclayer.annotation.API;
import io.doclayer.document.DocumentLayerException;
import io.doclayer.document.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Map;

/**
 * Thrown when document values fail validation. The failures are available as a mapping from field name to the
 * ordered list of messages for that field, so they can be rendered without parsing the exception message.
 *
 * <p>
 * Messages for fields of embedded documents are keyed by the dotted path of the field, e.g. {@code author.name}.
 * A validator that is not tied to a particular field throws an exception with a single message, which is keyed by
 * {@link #GENERAL_KEY} until the validation engine files it under the field being validated.
 * </p>
 */
@API(API.Status.STABLE)
public class ValidationException extends DocumentLayerException {
    private static final long serialVersionUID = 1;

    /**
     * The key of messages that are not (yet) attached to a field.
     */
    public static final String GENERAL_KEY = "_schema";

    @Nonnull
    private final ImmutableMap<String, List<String>> messages;

    /**
     * Create an exception with a single message. This is what field validators throw.
     * @param message the message to report for the field
     */
    public ValidationException(@Nonnull String message) {
        super(message);
        this.messages = ImmutableMap.of(GENERAL_KEY, ImmutableList.of(message));
    }

    /**
     * Create an exception with messages per field.
     * @param messages the messages per field
     */
    public ValidationException(@Nonnull Map<String, ? extends List<String>> messages) {
        super("document failed validation", LogMessageKeys.VALIDATION_MESSAGES, messages);
        final ImmutableMap.Builder<String, List<String>> builder = ImmutableMap.builder();
        messages.forEach((field, fieldMessages) -> builder.put(field, ImmutableList.copyOf(fieldMessages)));
        this.messages = builder.build();
    }

    /**
     * Get the messages per field.
     * @return an immutable mapping from field name to messages, in the order the messages were produced
     */
    @Nonnull
    public Map<String, List<String>> getMessages() {
        return messages;
    }

    @Override
    public String getMessage() {
        if (messages.size() == 1 && messages.containsKey(GENERAL_KEY)) {
            return super.getMessage();
        }
        return super.getMessage() + " " + messages;
    }
}
