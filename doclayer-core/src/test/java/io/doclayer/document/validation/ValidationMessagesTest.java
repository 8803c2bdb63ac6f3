/*
 * ValidationMessagesTest.java
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

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.not;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link ValidationMessages}.
 */
public class ValidationMessagesTest {

    @Test
    public void nestedMessagesArePrefixed() {
        final ValidationMessages nested = new ValidationMessages()
                .add("city", RequiredFieldException.MISSING_MESSAGE)
                .add("zip", "Not a valid string.");
        final ValidationMessages messages = new ValidationMessages()
                .add("name", "Not a valid string.")
                .addNested("address", nested);
        assertEquals(Map.of(
                "name", List.of("Not a valid string."),
                "address.city", List.of(RequiredFieldException.MISSING_MESSAGE),
                "address.zip", List.of("Not a valid string.")), messages.getMessages());
        assertThat(messages.getMessages().keySet(), contains("name", "address.city", "address.zip"));
        assertTrue(messages.hasMessagesFor("address"));
        assertFalse(messages.hasMessagesFor("addr"));
    }

    @Test
    public void validatorFailuresAreFiledUnderField() {
        final ValidationMessages messages = new ValidationMessages()
                .add("login", new ValidationException("Login is taken."))
                .add("profile", new ValidationException(Map.of("bio", List.of("Too long."))));
        assertEquals(Map.of(
                "login", List.of("Login is taken."),
                "profile.bio", List.of("Too long.")), messages.getMessages());
    }

    @Test
    public void exceptionTypeDependsOnMessages() {
        final ValidationMessages missing = new ValidationMessages()
                .add("name", RequiredFieldException.MISSING_MESSAGE)
                .add("address.city", RequiredFieldException.MISSING_MESSAGE);
        assertThat(missing.toException(), instanceOf(RequiredFieldException.class));

        missing.add("age", "Not a valid integer.");
        final ValidationException mixed = missing.toException();
        assertThat(mixed, not(instanceOf(RequiredFieldException.class)));
        assertEquals(3, mixed.getMessages().size());
    }

    @Test
    public void messagesAccumulate() {
        final ValidationMessages messages = new ValidationMessages().add("tags", "Unknown tag.");
        messages.addAll(new ValidationMessages().add("tags", "Unknown tag.").add("title", "Too short."));
        assertEquals(Map.of(
                "tags", List.of("Unknown tag.", "Unknown tag."),
                "title", List.of("Too short.")), messages.getMessages());
        assertTrue(new ValidationMessages().isEmpty());
    }
}
