/*
 * ValidatorsTest.java
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

import io.doclayer.document.metadata.FieldDescriptor;
import io.doclayer.document.metadata.Fields;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link Validators}.
 */
public class ValidatorsTest {
    private static final FieldDescriptor FIELD = Fields.string().build("field");

    private static String messageOf(FieldValidator validator, Object value) {
        final ValidationException failure = assertThrows(ValidationException.class, () -> validator.validate(FIELD, value));
        return failure.getMessages().get(ValidationException.GENERAL_KEY).get(0);
    }

    @Test
    public void length() {
        final FieldValidator between = Validators.length(2, 4);
        assertDoesNotThrow(() -> between.validate(FIELD, "abc"));
        assertDoesNotThrow(() -> between.validate(FIELD, List.of(1, 2)));
        assertDoesNotThrow(() -> between.validate(FIELD, Map.of("a", 1, "b", 2, "c", 3, "d", 4)));
        assertEquals("Length must be between 2 and 4.", messageOf(between, "a"));
        assertEquals("Length must be between 2 and 4.", messageOf(between, "abcde"));
        assertEquals("Length must be less than or equal to 1.", messageOf(Validators.length(null, 1), "ab"));
        assertEquals("Value has no length.", messageOf(between, 12));
    }

    @Test
    public void range() {
        final FieldValidator percent = Validators.range(0, 100);
        assertDoesNotThrow(() -> percent.validate(FIELD, 0));
        assertDoesNotThrow(() -> percent.validate(FIELD, 99.5));
        assertEquals("Value must be between 0 and 100.", messageOf(percent, 101L));
        assertEquals("Value must be greater than or equal to 1.5.", messageOf(Validators.range(1.5, null), 1));
        assertEquals("Not a valid number.", messageOf(percent, "50"));
    }

    @Test
    public void oneOf() {
        final FieldValidator colors = Validators.oneOf("red", "green");
        assertDoesNotThrow(() -> colors.validate(FIELD, "red"));
        assertEquals("Must be one of: red, green.", messageOf(colors, "blue"));
    }

    @Test
    public void regexpMatchesFromStart() {
        final FieldValidator digits = Validators.regexp("[0-9]+");
        assertDoesNotThrow(() -> digits.validate(FIELD, "123abc"));
        assertEquals("String does not match expected pattern.", messageOf(digits, "abc123"));
        assertEquals("String does not match expected pattern.", messageOf(digits, 123));
    }
}
