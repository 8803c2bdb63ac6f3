/*
 * KeyValueLogMessageTest.java
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

package io.doclayer.document.logging;

import org.junit.jupiter.api.Test;

import java.util.Locale;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link KeyValueLogMessage}.
 */
public class KeyValueLogMessageTest {

    @Test
    public void keysAreSorted() {
        assertEquals("inserted document collection=\"student\" document_type=\"Student\" identity=\"42\"",
                KeyValueLogMessage.of("inserted document",
                        LogMessageKeys.IDENTITY, 42,
                        LogMessageKeys.DOCUMENT_TYPE, "Student",
                        LogMessageKeys.COLLECTION, "student"));
    }

    @Test
    public void keysAreSnakeCaseNames() {
        assertEquals("document layer initialized driver=\"InMemoryDocumentDriver\" type_count=\"3\"",
                KeyValueLogMessage.of("document layer initialized",
                        LogMessageKeys.TYPE_COUNT, 3,
                        LogMessageKeys.DRIVER, "InMemoryDocumentDriver"));
        for (LogMessageKeys key : LogMessageKeys.values()) {
            assertEquals(key.name().toLowerCase(Locale.ROOT), key.toString());
        }
    }

    @Test
    public void quotesAndEqualsAreSanitized() {
        final KeyValueLogMessage message = KeyValueLogMessage.build("query")
                .addKeyAndValue("a=b", "say \"hi\"")
                .addKeysAndValues(Map.of("empty", ""));
        assertEquals(Map.of("ab", "say 'hi'", "empty", ""), message.getKeyValueMap());
        assertEquals("query ab=\"say 'hi'\" empty=\"\"", message.toString());
    }

    @Test
    public void nullValuesArePrinted() {
        assertEquals("lookup parent_type=\"null\"", KeyValueLogMessage.of("lookup", LogMessageKeys.PARENT_TYPE, null));
    }

    @Test
    public void unbalancedArgumentsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> KeyValueLogMessage.of("oops", LogMessageKeys.QUERY));
        assertThrows(IllegalArgumentException.class, () -> KeyValueLogMessage.build("oops").addKeyAndValue(null, 1));
    }
}
