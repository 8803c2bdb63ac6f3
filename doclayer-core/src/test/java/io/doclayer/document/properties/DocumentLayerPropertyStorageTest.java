/*
 * DocumentLayerPropertyStorageTest.java
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

package io.doclayer.document.properties;

import io.doclayer.document.DocumentLayerArgumentException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link DocumentLayerPropertyStorage}.
 */
public class DocumentLayerPropertyStorageTest {

    @Test
    public void defaultsApplyWhenUnset() {
        final DocumentLayerPropertyStorage empty = DocumentLayerPropertyStorage.getEmptyInstance();
        assertTrue(empty.getPropertyValue(DocumentLayerProperties.CHECK_UNIQUE_CONSTRAINTS));
        assertTrue(empty.getPropertyValue(DocumentLayerProperties.VALIDATE_REFERENCES));
        assertEquals(100, empty.getPropertyValue(DocumentLayerProperties.FIND_BATCH_SIZE));
        assertEquals(Long.MAX_VALUE, empty.getPropertyValue(DocumentLayerProperties.OPERATION_TIMEOUT_MILLIS));
        assertTrue(empty.getPropertyMap().isEmpty());
    }

    @Test
    public void setValuesOverrideDefaults() {
        final DocumentLayerPropertyStorage storage = DocumentLayerPropertyStorage.newBuilder()
                .addProp(DocumentLayerProperties.FIND_BATCH_SIZE, 10)
                .addProp(DocumentLayerProperties.VALIDATE_REFERENCES, false)
                .build();
        assertEquals(10, storage.getPropertyValue(DocumentLayerProperties.FIND_BATCH_SIZE));
        assertFalse(storage.getPropertyValue(DocumentLayerProperties.VALIDATE_REFERENCES));

        final DocumentLayerPropertyStorage changed = storage.toBuilder()
                .removeProp(DocumentLayerProperties.FIND_BATCH_SIZE)
                .addProp(DocumentLayerProperties.VALIDATE_REFERENCES, true)
                .build();
        assertEquals(100, changed.getPropertyValue(DocumentLayerProperties.FIND_BATCH_SIZE));
        assertTrue(changed.getPropertyValue(DocumentLayerProperties.VALIDATE_REFERENCES));
        assertEquals(10, storage.getPropertyValue(DocumentLayerProperties.FIND_BATCH_SIZE));
    }

    @Test
    @SuppressWarnings({"unchecked", "rawtypes"})
    public void valueMustMatchKeyType() {
        final DocumentLayerPropertyKey rawKey = DocumentLayerProperties.FIND_BATCH_SIZE;
        assertThrows(DocumentLayerArgumentException.class,
                () -> DocumentLayerPropertyStorage.newBuilder().addProp(rawKey, "ten"));
    }

    @Test
    public void keysAreEqualByNameAndType() {
        assertEquals(DocumentLayerProperties.FIND_BATCH_SIZE,
                DocumentLayerPropertyKey.integerPropertyKey("io.doclayer.document.find_batch_size", 5));
    }
}
