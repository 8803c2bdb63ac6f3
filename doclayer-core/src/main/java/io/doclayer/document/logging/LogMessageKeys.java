/*
 * LogMessageKeys.java
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

import io.doclayer.annotation.API;

import java.util.Locale;

/**
 * Common {@link KeyValueLogMessage} keys logged by the document layer.
 * Keys are kept in one place so that collisions are easy to spot and the same concept is always logged under the
 * same name.
 */
@API(API.Status.UNSTABLE)
public enum LogMessageKeys {
    // metadata
    DOCUMENT_TYPE,
    PARENT_TYPE,
    SCHEMA_NAME,
    FIELD_NAME,
    FIELD_NAMES,
    FIELD_KIND,
    EXPECTED_KIND,
    STORAGE_ATTRIBUTE,
    DISCRIMINATOR,
    // store access
    COLLECTION,
    IDENTITY,
    QUERY,
    CONDITIONS,
    MATCHED_COUNT,
    LIMIT,
    SKIP,
    BATCH_SIZE,
    // indexes
    INDEX_NAME,
    INDEX_KEYS,
    EXISTING_INDEX,
    // lifecycle
    OPERATION,
    DIRTY_FIELDS,
    // validation
    VALIDATION_MESSAGES,
    // asyncToSync timeouts
    TIME_LIMIT,
    TIME_UNIT,
    // configuration properties
    PROPERTY_NAME,
    PROPERTY_TYPE,
    // layer setup
    DRIVER,
    TYPE_COUNT;

    private final String logKey;

    LogMessageKeys() {
        this.logKey = name().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return logKey;
    }
}
