/*
 * IndexConflictException.java
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

package io.doclayer.document.driver;

import io.doclayer.annotation.API;

import javax.annotation.Nonnull;

/**
 * Thrown by a driver when an index is created under the name of an existing index with a different definition.
 */
@API(API.Status.STABLE)
public class IndexConflictException extends DocumentDriverException {
    private static final long serialVersionUID = 1;

    public IndexConflictException(@Nonnull String msg, @Nonnull Object... keyValues) {
        super(msg, keyValues);
    }
}
