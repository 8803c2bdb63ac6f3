/*
 * WriteResult.java
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

/**
 * The result of a store write performed by a commit: an {@link InsertResult} for a new document, or an
 * {@link UpdateResult} for a modified one.
 */
@API(API.Status.STABLE)
public interface WriteResult {
    /**
     * Whether the store acknowledged the write.
     * @return whether the write was acknowledged
     */
    boolean isAcknowledged();
}
