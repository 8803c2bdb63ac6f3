/*
 * DocumentLayerProperties.java
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

import io.doclayer.annotation.API;
import io.doclayer.document.DocumentLayerException;

/**
 * Property keys for the {@link io.doclayer.document.DocumentLayer} and the collections it manages. These affect how
 * operations are orchestrated, never the shape of the stored documents, so they can be changed between runs.
 */
@API(API.Status.EXPERIMENTAL)
public final class DocumentLayerProperties {
    /**
     * Whether a commit counts conflicting documents for every unique index it touches before writing. When disabled,
     * uniqueness is left to the store, which reports a conflict as a driver error rather than as a validation message.
     */
    public static final DocumentLayerPropertyKey<Boolean> CHECK_UNIQUE_CONSTRAINTS = DocumentLayerPropertyKey.booleanPropertyKey(
            "io.doclayer.document.check_unique_constraints", true);

    /**
     * Whether reference fields check that the referenced document exists during asynchronous validation.
     */
    public static final DocumentLayerPropertyKey<Boolean> VALIDATE_REFERENCES = DocumentLayerPropertyKey.booleanPropertyKey(
            "io.doclayer.document.validate_references", true);

    /**
     * The number of documents requested from the store per page by
     * {@link io.doclayer.document.DocumentCollection#findPage(java.util.Map, int, int)}.
     */
    public static final DocumentLayerPropertyKey<Integer> FIND_BATCH_SIZE = DocumentLayerPropertyKey.integerPropertyKey(
            "io.doclayer.document.find_batch_size", 100);

    /**
     * The time limit, in milliseconds, that {@link io.doclayer.document.DocumentLayer#asyncToSync(java.util.concurrent.CompletableFuture)}
     * waits for an operation. {@link Long#MAX_VALUE} means no limit.
     */
    public static final DocumentLayerPropertyKey<Long> OPERATION_TIMEOUT_MILLIS = DocumentLayerPropertyKey.longPropertyKey(
            "io.doclayer.document.operation_timeout_millis", Long.MAX_VALUE);

    private DocumentLayerProperties() {
        throw new DocumentLayerException("should not instantiate class of static prop");
    }
}
