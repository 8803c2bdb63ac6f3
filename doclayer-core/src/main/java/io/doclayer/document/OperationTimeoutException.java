/*
 * OperationTimeoutException.java
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

package io.doclayer.document;

import io.doclayer.annotation.API;

import javax.annotation.Nonnull;

/**
 * Thrown by {@link DocumentLayer#asyncToSync(java.util.concurrent.CompletableFuture)} when an operation does not
 * complete within the configured time limit. The document the operation was working on keeps its previous in-memory
 * state, but a store write that was already in flight may or may not have been applied.
 */
@API(API.Status.UNSTABLE)
public class OperationTimeoutException extends DocumentLayerException {
    private static final long serialVersionUID = 1;

    public OperationTimeoutException(@Nonnull String msg, @Nonnull Throwable cause) {
        super(msg, cause);
    }
}
