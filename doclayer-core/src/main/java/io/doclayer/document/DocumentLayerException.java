/*
 * DocumentLayerException.java
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
import io.doclayer.util.LoggableException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Base class for all exceptions thrown by the document layer. Like every {@link LoggableException}, it carries key/value
 * pairs (usually keyed by {@link io.doclayer.document.logging.LogMessageKeys}) that describe the failure.
 */
@API(API.Status.STABLE)
public class DocumentLayerException extends LoggableException {
    private static final long serialVersionUID = 1;

    public DocumentLayerException(@Nonnull String msg, @Nullable Object... keyValues) {
        super(msg, keyValues);
    }

    public DocumentLayerException(@Nonnull String msg, @Nullable Throwable cause) {
        super(msg, cause);
    }

    public DocumentLayerException(@Nonnull Throwable cause) {
        super(cause);
    }
}
