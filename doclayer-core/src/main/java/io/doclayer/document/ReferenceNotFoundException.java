/*
 * ReferenceNotFoundException.java
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
import io.doclayer.document.logging.LogMessageKeys;

import javax.annotation.Nonnull;

/**
 * Thrown by {@link Reference#fetch()} when the referenced document does not exist. During validation, the same
 * condition is reported as a message on the referencing field instead.
 */
@API(API.Status.STABLE)
public class ReferenceNotFoundException extends DocumentLayerException {
    private static final long serialVersionUID = 1;

    public ReferenceNotFoundException(@Nonnull String targetType, @Nonnull Object id) {
        super(messageFor(targetType), LogMessageKeys.DOCUMENT_TYPE, targetType, LogMessageKeys.IDENTITY, id);
    }

    @Nonnull
    public static String messageFor(@Nonnull String targetType) {
        return "Reference not found for document " + targetType + ".";
    }
}
