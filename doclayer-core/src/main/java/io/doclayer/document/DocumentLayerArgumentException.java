/*
 * DocumentLayerArgumentException.java
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
 * Functional equivalent of <code>IllegalArgumentException</code>. Thrown for programming errors, such as setting an
 * unknown field or passing update conditions to the first commit of a document.
 */
@API(API.Status.UNSTABLE)
public class DocumentLayerArgumentException extends DocumentLayerException {
    private static final long serialVersionUID = 1;

    public DocumentLayerArgumentException(@Nonnull String msg, @Nonnull Object... keyValue) {
        super(msg, keyValue);
    }

    public DocumentLayerArgumentException(@Nonnull String msg, @Nonnull Throwable cause) {
        super(msg, cause);
    }
}
