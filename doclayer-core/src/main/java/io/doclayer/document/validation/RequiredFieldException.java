/*
 * RequiredFieldException.java
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

package io.doclayer.document.validation;

import io.doclayer.annotation.API;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Map;

/**
 * A {@link ValidationException} for a document whose only failures are required fields without a value.
 */
@API(API.Status.STABLE)
public class RequiredFieldException extends ValidationException {
    private static final long serialVersionUID = 1;

    /**
     * The message reported for a required field without a value.
     */
    public static final String MISSING_MESSAGE = "Missing data for required field.";

    public RequiredFieldException(@Nonnull Map<String, ? extends List<String>> messages) {
        super(messages);
    }
}
