/*
 * Validators.java
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

import com.google.common.collect.ImmutableList;
import io.doclayer.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collection;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Common {@link FieldValidator}s.
 */
@API(API.Status.STABLE)
public class Validators {

    private Validators() {
    }

    /**
     * Check the length of a string, collection or map.
     * @param min the minimum length, or {@code null} for none
     * @param max the maximum length, or {@code null} for none
     * @return a new validator
     */
    @Nonnull
    public static FieldValidator length(@Nullable Integer min, @Nullable Integer max) {
        return (field, value) -> {
            final int length;
            if (value instanceof CharSequence) {
                length = ((CharSequence)value).length();
            } else if (value instanceof Collection) {
                length = ((Collection<?>)value).size();
            } else if (value instanceof Map) {
                length = ((Map<?, ?>)value).size();
            } else {
                throw new ValidationException("Value has no length.");
            }
            if (min != null && length < min || max != null && length > max) {
                throw new ValidationException(boundsMessage("Length", min, max));
            }
        };
    }

    /**
     * Check that a number lies within bounds (inclusive).
     * @param min the minimum, or {@code null} for none
     * @param max the maximum, or {@code null} for none
     * @return a new validator
     */
    @Nonnull
    public static FieldValidator range(@Nullable Number min, @Nullable Number max) {
        return (field, value) -> {
            if (!(value instanceof Number)) {
                throw new ValidationException("Not a valid number.");
            }
            final double number = ((Number)value).doubleValue();
            if (min != null && number < min.doubleValue() || max != null && number > max.doubleValue()) {
                throw new ValidationException(boundsMessage("Value", min, max));
            }
        };
    }

    @Nonnull
    public static FieldValidator oneOf(@Nonnull Object... choices) {
        final ImmutableList<Object> allowed = ImmutableList.copyOf(choices);
        final String choicesText = allowed.stream().map(String::valueOf).collect(Collectors.joining(", "));
        return (field, value) -> {
            if (!allowed.contains(value)) {
                throw new ValidationException("Must be one of: " + choicesText + ".");
            }
        };
    }

    /**
     * Check that a string matches a regular expression from its start. As with {@link java.util.regex.Matcher#lookingAt()},
     * the expression does not need to match the whole value.
     * @param regex the regular expression
     * @return a new validator
     */
    @Nonnull
    public static FieldValidator regexp(@Nonnull String regex) {
        final Pattern pattern = Pattern.compile(regex);
        return (field, value) -> {
            if (!(value instanceof CharSequence) || !pattern.matcher((CharSequence)value).lookingAt()) {
                throw new ValidationException("String does not match expected pattern.");
            }
        };
    }

    @Nonnull
    private static String boundsMessage(@Nonnull String subject, @Nullable Number min, @Nullable Number max) {
        if (min != null && max != null) {
            return subject + " must be between " + min + " and " + max + ".";
        } else if (min != null) {
            return subject + " must be greater than or equal to " + min + ".";
        } else {
            return subject + " must be less than or equal to " + max + ".";
        }
    }
}
