/*
 * QueryMatcher.java
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

package io.doclayer.document.driver.memory;

import io.doclayer.document.driver.DocumentDriverException;
import io.doclayer.document.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Evaluates a storage query against a stored document.
 *
 * <p>
 * Supported: equality on dotted paths (matching a list that contains the value as well), the comparison operators
 * {@code $eq}, {@code $ne}, {@code $gt}, {@code $gte}, {@code $lt}, {@code $lte}, the set operators {@code $in},
 * {@code $nin}, {@code $all}, {@code $exists}, and the logical operators {@code $and}, {@code $or}, {@code $nor}.
 * A {@code null} value matches documents where the path is missing or holds {@code null}.
 * </p>
 */
class QueryMatcher {

    private QueryMatcher() {
    }

    static boolean matches(@Nonnull Map<String, Object> document, @Nonnull Map<String, Object> query) {
        for (Map.Entry<String, Object> entry : query.entrySet()) {
            final String key = entry.getKey();
            final boolean matched;
            switch (key) {
                case "$and":
                    matched = subQueries(key, entry.getValue()).stream().allMatch(sub -> matches(document, sub));
                    break;
                case "$or":
                    matched = subQueries(key, entry.getValue()).stream().anyMatch(sub -> matches(document, sub));
                    break;
                case "$nor":
                    matched = subQueries(key, entry.getValue()).stream().noneMatch(sub -> matches(document, sub));
                    break;
                default:
                    if (key.startsWith("$")) {
                        throw unsupported(key);
                    }
                    matched = matchesCondition(StoredValues.valuesAt(document, key), entry.getValue());
                    break;
            }
            if (!matched) {
                return false;
            }
        }
        return true;
    }

    @Nonnull
    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> subQueries(@Nonnull String operator, @Nullable Object value) {
        if (!(value instanceof Collection)) {
            throw new DocumentDriverException("logical operator needs a list of queries", LogMessageKeys.QUERY, operator);
        }
        final List<Map<String, Object>> queries = new ArrayList<>();
        for (Object element : (Collection<?>)value) {
            if (!(element instanceof Map)) {
                throw new DocumentDriverException("logical operator needs a list of queries", LogMessageKeys.QUERY, operator);
            }
            queries.add((Map<String, Object>)element);
        }
        return queries;
    }

    private static boolean matchesCondition(@Nonnull List<Object> candidates, @Nullable Object condition) {
        if (isOperatorMap(condition)) {
            for (Map.Entry<?, ?> entry : ((Map<?, ?>)condition).entrySet()) {
                if (!matchesOperator(candidates, (String)entry.getKey(), entry.getValue())) {
                    return false;
                }
            }
            return true;
        }
        return matchesEquality(candidates, condition);
    }

    private static boolean isOperatorMap(@Nullable Object condition) {
        if (!(condition instanceof Map) || ((Map<?, ?>)condition).isEmpty()) {
            return false;
        }
        for (Object key : ((Map<?, ?>)condition).keySet()) {
            if (!(key instanceof String) || !((String)key).startsWith("$")) {
                return false;
            }
        }
        return true;
    }

    private static boolean matchesOperator(@Nonnull List<Object> candidates, @Nonnull String operator, @Nullable Object operand) {
        switch (operator) {
            case "$eq":
                return matchesEquality(candidates, operand);
            case "$ne":
                return !matchesEquality(candidates, operand);
            case "$in":
                return operandList(operator, operand).stream().anyMatch(value -> matchesEquality(candidates, value));
            case "$nin":
                return operandList(operator, operand).stream().noneMatch(value -> matchesEquality(candidates, value));
            case "$all":
                return operandList(operator, operand).stream().allMatch(value -> matchesEquality(candidates, value));
            case "$exists":
                return Boolean.TRUE.equals(operand) != candidates.isEmpty();
            case "$gt":
                return matchesComparison(candidates, operand, comparison -> comparison > 0);
            case "$gte":
                return matchesComparison(candidates, operand, comparison -> comparison >= 0);
            case "$lt":
                return matchesComparison(candidates, operand, comparison -> comparison < 0);
            case "$lte":
                return matchesComparison(candidates, operand, comparison -> comparison <= 0);
            default:
                throw unsupported(operator);
        }
    }

    @Nonnull
    private static Collection<?> operandList(@Nonnull String operator, @Nullable Object operand) {
        if (!(operand instanceof Collection)) {
            throw new DocumentDriverException("operator needs a list", LogMessageKeys.QUERY, operator);
        }
        return (Collection<?>)operand;
    }

    private static boolean matchesEquality(@Nonnull List<Object> candidates, @Nullable Object value) {
        if (value == null && candidates.isEmpty()) {
            return true;
        }
        for (Object candidate : candidates) {
            if (StoredValues.valueEquals(candidate, value)) {
                return true;
            }
            if (candidate instanceof List) {
                for (Object element : (List<?>)candidate) {
                    if (StoredValues.valueEquals(element, value)) {
                        return true;
                    }
                }
            }
        }
        return false;
    }

    private interface ComparisonTest {
        boolean test(int comparison);
    }

    private static boolean matchesComparison(@Nonnull List<Object> candidates, @Nullable Object operand, @Nonnull ComparisonTest test) {
        for (Object candidate : candidates) {
            if (candidate instanceof List) {
                for (Object element : (List<?>)candidate) {
                    final Integer comparison = StoredValues.compare(element, operand);
                    if (comparison != null && test.test(comparison)) {
                        return true;
                    }
                }
            } else {
                final Integer comparison = StoredValues.compare(candidate, operand);
                if (comparison != null && test.test(comparison)) {
                    return true;
                }
            }
        }
        return false;
    }

    @Nonnull
    private static DocumentDriverException unsupported(@Nonnull String operator) {
        return new DocumentDriverException("unsupported query operator", LogMessageKeys.QUERY, operator);
    }
}
