/*
 * StoredValues.java
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

import com.google.common.base.Splitter;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Helpers for the plain values held by the in-memory store: copying, comparing, and reading dotted paths.
 */
final class StoredValues {
    private static final Splitter PATH_SPLITTER = Splitter.on('.');

    private StoredValues() {
    }

    /**
     * Copy maps and lists recursively, so that the store never shares mutable state with its callers.
     */
    @Nullable
    @SuppressWarnings("unchecked")
    static Object deepCopy(@Nullable Object value) {
        if (value instanceof Map) {
            final Map<String, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<String, Object> entry : ((Map<String, Object>)value).entrySet()) {
                copy.put(entry.getKey(), deepCopy(entry.getValue()));
            }
            return copy;
        }
        if (value instanceof List) {
            final List<Object> copy = new ArrayList<>();
            for (Object element : (List<?>)value) {
                copy.add(deepCopy(element));
            }
            return copy;
        }
        return value;
    }

    @Nonnull
    @SuppressWarnings("unchecked")
    static Map<String, Object> copyDocument(@Nonnull Map<String, Object> document) {
        return (Map<String, Object>)deepCopy(document);
    }

    @Nonnull
    static List<String> splitPath(@Nonnull String path) {
        return PATH_SPLITTER.splitToList(path);
    }

    /**
     * Collect the values found at a dotted path. Lists are traversed: a path segment that is not a position is
     * applied to every element of the list.
     *
     * @return the values at the path; empty if the path does not exist
     */
    @Nonnull
    static List<Object> valuesAt(@Nullable Object current, @Nonnull String path) {
        final List<Object> values = new ArrayList<>();
        collect(current, splitPath(path), 0, values);
        return values;
    }

    private static void collect(@Nullable Object current, @Nonnull List<String> segments, int index, @Nonnull List<Object> values) {
        if (index == segments.size()) {
            values.add(current);
            return;
        }
        final String segment = segments.get(index);
        if (current instanceof Map) {
            final Map<?, ?> map = (Map<?, ?>)current;
            if (map.containsKey(segment)) {
                collect(map.get(segment), segments, index + 1, values);
            }
        } else if (current instanceof List) {
            final List<?> list = (List<?>)current;
            final Integer position = positionOf(segment);
            if (position != null) {
                if (position < list.size()) {
                    collect(list.get(position), segments, index + 1, values);
                }
            } else {
                for (Object element : list) {
                    if (element instanceof Map) {
                        collect(element, segments, index, values);
                    }
                }
            }
        }
    }

    @Nullable
    private static Integer positionOf(@Nonnull String segment) {
        if (segment.isEmpty() || !segment.chars().allMatch(Character::isDigit)) {
            return null;
        }
        try {
            return Integer.valueOf(segment);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Set the value at a dotted path, creating intermediate maps as needed.
     */
    @SuppressWarnings("unchecked")
    static void setPath(@Nonnull Map<String, Object> document, @Nonnull String path, @Nullable Object value) {
        final List<String> segments = splitPath(path);
        Map<String, Object> current = document;
        for (int i = 0; i < segments.size() - 1; i++) {
            final Object next = current.get(segments.get(i));
            if (next instanceof Map) {
                current = (Map<String, Object>)next;
            } else {
                final Map<String, Object> created = new LinkedHashMap<>();
                current.put(segments.get(i), created);
                current = created;
            }
        }
        current.put(segments.get(segments.size() - 1), deepCopy(value));
    }

    @SuppressWarnings("unchecked")
    static void unsetPath(@Nonnull Map<String, Object> document, @Nonnull String path) {
        final List<String> segments = splitPath(path);
        Map<String, Object> current = document;
        for (int i = 0; i < segments.size() - 1; i++) {
            final Object next = current.get(segments.get(i));
            if (!(next instanceof Map)) {
                return;
            }
            current = (Map<String, Object>)next;
        }
        current.remove(segments.get(segments.size() - 1));
    }

    /**
     * Compare values the way the store does: numbers by numeric value whatever their class, maps and lists
     * element by element.
     */
    static boolean valueEquals(@Nullable Object a, @Nullable Object b) {
        if (a instanceof Number && b instanceof Number) {
            return compareNumbers((Number)a, (Number)b) == 0;
        }
        if (a instanceof Map && b instanceof Map) {
            final Map<?, ?> mapA = (Map<?, ?>)a;
            final Map<?, ?> mapB = (Map<?, ?>)b;
            if (mapA.size() != mapB.size()) {
                return false;
            }
            for (Map.Entry<?, ?> entry : mapA.entrySet()) {
                if (!mapB.containsKey(entry.getKey()) || !valueEquals(entry.getValue(), mapB.get(entry.getKey()))) {
                    return false;
                }
            }
            return true;
        }
        if (a instanceof List && b instanceof List) {
            final List<?> listA = (List<?>)a;
            final List<?> listB = (List<?>)b;
            if (listA.size() != listB.size()) {
                return false;
            }
            final Iterator<?> iterB = listB.iterator();
            for (Object elementA : listA) {
                if (!valueEquals(elementA, iterB.next())) {
                    return false;
                }
            }
            return true;
        }
        return Objects.equals(a, b);
    }

    /**
     * Compare two values for ordering.
     * @return the comparison, or {@code null} if the values are not comparable with each other
     */
    @Nullable
    @SuppressWarnings({"unchecked", "rawtypes"})
    static Integer compare(@Nullable Object a, @Nullable Object b) {
        if (a instanceof Number && b instanceof Number) {
            return compareNumbers((Number)a, (Number)b);
        }
        if (a instanceof Comparable && b != null && a.getClass().equals(b.getClass())) {
            return ((Comparable)a).compareTo(b);
        }
        return null;
    }

    static int compareNumbers(@Nonnull Number a, @Nonnull Number b) {
        if (isIntegral(a) && isIntegral(b)) {
            return Long.compare(a.longValue(), b.longValue());
        }
        return toBigDecimal(a).compareTo(toBigDecimal(b));
    }

    private static boolean isIntegral(@Nonnull Number n) {
        return n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte;
    }

    @Nonnull
    private static BigDecimal toBigDecimal(@Nonnull Number n) {
        if (n instanceof BigDecimal) {
            return (BigDecimal)n;
        }
        if (n instanceof BigInteger) {
            return new BigDecimal((BigInteger)n);
        }
        if (isIntegral(n)) {
            return BigDecimal.valueOf(n.longValue());
        }
        return BigDecimal.valueOf(n.doubleValue());
    }

    /**
     * Turn a value into a form whose {@code equals} matches {@link #valueEquals}, for use as an index key.
     */
    @Nullable
    static Object indexKeyOf(@Nullable Object value) {
        if (value instanceof Number) {
            return toBigDecimal((Number)value).stripTrailingZeros();
        }
        if (value instanceof Map) {
            final Map<Object, Object> normalized = new LinkedHashMap<>();
            ((Map<?, ?>)value).forEach((k, v) -> normalized.put(k, indexKeyOf(v)));
            return normalized;
        }
        if (value instanceof List) {
            final List<Object> normalized = new ArrayList<>();
            ((List<?>)value).forEach(v -> normalized.add(indexKeyOf(v)));
            return Collections.unmodifiableList(normalized);
        }
        return value;
    }
}
