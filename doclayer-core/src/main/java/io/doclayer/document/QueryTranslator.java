/*
 * QueryTranslator.java
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

import com.google.common.collect.ImmutableSet;
import io.doclayer.annotation.API;
import io.doclayer.document.metadata.DocumentRegistry;
import io.doclayer.document.metadata.DocumentType;
import io.doclayer.document.metadata.FieldDescriptor;
import io.doclayer.document.metadata.FieldKind;
import io.doclayer.document.metadata.Schema;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Translates queries written with in-memory field names into queries on storage attributes.
 *
 * <p>
 * Keys are dotted paths of field names, resolved against the schema of the queried type and, failing that, against
 * the schemas of its descendants, so that a query on a root type can name fields only its subtypes have. Keys that
 * resolve nowhere are passed through unchanged. Values are converted to their storage form: documents and references
 * become identities, embedded documents (or maps given for embedded fields) become storage maps. The logical
 * operators {@code $and}, {@code $or} and {@code $nor} are translated recursively; the operand lists of {@code $in},
 * {@code $nin} and {@code $all} are converted element by element.
 * </p>
 */
@API(API.Status.INTERNAL)
public class QueryTranslator {
    private static final ImmutableSet<String> LOGICAL_OPERATORS = ImmutableSet.of("$and", "$or", "$nor");
    private static final ImmutableSet<String> LIST_OPERATORS = ImmutableSet.of("$in", "$nin", "$all");

    @Nonnull
    private final DocumentRegistry registry;
    @Nonnull
    private final PayloadTranslator translator;

    public QueryTranslator(@Nonnull DocumentRegistry registry, @Nonnull PayloadTranslator translator) {
        this.registry = registry;
        this.translator = translator;
    }

    /**
     * Translate a query.
     * @param documentType the queried type
     * @param query the query in in-memory field names
     * @return a new query in storage attributes
     */
    @Nonnull
    public Map<String, Object> translate(@Nonnull DocumentType documentType, @Nonnull Map<String, ?> query) {
        final Map<String, Object> translated = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : query.entrySet()) {
            final String key = entry.getKey();
            if (LOGICAL_OPERATORS.contains(key) && entry.getValue() instanceof Collection) {
                final List<Object> clauses = new ArrayList<>();
                for (Object clause : (Collection<?>)entry.getValue()) {
                    clauses.add(clause instanceof Map ? translate(documentType, asQuery((Map<?, ?>)clause)) : clause);
                }
                translated.put(key, clauses);
            } else if (key.startsWith("$")) {
                translated.put(key, entry.getValue());
            } else {
                final Schema.ResolvedPath path = resolve(documentType, key);
                if (path == null) {
                    translated.put(key, entry.getValue());
                } else {
                    translated.put(path.getStoragePath(), translateCondition(path.getField(), entry.getValue()));
                }
            }
        }
        return translated;
    }

    @Nullable
    private Schema.ResolvedPath resolve(@Nonnull DocumentType documentType, @Nonnull String path) {
        final Schema.ResolvedPath resolved = documentType.getSchema().resolvePath(path);
        if (resolved != null) {
            return resolved;
        }
        for (DocumentType descendant : registry.getDescendants(documentType)) {
            final Schema.ResolvedPath descendantPath = descendant.getSchema().resolvePath(path);
            if (descendantPath != null) {
                return descendantPath;
            }
        }
        return null;
    }

    @Nullable
    private Object translateCondition(@Nullable FieldDescriptor field, @Nullable Object condition) {
        if (!isOperatorMap(condition)) {
            return toStorageValue(field, condition);
        }
        final Map<String, Object> operators = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : ((Map<?, ?>)condition).entrySet()) {
            final String operator = (String)entry.getKey();
            final Object operand = entry.getValue();
            if (LIST_OPERATORS.contains(operator) && operand instanceof Collection) {
                final List<Object> values = new ArrayList<>();
                for (Object value : (Collection<?>)operand) {
                    values.add(toStorageValue(elementOf(field), value));
                }
                operators.put(operator, values);
            } else if ("$exists".equals(operator)) {
                operators.put(operator, operand);
            } else {
                operators.put(operator, toStorageValue(field, operand));
            }
        }
        return operators;
    }

    @Nullable
    private Object toStorageValue(@Nullable FieldDescriptor field, @Nullable Object value) {
        if (value instanceof Collection) {
            final List<Object> values = new ArrayList<>();
            for (Object element : (Collection<?>)value) {
                values.add(toStorageValue(elementOf(field), element));
            }
            return values;
        }
        if (field == null) {
            if (value instanceof Document) {
                return ((Document)value).getId();
            }
            if (value instanceof Reference) {
                return ((Reference)value).getId();
            }
            return value instanceof EmbeddedDocument ? ((EmbeddedDocument)value).toStorage() : value;
        }
        final FieldDescriptor target = elementOf(field);
        if (value instanceof Map && target.getKind() == FieldKind.EMBEDDED) {
            return translator.toStorageValue(target, translator.toFieldValue(target, value));
        }
        return translator.toStorageValue(target, value);
    }

    @Nullable
    private static FieldDescriptor elementOf(@Nullable FieldDescriptor field) {
        return field != null && field.getKind() == FieldKind.LIST ? field.getElementField() : field;
    }

    private static boolean isOperatorMap(@Nullable Object value) {
        if (!(value instanceof Map) || ((Map<?, ?>)value).isEmpty()) {
            return false;
        }
        for (Object key : ((Map<?, ?>)value).keySet()) {
            if (!(key instanceof String) || !((String)key).startsWith("$")) {
                return false;
            }
        }
        return true;
    }

    @Nonnull
    private static Map<String, Object> asQuery(@Nonnull Map<?, ?> clause) {
        final Map<String, Object> query = new LinkedHashMap<>();
        clause.forEach((key, value) -> query.put(String.valueOf(key), value));
        return query;
    }
}
