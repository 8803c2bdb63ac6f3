/*
 * InMemoryCollection.java
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

import io.doclayer.document.driver.DeleteResult;
import io.doclayer.document.driver.DocumentDriverException;
import io.doclayer.document.driver.DriverBatch;
import io.doclayer.document.driver.DuplicateKeyException;
import io.doclayer.document.driver.FindOptions;
import io.doclayer.document.driver.IndexConflictException;
import io.doclayer.document.driver.InsertResult;
import io.doclayer.document.driver.UpdateResult;
import io.doclayer.document.logging.LogMessageKeys;
import io.doclayer.document.metadata.IndexDescriptor;
import io.doclayer.document.metadata.Schema;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * One collection of the {@link InMemoryDocumentDriver}: documents in insertion order plus their indexes. All methods
 * are synchronized, so each operation is atomic.
 */
class InMemoryCollection {
    private static final int CONTINUATION_LENGTH = 2 * Long.BYTES;

    @Nonnull
    private final String name;
    @Nonnull
    private final List<Map<String, Object>> documents = new ArrayList<>();
    @Nonnull
    private final Map<String, IndexDescriptor> indexes = new LinkedHashMap<>();

    InMemoryCollection(@Nonnull String name) {
        this.name = name;
        indexes.put(IndexDescriptor.ID_INDEX.getName(), IndexDescriptor.ID_INDEX);
    }

    @Nonnull
    synchronized InsertResult insert(@Nonnull Map<String, Object> document) {
        final Map<String, Object> stored = StoredValues.copyDocument(document);
        final Object id = stored.get(Schema.ID_ATTRIBUTE);
        if (id == null) {
            throw new DocumentDriverException("document to insert has no identity", LogMessageKeys.COLLECTION, name);
        }
        checkUniqueIndexes(stored, null);
        documents.add(stored);
        return new InsertResult(id);
    }

    @Nonnull
    synchronized UpdateResult update(@Nonnull Map<String, Object> query, @Nonnull Map<String, Object> update, boolean upsert) {
        final int position = firstMatch(query);
        if (position < 0) {
            if (!upsert) {
                return new UpdateResult(0, 0, null);
            }
            final Map<String, Object> upserted = applyUpdate(equalityFields(query), update);
            if (!upserted.containsKey(Schema.ID_ATTRIBUTE)) {
                upserted.put(Schema.ID_ATTRIBUTE, UUID.randomUUID());
            }
            checkUniqueIndexes(upserted, null);
            documents.add(upserted);
            return new UpdateResult(0, 0, upserted.get(Schema.ID_ATTRIBUTE));
        }
        final Map<String, Object> existing = documents.get(position);
        final Map<String, Object> updated = applyUpdate(existing, update);
        if (!StoredValues.valueEquals(existing.get(Schema.ID_ATTRIBUTE), updated.get(Schema.ID_ATTRIBUTE))) {
            throw new DocumentDriverException("update cannot change the identity of a document",
                    LogMessageKeys.COLLECTION, name,
                    LogMessageKeys.IDENTITY, existing.get(Schema.ID_ATTRIBUTE));
        }
        checkUniqueIndexes(updated, existing);
        documents.set(position, updated);
        return new UpdateResult(1, StoredValues.valueEquals(existing, updated) ? 0 : 1, null);
    }

    @Nonnull
    synchronized DeleteResult delete(@Nonnull Map<String, Object> query) {
        final int position = firstMatch(query);
        if (position < 0) {
            return new DeleteResult(0);
        }
        documents.remove(position);
        return new DeleteResult(1);
    }

    @Nonnull
    synchronized List<Map<String, Object>> find(@Nonnull Map<String, Object> query, @Nonnull FindOptions options) {
        final List<Map<String, Object>> matching = matching(query);
        final int from = Math.min(options.getSkip(), matching.size());
        final int to = options.hasLimit() ? Math.min(matching.size(), from + options.getLimit()) : matching.size();
        return copies(matching.subList(from, to));
    }

    @Nonnull
    synchronized DriverBatch findBatch(@Nonnull Map<String, Object> query, @Nonnull FindOptions options,
                                       @Nullable byte[] continuation) {
        long position;
        long remaining;
        if (continuation == null) {
            position = options.getSkip();
            remaining = options.hasLimit() ? options.getLimit() : -1L;
        } else {
            if (continuation.length != CONTINUATION_LENGTH) {
                throw new DocumentDriverException("invalid continuation", LogMessageKeys.COLLECTION, name);
            }
            final ByteBuffer buffer = ByteBuffer.wrap(continuation);
            position = buffer.getLong();
            remaining = buffer.getLong();
        }
        final List<Map<String, Object>> matching = matching(query);
        int count = options.getBatchSize();
        if (remaining >= 0) {
            count = (int)Math.min(count, remaining);
        }
        final int from = (int)Math.min(position, matching.size());
        final int to = Math.min(matching.size(), from + count);
        final List<Map<String, Object>> batch = copies(matching.subList(from, to));
        if (batch.isEmpty()) {
            return new DriverBatch(batch, null);
        }
        final byte[] next = ByteBuffer.allocate(CONTINUATION_LENGTH)
                .putLong(to)
                .putLong(remaining < 0 ? -1L : remaining - batch.size())
                .array();
        return new DriverBatch(batch, next);
    }

    synchronized long count(@Nonnull Map<String, Object> query) {
        return matching(query).size();
    }

    synchronized void createIndex(@Nonnull IndexDescriptor index) {
        final IndexDescriptor existing = indexes.get(index.getName());
        if (existing != null) {
            if (!existing.equals(index)) {
                throw new IndexConflictException("index already exists with a different definition",
                        LogMessageKeys.COLLECTION, name,
                        LogMessageKeys.INDEX_NAME, index.getName(),
                        LogMessageKeys.EXISTING_INDEX, existing);
            }
            return;
        }
        if (index.isUnique()) {
            final Set<List<Object>> seen = new HashSet<>();
            for (Map<String, Object> document : documents) {
                final List<Object> key = indexKey(index, document);
                if (key != null && !seen.add(key)) {
                    throw duplicateKey(index, key);
                }
            }
        }
        indexes.put(index.getName(), index);
    }

    @Nonnull
    synchronized Set<IndexDescriptor> listIndexes() {
        return new LinkedHashSet<>(indexes.values());
    }

    synchronized void dropIndexes() {
        indexes.keySet().removeIf(indexName -> !indexName.equals(IndexDescriptor.ID_INDEX.getName()));
    }

    private int firstMatch(@Nonnull Map<String, Object> query) {
        for (int i = 0; i < documents.size(); i++) {
            if (QueryMatcher.matches(documents.get(i), query)) {
                return i;
            }
        }
        return -1;
    }

    @Nonnull
    private List<Map<String, Object>> matching(@Nonnull Map<String, Object> query) {
        final List<Map<String, Object>> matching = new ArrayList<>();
        for (Map<String, Object> document : documents) {
            if (QueryMatcher.matches(document, query)) {
                matching.add(document);
            }
        }
        return matching;
    }

    @Nonnull
    private static List<Map<String, Object>> copies(@Nonnull List<Map<String, Object>> documents) {
        final List<Map<String, Object>> copies = new ArrayList<>(documents.size());
        for (Map<String, Object> document : documents) {
            copies.add(StoredValues.copyDocument(document));
        }
        return copies;
    }

    @Nonnull
    private Map<String, Object> applyUpdate(@Nonnull Map<String, Object> original, @Nonnull Map<String, Object> update) {
        final boolean operators = update.keySet().stream().anyMatch(key -> key.startsWith("$"));
        if (!operators) {
            final Map<String, Object> replacement = StoredValues.copyDocument(update);
            if (original.containsKey(Schema.ID_ATTRIBUTE)) {
                replacement.put(Schema.ID_ATTRIBUTE, original.get(Schema.ID_ATTRIBUTE));
            }
            return replacement;
        }
        final Map<String, Object> updated = StoredValues.copyDocument(original);
        for (Map.Entry<String, Object> entry : update.entrySet()) {
            if (!(entry.getValue() instanceof Map)) {
                throw new DocumentDriverException("update operator needs a document", LogMessageKeys.OPERATION, entry.getKey());
            }
            final Map<?, ?> operand = (Map<?, ?>)entry.getValue();
            switch (entry.getKey()) {
                case "$set":
                    operand.forEach((path, value) -> StoredValues.setPath(updated, (String)path, value));
                    break;
                case "$unset":
                    operand.keySet().forEach(path -> StoredValues.unsetPath(updated, (String)path));
                    break;
                case "$inc":
                    operand.forEach((path, value) -> StoredValues.setPath(updated, (String)path, increment(updated, (String)path, value)));
                    break;
                default:
                    throw new DocumentDriverException("unsupported update operator",
                            LogMessageKeys.COLLECTION, name,
                            LogMessageKeys.OPERATION, entry.getKey());
            }
        }
        return updated;
    }

    @Nonnull
    private Object increment(@Nonnull Map<String, Object> document, @Nonnull String path, @Nullable Object amount) {
        if (!(amount instanceof Number)) {
            throw new DocumentDriverException("$inc needs a number", LogMessageKeys.COLLECTION, name);
        }
        final List<Object> current = StoredValues.valuesAt(document, path);
        if (current.isEmpty() || current.get(0) == null) {
            return amount;
        }
        if (!(current.get(0) instanceof Number)) {
            throw new DocumentDriverException("$inc applied to a value that is not a number", LogMessageKeys.COLLECTION, name);
        }
        final Number base = (Number)current.get(0);
        if (base instanceof Double || base instanceof Float || amount instanceof Double || amount instanceof Float) {
            return base.doubleValue() + ((Number)amount).doubleValue();
        }
        return base.longValue() + ((Number)amount).longValue();
    }

    @Nonnull
    private static Map<String, Object> equalityFields(@Nonnull Map<String, Object> query) {
        final Map<String, Object> fields = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : query.entrySet()) {
            if (!entry.getKey().startsWith("$") && !entry.getKey().contains(".") && !isOperatorMap(entry.getValue())) {
                fields.put(entry.getKey(), StoredValues.deepCopy(entry.getValue()));
            }
        }
        return fields;
    }

    private static boolean isOperatorMap(@Nullable Object value) {
        return value instanceof Map && ((Map<?, ?>)value).keySet().stream().anyMatch(key -> String.valueOf(key).startsWith("$"));
    }

    private void checkUniqueIndexes(@Nonnull Map<String, Object> candidate, @Nullable Map<String, Object> replaced) {
        for (IndexDescriptor index : indexes.values()) {
            if (!index.isUnique() && index != IndexDescriptor.ID_INDEX) {
                continue;
            }
            final List<Object> key = indexKey(index, candidate);
            if (key == null) {
                continue;
            }
            for (Iterator<Map<String, Object>> iter = documents.iterator(); iter.hasNext(); ) {
                final Map<String, Object> other = iter.next();
                if (other != replaced && key.equals(indexKey(index, other))) {
                    throw duplicateKey(index, key);
                }
            }
        }
    }

    /**
     * Compute the key of a document in an index.
     * @return the key, or {@code null} if the index is sparse and the document misses one of the key paths
     */
    @Nullable
    private static List<Object> indexKey(@Nonnull IndexDescriptor index, @Nonnull Map<String, Object> document) {
        final List<Object> key = new ArrayList<>();
        for (IndexDescriptor.Key indexKey : index.getKeys()) {
            final List<Object> values = StoredValues.valuesAt(document, indexKey.getPath());
            if (values.isEmpty()) {
                if (index.isSparse()) {
                    return null;
                }
                key.add(null);
            } else {
                key.add(StoredValues.indexKeyOf(values.size() == 1 ? values.get(0) : values));
            }
        }
        return key;
    }

    @Nonnull
    private DuplicateKeyException duplicateKey(@Nonnull IndexDescriptor index, @Nonnull List<Object> key) {
        return new DuplicateKeyException("duplicate key in unique index",
                LogMessageKeys.COLLECTION, name,
                LogMessageKeys.INDEX_NAME, index.getName(),
                LogMessageKeys.INDEX_KEYS, key);
    }
}
