/*
 * UniquenessChecker.java
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
import io.doclayer.async.MoreAsyncUtil;
import io.doclayer.document.Document;
import io.doclayer.document.PolymorphicMapper;
import io.doclayer.document.driver.DocumentDriver;
import io.doclayer.document.logging.KeyValueLogMessage;
import io.doclayer.document.logging.LogMessageKeys;
import io.doclayer.document.metadata.BoundIndex;
import io.doclayer.document.metadata.DocumentType;
import io.doclayer.document.metadata.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Checks the unique indexes of a document's type against the store before a write, so that conflicts are reported
 * as validation messages on the conflicting fields instead of as store errors.
 *
 * <p>
 * For each unique index touched by the write (every one on insert, those covering a changed field on update), the
 * checker counts the stored documents with the same key values, leaving out the document itself on update. A sparse
 * index is skipped when the document lacks one of its keys. The counts run concurrently.
 * </p>
 */
@API(API.Status.INTERNAL)
public class UniquenessChecker {
    private static final Logger LOGGER = LoggerFactory.getLogger(UniquenessChecker.class);

    public static final String UNIQUE_MESSAGE = "Field value must be unique.";

    @Nonnull
    private final PolymorphicMapper mapper;

    public UniquenessChecker(@Nonnull PolymorphicMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Check a document about to be written.
     * @param driver the driver of the store
     * @param document the document
     * @param changedFields the fields being updated, or {@code null} for an insert
     * @return a future with the messages for conflicting fields, empty if there is no conflict
     */
    @Nonnull
    public CompletableFuture<ValidationMessages> check(@Nonnull DocumentDriver driver, @Nonnull Document document,
                                                       @Nullable Collection<String> changedFields) {
        final DocumentType documentType = document.getType();
        final Map<String, Object> payload = document.toPayload(false);
        final Object identity = document.isCreated() ? document.getId() : null;
        final List<CompletableFuture<ValidationMessages>> checks = new ArrayList<>();
        for (BoundIndex index : mapper.indexesFor(documentType)) {
            if (!index.getDescriptor().isUnique() || changedFields != null && !index.coversAny(changedFields)) {
                continue;
            }
            final Map<String, Object> query = conflictQuery(index, payload, identity);
            if (query == null) {
                continue;
            }
            checks.add(MoreAsyncUtil.invokeSafely(() -> driver.count(documentType.getCollectionName(), query))
                    .thenApply(count -> {
                        final ValidationMessages messages = new ValidationMessages();
                        if (count > 0) {
                            if (LOGGER.isDebugEnabled()) {
                                LOGGER.debug(KeyValueLogMessage.of("unique index conflict",
                                        LogMessageKeys.DOCUMENT_TYPE, documentType.getName(),
                                        LogMessageKeys.INDEX_NAME, index.getDescriptor().getName(),
                                        LogMessageKeys.QUERY, query,
                                        LogMessageKeys.MATCHED_COUNT, count));
                            }
                            addConflict(messages, index);
                        }
                        return messages;
                    }));
        }
        if (checks.isEmpty()) {
            return CompletableFuture.completedFuture(new ValidationMessages());
        }
        return MoreAsyncUtil.whenAllSettled(checks).thenApply(vignore -> {
            final ValidationMessages messages = new ValidationMessages();
            for (CompletableFuture<ValidationMessages> check : checks) {
                final Throwable failure = MoreAsyncUtil.getFailure(check);
                if (failure != null) {
                    throw IoValidationEngine.asUnchecked(failure);
                }
                messages.addAll(check.join());
            }
            return messages;
        });
    }

    @Nullable
    private static Map<String, Object> conflictQuery(@Nonnull BoundIndex index, @Nonnull Map<String, Object> payload,
                                                     @Nullable Object identity) {
        final Map<String, Object> query = new LinkedHashMap<>();
        for (String path : index.getDescriptor().getKeyPaths()) {
            final Object value = valueAt(payload, path);
            if (value == null && index.getDescriptor().isSparse()) {
                return null;
            }
            query.put(path, value);
        }
        if (identity != null) {
            query.put(Schema.ID_ATTRIBUTE, Collections.singletonMap("$ne", identity));
        }
        return query;
    }

    @Nullable
    private static Object valueAt(@Nonnull Map<String, Object> payload, @Nonnull String path) {
        Object current = payload;
        for (String segment : path.split("\\.")) {
            if (!(current instanceof Map)) {
                return null;
            }
            current = ((Map<?, ?>)current).get(segment);
        }
        return current;
    }

    private static void addConflict(@Nonnull ValidationMessages messages, @Nonnull BoundIndex index) {
        final List<String> fieldPaths = index.getFieldPaths();
        if (fieldPaths.size() == 1) {
            messages.add(fieldPaths.get(0), UNIQUE_MESSAGE);
            return;
        }
        final String message = "Values of fields "
                               + fieldPaths.stream().map(path -> "'" + path + "'").collect(Collectors.joining(", ", "[", "]"))
                               + " must be unique together.";
        fieldPaths.forEach(path -> messages.add(path, message));
    }
}
