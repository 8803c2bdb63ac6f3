/*
 * DocumentLifecycleController.java
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

import com.google.common.collect.ImmutableList;
import io.doclayer.annotation.API;
import io.doclayer.async.MoreAsyncUtil;
import io.doclayer.document.driver.DeleteResult;
import io.doclayer.document.driver.DocumentDriver;
import io.doclayer.document.driver.FindOptions;
import io.doclayer.document.driver.InsertResult;
import io.doclayer.document.driver.UpdateResult;
import io.doclayer.document.driver.WriteResult;
import io.doclayer.document.logging.KeyValueLogMessage;
import io.doclayer.document.logging.LogMessageKeys;
import io.doclayer.document.metadata.DocumentType;
import io.doclayer.document.metadata.Schema;
import io.doclayer.document.properties.DocumentLayerProperties;
import io.doclayer.document.validation.IoValidationEngine;
import io.doclayer.document.validation.StructuralValidator;
import io.doclayer.document.validation.UniquenessChecker;
import io.doclayer.document.validation.ValidationMessages;
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
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Runs the store operations of documents: insert, update, delete and reload, each with validation and hooks.
 *
 * <p>
 * Every operation is a chain of futures, and the document's state (identity, created flag, dirty fields, values) is
 * only changed in the last stage of the chain. An operation that fails at any step, or whose future is completed
 * exceptionally by a caller before it finished (as {@link DocumentLayer#asyncToSync(CompletableFuture)} does when its
 * time limit passes), leaves the document as it was.
 * </p>
 *
 * <p>
 * Validation runs the structural checks first. The asynchronous validators of the fields that passed them and the
 * uniqueness checks then run concurrently, and all messages are reported together once both are finished.
 * </p>
 */
@API(API.Status.INTERNAL)
public class DocumentLifecycleController {
    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentLifecycleController.class);

    @Nonnull
    private final DocumentLayer layer;
    @Nonnull
    private final StructuralValidator structuralValidator;
    @Nonnull
    private final IoValidationEngine ioValidationEngine;
    @Nonnull
    private final UniquenessChecker uniquenessChecker;

    DocumentLifecycleController(@Nonnull DocumentLayer layer) {
        this.layer = layer;
        this.structuralValidator = new StructuralValidator(layer.getRegistry());
        this.ioValidationEngine = new IoValidationEngine(
                layer.getProperties().getPropertyValue(DocumentLayerProperties.VALIDATE_REFERENCES));
        this.uniquenessChecker = new UniquenessChecker(layer.getPolymorphicMapper());
    }

    /**
     * Insert a transient document or update a created one.
     * @param document the document
     * @param conditions additional conditions on the stored document, only allowed for created documents
     * @return a future with the result of the write, or {@code null} if a created document had nothing to write
     */
    @Nonnull
    public CompletableFuture<WriteResult> commit(@Nonnull Document document, @Nullable Map<String, ?> conditions) {
        final DocumentState state = document.getState();
        final boolean hasConditions = conditions != null && !conditions.isEmpty();
        if (!state.isCreated()) {
            if (hasConditions) {
                throw new DocumentLayerArgumentException("conditions cannot be applied to the insert of a new document",
                        LogMessageKeys.DOCUMENT_TYPE, document.getType().getName(),
                        LogMessageKeys.CONDITIONS, conditions);
            }
            return insert(document);
        }
        if (!state.isDirty()) {
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug(KeyValueLogMessage.of("nothing to commit",
                        LogMessageKeys.DOCUMENT_TYPE, document.getType().getName(),
                        LogMessageKeys.IDENTITY, document.getId()));
            }
            return CompletableFuture.completedFuture(null);
        }
        return update(document, hasConditions ? conditions : Collections.<String, Object>emptyMap());
    }

    @Nonnull
    private CompletableFuture<WriteResult> insert(@Nonnull Document document) {
        final DocumentType type = document.getType();
        final DocumentState state = document.getState();
        final Set<String> fieldNames = type.getSchema().getFields().keySet();
        return MoreAsyncUtil.invokeSafely(() -> validate(document, fieldNames, true))
                .thenCompose(vignore -> {
                    final Map<String, Object> payload = newInsertPayload(document);
                    return MoreAsyncUtil.invokeSafely(() -> type.getHooks().preInsert(document, payload))
                            .thenCompose(vignore2 -> layer.getDriver().insert(type.getCollectionName(), payload))
                            .thenCompose(result -> MoreAsyncUtil.invokeSafely(() -> type.getHooks().postInsert(document, result, payload))
                                    .thenApply(vignore2 -> result));
                })
                .thenApply(result -> {
                    state.markCreated(result.getInsertedId(), fieldNames);
                    if (LOGGER.isDebugEnabled()) {
                        LOGGER.debug(KeyValueLogMessage.of("inserted document",
                                LogMessageKeys.DOCUMENT_TYPE, type.getName(),
                                LogMessageKeys.COLLECTION, type.getCollectionName(),
                                LogMessageKeys.IDENTITY, result.getInsertedId()));
                    }
                    return result;
                });
    }

    @Nonnull
    private Map<String, Object> newInsertPayload(@Nonnull Document document) {
        final Map<String, Object> payload = document.toPayload(false);
        if (payload.containsKey(Schema.ID_ATTRIBUTE)) {
            return payload;
        }
        final Map<String, Object> withIdentity = new LinkedHashMap<>();
        withIdentity.put(Schema.ID_ATTRIBUTE, document.getType().newIdentity());
        withIdentity.putAll(payload);
        return withIdentity;
    }

    @Nonnull
    private CompletableFuture<WriteResult> update(@Nonnull Document document, @Nonnull Map<String, ?> conditions) {
        final DocumentType type = document.getType();
        final DocumentState state = document.getState();
        final Set<String> dirtyFields = state.getDirtyFields();
        final Map<String, Object> query = identityQuery(document, conditions);
        return MoreAsyncUtil.invokeSafely(() -> validate(document, dirtyFields, false))
                .thenCompose(vignore -> {
                    final Map<String, Object> payload = state.toPayload(true);
                    return MoreAsyncUtil.invokeSafely(() -> type.getHooks().preUpdate(document, query, payload))
                            .thenCompose(vignore2 -> layer.getDriver().update(type.getCollectionName(), query, payload, false))
                            .thenCompose(result -> {
                                if (result.getMatchedCount() == 0) {
                                    throw new UpdateException("no stored document matched the update",
                                            LogMessageKeys.DOCUMENT_TYPE, type.getName(),
                                            LogMessageKeys.IDENTITY, document.getId(),
                                            LogMessageKeys.QUERY, query);
                                }
                                return MoreAsyncUtil.invokeSafely(() -> type.getHooks().postUpdate(document, result, payload))
                                        .thenApply(vignore2 -> result);
                            });
                })
                .thenApply(result -> {
                    state.markClean(dirtyFields);
                    if (LOGGER.isDebugEnabled()) {
                        LOGGER.debug(KeyValueLogMessage.of("updated document",
                                LogMessageKeys.DOCUMENT_TYPE, type.getName(),
                                LogMessageKeys.IDENTITY, document.getId(),
                                LogMessageKeys.DIRTY_FIELDS, dirtyFields));
                    }
                    return result;
                });
    }

    /**
     * Delete a created document.
     * @param document the document
     * @param conditions additional conditions on the stored document, or {@code null}
     * @return a future with the result of the delete
     */
    @Nonnull
    public CompletableFuture<DeleteResult> delete(@Nonnull Document document, @Nullable Map<String, ?> conditions) {
        final DocumentType type = document.getType();
        final DocumentState state = document.getState();
        if (!state.isCreated()) {
            return CompletableFuture.failedFuture(notCreated("cannot delete a document that has not been created", document));
        }
        final Map<String, Object> query = identityQuery(document, conditions == null ? Collections.<String, Object>emptyMap() : conditions);
        return MoreAsyncUtil.invokeSafely(() -> type.getHooks().preDelete(document))
                .thenCompose(vignore -> layer.getDriver().delete(type.getCollectionName(), query))
                .thenCompose(result -> {
                    if (result.getDeletedCount() == 0) {
                        throw new DeleteException("no stored document matched the delete",
                                LogMessageKeys.DOCUMENT_TYPE, type.getName(),
                                LogMessageKeys.IDENTITY, document.getId(),
                                LogMessageKeys.QUERY, query);
                    }
                    return MoreAsyncUtil.invokeSafely(() -> type.getHooks().postDelete(document, result))
                            .thenApply(vignore -> result);
                })
                .thenApply(result -> {
                    if (LOGGER.isDebugEnabled()) {
                        LOGGER.debug(KeyValueLogMessage.of("deleted document",
                                LogMessageKeys.DOCUMENT_TYPE, type.getName(),
                                LogMessageKeys.IDENTITY, document.getId()));
                    }
                    state.markDeleted();
                    return result;
                });
    }

    /**
     * Replace the values of a created document with the stored ones.
     * @param document the document
     * @return a future that completes when the values have been replaced
     */
    @Nonnull
    public CompletableFuture<Void> reload(@Nonnull Document document) {
        final DocumentState state = document.getState();
        if (!state.isCreated()) {
            return CompletableFuture.failedFuture(notCreated("cannot reload a document that has not been created", document));
        }
        final Map<String, Object> query = Collections.singletonMap(Schema.ID_ATTRIBUTE, document.getId());
        final FindOptions options = FindOptions.newBuilder().setLimit(1).build();
        return MoreAsyncUtil.invokeSafely(() -> layer.getDriver().find(document.getType().getCollectionName(), query, options))
                .thenApply(stored -> {
                    if (stored.isEmpty()) {
                        throw notCreated("document no longer exists in the store", document);
                    }
                    state.reloadFrom(stored.get(0));
                    return null;
                });
    }

    /**
     * Validate a document without writing it.
     * @param document the document
     * @param validateAll whether to validate every field of a created document rather than only the dirty ones
     * @return a future that fails with a {@link io.doclayer.document.validation.ValidationException} if the document
     * is not valid
     */
    @Nonnull
    public CompletableFuture<Void> ioValidate(@Nonnull Document document, boolean validateAll) {
        final Collection<String> fieldNames = validateAll || !document.isCreated()
                                              ? document.getType().getSchema().getFields().keySet()
                                              : document.getDirtyFields();
        return MoreAsyncUtil.invokeSafely(() -> validate(document, fieldNames, false, false));
    }

    @Nonnull
    private CompletableFuture<Void> validate(@Nonnull Document document, @Nonnull Collection<String> fieldNames,
                                             boolean insert) {
        final boolean checkUnique = layer.getProperties().getPropertyValue(DocumentLayerProperties.CHECK_UNIQUE_CONSTRAINTS);
        return validate(document, fieldNames, insert, checkUnique);
    }

    @Nonnull
    private CompletableFuture<Void> validate(@Nonnull Document document, @Nonnull Collection<String> fieldNames,
                                             boolean insert, boolean checkUnique) {
        final DocumentState state = document.getState();
        final ValidationMessages messages = structuralValidator.validate(document.getType().getSchema(), state.getValues(), fieldNames);
        final List<String> asyncFields = new ArrayList<>();
        for (String fieldName : fieldNames) {
            if (!messages.hasMessagesFor(fieldName)) {
                asyncFields.add(fieldName);
            }
        }
        final CompletableFuture<ValidationMessages> ioFuture = MoreAsyncUtil.invokeSafely(() ->
                ioValidationEngine.validate(document.getType().getSchema(), state.getValues(), asyncFields));
        final CompletableFuture<ValidationMessages> uniqueFuture = checkUnique
                ? MoreAsyncUtil.invokeSafely(() -> uniquenessChecker.check(layer.getDriver(), document, insert ? null : fieldNames))
                : CompletableFuture.completedFuture(new ValidationMessages());
        final List<CompletableFuture<ValidationMessages>> checks = ImmutableList.of(ioFuture, uniqueFuture);
        return MoreAsyncUtil.whenAllSettled(checks).thenApply(vignore -> {
            for (CompletableFuture<ValidationMessages> check : checks) {
                final Throwable failure = MoreAsyncUtil.getFailure(check);
                if (failure != null) {
                    throw failure instanceof RuntimeException ? (RuntimeException)failure : new CompletionException(failure);
                }
                messages.addAll(check.join());
            }
            if (!messages.isEmpty()) {
                if (LOGGER.isDebugEnabled()) {
                    LOGGER.debug(KeyValueLogMessage.of("document failed validation",
                            LogMessageKeys.DOCUMENT_TYPE, document.getType().getName(),
                            LogMessageKeys.IDENTITY, document.getId(),
                            LogMessageKeys.VALIDATION_MESSAGES, messages));
                }
                throw messages.toException();
            }
            return null;
        });
    }

    @Nonnull
    private Map<String, Object> identityQuery(@Nonnull Document document, @Nonnull Map<String, ?> conditions) {
        final Map<String, Object> query = new LinkedHashMap<>();
        query.put(Schema.ID_ATTRIBUTE, document.getId());
        if (conditions.isEmpty()) {
            return query;
        }
        final Map<String, Object> translated = layer.getQueryTranslator().translate(document.getType(), conditions);
        if (translated.containsKey(Schema.ID_ATTRIBUTE)) {
            final Map<String, Object> combined = new LinkedHashMap<>();
            combined.put("$and", ImmutableList.of(query, translated));
            return combined;
        }
        query.putAll(translated);
        return query;
    }

    @Nonnull
    private static NotCreatedException notCreated(@Nonnull String message, @Nonnull Document document) {
        return new NotCreatedException(message,
                LogMessageKeys.DOCUMENT_TYPE, document.getType().getName(),
                LogMessageKeys.IDENTITY, document.getId());
    }
}
