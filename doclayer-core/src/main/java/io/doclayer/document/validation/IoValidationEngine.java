/*
 * IoValidationEngine.java
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
import io.doclayer.document.EmbeddedDocument;
import io.doclayer.document.Reference;
import io.doclayer.document.ReferenceNotFoundException;
import io.doclayer.document.TrackedList;
import io.doclayer.document.logging.KeyValueLogMessage;
import io.doclayer.document.logging.LogMessageKeys;
import io.doclayer.document.metadata.FieldDescriptor;
import io.doclayer.document.metadata.FieldKind;
import io.doclayer.document.metadata.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.stream.Collectors;

/**
 * The asynchronous half of validation: {@link AsyncFieldValidator}s and reference existence checks.
 *
 * <p>
 * Each field with asynchronous work gets one chain. Within a chain the validators run strictly one after the other,
 * and the first failure ends it, so a field reports at most one message of its own. Nested values are validated after
 * the field's own validators: the fields of an embedded document concurrently, like top-level fields, and the
 * elements of a list one at a time in list order. The chains of different fields run concurrently, and the result is
 * only reported once every chain has finished, whether it passed or failed.
 * </p>
 *
 * <p>
 * A validator failing with anything other than a {@link ValidationException} fails the whole validation with that
 * exception, again only after every chain has finished.
 * </p>
 */
@API(API.Status.INTERNAL)
public class IoValidationEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(IoValidationEngine.class);

    private static final AsyncFieldValidator REFERENCE_EXISTS = (field, value) -> {
        if (!(value instanceof Reference)) {
            return MoreAsyncUtil.DONE;
        }
        return ((Reference)value).exists().thenAccept(exists -> {
            if (!exists) {
                throw new ValidationException(ReferenceNotFoundException.messageFor(field.getReferenceType()));
            }
        });
    };

    private final boolean validateReferences;

    public IoValidationEngine(boolean validateReferences) {
        this.validateReferences = validateReferences;
    }

    /**
     * Validate some fields of a set of values asynchronously.
     * @param schema the schema describing the values
     * @param values the values, keyed by in-memory field name
     * @param fieldNames the fields to validate; fields the schema does not describe are ignored
     * @return a future with the messages per field, empty if the values are valid
     */
    @Nonnull
    public CompletableFuture<ValidationMessages> validate(@Nonnull Schema schema, @Nonnull Map<String, Object> values,
                                                          @Nonnull Collection<String> fieldNames) {
        final List<CompletableFuture<ValidationMessages>> chains = new ArrayList<>();
        for (FieldDescriptor field : schema.getFieldDescriptors()) {
            final Object value = values.get(field.getName());
            if (value == null || !fieldNames.contains(field.getName()) || !field.hasAsyncValidation()) {
                continue;
            }
            chains.add(MoreAsyncUtil.invokeSafely(() -> validateValue(field, value, field.getName())));
        }
        if (chains.isEmpty()) {
            return CompletableFuture.completedFuture(new ValidationMessages());
        }
        return MoreAsyncUtil.whenAllSettled(chains).thenApply(vignore -> {
            final ValidationMessages messages = new ValidationMessages();
            for (CompletableFuture<ValidationMessages> chain : chains) {
                final Throwable failure = MoreAsyncUtil.getFailure(chain);
                if (failure != null) {
                    throw asUnchecked(failure);
                }
                messages.addAll(chain.join());
            }
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug(KeyValueLogMessage.of("asynchronous validation finished",
                        LogMessageKeys.SCHEMA_NAME, schema.getName(),
                        LogMessageKeys.FIELD_NAMES, fieldNames,
                        LogMessageKeys.VALIDATION_MESSAGES, messages));
            }
            return messages;
        });
    }

    @Nonnull
    private CompletableFuture<ValidationMessages> validateValue(@Nonnull FieldDescriptor field, @Nonnull Object value,
                                                                @Nonnull String key) {
        final ValidationMessages messages = new ValidationMessages();
        return MoreAsyncUtil.forEachSequentially(validatorsOf(field), validator -> validator.validate(field, value))
                .handle((vignore, err) -> {
                    if (err != null) {
                        final Throwable cause = MoreAsyncUtil.unwrapCompletionException(err);
                        if (!(cause instanceof ValidationException)) {
                            throw asUnchecked(cause);
                        }
                        messages.add(key, (ValidationException)cause);
                    }
                    return messages;
                })
                .thenCompose(vignore -> validateNested(field, value, key, messages))
                .thenApply(vignore -> messages);
    }

    @Nonnull
    private CompletableFuture<Void> validateNested(@Nonnull FieldDescriptor field, @Nonnull Object value,
                                                   @Nonnull String key, @Nonnull ValidationMessages messages) {
        if (field.getKind() == FieldKind.EMBEDDED && value instanceof EmbeddedDocument) {
            final EmbeddedDocument embedded = (EmbeddedDocument)value;
            return validate(embedded.getSchema(), embedded.getValues(), embedded.getSchema().getFields().keySet())
                    .thenAccept(nested -> messages.addNested(key, nested));
        }
        if (field.getKind() == FieldKind.LIST && value instanceof TrackedList
                && field.getElementField().hasAsyncValidation()) {
            final List<Object> elements = ((TrackedList)value).stream()
                    .filter(Objects::nonNull)
                    .collect(Collectors.toList());
            return MoreAsyncUtil.forEachSequentially(elements, element ->
                    validateValue(field.getElementField(), element, key).thenAccept(messages::addAll));
        }
        return MoreAsyncUtil.DONE;
    }

    @Nonnull
    private List<AsyncFieldValidator> validatorsOf(@Nonnull FieldDescriptor field) {
        final List<AsyncFieldValidator> validators = new ArrayList<>();
        if (field.getKind() == FieldKind.REFERENCE && field.isCheckReference() && validateReferences) {
            validators.add(REFERENCE_EXISTS);
        }
        validators.addAll(field.getAsyncValidators());
        return validators;
    }

    @Nonnull
    static RuntimeException asUnchecked(@Nonnull Throwable failure) {
        if (failure instanceof RuntimeException) {
            return (RuntimeException)failure;
        }
        return new CompletionException(failure);
    }
}
