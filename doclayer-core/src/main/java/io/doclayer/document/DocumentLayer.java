/*
 * DocumentLayer.java
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
import io.doclayer.async.MoreAsyncUtil;
import io.doclayer.document.driver.DocumentDriver;
import io.doclayer.document.logging.KeyValueLogMessage;
import io.doclayer.document.logging.LogMessageKeys;
import io.doclayer.document.metadata.DocumentRegistry;
import io.doclayer.document.metadata.DocumentType;
import io.doclayer.document.metadata.DocumentTypeBuilder;
import io.doclayer.document.properties.DocumentLayerProperties;
import io.doclayer.document.properties.DocumentLayerPropertyStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * The root object of the mapper: the registry of document types, the driver all store access goes through, and the
 * properties that tune how operations run.
 *
 * <pre>
 * DocumentLayer layer = DocumentLayer.newBuilder().setDriver(new InMemoryDocumentDriver()).build();
 * DocumentCollection students = layer.register(DocumentTypeBuilder.newBuilder("Student")
 *         .addField("name", Fields.string().required()));
 * </pre>
 *
 * <p>
 * The driver may be supplied later with {@link #init(DocumentDriver)}, so that types can be registered before the
 * store is known. Until then, every store operation fails with {@link NoDriverDefinedException}.
 * </p>
 */
@API(API.Status.STABLE)
public class DocumentLayer {
    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentLayer.class);

    @Nonnull
    private final DocumentRegistry registry = new DocumentRegistry();
    @Nonnull
    private final DocumentLayerPropertyStorage properties;
    @Nonnull
    private final Map<String, DocumentCollection> collections = new ConcurrentHashMap<>();
    @Nonnull
    private final PayloadTranslator payloadTranslator;
    @Nonnull
    private final QueryTranslator queryTranslator;
    @Nonnull
    private final PolymorphicMapper polymorphicMapper;
    @Nonnull
    private final DocumentLifecycleController lifecycleController;
    @Nullable
    private volatile DocumentDriver driver;

    private DocumentLayer(@Nonnull Builder builder) {
        this.properties = builder.properties;
        this.driver = builder.driver;
        this.payloadTranslator = new PayloadTranslator(this);
        this.queryTranslator = new QueryTranslator(registry, payloadTranslator);
        this.polymorphicMapper = new PolymorphicMapper(registry);
        this.lifecycleController = new DocumentLifecycleController(this);
    }

    @Nonnull
    public static Builder newBuilder() {
        return new Builder();
    }

    /**
     * Register a document type.
     * @param typeBuilder the declaration of the type
     * @return the collection of the new type
     * @throws io.doclayer.document.metadata.MetaDataException if the declaration is not valid
     */
    @Nonnull
    public DocumentCollection register(@Nonnull DocumentTypeBuilder typeBuilder) {
        final DocumentType type = registry.register(typeBuilder);
        final DocumentCollection collection = new DocumentCollection(this, type);
        collections.put(type.getName(), collection);
        return collection;
    }

    /**
     * Get the collection of a registered type.
     * @param typeName the name of the type
     * @return the collection of the type
     * @throws io.doclayer.document.metadata.MetaDataException if no type has that name
     */
    @Nonnull
    public DocumentCollection collection(@Nonnull String typeName) {
        return collections.computeIfAbsent(typeName, name -> new DocumentCollection(this, registry.getType(name)));
    }

    /**
     * Supply the driver of a layer built without one, or replace the driver.
     * @param newDriver the driver
     */
    public void init(@Nonnull DocumentDriver newDriver) {
        this.driver = newDriver;
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info(KeyValueLogMessage.of("document layer initialized",
                    LogMessageKeys.DRIVER, newDriver.getClass().getSimpleName(),
                    LogMessageKeys.TYPE_COUNT, registry.getTypes().size()));
        }
    }

    public boolean isInitialized() {
        return driver != null;
    }

    /**
     * Get the driver.
     * @return the driver
     * @throws NoDriverDefinedException if the layer has not been given a driver yet
     */
    @Nonnull
    public DocumentDriver getDriver() {
        final DocumentDriver current = driver;
        if (current == null) {
            throw new NoDriverDefinedException("no driver has been defined for the document layer");
        }
        return current;
    }

    @Nonnull
    public DocumentRegistry getRegistry() {
        return registry;
    }

    @Nonnull
    public DocumentLayerPropertyStorage getProperties() {
        return properties;
    }

    @Nonnull
    PayloadTranslator getPayloadTranslator() {
        return payloadTranslator;
    }

    @Nonnull
    QueryTranslator getQueryTranslator() {
        return queryTranslator;
    }

    @Nonnull
    PolymorphicMapper getPolymorphicMapper() {
        return polymorphicMapper;
    }

    @Nonnull
    DocumentLifecycleController getLifecycleController() {
        return lifecycleController;
    }

    /**
     * Wait for an operation, rethrowing its failure as it was raised rather than wrapped in a
     * {@link CompletionException}.
     *
     * <p>
     * The wait is bounded by {@link DocumentLayerProperties#OPERATION_TIMEOUT_MILLIS}. When the limit passes first,
     * the operation's future is completed exceptionally, so its remaining stages are skipped and the document it
     * works on keeps its previous state, and {@link OperationTimeoutException} is thrown. Store writes that were
     * already sent are not undone.
     * </p>
     *
     * @param async the future of the operation
     * @param <T> the result type of the operation
     * @return the result of the operation
     */
    @Nullable
    public <T> T asyncToSync(@Nonnull CompletableFuture<T> async) {
        final long timeoutMillis = properties.getPropertyValue(DocumentLayerProperties.OPERATION_TIMEOUT_MILLIS);
        try {
            return MoreAsyncUtil.getWithDeadline(timeoutMillis, () -> async).join();
        } catch (CompletionException e) {
            final Throwable cause = MoreAsyncUtil.unwrapCompletionException(e);
            if (cause instanceof MoreAsyncUtil.DeadlineExceededException) {
                final OperationTimeoutException timeout = new OperationTimeoutException("operation did not finish in time", cause);
                timeout.addLogInfo(LogMessageKeys.TIME_LIMIT, timeoutMillis, LogMessageKeys.TIME_UNIT, TimeUnit.MILLISECONDS);
                throw timeout;
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException)cause;
            }
            if (cause instanceof Error) {
                throw (Error)cause;
            }
            throw e;
        }
    }

    /**
     * A builder for {@link DocumentLayer}.
     */
    public static class Builder {
        @Nullable
        private DocumentDriver driver;
        @Nonnull
        private DocumentLayerPropertyStorage properties = DocumentLayerPropertyStorage.getEmptyInstance();

        private Builder() {
        }

        @Nonnull
        public Builder setDriver(@Nullable DocumentDriver driver) {
            this.driver = driver;
            return this;
        }

        @Nonnull
        public Builder setProperties(@Nonnull DocumentLayerPropertyStorage properties) {
            this.properties = properties;
            return this;
        }

        @Nonnull
        public DocumentLayer build() {
            return new DocumentLayer(this);
        }
    }
}
