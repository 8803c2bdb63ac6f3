/*
 * MoreAsyncUtil.java
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

package io.doclayer.async;

import io.doclayer.annotation.API;
import io.doclayer.util.LoggableException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collection;
import java.util.Iterator;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Utility functions for working with {@link CompletableFuture}s.
 */
@API(API.Status.UNSTABLE)
public class MoreAsyncUtil {
    /**
     * A future that is already complete with a {@code null} result.
     */
    public static final CompletableFuture<Void> DONE = CompletableFuture.completedFuture(null);

    @Nonnull
    private static final ScheduledThreadPoolExecutor scheduledThreadPoolExecutor = new ScheduledThreadPoolExecutor(1, runnable -> {
        Thread thread = new Thread(runnable, "doclayer-delayed-future");
        thread.setDaemon(true);
        return thread;
    });

    static {
        scheduledThreadPoolExecutor.setRemoveOnCancelPolicy(true);
    }

    /**
     * Invoke a function that produces a future, turning an exception thrown while producing the future into a
     * future that completes exceptionally. Callers therefore only have to handle one failure path.
     *
     * @param futureSupplier the supplier of the future
     * @param <T> the result type of the future
     * @return the supplied future, or a failed future if the supplier threw
     */
    @Nonnull
    public static <T> CompletableFuture<T> invokeSafely(@Nonnull Supplier<? extends CompletableFuture<T>> futureSupplier) {
        try {
            final CompletableFuture<T> future = futureSupplier.get();
            if (future == null) {
                return CompletableFuture.completedFuture(null);
            }
            return future;
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * Apply an asynchronous function to each item in turn. The function is only applied to an item once the future
     * returned for the previous item has completed normally. The first failure ends the chain: later items are not
     * visited and the returned future completes exceptionally with that failure.
     *
     * @param items the items to visit, in order
     * @param func the function to apply to each item
     * @param <T> the type of the items
     * @return a future that completes when every item has been visited or one of them failed
     */
    @Nonnull
    public static <T> CompletableFuture<Void> forEachSequentially(@Nonnull Iterable<? extends T> items,
                                                                  @Nonnull Function<? super T, CompletableFuture<Void>> func) {
        return forEachSequentially(items.iterator(), func);
    }

    @Nonnull
    private static <T> CompletableFuture<Void> forEachSequentially(@Nonnull Iterator<? extends T> iterator,
                                                                   @Nonnull Function<? super T, CompletableFuture<Void>> func) {
        if (!iterator.hasNext()) {
            return DONE;
        }
        final T item = iterator.next();
        return invokeSafely(() -> func.apply(item)).thenCompose(vignore -> forEachSequentially(iterator, func));
    }

    /**
     * Return a future that completes once every one of the given futures has completed, whether normally or
     * exceptionally. Unlike {@link CompletableFuture#allOf(CompletableFuture[])}, the returned future always completes
     * normally; the caller is expected to inspect the individual futures afterwards.
     *
     * @param futures the futures to wait for
     * @return a future that completes when all of the given futures are done
     */
    @Nonnull
    public static CompletableFuture<Void> whenAllSettled(@Nonnull Collection<? extends CompletableFuture<?>> futures) {
        if (futures.isEmpty()) {
            return DONE;
        }
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0]))
                .handle((vignore, errIgnore) -> null);
    }

    /**
     * Returns whether the given {@link CompletableFuture} has completed normally, i.e., not exceptionally.
     * If the future is yet to complete or if the future completed with an error, then this
     * will return <code>false</code>.
     * @param future the future to check for normal completion
     * @return whether the future has completed without exception
     */
    public static boolean isCompletedNormally(@Nonnull CompletableFuture<?> future) {
        return future.isDone() && !future.isCompletedExceptionally();
    }

    /**
     * Get the failure of a completed future, with any {@link CompletionException} wrapping removed.
     *
     * @param future a future that is done
     * @return the failure, or {@code null} if the future completed normally or is not done
     */
    @Nullable
    public static Throwable getFailure(@Nonnull CompletableFuture<?> future) {
        if (!future.isCompletedExceptionally()) {
            return null;
        }
        return future.handle((vignore, err) -> unwrapCompletionException(err)).join();
    }

    /**
     * Strip the {@link CompletionException} and {@link ExecutionException} layers that future composition puts
     * around the original failure.
     *
     * @param err the possibly wrapped exception
     * @return the innermost exception that is not a wrapper
     */
    @Nullable
    public static Throwable unwrapCompletionException(@Nullable Throwable err) {
        Throwable current = err;
        while ((current instanceof CompletionException || current instanceof ExecutionException) && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Creates a future that will be ready after the given delay. All delayed futures share one timer thread, so
     * it is safe to create many of them. The future never fires before the delay has elapsed, but may fire later.
     *
     * @param delay the time from now to delay execution
     * @param unit the time unit of the delay parameter
     * @return a {@link CompletableFuture} that will fire after the given delay
     */
    @Nonnull
    public static CompletableFuture<Void> delayedFuture(long delay, @Nonnull TimeUnit unit) {
        if (delay <= 0) {
            return DONE;
        }
        CompletableFuture<Void> future = new CompletableFuture<>();
        scheduledThreadPoolExecutor.schedule(() -> future.complete(null), delay, unit);
        return future;
    }

    /**
     * Get a future that either completes within the given number of milliseconds or completes exceptionally
     * with {@link DeadlineExceededException}. If {@code deadlineTimeMillis} is {@link Long#MAX_VALUE}, no deadline
     * is imposed.
     *
     * <p>
     * When the deadline passes first, the supplied future itself is completed exceptionally. Any dependent stage
     * that had not yet run is therefore skipped, which is what lets a caller-level timeout leave a document in its
     * previous state.
     * </p>
     *
     * @param deadlineTimeMillis the maximum time to wait, in milliseconds
     * @param supplier the {@link Supplier} of the asynchronous result
     * @param <T> the result type
     * @return a future with the result of the supplied future or a deadline failure
     */
    @Nonnull
    public static <T> CompletableFuture<T> getWithDeadline(long deadlineTimeMillis,
                                                           @Nonnull Supplier<CompletableFuture<T>> supplier) {
        final CompletableFuture<T> valueFuture = invokeSafely(supplier);
        if (deadlineTimeMillis == Long.MAX_VALUE) {
            return valueFuture;
        }
        return CompletableFuture.anyOf(delayedFuture(deadlineTimeMillis, TimeUnit.MILLISECONDS), valueFuture)
                .handle((ignore, errIgnore) -> null)
                .thenCompose(ignore -> {
                    if (!valueFuture.isDone()) {
                        valueFuture.completeExceptionally(new DeadlineExceededException(deadlineTimeMillis));
                    }
                    return valueFuture;
                });
    }

    private MoreAsyncUtil() {
    }

    /**
     * Exception that will be thrown when the <code>supplier</code> in {@link #getWithDeadline(long, Supplier)} fails to
     * complete within the specified deadline time.
     */
    @SuppressWarnings("serial")
    public static class DeadlineExceededException extends LoggableException {
        public DeadlineExceededException(long deadlineTimeMillis) {
            super("deadline exceeded", "deadline_time_millis", deadlineTimeMillis);
        }
    }
}
