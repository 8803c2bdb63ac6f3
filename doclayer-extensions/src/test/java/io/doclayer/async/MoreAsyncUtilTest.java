/*
 * MoreAsyncUtilTest.java
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

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link MoreAsyncUtil}.
 */
public class MoreAsyncUtilTest {

    @Test
    public void completedNormally() {
        CompletableFuture<Void> future = new CompletableFuture<>();
        assertFalse(MoreAsyncUtil.isCompletedNormally(future));
        future.complete(null);
        assertTrue(MoreAsyncUtil.isCompletedNormally(future));
        future = new CompletableFuture<>();
        future.completeExceptionally(new IllegalStateException());
        assertFalse(MoreAsyncUtil.isCompletedNormally(future));
    }

    @Test
    public void forEachSequentiallyWaitsForEachItem() {
        final List<String> events = Collections.synchronizedList(new ArrayList<>());
        final CompletableFuture<Void> gate = new CompletableFuture<>();
        CompletableFuture<Void> all = MoreAsyncUtil.forEachSequentially(Arrays.asList("a", "b", "c"), item -> {
            events.add("start " + item);
            if (item.equals("a")) {
                return gate.thenRun(() -> events.add("end a"));
            }
            events.add("end " + item);
            return MoreAsyncUtil.DONE;
        });
        assertFalse(all.isDone());
        assertThat(events, contains("start a"));
        gate.complete(null);
        all.join();
        assertThat(events, contains("start a", "end a", "start b", "end b", "start c", "end c"));
    }

    @Test
    public void forEachSequentiallyStopsAtFirstFailure() {
        final List<Integer> visited = new ArrayList<>();
        CompletableFuture<Void> all = MoreAsyncUtil.forEachSequentially(Arrays.asList(1, 2, 3), item -> {
            visited.add(item);
            if (item == 2) {
                throw new IllegalArgumentException("bad item");
            }
            return MoreAsyncUtil.DONE;
        });
        CompletionException err = assertThrows(CompletionException.class, all::join);
        assertThat(err.getCause(), instanceOf(IllegalArgumentException.class));
        assertThat(visited, contains(1, 2));
    }

    @Test
    public void whenAllSettledWaitsForFailuresToo() {
        final CompletableFuture<Void> first = new CompletableFuture<>();
        final CompletableFuture<String> second = new CompletableFuture<>();
        CompletableFuture<Void> barrier = MoreAsyncUtil.whenAllSettled(Arrays.asList(first, second));
        first.completeExceptionally(new IllegalStateException("first failed"));
        assertFalse(barrier.isDone());
        second.complete("done");
        assertTrue(MoreAsyncUtil.isCompletedNormally(barrier));
        assertThat(MoreAsyncUtil.getFailure(first), instanceOf(IllegalStateException.class));
        assertNull(MoreAsyncUtil.getFailure(second));
    }

    @Test
    public void whenAllSettledOnNothing() {
        assertSame(MoreAsyncUtil.DONE, MoreAsyncUtil.whenAllSettled(Collections.emptyList()));
    }

    @Test
    public void invokeSafelyCapturesThrownException() {
        CompletableFuture<String> future = MoreAsyncUtil.invokeSafely(() -> {
            throw new IllegalStateException("thrown before any future existed");
        });
        assertTrue(future.isCompletedExceptionally());
        assertThat(MoreAsyncUtil.getFailure(future), instanceOf(IllegalStateException.class));
    }

    @Test
    public void unwrapNestedWrappers() {
        IllegalStateException root = new IllegalStateException("root");
        Throwable wrapped = new CompletionException(new ExecutionException(root));
        assertSame(root, MoreAsyncUtil.unwrapCompletionException(wrapped));
        assertSame(root, MoreAsyncUtil.unwrapCompletionException(root));
        assertNull(MoreAsyncUtil.unwrapCompletionException(null));
    }

    @Test
    public void delayedFutureFiresAfterDelay() {
        long start = System.nanoTime();
        MoreAsyncUtil.delayedFuture(20, TimeUnit.MILLISECONDS).join();
        assertTrue(System.nanoTime() - start >= TimeUnit.MILLISECONDS.toNanos(20));
    }

    @Test
    public void getWithDeadlineReturnsValue() {
        CompletableFuture<String> future = MoreAsyncUtil.getWithDeadline(5000, () -> CompletableFuture.completedFuture("value"));
        assertEquals("value", future.join());
    }

    @Test
    public void getWithDeadlineExpires() {
        final CompletableFuture<String> neverCompletes = new CompletableFuture<>();
        CompletableFuture<String> future = MoreAsyncUtil.getWithDeadline(10, () -> neverCompletes);
        CompletionException err = assertThrows(CompletionException.class, future::join);
        assertThat(err.getCause(), instanceOf(MoreAsyncUtil.DeadlineExceededException.class));
        assertEquals(10L, ((MoreAsyncUtil.DeadlineExceededException)err.getCause()).getLogInfo().get("deadline_time_millis"));
        // the supplied future is failed too, so stages chained on it never run
        assertTrue(neverCompletes.isCompletedExceptionally());
    }

    @Test
    public void getWithDeadlineWithoutLimit() {
        final CompletableFuture<String> pending = new CompletableFuture<>();
        assertSame(pending, MoreAsyncUtil.getWithDeadline(Long.MAX_VALUE, () -> pending));
    }
}
