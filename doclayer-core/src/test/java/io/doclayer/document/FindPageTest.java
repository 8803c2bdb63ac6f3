/*
 * FindPageTest.java
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

import io.doclayer.document.driver.FindOptions;
import io.doclayer.document.metadata.DocumentTypeBuilder;
import io.doclayer.document.metadata.Fields;
import io.doclayer.document.properties.DocumentLayerProperties;
import io.doclayer.document.properties.DocumentLayerPropertyStorage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for reading documents a page at a time.
 */
public class FindPageTest extends DocumentLayerTestBase {
    private DocumentCollection counters;

    @BeforeEach
    public void setUpDocuments() {
        counters = layer.register(counterType());
        for (int i = 0; i < 10; i++) {
            sync(counters.create(Map.of("value", i)).commit());
        }
    }

    private static DocumentTypeBuilder counterType() {
        return DocumentTypeBuilder.newBuilder("Counter")
                .addField("value", Fields.integer());
    }

    private static List<Object> values(FindPage page) {
        return page.getDocuments().stream().map(document -> document.get("value")).collect(Collectors.toList());
    }

    @Test
    public void limitAndSkipBoundThePages() {
        final FindPage first = sync(counters.findPage(Map.of(), 5, 6));
        assertThat(values(first), contains(6, 7, 8, 9));
        assertFalse(first.isExhausted());

        final FindPage second = sync(first.next());
        assertThat(second.getDocuments(), empty());
        assertTrue(second.isExhausted());
        assertNull(second.getContinuation().toBytes());
        failure(DocumentLayerArgumentException.class, second.next());
    }

    @Test
    public void findUsesLimitAndSkip() {
        assertThat(sync(counters.find(Map.of(), 3, 2)).stream().map(document -> document.get("value")).collect(Collectors.toList()),
                contains(2, 3, 4));
        assertEquals(10, sync(counters.find()).size());
        assertEquals(4, sync(counters.find(Map.of(), FindOptions.UNLIMITED, 6)).size());
    }

    @Test
    public void pagesFollowBatchSize() {
        final DocumentLayer batched = DocumentLayer.newBuilder()
                .setDriver(driver)
                .setProperties(DocumentLayerPropertyStorage.newBuilder()
                        .addProp(DocumentLayerProperties.FIND_BATCH_SIZE, 3)
                        .build())
                .build();
        final DocumentCollection batchedCounters = batched.register(counterType());

        final List<Object> seen = new ArrayList<>();
        final List<Integer> pageSizes = new ArrayList<>();
        FindPage page = batched.asyncToSync(batchedCounters.findPage(Map.of("value", Map.of("$gte", 1)), FindOptions.UNLIMITED, 0));
        while (true) {
            seen.addAll(values(page));
            pageSizes.add(page.getDocuments().size());
            if (page.isExhausted()) {
                break;
            }
            page = batched.asyncToSync(page.next());
        }
        assertThat(seen, contains(1, 2, 3, 4, 5, 6, 7, 8, 9));
        assertThat(pageSizes, contains(3, 3, 3, 0));
    }

    @Test
    public void continuationCanBeResumedLater() {
        final FindPage first = sync(counters.findPage(Map.of("value", Map.of("$lt", 8)), 6, 1));
        final byte[] saved = first.getContinuation().toBytes();
        final FindPage resumed = sync(counters.findPage(Map.of("value", Map.of("$lt", 8)), 6, 1, saved));
        assertThat(values(first), contains(1, 2, 3, 4, 5, 6));
        assertThat(resumed.getDocuments(), empty());
        assertTrue(resumed.isExhausted());
    }
}
