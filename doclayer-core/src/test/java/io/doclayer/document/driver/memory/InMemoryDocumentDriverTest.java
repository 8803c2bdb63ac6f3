/*
 * InMemoryDocumentDriverTest.java
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

import io.doclayer.document.driver.DocumentDriverException;
import io.doclayer.document.driver.DriverBatch;
import io.doclayer.document.driver.DuplicateKeyException;
import io.doclayer.document.driver.FindOptions;
import io.doclayer.document.driver.IndexConflictException;
import io.doclayer.document.driver.UpdateResult;
import io.doclayer.document.metadata.IndexDescriptor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.stream.Collectors;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link InMemoryDocumentDriver}.
 */
public class InMemoryDocumentDriverTest {
    private static final String COLLECTION = "planets";

    private InMemoryDocumentDriver driver;

    @BeforeEach
    public void setUp() {
        driver = new InMemoryDocumentDriver();
        insert(Map.of("_id", "mercury", "name", "Mercury", "moons", 0, "order", 1, "tags", List.of("rocky", "hot")));
        insert(Map.of("_id", "earth", "name", "Earth", "moons", 1, "order", 3, "tags", List.of("rocky", "wet"),
                "atmosphere", Map.of("main", "N2", "pressure", 1.0)));
        insert(Map.of("_id", "jupiter", "name", "Jupiter", "moons", 95, "order", 5, "tags", List.of("giant"),
                "rings", List.of(Map.of("name", "halo"), Map.of("name", "main"))));
    }

    private void insert(@Nonnull Map<String, Object> document) {
        driver.insert(COLLECTION, document).join();
    }

    @Nonnull
    private List<Object> ids(@Nonnull Map<String, Object> query) {
        return driver.find(COLLECTION, query, FindOptions.ALL).join().stream()
                .map(document -> document.get("_id"))
                .collect(Collectors.toList());
    }

    @Nonnull
    private static Throwable failure(@Nonnull CompletableFuture<?> future) {
        final CompletionException e = assertThrows(CompletionException.class, future::join);
        return e.getCause();
    }

    @Test
    public void queryOperators() {
        assertThat(ids(Map.of()), contains("mercury", "earth", "jupiter"));
        assertThat(ids(Map.of("name", "Earth")), contains("earth"));
        assertThat(ids(Map.of("moons", Map.of("$gt", 0))), contains("earth", "jupiter"));
        assertThat(ids(Map.of("moons", Map.of("$gte", 1L, "$lt", 2.5))), contains("earth"));
        assertThat(ids(Map.of("tags", "rocky")), contains("mercury", "earth"));
        assertThat(ids(Map.of("tags", Map.of("$all", List.of("rocky", "wet")))), contains("earth"));
        assertThat(ids(Map.of("tags", Map.of("$in", List.of("giant", "hot")))), contains("mercury", "jupiter"));
        assertThat(ids(Map.of("tags", Map.of("$nin", List.of("rocky")))), contains("jupiter"));
        assertThat(ids(Map.of("name", Map.of("$ne", "Earth"))), contains("mercury", "jupiter"));
        assertThat(ids(Map.of("atmosphere", Map.of("$exists", true))), contains("earth"));
        assertThat(ids(Map.of("atmosphere", Map.of("$exists", false))), contains("mercury", "jupiter"));
        assertThat(ids(Map.of("atmosphere.main", "N2")), contains("earth"));
        assertThat(ids(Map.of("atmosphere", Map.of("main", "N2", "pressure", 1))), contains("earth"));
        assertThat(ids(Map.of("rings.name", "main")), contains("jupiter"));
        assertThat(ids(Map.of("rings.0.name", "main")), empty());
        assertThat(ids(Map.of("tags.1", "wet")), contains("earth"));
        assertThat(ids(Map.of("$or", List.of(Map.of("order", 1), Map.of("order", 5)))), contains("mercury", "jupiter"));
        assertThat(ids(Map.of("$nor", List.of(Map.of("order", 1), Map.of("order", 5)))), contains("earth"));
        assertThat(ids(Map.of("$and", List.of(Map.of("tags", "rocky"), Map.of("moons", 0)))), contains("mercury"));
        final Map<String, Object> missing = new HashMap<>();
        missing.put("atmosphere", null);
        assertThat(ids(missing), contains("mercury", "jupiter"));
        assertEquals(2L, driver.count(COLLECTION, Map.of("tags", "rocky")).join());
        assertThat(failure(driver.find(COLLECTION, Map.of("name", Map.of("$regex", "^E")), FindOptions.ALL)),
                instanceOf(DocumentDriverException.class));
    }

    @Test
    public void limitAndSkip() {
        final FindOptions options = FindOptions.newBuilder().setSkip(1).setLimit(1).build();
        assertThat(driver.find(COLLECTION, Map.of(), options).join().stream()
                .map(document -> document.get("_id")).collect(Collectors.toList()), contains("earth"));
        assertThat(driver.find(COLLECTION, Map.of(), FindOptions.newBuilder().setSkip(10).build()).join(), empty());
        assertThat(driver.find("unknown", Map.of(), FindOptions.ALL).join(), empty());
    }

    @Test
    public void batchesFollowContinuations() {
        for (int i = 0; i < 5; i++) {
            insert(Map.of("_id", "asteroid-" + i, "name", "Asteroid " + i, "order", 4));
        }
        final Map<String, Object> query = Map.of("order", 4);
        final FindOptions options = FindOptions.newBuilder().setSkip(1).setLimit(3).setBatchSize(2).build();
        final List<Object> seen = new ArrayList<>();
        final List<Integer> sizes = new ArrayList<>();
        byte[] continuation = null;
        do {
            final DriverBatch batch = driver.findBatch(COLLECTION, query, options, continuation).join();
            sizes.add(batch.getDocuments().size());
            batch.getDocuments().forEach(document -> seen.add(document.get("_id")));
            continuation = batch.getContinuation();
        } while (continuation != null);
        assertThat(sizes, contains(2, 1, 0));
        assertThat(seen, contains("asteroid-1", "asteroid-2", "asteroid-3"));

        assertThat(failure(driver.findBatch(COLLECTION, query, options, new byte[] {1, 2, 3})),
                instanceOf(DocumentDriverException.class));
    }

    @Test
    public void updateOperators() {
        final UpdateResult result = driver.update(COLLECTION, Map.of("_id", "earth"),
                Map.of("$set", Map.of("atmosphere.main", "O2", "life", true),
                        "$unset", Map.of("tags", ""),
                        "$inc", Map.of("moons", 1, "order", 0.5)), false).join();
        assertEquals(1L, result.getMatchedCount());
        assertEquals(1L, result.getModifiedCount());
        final Map<String, Object> earth = driver.find(COLLECTION, Map.of("_id", "earth"), FindOptions.ALL).join().get(0);
        assertEquals(Map.of("main", "O2", "pressure", 1.0), earth.get("atmosphere"));
        assertEquals(true, earth.get("life"));
        assertFalse(earth.containsKey("tags"));
        assertEquals(2L, earth.get("moons"));
        assertEquals(3.5, earth.get("order"));

        final UpdateResult unchanged = driver.update(COLLECTION, Map.of("_id", "earth"),
                Map.of("$set", Map.of("life", true)), false).join();
        assertEquals(1L, unchanged.getMatchedCount());
        assertEquals(0L, unchanged.getModifiedCount());

        final UpdateResult none = driver.update(COLLECTION, Map.of("_id", "pluto"),
                Map.of("$set", Map.of("life", false)), false).join();
        assertEquals(0L, none.getMatchedCount());
        assertNull(none.getUpsertedId());

        assertThat(failure(driver.update(COLLECTION, Map.of("_id", "earth"),
                Map.of("$inc", Map.of("name", 1)), false)), instanceOf(DocumentDriverException.class));
        assertThat(failure(driver.update(COLLECTION, Map.of("_id", "earth"),
                Map.of("$push", Map.of("tags", "blue")), false)), instanceOf(DocumentDriverException.class));
    }

    @Test
    public void identityCannotChange() {
        assertThat(failure(driver.update(COLLECTION, Map.of("_id", "earth"),
                Map.of("$set", Map.of("_id", "terra")), false)), instanceOf(DocumentDriverException.class));
        assertThat(ids(Map.of("name", "Earth")), contains("earth"));
        assertThat(failure(driver.insert(COLLECTION, Map.of("name", "Nameless"))), instanceOf(DocumentDriverException.class));
        assertThat(failure(driver.insert(COLLECTION, Map.of("_id", "earth"))), instanceOf(DuplicateKeyException.class));
    }

    @Test
    public void replacementKeepsIdentity() {
        driver.update(COLLECTION, Map.of("_id", "mercury"), Map.of("name", "Hermes"), false).join();
        final Map<String, Object> mercury = driver.find(COLLECTION, Map.of("_id", "mercury"), FindOptions.ALL).join().get(0);
        assertEquals(Map.of("_id", "mercury", "name", "Hermes"), mercury);
    }

    @Test
    public void upsertBuildsFromQuery() {
        final UpdateResult result = driver.update(COLLECTION, Map.of("_id", "pluto", "order", Map.of("$gt", 8)),
                Map.of("$set", Map.of("name", "Pluto")), true).join();
        assertEquals(0L, result.getMatchedCount());
        assertEquals("pluto", result.getUpsertedId());
        final Map<String, Object> pluto = driver.find(COLLECTION, Map.of("_id", "pluto"), FindOptions.ALL).join().get(0);
        assertEquals(Map.of("_id", "pluto", "name", "Pluto"), pluto);

        final UpdateResult generated = driver.update("dwarfs", Map.of("name", "Ceres"),
                Map.of("$set", Map.of("order", 4)), true).join();
        assertNotNull(generated.getUpsertedId());
    }

    @Test
    public void deleteRemovesFirstMatch() {
        assertEquals(1L, driver.delete(COLLECTION, Map.of("tags", "rocky")).join().getDeletedCount());
        assertThat(ids(Map.of()), contains("earth", "jupiter"));
        assertEquals(0L, driver.delete(COLLECTION, Map.of("_id", "pluto")).join().getDeletedCount());
        assertEquals(0L, driver.delete("unknown", Map.of()).join().getDeletedCount());
    }

    @Test
    public void storedDocumentsAreCopies() {
        final Map<String, Object> found = driver.find(COLLECTION, Map.of("_id", "earth"), FindOptions.ALL).join().get(0);
        found.put("name", "Changed");
        assertThat(ids(Map.of("name", "Earth")), contains("earth"));
    }

    @Test
    public void uniqueAndSparseIndexes() {
        final IndexDescriptor name = IndexDescriptor.of(List.of(new IndexDescriptor.Key("name", 1)), true, false);
        final IndexDescriptor atmosphere = IndexDescriptor.of(List.of(new IndexDescriptor.Key("atmosphere.main", 1)), true, true);
        driver.createIndex(COLLECTION, name).join();
        driver.createIndex(COLLECTION, atmosphere).join();
        driver.createIndex(COLLECTION, name).join();

        assertThat(failure(driver.insert(COLLECTION, Map.of("_id", "earth-2", "name", "Earth"))),
                instanceOf(DuplicateKeyException.class));
        insert(Map.of("_id", "venus", "name", "Venus"));
        assertThat(failure(driver.insert(COLLECTION, Map.of("_id", "mars", "name", "Mars",
                "atmosphere", Map.of("main", "N2")))), instanceOf(DuplicateKeyException.class));
        assertThat(failure(driver.update(COLLECTION, Map.of("_id", "venus"),
                Map.of("$set", Map.of("name", "Jupiter")), false)), instanceOf(DuplicateKeyException.class));
        driver.update(COLLECTION, Map.of("_id", "venus"), Map.of("$set", Map.of("moons", 0)), false).join();

        assertThat(failure(driver.createIndex(COLLECTION,
                new IndexDescriptor("name_1", List.of(new IndexDescriptor.Key("name", 1)), false, false))),
                instanceOf(IndexConflictException.class));
        assertThat(failure(driver.createIndex(COLLECTION,
                IndexDescriptor.of(List.of(new IndexDescriptor.Key("moons", 1)), true, false))),
                instanceOf(DuplicateKeyException.class));
    }

    @Test
    public void sparseIndexSkipsDocumentsMissingAnyKey() {
        final IndexDescriptor ringsPerOrder = IndexDescriptor.of(List.of(
                new IndexDescriptor.Key("order", 1), new IndexDescriptor.Key("rings", 1)), true, true);
        driver.createIndex(COLLECTION, ringsPerOrder).join();
        insert(Map.of("_id", "saturn", "name", "Saturn", "order", 6));
        insert(Map.of("_id", "saturn-2", "name", "Saturn II", "order", 6));
        insert(Map.of("_id", "uranus", "name", "Uranus", "order", 7, "rings", List.of("epsilon")));
        assertThat(failure(driver.insert(COLLECTION, Map.of("_id", "uranus-2", "order", 7, "rings", List.of("epsilon")))),
                instanceOf(DuplicateKeyException.class));
    }

    @Test
    public void listAndDropIndexes() {
        assertThat(driver.listIndexes("unknown").join(), empty());
        final IndexDescriptor order = IndexDescriptor.of(List.of(new IndexDescriptor.Key("order", -1)), false, false);
        driver.createIndex(COLLECTION, order).join();
        assertThat(driver.listIndexes(COLLECTION).join(), containsInAnyOrder(IndexDescriptor.ID_INDEX, order));
        assertEquals("order_-1", order.getName());

        driver.dropIndexes(COLLECTION).join();
        assertThat(driver.listIndexes(COLLECTION).join(), contains(IndexDescriptor.ID_INDEX));

        driver.drop(COLLECTION).join();
        assertThat(ids(Map.of()), empty());
        assertThat(driver.listIndexes(COLLECTION).join(), empty());
    }
}
