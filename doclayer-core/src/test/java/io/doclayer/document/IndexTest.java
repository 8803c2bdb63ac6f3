/*
 * IndexTest.java
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

import io.doclayer.document.driver.DuplicateKeyException;
import io.doclayer.document.driver.IndexConflictException;
import io.doclayer.document.metadata.DocumentTypeBuilder;
import io.doclayer.document.metadata.Fields;
import io.doclayer.document.metadata.IndexDeclaration;
import io.doclayer.document.metadata.IndexDescriptor;
import io.doclayer.document.metadata.Schema;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for deriving indexes from document types and creating them in the store.
 */
public class IndexTest extends DocumentLayerTestBase {

    private static Set<String> names(Set<IndexDescriptor> indexes) {
        return indexes.stream().map(IndexDescriptor::getName).collect(Collectors.toSet());
    }

    private static IndexDescriptor named(List<IndexDescriptor> indexes, String name) {
        return indexes.stream()
                .filter(index -> index.getName().equals(name))
                .findFirst()
                .orElseThrow(() -> new AssertionError("no index " + name + " in " + indexes));
    }

    @Test
    public void ensureIndexesIsIdempotent() {
        final DocumentCollection things = layer.register(DocumentTypeBuilder.newBuilder("Thing")
                .addField("indexed", Fields.string())
                .addIndex(IndexDeclaration.keys("indexed")));
        sync(things.ensureIndexes());
        sync(things.ensureIndexes());
        assertEquals(Set.of("_id_", "indexed_1"), names(sync(things.listIndexes())));
    }

    @Test
    public void uniqueFieldsDeriveIndexes() {
        final DocumentCollection users = layer.register(DocumentTypeBuilder.newBuilder("User")
                .addField("login", Fields.string().required().unique())
                .addField("email", Fields.string().unique().attribute("mail"))
                .addField("created", Fields.dateTime())
                .addIndex(IndexDeclaration.keys("-created")));
        final List<IndexDescriptor> indexes = users.getIndexes();
        assertThat(indexes.stream().map(IndexDescriptor::getName).collect(Collectors.toList()),
                contains("login_1", "mail_1", "created_-1"));

        final IndexDescriptor login = named(indexes, "login_1");
        assertTrue(login.isUnique());
        assertFalse(login.isSparse());
        final IndexDescriptor email = named(indexes, "mail_1");
        assertTrue(email.isUnique());
        assertTrue(email.isSparse());
        final IndexDescriptor created = named(indexes, "created_-1");
        assertFalse(created.isUnique());
        assertEquals(List.of(new IndexDescriptor.Key("created", -1)), created.getKeys());
    }

    @Test
    public void compoundIndexOnEmbeddedPath() {
        final Schema address = Schema.newBuilder("Address")
                .addField("city", Fields.string().attribute("c"))
                .build();
        final DocumentCollection shops = layer.register(DocumentTypeBuilder.newBuilder("Shop")
                .addField("name", Fields.string())
                .addField("address", Fields.embedded(address).attribute("addr"))
                .addIndex(IndexDeclaration.keys("address.city", "-name").unique()));
        final IndexDescriptor index = shops.getIndexes().get(0);
        assertEquals("addr.c_1_name_-1", index.getName());
        assertTrue(index.isUnique());
    }

    @Test
    public void subtypeIndexesIncludeDiscriminator() {
        final DocumentCollection animals = layer.register(DocumentTypeBuilder.newBuilder("Animal")
                .setAllowInheritance(true)
                .addField("name", Fields.string().unique())
                .addField("age", Fields.integer())
                .addIndex(IndexDeclaration.keys("age")));
        final DocumentCollection dogs = layer.register(DocumentTypeBuilder.newBuilder("Dog")
                .setParent("Animal")
                .addField("chip", Fields.string().required().unique())
                .addField("breed", Fields.string())
                .addIndex(IndexDeclaration.keys("breed")));

        assertThat(animals.getIndexes().stream().map(IndexDescriptor::getName).collect(Collectors.toList()),
                contains("name_1", "age_1"));
        final List<IndexDescriptor> dogIndexes = dogs.getIndexes();
        assertThat(dogIndexes.stream().map(IndexDescriptor::getName).collect(Collectors.toList()),
                contains("name_1", "age_1", "chip_1__cls_1", "breed_1__cls_1"));
        final IndexDescriptor chip = named(dogIndexes, "chip_1__cls_1");
        assertTrue(chip.isUnique());
        assertTrue(chip.isSparse());

        sync(dogs.ensureIndexes());
        assertEquals(Set.of("_id_", "name_1", "age_1", "chip_1__cls_1", "breed_1__cls_1"), names(sync(animals.listIndexes())));

        sync(animals.create(Map.of("name", "Einstein")).commit());
        sync(animals.create(Map.of("name", "Copernicus")).commit());
        sync(dogs.create(Map.of("name", "Rex", "chip", "c-1")).commit());
    }

    @Test
    public void conflictingIndexDefinitionIsRejected() {
        final DocumentCollection things = layer.register(DocumentTypeBuilder.newBuilder("Thing")
                .addField("indexed", Fields.string())
                .addIndex(IndexDeclaration.keys("indexed")));
        sync(driver.createIndex(things.getCollectionName(),
                IndexDescriptor.of(List.of(new IndexDescriptor.Key("indexed", 1)), true, false)));
        failure(IndexConflictException.class, things.ensureIndexes());
    }

    @Test
    public void uniqueIndexOverDuplicatesFails() {
        final DocumentCollection plain = layer.register(DocumentTypeBuilder.newBuilder("Thing")
                .addField("code", Fields.string()));
        sync(plain.create(Map.of("code", "a")).commit());
        sync(plain.create(Map.of("code", "a")).commit());
        failure(DuplicateKeyException.class, driver.createIndex(plain.getCollectionName(),
                IndexDescriptor.of(List.of(new IndexDescriptor.Key("code", 1)), true, false)));
    }

    @Test
    public void dropIndexesKeepsIdentityIndex() {
        final DocumentCollection things = layer.register(DocumentTypeBuilder.newBuilder("Thing")
                .addField("indexed", Fields.string())
                .addIndex(IndexDeclaration.keys("indexed")));
        sync(things.ensureIndexes());
        sync(things.dropIndexes());
        assertEquals(Set.of("_id_"), names(sync(things.listIndexes())));

        sync(things.drop());
        assertThat(sync(things.listIndexes()), empty());
        assertThat(sync(things.find()), empty());
    }

    @Test
    public void documentsInheritTheirParentsIndexes() {
        layer.register(DocumentTypeBuilder.newBuilder("Animal")
                .setAllowInheritance(true)
                .addField("name", Fields.string().unique()));
        layer.register(DocumentTypeBuilder.newBuilder("Cat")
                .setParent("Animal"));
        final DocumentCollection cats = layer.collection("Cat");
        assertThat(cats.getIndexes().stream().map(IndexDescriptor::getName).collect(Collectors.toList()),
                containsInAnyOrder("name_1"));
    }
}
