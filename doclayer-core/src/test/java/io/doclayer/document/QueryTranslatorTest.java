/*
 * QueryTranslatorTest.java
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

import io.doclayer.document.metadata.DocumentType;
import io.doclayer.document.metadata.DocumentTypeBuilder;
import io.doclayer.document.metadata.Fields;
import io.doclayer.document.metadata.Schema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Tests for translating queries on in-memory field names into storage queries.
 */
public class QueryTranslatorTest extends DocumentLayerTestBase {
    private static final Schema TAG = Schema.newBuilder("Tag")
            .addField("label", Fields.string().attribute("l"))
            .build();
    private static final Schema ADDRESS = Schema.newBuilder("Address")
            .addField("city", Fields.string().attribute("c"))
            .addField("zip", Fields.string().attribute("z"))
            .build();

    private DocumentCollection authors;
    private DocumentCollection articles;

    @BeforeEach
    public void setUpTypes() {
        authors = layer.register(DocumentTypeBuilder.newBuilder("Author")
                .addField("name", Fields.string().attribute("n")));
        articles = layer.register(DocumentTypeBuilder.newBuilder("Article")
                .setAllowInheritance(true)
                .addField("title", Fields.string().attribute("t"))
                .addField("author", Fields.reference("Author").attribute("a"))
                .addField("address", Fields.embedded(ADDRESS).attribute("addr"))
                .addField("tags", Fields.list(Fields.embedded(TAG)).attribute("tg"))
                .addField("keywords", Fields.list(Fields.string()).attribute("kw")));
        layer.register(DocumentTypeBuilder.newBuilder("Review")
                .setParent("Article")
                .addField("rating", Fields.integer().attribute("r")));
    }

    private Map<String, Object> translate(Map<String, ?> query) {
        final DocumentType type = articles.getType();
        return layer.getQueryTranslator().translate(type, query);
    }

    @Test
    public void fieldNamesBecomeAttributes() {
        assertEquals(Map.of("t", "Outatime", "_id", "a-1"), translate(Map.of("title", "Outatime", "id", "a-1")));
        assertEquals(Map.of("addr.c", "Hill Valley"), translate(Map.of("address.city", "Hill Valley")));
        assertEquals(Map.of("tg.l", "physics"), translate(Map.of("tags.label", "physics")));
        assertEquals(Map.of("tg.0.l", "physics"), translate(Map.of("tags.0.label", "physics")));
        assertEquals(Map.of("unknown.path", 1), translate(Map.of("unknown.path", 1)));
    }

    @Test
    public void descendantFieldsResolve() {
        assertEquals(Map.of("r", Map.of("$gte", 4)), translate(Map.of("rating", Map.of("$gte", 4))));
    }

    @Test
    public void operatorsAndLogicalClausesAreTranslated() {
        final Map<String, Object> query = translate(Map.of("$or", List.of(
                Map.of("title", Map.of("$in", List.of("a", "b"))),
                Map.of("keywords", Map.of("$all", List.of("time", "travel"))),
                Map.of("address.zip", Map.of("$exists", false)))));
        assertEquals(Map.of("$or", List.of(
                Map.of("t", Map.of("$in", List.of("a", "b"))),
                Map.of("kw", Map.of("$all", List.of("time", "travel"))),
                Map.of("addr.z", Map.of("$exists", false)))), query);
    }

    @Test
    public void documentsAndEmbeddedValuesUseStorageForm() {
        final Document doc = authors.create(Map.of("name", "Doc"));
        sync(doc.commit());
        assertEquals(Map.of("a", doc.getId()), translate(Map.of("author", doc)));
        assertEquals(Map.of("a", Map.of("$in", List.of(doc.getId(), "other"))),
                translate(Map.of("author", Map.of("$in", List.of(authors.reference(doc.getId()), "other")))));
        assertEquals(Map.of("addr", Map.of("c", "Hill Valley", "z", "95420")),
                translate(Map.of("address", Map.of("city", "Hill Valley", "zip", "95420"))));
    }

    @Test
    public void translatedQueriesMatchStoredDocuments() {
        final Document doc = authors.create(Map.of("name", "Doc"));
        sync(doc.commit());
        sync(articles.create(Map.of(
                "title", "Flux capacitor",
                "author", doc,
                "keywords", List.of("time", "travel"),
                "tags", List.of(Map.of("label", "physics")))).commit());
        sync(articles.create(Map.of("title", "Hoverboards", "keywords", List.of("travel"))).commit());
        sync(layer.collection("Review").create(Map.of("title", "Jaws 19", "rating", 2)).commit());

        assertThat(titles(Map.of("keywords", "travel")), containsInAnyOrder("Flux capacitor", "Hoverboards"));
        assertThat(titles(Map.of("tags.label", "physics")), containsInAnyOrder("Flux capacitor"));
        assertThat(titles(Map.of("author", doc)), containsInAnyOrder("Flux capacitor"));
        assertThat(titles(Map.of("rating", Map.of("$lt", 3))), containsInAnyOrder("Jaws 19"));
        assertThat(titles(Map.of("$and", List.of(Map.of("keywords", "travel"), Map.of("keywords", Map.of("$ne", "time"))))),
                containsInAnyOrder("Hoverboards"));
    }

    private List<Object> titles(Map<String, ?> query) {
        return sync(articles.find(query)).stream().map(article -> article.get("title")).collect(java.util.stream.Collectors.toList());
    }
}
