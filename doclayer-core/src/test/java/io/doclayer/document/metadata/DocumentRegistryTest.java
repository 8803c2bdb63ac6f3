/*
 * DocumentRegistryTest.java
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

package io.doclayer.document.metadata;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import javax.annotation.Nonnull;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for registering document types.
 */
public class DocumentRegistryTest {
    private static final Schema POINT = Schema.newBuilder("Point")
            .addField("x", Fields.number())
            .addField("y", Fields.number())
            .build();

    private DocumentRegistry registry;

    @BeforeEach
    public void setUp() {
        registry = new DocumentRegistry();
    }

    @Test
    public void rootTypeDefaults() {
        final DocumentType type = registry.register(DocumentTypeBuilder.newBuilder("BlogPost")
                .addField("title", Fields.string()));
        assertEquals("blog_post", type.getCollectionName());
        assertFalse(type.isPolymorphic());
        assertThat(type.getSchema().getFields().keySet(), contains("id", "title"));
        assertEquals("_id", type.getSchema().getField("id").getAttribute());
        assertSame(type, registry.getType("BlogPost"));
        assertNull(registry.getTypeOrNull("Comment"));
        assertThrows(MetaDataException.class, () -> registry.getType("Comment"));
    }

    @Test
    public void subtypesInheritFields() {
        final DocumentType animal = registry.register(DocumentTypeBuilder.newBuilder("Animal")
                .setCollectionName("zoo")
                .setAllowInheritance(true)
                .addField("name", Fields.string()));
        final DocumentType dog = registry.register(DocumentTypeBuilder.newBuilder("Dog")
                .setParent("Animal")
                .setAllowInheritance(true)
                .addField("name", Fields.string().required())
                .addField("breed", Fields.string()));
        final DocumentType puppy = registry.register(DocumentTypeBuilder.newBuilder("Puppy")
                .setParent("Dog"));
        final DocumentType cat = registry.register(DocumentTypeBuilder.newBuilder("Cat")
                .setParent("Animal"));

        assertEquals("zoo", puppy.getCollectionName());
        assertTrue(animal.isPolymorphic());
        assertTrue(cat.isPolymorphic());
        assertThat(dog.getSchema().getFields().keySet(), contains("id", "name", "breed"));
        assertTrue(dog.getSchema().getField("name").isRequired());
        assertFalse(animal.getSchema().getField("name").isRequired());
        assertTrue(puppy.isSubtypeOf(animal));
        assertFalse(cat.isSubtypeOf(dog));
        assertSame(animal, puppy.getRoot());
        assertThat(puppy.getAncestry().stream().map(DocumentType::getName).collect(Collectors.toList()),
                contains("Animal", "Dog", "Puppy"));
        assertThat(registry.getDescendants(animal).stream().map(DocumentType::getName).collect(Collectors.toList()),
                contains("Dog", "Puppy", "Cat"));
    }

    @Test
    public void uniqueOriginIsHighestUniqueDeclaration() {
        final DocumentType animal = registry.register(DocumentTypeBuilder.newBuilder("Animal")
                .setAllowInheritance(true)
                .addField("name", Fields.string())
                .addField("tag", Fields.string().unique()));
        final DocumentType dog = registry.register(DocumentTypeBuilder.newBuilder("Dog")
                .setParent("Animal")
                .addField("name", Fields.string().unique()));
        assertSame(animal, dog.getUniqueOrigin("tag"));
        assertSame(dog, dog.getUniqueOrigin("name"));
        assertNull(animal.getUniqueOrigin("name"));
    }

    @SuppressWarnings("unused") // used as argument provider for parameterized test
    static Stream<Arguments> invalidDeclarations() {
        return Stream.of(
                Arguments.of("duplicate name", DocumentTypeBuilder.newBuilder("Closed")),
                Arguments.of("unknown parent", DocumentTypeBuilder.newBuilder("Orphan").setParent("Missing")),
                Arguments.of("parent without inheritance", DocumentTypeBuilder.newBuilder("Child").setParent("Closed")),
                Arguments.of("incompatible kind", DocumentTypeBuilder.newBuilder("Child").setParent("Open")
                        .addField("name", Fields.integer())),
                Arguments.of("incompatible embedded schema", DocumentTypeBuilder.newBuilder("Child").setParent("Open")
                        .addField("location", Fields.embedded(Schema.newBuilder("Other").build()))),
                Arguments.of("subtype collection", DocumentTypeBuilder.newBuilder("Child").setParent("Open")
                        .setCollectionName("elsewhere")),
                Arguments.of("identity redeclared", DocumentTypeBuilder.newBuilder("Rooted")
                        .addField("id", Fields.string())),
                Arguments.of("reserved attribute", DocumentTypeBuilder.newBuilder("Rooted")
                        .addField("kind", Fields.string().attribute("_cls"))),
                Arguments.of("shared attribute", DocumentTypeBuilder.newBuilder("Rooted")
                        .addField("a", Fields.string().attribute("same"))
                        .addField("b", Fields.string().attribute("same"))),
                Arguments.of("unique list", DocumentTypeBuilder.newBuilder("Rooted")
                        .addField("tags", Fields.list(Fields.string()).unique())),
                Arguments.of("unique list element", DocumentTypeBuilder.newBuilder("Rooted")
                        .addField("tags", Fields.list(Fields.string().unique()))),
                Arguments.of("unique inside embedded", DocumentTypeBuilder.newBuilder("Rooted")
                        .addField("spot", Fields.embedded(Schema.newBuilder("Spot")
                                .addField("code", Fields.string().unique())
                                .build()))),
                Arguments.of("index on unknown field", DocumentTypeBuilder.newBuilder("Rooted")
                        .addField("name", Fields.string())
                        .addIndex(IndexDeclaration.keys("name", "missing")))
        );
    }

    @ParameterizedTest(name = "invalidDeclaration [{0}]")
    @MethodSource("invalidDeclarations")
    public void invalidDeclaration(@Nonnull String description, @Nonnull DocumentTypeBuilder builder) {
        registry.register(DocumentTypeBuilder.newBuilder("Closed")
                .addField("name", Fields.string()));
        registry.register(DocumentTypeBuilder.newBuilder("Open")
                .setAllowInheritance(true)
                .addField("name", Fields.string())
                .addField("location", Fields.embedded(POINT)));

        assertThrows(MetaDataException.class, () -> registry.register(builder), description);
        assertEquals(2, registry.getTypes().size());
    }

    @Test
    public void builderRejectsRepeatedField() {
        final DocumentTypeBuilder builder = DocumentTypeBuilder.newBuilder("Twice")
                .addField("name", Fields.string());
        assertThrows(MetaDataException.class, () -> builder.addField("name", Fields.string()));
        assertThrows(MetaDataException.class, () -> Fields.list(Fields.list(Fields.string())));
        assertThrows(MetaDataException.class, () -> Fields.string().checkReference(false));
    }

    @Test
    public void identityGeneratorIsInherited() {
        final DocumentType root = registry.register(DocumentTypeBuilder.newBuilder("Sequenced")
                .setAllowInheritance(true)
                .setIdentityGenerator(() -> "fixed"));
        final DocumentType child = registry.register(DocumentTypeBuilder.newBuilder("SequencedChild")
                .setParent("Sequenced"));
        assertEquals("fixed", root.newIdentity());
        assertEquals("fixed", child.newIdentity());
    }
}
