/*
 * ReferenceTest.java
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

import io.doclayer.document.metadata.DocumentTypeBuilder;
import io.doclayer.document.metadata.Fields;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for references between documents.
 */
public class ReferenceTest extends DocumentLayerTestBase {
    private Classroom classroom;

    @BeforeEach
    public void setUpTypes() {
        classroom = new Classroom(layer);
    }

    @Test
    public void fetchLoadsReferencedDocument() {
        final Document teacher = classroom.teachers.create(Map.of("name", "Dr. Brown"));
        sync(teacher.commit());
        final Reference reference = classroom.teachers.reference(teacher.getId());
        assertSame(classroom.teachers, reference.getCollection());
        assertEquals("Teacher", reference.getDocumentType().getName());
        assertTrue(sync(reference.exists()));
        final Document fetched = sync(reference.fetch());
        assertEquals(teacher, fetched);
        assertEquals("Dr. Brown", fetched.get("name"));
    }

    @Test
    public void fetchOfMissingDocumentFails() {
        final Reference reference = classroom.teachers.reference("gone");
        assertFalse(sync(reference.exists()));
        final ReferenceNotFoundException failure = failure(ReferenceNotFoundException.class, reference.fetch());
        assertEquals("Reference not found for document Teacher.", failure.getMessage());
    }

    @Test
    public void assignedValuesBecomeReferences() {
        final Document teacher = classroom.teachers.create(Map.of("name", "Dr. Brown"));
        sync(teacher.commit());
        final Document byDocument = classroom.courses.create(Map.of("name", "Physics", "teacher", teacher));
        final Document byId = classroom.courses.create(Map.of("name", "Physics", "teacher", teacher.getId()));
        assertEquals(byDocument.getReference("teacher"), byId.getReference("teacher"));
        assertEquals(classroom.teachers.reference(teacher.getId()), byId.getReference("teacher"));
        assertNotEquals(classroom.teachers.reference("other"), byId.getReference("teacher"));
        assertThrows(DocumentLayerArgumentException.class, () -> byId.getReference("name"));
    }

    @Test
    public void uncreatedDocumentCannotBeReferenced() {
        final Document teacher = classroom.teachers.create(Map.of("name", "Dr. Brown"));
        final Document course = classroom.courses.create(Map.of("name", "Physics"));
        assertThrows(DocumentLayerArgumentException.class, () -> course.set("teacher", teacher));
        assertFalse(course.getDirtyFields().contains("teacher"));
    }

    @Test
    public void subtypeDocumentsAreReachableThroughParentReferences() {
        layer.register(DocumentTypeBuilder.newBuilder("Person")
                .setAllowInheritance(true)
                .addField("name", Fields.string()));
        final DocumentCollection professors = layer.register(DocumentTypeBuilder.newBuilder("Professor")
                .setParent("Person"));
        final DocumentCollection theses = layer.register(DocumentTypeBuilder.newBuilder("Thesis")
                .addField("advisor", Fields.reference("Person")));

        final Document professor = professors.create(Map.of("name", "Dr. Brown"));
        sync(professor.commit());
        final Document thesis = theses.create(Map.of("advisor", professor));
        sync(thesis.commit());

        final Document loaded = sync(theses.findOne(thesis.getId()));
        final Document advisor = sync(loaded.getReference("advisor").fetch());
        assertEquals("Professor", advisor.getType().getName());
    }
}
