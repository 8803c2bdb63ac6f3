/*
 * TrackedList.java
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
import io.doclayer.document.metadata.FieldDescriptor;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.AbstractList;
import java.util.ArrayList;
import java.util.List;
import java.util.RandomAccess;

/**
 * The value of a list field. Every structural change marks the list as modified, which makes the owning field dirty.
 * Elements are converted like values assigned to a field of the element descriptor, so maps assigned to a list of
 * embedded documents become {@link EmbeddedDocument}s and documents assigned to a list of references become
 * {@link Reference}s. Changes made inside an embedded element also count as modifications of the list.
 *
 * <p>
 * A list field that was never assigned holds an <em>implicit</em> empty list. The implicit list is not written on
 * insert until it is modified for the first time.
 * </p>
 */
@API(API.Status.STABLE)
public class TrackedList extends AbstractList<Object> implements RandomAccess {
    @Nonnull
    private final FieldDescriptor elementField;
    @Nonnull
    private final PayloadTranslator translator;
    @Nonnull
    private final List<Object> elements = new ArrayList<>();
    private boolean modified;
    private boolean implicit;

    TrackedList(@Nonnull FieldDescriptor elementField, @Nonnull PayloadTranslator translator, boolean implicit) {
        this.elementField = elementField;
        this.translator = translator;
        this.implicit = implicit;
    }

    @Nonnull
    public FieldDescriptor getElementField() {
        return elementField;
    }

    @Override
    public Object get(int index) {
        return elements.get(index);
    }

    @Override
    public int size() {
        return elements.size();
    }

    @Override
    public Object set(int index, @Nullable Object element) {
        final Object previous = elements.set(index, translator.toFieldValue(elementField, element));
        markModified();
        return previous;
    }

    @Override
    public void add(int index, @Nullable Object element) {
        elements.add(index, translator.toFieldValue(elementField, element));
        modCount++;
        markModified();
    }

    @Override
    public Object remove(int index) {
        final Object removed = elements.remove(index);
        modCount++;
        markModified();
        return removed;
    }

    /**
     * Whether the list was changed since it was loaded or last committed, either structurally or inside one of its
     * embedded elements.
     * @return whether the list has uncommitted changes
     */
    public boolean isModified() {
        if (modified) {
            return true;
        }
        for (Object element : elements) {
            if (element instanceof EmbeddedDocument && ((EmbeddedDocument)element).isModified()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Whether this is the untouched empty list that stands in for a list field that was never assigned.
     * @return whether the list is the implicit default
     */
    public boolean isImplicit() {
        return implicit;
    }

    /**
     * Add an element read from the store without marking the list as modified.
     * @param element the element, already converted from its storage form
     */
    void load(@Nullable Object element) {
        elements.add(element);
    }

    void clearModified() {
        modified = false;
        for (Object element : elements) {
            if (element instanceof EmbeddedDocument) {
                ((EmbeddedDocument)element).clearModified();
            }
        }
    }

    private void markModified() {
        modified = true;
        implicit = false;
    }
}
