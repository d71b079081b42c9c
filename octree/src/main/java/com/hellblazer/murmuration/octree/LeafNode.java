/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Murmuration.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.murmuration.octree;

import com.hellblazer.murmuration.entity.Positioned;

import javax.vecmath.Tuple3f;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Terminal octree node storing entities directly, in insertion order. No containment is enforced here: an entity is
 * kept by whichever leaf octant addressing routes it to.
 *
 * @param <E> the type of entity indexed
 * @author hal.hildebrand
 */
public final class LeafNode<E extends Positioned> extends OctreeNode<E> {

    private final List<E> entities;

    private LeafNode(Tuple3f center, float side, List<E> entities) {
        super(center, side, entities.size());
        this.entities = entities;
    }

    /**
     * @return an empty leaf covering the cube
     */
    public static <E extends Positioned> LeafNode<E> empty(Tuple3f center, float side) {
        return new LeafNode<>(center, side, Collections.emptyList());
    }

    @Override
    public OctreeNode<E> child(Octant octant) {
        return this;
    }

    @Override
    public Stream<E> entities() {
        return entities.stream();
    }

    /**
     * @return the unmodifiable entities of this leaf
     */
    public List<E> getEntities() {
        return entities;
    }

    @Override
    public LeafNode<E> insert(E entity) {
        Objects.requireNonNull(entity, "Entity cannot be null");
        var updated = new ArrayList<E>(entities.size() + 1);
        updated.addAll(entities);
        updated.add(entity);
        return new LeafNode<>(center, side, Collections.unmodifiableList(updated));
    }

    @Override
    public LeafNode<E> insertAll(List<? extends E> batch) {
        if (batch.isEmpty()) {
            return this;
        }
        var updated = new ArrayList<E>(entities.size() + batch.size());
        updated.addAll(entities);
        for (E entity : batch) {
            updated.add(Objects.requireNonNull(entity, "Entity cannot be null"));
        }
        return new LeafNode<>(center, side, Collections.unmodifiableList(updated));
    }

    public boolean isEmpty() {
        return entities.isEmpty();
    }

    @Override
    public boolean isLeaf() {
        return true;
    }

    @Override
    public OctreeNode<E> replaceChild(Octant octant, OctreeNode<E> newChild) {
        return this;
    }

    @Override
    public InternalNode<E> split() {
        var node = InternalNode.<E>subdivide(center, side);
        return (InternalNode<E>) node.insertAll(entities);
    }

    @Override
    public String toString() {
        return "Leaf[center=" + center + ", side=" + side + ", count=" + count + "]";
    }
}
