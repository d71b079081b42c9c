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
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Octree node delegating storage to eight children, indexed by {@link Octant#code()}. The children exactly tile this
 * node's cube: each has half the side and is centered a quarter side away from this center on every axis.
 *
 * @param <E> the type of entity indexed
 * @author hal.hildebrand
 */
public final class InternalNode<E extends Positioned> extends OctreeNode<E> {
    private static final int CHILDREN = 8;

    private final OctreeNode<E>[] children;

    private InternalNode(Tuple3f center, float side, int count, OctreeNode<E>[] children) {
        super(center, side, count);
        this.children = children;
    }

    /**
     * Create an internal node over the given children, which must be listed in octant code order. The count is the sum
     * of the children's counts.
     */
    public static <E extends Positioned> InternalNode<E> of(Tuple3f center, float side,
                                                        List<? extends OctreeNode<E>> children) {
        Objects.requireNonNull(children, "Children cannot be null");
        if (children.size() != CHILDREN) {
            throw new IllegalArgumentException("An internal node has exactly 8 children, not " + children.size());
        }
        OctreeNode<E>[] array = newChildren();
        var count = 0;
        for (var i = 0; i < CHILDREN; i++) {
            array[i] = Objects.requireNonNull(children.get(i), "Child cannot be null");
            count += array[i].count;
        }
        return new InternalNode<>(center, side, count, array);
    }

    /**
     * Create an internal node whose eight children are empty leaves tiling the cube
     */
    public static <E extends Positioned> InternalNode<E> subdivide(Tuple3f center, float side) {
        OctreeNode<E>[] array = newChildren();
        var half = side / 2.0f;
        for (var octant : Octant.values()) {
            array[octant.code()] = LeafNode.empty(octant.childCenter(center, side), half);
        }
        return new InternalNode<>(center, side, 0, array);
    }

    @SuppressWarnings("unchecked")
    private static <E extends Positioned> OctreeNode<E>[] newChildren() {
        return (OctreeNode<E>[]) new OctreeNode[CHILDREN];
    }

    @Override
    public OctreeNode<E> child(Octant octant) {
        return children[octant.code()];
    }

    /**
     * @return the children in octant code order
     */
    public List<OctreeNode<E>> children() {
        return Collections.unmodifiableList(Arrays.asList(children));
    }

    @Override
    public Stream<E> entities() {
        return Arrays.stream(children).flatMap(OctreeNode::entities);
    }

    @Override
    public OctreeNode<E> insert(E entity) {
        var octant = octantOf(entity.getPosition());
        return replaceChild(octant, child(octant).insert(entity));
    }

    @Override
    public OctreeNode<E> insertAll(List<? extends E> batch) {
        if (batch.isEmpty()) {
            return this;
        }
        var buckets = new EnumMap<Octant, List<E>>(Octant.class);
        for (E entity : batch) {
            buckets.computeIfAbsent(octantOf(entity.getPosition()), o -> new ArrayList<>()).add(entity);
        }
        var updated = children.clone();
        buckets.forEach((octant, bucket) -> updated[octant.code()] = children[octant.code()].insertAll(bucket));
        return new InternalNode<>(center, side, count + batch.size(), updated);
    }

    @Override
    public boolean isLeaf() {
        return false;
    }

    @Override
    public OctreeNode<E> replaceChild(Octant octant, OctreeNode<E> newChild) {
        Objects.requireNonNull(newChild, "Child cannot be null");
        var old = children[octant.code()];
        if (old == newChild) {
            return this;
        }
        var updated = children.clone();
        updated[octant.code()] = newChild;
        return new InternalNode<>(center, side, count - old.count + newChild.count, updated);
    }

    @Override
    public OctreeNode<E> split() {
        return this;
    }

    @Override
    public String toString() {
        return "Internal[center=" + center + ", side=" + side + ", count=" + count + "]";
    }

    /**
     * Rebuild this node with replacement children, sharing this node when nothing changed. Splitting never changes
     * membership, so the count is carried over.
     */
    InternalNode<E> withChildren(OctreeNode<E>[] replacement) {
        if (Arrays.equals(children, replacement)) {
            return this;
        }
        return new InternalNode<>(center, side, count, replacement.clone());
    }

    OctreeNode<E>[] childArray() {
        return children.clone();
    }
}
