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

import javax.vecmath.Point3f;
import javax.vecmath.Tuple3f;
import java.util.List;
import java.util.stream.Stream;

/**
 * A node of the persistent octree: either an {@link InternalNode} owning exactly eight children, one per
 * {@link Octant}, or a {@link LeafNode} owning entities directly. Both cover an axis aligned cube given by its center
 * and side, and cache the number of entities reachable below them.
 * <p>
 * Nodes are immutable. Every update returns a new node that shares all untouched subtrees with the original, so any
 * number of readers may hold and query older versions while newer versions are built.
 *
 * @param <E> the type of entity indexed
 * @author hal.hildebrand
 */
public abstract sealed class OctreeNode<E extends Positioned> permits InternalNode, LeafNode {

    // never mutated after construction
    final Point3f center;
    final float   side;
    final int     count;

    OctreeNode(Tuple3f center, float side, int count) {
        this.center = new Point3f(center);
        this.side = side;
        this.count = count;
    }

    /**
     * Answer the child covering the octant. A leaf answers itself, so algorithms descending by octant need not branch
     * on the node variant.
     */
    public abstract OctreeNode<E> child(Octant octant);

    /**
     * @return the stream of every entity below this node, children visited in octant code order. Each call produces
     * a fresh stream
     */
    public abstract Stream<E> entities();

    /**
     * @return a copy of the center of this node's cube
     */
    public Point3f getCenter() {
        return new Point3f(center);
    }

    /**
     * @return the number of entities below this node
     */
    public int getCount() {
        return count;
    }

    /**
     * @return the edge length of this node's cube
     */
    public float getSide() {
        return side;
    }

    /**
     * Insert the entity, answering the new node. Only the path from this node to the target leaf is rebuilt; a leaf
     * never splits as a result of insertion.
     */
    public abstract OctreeNode<E> insert(E entity);

    /**
     * Insert the batch, answering the new node. Equivalent to inserting each entity in order, but each affected leaf is
     * rebuilt once.
     */
    public abstract OctreeNode<E> insertAll(List<? extends E> batch);

    public abstract boolean isLeaf();

    /**
     * @return the octant of this node containing the position
     */
    public Octant octantOf(Tuple3f position) {
        return Octant.of(center, position);
    }

    /**
     * Replace the child at the octant. The count is adjusted by the difference between the old and new child. A leaf
     * has no children and answers itself.
     */
    public abstract OctreeNode<E> replaceChild(Octant octant, OctreeNode<E> newChild);

    /**
     * Split this node. A leaf becomes an internal node with eight empty children of half the side, after which its
     * entities are re-inserted. An internal node is already split and answers itself.
     */
    public abstract OctreeNode<E> split();

    /**
     * @return true if the closed cube of this node contains the position
     */
    public boolean contains(Tuple3f position) {
        var half = side / 2.0f;
        return Math.abs(position.x - center.x) <= half && Math.abs(position.y - center.y) <= half
        && Math.abs(position.z - center.z) <= half;
    }
}
