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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point3f;
import javax.vecmath.Tuple3f;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Persistent octree over a population of positioned entities, answering "what is near position P?".
 * <p>
 * An Octree is an immutable value. Insertion and splitting answer a new Octree that shares every subtree off the
 * updated paths with this one, so a snapshot may be queried from any number of threads while the next version is
 * built. Insertion never deepens the tree: entities accumulate in leaves until {@link #splitWhere} refines them under
 * the caller's capacity policy. There is no removal; moving or removing entities is done by rebuilding with
 * {@link #map}.
 * <p>
 * Insertion and point lookup check positions against the closed root cube according to the configured
 * {@link OctreeConfig.BoundsPolicy}. Radius and nearest neighbor queries accept any query position.
 *
 * @param <E> the type of entity indexed
 * @author hal.hildebrand
 */
public final class Octree<E extends Positioned> implements Iterable<E> {
    private static final Logger log = LoggerFactory.getLogger(Octree.class);

    private final OctreeNode<E> root;
    private final OctreeConfig  config;

    private Octree(OctreeNode<E> root, OctreeConfig config) {
        this.root = root;
        this.config = config;
    }

    /**
     * @return an empty octree covering the cube, with the default configuration
     */
    public static <E extends Positioned> Octree<E> empty(Tuple3f center, float side) {
        return empty(center, side, OctreeConfig.defaults());
    }

    /**
     * @return an empty octree covering the cube
     */
    public static <E extends Positioned> Octree<E> empty(Tuple3f center, float side, OctreeConfig config) {
        Objects.requireNonNull(center, "Center cannot be null");
        Objects.requireNonNull(config, "Config cannot be null");
        if (!(side > 0.0f) || Float.isInfinite(side)) {
            throw new IllegalArgumentException("Side must be a finite, positive value: " + side);
        }
        return new Octree<>(LeafNode.empty(center, side), config.copy());
    }

    /**
     * @return an unsplit octree covering the cube and holding the entities, with the default configuration
     */
    public static <E extends Positioned> Octree<E> of(Iterable<? extends E> entities, Tuple3f center, float side) {
        return of(entities, center, side, OctreeConfig.defaults());
    }

    /**
     * @return an unsplit octree covering the cube and holding the entities
     */
    public static <E extends Positioned> Octree<E> of(Iterable<? extends E> entities, Tuple3f center, float side,
                                                      OctreeConfig config) {
        Octree<E> tree = empty(center, side, config);
        return tree.insertAll(entities);
    }

    /**
     * @return true if the closed root cube contains the position
     */
    public boolean contains(Tuple3f position) {
        return root.contains(position);
    }

    /**
     * Stream every entity, children in octant code order and each leaf in insertion order. Every call answers a fresh
     * stream over this snapshot.
     */
    public Stream<E> entities() {
        return root.entities();
    }

    /**
     * Left fold over the entities in {@link #entities()} order
     */
    public <A> A fold(A identity, BiFunction<A, ? super E, A> accumulator) {
        Objects.requireNonNull(accumulator, "Accumulator cannot be null");
        var result = identity;
        for (var entity : this) {
            result = accumulator.apply(result, entity);
        }
        return result;
    }

    /**
     * @return the center of the root cube
     */
    public Point3f getCenter() {
        return root.getCenter();
    }

    /**
     * @return a copy of this tree's configuration
     */
    public OctreeConfig getConfig() {
        return config.copy();
    }

    /**
     * @return the edge length of the root cube
     */
    public float getSide() {
        return root.getSide();
    }

    /**
     * Insert the entity, answering the new tree
     *
     * @throws IllegalArgumentException if the entity lies outside the root cube and the bounds policy rejects it
     */
    public Octree<E> insert(E entity) {
        Objects.requireNonNull(entity, "Entity cannot be null");
        checkBounds(entity.getPosition());
        return new Octree<>(root.insert(entity), config);
    }

    /**
     * Insert the entities in order, answering the new tree. Nothing is inserted if any entity is rejected.
     *
     * @throws IllegalArgumentException if an entity lies outside the root cube and the bounds policy rejects it
     */
    public Octree<E> insertAll(Iterable<? extends E> entities) {
        Objects.requireNonNull(entities, "Entities cannot be null");
        var batch = new ArrayList<E>();
        for (E entity : entities) {
            Objects.requireNonNull(entity, "Entity cannot be null");
            checkBounds(entity.getPosition());
            batch.add(entity);
        }
        if (batch.isEmpty()) {
            return this;
        }
        return new Octree<>(root.insertAll(batch), config);
    }

    @Override
    public Iterator<E> iterator() {
        return root.entities().iterator();
    }

    public boolean isEmpty() {
        return root.getCount() == 0;
    }

    /**
     * Find up to <code>k</code> entities strictly within <code>maxRadius</code> of the position, nearest first
     */
    public List<Neighbor<E>> kNearest(Tuple3f position, int k, float maxRadius) {
        Objects.requireNonNull(position, "Position cannot be null");
        return KNearestNeighborSearch.kNearest(root, position, k, maxRadius);
    }

    /**
     * Answer the entities of the leaf containing the position
     *
     * @throws IllegalArgumentException if the position lies outside the root cube and the bounds policy rejects it
     */
    public List<E> locate(Tuple3f position) {
        Objects.requireNonNull(position, "Position cannot be null");
        checkBounds(position);
        return RadiusSearch.locate(root, position);
    }

    /**
     * Rebuild the tree from the transformed entities. A transformation may move an entity into another leaf, so every
     * result is re-inserted into a fresh, unsplit tree over the same cube; re-apply {@link #splitWhere} as needed.
     *
     * @throws IllegalArgumentException if a transformed entity lies outside the root cube and the bounds policy rejects
     *                                  it
     */
    public <F extends Positioned> Octree<F> map(Function<? super E, ? extends F> transform) {
        Objects.requireNonNull(transform, "Transform cannot be null");
        var transformed = new ArrayList<F>(size());
        for (var entity : this) {
            transformed.add(transform.apply(entity));
        }
        Octree<F> rebuilt = new Octree<>(LeafNode.empty(root.center, root.side), config);
        return rebuilt.insertAll(transformed);
    }

    /**
     * @return the root node of this snapshot
     */
    public OctreeNode<E> root() {
        return root;
    }

    /**
     * @return the number of entities in the tree
     */
    public int size() {
        return root.getCount();
    }

    /**
     * Split the root if it is a leaf
     */
    public Octree<E> split() {
        var split = root.split();
        return split == root ? this : new Octree<>(split, config);
    }

    /**
     * Split every leaf for which the predicate holds, repeatedly, until it holds on no leaf.
     *
     * @throws SubdivisionLimitException if the predicate holds on a leaf at the configured depth or extent floor
     */
    public Octree<E> splitWhere(Predicate<? super LeafNode<E>> predicate) {
        var split = Subdivision.splitWhere(root, predicate, config);
        if (split == root) {
            return this;
        }
        log.debug("Split octree of {} entities at {} side {}", root.getCount(), root.center, root.side);
        return new Octree<>(split, config);
    }

    @Override
    public String toString() {
        return "Octree[center=" + root.center + ", side=" + root.side + ", size=" + root.getCount() + "]";
    }

    /**
     * Find every entity strictly within <code>radius</code> of the position, in no defined order
     */
    public List<E> withinRadius(Tuple3f position, float radius) {
        Objects.requireNonNull(position, "Position cannot be null");
        return RadiusSearch.collectWithinRadius(root, position, radius);
    }

    private void checkBounds(Tuple3f position) {
        Objects.requireNonNull(position, "Position cannot be null");
        if (config.getBoundsPolicy() == OctreeConfig.BoundsPolicy.REJECT && !root.contains(position)) {
            throw new IllegalArgumentException(
            "Position " + position + " lies outside the octree cube centered at " + root.center + " with side "
            + root.side);
        }
    }
}
