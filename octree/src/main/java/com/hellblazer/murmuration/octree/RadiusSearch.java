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
import java.util.List;

/**
 * Point location and radius bounded region search over octree nodes.
 *
 * @author hal.hildebrand
 */
public final class RadiusSearch {

    // relative slack keeping the whole-leaf shortcut clear of float rounding in the per-entity test
    private static final double CONTAINMENT_SLACK = 1.0e-6;

    private RadiusSearch() {
    }

    /**
     * Candidate children of a node for a sphere of <code>radius</code> around <code>position</code>: the position's own
     * octant, plus the octant mirrored across each splitting plane the sphere straddles, in every combination. A sphere
     * larger than the node selects all eight children. A leaf is its own sole candidate.
     * <p>
     * The selection is conservative: no child that could hold an entity closer than the radius is omitted. The
     * position's own octant is always first.
     */
    public static <E extends Positioned> List<OctreeNode<E>> candidateChildren(OctreeNode<E> node, Tuple3f position,
                                                                               float radius) {
        if (node.isLeaf()) {
            return List.of(node);
        }
        var octants = candidateOctants(node, position, radius);
        var candidates = new ArrayList<OctreeNode<E>>(octants.size());
        for (var octant : octants) {
            candidates.add(node.child(octant));
        }
        return candidates;
    }

    /**
     * The octants selected by {@link #candidateChildren}, own octant first. Ordered with the x mirror varying fastest,
     * then y, then z.
     */
    public static List<Octant> candidateOctants(OctreeNode<?> node, Tuple3f position, float radius) {
        var own = node.octantOf(position);
        if (radius > node.side) {
            var all = new ArrayList<Octant>(8);
            all.add(own);
            for (var octant : Octant.values()) {
                if (octant != own) {
                    all.add(octant);
                }
            }
            return all;
        }
        var straddleX = radius > Math.abs(position.x - node.center.x);
        var straddleY = radius > Math.abs(position.y - node.center.y);
        var straddleZ = radius > Math.abs(position.z - node.center.z);
        var octants = new ArrayList<Octant>(8);
        for (var z = 0; z < (straddleZ ? 2 : 1); z++) {
            for (var y = 0; y < (straddleY ? 2 : 1); y++) {
                for (var x = 0; x < (straddleX ? 2 : 1); x++) {
                    var octant = own;
                    if (x == 1) {
                        octant = octant.opposite(Axis.X);
                    }
                    if (y == 1) {
                        octant = octant.opposite(Axis.Y);
                    }
                    if (z == 1) {
                        octant = octant.opposite(Axis.Z);
                    }
                    octants.add(octant);
                }
            }
        }
        return octants;
    }

    /**
     * Collect every entity strictly within <code>radius</code> of <code>position</code>. Leaves partition the entities,
     * so the result holds no duplicates. No ordering is defined.
     */
    public static <E extends Positioned> List<E> collectWithinRadius(OctreeNode<E> node, Tuple3f position,
                                                                     float radius) {
        var result = new ArrayList<E>();
        if (radius > 0.0f && node.count > 0) {
            collect(node, position, radius, result);
        }
        return result;
    }

    /**
     * Descend by octant to the leaf addressed by the position and answer its entities. No bounds check is made: a
     * position outside the node's cube answers whatever leaf the addressing reaches.
     */
    public static <E extends Positioned> List<E> locate(OctreeNode<E> node, Tuple3f position) {
        var current = node;
        while (!current.isLeaf()) {
            current = current.child(current.octantOf(position));
        }
        return ((LeafNode<E>) current).getEntities();
    }

    /**
     * @return true if the node's cube strictly contains the sphere of <code>radius</code> around
     * <code>position</code> on all six faces
     */
    public static boolean sphereWithinBounds(OctreeNode<?> node, Tuple3f position, float radius) {
        var half = node.side / 2.0f;
        var x = position.x - node.center.x;
        var y = position.y - node.center.y;
        var z = position.z - node.center.z;
        return -half < x - radius && -half < y - radius && -half < z - radius && half > x + radius
        && half > y + radius && half > z + radius;
    }

    /**
     * @return true if every point of the node's closed cube lies within the sphere of <code>radius</code> around
     * <code>position</code>
     */
    static boolean cubeWithinSphere(OctreeNode<?> node, Tuple3f position, float radius) {
        double half = node.side / 2.0f;
        var x = Math.abs((double) position.x - node.center.x) + half;
        var y = Math.abs((double) position.y - node.center.y) + half;
        var z = Math.abs((double) position.z - node.center.z) + half;
        double r = radius;
        return (x * x + y * y + z * z) * (1.0 + CONTAINMENT_SLACK) < r * r;
    }

    private static <E extends Positioned> void collect(OctreeNode<E> node, Tuple3f position, float radius,
                                                       List<E> result) {
        if (node.count == 0) {
            return;
        }
        if (node instanceof LeafNode<E> leaf) {
            if (radius > leaf.side && cubeWithinSphere(leaf, position, radius)) {
                result.addAll(leaf.getEntities());
                return;
            }
            var radiusSquared = radius * radius;
            for (E entity : leaf.getEntities()) {
                if (radiusSquared > distanceSquared(position, entity.getPosition())) {
                    result.add(entity);
                }
            }
            return;
        }
        for (var child : candidateChildren(node, position, radius)) {
            collect(child, position, radius, result);
        }
    }

    /**
     * Squared euclidean distance in float arithmetic, the measure every radius comparison in this package uses
     */
    static float distanceSquared(Tuple3f a, Tuple3f b) {
        var dx = a.x - b.x;
        var dy = a.y - b.y;
        var dz = a.z - b.z;
        return dx * dx + dy * dy + dz * dz;
    }
}
