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

import javax.vecmath.Tuple3f;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Best first k-nearest neighbor search with branch pruning.
 * <p>
 * At an internal node the child containing the query point is searched first, which usually fills the result list
 * with close candidates quickly. The distance of the k-th candidate then becomes the pruning radius: only the sibling
 * octants a sphere of that radius reaches are visited, each with the radius as it stands after the previous merge, so
 * the frontier tightens as better candidates are found. When the first child holds k candidates and strictly contains
 * the pruning sphere, no sibling can do better and the search returns at once.
 * <p>
 * Merges are deterministic: newly found entries precede entries already held at equal distance, and each list keeps
 * its own order.
 *
 * @author hal.hildebrand
 */
public final class KNearestNeighborSearch {
    private static final Logger log = LoggerFactory.getLogger(KNearestNeighborSearch.class);

    private KNearestNeighborSearch() {
    }

    /**
     * Find up to <code>k</code> entities strictly within <code>maxRadius</code> of the query point, nearest first.
     * Fewer than k entries are answered when fewer entities lie within the radius. A non-positive k or radius answers
     * the empty list.
     */
    public static <E extends Positioned> List<Neighbor<E>> kNearest(OctreeNode<E> node, Tuple3f position, int k,
                                                                    float maxRadius) {
        if (k <= 0 || !(maxRadius > 0.0f) || node.count == 0) {
            return Collections.emptyList();
        }
        return search(node, position, k, maxRadius);
    }

    /**
     * Merge <code>found</code> into <code>nearest</code>, both ascending by distance, keeping the first k. Entries of
     * <code>found</code> win ties.
     */
    static <E> List<Neighbor<E>> merge(List<Neighbor<E>> nearest, List<Neighbor<E>> found, int k) {
        if (found.isEmpty()) {
            return nearest;
        }
        var merged = new ArrayList<Neighbor<E>>(Math.min(k, nearest.size() + found.size()));
        var i = 0;
        var j = 0;
        while (merged.size() < k && (i < nearest.size() || j < found.size())) {
            if (i >= nearest.size() || (j < found.size() && found.get(j).distance() <= nearest.get(i).distance())) {
                merged.add(found.get(j++));
            } else {
                merged.add(nearest.get(i++));
            }
        }
        return merged;
    }

    private static <E extends Positioned> List<Neighbor<E>> searchLeaf(LeafNode<E> leaf, Tuple3f position, int k,
                                                                       float maxRadius) {
        var candidates = new ArrayList<Neighbor<E>>();
        for (E entity : leaf.getEntities()) {
            var distance = (float) Math.sqrt(RadiusSearch.distanceSquared(entity.getPosition(), position));
            if (distance < maxRadius) {
                candidates.add(new Neighbor<>(entity, distance));
            }
        }
        candidates.sort(Neighbor.nearestFirst());
        return candidates.size() > k ? new ArrayList<>(candidates.subList(0, k)) : candidates;
    }

    private static <E extends Positioned> List<Neighbor<E>> search(OctreeNode<E> node, Tuple3f position, int k,
                                                                   float maxRadius) {
        if (node.count == 0) {
            return Collections.emptyList();
        }
        if (node instanceof LeafNode<E> leaf) {
            return searchLeaf(leaf, position, k, maxRadius);
        }
        var own = node.octantOf(position);
        var first = node.child(own);
        var nearest = search(first, position, k, maxRadius);
        var radius = pruningRadius(nearest, k, maxRadius);
        if (nearest.size() >= k && RadiusSearch.sphereWithinBounds(first, position, radius)) {
            return nearest;
        }
        for (var octant : RadiusSearch.candidateOctants(node, position, radius)) {
            if (octant == own) {
                continue;
            }
            var sibling = node.child(octant);
            if (sibling.count == 0) {
                continue;
            }
            var current = pruningRadius(nearest, k, maxRadius);
            if (log.isTraceEnabled()) {
                log.trace("Visiting {} of {} at radius {}", octant, node, current);
            }
            nearest = merge(nearest, search(sibling, position, k, current), k);
        }
        return nearest;
    }

    private static <E> float pruningRadius(List<Neighbor<E>> nearest, int k, float maxRadius) {
        return nearest.size() >= k ? nearest.get(nearest.size() - 1).distance() : maxRadius;
    }
}
