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

import java.util.Objects;
import java.util.function.Predicate;

/**
 * Adaptive splitting of an octree under a caller supplied leaf predicate. The predicate is the capacity policy; this
 * class supplies only the mechanics of applying it.
 * <p>
 * The walk evaluates the predicate at leaves only. A leaf for which it holds is split and the resulting internal node
 * is walked again, so a crowded leaf may split repeatedly in a single call. Internal nodes are descended
 * unconditionally. Subtrees in which nothing splits are shared with the input.
 *
 * @author hal.hildebrand
 */
public final class Subdivision {
    private static final Logger log = LoggerFactory.getLogger(Subdivision.class);

    private Subdivision() {
    }

    /**
     * Split leaves of the tree rooted at <code>node</code> while the predicate holds, using the default subdivision
     * floor
     */
    public static <E extends Positioned> OctreeNode<E> splitWhere(OctreeNode<E> node,
                                                                  Predicate<? super LeafNode<E>> predicate) {
        return splitWhere(node, predicate, OctreeConfig.defaults());
    }

    /**
     * Split leaves of the tree rooted at <code>node</code> while the predicate holds. The node is taken to be at depth
     * 0.
     *
     * @throws SubdivisionLimitException if the predicate holds on a leaf the configuration forbids splitting
     */
    public static <E extends Positioned> OctreeNode<E> splitWhere(OctreeNode<E> node,
                                                                  Predicate<? super LeafNode<E>> predicate,
                                                                  OctreeConfig config) {
        Objects.requireNonNull(node, "Node cannot be null");
        Objects.requireNonNull(predicate, "Split predicate cannot be null");
        Objects.requireNonNull(config, "Config cannot be null");
        return splitWhere(node, predicate, config, 0);
    }

    private static <E extends Positioned> OctreeNode<E> splitWhere(OctreeNode<E> node,
                                                                   Predicate<? super LeafNode<E>> predicate,
                                                                   OctreeConfig config, int depth) {
        if (node instanceof LeafNode<E> leaf) {
            if (!predicate.test(leaf)) {
                return leaf;
            }
            if (!config.permitsSplit(depth, leaf.side)) {
                log.debug("Refusing split of {} at depth {} under {}", leaf, depth, config);
                throw new SubdivisionLimitException(
                "Split predicate still holds on leaf at depth " + depth + " with side " + leaf.side + ", center "
                + leaf.center + " and " + leaf.count + " entities, beyond the limits of " + config, depth, leaf.side);
            }
            if (log.isTraceEnabled()) {
                log.trace("Splitting {} at depth {}", leaf, depth);
            }
            return splitWhere(leaf.split(), predicate, config, depth);
        }
        var internal = (InternalNode<E>) node;
        var children = internal.childArray();
        for (var i = 0; i < children.length; i++) {
            children[i] = splitWhere(children[i], predicate, config, depth + 1);
        }
        return internal.withChildren(children);
    }
}
