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

import java.util.function.Predicate;

/**
 * Common leaf predicates for {@link Subdivision#splitWhere}. Compose them with {@link Predicate#and} and
 * {@link Predicate#or}.
 *
 * @author hal.hildebrand
 */
public final class SplitPredicates {

    private SplitPredicates() {
    }

    /**
     * Split leaves holding more than <code>capacity</code> entities
     */
    public static <E extends Positioned> Predicate<LeafNode<E>> capacityExceeds(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("Capacity must be non-negative");
        }
        return leaf -> leaf.getCount() > capacity;
    }

    /**
     * Split leaves whose side is at least <code>side</code>. Useful to pre-refine a tree to a uniform resolution
     */
    public static <E extends Positioned> Predicate<LeafNode<E>> sideAtLeast(float side) {
        if (!(side > 0.0f)) {
            throw new IllegalArgumentException("Side must be positive");
        }
        return leaf -> leaf.getSide() >= side;
    }
}
