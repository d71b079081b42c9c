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

import java.util.Comparator;

/**
 * An entity and its distance from a query point, as answered by a k-nearest neighbor search. The natural order is
 * ascending by distance.
 *
 * @param <E>      the type of entity
 * @param entity   the entity found
 * @param distance the distance from the query point to the entity's position
 * @author hal.hildebrand
 */
public record Neighbor<E>(E entity, float distance) implements Comparable<Neighbor<E>> {

    /**
     * Ascending by distance
     */
    public static <E> Comparator<Neighbor<E>> nearestFirst() {
        return (a, b) -> Float.compare(a.distance, b.distance);
    }

    @Override
    public int compareTo(Neighbor<E> other) {
        return Float.compare(this.distance, other.distance);
    }
}
