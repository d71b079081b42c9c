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

/**
 * Raised when a split is requested for a leaf that the configured depth or extent floor forbids splitting. This is a
 * configuration error: the split predicate keeps holding on ever smaller cells, typically because more entities than
 * the capacity share a position.
 *
 * @author hal.hildebrand
 */
public class SubdivisionLimitException extends RuntimeException {
    private final int   depth;
    private final float side;

    public SubdivisionLimitException(String message, int depth, float side) {
        super(message);
        this.depth = depth;
        this.side = side;
    }

    /**
     * @return depth of the leaf that could not be split, the root being depth 0
     */
    public int getDepth() {
        return depth;
    }

    /**
     * @return side length of the leaf that could not be split
     */
    public float getSide() {
        return side;
    }
}
