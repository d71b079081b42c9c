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

import javax.vecmath.Tuple3f;

/**
 * The three splitting axes of an octree cell. Each axis owns one bit of the {@link Octant} code; the bit is set when
 * a position lies strictly below the cell center on that axis.
 *
 * @author hal.hildebrand
 */
public enum Axis {
    X(1), Y(2), Z(4);

    private final int mask;

    Axis(int mask) {
        this.mask = mask;
    }

    /**
     * @return the component of the tuple along this axis
     */
    public float component(Tuple3f tuple) {
        return switch (this) {
            case X -> tuple.x;
            case Y -> tuple.y;
            case Z -> tuple.z;
        };
    }

    /**
     * @return the bit this axis contributes to an octant code
     */
    public int mask() {
        return mask;
    }
}
