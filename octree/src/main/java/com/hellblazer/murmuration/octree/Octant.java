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

import javax.vecmath.Point3f;
import javax.vecmath.Tuple3f;

/**
 * One of the eight sub-cubes of an octree cell. The ordinal is the octant's 3 bit code:
 *
 * <pre>
 *   bit 0 (1) : x &lt; center.x   LEFT   (clear: RIGHT)
 *   bit 1 (2) : y &lt; center.y   BOTTOM (clear: TOP)
 *   bit 2 (4) : z &lt; center.z   BACK   (clear: FRONT)
 * </pre>
 * <p>
 * A position equal to the center on an axis is not "less than", so it belongs to the RIGHT, TOP or FRONT half. This
 * tie-break fixes which leaf a boundary point lands in and must not change.
 *
 * @author hal.hildebrand
 */
public enum Octant {
    FRONT_TOP_RIGHT, FRONT_TOP_LEFT, FRONT_BOTTOM_RIGHT, FRONT_BOTTOM_LEFT, BACK_TOP_RIGHT, BACK_TOP_LEFT,
    BACK_BOTTOM_RIGHT, BACK_BOTTOM_LEFT;

    private static final Octant[] BY_CODE = values();

    /**
     * @param code the 3 bit octant code, 0-7
     * @return the octant with that code
     */
    public static Octant fromCode(int code) {
        if (code < 0 || code > 7) {
            throw new IllegalArgumentException("Octant code must be 0-7: " + code);
        }
        return BY_CODE[code];
    }

    /**
     * Address the octant of a cell centered at <code>center</code> that contains <code>position</code>. Total for
     * every input: positions outside the cell still map to the octant on their side of each splitting plane.
     */
    public static Octant of(Tuple3f center, Tuple3f position) {
        var code = 0;
        if (position.x < center.x) {
            code |= Axis.X.mask();
        }
        if (position.y < center.y) {
            code |= Axis.Y.mask();
        }
        if (position.z < center.z) {
            code |= Axis.Z.mask();
        }
        return BY_CODE[code];
    }

    /**
     * Compute the center of this octant's sub-cube within a cell of the given center and side
     */
    public Point3f childCenter(Tuple3f center, float side) {
        var quarter = side / 4.0f;
        return new Point3f(center.x + (isBelow(Axis.X) ? -quarter : quarter),
                           center.y + (isBelow(Axis.Y) ? -quarter : quarter),
                           center.z + (isBelow(Axis.Z) ? -quarter : quarter));
    }

    public int code() {
        return ordinal();
    }

    /**
     * @return true if this octant lies below the cell center along the axis
     */
    public boolean isBelow(Axis axis) {
        return (ordinal() & axis.mask()) != 0;
    }

    /**
     * @return the octant mirrored across the splitting plane of the axis
     */
    public Octant opposite(Axis axis) {
        return BY_CODE[ordinal() ^ axis.mask()];
    }
}
