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

import java.util.Objects;

/**
 * Configuration for an {@link Octree}: the subdivision floor and the policy for positions outside the root cube.
 * Instances are mutable builders; an octree copies the configuration it is created with, so later changes never reach
 * published trees.
 *
 * @author hal.hildebrand
 */
public class OctreeConfig {

    /**
     * Default deepest level a split may produce
     */
    public static final int DEFAULT_MAX_DEPTH = 21;

    private int          maxDepth     = DEFAULT_MAX_DEPTH;
    private float        minimumSide  = 0.0f;
    private BoundsPolicy boundsPolicy = BoundsPolicy.REJECT;

    /**
     * What to do with a position that lies outside the closed root cube on insertion or point lookup
     */
    public enum BoundsPolicy {
        /**
         * Fail with an IllegalArgumentException
         */
        REJECT,
        /**
         * Route purely by octant comparison. The entity lands in the leaf on its side of every splitting plane and
         * radius or nearest neighbor results involving it are undefined, though still safe to compute
         */
        UNCHECKED
    }

    public static OctreeConfig defaults() {
        return new OctreeConfig();
    }

    public OctreeConfig copy() {
        return new OctreeConfig().withMaxDepth(maxDepth).withMinimumSide(minimumSide).withBoundsPolicy(boundsPolicy);
    }

    public BoundsPolicy getBoundsPolicy() {
        return boundsPolicy;
    }

    /**
     * Deepest level a split may produce. The root is depth 0
     */
    public int getMaxDepth() {
        return maxDepth;
    }

    /**
     * Smallest child side a split may produce. Zero disables the extent floor
     */
    public float getMinimumSide() {
        return minimumSide;
    }

    /**
     * @return true if a leaf at the given depth and side may be split under this configuration
     */
    public boolean permitsSplit(int depth, float side) {
        return depth < maxDepth && side / 2.0f >= minimumSide && side / 2.0f > 0.0f;
    }

    @Override
    public String toString() {
        return "OctreeConfig[maxDepth=" + maxDepth + ", minimumSide=" + minimumSide + ", boundsPolicy=" + boundsPolicy
        + "]";
    }

    public OctreeConfig withBoundsPolicy(BoundsPolicy policy) {
        this.boundsPolicy = Objects.requireNonNull(policy, "Bounds policy cannot be null");
        return this;
    }

    public OctreeConfig withMaxDepth(int depth) {
        if (depth <= 0) {
            throw new IllegalArgumentException("Max depth must be positive");
        }
        this.maxDepth = depth;
        return this;
    }

    public OctreeConfig withMinimumSide(float side) {
        if (side < 0.0f || Float.isNaN(side) || Float.isInfinite(side)) {
            throw new IllegalArgumentException("Minimum side must be a finite, non-negative value");
        }
        this.minimumSide = side;
        return this;
    }
}
