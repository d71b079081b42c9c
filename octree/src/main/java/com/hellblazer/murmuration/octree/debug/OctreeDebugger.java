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
package com.hellblazer.murmuration.octree.debug;

import com.hellblazer.murmuration.entity.Positioned;
import com.hellblazer.murmuration.octree.InternalNode;
import com.hellblazer.murmuration.octree.LeafNode;
import com.hellblazer.murmuration.octree.Octant;
import com.hellblazer.murmuration.octree.Octree;
import com.hellblazer.murmuration.octree.OctreeNode;

import java.util.Objects;

/**
 * Debug utilities for octree inspection: a human readable dump, structural statistics and a check of the cached
 * counts.
 *
 * @param <E> The entity type
 */
public class OctreeDebugger<E extends Positioned> {

    private final OctreeNode<E> root;

    public OctreeDebugger(Octree<E> octree) {
        this(Objects.requireNonNull(octree).root());
    }

    public OctreeDebugger(OctreeNode<E> root) {
        this.root = Objects.requireNonNull(root);
    }

    /**
     * Analyze the shape of the tree
     *
     * @return structural statistics
     */
    public TreeStats analyze() {
        var stats = new Accumulator();
        analyze(root, 0, stats);
        return new TreeStats(stats.internalNodes + stats.leaves, stats.leaves, stats.internalNodes, root.getCount(),
                             stats.maxDepth, stats.maxOccupancy, stats.emptyLeaves,
                             stats.leaves == 0 ? 0.0 : (double) root.getCount() / stats.leaves);
    }

    /**
     * Render the whole tree
     */
    public String toTreeString() {
        return toTreeString(Integer.MAX_VALUE);
    }

    /**
     * Render the tree down to the given depth; deeper subtrees are summarized by their count
     *
     * @param maxDepth Maximum depth to display, the root being depth 0
     */
    public String toTreeString(int maxDepth) {
        var builder = new StringBuilder();
        render(root, null, 0, maxDepth, builder);
        return builder.toString();
    }

    /**
     * Check that every node's cached count equals the number of entities reachable below it
     *
     * @return true if all counts are consistent
     */
    public boolean verifyCounts() {
        return verify(root) >= 0;
    }

    private void analyze(OctreeNode<E> node, int depth, Accumulator stats) {
        stats.maxDepth = Math.max(stats.maxDepth, depth);
        if (node instanceof InternalNode<E> internal) {
            stats.internalNodes++;
            for (var child : internal.children()) {
                analyze(child, depth + 1, stats);
            }
            return;
        }
        stats.leaves++;
        stats.maxOccupancy = Math.max(stats.maxOccupancy, node.getCount());
        if (node.getCount() == 0) {
            stats.emptyLeaves++;
        }
    }

    private void indent(StringBuilder builder, int depth) {
        builder.append("  ".repeat(depth));
    }

    private void render(OctreeNode<E> node, Octant octant, int depth, int maxDepth, StringBuilder builder) {
        indent(builder, depth);
        if (octant != null) {
            builder.append(octant).append(": ");
        }
        builder.append(node.isLeaf() ? "Leaf" : "Node")
               .append(String.format(" {center: (%.3f, %.3f, %.3f), side: %.3f, count: %d}", node.getCenter().x,
                                     node.getCenter().y, node.getCenter().z, node.getSide(), node.getCount()));
        if (depth >= maxDepth && !node.isLeaf()) {
            builder.append(" ...\n");
            return;
        }
        builder.append('\n');
        if (node instanceof InternalNode<E> internal) {
            for (var o : Octant.values()) {
                render(internal.child(o), o, depth + 1, maxDepth, builder);
            }
        } else {
            for (var entity : ((LeafNode<E>) node).getEntities()) {
                indent(builder, depth + 1);
                builder.append("- ").append(entity).append('\n');
            }
        }
    }

    // answers the reachable count, or -1 once an inconsistency is found
    private int verify(OctreeNode<E> node) {
        if (node instanceof LeafNode<E> leaf) {
            return leaf.getEntities().size() == leaf.getCount() ? leaf.getCount() : -1;
        }
        var total = 0;
        for (var child : ((InternalNode<E>) node).children()) {
            var reachable = verify(child);
            if (reachable < 0) {
                return -1;
            }
            total += reachable;
        }
        return total == node.getCount() ? total : -1;
    }

    /**
     * Structural statistics of an octree
     *
     * @param nodeCount             all nodes
     * @param leafCount             leaf nodes
     * @param internalCount         internal nodes
     * @param entityCount           entities held
     * @param maxDepth              depth of the deepest node, the root being depth 0
     * @param maxLeafOccupancy      entities in the fullest leaf
     * @param emptyLeafCount        leaves holding no entity
     * @param averageLeafOccupancy  entities per leaf
     */
    public record TreeStats(int nodeCount, int leafCount, int internalCount, int entityCount, int maxDepth,
                            int maxLeafOccupancy, int emptyLeafCount, double averageLeafOccupancy) {
    }

    private static class Accumulator {
        int internalNodes;
        int leaves;
        int maxDepth;
        int maxOccupancy;
        int emptyLeaves;
    }
}
