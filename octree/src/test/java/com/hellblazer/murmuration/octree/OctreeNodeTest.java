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

import com.hellblazer.murmuration.entity.Entity;
import com.hellblazer.murmuration.entity.LongEntityID;
import org.junit.jupiter.api.Test;

import javax.vecmath.Point3f;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class OctreeNodeTest {

    private final Population.Ids ids = new Population.Ids();

    @Test
    void testEmptyLeaf() {
        LeafNode<Entity<LongEntityID, String>> leaf = LeafNode.empty(new Point3f(0, 0, 0), 8);
        assertTrue(leaf.isLeaf());
        assertTrue(leaf.isEmpty());
        assertEquals(0, leaf.getCount());
        assertEquals(8, leaf.getSide());
        assertSame(leaf, leaf.child(Octant.BACK_TOP_LEFT), "A leaf is its own child");
    }

    @Test
    void testLeafInsertIsPersistent() {
        LeafNode<Entity<LongEntityID, String>> leaf = LeafNode.empty(new Point3f(0, 0, 0), 8);
        var a = Population.at(ids, 1, 1, 1);
        var b = Population.at(ids, -1, -1, -1);
        var one = leaf.insert(a);
        var two = one.insert(b);
        assertEquals(0, leaf.getCount());
        assertEquals(1, one.getCount());
        assertEquals(List.of(a), one.getEntities());
        assertEquals(List.of(a, b), two.getEntities());
        assertThrows(UnsupportedOperationException.class, () -> two.getEntities().add(a));
    }

    @Test
    void testLeafReplaceChildIsNoOp() {
        LeafNode<Entity<LongEntityID, String>> leaf = LeafNode.empty(new Point3f(0, 0, 0), 8);
        var other = LeafNode.<Entity<LongEntityID, String>>empty(new Point3f(2, 2, 2), 4);
        assertSame(leaf, leaf.replaceChild(Octant.FRONT_TOP_RIGHT, other));
    }

    @Test
    void testSplitTilesParent() {
        LeafNode<Entity<LongEntityID, String>> leaf = LeafNode.empty(new Point3f(0, 0, 0), 8);
        var node = leaf.insert(Population.at(ids, 1, 1, 1))
                       .insert(Population.at(ids, 3, 3, 3))
                       .insert(Population.at(ids, -3, -3, -3));
        var split = ((LeafNode<Entity<LongEntityID, String>>) node).split();
        assertFalse(split.isLeaf());
        assertEquals(3, split.getCount());
        for (var octant : Octant.values()) {
            var child = split.child(octant);
            assertTrue(child.isLeaf());
            assertEquals(4, child.getSide());
            assertEquals(octant.childCenter(new Point3f(0, 0, 0), 8), child.getCenter());
        }
        assertEquals(2, split.child(Octant.FRONT_TOP_RIGHT).getCount());
        assertEquals(1, split.child(Octant.BACK_BOTTOM_LEFT).getCount());
        assertEquals(0, split.child(Octant.FRONT_TOP_LEFT).getCount());
    }

    @Test
    void testSplitInternalIsIdentity() {
        LeafNode<Entity<LongEntityID, String>> leaf = LeafNode.empty(new Point3f(0, 0, 0), 8);
        var split = leaf.insert(Population.at(ids, 1, 1, 1)).split();
        assertSame(split, split.split());
        assertSame(split, split.split().split());
    }

    @Test
    void testInternalInsertRebuildsOnlyThePath() {
        OctreeNode<Entity<LongEntityID, String>> node = LeafNode.<Entity<LongEntityID, String>>empty(
        new Point3f(0, 0, 0), 8).split();
        node = node.insert(Population.at(ids, -1, -1, -1));
        var before = node;
        var after = node.insert(Population.at(ids, 1, 2, 3));

        assertEquals(1, before.getCount());
        assertEquals(2, after.getCount());
        assertEquals(0, before.child(Octant.FRONT_TOP_RIGHT).getCount());
        assertEquals(1, after.child(Octant.FRONT_TOP_RIGHT).getCount());
        for (var octant : Octant.values()) {
            if (octant != Octant.FRONT_TOP_RIGHT) {
                assertSame(before.child(octant), after.child(octant), "Sibling " + octant + " must be shared");
            }
        }
    }

    @Test
    void testReplaceChildRecomputesCount() {
        OctreeNode<Entity<LongEntityID, String>> node = LeafNode.<Entity<LongEntityID, String>>empty(
        new Point3f(0, 0, 0), 8).split();
        node = node.insert(Population.at(ids, 1, 1, 1)).insert(Population.at(ids, 2, 2, 2));
        var replacement = LeafNode.<Entity<LongEntityID, String>>empty(new Point3f(2, 2, 2), 4)
                                  .insert(Population.at(ids, 1, 1, 1));
        var replaced = node.replaceChild(Octant.FRONT_TOP_RIGHT, replacement);
        assertEquals(2, node.getCount());
        assertEquals(1, replaced.getCount());
        assertSame(replacement, replaced.child(Octant.FRONT_TOP_RIGHT));
        assertSame(node, node.replaceChild(Octant.FRONT_TOP_RIGHT, node.child(Octant.FRONT_TOP_RIGHT)));
    }

    @Test
    void testInsertAllMatchesRepeatedInsert() {
        var entities = Population.random(new Random(11), 500, 64);
        OctreeNode<Entity<LongEntityID, String>> folded = Subdivision.splitWhere(
        LeafNode.<Entity<LongEntityID, String>>empty(new Point3f(0, 0, 0), 64), SplitPredicates.sideAtLeast(16));
        var bulk = folded.insertAll(entities);
        for (var entity : entities) {
            folded = folded.insert(entity);
        }
        assertEquals(folded.getCount(), bulk.getCount());
        assertEquals(folded.entities().collect(Collectors.toList()), bulk.entities().collect(Collectors.toList()));
    }

    @Test
    void testInternalOfValidatesChildren() {
        var center = new Point3f(0, 0, 0);
        var leaf = LeafNode.<Entity<LongEntityID, String>>empty(center, 4);
        assertThrows(IllegalArgumentException.class, () -> InternalNode.of(center, 8, List.of(leaf, leaf)));
        var node = InternalNode.of(center, 8, List.of(leaf, leaf, leaf, leaf, leaf, leaf, leaf,
                                                      leaf.insert(Population.at(ids, -1, -1, -1))));
        assertEquals(1, node.getCount());
        assertEquals(8, node.children().size());
    }

    @Test
    void testContainsIsClosed() {
        var leaf = LeafNode.<Entity<LongEntityID, String>>empty(new Point3f(0, 0, 0), 8);
        assertTrue(leaf.contains(new Point3f(4, 4, 4)));
        assertTrue(leaf.contains(new Point3f(-4, -4, -4)));
        assertFalse(leaf.contains(new Point3f(4.01f, 0, 0)));
    }
}
