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
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test the k-nearest neighbor search functionality
 *
 * @author hal.hildebrand
 */
public class KNearestNeighborSearchTest {

    private final Population.Ids ids = new Population.Ids();

    @Test
    void testTwoNearestWithinRadius() {
        var one = Population.at(ids, 1, 0, 0);
        var five = Population.at(ids, 0, 5, 0);
        var nine = Population.at(ids, 0, 0, -9);
        Octree<Entity<LongEntityID, String>> tree = Octree.of(List.of(nine, five, one), new Point3f(0, 0, 0), 32)
                                                          .splitWhere(SplitPredicates.capacityExceeds(1));

        var nearest = tree.kNearest(new Point3f(0, 0, 0), 2, 10.0f);
        assertEquals(List.of(new Neighbor<>(one, 1.0f), new Neighbor<>(five, 5.0f)), nearest);
    }

    @Test
    void testFewerThanKWithinRadius() {
        var random = new Random(17);
        var generator = new Population.Ids(1000);
        var close = List.of(Population.at(generator, 0.25f, 0, 0), Population.at(generator, 0, -0.5f, 0.5f));
        var entities = new ArrayList<>(close);
        while (entities.size() < 300) {
            var p = Population.randomPoint(random, 64);
            if (p.distance(new Point3f(0, 0, 0)) > 2) {
                entities.add(Population.at(generator, p.x, p.y, p.z));
            }
        }
        Octree<Entity<LongEntityID, String>> tree = Octree.of(entities, new Point3f(0, 0, 0), 64)
                                                          .splitWhere(SplitPredicates.capacityExceeds(4));

        var nearest = tree.kNearest(new Point3f(0, 0, 0), 5, 1.0f);
        assertEquals(2, nearest.size());
        assertEquals(close.get(0), nearest.get(0).entity());
        assertEquals(close.get(1), nearest.get(1).entity());
        assertTrue(nearest.get(0).distance() <= nearest.get(1).distance());
    }

    @Test
    void testDegenerateArguments() {
        var entities = Population.random(new Random(5), 200, 20);
        Octree<Entity<LongEntityID, String>> tree = Octree.of(entities, new Point3f(0, 0, 0), 20)
                                                          .splitWhere(SplitPredicates.capacityExceeds(4));
        var origin = new Point3f(0, 0, 0);
        assertTrue(tree.kNearest(origin, 0, 100).isEmpty());
        assertTrue(tree.kNearest(origin, -3, 100).isEmpty());
        assertTrue(tree.kNearest(origin, 5, 0).isEmpty());
        assertTrue(tree.kNearest(origin, 5, -1).isEmpty());
        assertTrue(tree.kNearest(origin, 5, Float.NaN).isEmpty());

        Octree<Entity<LongEntityID, String>> empty = Octree.empty(origin, 20);
        assertTrue(empty.kNearest(origin, 5, 100).isEmpty());
    }

    @Test
    void testCoincidentEntities() {
        var a = Population.at(ids, 1, 1, 1);
        var b = Population.at(ids, 1, 1, 1);
        var c = Population.at(ids, 2, 2, 2);
        Octree<Entity<LongEntityID, String>> tree = Octree.of(List.of(a, b, c), new Point3f(0, 0, 0), 8).split();
        var nearest = tree.kNearest(new Point3f(1, 1, 1), 2, 5);
        assertEquals(2, nearest.size());
        assertEquals(new HashSet<>(List.of(a, b)),
                     nearest.stream().map(Neighbor::entity).collect(Collectors.toSet()));
        assertEquals(0.0f, nearest.get(1).distance());
    }

    @Test
    void testMergePutsFoundEntriesFirstOnTies() {
        var held = List.of(new Neighbor<>("a", 1f), new Neighbor<>("b", 3f));
        var found = List.of(new Neighbor<>("c", 1f), new Neighbor<>("d", 2f), new Neighbor<>("e", 3f));
        assertEquals(List.of(new Neighbor<>("c", 1f), new Neighbor<>("a", 1f), new Neighbor<>("d", 2f),
                             new Neighbor<>("e", 3f)), KNearestNeighborSearch.merge(held, found, 4));
        assertEquals(List.of(new Neighbor<>("c", 1f), new Neighbor<>("a", 1f)),
                     KNearestNeighborSearch.merge(held, found, 2));
        assertEquals(List.of(new Neighbor<>("c", 1f)), KNearestNeighborSearch.merge(held, found, 1));
        assertSame(held, KNearestNeighborSearch.merge(held, List.of(), 2));
    }

    @Test
    void testQueryOutsideTheCube() {
        var entities = Population.random(new Random(23), 400, 50);
        Octree<Entity<LongEntityID, String>> tree = Octree.of(entities, new Point3f(0, 0, 0), 50)
                                                          .splitWhere(SplitPredicates.capacityExceeds(6));
        var query = new Point3f(80, -10, 5);
        var expected = Population.bruteForceNearestDistances(entities, query, 7, Float.POSITIVE_INFINITY);
        var actual = tree.kNearest(query, 7, Float.POSITIVE_INFINITY);
        assertEquals(expected, actual.stream().map(Neighbor::distance).collect(Collectors.toList()));
    }

    @Test
    void testMatchesBruteForce() {
        List<Predicate<LeafNode<Entity<LongEntityID, String>>>> policies = List.of(
        SplitPredicates.capacityExceeds(1), SplitPredicates.capacityExceeds(4), SplitPredicates.capacityExceeds(32),
        SplitPredicates.sideAtLeast(30));
        int[] ks = { 1, 3, 10, 50 };
        float[] maxRadii = { 2f, 10f, 35f, Float.POSITIVE_INFINITY };
        for (var seed = 0; seed < 6; seed++) {
            var random = new Random(seed * 31L + 7);
            var side = 100f;
            var entities = Population.random(random, 1000 + seed * 200, side);
            for (var policy : policies) {
                Octree<Entity<LongEntityID, String>> tree = Octree.of(entities, new Point3f(0, 0, 0), side)
                                                                  .splitWhere(policy);
                for (var q = 0; q < 15; q++) {
                    var query = Population.randomPoint(random, side);
                    for (var k : ks) {
                        for (var maxRadius : maxRadii) {
                            var expected = Population.bruteForceNearestDistances(entities, query, k, maxRadius);
                            var actual = tree.kNearest(query, k, maxRadius);
                            var distances = actual.stream().map(Neighbor::distance).collect(Collectors.toList());
                            assertEquals(expected, distances,
                                         "seed " + seed + " query " + query + " k " + k + " maxRadius " + maxRadius);
                            for (var neighbor : actual) {
                                assertEquals(query.distance(neighbor.entity().getPosition()), neighbor.distance());
                            }
                            assertEquals(actual.size(), new HashSet<>(actual).size(), "No duplicates");
                        }
                    }
                }
            }
        }
    }
}
