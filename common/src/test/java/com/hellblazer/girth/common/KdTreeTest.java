/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Girth.
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
package com.hellblazer.girth.common;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

import javax.vecmath.Point2d;

import org.junit.jupiter.api.Test;

/**
 * @author hal.hildebrand
 */
public class KdTreeTest {

    private static double[][] randomPoints(Random random, int count) {
        var u = new double[count];
        var v = new double[count];
        for (int i = 0; i < count; i++) {
            u[i] = random.nextDouble();
            v[i] = random.nextDouble();
        }
        return new double[][] { u, v };
    }

    private static List<KdTree.Neighbor> bruteForce(double[] u, double[] v, Point2d target, int k, int exclude) {
        var all = new ArrayList<KdTree.Neighbor>();
        for (int i = 0; i < u.length; i++) {
            if (i == exclude) {
                continue;
            }
            all.add(new KdTree.Neighbor(i, Math.hypot(u[i] - target.x, v[i] - target.y)));
        }
        all.sort(Comparator.comparingDouble(KdTree.Neighbor::distance).thenComparingInt(KdTree.Neighbor::id));
        return all.subList(0, Math.min(k, all.size()));
    }

    @Test
    public void testNearestMatchesBruteForce() {
        var random = new Random(0x666);
        var points = randomPoints(random, 2000);
        var tree = KdTree.of(points[0], points[1], 2000);
        assertEquals(2000, tree.size());
        for (int q = 0; q < 50; q++) {
            var target = new Point2d(random.nextDouble(), random.nextDouble());
            var expected = bruteForce(points[0], points[1], target, 7, -1);
            var actual = tree.nearest(target, 7, -1);
            assertEquals(expected.size(), actual.size());
            for (int i = 0; i < expected.size(); i++) {
                assertEquals(expected.get(i).id(), actual.get(i).id(), "neighbor " + i + " of query " + q);
                assertEquals(expected.get(i).distance(), actual.get(i).distance(), 1e-12);
            }
        }
    }

    @Test
    public void testExcludesSelf() {
        var u = new double[] { 0, 1, 2, 3 };
        var v = new double[] { 0, 0, 0, 0 };
        var tree = KdTree.of(u, v, 4);
        var neighbors = tree.nearest(new Point2d(1, 0), 2, 1);
        assertEquals(2, neighbors.size());
        assertEquals(0, neighbors.get(0).id(), "Equal distances resolve to the lower id");
        assertEquals(2, neighbors.get(1).id());
        assertEquals(1.0, neighbors.get(0).distance(), 0.0);
    }

    @Test
    public void testIndependentOfInsertionOrder() {
        var random = new Random(42);
        var points = randomPoints(random, 300);
        var nodes = new ArrayList<KdTree.Node>();
        for (int i = 0; i < 300; i++) {
            nodes.add(new KdTree.Node(i, new Point2d(points[0][i], points[1][i])));
        }
        var ordered = new KdTree(nodes);
        Collections.shuffle(nodes, new Random(7));
        var shuffled = new KdTree(nodes);
        var target = new Point2d(0.5, 0.5);
        assertEquals(ordered.nearest(target, 12, -1), shuffled.nearest(target, 12, -1));
    }

    @Test
    public void testKLargerThanTree() {
        var tree = KdTree.of(new double[] { 0, 1 }, new double[] { 0, 1 }, 2);
        var neighbors = tree.nearest(new Point2d(0, 0), 10, -1);
        assertEquals(2, neighbors.size());
        assertTrue(neighbors.get(0).distance() <= neighbors.get(1).distance());
    }

    @Test
    public void testQuickSelect() {
        var values = new ArrayList<Integer>();
        for (int i = 0; i < 101; i++) {
            values.add((i * 37) % 101);
        }
        assertEquals(50, KdTree.QuickSelect.select(values, 50, Comparator.naturalOrder()));
    }

    @Test
    public void testWithinMatchesBruteForce() {
        var random = new Random(0x1638);
        var points = randomPoints(random, 1500);
        var tree = KdTree.of(points[0], points[1], 1500);
        for (int q = 0; q < 40; q++) {
            var target = new Point2d(random.nextDouble(), random.nextDouble());
            double radius = 0.01 + random.nextDouble() * 0.1;
            var expected = new IntArrayList();
            for (int i = 0; i < 1500; i++) {
                double du = points[0][i] - target.x;
                double dv = points[1][i] - target.y;
                if (du * du + dv * dv <= radius * radius) {
                    expected.add(i);
                }
            }
            var actual = tree.within(target, radius);
            assertEquals(expected.toString(), actual.toString(), "query " + q);
        }
    }

    @Test
    public void testWithinIncludesCoincidentPoints() {
        var u = new double[] { 0, 0, 0, 1 };
        var v = new double[] { 0, 0, 0, 0 };
        var tree = KdTree.of(u, v, 4);
        assertEquals("[0, 1, 2]", tree.within(new Point2d(0, 0), 0.0).toString());
        assertEquals("[0, 1, 2, 3]", tree.within(new Point2d(0, 0), 1.0).toString());
    }
}
