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
package com.hellblazer.girth.section.geometry;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Random;

import org.junit.jupiter.api.Test;

/**
 * @author hal.hildebrand
 */
public class ConvexHull2dTest {

    @Test
    public void testSquareWithInterior() {
        var points = PlanarPoints.of(new double[] { 0.5, 1, 0, 1, 0, 0.5, 0.2 },
                                     new double[] { 0.5, 1, 0, 0, 1, 0, 0.7 });
        var hull = ConvexHull2d.hull(points);
        // counter clockwise from the lexicographically smallest, collinear (0.5, 0) excluded
        assertArrayEquals(new int[] { 2, 3, 1, 4 }, hull.toArray());
    }

    @Test
    public void testRandomHullContainsEverything() {
        var random = new Random(0x600d);
        int n = 500;
        var u = new double[n];
        var v = new double[n];
        for (int i = 0; i < n; i++) {
            u[i] = random.nextGaussian();
            v[i] = random.nextGaussian();
        }
        var points = PlanarPoints.of(u, v);
        var hull = ConvexHull2d.hull(points).toArray();
        assertTrue(hull.length >= 3);
        for (int e = 0; e < hull.length; e++) {
            int a = hull[e];
            int b = hull[(e + 1) % hull.length];
            for (int i = 0; i < n; i++) {
                double cross = (u[b] - u[a]) * (v[i] - v[a]) - (v[b] - v[a]) * (u[i] - u[a]);
                assertTrue(cross >= -1e-12, "point " + i + " lies outside hull edge " + e);
            }
        }
    }

    @Test
    public void testHullLoop() {
        var points = PlanarPoints.of(new double[] { 0, 2, 2, 0, 1 }, new double[] { 0, 0, 2, 2, 1 });
        var loop = ConvexHull2d.hullLoop(points, 1e-6);
        assertNotNull(loop);
        assertEquals(4, loop.size());
        assertEquals(8.0, loop.perimeter(), 1e-12);
        assertEquals(4.0, loop.area(), 1e-12);
        assertTrue(loop.isSimple());
    }

    @Test
    public void testDegenerateHull() {
        var collinear = PlanarPoints.of(new double[] { 0, 1, 2, 3 }, new double[] { 0, 1, 2, 3 });
        assertTrue(ConvexHull2d.hull(collinear).size() < 3);
        assertNull(ConvexHull2d.hullLoop(collinear, 1e-6));
        assertNull(ConvexHull2d.hullLoop(PlanarPoints.of(new double[] { 1 }, new double[] { 1 }), 1e-6));
        assertEquals(0, ConvexHull2d.hull(PlanarPoints.of(new double[0], new double[0])).size());
    }
}
