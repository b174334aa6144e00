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

import org.junit.jupiter.api.Test;

/**
 * @author hal.hildebrand
 */
public class PolygonMetricsTest {

    private static final double[] SQUARE_U = { 0, 1, 1, 0 };
    private static final double[] SQUARE_V = { 0, 0, 1, 1 };

    @Test
    public void testSquare() {
        assertEquals(1.0, PolygonMetrics.area(SQUARE_U, SQUARE_V, 4), 1e-12);
        assertEquals(1.0, PolygonMetrics.signedArea(SQUARE_U, SQUARE_V, 4), 1e-12, "counter clockwise is positive");
        assertEquals(4.0, PolygonMetrics.perimeter(SQUARE_U, SQUARE_V, 4), 1e-12, "closing edge included");
    }

    @Test
    public void testClockwise() {
        double[] u = { 0, 0, 1, 1 };
        double[] v = { 0, 1, 1, 0 };
        assertEquals(-1.0, PolygonMetrics.signedArea(u, v, 4), 1e-12);
        assertEquals(1.0, PolygonMetrics.area(u, v, 4), 1e-12);
    }

    @Test
    public void testDegenerate() {
        assertEquals(0.0, PolygonMetrics.area(SQUARE_U, SQUARE_V, 2));
        assertEquals(2.0, PolygonMetrics.perimeter(SQUARE_U, SQUARE_V, 2), 1e-12, "segment out and back");
        assertEquals(0.0, PolygonMetrics.perimeter(SQUARE_U, SQUARE_V, 1));
    }

    @Test
    public void testRegularPolygonApproachesCircle() {
        int n = 720;
        var u = new double[n];
        var v = new double[n];
        for (int i = 0; i < n; i++) {
            u[i] = 0.5 * Math.cos(2 * Math.PI * i / n);
            v[i] = 0.5 * Math.sin(2 * Math.PI * i / n);
        }
        assertEquals(Math.PI, PolygonMetrics.perimeter(u, v, n), 1e-4);
        assertEquals(Math.PI * 0.25, PolygonMetrics.area(u, v, n), 1e-4);
    }

    @Test
    public void testMergeConsecutive() {
        double[] u = { 0, 1e-9, 1, 1, 1, 0, 0 };
        double[] v = { 0, 0, 0, 1, 1 + 1e-9, 1, 1e-9 };
        var kept = PolygonMetrics.mergeConsecutive(u, v, u.length, 1e-6);
        assertArrayEquals(new int[] { 0, 2, 3, 5 }, kept.toArray(), "duplicates and the wrap around pair merge");
        assertEquals(0, PolygonMetrics.mergeConsecutive(u, v, 0, 1e-6).size());
    }
}
