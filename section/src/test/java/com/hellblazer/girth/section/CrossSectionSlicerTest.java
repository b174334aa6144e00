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
package com.hellblazer.girth.section;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Random;

import javax.vecmath.Point3f;

import org.junit.jupiter.api.Test;

/**
 * @author hal.hildebrand
 */
public class CrossSectionSlicerTest {

    private static ArrayList<Point3f> randomCloud(Random random, int count) {
        var points = new ArrayList<Point3f>();
        for (int i = 0; i < count; i++) {
            points.add(new Point3f(random.nextFloat(), random.nextFloat() * 2.0f, random.nextFloat()));
        }
        return points;
    }

    @Test
    public void testBandMatchesBruteForce() {
        var random = new Random(0x1234);
        var points = randomCloud(random, 5000);
        var slicer = new CrossSectionSlicer(VertexCloud.of(points), Axis.Y, 20_000);
        for (int q = 0; q < 20; q++) {
            double height = random.nextDouble() * 2.0;
            double tolerance = random.nextDouble() * 0.05;
            int expected = 0;
            for (var p : points) {
                if (p.y >= height - tolerance && p.y <= height + tolerance) {
                    expected++;
                }
            }
            var band = slicer.slice(height, tolerance);
            assertEquals(expected, band.size(), "query " + q);
            assertEquals(expected, slicer.count(height, tolerance));
            assertEquals(1, band.stride());
            assertFalse(band.isDownsampled());
        }
    }

    @Test
    public void testBandIsInclusive() {
        var cloud = VertexCloud.of(new float[][] { { 0, 1.0f, 0 }, { 1, 1.5f, 0 }, { 2, 2.0f, 0 }, { 3, 2.5f, 0 } });
        var slicer = new CrossSectionSlicer(cloud, Axis.Y, 100);
        var band = slicer.slice(1.5, 0.5);
        assertEquals(3, band.size());
        assertArrayEquals(new double[] { 0, 1, 2 }, band.points().us());
    }

    @Test
    public void testCanonicalOrder() {
        var random = new Random(0x5eed);
        var points = randomCloud(random, 3000);
        var ordered = new CrossSectionSlicer(VertexCloud.of(points), Axis.Y, 20_000).slice(1.0, 0.1);
        var u = ordered.points().us();
        var v = ordered.points().vs();
        for (int i = 1; i < u.length; i++) {
            assertTrue(u[i - 1] < u[i] || (u[i - 1] == u[i] && v[i - 1] <= v[i]), "out of order at " + i);
        }
        Collections.shuffle(points, random);
        var shuffled = new CrossSectionSlicer(VertexCloud.of(points), Axis.Y, 20_000).slice(1.0, 0.1);
        assertArrayEquals(u, shuffled.points().us());
        assertArrayEquals(v, shuffled.points().vs());
    }

    @Test
    public void testDownsampling() {
        var random = new Random(7);
        var points = randomCloud(random, 1000);
        var slicer = new CrossSectionSlicer(VertexCloud.of(points), Axis.Y, 100);
        var band = slicer.slice(1.0, 1.0);
        assertEquals(1000, band.rawCount());
        assertTrue(band.isDownsampled());
        assertEquals(10, band.stride());
        assertEquals(100, band.size());
    }

    @Test
    public void testProjection() {
        var cloud = VertexCloud.of(new float[][] { { 1, 2, 3 }, { 4, 5, 6 } });
        var band = new CrossSectionSlicer(cloud, Axis.X, 10).slice(1.0, 0.0);
        assertEquals(1, band.size());
        assertEquals(2.0, band.points().u(0));
        assertEquals(3.0, band.points().v(0));
        var center = new CrossSectionSlicer(cloud, Axis.Z, 10).bodyCenter();
        assertEquals(2.5, center.x, 1e-12);
        assertEquals(3.5, center.y, 1e-12);
    }

    @Test
    public void testNegativeTolerance() {
        var slicer = new CrossSectionSlicer(VertexCloud.of(new float[][] { { 0, 0, 0 } }), Axis.Y, 10);
        assertThrows(IllegalArgumentException.class, () -> slicer.slice(0.0, -1.0));
    }
}
