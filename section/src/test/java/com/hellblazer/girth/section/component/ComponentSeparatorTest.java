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
package com.hellblazer.girth.section.component;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Random;

import javax.vecmath.Point2d;

import org.junit.jupiter.api.Test;

import com.hellblazer.girth.section.config.SectionConfig;
import com.hellblazer.girth.section.failure.FailureReason;
import com.hellblazer.girth.section.geometry.PlanarPoints;

/**
 * @author hal.hildebrand
 */
public class ComponentSeparatorTest {

    private static PlanarPoints rings(double[][] centers, double radius, int perRing) {
        var u = new double[centers.length * perRing];
        var v = new double[u.length];
        int k = 0;
        for (var c : centers) {
            for (int i = 0; i < perRing; i++) {
                double theta = 2.0 * Math.PI * i / perRing;
                u[k] = c[0] + radius * Math.cos(theta);
                v[k++] = c[1] + radius * Math.sin(theta);
            }
        }
        return PlanarPoints.of(u, v);
    }

    @Test
    public void testSeparatesRings() {
        var slice = rings(new double[][] { { -0.3, 0 }, { 0, 0 }, { 0.3, 0 } }, 0.05, 64);
        var result = new ComponentSeparator(0.01, 3).separate(slice, new Point2d(0, 0), true);
        assertTrue(result.isPassed());
        var separation = result.value();
        assertEquals(3, separation.count());
        assertFalse(separation.singleComponentOnly());
        // sets come out ordered by smallest member
        assertEquals(-0.3, separation.components().get(0).centroid().x, 1e-9);
        var middle = separation.components().get(1);
        assertEquals(0.0, middle.centerDistance(), 1e-9);
        assertEquals(64, middle.size());
        assertEquals(Math.PI * 0.05 * 0.05, middle.hullArea(), 1e-4);
        assertEquals(2 * Math.PI * 0.05, middle.hullPerimeter(), 1e-3);
    }

    @Test
    public void testConnectivityFollowsDensity() {
        var separator = new ComponentSeparator(0.01, 40.0, 0.05, 3);
        var u = new double[11];
        for (int i = 0; i < u.length; i++) {
            u[i] = i * 0.001;
        }
        assertEquals(0.04, separator.connectivityFor(PlanarPoints.of(u, new double[u.length])), 1e-9,
                     "forty times the median spacing");
        assertEquals(0.05, separator.connectivityFor(rings(new double[][] { { 0, 0 } }, 0.05, 64)), 1e-12,
                     "capped");
        var dense = new double[11];
        for (int i = 0; i < dense.length; i++) {
            dense[i] = i * 0.0001;
        }
        assertEquals(0.01, separator.connectivityFor(PlanarPoints.of(dense, new double[dense.length])), 1e-12,
                     "floored");
        assertEquals(0.01, new ComponentSeparator(0.01, 3).connectivityFor(PlanarPoints.of(u, new double[u.length])),
                     1e-12, "fixed without a density factor");
    }

    @Test
    public void testSparseRingStaysWhole() {
        var random = new Random(0x5eed);
        int n = 200;
        var u = new double[n];
        var v = new double[n];
        for (int i = 0; i < n; i++) {
            double theta = 2.0 * Math.PI * random.nextDouble();
            u[i] = 0.15 * Math.cos(theta);
            v[i] = 0.15 * Math.sin(theta);
        }
        var slice = PlanarPoints.of(u, v);
        var fixed = new ComponentSeparator(0.01, 3).separate(slice, new Point2d(), false);
        assertTrue(fixed.isPassed());
        assertTrue(fixed.value().count() > 1, "a fixed 1 cm threshold breaks the ring: " + fixed.value().count());

        var adaptive = ComponentSeparator.of(SectionConfig.defaults()).separate(slice, new Point2d(), false);
        assertTrue(adaptive.isPassed());
        assertEquals(1, adaptive.value().count(), "one ring, one component");
        assertEquals(n, adaptive.value().components().get(0).size());
        assertEquals(0.05, adaptive.value().connectivity(), 1e-12);
    }

    @Test
    public void testStrictConnectivity() {
        var slice = PlanarPoints.of(new double[] { 0, 0.01, 0.05, 0.5, 0.5, 0.5 },
                                    new double[] { 0, 0, 0, 0, 0.005, 0.0099 });
        var uf = new ComponentSeparator(0.01, 1).connect(slice);
        assertFalse(uf.connected(0, 1), "points exactly at the connectivity distance are not adjacent");
        assertTrue(uf.connected(3, 5));
        assertEquals(4, uf.setCount());
    }

    @Test
    public void testSingleComponentFlag() {
        var slice = rings(new double[][] { { 0, 0 } }, 0.1, 128);
        var expected = new ComponentSeparator(0.01, 3).separate(slice, new Point2d(), true).value();
        assertTrue(expected.singleComponentOnly());
        var unexpected = new ComponentSeparator(0.01, 3).separate(slice, new Point2d(), false).value();
        assertFalse(unexpected.singleComponentOnly());
    }

    @Test
    public void testSmallSetsDropped() {
        var random = new Random(99);
        var u = new double[20];
        var v = new double[20];
        for (int i = 0; i < u.length; i++) {
            u[i] = random.nextDouble() * 10;
            v[i] = random.nextDouble() * 10;
        }
        var result = new ComponentSeparator(0.001, 3).separate(PlanarPoints.of(u, v), new Point2d(), true);
        assertFalse(result.isPassed());
        assertEquals(FailureReason.EXTRACT_EMPTY, result.failure().reason());
    }

    @Test
    public void testOrderIndependentPartition() {
        var slice = rings(new double[][] { { -0.2, 0.1 }, { 0.2, -0.1 } }, 0.04, 48);
        var random = new Random(5);
        int n = slice.size();
        var perm = new int[n];
        for (int i = 0; i < n; i++) {
            perm[i] = i;
        }
        for (int i = n - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            int t = perm[i];
            perm[i] = perm[j];
            perm[j] = t;
        }
        var u = new double[n];
        var v = new double[n];
        for (int i = 0; i < n; i++) {
            u[i] = slice.u(perm[i]);
            v[i] = slice.v(perm[i]);
        }
        var separator = new ComponentSeparator(0.01, 3);
        var a = separator.separate(slice, new Point2d(), true).value();
        var b = separator.separate(PlanarPoints.of(u, v), new Point2d(), true).value();
        assertEquals(a.count(), b.count());
        var byX = Comparator.<Component>comparingDouble(c -> c.centroid().x);
        var left = new ArrayList<>(a.components());
        var right = new ArrayList<>(b.components());
        left.sort(byX);
        right.sort(byX);
        for (int i = 0; i < a.count(); i++) {
            assertEquals(left.get(i).size(), right.get(i).size());
            assertEquals(left.get(i).centroid().x, right.get(i).centroid().x, 1e-12);
            assertEquals(left.get(i).hullArea(), right.get(i).hullArea(), 1e-12);
        }
    }
}
