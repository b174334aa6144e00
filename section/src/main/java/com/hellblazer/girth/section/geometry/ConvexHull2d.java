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

import java.util.Arrays;
import java.util.Comparator;

import com.hellblazer.girth.common.IntArrayList;

/**
 * Planar convex hull by Andrew's monotone chain.
 *
 * @author hal.hildebrand
 */
public final class ConvexHull2d {

    /**
     * @return the hull vertex indices in counter clockwise order starting from the lexicographically smallest point,
     *         collinear points excluded; fewer than three indices when the hull is degenerate
     */
    public static IntArrayList hull(PlanarPoints points) {
        int n = points.size();
        var order = new Integer[n];
        for (int i = 0; i < n; i++) {
            order[i] = i;
        }
        Arrays.sort(order, Comparator.<Integer>comparingDouble(points::u)
                                     .thenComparingDouble(points::v)
                                     .thenComparingInt(i -> i));
        var hull = new int[2 * n + 1];
        int k = 0;
        // lower
        for (int i = 0; i < n; i++) {
            while (k >= 2 && cross(points, hull[k - 2], hull[k - 1], order[i]) <= 0) {
                k--;
            }
            hull[k++] = order[i];
        }
        // upper
        for (int i = n - 2, lower = k + 1; i >= 0; i--) {
            while (k >= lower && cross(points, hull[k - 2], hull[k - 1], order[i]) <= 0) {
                k--;
            }
            hull[k++] = order[i];
        }
        var result = new IntArrayList(Math.max(k, 1));
        // last vertex repeats the first
        for (int i = 0; i < k - 1; i++) {
            result.add(hull[i]);
        }
        return result;
    }

    /**
     * @return the hull of the points as a loop, or null when the hull is degenerate
     */
    public static Loop hullLoop(PlanarPoints points, double dedupeEpsilon) {
        var indices = hull(points);
        if (indices.size() < 3) {
            return null;
        }
        var loop = Loop.of(points.subset(indices), dedupeEpsilon, true);
        return loop.size() < 3 || !(loop.area() > 0.0) ? null : loop;
    }

    private static double cross(PlanarPoints p, int o, int a, int b) {
        return (p.u(a) - p.u(o)) * (p.v(b) - p.v(o)) - (p.v(a) - p.v(o)) * (p.u(b) - p.u(o));
    }

    private ConvexHull2d() {
    }
}
