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

import com.hellblazer.girth.common.IntArrayList;

/**
 * Closed polygon arithmetic over parallel coordinate arrays. Closure is implicit: the last vertex connects to the
 * first.
 *
 * @author hal.hildebrand
 */
public final class PolygonMetrics {

    /**
     * |shoelace| / 2
     */
    public static double area(double[] u, double[] v, int n) {
        return Math.abs(signedArea(u, v, n));
    }

    /**
     * Indices of the vertices that survive merging consecutive near duplicates, the wrap around pair included. A
     * vertex within epsilon of the last kept vertex is dropped; finally trailing vertices within epsilon of the first
     * are dropped.
     */
    public static IntArrayList mergeConsecutive(double[] u, double[] v, int n, double epsilon) {
        var kept = new IntArrayList(n);
        if (n == 0) {
            return kept;
        }
        kept.add(0);
        int last = 0;
        for (int i = 1; i < n; i++) {
            if (distance(u, v, last, i) > epsilon) {
                kept.add(i);
                last = i;
            }
        }
        var result = new IntArrayList(kept.size());
        int end = kept.size();
        while (end > 1 && distance(u, v, kept.get(end - 1), kept.get(0)) <= epsilon) {
            end--;
        }
        for (int i = 0; i < end; i++) {
            result.add(kept.get(i));
        }
        return result;
    }

    /**
     * Sum of consecutive edge lengths, closing edge included
     */
    public static double perimeter(double[] u, double[] v, int n) {
        if (n < 2) {
            return 0.0;
        }
        double sum = 0.0;
        for (int i = 0; i < n; i++) {
            int j = i + 1 == n ? 0 : i + 1;
            sum += distance(u, v, i, j);
        }
        return sum;
    }

    /**
     * Positive when counter clockwise
     */
    public static double signedArea(double[] u, double[] v, int n) {
        if (n < 3) {
            return 0.0;
        }
        double twice = 0.0;
        for (int i = 0; i < n; i++) {
            int j = i + 1 == n ? 0 : i + 1;
            twice += u[i] * v[j] - u[j] * v[i];
        }
        return twice / 2.0;
    }

    private static double distance(double[] u, double[] v, int a, int b) {
        double du = u[a] - u[b];
        double dv = v[a] - v[b];
        return Math.sqrt(du * du + dv * dv);
    }

    private PolygonMetrics() {
    }
}
