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

import javax.vecmath.Point2d;

/**
 * An ordered, implicitly closed planar polygon with no two adjacent vertices (wrap around included) closer than the
 * dedupe epsilon it was built with. Perimeter and area are computed once at construction.
 *
 * @author hal.hildebrand
 */
public final class Loop {
    private static final double MIN_SHAPE_AREA = 1e-10;

    /**
     * Build a loop from ordered points, merging consecutive near duplicates.
     *
     * @param simple whether the producing strategy guarantees the polygon does not self intersect
     */
    public static Loop of(PlanarPoints ordered, double dedupeEpsilon, boolean simple) {
        var u = ordered.us();
        var v = ordered.vs();
        var kept = PolygonMetrics.mergeConsecutive(u, v, u.length, dedupeEpsilon);
        var merged = ordered.subset(kept);
        return new Loop(merged.us(), merged.vs(), simple);
    }

    private final double   area;
    private final double   perimeter;
    private final boolean  simple;
    private final double[] u;
    private final double[] v;

    private Loop(double[] u, double[] v, boolean simple) {
        this.u = u;
        this.v = v;
        this.simple = simple;
        perimeter = PolygonMetrics.perimeter(u, v, u.length);
        area = PolygonMetrics.area(u, v, u.length);
    }

    public double area() {
        return area;
    }

    public boolean isSimple() {
        return simple;
    }

    /**
     * The largest angular gap, in radians, between the loop's points as seen from their centroid. A loop that winds
     * all the way around has gaps that sum to 2pi.
     */
    public double maxAngularGap() {
        int n = u.length;
        if (n < 2) {
            return 2.0 * Math.PI;
        }
        double cu = 0.0, cv = 0.0;
        for (int i = 0; i < n; i++) {
            cu += u[i];
            cv += v[i];
        }
        cu /= n;
        cv /= n;
        var angles = new double[n];
        for (int i = 0; i < n; i++) {
            angles[i] = Math.atan2(v[i] - cv, u[i] - cu);
        }
        Arrays.sort(angles);
        double gap = angles[0] + 2.0 * Math.PI - angles[n - 1];
        for (int i = 1; i < n; i++) {
            gap = Math.max(gap, angles[i] - angles[i - 1]);
        }
        return gap;
    }

    public double perimeter() {
        return perimeter;
    }

    public PlanarPoints points() {
        return PlanarPoints.of(u, v);
    }

    public Point2d point(int i) {
        return new Point2d(u[i], v[i]);
    }

    /**
     * perimeter² / area, a circularity proxy (4π for a circle); NaN when the area is effectively zero
     */
    public double shapeRatio() {
        return area > MIN_SHAPE_AREA ? perimeter * perimeter / area : Double.NaN;
    }

    public int size() {
        return u.length;
    }

    @Override
    public String toString() {
        return "Loop[points=" + u.length + ", perimeter=" + perimeter + ", area=" + area + ", simple=" + simple + "]";
    }
}
