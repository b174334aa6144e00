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

import java.util.Arrays;
import java.util.Comparator;

import javax.vecmath.Point2d;

import com.hellblazer.girth.section.geometry.PlanarPoints;

/**
 * Cuts thin bands perpendicular to the long axis. The vertex indices are sorted once, by axis coordinate then by the
 * in-plane coordinates, so every band is a contiguous run found by binary search and its cost scales with the band
 * population rather than the cloud size.
 * <p>
 * Within a band the projected points are put in lexicographic (u, v) order. Everything downstream sees only that
 * canonical order, which makes results independent of the order the vertices arrived in.
 *
 * @author hal.hildebrand
 */
public class CrossSectionSlicer {

    private final double[]    axial;
    private final Axis        axis;
    private final Point2d     bodyCenter;
    private final VertexCloud cloud;
    private final int         maxSlicePoints;
    private final int[]       sorted;

    public CrossSectionSlicer(VertexCloud cloud, Axis axis, int maxSlicePoints) {
        if (maxSlicePoints < 1) {
            throw new IllegalArgumentException("Max slice points must be positive: " + maxSlicePoints);
        }
        this.cloud = cloud;
        this.axis = axis;
        this.maxSlicePoints = maxSlicePoints;
        var order = new Integer[cloud.size()];
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
        }
        Arrays.sort(order, Comparator.<Integer>comparingDouble(i -> cloud.coordinate(i, axis.index()))
                                     .thenComparingDouble(i -> cloud.coordinate(i, axis.u()))
                                     .thenComparingDouble(i -> cloud.coordinate(i, axis.v())));
        sorted = new int[order.length];
        axial = new double[order.length];
        for (int i = 0; i < order.length; i++) {
            sorted[i] = order[i];
            axial[i] = cloud.coordinate(order[i], axis.index());
        }
        bodyCenter = canonicalCenter();
    }

    public Axis axis() {
        return axis;
    }

    /**
     * The cloud centroid projected onto the slice plane
     */
    public Point2d bodyCenter() {
        return new Point2d(bodyCenter);
    }

    /**
     * Number of vertices in the band, without materializing it
     */
    public int count(double height, double tolerance) {
        return upperBound(height + tolerance) - lowerBound(height - tolerance);
    }

    /**
     * Extract the band {@code [height - tolerance, height + tolerance]}, inclusive at both ends. A band with more than
     * the maximum number of points is thinned with a fixed stride over its canonical order.
     */
    public SliceBand slice(double height, double tolerance) {
        if (!(tolerance >= 0.0)) {
            throw new IllegalArgumentException("Tolerance must be non-negative: " + tolerance);
        }
        int from = lowerBound(height - tolerance);
        int to = upperBound(height + tolerance);
        int raw = Math.max(0, to - from);
        var band = new Integer[raw];
        for (int i = 0; i < raw; i++) {
            band[i] = sorted[from + i];
        }
        Arrays.sort(band, Comparator.<Integer>comparingDouble(i -> cloud.coordinate(i, axis.u()))
                                    .thenComparingDouble(i -> cloud.coordinate(i, axis.v()))
                                    .thenComparingDouble(i -> cloud.coordinate(i, axis.index())));
        int stride = raw > maxSlicePoints ? (raw + maxSlicePoints - 1) / maxSlicePoints : 1;
        int kept = (raw + stride - 1) / stride;
        var u = new double[kept];
        var v = new double[kept];
        for (int i = 0, j = 0; i < raw; i += stride, j++) {
            u[j] = cloud.coordinate(band[i], axis.u());
            v[j] = cloud.coordinate(band[i], axis.v());
        }
        return new SliceBand(height, tolerance, PlanarPoints.of(u, v), raw, stride);
    }

    // summed in sorted order so the result does not depend on input order
    private Point2d canonicalCenter() {
        if (sorted.length == 0) {
            return new Point2d();
        }
        double su = 0.0;
        double sv = 0.0;
        for (var i : sorted) {
            su += cloud.coordinate(i, axis.u());
            sv += cloud.coordinate(i, axis.v());
        }
        return new Point2d(su / sorted.length, sv / sorted.length);
    }

    // first index with axial >= value
    private int lowerBound(double value) {
        int lo = 0, hi = axial.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (axial[mid] < value) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }

    // first index with axial > value
    private int upperBound(double value) {
        int lo = 0, hi = axial.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (axial[mid] <= value) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }
}
