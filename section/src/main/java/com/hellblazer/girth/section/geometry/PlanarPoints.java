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

import javax.vecmath.Point2d;

import com.hellblazer.girth.common.IntArrayList;

/**
 * An index arena of planar points. Points are addressed by their arena index everywhere downstream (graph edges,
 * component membership, boundary masks), so a subset is just an {@link IntArrayList} until it is materialized with
 * {@link #subset(IntArrayList)}.
 *
 * @author hal.hildebrand
 */
public final class PlanarPoints {

    public static PlanarPoints of(double[] u, double[] v) {
        if (u.length != v.length) {
            throw new IllegalArgumentException("Coordinate arrays differ in length: " + u.length + " != " + v.length);
        }
        return new PlanarPoints(u.clone(), v.clone());
    }

    private final double[] u;
    private final double[] v;

    PlanarPoints(double[] u, double[] v) {
        this.u = u;
        this.v = v;
    }

    public Point2d centroid() {
        if (u.length == 0) {
            throw new IllegalStateException("Centroid of an empty point set");
        }
        double su = 0.0;
        double sv = 0.0;
        for (int i = 0; i < u.length; i++) {
            su += u[i];
            sv += v[i];
        }
        return new Point2d(su / u.length, sv / v.length);
    }

    public boolean isEmpty() {
        return u.length == 0;
    }

    public Point2d point(int i) {
        return new Point2d(u[i], v[i]);
    }

    public int size() {
        return u.length;
    }

    /**
     * Materialize the points at the given indices, in the order given
     */
    public PlanarPoints subset(IntArrayList indices) {
        var su = new double[indices.size()];
        var sv = new double[indices.size()];
        for (int i = 0; i < su.length; i++) {
            int index = indices.get(i);
            su[i] = u[index];
            sv[i] = v[index];
        }
        return new PlanarPoints(su, sv);
    }

    @Override
    public String toString() {
        return "PlanarPoints[" + u.length + "]";
    }

    public double u(int i) {
        return u[i];
    }

    /**
     * @return a copy of the first coordinates
     */
    public double[] us() {
        return u.clone();
    }

    public double v(int i) {
        return v[i];
    }

    /**
     * @return a copy of the second coordinates
     */
    public double[] vs() {
        return v.clone();
    }
}
