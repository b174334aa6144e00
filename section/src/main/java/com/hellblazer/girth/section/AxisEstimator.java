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

/**
 * Picks the long axis of a body as the coordinate dimension with the largest extent. Ties prefer Y, the conventional
 * vertical, then the lowest index.
 *
 * @author hal.hildebrand
 */
public final class AxisEstimator {
    public static final String EXTENT_TIE     = "extent_tie";
    public static final String LARGEST_EXTENT = "largest_extent";

    public static AxisEstimate estimate(VertexCloud cloud) {
        if (cloud.isEmpty()) {
            throw new IllegalArgumentException("Cannot estimate the axis of an empty cloud");
        }
        var min = new double[] { Double.POSITIVE_INFINITY, Double.POSITIVE_INFINITY, Double.POSITIVE_INFINITY };
        var max = new double[] { Double.NEGATIVE_INFINITY, Double.NEGATIVE_INFINITY, Double.NEGATIVE_INFINITY };
        for (int i = 0; i < cloud.size(); i++) {
            for (int a = 0; a < 3; a++) {
                double c = cloud.coordinate(i, a);
                min[a] = Math.min(min[a], c);
                max[a] = Math.max(max[a], c);
            }
        }
        double largest = Math.max(max[0] - min[0], Math.max(max[1] - min[1], max[2] - min[2]));
        Axis chosen = null;
        int tied = 0;
        for (var axis : new Axis[] { Axis.Y, Axis.X, Axis.Z }) {
            if (max[axis.index()] - min[axis.index()] == largest) {
                tied++;
                if (chosen == null) {
                    chosen = axis;
                }
            }
        }
        return new AxisEstimate(chosen, min[chosen.index()], max[chosen.index()],
                                tied > 1 ? EXTENT_TIE : LARGEST_EXTENT);
    }

    private AxisEstimator() {
    }
}
