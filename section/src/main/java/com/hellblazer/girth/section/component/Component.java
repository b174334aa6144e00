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

import javax.vecmath.Point2d;

import com.hellblazer.girth.common.IntArrayList;
import com.hellblazer.girth.section.geometry.PlanarPoints;

/**
 * A connected subset of a slice with the position-only facts torso selection ranks on.
 *
 * @author hal.hildebrand
 */
public record Component(IntArrayList indices, PlanarPoints points, Point2d centroid, double centerDistance,
                        double hullArea, double hullPerimeter) {

    public int size() {
        return indices.size();
    }

    @Override
    public String toString() {
        return String.format("Component[n=%d, centroid=(%.4f, %.4f), distance=%.6f, area=%.6f, perimeter=%.6f]",
                             size(), centroid.x, centroid.y, centerDistance, hullArea, hullPerimeter);
    }
}
