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

import com.hellblazer.girth.section.geometry.PlanarPoints;

/**
 * The points whose long-axis coordinate falls in {@code [height - tolerance, height + tolerance]}, projected onto the
 * slice plane in canonical (u, v) order.
 *
 * @param rawCount the band population before downsampling
 * @param stride   the downsampling stride, 1 when every point was kept
 * @author hal.hildebrand
 */
public record SliceBand(double height, double tolerance, PlanarPoints points, int rawCount, int stride) {

    public boolean isDownsampled() {
        return stride > 1;
    }

    public int size() {
        return points.size();
    }
}
