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
 * The chosen long axis, its coordinate range and why it was chosen.
 *
 * @author hal.hildebrand
 */
public record AxisEstimate(Axis axis, double min, double max, String reason) {

    public double extent() {
        return max - min;
    }

    /**
     * @return the axis coordinate at the given fraction of the extent above the minimum
     */
    public double height(double fraction) {
        return min + fraction * extent();
    }
}
