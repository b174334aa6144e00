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
 * A coordinate axis and the two in-plane coordinates of a slice perpendicular to it. The in-plane order is fixed per
 * axis, so for the usual vertical Y axis a slice is (x, z).
 *
 * @author hal.hildebrand
 */
public enum Axis {
    X(0, 1, 2), Y(1, 0, 2), Z(2, 0, 1);

    private final int index;
    private final int u;
    private final int v;

    Axis(int index, int u, int v) {
        this.index = index;
        this.u = u;
        this.v = v;
    }

    public int index() {
        return index;
    }

    /** Index of the first in-plane coordinate */
    public int u() {
        return u;
    }

    /** Index of the second in-plane coordinate */
    public int v() {
        return v;
    }
}
