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

import java.util.Locale;

/**
 * Straight line extents of a single fixed-fraction cross section. Width runs along the first in-plane coordinate,
 * depth along the second.
 *
 * @author hal.hildebrand
 */
public enum ExtentKey {
    CHEST_WIDTH(0.35, true, false), CHEST_DEPTH(0.35, false, false), WAIST_WIDTH(0.50, true, true),
    WAIST_DEPTH(0.50, false, true), HIP_WIDTH(0.60, true, true), HIP_DEPTH(0.60, false, true);

    public static ExtentKey fromToken(String token) {
        if (token == null) {
            throw new IllegalArgumentException("Extent key token is required");
        }
        var normalized = token.trim().toUpperCase(Locale.ROOT);
        for (var key : values()) {
            if (key.name().equals(normalized) || key.standardKey().equals(normalized)) {
                return key;
            }
        }
        throw new IllegalArgumentException("Unknown extent key: " + token);
    }

    private final boolean adaptive;
    private final double  fraction;
    private final boolean width;

    ExtentKey(double fraction, boolean width, boolean adaptive) {
        this.fraction = fraction;
        this.width = width;
        this.adaptive = adaptive;
    }

    /**
     * Fraction of the long-axis extent, above its minimum, where the plane is cut
     */
    public double fraction() {
        return fraction;
    }

    /**
     * Whether the slice thickness is floored and an empty plane may shift to the nearest populated one
     */
    public boolean isAdaptive() {
        return adaptive;
    }

    public boolean isWidth() {
        return width;
    }

    public String standardKey() {
        return name() + "_M";
    }
}
