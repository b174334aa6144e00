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
 * Vertical lengths read straight off the body's long axis. Body height is the full extent; crotch and knee heights are
 * fixed fractions of it, measured from the lowest vertex, standing in for landmarks that are never detected.
 *
 * @author hal.hildebrand
 */
public enum HeightKey {
    HEIGHT(1.0, null), CROTCH_HEIGHT(0.45, null), KNEE_HEIGHT(0.25, "right");

    public static HeightKey fromToken(String token) {
        if (token == null) {
            throw new IllegalArgumentException("Height key token is required");
        }
        var normalized = token.trim().toUpperCase(Locale.ROOT);
        for (var key : values()) {
            if (key.name().equals(normalized) || key.standardKey().equals(normalized)) {
                return key;
            }
        }
        throw new IllegalArgumentException("Unknown height key: " + token);
    }

    private final double fraction;
    private final String side;

    HeightKey(double fraction, String side) {
        this.fraction = fraction;
        this.side = side;
    }

    /**
     * Share of the full body height this key reports
     */
    public double fraction() {
        return fraction;
    }

    public boolean isEstimated() {
        return this != HEIGHT;
    }

    /**
     * The canonical side a bilateral length is reported for, or null
     */
    public String side() {
        return side;
    }

    public String standardKey() {
        return name() + "_M";
    }
}
