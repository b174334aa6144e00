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
 * The fixed enumeration of circumference measurements. Each key has a standard column name; policy (search region and
 * selection statistic) lives in {@link com.hellblazer.girth.section.select.PolicyTable}, not here.
 *
 * @author hal.hildebrand
 */
public enum MeasurementKey {
    NECK("NECK_CIRC_M"), BUST("BUST_CIRC_M"), UNDERBUST("UNDERBUST_CIRC_M"), WAIST("WAIST_CIRC_M"),
    HIP("HIP_CIRC_M"), THIGH("THIGH_CIRC_M"), MIN_CALF("MIN_CALF_CIRC_M");

    /**
     * Resolve a measurement token, either the key name ({@code WAIST}) or its standard name ({@code WAIST_CIRC_M}),
     * ignoring case.
     *
     * @throws IllegalArgumentException if the token names no key
     */
    public static MeasurementKey fromToken(String token) {
        if (token == null) {
            throw new IllegalArgumentException("Measurement key token is required");
        }
        var normalized = token.trim().toUpperCase(Locale.ROOT);
        for (var key : values()) {
            if (key.name().equals(normalized) || key.standardKey.equals(normalized)) {
                return key;
            }
        }
        throw new IllegalArgumentException("Unknown measurement key: " + token);
    }

    private final String standardKey;

    MeasurementKey(String standardKey) {
        this.standardKey = standardKey;
    }

    public String standardKey() {
        return standardKey;
    }
}
