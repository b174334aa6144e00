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
package com.hellblazer.girth.section.select;

/**
 * The per-key selection policy: a coarse height-fraction search region, the statistic applied over the candidate
 * perimeters found inside it, and whether the region is expected to separate into several components (torso versus
 * arms). Region gating uses only fractions of the body extent, never landmark indices.
 *
 * @author hal.hildebrand
 */
public record RegionPolicy(String region,               // semantic region label, e.g. "upper_torso"
                           double startFraction,        // lower bound as a fraction of the long-axis extent
                           double endFraction,          // upper bound as a fraction of the long-axis extent
                           SelectionStatistic statistic,
                           boolean separationExpected) {

    public RegionPolicy {
        if (region == null || region.isBlank()) {
            throw new IllegalArgumentException("Region label is required");
        }
        if (statistic == null) {
            throw new IllegalArgumentException("Selection statistic is required");
        }
        if (!(startFraction >= 0.0 && startFraction < endFraction && endFraction <= 1.0)) {
            throw new IllegalArgumentException(
            "Region fractions must satisfy 0 <= start < end <= 1: [" + startFraction + ", " + endFraction + "]");
        }
    }

    public RegionPolicy withRange(double start, double end) {
        return new RegionPolicy(region, start, end, statistic, separationExpected);
    }

    public RegionPolicy withSeparationExpected(boolean expected) {
        return new RegionPolicy(region, startFraction, endFraction, statistic, expected);
    }

    public RegionPolicy withStatistic(SelectionStatistic selection) {
        return new RegionPolicy(region, startFraction, endFraction, selection, separationExpected);
    }
}
