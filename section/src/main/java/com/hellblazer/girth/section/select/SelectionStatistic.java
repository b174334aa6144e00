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

import java.util.Arrays;
import java.util.Locale;

/**
 * The statistic that picks the canonical candidate from the perimeters found inside a search region.
 *
 * @author hal.hildebrand
 */
public enum SelectionStatistic {
    /** Volume extrema, e.g. bust and hip */
    MAX {
        @Override
        public double target(double[] perimeters) {
            return Arrays.stream(perimeters).max().orElseThrow();
        }
    },
    /**
     * Structurally stable sections, e.g. neck and underbust. The lower median, so the target is always one of the
     * candidates.
     */
    MEDIAN {
        @Override
        public double target(double[] perimeters) {
            var sorted = perimeters.clone();
            Arrays.sort(sorted);
            return sorted[(sorted.length - 1) / 2];
        }
    },
    /** Narrowest point, e.g. waist and calf */
    MIN {
        @Override
        public double target(double[] perimeters) {
            return Arrays.stream(perimeters).min().orElseThrow();
        }
    };

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @param perimeters the valid candidate perimeters, at least one
     * @return the perimeter value the canonical candidate should be closest to
     */
    public abstract double target(double[] perimeters);
}
