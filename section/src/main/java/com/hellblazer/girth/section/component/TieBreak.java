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

import java.util.Locale;

/**
 * The criterion that decided a torso selection, listed in the default order of application
 *
 * @author hal.hildebrand
 */
public enum TieBreak {
    /** Only one component */
    SINGLE_COMPONENT,
    /** Smallest centroid distance to the reference center */
    DISTANCE,
    /** Largest hull area */
    AREA,
    /** Largest hull perimeter */
    PERIMETER,
    /** Lexicographically smallest centroid */
    CENTROID;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
