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

import com.hellblazer.girth.section.component.TieBreak;
import com.hellblazer.girth.section.loop.Reconstruction;

/**
 * A candidate height that made it through every stage
 *
 * @param connectivity    the connectivity distance the slice was separated with
 * @param componentPoints the number of points in the measured component
 * @author hal.hildebrand
 */
public record CandidateSection(int index, double height, double tolerance, int slicePoints, int componentCount,
                               double connectivity, int componentPoints, TieBreak criterion,
                               Reconstruction reconstruction) {

    public double perimeter() {
        return reconstruction.loop().perimeter();
    }
}
