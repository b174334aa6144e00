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
package com.hellblazer.girth.section.loop;

import javax.vecmath.Point2d;

import com.hellblazer.girth.section.config.SectionConfig;
import com.hellblazer.girth.section.geometry.PlanarPoints;

/**
 * What every boundary strategy sees: the selected component's points in canonical order, the reference center, the
 * population of the whole slice, the optional case id and the thresholds.
 *
 * @param singleComponent the slice held exactly one component
 * @author hal.hildebrand
 */
public record BoundaryInput(PlanarPoints points, Point2d center, int sliceSize, String caseId, SectionConfig config,
                            boolean singleComponent) {
}
