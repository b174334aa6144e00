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
package com.hellblazer.girth.section.failure;

/**
 * The detail half of a stage specific code, e.g. the {@code TOO_FEW_BOUNDARY_POINTS} in
 * {@code ALPHA_FAIL:TOO_FEW_BOUNDARY_POINTS}. {@link #DEGEN_FAIL} is also the terminal failure reason of an undefined
 * measurement.
 *
 * @author hal.hildebrand
 */
public enum FailureReason {
    CROSS_SECTION_NOT_FOUND,
    DEGEN_FAIL,
    DEGENERATE_HULL,
    EXCEPTION,
    EXTRACT_EMPTY,
    INCOMPLETE_BOUNDARY,
    NO_CLUSTER,
    NOT_CLOSED_LOOP,
    NUMERIC_ERROR,
    PERIMETER_LARGE,
    SCALE_SUSPECTED,
    TOO_FEW_BOUNDARY_POINTS,
    TOO_FEW_CLUSTER_POINTS,
    TOO_FEW_COMPONENT_POINTS,
    TOO_FEW_POINTS,
    TOO_FEW_SLICE_POINTS;
}
