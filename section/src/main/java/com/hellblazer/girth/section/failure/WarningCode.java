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
 * The stable warning vocabulary attached to every measurement result. Codes are emitted as strings, either bare
 * ({@code TORSO_TIEBREAK_USED}) or qualified by a {@link FailureReason} ({@code ALPHA_FAIL:TOO_FEW_BOUNDARY_POINTS}).
 * Downstream aggregation groups by the part before the colon.
 *
 * @author hal.hildebrand
 */
public enum WarningCode {
    /** Extent along the chosen long axis is effectively zero */
    BODY_AXIS_TOO_SHORT,
    /** A stage failed for one candidate height; qualified by the reason */
    CANDIDATE_FAIL,
    /** Convex hull last resort failed; qualified */
    HULL_FAIL,
    /** Alpha-shape boundary extraction failed; qualified */
    ALPHA_FAIL,
    /** Density trim failed; qualified */
    CLUSTER_TRIM_FAIL,
    /** The measured component looks like a piece of a broken ring rather than a whole section */
    COMPONENT_FRAGMENTED,
    CROSS_SECTION_NOT_FOUND,
    /** Crotch height is a fixed fraction of body height, not a detected landmark */
    CROTCH_ESTIMATED,
    DOWNSAMPLED,
    EMPTY_CANDIDATES,
    HEIGHT_LARGE,
    HEIGHT_SMALL,
    INSUFFICIENT_VERTICES,
    /** Knee height is a fixed fraction of body height, not a detected landmark */
    KNEE_ESTIMATED,
    MIN_SEARCH_USED,
    NEAREST_VALID_PLANE_FALLBACK,
    PERIMETER_LARGE,
    PERIMETER_SMALL,
    /** Polar-angle ordering was rejected; qualified */
    PRIMARY_REJECTED,
    REGION_AMBIGUOUS,
    /** Percentile boundary builder failed; qualified */
    SECONDARY_FAIL,
    SINGLE_COMPONENT_ONLY,
    SLICE_THICKNESS_ADJUSTED,
    TORSO_FALLBACK_HULL_USED,
    TORSO_SINGLE_COMPONENT_FALLBACK_USED,
    TORSO_TIEBREAK_USED,
    /** Input scale looks wrong for meters; qualified. Never corrected. */
    UNIT_FAIL;

    /**
     * The family of a code string, i.e. everything before the first ':'
     */
    public static String family(String code) {
        int colon = code.indexOf(':');
        return colon < 0 ? code : code.substring(0, colon);
    }

    public String code() {
        return name();
    }

    public String code(FailureReason reason) {
        return name() + ":" + reason.name();
    }
}
