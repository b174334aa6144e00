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

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hellblazer.girth.common.IntArrayList;
import com.hellblazer.girth.section.failure.FailureReason;
import com.hellblazer.girth.section.failure.WarningCode;
import com.hellblazer.girth.section.geometry.PlanarPoints;

/**
 * Concave boundary from a k-nearest-neighbor graph: a point is on the boundary when its k-th neighbor is farther than
 * {@code alphaBoundaryRatio} times the median k-th neighbor distance, i.e. when its neighborhood is one sided. The
 * neighborhood size is picked from the configured choices by a stable hash of the case id, so a case always gets the
 * same k. When too few boundary points are found the attempt is repeated once with the relaxed k, if smaller.
 *
 * @author hal.hildebrand
 */
public class AlphaShapeStrategy implements BoundaryStrategy {
    public static final String ALPHA_PARAM_USED = "alpha_param_used";
    public static final String TAG              = "alpha_shape";

    private static final Logger log = LoggerFactory.getLogger(AlphaShapeStrategy.class);

    /**
     * The neighborhood size for a case
     *
     * @param caseId the case id, or null
     */
    public static int alphaK(String caseId, int[] choices, int defaultK) {
        if (caseId == null) {
            return defaultK;
        }
        return choices[Math.floorMod(caseId.hashCode(), choices.length)];
    }

    @Override
    public StrategyOutcome attempt(BoundaryInput input) {
        var config = input.config();
        if (input.sliceSize() < config.getMinSlicePoints()) {
            return StrategyOutcome.failed(FailureReason.TOO_FEW_SLICE_POINTS);
        }
        var points = input.points();
        if (points.size() < config.getMinComponentPoints() || points.size() < 3) {
            return StrategyOutcome.failed(FailureReason.TOO_FEW_COMPONENT_POINTS);
        }
        int k = alphaK(input.caseId(), config.getAlphaKChoices(), config.getDefaultAlphaK());
        var boundary = boundary(points, k, config.getAlphaBoundaryRatio());
        boolean relaxed = false;
        if (boundary.size() < config.getMinBoundaryPoints()) {
            int relaxedK = Math.min(k, config.getRelaxedAlphaK());
            if (relaxedK >= k) {
                return StrategyOutcome.failed(FailureReason.TOO_FEW_BOUNDARY_POINTS);
            }
            log.trace("Relaxing alpha k {} -> {} after {} boundary points", k, relaxedK, boundary.size());
            k = relaxedK;
            relaxed = true;
            boundary = boundary(points, k, config.getAlphaBoundaryRatio());
            if (boundary.size() < config.getMinBoundaryPoints()) {
                return StrategyOutcome.failed(FailureReason.TOO_FEW_BOUNDARY_POINTS);
            }
        }
        var outcome = PolarOrder.order(points.subset(boundary), config.getDedupeEpsilon(),
                                       config.getMaxAngularGap());
        if (outcome instanceof StrategyOutcome.Built built) {
            return new StrategyOutcome.Built(built.loop(), Map.of(ALPHA_PARAM_USED, k, "boundary_points",
                                                                  boundary.size(), "alpha_relaxed", relaxed));
        }
        return outcome;
    }

    @Override
    public WarningCode failureCode() {
        return WarningCode.ALPHA_FAIL;
    }

    @Override
    public String tag() {
        return TAG;
    }

    private IntArrayList boundary(PlanarPoints points, int k, double ratio) {
        int n = points.size();
        var result = new IntArrayList();
        // every point is on the boundary when there are not enough neighbors to rank
        if (n <= k + 1) {
            for (int i = 0; i < n; i++) {
                result.add(i);
            }
            return result;
        }
        var distances = PolarOrder.kthNeighborDistances(points, k);
        double threshold = PolarOrder.median(distances) * ratio;
        for (int i = 0; i < n; i++) {
            if (distances[i] > threshold) {
                result.add(i);
            }
        }
        return result;
    }
}
