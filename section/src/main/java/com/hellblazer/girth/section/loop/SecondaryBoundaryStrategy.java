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

import com.hellblazer.girth.common.IntArrayList;
import com.hellblazer.girth.section.failure.FailureReason;
import com.hellblazer.girth.section.failure.WarningCode;

/**
 * A more aggressive boundary: every point whose k-th neighbor distance reaches the configured percentile of all k-th
 * neighbor distances. Distances within the dedupe epsilon of the percentile count as reaching it, so uniformly sampled
 * sections keep every point.
 *
 * @author hal.hildebrand
 */
public class SecondaryBoundaryStrategy implements BoundaryStrategy {
    public static final String TAG = "secondary_boundary";

    @Override
    public StrategyOutcome attempt(BoundaryInput input) {
        var config = input.config();
        var points = input.points();
        int n = points.size();
        int k = Math.min(config.getSecondaryK(), n - 1);
        if (n < 3 || k < 1) {
            return StrategyOutcome.failed(FailureReason.TOO_FEW_COMPONENT_POINTS);
        }
        var boundary = new IntArrayList();
        if (n > k + 1) {
            var distances = PolarOrder.kthNeighborDistances(points, k);
            double threshold = PolarOrder.percentile(distances, config.getSecondaryPercentile())
            - config.getDedupeEpsilon();
            for (int i = 0; i < n; i++) {
                if (distances[i] >= threshold) {
                    boundary.add(i);
                }
            }
        } else {
            for (int i = 0; i < n; i++) {
                boundary.add(i);
            }
        }
        if (boundary.size() < config.getMinBoundaryPoints()) {
            return StrategyOutcome.failed(FailureReason.TOO_FEW_BOUNDARY_POINTS);
        }
        var outcome = PolarOrder.order(points.subset(boundary), config.getDedupeEpsilon(),
                                       config.getMaxAngularGap());
        if (outcome instanceof StrategyOutcome.Built built) {
            return new StrategyOutcome.Built(built.loop(), Map.of("secondary_k", k, "boundary_points",
                                                                  boundary.size()));
        }
        return outcome;
    }

    @Override
    public WarningCode failureCode() {
        return WarningCode.SECONDARY_FAIL;
    }

    @Override
    public String tag() {
        return TAG;
    }
}
