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

import com.hellblazer.girth.section.failure.FailureReason;
import com.hellblazer.girth.section.failure.WarningCode;

/**
 * The primary strategy: the component's points ordered by polar angle about their centroid. Rejected when the loop
 * has too few points, encloses no area, or leaves an angular gap wider than the configured maximum, i.e. does not
 * actually wind around its centroid.
 *
 * @author hal.hildebrand
 */
public class PolarAngleStrategy implements BoundaryStrategy {
    public static final String TAG = "polar_angle";

    @Override
    public StrategyOutcome attempt(BoundaryInput input) {
        var config = input.config();
        if (input.points().size() < config.getMinBoundaryPoints()) {
            return StrategyOutcome.failed(FailureReason.TOO_FEW_POINTS);
        }
        var outcome = PolarOrder.order(input.points(), config.getDedupeEpsilon(), config.getMaxAngularGap());
        if (outcome instanceof StrategyOutcome.Built built && built.loop().size() < config.getMinBoundaryPoints()) {
            return StrategyOutcome.failed(FailureReason.TOO_FEW_POINTS);
        }
        return outcome;
    }

    @Override
    public WarningCode failureCode() {
        return WarningCode.PRIMARY_REJECTED;
    }

    @Override
    public String tag() {
        return TAG;
    }
}
