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
import com.hellblazer.girth.section.geometry.ConvexHull2d;

/**
 * Last resort: the convex hull of the component. Always simple, but bridges every concavity, so its use is flagged.
 * The single component variant serves slices that never separated; the other serves a selected torso among several
 * components. The hull of an open arc is still rejected, since its vertices do not surround their centroid.
 *
 * @author hal.hildebrand
 */
public class ConvexHullStrategy implements BoundaryStrategy {

    public static ConvexHullStrategy multiComponent() {
        return new ConvexHullStrategy("hull_fallback", WarningCode.TORSO_FALLBACK_HULL_USED);
    }

    public static ConvexHullStrategy singleComponent() {
        return new ConvexHullStrategy("single_component_fallback", WarningCode.TORSO_SINGLE_COMPONENT_FALLBACK_USED);
    }

    private final WarningCode flag;
    private final String      tag;

    private ConvexHullStrategy(String tag, WarningCode flag) {
        this.tag = tag;
        this.flag = flag;
    }

    @Override
    public StrategyOutcome attempt(BoundaryInput input) {
        if (input.points().size() < 3) {
            return StrategyOutcome.failed(FailureReason.TOO_FEW_POINTS);
        }
        var loop = ConvexHull2d.hullLoop(input.points(), input.config().getDedupeEpsilon());
        if (loop == null) {
            return StrategyOutcome.failed(FailureReason.DEGENERATE_HULL);
        }
        return PolarOrder.closed(loop, input.config().getMaxAngularGap());
    }

    @Override
    public WarningCode failureCode() {
        return WarningCode.HULL_FAIL;
    }

    @Override
    public String tag() {
        return tag;
    }

    @Override
    public WarningCode usedFlag() {
        return flag;
    }
}
