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

import com.hellblazer.girth.section.failure.WarningCode;

/**
 * One named way to turn a component's points into a closed loop. Implementations are pure functions of their input:
 * no state survives an attempt.
 *
 * @author hal.hildebrand
 */
public interface BoundaryStrategy {

    StrategyOutcome attempt(BoundaryInput input);

    /**
     * The warning family recorded, qualified by the failure reason, when an attempt fails
     */
    WarningCode failureCode();

    /**
     * Whether the strategy deliberately leaves some of the component out, in which case its loop is held to the hull
     * of its own vertices rather than the component's
     */
    default boolean trimsOutliers() {
        return false;
    }

    /**
     * The method tag recorded when this strategy produces the loop
     */
    String tag();

    /**
     * A warning recorded when this strategy produces the loop, or null
     */
    default WarningCode usedFlag() {
        return null;
    }
}
