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

import static com.hellblazer.girth.section.loop.BoundaryFixtures.arc;
import static com.hellblazer.girth.section.loop.BoundaryFixtures.input;
import static com.hellblazer.girth.section.loop.BoundaryFixtures.ring;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import com.hellblazer.girth.section.failure.FailureReason;

/**
 * @author hal.hildebrand
 */
public class PolarAngleStrategyTest {

    @Test
    public void testClosedRing() {
        var outcome = new PolarAngleStrategy().attempt(input(ring(0.15, 100), false));
        var built = assertInstanceOf(StrategyOutcome.Built.class, outcome);
        assertEquals(2 * Math.PI * 0.15, built.loop().perimeter(), 1e-3);
        assertTrue(built.loop().maxAngularGap() < 0.1, "gap " + built.loop().maxAngularGap());
    }

    @Test
    public void testSemicircleIsNotClosed() {
        var outcome = new PolarAngleStrategy().attempt(input(arc(0.1, Math.PI, 32), false));
        assertEquals(FailureReason.NOT_CLOSED_LOOP, ((StrategyOutcome.Failed) outcome).reason());
    }

    @Test
    public void testTooFewPoints() {
        var outcome = new PolarAngleStrategy().attempt(input(arc(0.1, Math.PI, 2), false));
        assertEquals(FailureReason.TOO_FEW_POINTS, ((StrategyOutcome.Failed) outcome).reason());
    }

    @Test
    public void testPercentileAndMedian() {
        var values = new double[] { 4, 1, 3, 2 };
        assertEquals(2.5, PolarOrder.median(values));
        assertEquals(3.25, PolarOrder.percentile(values, 75));
        assertEquals(1.0, PolarOrder.percentile(values, 0));
        assertEquals(4.0, PolarOrder.percentile(values, 100));
        assertEquals(4.0, values[0], "inputs are not reordered");
    }
}
