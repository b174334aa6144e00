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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

/**
 * @author hal.hildebrand
 */
public class WarningLogTest {

    @Test
    public void testOrderedAppend() {
        var log = new WarningLog().add(WarningCode.DOWNSAMPLED)
                                  .add(WarningCode.ALPHA_FAIL, FailureReason.TOO_FEW_BOUNDARY_POINTS)
                                  .add(WarningCode.DOWNSAMPLED);
        assertEquals(List.of("DOWNSAMPLED", "ALPHA_FAIL:TOO_FEW_BOUNDARY_POINTS", "DOWNSAMPLED"), log.snapshot());
        assertEquals(3, log.size());
    }

    @Test
    public void testContains() {
        var log = new WarningLog().add(WarningCode.UNIT_FAIL, FailureReason.SCALE_SUSPECTED);
        assertTrue(log.contains(WarningCode.UNIT_FAIL));
        assertTrue(log.contains("UNIT_FAIL:SCALE_SUSPECTED"));
        assertFalse(log.contains("UNIT_FAIL"));
        assertFalse(log.contains(WarningCode.PERIMETER_LARGE));
    }

    @Test
    public void testSnapshotIsImmutableCopy() {
        var log = new WarningLog().add(WarningCode.MIN_SEARCH_USED);
        var snapshot = log.snapshot();
        log.add(WarningCode.REGION_AMBIGUOUS);
        assertEquals(1, snapshot.size());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.add("X"));
    }

    @Test
    public void testAddAll() {
        var first = new WarningLog().add(WarningCode.SINGLE_COMPONENT_ONLY);
        var second = new WarningLog().add(WarningCode.PERIMETER_SMALL).addAll(first);
        assertEquals(List.of("PERIMETER_SMALL", "SINGLE_COMPONENT_ONLY"), second.snapshot());
        assertTrue(new WarningLog().isEmpty());
    }

    @Test
    public void testFamily() {
        assertEquals("CLUSTER_TRIM_FAIL", WarningCode.family("CLUSTER_TRIM_FAIL:NO_CLUSTER"));
        assertEquals("TORSO_TIEBREAK_USED", WarningCode.family("TORSO_TIEBREAK_USED"));
        assertEquals("HULL_FAIL:DEGENERATE_HULL", WarningCode.HULL_FAIL.code(FailureReason.DEGENERATE_HULL));
    }
}
