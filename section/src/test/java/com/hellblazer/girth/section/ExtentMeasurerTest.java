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
package com.hellblazer.girth.section;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.CancellationException;

import org.junit.jupiter.api.Test;

import com.hellblazer.girth.section.config.SectionConfig;
import com.hellblazer.girth.section.failure.FailureReason;
import com.hellblazer.girth.section.failure.WarningCode;

/**
 * @author hal.hildebrand
 */
public class ExtentMeasurerTest {

    @Test
    public void testCylinderWidthAndDepth() {
        var measurer = new ExtentMeasurer();
        var cloud = VertexCloud.of(SyntheticBodies.cylinder(0.15, 1.7));
        for (var key : ExtentKey.values()) {
            var result = measurer.measure(cloud, key);
            assertTrue(result.isDefined(), key + ": " + result);
            assertEquals(0.30, result.value(), 1e-4, key.toString());
            assertEquals(ExtentMeasurer.METHOD_TAG, result.methodTag());
            assertEquals(key.standardKey(), result.key());
        }
    }

    @Test
    public void testArmsExcluded() {
        var cloud = VertexCloud.of(SyntheticBodies.torsoWithArms(0.15, 0.04, 0.25, 0.55, 1.4, 1.7));
        var width = new ExtentMeasurer().measure(cloud, ExtentKey.CHEST_WIDTH);
        assertTrue(width.isDefined(), width.toString());
        assertEquals(0.30, width.value(), 1e-4, "torso only");
        assertEquals(3, SectionIds.decode(width.sectionId()).get("components"));
    }

    @Test
    public void testNearestValidPlane() {
        var config = SectionConfig.defaults().withExtentTolerance(0.001, 0.001, 0.002);
        var cloud = VertexCloud.of(SyntheticBodies.cylinderWithout(0.15, 1.7, y -> Math.abs(y - 0.85) < 0.001));
        var result = new ExtentMeasurer(config).measure(cloud, ExtentKey.WAIST_WIDTH);
        assertTrue(result.isDefined(), result.toString());
        assertTrue(result.hasWarning(WarningCode.NEAREST_VALID_PLANE_FALLBACK.code()), result.warnings().toString());
        assertEquals(0.30, result.value(), 1e-4);
        var shift = (Double) SectionIds.decode(result.sectionId()).get("plane_shift");
        assertTrue(shift > 0.0 && shift <= 0.010 + 1e-9, "shift " + shift);
    }

    @Test
    public void testCrossSectionNotFound() {
        var config = SectionConfig.defaults().withExtentTolerance(0.001, 0.001, 0.002);
        var cloud = VertexCloud.of(SyntheticBodies.cylinderWithout(0.15, 1.7, y -> Math.abs(y - 0.85) < 0.035));
        var result = new ExtentMeasurer(config).measure(cloud, ExtentKey.WAIST_DEPTH);
        assertTrue(Double.isNaN(result.value()));
        assertEquals(FailureReason.CROSS_SECTION_NOT_FOUND, result.failureReason());
        assertTrue(result.hasWarning(WarningCode.CROSS_SECTION_NOT_FOUND.code()));
    }

    @Test
    public void testFixedPlaneDoesNotSearch() {
        var config = SectionConfig.defaults().withExtentTolerance(0.001, 0.001, 0.002);
        // chest plane at 0.35 of 1.7
        var cloud = VertexCloud.of(SyntheticBodies.cylinderWithout(0.15, 1.7, y -> Math.abs(y - 0.595) < 0.006));
        var result = new ExtentMeasurer(config).measure(cloud, ExtentKey.CHEST_WIDTH);
        assertTrue(Double.isNaN(result.value()));
        assertFalse(result.hasWarning(WarningCode.NEAREST_VALID_PLANE_FALLBACK.code()));
    }

    @Test
    public void testThicknessFloor() {
        // a 20 cm tall body: 2% of the extent is below the 5 mm floor
        var cloud = VertexCloud.of(SyntheticBodies.cylinder(0.05, 0.2));
        var result = new ExtentMeasurer().measure(cloud, ExtentKey.HIP_WIDTH);
        assertTrue(result.hasWarning(WarningCode.SLICE_THICKNESS_ADJUSTED.code()));
        assertEquals(0.005, (Double) SectionIds.decode(result.sectionId()).get("tolerance"), 1e-12);
    }

    @Test
    public void testInterruptedMeasurementIsCancelled() {
        var cloud = VertexCloud.of(SyntheticBodies.cylinder(0.15, 1.7));
        Thread.currentThread().interrupt();
        try {
            assertThrows(CancellationException.class, () -> new ExtentMeasurer().measure(cloud, ExtentKey.HIP_WIDTH));
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    public void testExtentKeyTokens() {
        assertEquals(ExtentKey.HIP_DEPTH, ExtentKey.fromToken("hip_depth_m"));
        assertEquals(ExtentKey.CHEST_WIDTH, ExtentKey.fromToken("CHEST_WIDTH"));
        assertThrows(IllegalArgumentException.class, () -> ExtentKey.fromToken("KNEE_WIDTH_M"));
    }
}
