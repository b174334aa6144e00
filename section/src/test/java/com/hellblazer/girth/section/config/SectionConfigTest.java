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
package com.hellblazer.girth.section.config;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import com.hellblazer.girth.section.MeasurementKey;
import com.hellblazer.girth.section.component.CenterReference;
import com.hellblazer.girth.section.select.SelectionStatistic;

/**
 * @author hal.hildebrand
 */
public class SectionConfigTest {

    @Test
    public void testDefaults() {
        var config = SectionConfig.defaults();
        assertEquals(20, config.getCandidateCount());
        assertEquals(0.01, config.getConnectivityDistance());
        assertEquals(0.5, config.getToleranceFactor());
        assertArrayEquals(new int[] { 3, 5, 7 }, config.getAlphaKChoices());
        assertEquals(CenterReference.SLICE_CENTROID, config.getCenterReference());
        assertEquals(0.1, config.getPerimeterSmall());
        assertEquals(3.0, config.getPerimeterLarge());
        assertEquals(0.1, config.getHeightSmall());
        assertEquals(3.0, config.getHeightLarge());
        assertEquals(SelectionStatistic.MIN, config.getPolicyTable().policy(MeasurementKey.WAIST).statistic());
        assertEquals(40.0, config.getConnectivityDensityFactor());
        assertEquals(0.05, config.getMaxConnectivityDistance());
        assertEquals(0.995, config.getMinHullCoverage());
        assertEquals(0.1, config.getFragmentShare());
        assertEquals(Math.PI / 4.0, config.getFragmentGap());
    }

    @Test
    public void testPresets() {
        assertEquals(40, SectionConfig.fineScan().getCandidateCount());
        assertEquals(0.25, SectionConfig.fineScan().getToleranceFactor());
        assertEquals(12, SectionConfig.sparseScan().getCandidateCount());
        assertEquals(0.02, SectionConfig.sparseScan().getConnectivityDistance());
    }

    @Test
    public void testFluentValidation() {
        var config = SectionConfig.defaults();
        assertSame(config, config.withCandidateCount(5));
        assertThrows(IllegalArgumentException.class, () -> config.withCandidateCount(0));
        assertThrows(IllegalArgumentException.class, () -> config.withConnectivityDistance(-0.01));
        assertThrows(IllegalArgumentException.class, () -> config.withConnectivityDistance(Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> config.withToleranceFactor(Double.POSITIVE_INFINITY));
        assertThrows(IllegalArgumentException.class, () -> config.withAlphaKChoices());
        assertThrows(IllegalArgumentException.class, () -> config.withAlphaKChoices(3, 0));
        assertThrows(IllegalArgumentException.class, () -> config.withMinSlicePoints(2));
        assertThrows(IllegalArgumentException.class, () -> config.withMaxAngularGap(7.0));
        assertThrows(IllegalArgumentException.class, () -> config.withSecondaryPercentile(101));
        assertThrows(IllegalArgumentException.class, () -> config.withPerimeterBounds(1.0, 0.5));
        assertThrows(IllegalArgumentException.class, () -> config.withHeightBounds(0.0, 2.0));
        assertThrows(IllegalArgumentException.class, () -> config.withExtentTolerance(0.03, 0.005, 0.02));
        assertThrows(IllegalArgumentException.class, () -> config.withCenterReference(null));
        assertThrows(IllegalArgumentException.class, () -> config.withConnectivityDensity(-1.0, 0.05));
        assertThrows(IllegalArgumentException.class, () -> config.withConnectivityDensity(40.0, 0.0));
        assertThrows(IllegalArgumentException.class, () -> config.withMinHullCoverage(1.5));
        assertThrows(IllegalArgumentException.class, () -> config.withFragmentation(-0.1, 1.0));
        assertThrows(IllegalArgumentException.class, () -> config.withFragmentation(0.1, 0.0));
        assertEquals(5, config.getCandidateCount(), "rejected values must not be applied");
    }

    @Test
    public void testCopyIsIndependent() {
        var original = SectionConfig.defaults().withAlphaKChoices(5);
        var copy = original.copy();
        original.withCandidateCount(99)
                .withAlphaKChoices(7, 9)
                .withConnectivityDensity(0.0, 0.1)
                .withMinHullCoverage(0.5);
        assertEquals(20, copy.getCandidateCount());
        assertEquals(40.0, copy.getConnectivityDensityFactor());
        assertEquals(0.05, copy.getMaxConnectivityDistance());
        assertEquals(0.995, copy.getMinHullCoverage());
        assertArrayEquals(new int[] { 5 }, copy.getAlphaKChoices());
        var choices = copy.getAlphaKChoices();
        choices[0] = 42;
        assertArrayEquals(new int[] { 5 }, copy.getAlphaKChoices(), "getter must not expose internal state");
    }
}
