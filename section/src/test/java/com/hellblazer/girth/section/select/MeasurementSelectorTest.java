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
package com.hellblazer.girth.section.select;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.hellblazer.girth.section.Axis;
import com.hellblazer.girth.section.AxisEstimate;
import com.hellblazer.girth.section.AxisEstimator;
import com.hellblazer.girth.section.CrossSectionSlicer;
import com.hellblazer.girth.section.MeasurementKey;
import com.hellblazer.girth.section.SyntheticBodies;
import com.hellblazer.girth.section.VertexCloud;
import com.hellblazer.girth.section.config.SectionConfig;

/**
 * @author hal.hildebrand
 */
public class MeasurementSelectorTest {

    private static final double NAN = Double.NaN;

    @Test
    public void testChooseMax() {
        var choice = MeasurementSelector.choose(new double[] { 1.0, NAN, 3.0, 2.0 }, SelectionStatistic.MAX, 1e-6);
        assertEquals(2, choice.index());
        assertEquals(3.0, choice.target());
        assertFalse(choice.ambiguous());
    }

    @Test
    public void testChooseLowerMedian() {
        var choice = MeasurementSelector.choose(new double[] { 5.0, 1.0, 3.0, 4.0 }, SelectionStatistic.MEDIAN, 1e-6);
        assertEquals(3.0, choice.target());
        assertEquals(2, choice.index());
    }

    @Test
    public void testChooseLowestIndexOnTies() {
        var choice = MeasurementSelector.choose(new double[] { 1.0, 2.0, 1.0 }, SelectionStatistic.MIN, 1e-6);
        assertEquals(0, choice.index());
        assertTrue(choice.ambiguous());
    }

    @Test
    public void testNearTiesAreAmbiguous() {
        var choice = MeasurementSelector.choose(new double[] { 2.0, 2.0 + 5e-7, 1.0 }, SelectionStatistic.MAX, 1e-6);
        assertEquals(1, choice.index());
        assertTrue(choice.ambiguous());
        var clear = MeasurementSelector.choose(new double[] { 2.0, 2.1, 1.0 }, SelectionStatistic.MAX, 1e-6);
        assertFalse(clear.ambiguous());
    }

    @Test
    public void testChooseNothingValid() {
        var choice = MeasurementSelector.choose(new double[] { NAN, NAN }, SelectionStatistic.MIN, 1e-6);
        assertTrue(choice.isEmpty());
        assertTrue(Double.isNaN(choice.target()));
        assertTrue(MeasurementSelector.choose(new double[0], SelectionStatistic.MAX, 1e-6).isEmpty());
    }

    @Test
    public void testHeights() {
        var axis = new AxisEstimate(Axis.Y, 0.0, 1.0, AxisEstimator.LARGEST_EXTENT);
        var policy = new RegionPolicy("upper_leg", 0.2, 0.4, SelectionStatistic.MAX, false);
        assertArrayEquals(new double[] { 0.2, 0.3, 0.4 }, MeasurementSelector.heights(axis, policy, 3), 1e-12);
        assertEquals(0.1, MeasurementSelector.spacing(axis, policy, 3), 1e-12);
        assertArrayEquals(new double[] { 0.2 }, MeasurementSelector.heights(axis, policy, 1), 1e-12);
        assertEquals(0.2, MeasurementSelector.spacing(axis, policy, 1), 1e-12);
    }

    @Test
    public void testSelectOnCylinder() {
        var cloud = VertexCloud.of(SyntheticBodies.cylinder(0.1, 1.0));
        var axis = AxisEstimator.estimate(cloud);
        var config = SectionConfig.defaults();
        var pipeline = new SectionPipeline(new CrossSectionSlicer(cloud, axis.axis(), config.getMaxSlicePoints()),
                                           config, null);
        var selection = new MeasurementSelector().select(config.getPolicyTable().policy(MeasurementKey.THIGH), axis,
                                                         pipeline);
        assertFalse(selection.isEmpty());
        assertEquals(20, selection.candidateCount());
        assertEquals(20, selection.validCount());
        assertTrue(selection.ambiguous(), "identical rings give identical perimeters");
        assertTrue(selection.warnings().contains("REGION_AMBIGUOUS"));
        assertEquals(2 * Math.PI * 0.1, selection.chosen().perimeter(), 2 * Math.PI * 0.1 * 0.01);
        assertEquals(List.of(), selection.candidateFailures());
    }

    @Test
    public void testSelectWithNoValidCandidate() {
        var cloud = VertexCloud.of(SyntheticBodies.cylinderWithout(0.1, 1.0, y -> y > 0.15 && y < 0.45));
        var axis = AxisEstimator.estimate(cloud);
        var config = SectionConfig.defaults();
        var pipeline = new SectionPipeline(new CrossSectionSlicer(cloud, axis.axis(), config.getMaxSlicePoints()),
                                           config, null);
        var selection = new MeasurementSelector().select(config.getPolicyTable().policy(MeasurementKey.THIGH), axis,
                                                         pipeline);
        assertTrue(selection.isEmpty());
        assertNull(selection.chosen());
        assertEquals(0, selection.validCount());
        assertEquals(List.of("CANDIDATE_FAIL:TOO_FEW_SLICE_POINTS"), selection.candidateFailures());
    }
}
