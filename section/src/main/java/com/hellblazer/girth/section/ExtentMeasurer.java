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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hellblazer.girth.section.component.CenterReference;
import com.hellblazer.girth.section.component.ComponentSeparator;
import com.hellblazer.girth.section.component.TorsoSelector;
import com.hellblazer.girth.section.config.SectionConfig;
import com.hellblazer.girth.section.failure.FailureClassifier;
import com.hellblazer.girth.section.failure.FailureReason;
import com.hellblazer.girth.section.failure.WarningCode;

/**
 * Width and depth of the torso at a fixed height fraction. The slice half thickness is a fraction of the body extent;
 * for the adaptive keys it is floored at a minimum thickness and, when the plane holds too few points, the nearest
 * populated plane within a small window is used instead. The value is the extent of the selected component along the
 * key's in-plane coordinate.
 *
 * @author hal.hildebrand
 */
public class ExtentMeasurer {
    public static final String METHOD_TAG = "component_extent";

    private static final Logger log = LoggerFactory.getLogger(ExtentMeasurer.class);

    private final SectionConfig config;

    public ExtentMeasurer() {
        this(SectionConfig.defaults());
    }

    public ExtentMeasurer(SectionConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("Configuration is required");
        }
        this.config = config.copy();
    }

    public MeasurementResult measure(VertexCloud cloud, ExtentKey key) {
        if (key == null) {
            throw new IllegalArgumentException("Extent key is required");
        }
        FailureClassifier.checkInterrupted(key);
        var frame = BodyFrame.prepare(cloud, config);
        var warnings = frame.warnings();
        var id = frame.idFields();
        id.put("key", key.standardKey());
        if (frame.isDegenerate()) {
            return MeasurementResult.undefined(key.standardKey(), SectionIds.encode(id), warnings.snapshot(),
                                               FailureReason.DEGEN_FAIL);
        }
        var axis = frame.axis();
        double extent = axis.extent();
        double base = extent * config.getExtentToleranceFraction();
        double tolerance = base;
        if (key.isAdaptive()) {
            tolerance = Math.max(config.getExtentMinTolerance(),
                                 Math.min(base, extent * config.getExtentMaxToleranceFraction()));
            if (tolerance > base) {
                warnings.add(WarningCode.SLICE_THICKNESS_ADJUSTED);
            }
        }
        double target = axis.height(key.fraction());
        var slicer = frame.slicer();
        double plane = target;
        if (slicer.count(plane, tolerance) < config.getMinSlicePoints() && key.isAdaptive()) {
            double shifted = nearestValidPlane(slicer, axis, target, tolerance);
            if (!Double.isNaN(shifted)) {
                plane = shifted;
                warnings.add(WarningCode.NEAREST_VALID_PLANE_FALLBACK);
                id.put("plane_shift", Math.abs(shifted - target));
            }
        }
        id.put("fraction", key.fraction());
        id.put("plane_value", plane);
        id.put("tolerance", tolerance);
        var band = slicer.slice(plane, tolerance);
        if (band.isDownsampled()) {
            warnings.add(WarningCode.DOWNSAMPLED);
        }
        if (band.size() < config.getMinSlicePoints()) {
            warnings.add(WarningCode.CROSS_SECTION_NOT_FOUND);
            return MeasurementResult.undefined(key.standardKey(), SectionIds.encode(id), warnings.snapshot(),
                                               FailureReason.CROSS_SECTION_NOT_FOUND);
        }
        var center = config.getCenterReference() == CenterReference.SLICE_CENTROID ? band.points().centroid()
                                                                                     : slicer.bodyCenter();
        var separation = ComponentSeparator.of(config).separate(band.points(), center, false);
        if (!separation.isPassed()) {
            warnings.add(WarningCode.CANDIDATE_FAIL, separation.failure().reason());
            return MeasurementResult.undefined(key.standardKey(), SectionIds.encode(id), warnings.snapshot(),
                                               separation.failure().reason());
        }
        var selector = new TorsoSelector(config.getTieEpsilon(), config.getTieBreakOrder());
        var selection = selector.select(separation.value().components());
        if (selection.tieBroken()) {
            warnings.add(WarningCode.TORSO_TIEBREAK_USED);
        }
        var points = selection.component().points();
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < points.size(); i++) {
            double c = key.isWidth() ? points.u(i) : points.v(i);
            min = Math.min(min, c);
            max = Math.max(max, c);
        }
        id.put("components", separation.value().count());
        id.put("connectivity", separation.value().connectivity());
        id.put("selection_criterion", selection.criterion().label());
        id.put("slice_points", band.size());
        double value = max - min;
        log.debug("{} = {} at plane {} tolerance {}", key, value, plane, tolerance);
        return new MeasurementResult(key.standardKey(), value, SectionIds.encode(id), METHOD_TAG, warnings.snapshot(),
                                     null);
    }

    /**
     * Scan outward from the target in fixed steps, below before above at equal shift
     *
     * @return the nearest populated plane within the window, or NaN
     */
    private double nearestValidPlane(CrossSectionSlicer slicer, AxisEstimate axis, double target, double tolerance) {
        int steps = (int) Math.floor(config.getNearestPlaneWindow() / config.getNearestPlaneStep() + 1e-9);
        for (int k = 1; k <= steps; k++) {
            FailureClassifier.checkInterrupted("Nearest plane search");
            double shift = k * config.getNearestPlaneStep();
            for (var candidate : new double[] { target - shift, target + shift }) {
                if (candidate >= axis.min() && candidate <= axis.max()
                && slicer.count(candidate, tolerance) >= config.getMinSlicePoints()) {
                    return candidate;
                }
            }
        }
        return Double.NaN;
    }
}
