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

import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hellblazer.girth.section.config.SectionConfig;
import com.hellblazer.girth.section.failure.FailureClassifier;
import com.hellblazer.girth.section.failure.FailureReason;
import com.hellblazer.girth.section.failure.WarningCode;

/**
 * Straight line heights along the long axis. The body height is the bounding box span of the cloud along that axis;
 * crotch and knee heights scale it by their key's fraction and always carry their estimation warning. Spans along all
 * three coordinate axes are recorded in the section id for debugging.
 *
 * @author hal.hildebrand
 */
public class HeightMeasurer {
    public static final String METHOD_TAG = "bbox_span";
    public static final String PATH_TYPE  = "straight_line";

    private static final Logger log = LoggerFactory.getLogger(HeightMeasurer.class);

    private final SectionConfig config;

    public HeightMeasurer() {
        this(SectionConfig.defaults());
    }

    public HeightMeasurer(SectionConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("Configuration is required");
        }
        this.config = config.copy();
    }

    public MeasurementResult measure(VertexCloud cloud, HeightKey key) {
        if (key == null) {
            throw new IllegalArgumentException("Height key is required");
        }
        FailureClassifier.checkInterrupted(key);
        var frame = BodyFrame.prepare(cloud, config);
        var warnings = frame.warnings();
        var id = frame.idFields();
        id.put("key", key.standardKey());
        id.put("method_path_type", PATH_TYPE);
        if (key.side() != null) {
            id.put("canonical_side", key.side());
        }
        if (key.isEstimated()) {
            warnings.add(key == HeightKey.KNEE_HEIGHT ? WarningCode.KNEE_ESTIMATED : WarningCode.CROTCH_ESTIMATED);
        }
        if (frame.isDegenerate()) {
            return MeasurementResult.undefined(key.standardKey(), SectionIds.encode(id), warnings.snapshot(),
                                               FailureReason.DEGEN_FAIL);
        }
        var spans = spans(cloud);
        var longest = Axis.X;
        for (var axis : Axis.values()) {
            id.put("bbox_span_" + axis.name().toLowerCase(Locale.ROOT), spans[axis.index()]);
            if (spans[axis.index()] > spans[longest.index()]) {
                longest = axis;
            }
        }
        id.put("bbox_longest_axis", longest.name());
        id.put("bbox_longest_span_m", spans[longest.index()]);
        id.put("fraction", key.fraction());
        double height = frame.axis().extent();
        if (height < config.getHeightSmall()) {
            warnings.add(WarningCode.HEIGHT_SMALL);
        } else if (height > config.getHeightLarge()) {
            warnings.add(WarningCode.HEIGHT_LARGE);
        }
        double value = height * key.fraction();
        log.debug("{} = {} from span {} along {}", key, value, height, frame.axis().axis());
        return new MeasurementResult(key.standardKey(), value, SectionIds.encode(id), METHOD_TAG, warnings.snapshot(),
                                     null);
    }

    private static double[] spans(VertexCloud cloud) {
        var spans = new double[3];
        for (int a = 0; a < 3; a++) {
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            for (int i = 0; i < cloud.size(); i++) {
                double c = cloud.coordinate(i, a);
                min = Math.min(min, c);
                max = Math.max(max, c);
            }
            spans[a] = max - min;
        }
        return spans;
    }
}
