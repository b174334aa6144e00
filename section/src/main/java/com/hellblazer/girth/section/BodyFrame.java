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

import java.util.Map;
import java.util.TreeMap;

import com.hellblazer.girth.section.config.SectionConfig;
import com.hellblazer.girth.section.failure.FailureReason;
import com.hellblazer.girth.section.failure.WarningCode;
import com.hellblazer.girth.section.failure.WarningLog;

/**
 * The per-cloud work shared by every measurement of one body: input sanity facts, the long axis and the pre-sorted
 * slicer. A degenerate frame (too few vertices, no extent) carries the warning that explains it and no slicer.
 *
 * @author hal.hildebrand
 */
final class BodyFrame {

    static BodyFrame prepare(VertexCloud cloud, SectionConfig config) {
        if (cloud == null) {
            throw new IllegalArgumentException("Vertex cloud is required");
        }
        var warnings = new WarningLog();
        if (cloud.size() < 3) {
            warnings.add(WarningCode.INSUFFICIENT_VERTICES);
            return new BodyFrame(null, null, warnings, Map.of("vertices", cloud.size()));
        }
        if (cloud.maxAbs() > config.getUnitMaxAbs()) {
            warnings.add(WarningCode.UNIT_FAIL, FailureReason.SCALE_SUSPECTED);
        }
        var axis = AxisEstimator.estimate(cloud);
        var id = new TreeMap<String, Object>();
        id.put("axis", axis.axis().name());
        id.put("axis_reason", axis.reason());
        id.put("axis_min", axis.min());
        id.put("axis_max", axis.max());
        if (axis.extent() < config.getMinAxisExtent()) {
            warnings.add(WarningCode.BODY_AXIS_TOO_SHORT);
            return new BodyFrame(axis, null, warnings, id);
        }
        return new BodyFrame(axis, new CrossSectionSlicer(cloud, axis.axis(), config.getMaxSlicePoints()),
                             warnings, id);
    }

    private final AxisEstimate        axis;
    private final Map<String, Object> idFields;
    private final CrossSectionSlicer  slicer;
    private final WarningLog          warnings;

    private BodyFrame(AxisEstimate axis, CrossSectionSlicer slicer, WarningLog warnings,
                      Map<String, Object> idFields) {
        this.axis = axis;
        this.slicer = slicer;
        this.warnings = warnings;
        this.idFields = idFields;
    }

    AxisEstimate axis() {
        return axis;
    }

    /**
     * @return a fresh, mutable copy of the section id fields describing the frame
     */
    Map<String, Object> idFields() {
        return new TreeMap<>(idFields);
    }

    boolean isDegenerate() {
        return slicer == null;
    }

    CrossSectionSlicer slicer() {
        return slicer;
    }

    /**
     * @return a fresh log seeded with the frame's warnings
     */
    WarningLog warnings() {
        return new WarningLog().addAll(warnings);
    }
}
