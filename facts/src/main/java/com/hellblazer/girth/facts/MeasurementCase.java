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
package com.hellblazer.girth.facts;

import java.util.function.Supplier;

import com.hellblazer.girth.section.VertexCloud;

/**
 * One body to measure. The cloud is produced lazily on the worker that measures the case, so malformed vertex data
 * surfaces as a contract violation of that case alone.
 *
 * @author hal.hildebrand
 */
public record MeasurementCase(String caseId, Supplier<VertexCloud> source) {

    public MeasurementCase {
        if (caseId == null || caseId.isBlank()) {
            throw new IllegalArgumentException("Case id is required");
        }
        if (source == null) {
            throw new IllegalArgumentException("Vertex source is required for case " + caseId);
        }
    }

    /**
     * @param vertices an (N,3) vertex array in meters, validated when the case is measured
     */
    public static MeasurementCase of(String caseId, float[][] vertices) {
        return new MeasurementCase(caseId, () -> VertexCloud.of(vertices));
    }

    public static MeasurementCase of(String caseId, VertexCloud cloud) {
        return new MeasurementCase(caseId, () -> cloud);
    }

    VertexCloud cloud() {
        var cloud = source.get();
        if (cloud == null) {
            throw new IllegalArgumentException("No vertices for case " + caseId);
        }
        return cloud;
    }
}
