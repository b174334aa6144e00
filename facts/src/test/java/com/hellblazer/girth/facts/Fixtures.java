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

import java.util.ArrayList;
import java.util.List;

import com.hellblazer.girth.facts.CaseOutcome.Status;
import com.hellblazer.girth.section.MeasurementResult;
import com.hellblazer.girth.section.VertexCloud;
import com.hellblazer.girth.section.failure.FailureReason;

/**
 * Bodies and hand built outcomes for the batch tests
 *
 * @author hal.hildebrand
 */
final class Fixtures {
    static final int POINTS_PER_RING = 160;

    /**
     * Rings about the Y axis every centimeter from 0 to height
     */
    static VertexCloud cylinder(double radius, double height) {
        var vertices = new ArrayList<float[]>();
        int rings = (int) Math.round(height / 0.01);
        for (int i = 0; i <= rings; i++) {
            for (int j = 0; j < POINTS_PER_RING; j++) {
                double angle = 2.0 * Math.PI * j / POINTS_PER_RING;
                vertices.add(new float[] { (float) (radius * Math.cos(angle)), (float) (i * 0.01),
                                           (float) (radius * Math.sin(angle)) });
            }
        }
        return VertexCloud.of(vertices.toArray(new float[0][]));
    }

    /**
     * Three results over two measured cases plus a contract violation
     */
    static BatchReport report() {
        var waist = new MeasurementResult("WAIST_CIRC_M", 0.8, "{}", "polar_angle", List.of("MIN_SEARCH_USED"), null);
        var emptyWaist = MeasurementResult.undefined("WAIST_CIRC_M", "{}",
                                                     List.of("MIN_SEARCH_USED", "EMPTY_CANDIDATES",
                                                             "CANDIDATE_FAIL:TOO_FEW_SLICE_POINTS"),
                                                     FailureReason.DEGEN_FAIL);
        var hip = new MeasurementResult("HIP_CIRC_M", 1.0, "{}", "alpha_shape",
                                        List.of("PRIMARY_REJECTED:NOT_CLOSED_LOOP"), null);
        return new BatchReport(List.of(CaseOutcome.measured("a", List.of(waist, hip)),
                                       CaseOutcome.measured("b", List.of(emptyWaist)),
                                       new CaseOutcome("c", Status.CONTRACT_VIOLATION, List.of(), "bad vertices")),
                               12);
    }

    private Fixtures() {
    }
}
