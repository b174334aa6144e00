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

import java.util.List;

import com.hellblazer.girth.section.MeasurementResult;

/**
 * What happened to one case of a batch. Only a {@link Status#MEASURED} case carries results; the others carry the
 * reason they have none.
 *
 * @author hal.hildebrand
 */
public record CaseOutcome(String caseId, Status status, List<MeasurementResult> results, String error) {

    public enum Status {
        /** Every configured key was measured; individual values may still be NaN */
        MEASURED,
        /** The case's input broke the measurement contract */
        CONTRACT_VIOLATION,
        /** The case exceeded its time budget, or never got a worker */
        CANCELLED,
        /** An unexpected failure escaped the measurers */
        FAILED;
    }

    public CaseOutcome {
        results = List.copyOf(results);
    }

    public static CaseOutcome cancelled(String caseId, long timeoutMs) {
        return new CaseOutcome(caseId, Status.CANCELLED, List.of(), "Exceeded " + timeoutMs + " ms");
    }

    public static CaseOutcome contractViolation(String caseId, String error) {
        return new CaseOutcome(caseId, Status.CONTRACT_VIOLATION, List.of(), error);
    }

    public static CaseOutcome failed(String caseId, String error) {
        return new CaseOutcome(caseId, Status.FAILED, List.of(), error);
    }

    public static CaseOutcome notStarted(String caseId, long queueTimeoutMs) {
        return new CaseOutcome(caseId, Status.CANCELLED, List.of(), "Not started within " + queueTimeoutMs + " ms");
    }

    public static CaseOutcome measured(String caseId, List<MeasurementResult> results) {
        return new CaseOutcome(caseId, Status.MEASURED, results, null);
    }

    public boolean isMeasured() {
        return status == Status.MEASURED;
    }
}
