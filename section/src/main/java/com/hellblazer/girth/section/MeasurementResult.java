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

import java.util.List;

import com.hellblazer.girth.section.failure.FailureReason;

/**
 * The facts reported for one measurement. {@code value} is NaN exactly when the measurement is undefined, in which
 * case {@code failureReason} says why. Warnings are in the order they were raised and are never removed.
 *
 * @param value         circumference in meters, or NaN
 * @param sectionId     deterministic JSON identifying the chosen section
 * @param methodTag     the boundary strategy that produced the loop, {@value #NO_METHOD} when none did
 * @param failureReason null unless value is NaN
 * @author hal.hildebrand
 */
public record MeasurementResult(String key, double value, String sectionId, String methodTag, List<String> warnings,
                                FailureReason failureReason) {
    public static final String NO_METHOD = "none";

    public MeasurementResult {
        warnings = List.copyOf(warnings);
        if (Double.isNaN(value) == (failureReason == null)) {
            throw new IllegalArgumentException("A failure reason is required exactly when the value is NaN: " + value
            + ", " + failureReason);
        }
    }

    public static MeasurementResult undefined(String key, String sectionId, List<String> warnings,
                                              FailureReason reason) {
        return new MeasurementResult(key, Double.NaN, sectionId, NO_METHOD, warnings, reason);
    }

    public boolean hasWarning(String code) {
        return warnings.contains(code);
    }

    public boolean isDefined() {
        return failureReason == null;
    }
}
