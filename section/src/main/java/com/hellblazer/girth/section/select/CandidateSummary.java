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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What happened at one candidate height, kept for every candidate so the warnings of those not chosen are not lost
 *
 * @param perimeter NaN when the candidate failed
 * @param outcome   the method tag of a valid candidate, the stage failure code of a failed one
 * @author hal.hildebrand
 */
public record CandidateSummary(int index, double height, double perimeter, String outcome, List<String> warnings) {

    public CandidateSummary {
        warnings = List.copyOf(warnings);
    }

    public boolean isValid() {
        return !Double.isNaN(perimeter);
    }

    /**
     * The summary as section id fields
     */
    public Map<String, Object> fields() {
        var fields = new LinkedHashMap<String, Object>();
        fields.put("index", index);
        fields.put("height", height);
        if (isValid()) {
            fields.put("perimeter", perimeter);
            fields.put("method", outcome);
        } else {
            fields.put("failure", outcome);
        }
        fields.put("warnings", warnings);
        return fields;
    }
}
