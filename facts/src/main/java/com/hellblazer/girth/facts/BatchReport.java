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
import java.util.Optional;

/**
 * The outcomes of a batch in the order the cases were submitted
 *
 * @author hal.hildebrand
 */
public record BatchReport(List<CaseOutcome> outcomes, long elapsedMs) {

    public BatchReport {
        outcomes = List.copyOf(outcomes);
    }

    public long count(CaseOutcome.Status status) {
        return outcomes.stream().filter(o -> o.status() == status).count();
    }

    public Optional<CaseOutcome> outcome(String caseId) {
        return outcomes.stream().filter(o -> o.caseId().equals(caseId)).findFirst();
    }

    public int size() {
        return outcomes.size();
    }
}
