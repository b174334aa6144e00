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

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

import com.hellblazer.girth.section.failure.WarningCode;

/**
 * Facts-only aggregate of a batch: how often each key came out undefined, which warnings were raised, which boundary
 * methods produced the loops and why measurements failed. Nothing here judges a result; it only counts.
 * <p>
 * Every map is sorted by key so the summary serializes identically for identical batches.
 *
 * @param cases          number of cases submitted
 * @param caseStatus     case count per {@link CaseOutcome.Status}
 * @param results        number of measurement results, over the measured cases
 * @param keys           per measurement key facts
 * @param warnings       occurrences of each full warning code
 * @param warningFamily  occurrences of each warning family, the code up to its first ':'
 * @param methodUsage    results per method tag; sums to {@code results}
 * @param failureReasons undefined results per failure reason
 * @author hal.hildebrand
 */
public record FactsSummary(int cases, Map<String, Integer> caseStatus, int results, Map<String, KeyFacts> keys,
                           Map<String, Integer> warnings, Map<String, Integer> warningFamily,
                           Map<String, Integer> methodUsage, Map<String, Integer> failureReasons) {

    /**
     * @param processed results for this key
     * @param undefined results whose value is NaN
     * @param nanRate   undefined / processed, 0 when nothing was processed
     */
    public record KeyFacts(int processed, int undefined, double nanRate) {
    }

    public FactsSummary {
        caseStatus = Collections.unmodifiableMap(new TreeMap<>(caseStatus));
        keys = Collections.unmodifiableMap(new TreeMap<>(keys));
        warnings = Collections.unmodifiableMap(new TreeMap<>(warnings));
        warningFamily = Collections.unmodifiableMap(new TreeMap<>(warningFamily));
        methodUsage = Collections.unmodifiableMap(new TreeMap<>(methodUsage));
        failureReasons = Collections.unmodifiableMap(new TreeMap<>(failureReasons));
    }

    public static FactsSummary of(BatchReport report) {
        var caseStatus = new TreeMap<String, Integer>();
        var processed = new TreeMap<String, Integer>();
        var undefined = new TreeMap<String, Integer>();
        var warnings = new TreeMap<String, Integer>();
        var families = new TreeMap<String, Integer>();
        var methods = new TreeMap<String, Integer>();
        var reasons = new TreeMap<String, Integer>();
        int results = 0;
        for (var outcome : report.outcomes()) {
            caseStatus.merge(outcome.status().name(), 1, Integer::sum);
            for (var result : outcome.results()) {
                results++;
                processed.merge(result.key(), 1, Integer::sum);
                undefined.merge(result.key(), result.isDefined() ? 0 : 1, Integer::sum);
                methods.merge(result.methodTag(), 1, Integer::sum);
                if (!result.isDefined()) {
                    reasons.merge(result.failureReason().name(), 1, Integer::sum);
                }
                for (var code : result.warnings()) {
                    warnings.merge(code, 1, Integer::sum);
                    families.merge(WarningCode.family(code), 1, Integer::sum);
                }
            }
        }
        var keys = new TreeMap<String, KeyFacts>();
        processed.forEach((key, count) -> {
            int nan = undefined.get(key);
            keys.put(key, new KeyFacts(count, nan, count == 0 ? 0.0 : (double) nan / count));
        });
        return new FactsSummary(report.size(), caseStatus, results, keys, warnings, families, methods, reasons);
    }

    /**
     * @return the count for a warning family, 0 when it never occurred
     */
    public int family(WarningCode code) {
        return warningFamily.getOrDefault(code.name(), 0);
    }
}
