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

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.hellblazer.girth.section.MeasurementResult;

/**
 * Writes batch facts as JSON: the {@link FactsSummary} as one indented document, the individual results as JSON
 * lines. Property names are snake case. An undefined value is written as {@code null}, never as a number.
 *
 * @author hal.hildebrand
 */
public class FactsWriter {
    private static final Logger log = LoggerFactory.getLogger(FactsWriter.class);

    private final ObjectMapper lines;
    private final ObjectMapper pretty;

    public FactsWriter() {
        lines = new ObjectMapper().setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                                  .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
        pretty = lines.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * One row per result of a measured case, one row per case that was not measured, in report order
     */
    public void writeResults(BatchReport report, Path path) throws IOException {
        createParent(path);
        try (BufferedWriter out = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            for (var outcome : report.outcomes()) {
                if (!outcome.isMeasured()) {
                    out.write(lines.writeValueAsString(caseRow(outcome)));
                    out.newLine();
                    continue;
                }
                for (var result : outcome.results()) {
                    out.write(lines.writeValueAsString(resultRow(outcome, result)));
                    out.newLine();
                }
            }
        }
        log.info("Wrote results of {} cases to {}", report.size(), path);
    }

    public void writeSummary(FactsSummary summary, Path path) throws IOException {
        createParent(path);
        pretty.writeValue(path.toFile(), summary);
        log.info("Wrote facts summary of {} cases to {}", summary.cases(), path);
    }

    public String toJson(FactsSummary summary) throws JsonProcessingException {
        return pretty.writeValueAsString(summary);
    }

    Map<String, Object> caseRow(CaseOutcome outcome) {
        var row = new LinkedHashMap<String, Object>();
        row.put("case_id", outcome.caseId());
        row.put("status", outcome.status().name());
        row.put("error", outcome.error());
        return row;
    }

    Map<String, Object> resultRow(CaseOutcome outcome, MeasurementResult result) {
        var row = new LinkedHashMap<String, Object>();
        row.put("case_id", outcome.caseId());
        row.put("status", outcome.status().name());
        row.put("key", result.key());
        row.put("value", result.isDefined() ? result.value() : null);
        row.put("section_id", result.sectionId());
        row.put("method_tag", result.methodTag());
        row.put("warnings", result.warnings());
        row.put("failure_reason", result.isDefined() ? null : result.failureReason().name());
        return row;
    }

    private void createParent(Path path) throws IOException {
        var parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }
}
