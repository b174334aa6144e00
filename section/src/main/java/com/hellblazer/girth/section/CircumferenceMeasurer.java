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

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hellblazer.girth.section.config.SectionConfig;
import com.hellblazer.girth.section.failure.FailureClassifier;
import com.hellblazer.girth.section.failure.FailureReason;
import com.hellblazer.girth.section.failure.WarningCode;
import com.hellblazer.girth.section.failure.WarningLog;
import com.hellblazer.girth.section.select.MeasurementSelector;
import com.hellblazer.girth.section.select.RegionPolicy;
import com.hellblazer.girth.section.select.SectionPipeline;
import com.hellblazer.girth.section.select.SelectionStatistic;

/**
 * Landmark free circumference measurement. The long axis is the dimension of largest extent; candidate slices
 * perpendicular to it are cut inside each key's search region, the torso component of each slice is reconstructed into
 * a closed loop, and the key's selection statistic picks the canonical perimeter.
 * <p>
 * Every call is a pure function of the cloud, key, configuration and case id: no state is kept between calls and a
 * measurer may be shared between threads. Geometric failure is reported as a NaN value with a failure reason and
 * warnings; only contract violations throw. An interrupted measurement stops between keys or candidates with a
 * {@link java.util.concurrent.CancellationException}.
 * <p>
 * The section id records every candidate of the region search, with its perimeter or failure and its own warnings;
 * the result's warnings are those of the chosen candidate.
 *
 * @author hal.hildebrand
 */
public class CircumferenceMeasurer {
    private static final Logger log = LoggerFactory.getLogger(CircumferenceMeasurer.class);

    private final SectionConfig       config;
    private final MeasurementSelector selector = new MeasurementSelector();

    public CircumferenceMeasurer() {
        this(SectionConfig.defaults());
    }

    public CircumferenceMeasurer(SectionConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("Configuration is required");
        }
        this.config = config.copy();
    }

    public MeasurementResult measure(VertexCloud cloud, MeasurementKey key) {
        return measure(cloud, key, null);
    }

    /**
     * @param caseId identifies the case for the deterministic choice of alpha neighborhood; may be null
     */
    public MeasurementResult measure(VertexCloud cloud, MeasurementKey key, String caseId) {
        return measureAll(cloud, List.of(requireKey(key)), caseId).get(key);
    }

    /**
     * Measure several keys of one body, sharing the axis estimate and the sorted slicer between them
     */
    public Map<MeasurementKey, MeasurementResult> measureAll(VertexCloud cloud, Collection<MeasurementKey> keys,
                                                            String caseId) {
        if (keys == null) {
            throw new IllegalArgumentException("Measurement keys are required");
        }
        keys.forEach(CircumferenceMeasurer::requireKey);
        var frame = BodyFrame.prepare(cloud, config);
        var pipeline = frame.isDegenerate() ? null : new SectionPipeline(frame.slicer(), config, caseId);
        var results = new EnumMap<MeasurementKey, MeasurementResult>(MeasurementKey.class);
        for (var key : keys) {
            FailureClassifier.checkInterrupted(key);
            var result = frame.isDegenerate() ? degenerate(key, frame) : measure(key, frame, pipeline);
            log.debug("{} {} = {} via {} {}", caseId, key, result.value(), result.methodTag(), result.warnings());
            results.put(key, result);
        }
        return results;
    }

    private MeasurementResult degenerate(MeasurementKey key, BodyFrame frame) {
        var id = frame.idFields();
        id.put("key", key.standardKey());
        return MeasurementResult.undefined(key.standardKey(), SectionIds.encode(id), frame.warnings().snapshot(),
                                           FailureReason.DEGEN_FAIL);
    }

    private MeasurementResult measure(MeasurementKey key, BodyFrame frame, SectionPipeline pipeline) {
        RegionPolicy policy = config.getPolicyTable().policy(key);
        var warnings = frame.warnings();
        if (policy.statistic() == SelectionStatistic.MIN) {
            warnings.add(WarningCode.MIN_SEARCH_USED);
        }
        var id = frame.idFields();
        id.put("key", key.standardKey());
        id.put("region", policy.region());
        id.put("region_range", List.of(policy.startFraction(), policy.endFraction()));
        id.put("statistic", policy.statistic().label());
        id.put("candidate_count", config.getCandidateCount());
        id.put("center_reference", config.getCenterReference().name());

        var selection = selector.select(policy, frame.axis(), pipeline);
        var candidates = new ArrayList<Map<String, Object>>();
        selection.candidates().forEach(c -> candidates.add(c.fields()));
        id.put("candidates", candidates);
        if (selection.isEmpty()) {
            warnings.add(WarningCode.EMPTY_CANDIDATES);
            var all = new ArrayList<>(warnings.snapshot());
            all.addAll(selection.candidateFailures());
            id.put("valid_candidates", 0);
            return MeasurementResult.undefined(key.standardKey(), SectionIds.encode(id), all,
                                               FailureReason.DEGEN_FAIL);
        }
        var chosen = selection.chosen();
        var reconstruction = chosen.reconstruction();
        id.put("candidate_index", chosen.index());
        id.put("plane_value", chosen.height());
        id.put("tolerance", chosen.tolerance());
        id.put("slice_points", chosen.slicePoints());
        id.put("components", chosen.componentCount());
        id.put("component_points", chosen.componentPoints());
        id.put("connectivity", chosen.connectivity());
        id.put("selection_criterion", chosen.criterion().label());
        id.put("valid_candidates", selection.validCount());
        id.put("method", reconstruction.methodTag());
        if (!reconstruction.facts().isEmpty()) {
            id.put("method_facts", reconstruction.facts());
        }
        if (selection.ambiguous()) {
            id.put("tie", "lowest_index");
        }

        var codes = new ArrayList<>(warnings.snapshot());
        codes.addAll(selection.warnings());
        double perimeter = chosen.perimeter();
        var range = new WarningLog();
        if (perimeter < config.getPerimeterSmall()) {
            range.add(WarningCode.PERIMETER_SMALL);
        }
        if (perimeter > config.getPerimeterLarge()) {
            range.add(WarningCode.PERIMETER_LARGE);
            range.add(WarningCode.UNIT_FAIL, FailureReason.PERIMETER_LARGE);
        }
        codes.addAll(range.snapshot());
        return new MeasurementResult(key.standardKey(), perimeter, SectionIds.encode(id), reconstruction.methodTag(),
                                     codes, null);
    }

    private static MeasurementKey requireKey(MeasurementKey key) {
        if (key == null) {
            throw new IllegalArgumentException("Measurement key is required");
        }
        return key;
    }
}
