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

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hellblazer.girth.section.AxisEstimate;
import com.hellblazer.girth.section.failure.FailureClassifier;
import com.hellblazer.girth.section.failure.WarningCode;
import com.hellblazer.girth.section.failure.WarningLog;

/**
 * Chooses the canonical cross section for one measurement. Candidate heights are spaced evenly over the policy's
 * region, both ends included, each cut with a half thickness of {@code toleranceFactor} times the spacing. Every
 * candidate runs the full {@link SectionPipeline}; the policy's statistic over the surviving perimeters names a
 * target and the candidate closest to it wins, the lowest index among equally close candidates.
 * <p>
 * The same routine serves every key; only the {@link RegionPolicy} differs. The search checks for interruption before
 * each candidate and stops with a {@link java.util.concurrent.CancellationException} once interrupted.
 *
 * @author hal.hildebrand
 */
public class MeasurementSelector {

    /**
     * The index of the chosen perimeter, -1 when none is valid, whether the choice was ambiguous and the statistic's
     * target
     */
    public record Choice(int index, boolean ambiguous, double target) {
        public boolean isEmpty() {
            return index < 0;
        }
    }

    /**
     * The outcome of a region search. When no candidate survived, {@code chosen} is null and
     * {@code candidateFailures} holds the distinct stage failure codes in first seen order. {@code warnings} are the
     * chosen candidate's; {@code candidates} summarizes every candidate, warnings included.
     */
    public record RegionSelection(CandidateSection chosen, List<String> warnings, List<String> candidateFailures,
                                  int candidateCount, int validCount, boolean ambiguous,
                                  List<CandidateSummary> candidates) {
        public RegionSelection {
            warnings = List.copyOf(warnings);
            candidateFailures = List.copyOf(candidateFailures);
            candidates = List.copyOf(candidates);
        }

        public boolean isEmpty() {
            return chosen == null;
        }
    }

    private static final Logger log = LoggerFactory.getLogger(MeasurementSelector.class);

    /**
     * Apply a statistic to candidate perimeters
     *
     * @param perimeters one entry per candidate, NaN for a failed candidate
     * @param epsilon    distances to the target within this of the best are ties
     */
    public static Choice choose(double[] perimeters, SelectionStatistic statistic, double epsilon) {
        var valid = new ArrayList<Double>();
        for (var p : perimeters) {
            if (!Double.isNaN(p)) {
                valid.add(p);
            }
        }
        if (valid.isEmpty()) {
            return new Choice(-1, false, Double.NaN);
        }
        var values = new double[valid.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = valid.get(i);
        }
        double target = statistic.target(values);
        int best = -1;
        double bestDistance = Double.POSITIVE_INFINITY;
        for (int i = 0; i < perimeters.length; i++) {
            if (Double.isNaN(perimeters[i])) {
                continue;
            }
            double distance = Math.abs(perimeters[i] - target);
            if (distance < bestDistance) {
                bestDistance = distance;
                best = i;
            }
        }
        int close = 0;
        for (var p : perimeters) {
            if (!Double.isNaN(p) && Math.abs(p - target) - bestDistance <= epsilon) {
                close++;
            }
        }
        return new Choice(best, close > 1, target);
    }

    /**
     * The candidate heights for a region
     */
    public static double[] heights(AxisEstimate axis, RegionPolicy policy, int count) {
        var result = new double[count];
        double start = axis.height(policy.startFraction());
        double step = spacing(axis, policy, count);
        for (int i = 0; i < count; i++) {
            result[i] = start + i * step;
        }
        return result;
    }

    /**
     * Distance between consecutive candidate heights; the whole region when there is a single candidate
     */
    public static double spacing(AxisEstimate axis, RegionPolicy policy, int count) {
        double start = axis.height(policy.startFraction());
        double end = axis.height(policy.endFraction());
        return (end - start) / Math.max(1, count - 1);
    }

    public RegionSelection select(RegionPolicy policy, AxisEstimate axis, SectionPipeline pipeline) {
        var config = pipeline.config();
        int count = config.getCandidateCount();
        var heights = heights(axis, policy, count);
        double tolerance = spacing(axis, policy, count) * config.getToleranceFactor();
        var perimeters = new double[count];
        var sections = new CandidateSection[count];
        var logs = new WarningLog[count];
        var outcomes = new String[count];
        var failures = new LinkedHashSet<String>();
        int valid = 0;
        for (int i = 0; i < count; i++) {
            FailureClassifier.checkInterrupted("Candidate " + i + " of " + policy.region());
            logs[i] = new WarningLog();
            var result = pipeline.evaluate(i, heights[i], tolerance, policy.separationExpected(), logs[i]);
            if (result.isPassed()) {
                sections[i] = result.value();
                perimeters[i] = sections[i].perimeter();
                outcomes[i] = sections[i].reconstruction().methodTag();
                valid++;
            } else {
                perimeters[i] = Double.NaN;
                outcomes[i] = result.failure().code();
                failures.add(outcomes[i]);
                log.trace("Candidate {} at {} failed: {}", i, heights[i], result.failure());
            }
        }
        var choice = choose(perimeters, policy.statistic(), config.getAmbiguityEpsilon());
        if (!choice.isEmpty() && choice.ambiguous()) {
            logs[choice.index()].add(WarningCode.REGION_AMBIGUOUS);
        }
        var candidates = new ArrayList<CandidateSummary>(count);
        for (int i = 0; i < count; i++) {
            candidates.add(new CandidateSummary(i, heights[i], perimeters[i], outcomes[i], logs[i].snapshot()));
        }
        if (choice.isEmpty()) {
            log.debug("No valid candidate in {} of {} heights, failures: {}", policy.region(), count, failures);
            return new RegionSelection(null, List.of(), new ArrayList<>(failures), count, 0, false, candidates);
        }
        log.debug("Selected candidate {} of {} ({} valid) in {}: {} target {}", choice.index(), count, valid,
                  policy.region(), perimeters[choice.index()], choice.target());
        return new RegionSelection(sections[choice.index()], logs[choice.index()].snapshot(),
                                   new ArrayList<>(failures), count, valid, choice.ambiguous(), candidates);
    }
}
