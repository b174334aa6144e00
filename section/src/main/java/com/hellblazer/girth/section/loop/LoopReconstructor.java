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
package com.hellblazer.girth.section.loop;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hellblazer.girth.section.failure.FailureClassifier;
import com.hellblazer.girth.section.failure.FailureReason;
import com.hellblazer.girth.section.failure.SectionStage;
import com.hellblazer.girth.section.failure.StageResult;
import com.hellblazer.girth.section.failure.WarningLog;
import com.hellblazer.girth.section.geometry.ConvexHull2d;
import com.hellblazer.girth.section.geometry.Loop;
import com.hellblazer.girth.section.geometry.PlanarPoints;

/**
 * Drives the boundary strategies in order until one produces a loop. The primary strategy runs first unless the
 * caller forces the fallbacks (a slice that was expected to separate but did not). Every failed attempt records
 * exactly one qualified warning; the successful strategy's tag becomes the method tag. A strategy that throws is
 * recorded as failing with {@link FailureReason#EXCEPTION} and the chain continues.
 * <p>
 * A built loop is only accepted when its perimeter covers at least {@code minHullCoverage} of the component's convex
 * hull perimeter. A loop through all of the hull's vertices is never shorter than the hull, so a shorter one has cut
 * across part of the outline and is rejected with {@link FailureReason#INCOMPLETE_BOUNDARY}. A strategy that trims
 * outliers is held to the hull of its own vertices instead. Accepted loops carry their quality facts: area, perimeter,
 * shape ratio, simplicity, angular gap and hull coverage.
 *
 * @author hal.hildebrand
 */
public class LoopReconstructor {
    public static final String LOOP_AREA          = "loop_area_m2";
    public static final String LOOP_HULL_COVERAGE = "loop_hull_coverage";
    public static final String LOOP_MAX_GAP       = "loop_max_gap";
    public static final String LOOP_PERIMETER     = "loop_perimeter_m";
    public static final String LOOP_SHAPE_RATIO   = "loop_shape_ratio";
    public static final String LOOP_SIMPLE        = "loop_simple";

    private static final Logger log = LoggerFactory.getLogger(LoopReconstructor.class);

    /**
     * The loop's perimeter as a fraction of the perimeter of the convex hull of the reference points; 1 when that hull
     * is degenerate
     */
    static double hullCoverage(Loop loop, PlanarPoints reference, double dedupeEpsilon) {
        var hull = ConvexHull2d.hullLoop(reference, dedupeEpsilon);
        if (hull == null || !(hull.perimeter() > 0.0)) {
            return 1.0;
        }
        return loop.perimeter() / hull.perimeter();
    }

    public static LoopReconstructor defaultChain() {
        return new LoopReconstructor(new PolarAngleStrategy(),
                                     List.of(new AlphaShapeStrategy(), new SecondaryBoundaryStrategy(),
                                             new ClusterTrimStrategy()),
                                     ConvexHullStrategy.singleComponent(), ConvexHullStrategy.multiComponent());
    }

    private final List<BoundaryStrategy> fallbacks;
    private final BoundaryStrategy       multiComponentResort;
    private final BoundaryStrategy       primary;
    private final BoundaryStrategy       singleComponentResort;

    public LoopReconstructor(BoundaryStrategy primary, List<BoundaryStrategy> fallbacks,
                             BoundaryStrategy singleComponentResort, BoundaryStrategy multiComponentResort) {
        this.primary = primary;
        this.fallbacks = List.copyOf(fallbacks);
        this.singleComponentResort = singleComponentResort;
        this.multiComponentResort = multiComponentResort;
    }

    /**
     * @param forceFallback skip the primary strategy
     * @param warnings      receives the failure codes of every strategy tried and the flag of the one that succeeded
     */
    public StageResult<Reconstruction> reconstruct(BoundaryInput input, boolean forceFallback, WarningLog warnings) {
        if (!forceFallback) {
            var built = attempt(primary, input, warnings);
            if (built != null) {
                return StageResult.passed(built);
            }
        }
        for (var strategy : fallbacks) {
            var built = attempt(strategy, input, warnings);
            if (built != null) {
                return StageResult.passed(built);
            }
        }
        var built = attempt(input.singleComponent() ? singleComponentResort : multiComponentResort, input, warnings);
        if (built != null) {
            return StageResult.passed(built);
        }
        return StageResult.halted(SectionStage.LOOP_RECONSTRUCTION, FailureReason.NOT_CLOSED_LOOP);
    }

    private Reconstruction attempt(BoundaryStrategy strategy, BoundaryInput input, WarningLog warnings) {
        FailureClassifier.checkInterrupted(strategy.tag());
        StrategyOutcome outcome;
        try {
            outcome = strategy.attempt(input);
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Boundary strategy {} failed", strategy.tag(), e);
            outcome = StrategyOutcome.failed(FailureReason.EXCEPTION);
        }
        if (outcome instanceof StrategyOutcome.Built built) {
            var loop = built.loop();
            double coverage = hullCoverage(loop, strategy.trimsOutliers() ? loop.points() : input.points(),
                                           input.config().getDedupeEpsilon());
            if (coverage < input.config().getMinHullCoverage()) {
                log.trace("Boundary strategy {} built {} covering {} of the hull", strategy.tag(), loop, coverage);
                warnings.add(strategy.failureCode(), FailureReason.INCOMPLETE_BOUNDARY);
                return null;
            }
            if (strategy.usedFlag() != null) {
                warnings.add(strategy.usedFlag());
            }
            log.trace("Boundary strategy {} built {}", strategy.tag(), loop);
            var facts = new HashMap<String, Object>(built.facts());
            facts.putAll(loopFacts(loop, coverage));
            return new Reconstruction(loop, strategy.tag(), facts);
        }
        var failed = (StrategyOutcome.Failed) outcome;
        warnings.add(strategy.failureCode(), failed.reason());
        return null;
    }

    private Map<String, Object> loopFacts(Loop loop, double coverage) {
        var facts = new HashMap<String, Object>();
        facts.put(LOOP_AREA, loop.area());
        facts.put(LOOP_HULL_COVERAGE, coverage);
        facts.put(LOOP_MAX_GAP, loop.maxAngularGap());
        facts.put(LOOP_PERIMETER, loop.perimeter());
        facts.put(LOOP_SHAPE_RATIO, loop.shapeRatio());
        facts.put(LOOP_SIMPLE, loop.isSimple());
        return facts;
    }
}
