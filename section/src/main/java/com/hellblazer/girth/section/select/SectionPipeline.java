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

import javax.vecmath.Point2d;

import com.hellblazer.girth.section.CrossSectionSlicer;
import com.hellblazer.girth.section.SliceBand;
import com.hellblazer.girth.section.component.CenterReference;
import com.hellblazer.girth.section.component.ComponentSeparator;
import com.hellblazer.girth.section.component.SeparationResult;
import com.hellblazer.girth.section.component.Selection;
import com.hellblazer.girth.section.component.TorsoSelector;
import com.hellblazer.girth.section.config.SectionConfig;
import com.hellblazer.girth.section.failure.FailureClassifier;
import com.hellblazer.girth.section.failure.FailureReason;
import com.hellblazer.girth.section.failure.SectionStage;
import com.hellblazer.girth.section.failure.StageResult;
import com.hellblazer.girth.section.failure.WarningCode;
import com.hellblazer.girth.section.failure.WarningLog;
import com.hellblazer.girth.section.geometry.Loop;
import com.hellblazer.girth.section.loop.BoundaryInput;
import com.hellblazer.girth.section.loop.LoopReconstructor;
import com.hellblazer.girth.section.loop.Reconstruction;

/**
 * Runs one candidate height through slicing, component separation, torso selection, loop reconstruction and
 * perimeter computation. Each stage either hands its intermediate to the next or halts the candidate with an explicit
 * failure; nothing here throws for geometric reasons.
 *
 * @author hal.hildebrand
 */
public class SectionPipeline {

    private record Sliced(SliceBand band, Point2d center) {
    }

    private record Separated(Sliced sliced, SeparationResult separation) {
    }

    private record Selected(Separated separated, Selection selection) {
    }

    private record Reconstructed(Selected selected, Reconstruction reconstruction) {
    }

    private final String             caseId;
    private final SectionConfig      config;
    private final LoopReconstructor  reconstructor;
    private final ComponentSeparator separator;
    private final CrossSectionSlicer slicer;
    private final TorsoSelector      torsoSelector;

    /**
     * @param caseId the case id used to pick the alpha neighborhood, or null
     */
    public SectionPipeline(CrossSectionSlicer slicer, SectionConfig config, String caseId) {
        this(slicer, config, caseId, LoopReconstructor.defaultChain());
    }

    public SectionPipeline(CrossSectionSlicer slicer, SectionConfig config, String caseId,
                           LoopReconstructor reconstructor) {
        this.slicer = slicer;
        this.config = config;
        this.caseId = caseId;
        this.reconstructor = reconstructor;
        separator = ComponentSeparator.of(config);
        torsoSelector = new TorsoSelector(config.getTieEpsilon(), config.getTieBreakOrder());
    }

    public SectionConfig config() {
        return config;
    }

    /**
     * @param warnings receives this candidate's warnings; callers keep one log per candidate
     */
    public StageResult<CandidateSection> evaluate(int index, double height, double tolerance,
                                                  boolean separationExpected, WarningLog warnings) {
        return FailureClassifier.guard(SectionStage.CANDIDATE_GENERATION, () -> slice(height, tolerance, warnings))
                                .then(SectionStage.COMPONENT_SEPARATION,
                                      sliced -> separate(sliced, separationExpected, warnings))
                                .then(SectionStage.REGION_SELECTION, separated -> select(separated, warnings))
                                .then(SectionStage.LOOP_RECONSTRUCTION, selected -> reconstruct(selected, warnings))
                                .then(SectionStage.PERIMETER_COMPUTATION,
                                      reconstructed -> measure(index, reconstructed, warnings));
    }

    public CrossSectionSlicer slicer() {
        return slicer;
    }

    /**
     * Whether the measured component looks like a piece of a ring broken apart by sampling gaps: the slice has other
     * components and either the component holds only a small share of the slice, or its loop only barely winds
     * around its centroid
     */
    private boolean isFragment(Selected selected, Loop loop) {
        var separation = selected.separated().separation();
        if (separation.count() < 2) {
            return false;
        }
        int slicePoints = selected.separated().sliced().band().size();
        return selected.selection().component().size() < config.getFragmentShare() * slicePoints
        || loop.maxAngularGap() > config.getFragmentGap();
    }

    private StageResult<CandidateSection> measure(int index, Reconstructed reconstructed, WarningLog warnings) {
        var loop = reconstructed.reconstruction().loop();
        var perimeter = loop.perimeter();
        if (!Double.isFinite(perimeter) || perimeter <= 0.0) {
            return StageResult.halted(SectionStage.PERIMETER_COMPUTATION, FailureReason.NUMERIC_ERROR);
        }
        var selected = reconstructed.selected();
        if (isFragment(selected, loop)) {
            warnings.add(WarningCode.COMPONENT_FRAGMENTED);
        }
        var band = selected.separated().sliced().band();
        var separation = selected.separated().separation();
        return StageResult.passed(new CandidateSection(index, band.height(), band.tolerance(), band.size(),
                                                       separation.count(), separation.connectivity(),
                                                       selected.selection().component().size(),
                                                       selected.selection().criterion(),
                                                       reconstructed.reconstruction()));
    }

    private StageResult<Reconstructed> reconstruct(Selected selected, WarningLog warnings) {
        var separated = selected.separated();
        var sliced = separated.sliced();
        var separation = separated.separation();
        var input = new BoundaryInput(selected.selection().component().points(), sliced.center(),
                                      sliced.band().size(), caseId, config, separation.count() == 1);
        return reconstructor.reconstruct(input, separation.singleComponentOnly(), warnings)
                            .then(SectionStage.LOOP_RECONSTRUCTION,
                                  r -> StageResult.passed(new Reconstructed(selected, r)));
    }

    private StageResult<Selected> select(Separated separated, WarningLog warnings) {
        var selection = torsoSelector.select(separated.separation().components());
        if (selection.tieBroken()) {
            warnings.add(WarningCode.TORSO_TIEBREAK_USED);
        }
        return StageResult.passed(new Selected(separated, selection));
    }

    private StageResult<Separated> separate(Sliced sliced, boolean separationExpected, WarningLog warnings) {
        return separator.separate(sliced.band().points(), sliced.center(), separationExpected)
                        .then(SectionStage.COMPONENT_SEPARATION, separation -> {
                            if (separation.singleComponentOnly()) {
                                warnings.add(WarningCode.SINGLE_COMPONENT_ONLY);
                            }
                            return StageResult.passed(new Separated(sliced, separation));
                        });
    }

    private StageResult<Sliced> slice(double height, double tolerance, WarningLog warnings) {
        var band = slicer.slice(height, tolerance);
        if (band.isDownsampled()) {
            warnings.add(WarningCode.DOWNSAMPLED);
        }
        if (band.size() < config.getMinSlicePoints()) {
            return StageResult.halted(SectionStage.CANDIDATE_GENERATION, FailureReason.TOO_FEW_SLICE_POINTS);
        }
        var center = config.getCenterReference() == CenterReference.SLICE_CENTROID ? band.points().centroid()
                                                                                     : slicer.bodyCenter();
        return StageResult.passed(new Sliced(band, center));
    }
}
