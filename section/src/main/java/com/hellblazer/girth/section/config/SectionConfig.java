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
package com.hellblazer.girth.section.config;

import java.util.Arrays;
import java.util.List;

import com.hellblazer.girth.section.component.CenterReference;
import com.hellblazer.girth.section.component.TieBreak;
import com.hellblazer.girth.section.component.TorsoSelector;
import com.hellblazer.girth.section.select.PolicyTable;

/**
 * Every threshold used while measuring a cross section. Setters validate and return this instance; a measurer takes a
 * {@link #copy()} at construction, so a configuration may be reused and modified between measurers without affecting
 * any of them.
 *
 * @author hal.hildebrand
 */
public class SectionConfig {

    /**
     * The default configuration
     */
    public static SectionConfig defaults() {
        return new SectionConfig();
    }

    /**
     * A denser candidate scan with a thinner band, for high resolution scans.
     */
    public static SectionConfig fineScan() {
        return new SectionConfig().withCandidateCount(40).withToleranceFactor(0.25);
    }

    /**
     * Looser connectivity, for sparse or low resolution scans.
     */
    public static SectionConfig sparseScan() {
        return new SectionConfig().withConnectivityDistance(0.02).withCandidateCount(12);
    }

    private double          alphaBoundaryRatio         = 1.5;
    private int[]           alphaKChoices              = { 3, 5, 7 };
    private double          ambiguityEpsilon           = 1e-6;
    private int             candidateCount             = 20;
    private CenterReference centerReference            = CenterReference.SLICE_CENTROID;
    private double          clusterEpsFactor           = 3.0;
    private int             clusterMinSamples          = 3;
    private double          connectivityDensityFactor  = 40.0;
    private double          connectivityDistance       = 0.01;
    private double          dedupeEpsilon              = 1e-6;
    private int             defaultAlphaK              = 5;
    private double          extentMaxToleranceFraction = 0.03;
    private double          extentMinTolerance         = 0.005;
    private double          extentToleranceFraction    = 0.02;
    private double          fragmentGap                = Math.PI / 4.0;
    private double          fragmentShare              = 0.1;
    private double          heightLarge                = 3.0;
    private double          heightSmall                = 0.1;
    private double          maxAngularGap              = Math.PI / 2.0;
    private double          maxConnectivityDistance    = 0.05;
    private int             maxSlicePoints             = 20_000;
    private double          minAxisExtent              = 1e-6;
    private int             minBoundaryPoints          = 3;
    private int             minComponentPoints         = 3;
    private double          minHullCoverage            = 0.995;
    private int             minSlicePoints             = 3;
    private double          nearestPlaneStep           = 0.001;
    private double          nearestPlaneWindow         = 0.010;
    private double          perimeterLarge             = 3.0;
    private double          perimeterSmall             = 0.1;
    private PolicyTable     policyTable                = PolicyTable.defaults();
    private int             relaxedAlphaK              = 3;
    private int             secondaryK                 = 3;
    private double          secondaryPercentile        = 75.0;
    private List<TieBreak>  tieBreakOrder              = TorsoSelector.DEFAULT_ORDER;
    private double          tieEpsilon                 = 1e-6;
    private double          toleranceFactor            = 0.5;
    private double          unitMaxAbs                 = 10.0;

    public SectionConfig copy() {
        var copy = new SectionConfig();
        copy.alphaBoundaryRatio = alphaBoundaryRatio;
        copy.alphaKChoices = alphaKChoices.clone();
        copy.ambiguityEpsilon = ambiguityEpsilon;
        copy.candidateCount = candidateCount;
        copy.centerReference = centerReference;
        copy.clusterEpsFactor = clusterEpsFactor;
        copy.clusterMinSamples = clusterMinSamples;
        copy.connectivityDensityFactor = connectivityDensityFactor;
        copy.connectivityDistance = connectivityDistance;
        copy.dedupeEpsilon = dedupeEpsilon;
        copy.defaultAlphaK = defaultAlphaK;
        copy.extentMaxToleranceFraction = extentMaxToleranceFraction;
        copy.extentMinTolerance = extentMinTolerance;
        copy.extentToleranceFraction = extentToleranceFraction;
        copy.fragmentGap = fragmentGap;
        copy.fragmentShare = fragmentShare;
        copy.heightLarge = heightLarge;
        copy.heightSmall = heightSmall;
        copy.maxAngularGap = maxAngularGap;
        copy.maxConnectivityDistance = maxConnectivityDistance;
        copy.maxSlicePoints = maxSlicePoints;
        copy.minAxisExtent = minAxisExtent;
        copy.minBoundaryPoints = minBoundaryPoints;
        copy.minComponentPoints = minComponentPoints;
        copy.minHullCoverage = minHullCoverage;
        copy.minSlicePoints = minSlicePoints;
        copy.nearestPlaneStep = nearestPlaneStep;
        copy.nearestPlaneWindow = nearestPlaneWindow;
        copy.perimeterLarge = perimeterLarge;
        copy.perimeterSmall = perimeterSmall;
        copy.policyTable = policyTable;
        copy.relaxedAlphaK = relaxedAlphaK;
        copy.secondaryK = secondaryK;
        copy.secondaryPercentile = secondaryPercentile;
        copy.tieBreakOrder = tieBreakOrder;
        copy.tieEpsilon = tieEpsilon;
        copy.toleranceFactor = toleranceFactor;
        copy.unitMaxAbs = unitMaxAbs;
        return copy;
    }

    /**
     * A point is an alpha boundary candidate when its k-th neighbor distance exceeds this multiple of the median k-th
     * neighbor distance.
     */
    public double getAlphaBoundaryRatio() {
        return alphaBoundaryRatio;
    }

    /**
     * The neighborhood sizes a case id hashes into.
     */
    public int[] getAlphaKChoices() {
        return alphaKChoices.clone();
    }

    /**
     * Candidates whose perimeters lie within this distance of the statistic's target are considered equally good.
     */
    public double getAmbiguityEpsilon() {
        return ambiguityEpsilon;
    }

    public int getCandidateCount() {
        return candidateCount;
    }

    public CenterReference getCenterReference() {
        return centerReference;
    }

    /**
     * Density clustering radius as a multiple of the median nearest neighbor distance.
     */
    public double getClusterEpsFactor() {
        return clusterEpsFactor;
    }

    public int getClusterMinSamples() {
        return clusterMinSamples;
    }

    /**
     * The connectivity distance of a slice is this multiple of its median nearest neighbor spacing, kept between
     * {@link #getConnectivityDistance()} and {@link #getMaxConnectivityDistance()}. Zero disables the adaptation.
     */
    public double getConnectivityDensityFactor() {
        return connectivityDensityFactor;
    }

    /**
     * Two slice points are adjacent when strictly closer than this, in meters. A floor when the connectivity adapts to
     * the slice density.
     */
    public double getConnectivityDistance() {
        return connectivityDistance;
    }

    public double getDedupeEpsilon() {
        return dedupeEpsilon;
    }

    /**
     * Alpha neighborhood size when no case id is supplied.
     */
    public int getDefaultAlphaK() {
        return defaultAlphaK;
    }

    public double getExtentMaxToleranceFraction() {
        return extentMaxToleranceFraction;
    }

    public double getExtentMinTolerance() {
        return extentMinTolerance;
    }

    public double getExtentToleranceFraction() {
        return extentToleranceFraction;
    }

    /**
     * An accepted loop leaving an angular gap wider than this, in a slice of several components, is flagged as a
     * fragment.
     */
    public double getFragmentGap() {
        return fragmentGap;
    }

    /**
     * A measured component holding less than this share of its slice's points is flagged as a fragment.
     */
    public double getFragmentShare() {
        return fragmentShare;
    }

    /**
     * Body heights above this, in meters, are flagged as implausibly large.
     */
    public double getHeightLarge() {
        return heightLarge;
    }

    public double getHeightSmall() {
        return heightSmall;
    }

    /**
     * Largest angular gap, in radians, an ordered loop may have around its centroid and still count as closed.
     */
    public double getMaxAngularGap() {
        return maxAngularGap;
    }

    /**
     * Upper bound, in meters, on a density adapted connectivity distance.
     */
    public double getMaxConnectivityDistance() {
        return maxConnectivityDistance;
    }

    public int getMaxSlicePoints() {
        return maxSlicePoints;
    }

    public double getMinAxisExtent() {
        return minAxisExtent;
    }

    public int getMinBoundaryPoints() {
        return minBoundaryPoints;
    }

    public int getMinComponentPoints() {
        return minComponentPoints;
    }

    /**
     * Smallest share of its component's convex hull perimeter a loop must cover to be accepted.
     */
    public double getMinHullCoverage() {
        return minHullCoverage;
    }

    public int getMinSlicePoints() {
        return minSlicePoints;
    }

    public double getNearestPlaneStep() {
        return nearestPlaneStep;
    }

    /**
     * Half width, in meters, of the search for a nearby plane when the requested one is empty.
     */
    public double getNearestPlaneWindow() {
        return nearestPlaneWindow;
    }

    public double getPerimeterLarge() {
        return perimeterLarge;
    }

    public double getPerimeterSmall() {
        return perimeterSmall;
    }

    public PolicyTable getPolicyTable() {
        return policyTable;
    }

    public int getRelaxedAlphaK() {
        return relaxedAlphaK;
    }

    public int getSecondaryK() {
        return secondaryK;
    }

    public double getSecondaryPercentile() {
        return secondaryPercentile;
    }

    /**
     * The order torso selection applies its criteria in.
     */
    public List<TieBreak> getTieBreakOrder() {
        return tieBreakOrder;
    }

    /**
     * Torso selection treats criteria values within this distance as tied.
     */
    public double getTieEpsilon() {
        return tieEpsilon;
    }

    /**
     * Slice half thickness as a fraction of the candidate spacing.
     */
    public double getToleranceFactor() {
        return toleranceFactor;
    }

    /**
     * Largest absolute coordinate, in meters, a plausible body can have.
     */
    public double getUnitMaxAbs() {
        return unitMaxAbs;
    }

    @Override
    public String toString() {
        return "SectionConfig[candidates=" + candidateCount + ", toleranceFactor=" + toleranceFactor
        + ", connectivity=" + connectivityDistance + "x" + connectivityDensityFactor + "<=" + maxConnectivityDistance
        + ", alphaK=" + Arrays.toString(alphaKChoices) + ", center="
        + centerReference + ", tieBreak=" + tieBreakOrder + "]";
    }

    // Fluent API for configuration

    public SectionConfig withAlphaBoundaryRatio(double ratio) {
        alphaBoundaryRatio = positive("Alpha boundary ratio", ratio);
        return this;
    }

    public SectionConfig withAlphaKChoices(int... choices) {
        if (choices == null || choices.length == 0) {
            throw new IllegalArgumentException("At least one alpha k choice is required");
        }
        for (var k : choices) {
            if (k < 1) {
                throw new IllegalArgumentException("Alpha k must be positive: " + k);
            }
        }
        alphaKChoices = choices.clone();
        return this;
    }

    public SectionConfig withAmbiguityEpsilon(double epsilon) {
        ambiguityEpsilon = nonNegative("Ambiguity epsilon", epsilon);
        return this;
    }

    public SectionConfig withCandidateCount(int count) {
        if (count < 1) {
            throw new IllegalArgumentException("Candidate count must be positive: " + count);
        }
        candidateCount = count;
        return this;
    }

    public SectionConfig withCenterReference(CenterReference reference) {
        if (reference == null) {
            throw new IllegalArgumentException("Center reference is required");
        }
        centerReference = reference;
        return this;
    }

    public SectionConfig withClusterEpsFactor(double factor) {
        clusterEpsFactor = positive("Cluster eps factor", factor);
        return this;
    }

    public SectionConfig withClusterMinSamples(int samples) {
        if (samples < 1) {
            throw new IllegalArgumentException("Cluster min samples must be positive: " + samples);
        }
        clusterMinSamples = samples;
        return this;
    }

    public SectionConfig withConnectivityDensity(double factor, double maxDistance) {
        nonNegative("Connectivity density factor", factor);
        positive("Max connectivity distance", maxDistance);
        connectivityDensityFactor = factor;
        maxConnectivityDistance = maxDistance;
        return this;
    }

    public SectionConfig withConnectivityDistance(double distance) {
        connectivityDistance = positive("Connectivity distance", distance);
        return this;
    }

    public SectionConfig withDedupeEpsilon(double epsilon) {
        dedupeEpsilon = nonNegative("Dedupe epsilon", epsilon);
        return this;
    }

    public SectionConfig withDefaultAlphaK(int k) {
        if (k < 1) {
            throw new IllegalArgumentException("Default alpha k must be positive: " + k);
        }
        defaultAlphaK = k;
        return this;
    }

    public SectionConfig withExtentTolerance(double fraction, double minimum, double maxFraction) {
        positive("Extent tolerance fraction", fraction);
        positive("Extent minimum tolerance", minimum);
        positive("Extent max tolerance fraction", maxFraction);
        if (maxFraction < fraction) {
            throw new IllegalArgumentException(
            "Extent max tolerance fraction " + maxFraction + " is below the tolerance fraction " + fraction);
        }
        extentToleranceFraction = fraction;
        extentMinTolerance = minimum;
        extentMaxToleranceFraction = maxFraction;
        return this;
    }

    public SectionConfig withFragmentation(double share, double gap) {
        if (!(share >= 0.0 && share <= 1.0)) {
            throw new IllegalArgumentException("Fragment share must be in [0, 1]: " + share);
        }
        if (!(gap > 0.0 && gap <= 2.0 * Math.PI)) {
            throw new IllegalArgumentException("Fragment gap must be in (0, 2pi]: " + gap);
        }
        fragmentShare = share;
        fragmentGap = gap;
        return this;
    }

    public SectionConfig withMaxAngularGap(double radians) {
        if (!(radians > 0.0 && radians <= 2.0 * Math.PI)) {
            throw new IllegalArgumentException("Max angular gap must be in (0, 2pi]: " + radians);
        }
        maxAngularGap = radians;
        return this;
    }

    public SectionConfig withMaxSlicePoints(int points) {
        if (points < minSlicePoints) {
            throw new IllegalArgumentException("Max slice points must be at least " + minSlicePoints + ": " + points);
        }
        maxSlicePoints = points;
        return this;
    }

    public SectionConfig withMinAxisExtent(double extent) {
        minAxisExtent = positive("Min axis extent", extent);
        return this;
    }

    public SectionConfig withMinBoundaryPoints(int points) {
        minBoundaryPoints = atLeastThree("Min boundary points", points);
        return this;
    }

    public SectionConfig withMinComponentPoints(int points) {
        if (points < 1) {
            throw new IllegalArgumentException("Min component points must be positive: " + points);
        }
        minComponentPoints = points;
        return this;
    }

    public SectionConfig withMinHullCoverage(double coverage) {
        if (!(coverage >= 0.0 && coverage <= 1.0)) {
            throw new IllegalArgumentException("Min hull coverage must be in [0, 1]: " + coverage);
        }
        minHullCoverage = coverage;
        return this;
    }

    public SectionConfig withMinSlicePoints(int points) {
        minSlicePoints = atLeastThree("Min slice points", points);
        return this;
    }

    public SectionConfig withNearestPlaneSearch(double window, double step) {
        nonNegative("Nearest plane window", window);
        positive("Nearest plane step", step);
        nearestPlaneWindow = window;
        nearestPlaneStep = step;
        return this;
    }

    public SectionConfig withHeightBounds(double small, double large) {
        positive("Small height bound", small);
        if (!(large > small)) {
            throw new IllegalArgumentException("Large height bound must exceed " + small + ": " + large);
        }
        heightSmall = small;
        heightLarge = large;
        return this;
    }

    public SectionConfig withPerimeterBounds(double small, double large) {
        positive("Small perimeter bound", small);
        if (!(large > small)) {
            throw new IllegalArgumentException("Large perimeter bound must exceed " + small + ": " + large);
        }
        perimeterSmall = small;
        perimeterLarge = large;
        return this;
    }

    public SectionConfig withPolicyTable(PolicyTable table) {
        if (table == null) {
            throw new IllegalArgumentException("Policy table is required");
        }
        policyTable = table;
        return this;
    }

    public SectionConfig withRelaxedAlphaK(int k) {
        if (k < 1) {
            throw new IllegalArgumentException("Relaxed alpha k must be positive: " + k);
        }
        relaxedAlphaK = k;
        return this;
    }

    public SectionConfig withSecondaryK(int k) {
        if (k < 1) {
            throw new IllegalArgumentException("Secondary k must be positive: " + k);
        }
        secondaryK = k;
        return this;
    }

    public SectionConfig withSecondaryPercentile(double percentile) {
        if (!(percentile >= 0.0 && percentile <= 100.0)) {
            throw new IllegalArgumentException("Percentile must be in [0, 100]: " + percentile);
        }
        secondaryPercentile = percentile;
        return this;
    }

    public SectionConfig withTieBreakOrder(List<TieBreak> order) {
        tieBreakOrder = TorsoSelector.validateOrder(order);
        return this;
    }

    public SectionConfig withTieEpsilon(double epsilon) {
        tieEpsilon = nonNegative("Tie epsilon", epsilon);
        return this;
    }

    public SectionConfig withToleranceFactor(double factor) {
        toleranceFactor = positive("Tolerance factor", factor);
        return this;
    }

    public SectionConfig withUnitMaxAbs(double maxAbs) {
        unitMaxAbs = positive("Unit max abs", maxAbs);
        return this;
    }

    private static int atLeastThree(String name, int value) {
        if (value < 3) {
            throw new IllegalArgumentException(name + " must be at least 3: " + value);
        }
        return value;
    }

    private static double nonNegative(String name, double value) {
        if (!(value >= 0.0) || Double.isInfinite(value)) {
            throw new IllegalArgumentException(name + " must be finite and non-negative: " + value);
        }
        return value;
    }

    private static double positive(String name, double value) {
        if (!(value > 0.0) || Double.isInfinite(value)) {
            throw new IllegalArgumentException(name + " must be finite and positive: " + value);
        }
        return value;
    }
}
