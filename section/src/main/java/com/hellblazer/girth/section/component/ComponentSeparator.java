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
package com.hellblazer.girth.section.component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;

import javax.vecmath.Point2d;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hellblazer.girth.common.IntArrayList;
import com.hellblazer.girth.common.KdTree;
import com.hellblazer.girth.common.UnionFind;
import com.hellblazer.girth.section.config.SectionConfig;
import com.hellblazer.girth.section.failure.FailureReason;
import com.hellblazer.girth.section.failure.SectionStage;
import com.hellblazer.girth.section.failure.StageResult;
import com.hellblazer.girth.section.geometry.ConvexHull2d;
import com.hellblazer.girth.section.geometry.PlanarPoints;
import com.hellblazer.girth.section.geometry.PolygonMetrics;

/**
 * Splits a slice into connected components. Two points are adjacent when strictly closer than the connectivity
 * distance; candidate pairs come from a uniform grid whose cell is the connectivity distance, so only the 3x3 block of
 * cells around a point is examined. Components are the disjoint sets of a union-find over the slice arena indices.
 * <p>
 * With a positive density factor the connectivity distance follows the slice: that factor times the median nearest
 * neighbor spacing, never below the configured distance and never above the maximum. A sparsely sampled ring then
 * stays one component instead of breaking into arcs at its widest sampling gaps.
 *
 * @author hal.hildebrand
 */
public class ComponentSeparator {
    private static final Logger log = LoggerFactory.getLogger(ComponentSeparator.class);

    public static ComponentSeparator of(SectionConfig config) {
        return new ComponentSeparator(config.getConnectivityDistance(), config.getConnectivityDensityFactor(),
                                      config.getMaxConnectivityDistance(), config.getMinComponentPoints());
    }

    private final double connectivity;
    private final double densityFactor;
    private final double maxConnectivity;
    private final int    minComponentPoints;

    /**
     * A separator with a fixed connectivity distance
     */
    public ComponentSeparator(double connectivity, int minComponentPoints) {
        this(connectivity, 0.0, connectivity, minComponentPoints);
    }

    public ComponentSeparator(double connectivity, double densityFactor, double maxConnectivity,
                              int minComponentPoints) {
        if (!(connectivity > 0.0)) {
            throw new IllegalArgumentException("Connectivity distance must be positive: " + connectivity);
        }
        if (!(densityFactor >= 0.0)) {
            throw new IllegalArgumentException("Density factor must be non-negative: " + densityFactor);
        }
        this.connectivity = connectivity;
        this.densityFactor = densityFactor;
        this.maxConnectivity = maxConnectivity;
        this.minComponentPoints = minComponentPoints;
    }

    /**
     * The connectivity distance used for the slice
     */
    public double connectivityFor(PlanarPoints slice) {
        int n = slice.size();
        if (densityFactor == 0.0 || n < 2) {
            return connectivity;
        }
        var tree = KdTree.of(slice.us(), slice.vs(), n);
        var spacing = new double[n];
        for (int i = 0; i < n; i++) {
            spacing[i] = tree.nearest(slice.point(i), 1, i).get(0).distance();
        }
        Arrays.sort(spacing);
        double median = n % 2 == 1 ? spacing[n / 2] : (spacing[n / 2 - 1] + spacing[n / 2]) / 2.0;
        return Math.max(connectivity, Math.min(densityFactor * median, maxConnectivity));
    }

    /**
     * @param slice              the slice points in canonical order
     * @param center             the reference center distances are measured from
     * @param separationExpected whether a single component should be flagged
     * @return the surviving components, or {@link FailureReason#EXTRACT_EMPTY} when none survive
     */
    public StageResult<SeparationResult> separate(PlanarPoints slice, Point2d center, boolean separationExpected) {
        double distance = connectivityFor(slice);
        var sets = connect(slice, distance).sets();
        var components = new ArrayList<Component>();
        for (var members : sets) {
            if (members.size() >= minComponentPoints) {
                components.add(describe(slice, members, center));
            }
        }
        log.trace("Separated {} points at {} into {} sets, {} components", slice.size(), distance, sets.size(),
                  components.size());
        if (components.isEmpty()) {
            return StageResult.halted(SectionStage.COMPONENT_SEPARATION, FailureReason.EXTRACT_EMPTY);
        }
        return StageResult.passed(new SeparationResult(components, separationExpected && components.size() == 1,
                                                       distance));
    }

    UnionFind connect(PlanarPoints slice) {
        return connect(slice, connectivity);
    }

    private UnionFind connect(PlanarPoints slice, double distance) {
        int n = slice.size();
        var uf = new UnionFind(n);
        var grid = new HashMap<Long, IntArrayList>();
        for (int i = 0; i < n; i++) {
            long key = cellKey(cell(slice.u(i), distance), cell(slice.v(i), distance));
            grid.computeIfAbsent(key, k -> new IntArrayList()).add(i);
        }
        double threshold2 = distance * distance;
        for (int i = 0; i < n; i++) {
            long cu = cell(slice.u(i), distance);
            long cv = cell(slice.v(i), distance);
            for (long du = -1; du <= 1; du++) {
                for (long dv = -1; dv <= 1; dv++) {
                    var bucket = grid.get(cellKey(cu + du, cv + dv));
                    if (bucket != null) {
                        link(slice, uf, i, bucket, threshold2);
                    }
                }
            }
        }
        return uf;
    }

    private long cell(double coordinate, double distance) {
        return (long) Math.floor(coordinate / distance);
    }

    private long cellKey(long cu, long cv) {
        return (cu << 32) ^ (cv & 0xFFFFFFFFL);
    }

    private Component describe(PlanarPoints slice, IntArrayList members, Point2d center) {
        var points = slice.subset(members);
        var centroid = points.centroid();
        var hull = points.subset(ConvexHull2d.hull(points));
        var hu = hull.us();
        var hv = hull.vs();
        return new Component(members, points, centroid, centroid.distance(center),
                             PolygonMetrics.area(hu, hv, hu.length), PolygonMetrics.perimeter(hu, hv, hu.length));
    }

    private void link(PlanarPoints slice, UnionFind uf, int i, IntArrayList bucket, double threshold2) {
        for (int b = 0; b < bucket.size(); b++) {
            int j = bucket.get(b);
            if (j <= i) {
                continue;
            }
            double du = slice.u(i) - slice.u(j);
            double dv = slice.v(i) - slice.v(j);
            if (du * du + dv * dv < threshold2) {
                uf.union(i, j);
            }
        }
    }
}
