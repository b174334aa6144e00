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

import java.util.Arrays;
import java.util.Comparator;

import com.hellblazer.girth.common.IntArrayList;
import com.hellblazer.girth.common.KdTree;
import com.hellblazer.girth.section.failure.FailureReason;
import com.hellblazer.girth.section.geometry.Loop;
import com.hellblazer.girth.section.geometry.PlanarPoints;

/**
 * Shared machinery of the boundary strategies: polar ordering about a centroid, the closure test every built loop
 * must pass and k-th neighbor distances.
 *
 * @author hal.hildebrand
 */
final class PolarOrder {

    /**
     * The distance from each point to its k-th nearest neighbor, itself excluded
     */
    static double[] kthNeighborDistances(PlanarPoints points, int k) {
        var tree = KdTree.of(points.us(), points.vs(), points.size());
        var result = new double[points.size()];
        for (int i = 0; i < result.length; i++) {
            var neighbors = tree.nearest(points.point(i), k, i);
            result[i] = neighbors.get(neighbors.size() - 1).distance();
        }
        return result;
    }

    static double median(double[] values) {
        var sorted = values.clone();
        Arrays.sort(sorted);
        int n = sorted.length;
        return n % 2 == 1 ? sorted[n / 2] : (sorted[n / 2 - 1] + sorted[n / 2]) / 2.0;
    }

    /**
     * Order the points by polar angle about their centroid, equal angles by radius, then by coordinates, and close
     * them into a loop.
     *
     * @return the loop, or {@link FailureReason#NOT_CLOSED_LOOP} when it encloses no area or does not wind around its
     *         own centroid
     */
    static StrategyOutcome order(PlanarPoints points, double dedupeEpsilon, double maxAngularGap) {
        var centroid = points.centroid();
        int n = points.size();
        var angle = new double[n];
        var radius = new double[n];
        var order = new Integer[n];
        for (int i = 0; i < n; i++) {
            double du = points.u(i) - centroid.x;
            double dv = points.v(i) - centroid.y;
            angle[i] = Math.atan2(dv, du);
            radius[i] = Math.sqrt(du * du + dv * dv);
            order[i] = i;
        }
        Arrays.sort(order, Comparator.<Integer>comparingDouble(i -> angle[i])
                                     .thenComparingDouble(i -> radius[i])
                                     .thenComparingDouble(points::u)
                                     .thenComparingDouble(points::v));
        var indices = new IntArrayList(n);
        for (var i : order) {
            indices.add(i);
        }
        return closed(Loop.of(points.subset(indices), dedupeEpsilon, false), maxAngularGap);
    }

    /**
     * @return the loop, or {@link FailureReason#NOT_CLOSED_LOOP} when it has fewer than three points, encloses no area
     *         or leaves an angular gap wider than the maximum
     */
    static StrategyOutcome closed(Loop loop, double maxAngularGap) {
        if (loop.size() < 3 || !(loop.area() > 0.0) || loop.maxAngularGap() > maxAngularGap) {
            return StrategyOutcome.failed(FailureReason.NOT_CLOSED_LOOP);
        }
        return new StrategyOutcome.Built(loop);
    }

    /**
     * Linear interpolation between closest ranks
     */
    static double percentile(double[] values, double percentile) {
        var sorted = values.clone();
        Arrays.sort(sorted);
        double rank = percentile / 100.0 * (sorted.length - 1);
        int lo = (int) Math.floor(rank);
        int hi = (int) Math.ceil(rank);
        return sorted[lo] + (sorted[hi] - sorted[lo]) * (rank - lo);
    }

    private PolarOrder() {
    }
}
