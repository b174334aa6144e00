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

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Map;

import com.hellblazer.girth.common.IntArrayList;
import com.hellblazer.girth.common.KdTree;
import com.hellblazer.girth.section.failure.FailureReason;
import com.hellblazer.girth.section.failure.WarningCode;
import com.hellblazer.girth.section.geometry.PlanarPoints;
import com.hellblazer.girth.section.geometry.PolygonMetrics;

/**
 * Density trim: DBSCAN over the distinct point positions with a radius of {@code clusterEpsFactor} times the median
 * nearest neighbor distance, keeping the cluster whose centroid is nearest the reference center and ordering it by
 * polar angle. Noise points never join a loop.
 *
 * @author hal.hildebrand
 */
public class ClusterTrimStrategy implements BoundaryStrategy {
    public static final String TAG = "cluster_trim";

    private static final int NOISE      = -1;
    private static final int UNASSIGNED = -2;

    @Override
    public StrategyOutcome attempt(BoundaryInput input) {
        var config = input.config();
        if (input.points().size() < 3) {
            return StrategyOutcome.failed(FailureReason.TOO_FEW_COMPONENT_POINTS);
        }
        // canonical order puts coincident points next to each other
        var points = input.points()
                          .subset(PolygonMetrics.mergeConsecutive(input.points().us(), input.points().vs(),
                                                                  input.points().size(), config.getDedupeEpsilon()));
        if (points.size() < 3) {
            return StrategyOutcome.failed(FailureReason.TOO_FEW_COMPONENT_POINTS);
        }
        double eps = PolarOrder.median(PolarOrder.kthNeighborDistances(points, 1)) * config.getClusterEpsFactor();
        var labels = dbscan(points, eps, config.getClusterMinSamples());
        int clusters = Arrays.stream(labels).max().orElse(NOISE) + 1;
        if (clusters == 0) {
            return StrategyOutcome.failed(FailureReason.NO_CLUSTER);
        }
        IntArrayList best = null;
        double bestDistance = Double.POSITIVE_INFINITY;
        for (int c = 0; c < clusters; c++) {
            var members = new IntArrayList();
            for (int i = 0; i < labels.length; i++) {
                if (labels[i] == c) {
                    members.add(i);
                }
            }
            double distance = points.subset(members).centroid().distance(input.center());
            if (distance < bestDistance) {
                bestDistance = distance;
                best = members;
            }
        }
        if (best.size() < 3) {
            return StrategyOutcome.failed(FailureReason.TOO_FEW_CLUSTER_POINTS);
        }
        var outcome = PolarOrder.order(points.subset(best), config.getDedupeEpsilon(),
                                       config.getMaxAngularGap());
        if (outcome instanceof StrategyOutcome.Built built) {
            return new StrategyOutcome.Built(built.loop(),
                                             Map.of("cluster_count", clusters, "cluster_points", best.size(),
                                                    "cluster_eps", eps));
        }
        return outcome;
    }

    @Override
    public WarningCode failureCode() {
        return WarningCode.CLUSTER_TRIM_FAIL;
    }

    @Override
    public String tag() {
        return TAG;
    }

    @Override
    public boolean trimsOutliers() {
        return true;
    }

    /**
     * @return the cluster label of each point, clusters numbered from 0 in order of discovery, {@value #NOISE} for
     *         noise
     */
    int[] dbscan(PlanarPoints points, double eps, int minSamples) {
        int n = points.size();
        var tree = KdTree.of(points.us(), points.vs(), n);
        var labels = new int[n];
        Arrays.fill(labels, UNASSIGNED);
        int cluster = 0;
        for (int i = 0; i < n; i++) {
            if (labels[i] != UNASSIGNED) {
                continue;
            }
            var neighbors = tree.within(points.point(i), eps);
            if (neighbors.size() < minSamples) {
                labels[i] = NOISE;
                continue;
            }
            labels[i] = cluster;
            var frontier = new ArrayDeque<Integer>();
            neighbors.forEach(frontier::add);
            while (!frontier.isEmpty()) {
                int q = frontier.poll();
                if (labels[q] == NOISE) {
                    labels[q] = cluster;
                }
                if (labels[q] != UNASSIGNED) {
                    continue;
                }
                labels[q] = cluster;
                var reach = tree.within(points.point(q), eps);
                if (reach.size() >= minSamples) {
                    reach.forEach(frontier::add);
                }
            }
            cluster++;
        }
        return labels;
    }
}
