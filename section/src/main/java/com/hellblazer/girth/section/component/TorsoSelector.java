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
import java.util.List;
import java.util.function.ToDoubleFunction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Selects the torso among the components of a slice using point positions only. Criteria are applied as successive
 * filters in the configured order, by default smallest centroid distance to the reference center, largest hull area,
 * largest hull perimeter, then lexicographically smallest centroid. Values within the tie epsilon of the best survive
 * each filter; the lexicographic centroid comparison is exact.
 *
 * @author hal.hildebrand
 */
public class TorsoSelector {
    public static final List<TieBreak> DEFAULT_ORDER = List.of(TieBreak.DISTANCE, TieBreak.AREA, TieBreak.PERIMETER,
                                                               TieBreak.CENTROID);

    private static final Logger log = LoggerFactory.getLogger(TorsoSelector.class);

    private final List<TieBreak> order;
    private final double         tieEpsilon;

    public TorsoSelector(double tieEpsilon) {
        this(tieEpsilon, DEFAULT_ORDER);
    }

    public TorsoSelector(double tieEpsilon, List<TieBreak> order) {
        this.tieEpsilon = tieEpsilon;
        this.order = validateOrder(order);
    }

    /**
     * @return the order unchanged if it is a permutation of the four selection criteria
     */
    public static List<TieBreak> validateOrder(List<TieBreak> order) {
        if (order == null || order.size() != DEFAULT_ORDER.size() || !order.containsAll(DEFAULT_ORDER)) {
            throw new IllegalArgumentException("Tie break order must be a permutation of " + DEFAULT_ORDER + ": " + order);
        }
        return List.copyOf(order);
    }

    public Selection select(List<Component> components) {
        if (components.isEmpty()) {
            throw new IllegalArgumentException("No components to select from");
        }
        if (components.size() == 1) {
            return new Selection(components.get(0), 0, TieBreak.SINGLE_COMPONENT, false);
        }
        var survivors = new ArrayList<Integer>();
        for (int i = 0; i < components.size(); i++) {
            survivors.add(i);
        }
        for (int step = 0; step < order.size(); step++) {
            var criterion = order.get(step);
            survivors = switch (criterion) {
            case DISTANCE -> keepBest(components, survivors, Component::centerDistance, false);
            case AREA -> keepBest(components, survivors, Component::hullArea, true);
            case PERIMETER -> keepBest(components, survivors, Component::hullPerimeter, true);
            case CENTROID -> smallestCentroid(components, survivors);
            default -> throw new IllegalStateException("Not a selection criterion: " + criterion);
            };
            if (survivors.size() == 1) {
                return selected(components, survivors.get(0), criterion, step > 0);
            }
        }
        // equal centroids
        return selected(components, survivors.get(0), order.get(order.size() - 1), true);
    }

    private ArrayList<Integer> keepBest(List<Component> components, List<Integer> candidates,
                                        ToDoubleFunction<Component> criterion, boolean largest) {
        double best = largest ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        for (var i : candidates) {
            double value = criterion.applyAsDouble(components.get(i));
            best = largest ? Math.max(best, value) : Math.min(best, value);
        }
        var kept = new ArrayList<Integer>();
        for (var i : candidates) {
            if (Math.abs(criterion.applyAsDouble(components.get(i)) - best) <= tieEpsilon) {
                kept.add(i);
            }
        }
        return kept;
    }

    private ArrayList<Integer> smallestCentroid(List<Component> components, List<Integer> candidates) {
        int best = candidates.get(0);
        for (var i : candidates) {
            var c = components.get(i).centroid();
            var b = components.get(best).centroid();
            if (c.x < b.x || (c.x == b.x && c.y < b.y)) {
                best = i;
            }
        }
        var kept = new ArrayList<Integer>();
        var b = components.get(best).centroid();
        for (var i : candidates) {
            var c = components.get(i).centroid();
            if (c.x == b.x && c.y == b.y) {
                kept.add(i);
            }
        }
        return kept;
    }

    private Selection selected(List<Component> components, int index, TieBreak criterion, boolean tieBroken) {
        var selection = new Selection(components.get(index), index, criterion, tieBroken);
        log.trace("Selected component {} of {} by {}", index, components.size(), criterion.label());
        return selection;
    }
}
