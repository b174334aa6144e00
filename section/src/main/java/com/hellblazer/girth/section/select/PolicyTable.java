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

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import com.hellblazer.girth.section.MeasurementKey;

/**
 * Immutable lookup table from measurement key to {@link RegionPolicy}. The measurement selector is a single generic
 * routine parameterized by the record it finds here, so no code branches on key names.
 *
 * @author hal.hildebrand
 */
public final class PolicyTable {

    /**
     * The default region table. Regions are fractions of the long-axis extent measured from its minimum.
     */
    public static PolicyTable defaults() {
        var policies = new EnumMap<MeasurementKey, RegionPolicy>(MeasurementKey.class);
        policies.put(MeasurementKey.NECK, new RegionPolicy("neck", 0.75, 0.90, SelectionStatistic.MEDIAN, true));
        policies.put(MeasurementKey.BUST,
                     new RegionPolicy("upper_torso", 0.40, 0.70, SelectionStatistic.MAX, true));
        policies.put(MeasurementKey.UNDERBUST,
                     new RegionPolicy("lower_thoracic_band", 0.30, 0.60, SelectionStatistic.MEDIAN, true));
        policies.put(MeasurementKey.WAIST, new RegionPolicy("mid_torso", 0.40, 0.70, SelectionStatistic.MIN, true));
        policies.put(MeasurementKey.HIP, new RegionPolicy("lower_torso", 0.50, 0.80, SelectionStatistic.MAX, true));
        policies.put(MeasurementKey.THIGH, new RegionPolicy("upper_leg", 0.20, 0.40, SelectionStatistic.MAX, false));
        policies.put(MeasurementKey.MIN_CALF,
                     new RegionPolicy("lower_leg", 0.05, 0.20, SelectionStatistic.MIN, false));
        return new PolicyTable(policies);
    }

    private final EnumMap<MeasurementKey, RegionPolicy> policies;

    private PolicyTable(EnumMap<MeasurementKey, RegionPolicy> policies) {
        for (var key : MeasurementKey.values()) {
            if (!policies.containsKey(key)) {
                throw new IllegalArgumentException("No policy for " + key);
            }
        }
        this.policies = policies;
    }

    public Map<MeasurementKey, RegionPolicy> asMap() {
        return Collections.unmodifiableMap(policies);
    }

    public RegionPolicy policy(MeasurementKey key) {
        return policies.get(key);
    }

    /**
     * @return a copy of this table with the policy for key replaced
     */
    public PolicyTable with(MeasurementKey key, RegionPolicy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("Policy is required for " + key);
        }
        var copy = new EnumMap<>(policies);
        copy.put(key, policy);
        return new PolicyTable(copy);
    }
}
