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
package com.hellblazer.girth.facts;

import java.util.EnumSet;
import java.util.List;
import java.util.Objects;

import com.hellblazer.girth.section.ExtentKey;
import com.hellblazer.girth.section.HeightKey;
import com.hellblazer.girth.section.MeasurementKey;
import com.hellblazer.girth.section.config.SectionConfig;

/**
 * Configuration for a batch run: the worker pool, the per case time budget counted from the case's start, how long a
 * case may wait for a worker, which measurements to take and the section configuration every measurer is built from.
 *
 * @author hal.hildebrand
 */
public class BatchConfig {

    /**
     * Every circumference key, no width or depth
     */
    public static BatchConfig defaults() {
        return new BatchConfig();
    }

    /**
     * Every circumference key plus every width, depth and height
     */
    public static BatchConfig fullBody() {
        return new BatchConfig().withExtentKeys(List.of(ExtentKey.values()))
                                .withHeightKeys(List.of(HeightKey.values()));
    }

    private long                 caseTimeoutMs     = 60_000;
    private List<MeasurementKey> circumferenceKeys = List.of(MeasurementKey.values());
    private List<ExtentKey>      extentKeys        = List.of();
    private List<HeightKey>      heightKeys        = List.of();
    private long                 queueTimeoutMs    = 600_000;
    private SectionConfig        sectionConfig     = SectionConfig.defaults();
    private int                  threadCount       = Runtime.getRuntime().availableProcessors();

    public long getCaseTimeoutMs() {
        return caseTimeoutMs;
    }

    public List<MeasurementKey> getCircumferenceKeys() {
        return circumferenceKeys;
    }

    public List<ExtentKey> getExtentKeys() {
        return extentKeys;
    }

    public List<HeightKey> getHeightKeys() {
        return heightKeys;
    }

    /**
     * How long a case may wait for a worker before it is cancelled without starting
     */
    public long getQueueTimeoutMs() {
        return queueTimeoutMs;
    }

    public SectionConfig getSectionConfig() {
        return sectionConfig.copy();
    }

    public int getThreadCount() {
        return threadCount;
    }

    public BatchConfig withCaseTimeout(long timeoutMs) {
        if (timeoutMs < 1) {
            throw new IllegalArgumentException("Case timeout must be positive: " + timeoutMs);
        }
        this.caseTimeoutMs = timeoutMs;
        return this;
    }

    /**
     * Keys are measured in enum order, duplicates ignored
     */
    public BatchConfig withCircumferenceKeys(List<MeasurementKey> keys) {
        if (keys == null || keys.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("Circumference keys must not be null: " + keys);
        }
        this.circumferenceKeys = keys.isEmpty() ? List.of() : List.copyOf(EnumSet.copyOf(keys));
        return this;
    }

    /**
     * Keys are measured in enum order, duplicates ignored
     */
    public BatchConfig withExtentKeys(List<ExtentKey> keys) {
        if (keys == null || keys.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("Extent keys must not be null: " + keys);
        }
        this.extentKeys = keys.isEmpty() ? List.of() : List.copyOf(EnumSet.copyOf(keys));
        return this;
    }

    /**
     * Keys are measured in enum order, duplicates ignored
     */
    public BatchConfig withHeightKeys(List<HeightKey> keys) {
        if (keys == null || keys.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("Height keys must not be null: " + keys);
        }
        this.heightKeys = keys.isEmpty() ? List.of() : List.copyOf(EnumSet.copyOf(keys));
        return this;
    }

    public BatchConfig withQueueTimeout(long timeoutMs) {
        if (timeoutMs < 1) {
            throw new IllegalArgumentException("Queue timeout must be positive: " + timeoutMs);
        }
        this.queueTimeoutMs = timeoutMs;
        return this;
    }

    public BatchConfig withSectionConfig(SectionConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("Section configuration is required");
        }
        this.sectionConfig = config.copy();
        return this;
    }

    public BatchConfig withThreadCount(int count) {
        this.threadCount = Math.max(1, count);
        return this;
    }
}
