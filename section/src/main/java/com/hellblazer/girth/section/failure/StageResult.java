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
package com.hellblazer.girth.section.failure;

import java.util.function.Function;

/**
 * The outcome of one pipeline stage: either the intermediate the next stage consumes, or an explicit
 * {@link StageFailure} that short circuits every remaining stage.
 *
 * @param <T> the intermediate type
 * @author hal.hildebrand
 */
public final class StageResult<T> {

    public static <T> StageResult<T> halted(SectionStage stage, FailureReason reason) {
        return new StageResult<>(null, new StageFailure(stage, reason));
    }

    public static <T> StageResult<T> passed(T value) {
        if (value == null) {
            throw new IllegalArgumentException("A passed stage must carry a value");
        }
        return new StageResult<>(value, null);
    }

    private final StageFailure failure;
    private final T            value;

    private StageResult(T value, StageFailure failure) {
        this.value = value;
        this.failure = failure;
    }

    public StageFailure failure() {
        if (failure == null) {
            throw new IllegalStateException("Stage passed");
        }
        return failure;
    }

    public boolean isPassed() {
        return failure == null;
    }

    /**
     * Run the next stage on this intermediate, guarded by the {@link FailureClassifier}. A halted result propagates
     * unchanged.
     */
    public <U> StageResult<U> then(SectionStage stage, Function<? super T, StageResult<U>> next) {
        if (!isPassed()) {
            return new StageResult<>(null, failure);
        }
        return FailureClassifier.guard(stage, () -> next.apply(value));
    }

    @Override
    public String toString() {
        return isPassed() ? "Passed[" + value + "]" : "Halted[" + failure + "]";
    }

    public T value() {
        if (failure != null) {
            throw new IllegalStateException("Stage halted: " + failure);
        }
        return value;
    }
}
