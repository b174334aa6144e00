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

import java.util.concurrent.CancellationException;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wraps every stage transition. Geometric degeneracy arrives here as {@link StageResult#halted} data; an unexpected
 * runtime failure inside a stage is logged and converted into {@link FailureReason#NUMERIC_ERROR} for that stage, so a
 * single measurement never throws past its input contract checks. Cancellation is the exception: an interrupted
 * measurement stops with {@link CancellationException} instead of producing a result.
 *
 * @author hal.hildebrand
 */
public final class FailureClassifier {
    private static final Logger log = LoggerFactory.getLogger(FailureClassifier.class);

    /**
     * Stop work whose thread has been interrupted, leaving the interrupt status set
     *
     * @param activity names the work in the exception message
     * @throws CancellationException when the calling thread is interrupted
     */
    public static void checkInterrupted(Object activity) {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException(activity + " interrupted");
        }
    }

    public static <T> StageResult<T> guard(SectionStage stage, Supplier<StageResult<T>> body) {
        try {
            var result = body.get();
            if (result == null) {
                log.warn("Stage {} produced no result", stage);
                return StageResult.halted(stage, FailureReason.NUMERIC_ERROR);
            }
            return result;
        } catch (CancellationException e) {
            throw e;
        } catch (ArithmeticException | IllegalStateException | IndexOutOfBoundsException | ClassCastException
        | UnsupportedOperationException | IllegalArgumentException e) {
            log.warn("Stage {} failed numerically, recording {}", stage, FailureReason.NUMERIC_ERROR, e);
            return StageResult.halted(stage, FailureReason.NUMERIC_ERROR);
        }
    }

    private FailureClassifier() {
    }
}
