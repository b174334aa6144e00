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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

/**
 * @author hal.hildebrand
 */
public class StageResultTest {

    @Test
    public void testChainPasses() {
        var result = StageResult.passed(2)
                                .then(SectionStage.COMPONENT_SEPARATION, i -> StageResult.passed(i * 3))
                                .then(SectionStage.REGION_SELECTION, i -> StageResult.passed("v" + i));
        assertTrue(result.isPassed());
        assertEquals("v6", result.value());
        assertThrows(IllegalStateException.class, result::failure);
    }

    @Test
    public void testHaltShortCircuits() {
        var calls = new AtomicInteger();
        StageResult<Integer> result = StageResult.passed(1)
                                                 .<Integer>then(SectionStage.COMPONENT_SEPARATION,
                                                                i -> StageResult.halted(SectionStage.COMPONENT_SEPARATION,
                                                                                        FailureReason.EXTRACT_EMPTY))
                                                 .then(SectionStage.LOOP_RECONSTRUCTION, i -> {
                                                     calls.incrementAndGet();
                                                     return StageResult.passed(i);
                                                 });
        assertFalse(result.isPassed());
        assertEquals(0, calls.get(), "stages after a halt must not run");
        assertEquals(SectionStage.COMPONENT_SEPARATION, result.failure().stage());
        assertEquals(FailureReason.EXTRACT_EMPTY, result.failure().reason());
        assertEquals("CANDIDATE_FAIL:EXTRACT_EMPTY", result.failure().code());
        assertThrows(IllegalStateException.class, result::value);
    }

    @Test
    public void testRuntimeFailureBecomesNumericError() {
        StageResult<Integer> result = StageResult.passed(0).then(SectionStage.PERIMETER_COMPUTATION, i -> {
            throw new ArithmeticException("/ by zero");
        });
        assertFalse(result.isPassed());
        assertEquals(SectionStage.PERIMETER_COMPUTATION, result.failure().stage());
        assertEquals(FailureReason.NUMERIC_ERROR, result.failure().reason());
    }

    @Test
    public void testNullResultBecomesNumericError() {
        var result = FailureClassifier.<String>guard(SectionStage.RESULT, () -> null);
        assertEquals(FailureReason.NUMERIC_ERROR, result.failure().reason());
    }

    @Test
    public void testGuardPassesThrough() {
        var passed = StageResult.passed("x");
        assertSame(passed, FailureClassifier.guard(SectionStage.RESULT, () -> passed));
    }

    @Test
    public void testCancellationIsNotAStageFailure() {
        assertThrows(CancellationException.class, () -> FailureClassifier.<String>guard(SectionStage.RESULT, () -> {
            throw new CancellationException("stop");
        }));
        assertThrows(CancellationException.class, () -> StageResult.passed(1).then(SectionStage.RESULT, i -> {
            throw new CancellationException("stop");
        }));
    }

    @Test
    public void testPassedRequiresValue() {
        assertThrows(IllegalArgumentException.class, () -> StageResult.passed(null));
    }
}
