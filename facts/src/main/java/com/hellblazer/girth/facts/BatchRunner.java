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

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hellblazer.girth.section.CircumferenceMeasurer;
import com.hellblazer.girth.section.ExtentMeasurer;
import com.hellblazer.girth.section.HeightMeasurer;
import com.hellblazer.girth.section.MeasurementResult;

/**
 * Measures many cases on a fixed worker pool. Measurement is pure, so the workers share one set of measurers and
 * need no locking. A case whose input breaks the measurement contract, or which exceeds its time budget, is recorded
 * as such and never affects the other cases. Outcomes are reported in submission order whatever order the workers
 * finish in.
 * <p>
 * A case's time budget runs from the moment a worker starts it, not from when the runner begins waiting on it, so a
 * case queued behind a slow one is not charged for the wait. Time spent queued is bounded separately by the queue
 * timeout. Cancelling a case interrupts its worker; the measurers check for interruption between keys, candidates and
 * planes.
 *
 * @author hal.hildebrand
 */
public class BatchRunner implements AutoCloseable {

    /**
     * A submitted case, recording when a worker picked it up
     */
    private final class CaseTask implements Callable<CaseOutcome> {
        private final MeasurementCase c;
        private final CountDownLatch  started = new CountDownLatch(1);
        private volatile long         startNanos;

        private CaseTask(MeasurementCase c) {
            this.c = c;
        }

        @Override
        public CaseOutcome call() {
            startNanos = System.nanoTime();
            started.countDown();
            return measure(c);
        }

        private long elapsedMs() {
            return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        }
    }

    private static final Logger log = LoggerFactory.getLogger(BatchRunner.class);

    private final CircumferenceMeasurer circumference;
    private final BatchConfig           config;
    private final ExecutorService       executor;
    private final ExtentMeasurer        extents;
    private final HeightMeasurer        heights;

    public BatchRunner(BatchConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("Batch configuration is required");
        }
        this.config = config;
        var sectionConfig = config.getSectionConfig();
        circumference = new CircumferenceMeasurer(sectionConfig);
        extents = new ExtentMeasurer(sectionConfig);
        heights = new HeightMeasurer(sectionConfig);
        executor = Executors.newFixedThreadPool(config.getThreadCount(), workers());
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    /**
     * Measure every case.
     *
     * @throws IllegalArgumentException if two cases share an id
     * @throws InterruptedException     if interrupted while waiting for the workers
     */
    public BatchReport run(List<MeasurementCase> cases) throws InterruptedException {
        if (cases == null) {
            throw new IllegalArgumentException("Cases must not be null");
        }
        var ids = new HashSet<String>();
        for (var c : cases) {
            if (c == null) {
                throw new IllegalArgumentException("Cases must not be null");
            }
            if (!ids.add(c.caseId())) {
                throw new IllegalArgumentException("Duplicate case id: " + c.caseId());
            }
        }
        long start = System.currentTimeMillis();
        var tasks = new ArrayList<CaseTask>(cases.size());
        var futures = new ArrayList<Future<CaseOutcome>>(cases.size());
        for (var c : cases) {
            var task = new CaseTask(c);
            tasks.add(task);
            futures.add(executor.submit(task));
        }
        var outcomes = new ArrayList<CaseOutcome>(cases.size());
        for (int i = 0; i < cases.size(); i++) {
            outcomes.add(collect(tasks.get(i), futures.get(i)));
        }
        var report = new BatchReport(outcomes, System.currentTimeMillis() - start);
        log.info("Batch of {} cases in {} ms: {} measured, {} contract violations, {} cancelled, {} failed",
                 report.size(), report.elapsedMs(), report.count(CaseOutcome.Status.MEASURED),
                 report.count(CaseOutcome.Status.CONTRACT_VIOLATION), report.count(CaseOutcome.Status.CANCELLED),
                 report.count(CaseOutcome.Status.FAILED));
        return report;
    }

    /**
     * Measure one case on the calling thread
     */
    CaseOutcome measure(MeasurementCase c) {
        try {
            var cloud = c.cloud();
            var results = new ArrayList<MeasurementResult>();
            results.addAll(circumference.measureAll(cloud, config.getCircumferenceKeys(), c.caseId()).values());
            for (var key : config.getExtentKeys()) {
                results.add(extents.measure(cloud, key));
            }
            for (var key : config.getHeightKeys()) {
                results.add(heights.measure(cloud, key));
            }
            log.debug("Measured case {}: {} results", c.caseId(), results.size());
            return CaseOutcome.measured(c.caseId(), results);
        } catch (IllegalArgumentException | NullPointerException e) {
            log.warn("Contract violation in case {}: {}", c.caseId(), e.getMessage());
            return CaseOutcome.contractViolation(c.caseId(), String.valueOf(e.getMessage()));
        }
    }

    private CaseOutcome collect(CaseTask task, Future<CaseOutcome> future) throws InterruptedException {
        var c = task.c;
        if (!task.started.await(config.getQueueTimeoutMs(), TimeUnit.MILLISECONDS)) {
            future.cancel(true);
            log.warn("Case {} not started within {} ms, cancelled", c.caseId(), config.getQueueTimeoutMs());
            return CaseOutcome.notStarted(c.caseId(), config.getQueueTimeoutMs());
        }
        long remaining = Math.max(0, config.getCaseTimeoutMs() - task.elapsedMs());
        try {
            return future.get(remaining, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Case {} exceeded {} ms, cancelled", c.caseId(), config.getCaseTimeoutMs());
            return CaseOutcome.cancelled(c.caseId(), config.getCaseTimeoutMs());
        } catch (ExecutionException e) {
            if (e.getCause() instanceof CancellationException) {
                log.warn("Case {} interrupted: {}", c.caseId(), e.getCause().getMessage());
                return CaseOutcome.cancelled(c.caseId(), config.getCaseTimeoutMs());
            }
            log.error("Case {} failed", c.caseId(), e.getCause());
            return CaseOutcome.failed(c.caseId(), String.valueOf(e.getCause()));
        }
    }

    private ThreadFactory workers() {
        var count = new AtomicInteger();
        return r -> {
            var thread = new Thread(r, "girth-batch-" + count.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
