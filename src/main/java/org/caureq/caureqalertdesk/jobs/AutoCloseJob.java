package org.caureq.caureqalertdesk.jobs;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.caureqalertdesk.engine.RuleEngine;
import org.caureq.caureqalertdesk.engine.SweepStats;
import org.caureq.caureqalertdesk.service.JobService;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodic auto-close sweep. At most one sweep runs per process: a scheduled
 * tick or manual trigger arriving while one is in progress is skipped.
 * Job bookkeeping is best effort and never stops the sweep itself.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AutoCloseJob {
    public static final String JOB_TYPE = "auto_close";

    private final RuleEngine engine;
    private final JobService jobs;
    private final Clock clock;
    private final AtomicBoolean running = new AtomicBoolean(false);

    @Scheduled(fixedDelayString = "${app.sweep.interval-ms:300000}",
            initialDelayString = "${app.sweep.initial-delay-ms:60000}")
    public void scheduled() {
        try {
            if (runOnce().isEmpty()) log.info("[Sweep] previous run still in progress, tick skipped");
        } catch (RuntimeException e) {
            log.error("[Sweep] run failed", e);
        }
    }

    /** @return stats of the run, or empty when another sweep holds the guard */
    public Optional<SweepStats> runOnce() {
        if (!running.compareAndSet(false, true)) return Optional.empty();
        try {
            return Optional.of(execute());
        } finally {
            running.set(false);
        }
    }

    /** Manual trigger. */
    public SweepStats trigger() {
        return runOnce().orElseThrow(SweepInProgressException::new);
    }

    public boolean isRunning() {
        return running.get();
    }

    private SweepStats execute() {
        var jobId = startRecord();
        long t0 = clock.millis();
        try {
            var stats = engine.sweepAutoClose();
            if (jobId != null) {
                try {
                    jobs.complete(jobId, stats, clock.millis() - t0);
                } catch (RuntimeException e) {
                    log.warn("[Sweep] could not complete job record {}: {}", jobId, e.getMessage());
                }
            }
            return stats;
        } catch (RuntimeException e) {
            if (jobId != null) {
                try {
                    jobs.fail(jobId, e.getMessage(), clock.millis() - t0);
                } catch (RuntimeException bookkeeping) {
                    log.warn("[Sweep] could not mark job {} failed: {}", jobId, bookkeeping.getMessage());
                }
            }
            throw e;
        }
    }

    private String startRecord() {
        try {
            return jobs.start(JOB_TYPE);
        } catch (RuntimeException e) {
            log.warn("[Sweep] could not create job record: {}", e.getMessage());
            return null;
        }
    }
}
