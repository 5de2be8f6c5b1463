package org.caureq.caureqalertdesk.engine;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.caureqalertdesk.domain.AlertRecord;
import org.caureq.caureqalertdesk.domain.AlertRule;
import org.caureq.caureqalertdesk.domain.AlertStatus;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;

/**
 * Escalation and auto-close decisions over the alert and rule stores.
 *
 * Entry points
 * - {@link #evaluateEscalation}: right after an alert is created, inline with the request.
 * - {@link #sweepAutoClose}: periodic pass over every non-terminal alert.
 * - {@link #resolve} / {@link #changeStatus}: operator actions.
 *
 * Alert state is always re-read from the store; only rules may come from a cache.
 * No in-process lock is taken: the store validates each transition atomically.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RuleEngine {
    public static final String SYSTEM_ACTOR = "system";
    static final int MAX_REPORTED_FAILURES = 20;
    static final int MAX_FAILURE_LENGTH = 500;
    static final int SWEEP_BATCH_SIZE = 200;

    private final AlertStore alerts;
    private final RuleStore rules;
    private final Clock clock;

    private int sweepBatchSize = SWEEP_BATCH_SIZE;

    void setSweepBatchSize(int sweepBatchSize) {
        if (sweepBatchSize < 1) throw new IllegalArgumentException("sweep batch size must be positive");
        this.sweepBatchSize = sweepBatchSize;
    }

    /**
     * Escalates the alert when the first well-formed escalation rule for its source
     * type sees at least {@code escalateIfCount} alerts for the same entity inside
     * the window. Calling it again on an alert that is no longer OPEN does nothing.
     */
    public Optional<Transition> evaluateEscalation(AlertRecord alert) {
        var current = alerts.get(alert.getId());
        if (current.getStatus() != AlertStatus.OPEN) {
            log.debug("[Engine] {} is {}, escalation skipped", current.getId(), current.getStatus());
            return Optional.empty();
        }
        if (current.getEntityKey() == null || current.getEntityKey().isBlank()) {
            log.warn("[Engine] {} has no entity key, cannot check escalation", current.getId());
            return Optional.empty();
        }

        for (AlertRule rule : rules.activeRulesFor(current.getSourceType())) {
            var c = rule.getConditions();
            if (!c.hasEscalation()) continue;
            if (!wellFormed(rule, current)) continue;

            var now = clock.instant();
            int window = c.getWindowMins();
            long count = countInWindow(current, now.minus(Duration.ofMinutes(window)), now);
            if (count < c.getEscalateIfCount()) {
                log.debug("[Engine] {} rule={} count={} below threshold {} ({} min)",
                        current.getId(), rule.getRuleId(), count, c.getEscalateIfCount(), window);
                return Optional.empty();
            }

            var reason = "%d %s incidents within %d minutes".formatted(count, current.getSourceType(), window);
            var transition = Transition.escalate(now, reason, SYSTEM_ACTOR, rule.getRuleId());
            try {
                alerts.applyTransition(current.getId(), transition);
            } catch (InvalidStateException e) {
                log.info("[Engine] {} changed state concurrently, escalation dropped: {}", current.getId(), e.getMessage());
                return Optional.empty();
            }
            log.info("[Engine] escalated {} via rule {}: {}", current.getId(), rule.getRuleId(), reason);
            return Optional.of(transition);
        }
        return Optional.empty();
    }

    /**
     * One auto-close pass. Each alert is evaluated and persisted on its own;
     * a failure is counted and the pass moves on. Pending alerts are read in
     * batches of {@code sweepBatchSize}, keyed on {@code (ts, id)}, so alerts
     * closed earlier in the pass never shift the next page.
     */
    public SweepStats sweepAutoClose() {
        int checked = 0;
        int closed = 0;
        int errors = 0;
        var failures = new ArrayList<String>();

        var afterTs = Instant.EPOCH;
        var afterId = "";
        List<AlertRecord> batch;
        do {
            batch = alerts.findOpenOrEscalated(afterTs, afterId, sweepBatchSize);
            for (AlertRecord alert : batch) {
                checked++;
                afterTs = alert.getTs();
                afterId = alert.getId();
                try {
                    var decision = checkAutoClose(alert, clock.instant());
                    if (decision.isEmpty()) continue;
                    alerts.applyTransition(alert.getId(), decision.get());
                    closed++;
                    log.info("[Sweep] auto-closed {}: {}", alert.getId(), decision.get().reason());
                } catch (InvalidStateException e) {
                    log.info("[Sweep] {} left the open states during the pass: {}", alert.getId(), e.getMessage());
                } catch (StoreUnavailableException e) {
                    errors++;
                    record(failures, alert, e);
                    log.warn("[Sweep] store unavailable for {}: {}", alert.getId(), e.getMessage());
                } catch (RuntimeException e) {
                    errors++;
                    record(failures, alert, e);
                    log.error("[Sweep] failed to evaluate {}", alert.getId(), e);
                }
            }
        } while (batch.size() >= sweepBatchSize);

        var stats = new SweepStats(checked, closed, 0, errors, failures);
        log.info("[Sweep] checked={} closed={} errors={}", stats.checked(), stats.closed(), stats.errors());
        return stats;
    }

    /**
     * Decides whether the alert should be auto-closed now. Clause order:
     * metadata conditions (by rule priority), then rule expiry (by rule priority),
     * then the alert's own expiry date. First satisfied clause wins.
     */
    Optional<Transition> checkAutoClose(AlertRecord alert, Instant now) {
        if (alert.getStatus().isTerminal()) return Optional.empty();

        var usable = rules.activeRulesFor(alert.getSourceType()).stream()
                .filter(r -> wellFormed(r, alert))
                .toList();

        for (AlertRule rule : usable) {
            var field = rule.getConditions().getAutoCloseIf();
            if (field == null) continue;
            boolean satisfied = alert.metadataValue(field).map(v -> v.isTruthy()).orElse(false);
            if (satisfied) {
                return Optional.of(Transition.autoClose(now, "condition '" + field + "' satisfied",
                        SYSTEM_ACTOR, rule.getRuleId()));
            }
        }

        for (AlertRule rule : usable) {
            var mins = rule.getConditions().getExpireAfterMins();
            if (mins == null) continue;
            if (!now.isBefore(alert.getTs().plus(Duration.ofMinutes(mins)))) {
                return Optional.of(Transition.autoClose(now, "expired after " + mins + " minutes",
                        SYSTEM_ACTOR, rule.getRuleId()));
            }
        }

        if (alert.getExpiresAt() != null && !now.isBefore(alert.getExpiresAt())) {
            return Optional.of(Transition.autoClose(now, "expired at " + alert.getExpiresAt(), SYSTEM_ACTOR, null));
        }
        return Optional.empty();
    }

    /**
     * @throws NotFoundException     unknown alert
     * @throws InvalidStateException alert already AUTO_CLOSED or RESOLVED
     */
    public AlertRecord resolve(String alertId, String notes, String actor) {
        var alert = alerts.get(alertId);
        if (alert.getStatus().isTerminal()) {
            throw new InvalidStateException(alertId, alert.getStatus(), AlertStatus.RESOLVED);
        }
        var updated = alerts.applyTransition(alertId, Transition.resolve(clock.instant(), notes, actor));
        log.info("[Engine] {} resolved by {}", alertId, actor);
        return updated;
    }

    /** Operator-driven status change. For RESOLVED the reason is kept as resolution notes. */
    public AlertRecord changeStatus(String alertId, AlertStatus target, String reason, String actor) {
        var alert = alerts.get(alertId);
        if (!alert.getStatus().canMoveTo(target)) {
            throw new InvalidStateException(alertId, alert.getStatus(), target);
        }
        var now = clock.instant();
        var transition = switch (target) {
            case ESCALATED -> Transition.escalate(now, reason, actor, null);
            case AUTO_CLOSED -> Transition.autoClose(now, reason, actor, null);
            case RESOLVED -> Transition.resolve(now, reason, actor);
            case OPEN -> throw new InvalidStateException(alertId, alert.getStatus(), target);
        };
        var updated = alerts.applyTransition(alertId, transition);
        log.info("[Engine] {} moved to {} by {}", alertId, target, actor);
        return updated;
    }

    /** Alerts of any status in [since, now] for the same entity and source, the current one counted once. */
    private long countInWindow(AlertRecord current, Instant since, Instant now) {
        var ids = new HashSet<String>();
        for (var a : alerts.findByEntityAndWindow(current.getEntityKey(), current.getSourceType(), since)) {
            if (!a.getTs().isBefore(since) && !a.getTs().isAfter(now)) ids.add(a.getId());
        }
        ids.add(current.getId());
        return ids.size();
    }

    private boolean wellFormed(AlertRule rule, AlertRecord alert) {
        try {
            rule.getConditions().validate(rule.getRuleId());
            return true;
        } catch (ConditionEvaluationException e) {
            log.warn("[Rules] skipping malformed rule for {}: {}", alert.getId(), e.getMessage());
            return false;
        }
    }

    private static void record(List<String> failures, AlertRecord alert, RuntimeException e) {
        if (failures.size() >= MAX_REPORTED_FAILURES) return;
        var line = alert.getId() + ": " + e.getMessage();
        failures.add(line.length() > MAX_FAILURE_LENGTH ? line.substring(0, MAX_FAILURE_LENGTH) : line);
    }
}
