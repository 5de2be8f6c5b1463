package org.caureq.caureqalertdesk.engine;

import org.caureq.caureqalertdesk.domain.AlertRecord;
import org.caureq.caureqalertdesk.domain.AlertSeverity;
import org.caureq.caureqalertdesk.domain.AlertStatus;
import org.caureq.caureqalertdesk.domain.StateTransition;

import java.time.Instant;
import java.util.Objects;

/**
 * A state change decided by the engine or an operator, applied by an {@link AlertStore}.
 * The source status is taken from the persisted alert when applied.
 */
public record Transition(AlertStatus to, Instant at, String reason, String triggeredBy,
                         String ruleTriggered, AlertSeverity severity, String resolutionNotes) {

    public Transition {
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(at, "at");
    }

    public static Transition escalate(Instant at, String reason, String triggeredBy, String ruleId) {
        return new Transition(AlertStatus.ESCALATED, at, reason, triggeredBy, ruleId, AlertSeverity.CRITICAL, null);
    }

    public static Transition autoClose(Instant at, String reason, String triggeredBy, String ruleId) {
        return new Transition(AlertStatus.AUTO_CLOSED, at, reason, triggeredBy, ruleId, null, null);
    }

    public static Transition resolve(Instant at, String notes, String actor) {
        return new Transition(AlertStatus.RESOLVED, at, "Alert resolved by " + actor, actor, null, null, notes);
    }

    /**
     * Mutates the alert in place: status, derived fields and one new history entry.
     * Callers must have checked {@code alert.getStatus().canMoveTo(to)}.
     */
    public void applyTo(AlertRecord alert) {
        var from = alert.getStatus();
        alert.getStateHistory().add(StateTransition.builder()
                .fromStatus(from)
                .toStatus(to)
                .ts(at)
                .reason(reason)
                .triggeredBy(triggeredBy)
                .ruleTriggered(ruleTriggered)
                .build());
        alert.setStatus(to);
        alert.setUpdatedAt(at);
        if (severity != null) alert.setSeverity(severity);
        switch (to) {
            case ESCALATED -> alert.setEscalatedAt(at);
            case AUTO_CLOSED -> {
                alert.setClosedAt(at);
                alert.setAutoCloseReason(reason);
            }
            case RESOLVED -> {
                alert.setResolvedAt(at);
                alert.setResolvedBy(triggeredBy);
                alert.setResolutionNotes(resolutionNotes);
            }
            case OPEN -> throw new IllegalStateException("no transition leads back to OPEN");
        }
    }
}
