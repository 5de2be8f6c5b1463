package org.caureq.caureqalertdesk.engine;

import org.caureq.caureqalertdesk.domain.AlertStatus;

/** A transition was requested from a terminal or incompatible status. */
public class InvalidStateException extends RuntimeException {
    private final String alertId;
    private final AlertStatus current;
    private final AlertStatus requested;

    public InvalidStateException(String alertId, AlertStatus current, AlertStatus requested) {
        this("alert %s cannot move %s -> %s".formatted(alertId, current, requested), alertId, current, requested);
    }

    private InvalidStateException(String message, String alertId, AlertStatus current, AlertStatus requested) {
        super(message);
        this.alertId = alertId;
        this.current = current;
        this.requested = requested;
    }

    /** The alert is closed and accepts no further changes of any kind. {@link #requested()} is null. */
    public static InvalidStateException terminal(String alertId, AlertStatus current) {
        return new InvalidStateException("alert %s is %s and can no longer be changed".formatted(alertId, current),
                alertId, current, null);
    }

    public String alertId() { return alertId; }
    public AlertStatus current() { return current; }
    public AlertStatus requested() { return requested; }
}
