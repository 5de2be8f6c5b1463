package org.caureq.caureqalertdesk.domain;

/**
 * Alert lifecycle. OPEN is initial, AUTO_CLOSED and RESOLVED are terminal.
 */
public enum AlertStatus {
    OPEN, ESCALATED, AUTO_CLOSED, RESOLVED;

    public boolean isTerminal() {
        return this == AUTO_CLOSED || this == RESOLVED;
    }

    public boolean canMoveTo(AlertStatus next) {
        return switch (this) {
            case OPEN -> next == ESCALATED || next == AUTO_CLOSED || next == RESOLVED;
            case ESCALATED -> next == AUTO_CLOSED || next == RESOLVED;
            case AUTO_CLOSED, RESOLVED -> false;
        };
    }
}
