package org.caureq.caureqalertdesk.api.dto;

import org.caureq.caureqalertdesk.domain.AlertStatus;
import org.caureq.caureqalertdesk.domain.StateTransition;

import java.time.Instant;

public record StateTransitionDTO(
        AlertStatus fromStatus, AlertStatus toStatus, Instant timestamp,
        String reason, String triggeredBy, String ruleTriggered
) {
    public static StateTransitionDTO from(StateTransition t) {
        return new StateTransitionDTO(t.getFromStatus(), t.getToStatus(), t.getTs(),
                t.getReason(), t.getTriggeredBy(), t.getRuleTriggered());
    }
}
