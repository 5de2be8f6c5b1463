package org.caureq.caureqalertdesk.api.dto;

import java.time.Instant;

public record TopOffenderDTO(
        String entityKey, Long openAlerts, Long escalatedAlerts, Long totalAlerts, Instant lastAlertAt
) {}
