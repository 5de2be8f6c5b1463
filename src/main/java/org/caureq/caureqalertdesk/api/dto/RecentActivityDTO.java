package org.caureq.caureqalertdesk.api.dto;

import org.caureq.caureqalertdesk.domain.AlertSeverity;
import org.caureq.caureqalertdesk.domain.AlertStatus;
import org.caureq.caureqalertdesk.domain.SourceType;

import java.time.Instant;

/** One history entry flattened with its alert's current state. */
public record RecentActivityDTO(
        String alertId, SourceType sourceType, AlertSeverity severity, AlertStatus status,
        String entityKey, Instant timestamp, AlertStatus fromStatus, AlertStatus toStatus,
        String reason, String triggeredBy
) {}
