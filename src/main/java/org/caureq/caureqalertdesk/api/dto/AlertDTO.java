package org.caureq.caureqalertdesk.api.dto;

import org.caureq.caureqalertdesk.domain.AlertRecord;
import org.caureq.caureqalertdesk.domain.AlertSeverity;
import org.caureq.caureqalertdesk.domain.AlertStatus;
import org.caureq.caureqalertdesk.domain.MetadataValue;
import org.caureq.caureqalertdesk.domain.SourceType;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record AlertDTO(
        String id, SourceType sourceType, AlertSeverity severity, AlertStatus status,
        String entityKey, Instant timestamp, Map<String, Object> metadata,
        List<StateTransitionDTO> stateHistory,
        Instant escalatedAt, Instant closedAt, Instant resolvedAt, Instant expiresAt,
        String autoCloseReason, String resolvedBy, String resolutionNotes, Instant updatedAt
) {
    public static AlertDTO from(AlertRecord a) {
        return new AlertDTO(
                a.getId(), a.getSourceType(), a.getSeverity(), a.getStatus(),
                a.getEntityKey(), a.getTs(), MetadataValue.toMap(a.getMetadata()),
                a.getStateHistory().stream().map(StateTransitionDTO::from).toList(),
                a.getEscalatedAt(), a.getClosedAt(), a.getResolvedAt(), a.getExpiresAt(),
                a.getAutoCloseReason(), a.getResolvedBy(), a.getResolutionNotes(), a.getUpdatedAt()
        );
    }
}
