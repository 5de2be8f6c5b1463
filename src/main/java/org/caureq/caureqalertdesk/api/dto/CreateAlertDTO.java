package org.caureq.caureqalertdesk.api.dto;

import jakarta.annotation.Nullable;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import org.caureq.caureqalertdesk.domain.AlertSeverity;
import org.caureq.caureqalertdesk.domain.SourceType;

import java.util.Map;

/**
 * entityKey falls back to metadata.driver_id; severity falls back to the source type default.
 */
public record CreateAlertDTO(
        @NotNull SourceType sourceType,
        @Nullable @Size(max = 128) String entityKey,
        @Nullable AlertSeverity severity,
        @Nullable @Size(max = 50) Map<@Size(min = 1, max = 128) String, Object> metadata // {"driver_id":"DRV001","speed":85.5}
) {}
