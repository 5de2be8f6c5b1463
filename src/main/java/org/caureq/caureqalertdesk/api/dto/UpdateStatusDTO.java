package org.caureq.caureqalertdesk.api.dto;

import jakarta.annotation.Nullable;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import org.caureq.caureqalertdesk.domain.AlertStatus;

public record UpdateStatusDTO(
        @NotNull AlertStatus newStatus,
        @NotBlank @Size(max = 512) String reason,
        @Nullable @Size(max = 128) String actor
) {}
