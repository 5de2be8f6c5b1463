package org.caureq.caureqalertdesk.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ResolveAlertDTO(
        @NotBlank @Size(max = 2000) String resolutionNotes,
        @NotBlank @Size(max = 128) String resolvedBy
) {}
