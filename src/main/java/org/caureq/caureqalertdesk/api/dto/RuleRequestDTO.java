package org.caureq.caureqalertdesk.api.dto;

import jakarta.annotation.Nullable;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import org.caureq.caureqalertdesk.domain.SourceType;

/** Create/update body. On update the path id wins and ruleId may be omitted. */
public record RuleRequestDTO(
        @Nullable @Size(min = 1, max = 64) @Pattern(regexp = "^[A-Za-z0-9_.-]+$") String ruleId,
        @NotNull SourceType sourceType,
        @NotBlank @Size(max = 128) String name,
        @Nullable @Size(max = 1000) String description,
        @NotNull @Valid RuleConditionsDTO conditions,
        @Nullable Boolean active,
        @Nullable Integer priority
) {}
