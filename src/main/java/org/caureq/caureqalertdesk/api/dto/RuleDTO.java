package org.caureq.caureqalertdesk.api.dto;

import org.caureq.caureqalertdesk.domain.AlertRule;
import org.caureq.caureqalertdesk.domain.SourceType;

import java.time.Instant;

public record RuleDTO(
        String ruleId, SourceType sourceType, String name, String description,
        RuleConditionsDTO conditions, boolean active, int priority,
        Instant createdAt, Instant updatedAt
) {
    public static RuleDTO from(AlertRule r) {
        return new RuleDTO(r.getRuleId(), r.getSourceType(), r.getName(), r.getDescription(),
                RuleConditionsDTO.from(r.getConditions()), r.isActive(), r.getPriority(),
                r.getCreatedAt(), r.getUpdatedAt());
    }
}
