package org.caureq.caureqalertdesk.api.dto;

import jakarta.annotation.Nullable;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import org.caureq.caureqalertdesk.domain.RuleConditions;

public record RuleConditionsDTO(
        @Nullable @Positive Integer escalateIfCount,
        @Nullable @Positive Integer windowMins,
        @Nullable @Size(min = 1, max = 128) String autoCloseIf,
        @Nullable @Positive Integer expireAfterMins
) {
    public static RuleConditionsDTO from(RuleConditions c) {
        return new RuleConditionsDTO(c.getEscalateIfCount(), c.getWindowMins(), c.getAutoCloseIf(), c.getExpireAfterMins());
    }

    public RuleConditions toConditions() {
        return new RuleConditions(escalateIfCount, windowMins, autoCloseIf, expireAfterMins);
    }
}
