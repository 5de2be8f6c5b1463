package org.caureq.caureqalertdesk.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.*;
import org.caureq.caureqalertdesk.engine.ConditionEvaluationException;

import java.util.ArrayList;

/**
 * Up to three independent clauses: escalation count within a window,
 * an auto-close metadata flag, and an expiry duration.
 */
@Embeddable
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class RuleConditions {
    @Column(name = "escalate_if_count")
    private Integer escalateIfCount;

    @Column(name = "window_mins")
    private Integer windowMins;

    @Column(name = "auto_close_if", length = 128)
    private String autoCloseIf; // metadata field name

    @Column(name = "expire_after_mins")
    private Integer expireAfterMins;

    public boolean hasEscalation() { return escalateIfCount != null; }
    public boolean hasAutoCloseCondition() { return autoCloseIf != null; }
    public boolean hasExpiry() { return expireAfterMins != null; }

    /**
     * Rejects clauses that are present but cannot be evaluated.
     *
     * @throws ConditionEvaluationException listing every problem found
     */
    public void validate(String ruleId) {
        var problems = new ArrayList<String>();
        if (hasEscalation()) {
            if (escalateIfCount < 1) problems.add("escalate_if_count must be >= 1");
            if (windowMins == null) problems.add("window_mins is required with escalate_if_count");
            else if (windowMins < 1) problems.add("window_mins must be >= 1");
        }
        if (hasAutoCloseCondition() && autoCloseIf.isBlank()) problems.add("auto_close_if must name a metadata field");
        if (hasExpiry() && expireAfterMins < 1) problems.add("expire_after_mins must be >= 1");
        if (!problems.isEmpty()) throw new ConditionEvaluationException(ruleId, String.join("; ", problems));
    }
}
