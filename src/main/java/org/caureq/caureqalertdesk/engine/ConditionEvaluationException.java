package org.caureq.caureqalertdesk.engine;

/** A rule's conditions cannot be evaluated. The rule is treated as not matching. */
public class ConditionEvaluationException extends RuntimeException {
    private final String ruleId;

    public ConditionEvaluationException(String ruleId, String message) {
        super("rule " + ruleId + ": " + message);
        this.ruleId = ruleId;
    }

    public String ruleId() { return ruleId; }
}
