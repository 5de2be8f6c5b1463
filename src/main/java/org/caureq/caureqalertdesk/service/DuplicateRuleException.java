package org.caureq.caureqalertdesk.service;

public class DuplicateRuleException extends RuntimeException {
    private final String ruleId;

    public DuplicateRuleException(String ruleId) {
        super("rule already exists: " + ruleId);
        this.ruleId = ruleId;
    }

    public String ruleId() { return ruleId; }
}
