package org.caureq.caureqalertdesk.api.error;
public enum ErrorCode {
    BAD_REQUEST, ALERT_NOT_FOUND, RULE_NOT_FOUND, NOT_FOUND, INVALID_TRANSITION, RULE_CONFLICT,
    INVALID_RULE, SWEEP_RUNNING, CONCURRENT_UPDATE, STORE_UNAVAILABLE, AUTH_REQUIRED, FORBIDDEN, INTERNAL_ERROR
}
