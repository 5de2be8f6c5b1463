package org.caureq.caureqalertdesk.domain;

public enum AlertSeverity {
    INFO, WARNING, CRITICAL
}
