package org.caureq.caureqalertdesk.domain;

/**
 * Where an alert comes from. Each type carries the prefix used in alert ids
 * and the severity a new alert gets when the producer does not send one.
 */
public enum SourceType {
    OVERSPEEDING("OSP", AlertSeverity.WARNING),
    COMPLIANCE("CMP", AlertSeverity.INFO),
    FEEDBACK_NEGATIVE("FBN", AlertSeverity.WARNING),
    FEEDBACK_POSITIVE("FBP", AlertSeverity.INFO),
    DOCUMENT_EXPIRY("DOC", AlertSeverity.WARNING),
    SAFETY("SAF", AlertSeverity.CRITICAL);

    private final String prefix;
    private final AlertSeverity defaultSeverity;

    SourceType(String prefix, AlertSeverity defaultSeverity) {
        this.prefix = prefix;
        this.defaultSeverity = defaultSeverity;
    }

    public String prefix() { return prefix; }
    public AlertSeverity defaultSeverity() { return defaultSeverity; }
}
