package org.caureq.caureqalertdesk.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/** One entry of an alert's append-only state history. */
@Embeddable
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class StateTransition {
    @Enumerated(EnumType.STRING)
    @Column(name = "from_status", nullable = false, length = 16)
    private AlertStatus fromStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "to_status", nullable = false, length = 16)
    private AlertStatus toStatus;

    @Column(name = "ts", nullable = false)
    private Instant ts;

    @Column(length = 512)
    private String reason;

    @Column(name = "triggered_by", length = 128)
    private String triggeredBy;   // "system" or operator id

    @Column(name = "rule_triggered", length = 64)
    private String ruleTriggered;
}
