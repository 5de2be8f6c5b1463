package org.caureq.caureqalertdesk.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "alert_rules", indexes = {
        @Index(name = "idx_rule_src_active_prio", columnList = "source_type, is_active, priority")
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class AlertRule {
    @Id
    @Column(name = "rule_id", length = 64)
    private String ruleId;

    @Enumerated(EnumType.STRING)
    @Column(name = "source_type", nullable = false, length = 32)
    private SourceType sourceType;

    @Column(nullable = false, length = 128)
    private String name;

    @Column(length = 1000)
    private String description;

    @Embedded
    private RuleConditions conditions;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(nullable = false)
    private int priority; // lower runs first

    private Instant createdAt;
    private Instant updatedAt;

    /** Hibernate leaves an all-null embeddable as null. */
    public RuleConditions getConditions() {
        if (conditions == null) conditions = new RuleConditions();
        return conditions;
    }
}
