package org.caureq.caureqalertdesk.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Entity
@Table(name = "alerts", indexes = {
        @Index(name = "idx_alert_ts", columnList = "ts DESC"),
        @Index(name = "idx_alert_entity_src_ts", columnList = "entity_key, source_type, ts"),
        @Index(name = "idx_alert_status", columnList = "status")
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class AlertRecord {
    @Id
    @Column(length = 32)
    private String id; // OSP-2026-00001

    @Enumerated(EnumType.STRING)
    @Column(name = "source_type", nullable = false, length = 32)
    private SourceType sourceType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private AlertSeverity severity;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private AlertStatus status;

    @Column(name = "entity_key", length = 128)
    private String entityKey; // driver id

    @Column(nullable = false)
    private Instant ts;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "alert_metadata", joinColumns = @JoinColumn(name = "alert_id"))
    @MapKeyColumn(name = "meta_key", length = 128)
    @Builder.Default
    private Map<String, MetadataValue> metadata = new HashMap<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "alert_state_history", joinColumns = @JoinColumn(name = "alert_id"))
    @OrderColumn(name = "seq")
    @Builder.Default
    private List<StateTransition> stateHistory = new ArrayList<>();

    private Instant escalatedAt;
    private Instant closedAt;
    private Instant resolvedAt;
    private Instant expiresAt;
    private Instant updatedAt;

    @Column(length = 512)
    private String autoCloseReason;

    @Column(length = 128)
    private String resolvedBy;

    @Column(length = 2000)
    private String resolutionNotes;

    @Version
    private Long version;

    public Optional<MetadataValue> metadataValue(String key) {
        return Optional.ofNullable(metadata == null ? null : metadata.get(key));
    }
}
