package org.caureq.caureqalertdesk.domain;

import jakarta.persistence.*;
import lombok.*;

/** Per prefix and year counter backing alert ids. */
@Entity
@Table(name = "alert_sequences")
@Getter @Setter @NoArgsConstructor @AllArgsConstructor
public class AlertSequence {
    @Id
    @Column(length = 32)
    private String id; // alert_OSP_2026

    @Column(nullable = false)
    private long sequence;
}
