package org.caureq.caureqalertdesk.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "job_runs", indexes = {
        @Index(name = "idx_job_started", columnList = "started_at DESC")
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class JobRun {
    public enum Status { RUNNING, COMPLETED, FAILED }

    @Id
    @Column(length = 40)
    private String id; // JOB-20261017-114500-9f2c01ab

    @Column(name = "job_type", nullable = false, length = 64)
    private String jobType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Status status;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;
    private Instant completedAt;

    private int alertsProcessed;
    private int alertsClosed;
    private int alertsEscalated;
    private int errorCount;
    private Long executionTimeMs;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "job_run_errors", joinColumns = @JoinColumn(name = "job_id"))
    @OrderColumn(name = "seq")
    @Column(name = "message", length = 1000)
    @Builder.Default
    private List<String> errors = new ArrayList<>();
}
