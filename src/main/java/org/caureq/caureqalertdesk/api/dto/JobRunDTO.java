package org.caureq.caureqalertdesk.api.dto;

import org.caureq.caureqalertdesk.domain.JobRun;

import java.time.Instant;
import java.util.List;

public record JobRunDTO(
        String jobId, String jobType, JobRun.Status status,
        Instant startedAt, Instant completedAt, Long executionTimeMs,
        int alertsProcessed, int alertsClosed, int alertsEscalated, int errorCount,
        List<String> errors
) {
    public static JobRunDTO from(JobRun j) {
        return new JobRunDTO(j.getId(), j.getJobType(), j.getStatus(),
                j.getStartedAt(), j.getCompletedAt(), j.getExecutionTimeMs(),
                j.getAlertsProcessed(), j.getAlertsClosed(), j.getAlertsEscalated(), j.getErrorCount(),
                List.copyOf(j.getErrors()));
    }
}
