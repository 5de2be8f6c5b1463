package org.caureq.caureqalertdesk.service;

import lombok.RequiredArgsConstructor;
import org.caureq.caureqalertdesk.api.dto.JobRunDTO;
import org.caureq.caureqalertdesk.domain.JobRun;
import org.caureq.caureqalertdesk.engine.NotFoundException;
import org.caureq.caureqalertdesk.engine.SweepStats;
import org.caureq.caureqalertdesk.repo.JobRunRepo;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.UUID;

/** Bookkeeping for background runs: one {@link JobRun} row per run. */
@Service
@RequiredArgsConstructor
public class JobService {
    static final int MAX_ERROR_LENGTH = 1000; // job_run_errors.message

    private static final DateTimeFormatter ID_TS = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneOffset.UTC);

    private final JobRunRepo repo;
    private final Clock clock;

    @Transactional
    public String start(String jobType) {
        var now = clock.instant();
        var id = "JOB-%s-%s".formatted(ID_TS.format(now), UUID.randomUUID().toString().replace("-", "").substring(0, 8));
        repo.save(JobRun.builder()
                .id(id).jobType(jobType).status(JobRun.Status.RUNNING).startedAt(now)
                .build());
        return id;
    }

    @Transactional
    public void complete(String jobId, SweepStats stats, long executionTimeMs) {
        var job = load(jobId);
        job.setStatus(JobRun.Status.COMPLETED);
        job.setCompletedAt(clock.instant());
        job.setExecutionTimeMs(executionTimeMs);
        job.setAlertsProcessed(stats.checked());
        job.setAlertsClosed(stats.closed());
        job.setAlertsEscalated(stats.escalated());
        job.setErrorCount(stats.errors());
        stats.failures().forEach(f -> job.getErrors().add(truncate(f)));
        repo.save(job);
    }

    @Transactional
    public void fail(String jobId, String message, long executionTimeMs) {
        var job = load(jobId);
        job.setStatus(JobRun.Status.FAILED);
        job.setCompletedAt(clock.instant());
        job.setExecutionTimeMs(executionTimeMs);
        job.setErrorCount(job.getErrorCount() + 1);
        job.getErrors().add(truncate(message));
        repo.save(job);
    }

    @Transactional(readOnly = true)
    public List<JobRunDTO> recent(Integer limit) {
        int size = (limit == null || limit <= 0) ? 20 : Math.min(limit, 200);
        return repo.findAllByOrderByStartedAtDesc(PageRequest.of(0, size)).getContent()
                .stream().map(JobRunDTO::from).toList();
    }

    @Transactional(readOnly = true)
    public JobRunDTO get(String jobId) {
        return JobRunDTO.from(load(jobId));
    }

    private JobRun load(String jobId) {
        return repo.findById(jobId).orElseThrow(() -> new NotFoundException("job", jobId));
    }

    static String truncate(String s) {
        if (s == null) return "unknown error";
        return s.length() > MAX_ERROR_LENGTH ? s.substring(0, MAX_ERROR_LENGTH) : s;
    }
}
