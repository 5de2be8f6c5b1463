package org.caureq.caureqalertdesk.api;

import lombok.RequiredArgsConstructor;
import org.caureq.caureqalertdesk.api.dto.JobRunDTO;
import org.caureq.caureqalertdesk.engine.SweepStats;
import org.caureq.caureqalertdesk.jobs.AutoCloseJob;
import org.caureq.caureqalertdesk.service.JobService;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/admin/jobs")
@RequiredArgsConstructor
public class JobsAdminController {
    private final JobService jobs;
    private final AutoCloseJob autoClose;

    @GetMapping
    public List<JobRunDTO> recent(@RequestParam(value = "limit", required = false) Integer limit) {
        return jobs.recent(limit);
    }

    @GetMapping("/{jobId}")
    public JobRunDTO get(@PathVariable String jobId) {
        return jobs.get(jobId);
    }

    @GetMapping("/auto-close/status")
    public Map<String, Object> status() {
        return Map.of("running", autoClose.isRunning());
    }

    /** 409 when a sweep is already in progress. */
    @PostMapping("/auto-close/run")
    public SweepStats run() {
        return autoClose.trigger();
    }
}
