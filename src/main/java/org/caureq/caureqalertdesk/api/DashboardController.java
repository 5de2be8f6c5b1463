package org.caureq.caureqalertdesk.api;

import lombok.RequiredArgsConstructor;
import org.caureq.caureqalertdesk.api.dto.AlertDTO;
import org.caureq.caureqalertdesk.api.dto.AlertSummaryDTO;
import org.caureq.caureqalertdesk.api.dto.RecentActivityDTO;
import org.caureq.caureqalertdesk.api.dto.SourceCountDTO;
import org.caureq.caureqalertdesk.api.dto.TopOffenderDTO;
import org.caureq.caureqalertdesk.api.dto.TrendPointDTO;
import org.caureq.caureqalertdesk.service.DashboardService;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Dashboard read APIs. DB-backed aggregates only, no side effects.
 */
@RestController
@RequestMapping("/api/dashboard")
@RequiredArgsConstructor
public class DashboardController {
    private final DashboardService dashboard;

    @GetMapping("/summary")
    public AlertSummaryDTO summary() {
        return dashboard.summary();
    }

    @GetMapping("/top-offenders")
    public List<TopOffenderDTO> topOffenders(@RequestParam(value = "limit", required = false) Integer limit) {
        return dashboard.topOffenders(limit);
    }

    @GetMapping("/recent-activities")
    public List<RecentActivityDTO> recent(@RequestParam(value = "limit", required = false) Integer limit) {
        return dashboard.recentActivities(limit);
    }

    @GetMapping("/auto-closed")
    public List<AlertDTO> autoClosed(
            @RequestParam(value = "hours", required = false) Integer hours,
            @RequestParam(value = "limit", required = false) Integer limit
    ) {
        return dashboard.recentlyAutoClosed(hours, limit);
    }

    @GetMapping("/trends")
    public List<TrendPointDTO> trends(@RequestParam(value = "days", required = false) Integer days) {
        return dashboard.trends(days);
    }

    @GetMapping("/sources")
    public List<SourceCountDTO> sources() {
        return dashboard.sourceDistribution();
    }
}
