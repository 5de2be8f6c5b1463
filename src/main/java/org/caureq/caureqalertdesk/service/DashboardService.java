package org.caureq.caureqalertdesk.service;

import lombok.RequiredArgsConstructor;
import org.caureq.caureqalertdesk.api.dto.AlertDTO;
import org.caureq.caureqalertdesk.api.dto.AlertSummaryDTO;
import org.caureq.caureqalertdesk.api.dto.RecentActivityDTO;
import org.caureq.caureqalertdesk.api.dto.SourceCountDTO;
import org.caureq.caureqalertdesk.api.dto.TopOffenderDTO;
import org.caureq.caureqalertdesk.api.dto.TrendPointDTO;
import org.caureq.caureqalertdesk.domain.AlertSeverity;
import org.caureq.caureqalertdesk.domain.AlertStatus;
import org.caureq.caureqalertdesk.domain.SourceType;
import org.caureq.caureqalertdesk.repo.AlertRepo;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Read side for the dashboard. Aggregates run in the database where JPQL can
 * express them; daily trends are bucketed in memory by UTC day.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class DashboardService {
    private static final List<AlertStatus> ACTIVE = List.of(AlertStatus.OPEN, AlertStatus.ESCALATED);

    private final AlertRepo repo;
    private final Clock clock;

    public AlertSummaryDTO summary() {
        var byStatus = counts(repo.countByStatus(), AlertStatus.class);
        var bySeverity = counts(repo.countBySeverity(), AlertSeverity.class);
        long total = byStatus.values().stream().mapToLong(Long::longValue).sum();
        return new AlertSummaryDTO(total,
                bySeverity.getOrDefault(AlertSeverity.CRITICAL, 0L),
                bySeverity.getOrDefault(AlertSeverity.WARNING, 0L),
                bySeverity.getOrDefault(AlertSeverity.INFO, 0L),
                byStatus.getOrDefault(AlertStatus.OPEN, 0L),
                byStatus.getOrDefault(AlertStatus.ESCALATED, 0L),
                byStatus.getOrDefault(AlertStatus.AUTO_CLOSED, 0L),
                byStatus.getOrDefault(AlertStatus.RESOLVED, 0L));
    }

    public List<TopOffenderDTO> topOffenders(Integer limit) {
        return repo.topOffenders(ACTIVE, PageRequest.of(0, clamp(limit, 10, 100)));
    }

    public List<RecentActivityDTO> recentActivities(Integer limit) {
        return repo.recentActivities(PageRequest.of(0, clamp(limit, 20, 200)));
    }

    public List<AlertDTO> recentlyAutoClosed(Integer hours, Integer limit) {
        var since = clock.instant().minus(Duration.ofHours(clamp(hours, 24, 24 * 30)));
        var page = PageRequest.of(0, clamp(limit, 20, 200), Sort.by("closedAt").descending());
        return repo.findByStatusAndClosedAtGreaterThanEqual(AlertStatus.AUTO_CLOSED, since, page)
                .getContent().stream().map(AlertDTO::from).toList();
    }

    /** One point per UTC day, oldest first, days without alerts included. */
    public List<TrendPointDTO> trends(Integer days) {
        int n = clamp(days, 7, 90);
        var today = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
        var first = today.minusDays(n - 1L);
        var alerts = repo.findByTsGreaterThanEqual(first.atStartOfDay(ZoneOffset.UTC).toInstant());

        var points = new ArrayList<TrendPointDTO>(n);
        for (var day = first; !day.isAfter(today); day = day.plusDays(1)) {
            final var d = day;
            var ofDay = alerts.stream().filter(a -> LocalDate.ofInstant(a.getTs(), ZoneOffset.UTC).equals(d)).toList();
            points.add(new TrendPointDTO(d, ofDay.size(),
                    ofDay.stream().filter(a -> a.getEscalatedAt() != null).count(),
                    ofDay.stream().filter(a -> a.getStatus() == AlertStatus.AUTO_CLOSED).count(),
                    ofDay.stream().filter(a -> a.getStatus() == AlertStatus.RESOLVED).count()));
        }
        return points;
    }

    /** Every source type, zero counts included, largest first. */
    public List<SourceCountDTO> sourceDistribution() {
        var bySource = counts(repo.countBySourceType(), SourceType.class);
        var out = new ArrayList<SourceCountDTO>();
        for (var s : SourceType.values()) out.add(new SourceCountDTO(s, bySource.getOrDefault(s, 0L)));
        out.sort(Comparator.comparingLong(SourceCountDTO::count).reversed());
        return out;
    }

    private static <E extends Enum<E>> Map<E, Long> counts(List<Object[]> rows, Class<E> type) {
        var out = new EnumMap<E, Long>(type);
        for (var row : rows) {
            if (row[0] != null) out.put(type.cast(row[0]), ((Number) row[1]).longValue());
        }
        return out;
    }

    private static int clamp(Integer v, int dflt, int max) {
        return (v == null || v <= 0) ? dflt : Math.min(v, max);
    }
}
