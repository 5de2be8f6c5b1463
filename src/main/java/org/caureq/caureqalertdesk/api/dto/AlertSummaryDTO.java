package org.caureq.caureqalertdesk.api.dto;

public record AlertSummaryDTO(
        long totalAlerts,
        long criticalCount, long warningCount, long infoCount,
        long openCount, long escalatedCount, long autoClosedCount, long resolvedCount
) {}
