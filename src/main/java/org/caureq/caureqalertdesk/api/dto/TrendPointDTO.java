package org.caureq.caureqalertdesk.api.dto;

import java.time.LocalDate;

public record TrendPointDTO(LocalDate date, long totalAlerts, long escalated, long autoClosed, long resolved) {}
