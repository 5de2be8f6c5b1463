package org.caureq.caureqalertdesk.api.dto;

import java.util.List;

public record AlertPageDTO(List<AlertDTO> alerts, long total, int offset, int limit) {}
