package org.caureq.caureqalertdesk.api.dto;

import org.caureq.caureqalertdesk.domain.SourceType;

public record SourceCountDTO(SourceType sourceType, long count) {}
