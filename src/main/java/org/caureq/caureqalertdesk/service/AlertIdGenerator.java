package org.caureq.caureqalertdesk.service;

import lombok.RequiredArgsConstructor;
import org.caureq.caureqalertdesk.domain.SourceType;
import org.caureq.caureqalertdesk.repo.AlertSequenceRepo;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.ZoneOffset;

/**
 * Human readable alert ids: {@code PREFIX-YEAR-NNNNN}, one counter per prefix and UTC year.
 * The counter row is created with an idempotent insert, then locked for the duration of its own transaction,
 * so callers racing on a new prefix or year serialize on the row instead of colliding on its key.
 */
@Component
@RequiredArgsConstructor
public class AlertIdGenerator {
    private final AlertSequenceRepo repo;
    private final Clock clock;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public String next(SourceType sourceType) {
        int year = clock.instant().atZone(ZoneOffset.UTC).getYear();
        var key = "alert_%s_%d".formatted(sourceType.prefix(), year);
        repo.insertIfAbsent(key);
        var seq = repo.findForUpdate(key)
                .orElseThrow(() -> new IllegalStateException("alert sequence " + key + " missing after insert"));
        seq.setSequence(seq.getSequence() + 1);
        repo.save(seq);
        return "%s-%d-%05d".formatted(sourceType.prefix(), year, seq.getSequence());
    }
}
