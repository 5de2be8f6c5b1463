package org.caureq.caureqalertdesk.store;

import lombok.RequiredArgsConstructor;
import org.caureq.caureqalertdesk.domain.AlertRecord;
import org.caureq.caureqalertdesk.domain.AlertStatus;
import org.caureq.caureqalertdesk.domain.SourceType;
import org.caureq.caureqalertdesk.engine.AlertStore;
import org.caureq.caureqalertdesk.engine.InvalidStateException;
import org.caureq.caureqalertdesk.engine.NotFoundException;
import org.caureq.caureqalertdesk.engine.StoreUnavailableException;
import org.caureq.caureqalertdesk.engine.Transition;
import org.caureq.caureqalertdesk.repo.AlertRepo;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

/**
 * {@link AlertStore} over Spring Data JPA.
 *
 * Transitions are applied in one transaction: load, re-validate the persisted
 * status, mutate, flush. The entity's {@code @Version} turns a concurrent
 * writer into a failed flush, reported as {@link StoreUnavailableException}.
 */
@Component
@RequiredArgsConstructor
public class JpaAlertStore implements AlertStore {
    private static final List<AlertStatus> NON_TERMINAL = List.of(AlertStatus.OPEN, AlertStatus.ESCALATED);

    private final AlertRepo repo;

    @Override
    @Transactional(readOnly = true)
    public AlertRecord get(String id) {
        try {
            return repo.findById(id).orElseThrow(() -> NotFoundException.alert(id));
        } catch (DataAccessException e) {
            throw unavailable("load alert " + id, e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<AlertRecord> findByEntityAndWindow(String entityKey, SourceType sourceType, Instant since) {
        try {
            return repo.findByEntityKeyAndSourceTypeAndTsGreaterThanEqual(entityKey, sourceType, since);
        } catch (DataAccessException e) {
            throw unavailable("window query for " + entityKey, e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<AlertRecord> findOpenOrEscalated(Instant afterTs, String afterId, int limit) {
        try {
            return repo.findPendingAfter(NON_TERMINAL, afterTs, afterId, PageRequest.of(0, limit));
        } catch (DataAccessException e) {
            throw unavailable("open alerts query", e);
        }
    }

    @Override
    @Transactional
    public AlertRecord applyTransition(String alertId, Transition transition) {
        try {
            var alert = repo.findById(alertId).orElseThrow(() -> NotFoundException.alert(alertId));
            if (!alert.getStatus().canMoveTo(transition.to())) {
                throw new InvalidStateException(alertId, alert.getStatus(), transition.to());
            }
            transition.applyTo(alert);
            return repo.saveAndFlush(alert);
        } catch (DataAccessException e) {
            throw unavailable("apply " + transition.to() + " to " + alertId, e);
        }
    }

    private static StoreUnavailableException unavailable(String what, DataAccessException e) {
        return new StoreUnavailableException("alert store failed to " + what + ": " + e.getMostSpecificCause().getMessage(), e);
    }
}
