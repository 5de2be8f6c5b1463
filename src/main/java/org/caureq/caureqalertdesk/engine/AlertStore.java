package org.caureq.caureqalertdesk.engine;

import org.caureq.caureqalertdesk.domain.AlertRecord;
import org.caureq.caureqalertdesk.domain.SourceType;

import java.time.Instant;
import java.util.List;

/**
 * Alert persistence as seen by the engine. Implementations translate
 * infrastructure failures into {@link StoreUnavailableException}.
 */
public interface AlertStore {

    /** @throws NotFoundException when no alert has this id */
    AlertRecord get(String id);

    /** Alerts of any status for this entity and source with {@code ts >= since}. */
    List<AlertRecord> findByEntityAndWindow(String entityKey, SourceType sourceType, Instant since);

    /**
     * One page of alerts not yet in a terminal status, ordered by {@code (ts, id)}
     * and starting strictly after the given cursor. Pass {@link Instant#EPOCH} and
     * an empty id for the first page.
     */
    List<AlertRecord> findOpenOrEscalated(Instant afterTs, String afterId, int limit);

    /**
     * Atomically validates the transition against the persisted status, appends
     * the history entry and sets the derived fields. Either everything is
     * persisted or nothing is.
     *
     * @throws NotFoundException     when the alert does not exist
     * @throws InvalidStateException when the persisted status cannot move to {@code transition.to()}
     */
    AlertRecord applyTransition(String alertId, Transition transition);
}
