package org.caureq.caureqalertdesk.service;

import jakarta.persistence.criteria.Predicate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.caureqalertdesk.api.dto.AlertDTO;
import org.caureq.caureqalertdesk.api.dto.AlertPageDTO;
import org.caureq.caureqalertdesk.api.dto.CreateAlertDTO;
import org.caureq.caureqalertdesk.api.dto.ResolveAlertDTO;
import org.caureq.caureqalertdesk.api.dto.StateTransitionDTO;
import org.caureq.caureqalertdesk.api.dto.UpdateStatusDTO;
import org.caureq.caureqalertdesk.config.AppProps;
import org.caureq.caureqalertdesk.domain.AlertRecord;
import org.caureq.caureqalertdesk.domain.AlertSeverity;
import org.caureq.caureqalertdesk.domain.AlertStatus;
import org.caureq.caureqalertdesk.domain.MetadataValue;
import org.caureq.caureqalertdesk.domain.SourceType;
import org.caureq.caureqalertdesk.domain.StateTransition;
import org.caureq.caureqalertdesk.engine.InvalidStateException;
import org.caureq.caureqalertdesk.engine.NotFoundException;
import org.caureq.caureqalertdesk.engine.RuleEngine;
import org.caureq.caureqalertdesk.repo.AlertRepo;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

/**
 * Alert ingestion and operator-facing reads/writes.
 *
 * Responsibilities
 * - Create alerts (id, default severity, entity key fallback, expiry date, first history entry).
 * - Run escalation right after creation; a failure there never fails the create.
 * - Delegate operator transitions to {@link RuleEngine} so the same checks apply everywhere.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AlertService {
    static final String DEFAULT_ACTOR = "operator";
    static final String ENTITY_KEY_FIELD = "driver_id";
    static final int MAX_ENTITY_KEY_LENGTH = 128;

    private final AlertRepo repo;
    private final AlertIdGenerator ids;
    private final RuleEngine engine;
    private final AppProps props;
    private final Clock clock;

    /** Runs outside a transaction: the escalation window query must see the committed alert. */
    public AlertDTO create(CreateAlertDTO d) {
        var metadata = MetadataValue.fromMap(d.metadata());
        var entityKey = entityKey(d, metadata);
        var now = clock.instant();
        var severity = d.severity() != null ? d.severity() : d.sourceType().defaultSeverity();
        var alert = AlertRecord.builder()
                .id(ids.next(d.sourceType()))
                .sourceType(d.sourceType())
                .severity(severity)
                .status(AlertStatus.OPEN)
                .entityKey(entityKey)
                .ts(now)
                .metadata(new HashMap<>(metadata))
                .expiresAt(expiry(now))
                .updatedAt(now)
                .build();
        alert.getStateHistory().add(StateTransition.builder()
                .fromStatus(AlertStatus.OPEN).toStatus(AlertStatus.OPEN)
                .ts(now).reason("Alert created").triggeredBy(RuleEngine.SYSTEM_ACTOR)
                .build());
        var saved = repo.save(alert);
        log.info("[Alerts] created {} source={} entity={} severity={}",
                saved.getId(), saved.getSourceType(), saved.getEntityKey(), saved.getSeverity());

        try {
            engine.evaluateEscalation(saved);
        } catch (RuntimeException e) {
            log.warn("[Alerts] escalation check failed for {}: {}", saved.getId(), e.getMessage());
        }
        return AlertDTO.from(repo.findById(saved.getId()).orElse(saved));
    }

    @Transactional(readOnly = true)
    public AlertPageDTO list(AlertStatus status, SourceType sourceType, AlertSeverity severity,
                             String entityKey, Instant from, Instant to, Integer limit, Integer offset) {
        int size = (limit == null || limit <= 0 || limit > 1000) ? 50 : limit;
        int off = (offset == null || offset < 0) ? 0 : offset;
        var pageable = PageRequest.of(off / size, size, Sort.by("ts").descending().and(Sort.by("id")));

        var page = repo.findAll(filter(status, sourceType, severity, entityKey, from, to), pageable);
        var alerts = page.getContent().stream().map(AlertDTO::from).toList();
        return new AlertPageDTO(alerts, page.getTotalElements(), (off / size) * size, size);
    }

    @Transactional(readOnly = true)
    public AlertDTO get(String id) {
        return AlertDTO.from(load(id));
    }

    @Transactional(readOnly = true)
    public List<StateTransitionDTO> history(String id) {
        return load(id).getStateHistory().stream().map(StateTransitionDTO::from).toList();
    }

    public AlertDTO changeStatus(String id, UpdateStatusDTO d) {
        var actor = (d.actor() == null || d.actor().isBlank()) ? DEFAULT_ACTOR : d.actor().trim();
        return AlertDTO.from(engine.changeStatus(id, d.newStatus(), d.reason(), actor));
    }

    public AlertDTO resolve(String id, ResolveAlertDTO d) {
        return AlertDTO.from(engine.resolve(id, d.resolutionNotes(), d.resolvedBy().trim()));
    }

    /**
     * Merges producer metadata into a non-terminal alert. A null value removes the key.
     * The next sweep sees the new values.
     */
    @Transactional
    public AlertDTO mergeMetadata(String id, Map<String, Object> patch) {
        var alert = load(id);
        if (alert.getStatus().isTerminal()) {
            throw InvalidStateException.terminal(id, alert.getStatus());
        }
        var removed = new HashSet<String>();
        var updates = new HashMap<String, MetadataValue>();
        if (patch != null) {
            patch.forEach((k, v) -> {
                MetadataValue.checkKey(k);
                if (v == null) removed.add(k);
                else updates.put(k, MetadataValue.of(k, v));
            });
        }
        removed.forEach(alert.getMetadata()::remove);
        alert.getMetadata().putAll(updates);
        alert.setUpdatedAt(clock.instant());
        log.info("[Alerts] metadata updated on {}: {}", id, patch == null ? "{}" : patch.keySet());
        return AlertDTO.from(repo.saveAndFlush(alert));
    }

    private AlertRecord load(String id) {
        return repo.findById(id).orElseThrow(() -> NotFoundException.alert(id));
    }

    private Instant expiry(Instant now) {
        int days = props.alerts().expirationDays();
        return days <= 0 ? null : now.plus(Duration.ofDays(days));
    }

    private static String entityKey(CreateAlertDTO d, Map<String, MetadataValue> metadata) {
        if (d.entityKey() != null && !d.entityKey().isBlank()) return d.entityKey().trim();
        var fallback = metadata.get(ENTITY_KEY_FIELD);
        if (fallback == null) return null;
        var raw = fallback.toObject();
        if (raw == null) return null;
        var key = String.valueOf(raw).trim();
        if (key.length() > MAX_ENTITY_KEY_LENGTH) {
            throw new IllegalArgumentException(ENTITY_KEY_FIELD + " exceeds " + MAX_ENTITY_KEY_LENGTH + " characters");
        }
        return key.isEmpty() ? null : key;
    }

    private static Specification<AlertRecord> filter(AlertStatus status, SourceType sourceType, AlertSeverity severity,
                                                     String entityKey, Instant from, Instant to) {
        return (root, query, cb) -> {
            var ps = new ArrayList<Predicate>();
            if (status != null) ps.add(cb.equal(root.get("status"), status));
            if (sourceType != null) ps.add(cb.equal(root.get("sourceType"), sourceType));
            if (severity != null) ps.add(cb.equal(root.get("severity"), severity));
            if (entityKey != null && !entityKey.isBlank()) ps.add(cb.equal(root.get("entityKey"), entityKey.trim()));
            if (from != null) ps.add(cb.greaterThanOrEqualTo(root.<Instant>get("ts"), from));
            if (to != null) ps.add(cb.lessThanOrEqualTo(root.<Instant>get("ts"), to));
            return cb.and(ps.toArray(Predicate[]::new));
        };
    }
}
