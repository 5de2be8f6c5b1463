package org.caureq.caureqalertdesk.api;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.caureq.caureqalertdesk.api.dto.AlertDTO;
import org.caureq.caureqalertdesk.api.dto.AlertPageDTO;
import org.caureq.caureqalertdesk.api.dto.CreateAlertDTO;
import org.caureq.caureqalertdesk.api.dto.ResolveAlertDTO;
import org.caureq.caureqalertdesk.api.dto.StateTransitionDTO;
import org.caureq.caureqalertdesk.api.dto.UpdateStatusDTO;
import org.caureq.caureqalertdesk.domain.AlertSeverity;
import org.caureq.caureqalertdesk.domain.AlertStatus;
import org.caureq.caureqalertdesk.domain.SourceType;
import org.caureq.caureqalertdesk.service.AlertService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Alert ingestion and operator actions.
 *
 * Writes need the X-API-KEY header (see ApiKeyFilter). Creation runs escalation
 * inline; status changes go through the rule engine's transition checks.
 */
@RestController
@RequestMapping("/api/alerts")
@RequiredArgsConstructor
public class AlertsController {
    private final AlertService service;

    @PostMapping
    public ResponseEntity<AlertDTO> create(@RequestBody @Valid CreateAlertDTO body) {
        var created = service.create(body);
        return ResponseEntity.created(URI.create("/api/alerts/" + created.id())).body(created);
    }

    /**
     * @param from   inclusive lower bound on creation time (ISO-8601)
     * @param to     inclusive upper bound on creation time (ISO-8601)
     * @param limit  page size (default 50, max 1000)
     * @param offset start offset, rounded down to a page boundary
     */
    @GetMapping
    public AlertPageDTO list(
            @RequestParam(value = "status", required = false) AlertStatus status,
            @RequestParam(value = "sourceType", required = false) SourceType sourceType,
            @RequestParam(value = "severity", required = false) AlertSeverity severity,
            @RequestParam(value = "entityKey", required = false) String entityKey,
            @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(value = "limit", required = false) Integer limit,
            @RequestParam(value = "offset", required = false) Integer offset
    ) {
        return service.list(status, sourceType, severity, entityKey, from, to, limit, offset);
    }

    @GetMapping("/{id}")
    public AlertDTO get(@PathVariable String id) {
        return service.get(id);
    }

    @GetMapping("/{id}/history")
    public List<StateTransitionDTO> history(@PathVariable String id) {
        return service.history(id);
    }

    @PatchMapping("/{id}/status")
    public AlertDTO changeStatus(@PathVariable String id, @RequestBody @Valid UpdateStatusDTO body) {
        return service.changeStatus(id, body);
    }

    @PostMapping("/{id}/resolve")
    public AlertDTO resolve(@PathVariable String id, @RequestBody @Valid ResolveAlertDTO body) {
        return service.resolve(id, body);
    }

    /** Producers report follow-up facts here, e.g. {"document_renewed": true}. */
    @PatchMapping("/{id}/metadata")
    public AlertDTO mergeMetadata(@PathVariable String id, @RequestBody Map<String, Object> body) {
        return service.mergeMetadata(id, body);
    }
}
