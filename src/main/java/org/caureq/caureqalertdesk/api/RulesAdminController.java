package org.caureq.caureqalertdesk.api;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.caureq.caureqalertdesk.api.dto.RuleDTO;
import org.caureq.caureqalertdesk.api.dto.RuleRequestDTO;
import org.caureq.caureqalertdesk.domain.SourceType;
import org.caureq.caureqalertdesk.service.RuleService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.net.URI;
import java.util.List;

/** Admin endpoints to manage escalation and auto-close rules at runtime. */
@RestController
@RequestMapping("/api/admin/rules")
@RequiredArgsConstructor
public class RulesAdminController {
    private final RuleService rules;

    @GetMapping
    public List<RuleDTO> list(
            @RequestParam(value = "active", required = false) Boolean active,
            @RequestParam(value = "sourceType", required = false) SourceType sourceType
    ) {
        return rules.list(active, sourceType);
    }

    @GetMapping("/{ruleId}")
    public RuleDTO get(@PathVariable String ruleId) {
        return rules.get(ruleId);
    }

    /** What the engine currently evaluates for this source type (cached view). */
    @GetMapping("/active/{sourceType}")
    public List<RuleDTO> active(@PathVariable SourceType sourceType) {
        return rules.activeFor(sourceType);
    }

    @PostMapping
    public ResponseEntity<RuleDTO> create(@RequestBody @Valid RuleRequestDTO body) {
        var created = rules.create(body);
        return ResponseEntity.created(URI.create("/api/admin/rules/" + created.ruleId())).body(created);
    }

    @PutMapping("/{ruleId}")
    public RuleDTO update(@PathVariable String ruleId, @RequestBody @Valid RuleRequestDTO body) {
        return rules.update(ruleId, body);
    }

    @DeleteMapping("/{ruleId}")
    public ResponseEntity<Void> delete(@PathVariable String ruleId) {
        rules.delete(ruleId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/load-defaults")
    public RuleService.LoadResult loadDefaults() {
        return rules.loadDefaults();
    }
}
