package org.caureq.caureqalertdesk.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.caureqalertdesk.api.dto.RuleDTO;
import org.caureq.caureqalertdesk.api.dto.RuleRequestDTO;
import org.caureq.caureqalertdesk.config.AppProps;
import org.caureq.caureqalertdesk.domain.AlertRule;
import org.caureq.caureqalertdesk.domain.SourceType;
import org.caureq.caureqalertdesk.engine.ActiveRuleCache;
import org.caureq.caureqalertdesk.engine.NotFoundException;
import org.caureq.caureqalertdesk.engine.RuleStore;
import org.caureq.caureqalertdesk.repo.RuleRepo;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Rule administration. Every write drops the active-rule cache so the engine
 * picks the change up on its next read instead of after the TTL.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RuleService {
    private final RuleRepo repo;
    private final RuleStore ruleStore;
    private final ActiveRuleCache cache;
    private final ResourceLoader resources;
    private final ObjectMapper mapper;
    private final AppProps props;
    private final Clock clock;

    /** Shape of {@code default-rules.json}. */
    public record DefaultRules(List<RuleRequestDTO> rules) {}

    public record LoadResult(List<String> loaded, List<String> skipped) {}

    @Transactional(readOnly = true)
    public List<RuleDTO> list(Boolean active, SourceType sourceType) {
        List<AlertRule> rules;
        if (active != null && sourceType != null) rules = repo.findBySourceTypeAndActiveOrderByPriorityAscRuleIdAsc(sourceType, active);
        else if (active != null) rules = repo.findByActiveOrderByPriorityAscRuleIdAsc(active);
        else if (sourceType != null) rules = repo.findBySourceTypeOrderByPriorityAscRuleIdAsc(sourceType);
        else rules = repo.findAllByOrderByPriorityAscRuleIdAsc();
        return rules.stream().map(RuleDTO::from).toList();
    }

    @Transactional(readOnly = true)
    public RuleDTO get(String ruleId) {
        return RuleDTO.from(load(ruleId));
    }

    /** Same view the engine gets, cache included. */
    public List<RuleDTO> activeFor(SourceType sourceType) {
        return ruleStore.activeRulesFor(sourceType).stream().map(RuleDTO::from).toList();
    }

    @Transactional
    public RuleDTO create(RuleRequestDTO d) {
        if (d.ruleId() == null || d.ruleId().isBlank()) throw new IllegalArgumentException("ruleId is required");
        if (repo.existsById(d.ruleId())) throw new DuplicateRuleException(d.ruleId());
        var now = clock.instant();
        var rule = new AlertRule();
        rule.setRuleId(d.ruleId());
        rule.setCreatedAt(now);
        apply(rule, d);
        rule.setUpdatedAt(now);
        var saved = repo.save(rule);
        cache.invalidateAll();
        log.info("[Rules] created {} for {} (priority={}, active={})",
                saved.getRuleId(), saved.getSourceType(), saved.getPriority(), saved.isActive());
        return RuleDTO.from(saved);
    }

    @Transactional
    public RuleDTO update(String ruleId, RuleRequestDTO d) {
        if (d.ruleId() != null && !d.ruleId().equals(ruleId)) {
            throw new IllegalArgumentException("ruleId in body (%s) does not match path (%s)".formatted(d.ruleId(), ruleId));
        }
        var rule = load(ruleId);
        apply(rule, d);
        rule.setUpdatedAt(clock.instant());
        var saved = repo.save(rule);
        cache.invalidateAll();
        log.info("[Rules] updated {}", ruleId);
        return RuleDTO.from(saved);
    }

    @Transactional
    public void delete(String ruleId) {
        repo.delete(load(ruleId));
        cache.invalidateAll();
        log.info("[Rules] deleted {}", ruleId);
    }

    /** Seeds rules from the configured JSON file. Ids that already exist are left untouched. */
    @Transactional
    public LoadResult loadDefaults() {
        var location = props.rules().defaultsLocation();
        DefaultRules file;
        try (var in = resources.getResource(location).getInputStream()) {
            file = mapper.readValue(in, DefaultRules.class);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read default rules from " + location, e);
        }

        var loaded = new ArrayList<String>();
        var skipped = new ArrayList<String>();
        var now = clock.instant();
        for (var d : file.rules() == null ? List.<RuleRequestDTO>of() : file.rules()) {
            if (repo.existsById(d.ruleId())) {
                skipped.add(d.ruleId());
                continue;
            }
            var rule = new AlertRule();
            rule.setRuleId(d.ruleId());
            rule.setCreatedAt(now);
            rule.setUpdatedAt(now);
            apply(rule, d);
            repo.save(rule);
            loaded.add(d.ruleId());
        }
        cache.invalidateAll();
        log.info("[Rules] default rules from {}: loaded={} skipped={}", location, loaded.size(), skipped.size());
        return new LoadResult(loaded, skipped);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void loadDefaultsOnStartup() {
        if (!props.rules().loadDefaultsOnStartup()) return;
        try {
            loadDefaults();
        } catch (RuntimeException e) {
            log.error("[Rules] could not seed default rules, continuing with stored rules", e);
        }
    }

    private AlertRule load(String ruleId) {
        return repo.findById(ruleId).orElseThrow(() -> NotFoundException.rule(ruleId));
    }

    private static void apply(AlertRule rule, RuleRequestDTO d) {
        if (d.sourceType() == null || d.name() == null || d.conditions() == null) {
            throw new IllegalArgumentException("rule " + rule.getRuleId() + " needs sourceType, name and conditions");
        }
        var conditions = d.conditions().toConditions();
        conditions.validate(rule.getRuleId());
        rule.setSourceType(d.sourceType());
        rule.setName(d.name().trim());
        rule.setDescription(d.description());
        rule.setConditions(conditions);
        rule.setActive(d.active() == null || d.active());
        rule.setPriority(d.priority() == null ? 100 : d.priority());
    }
}
