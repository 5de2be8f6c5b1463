package org.caureq.caureqalertdesk.store;

import lombok.RequiredArgsConstructor;
import org.caureq.caureqalertdesk.domain.AlertRule;
import org.caureq.caureqalertdesk.domain.SourceType;
import org.caureq.caureqalertdesk.engine.ActiveRuleCache;
import org.caureq.caureqalertdesk.engine.RuleStore;
import org.caureq.caureqalertdesk.engine.StoreUnavailableException;
import org.caureq.caureqalertdesk.repo.RuleRepo;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.List;

/** Active rules read through the shared TTL cache. */
@Component
@RequiredArgsConstructor
public class JpaRuleStore implements RuleStore {
    private final RuleRepo repo;
    private final ActiveRuleCache cache;

    @Override
    public List<AlertRule> activeRulesFor(SourceType sourceType) {
        return cache.get(sourceType, this::load);
    }

    private List<AlertRule> load(SourceType sourceType) {
        try {
            return repo.findBySourceTypeAndActiveTrueOrderByPriorityAscRuleIdAsc(sourceType);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("rule store failed to load rules for " + sourceType, e);
        }
    }
}
