package org.caureq.caureqalertdesk.repo;

import org.caureq.caureqalertdesk.domain.AlertRule;
import org.caureq.caureqalertdesk.domain.SourceType;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface RuleRepo extends JpaRepository<AlertRule, String> {
    List<AlertRule> findBySourceTypeAndActiveTrueOrderByPriorityAscRuleIdAsc(SourceType sourceType);
    List<AlertRule> findAllByOrderByPriorityAscRuleIdAsc();
    List<AlertRule> findByActiveOrderByPriorityAscRuleIdAsc(boolean active);
    List<AlertRule> findBySourceTypeOrderByPriorityAscRuleIdAsc(SourceType sourceType);
    List<AlertRule> findBySourceTypeAndActiveOrderByPriorityAscRuleIdAsc(SourceType sourceType, boolean active);
}
