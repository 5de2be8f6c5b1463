package org.caureq.caureqalertdesk.engine;

import org.caureq.caureqalertdesk.domain.AlertRule;
import org.caureq.caureqalertdesk.domain.SourceType;

import java.util.List;

public interface RuleStore {
    /** Active rules for the source type, lowest priority value first. */
    List<AlertRule> activeRulesFor(SourceType sourceType);
}
