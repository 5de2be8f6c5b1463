package org.caureq.caureqalertdesk.config;

import org.caureq.caureqalertdesk.engine.ActiveRuleCache;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class EngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** One cache per process, shared by the rule store and the admin API (for invalidation). */
    @Bean
    public ActiveRuleCache activeRuleCache(AppProps props, Clock clock) {
        return new ActiveRuleCache(props.rules().cacheTtl(), clock);
    }
}
