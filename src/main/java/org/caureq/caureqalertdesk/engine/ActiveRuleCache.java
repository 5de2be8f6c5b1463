package org.caureq.caureqalertdesk.engine;

import com.google.common.base.Ticker;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import lombok.extern.slf4j.Slf4j;
import org.caureq.caureqalertdesk.domain.AlertRule;
import org.caureq.caureqalertdesk.domain.SourceType;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Active rules per source type, kept for at most {@code ttl}. Expiry reads the
 * injected clock so staleness is bounded the same way in tests and production.
 */
@Slf4j
public class ActiveRuleCache {
    private final Cache<SourceType, List<AlertRule>> cache;
    private final Duration ttl;

    public ActiveRuleCache(Duration ttl, Clock clock) {
        this.ttl = ttl;
        this.cache = CacheBuilder.newBuilder()
                .expireAfterWrite(ttl.toNanos(), TimeUnit.NANOSECONDS)
                .maximumSize(SourceType.values().length)
                .ticker(new Ticker() {
                    @Override
                    public long read() {
                        return TimeUnit.MILLISECONDS.toNanos(clock.millis());
                    }
                })
                .build();
    }

    public List<AlertRule> get(SourceType sourceType, Function<SourceType, List<AlertRule>> loader) {
        var cached = cache.getIfPresent(sourceType);
        if (cached != null) return cached;
        var loaded = List.copyOf(loader.apply(sourceType));
        cache.put(sourceType, loaded);
        log.debug("[Rules] cached {} active rules for {} (ttl={})", loaded.size(), sourceType, ttl);
        return loaded;
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }
}
