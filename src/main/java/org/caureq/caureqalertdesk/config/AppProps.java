package org.caureq.caureqalertdesk.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "app")
public record AppProps(String apiKey, AlertsProps alerts, RulesProps rules, SweepProps sweep) {
    public AppProps {
        if (alerts == null) alerts = new AlertsProps(7);
        if (rules == null) rules = new RulesProps(null, true, null);
        if (sweep == null) sweep = new SweepProps(300_000, 60_000);
    }

    /** Alert defaults. expirationDays = 0 disables the built-in expiry date. */
    public record AlertsProps(int expirationDays) {}

    /** Active-rule cache TTL and the classpath file seeded on startup. */
    public record RulesProps(Duration cacheTtl, boolean loadDefaultsOnStartup, String defaultsLocation) {
        public RulesProps {
            if (cacheTtl == null) cacheTtl = Duration.ofMinutes(5);
            if (defaultsLocation == null || defaultsLocation.isBlank()) defaultsLocation = "classpath:default-rules.json";
        }
    }

    /** Auto-close sweep timing (fixed delay, so runs never overlap on the scheduler). */
    public record SweepProps(long intervalMs, long initialDelayMs) {}
}
