package org.caureq.caureqalertdesk.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/** Admin routes: shared key plus an IPv4 / CIDR allowlist ("*" allows all). */
@ConfigurationProperties(prefix = "admin")
public record AdminProps(String apiKey, List<String> allowIps) {
    public AdminProps {
        if (apiKey == null || apiKey.isBlank()) apiKey = "ADMIN-CHANGE-ME";
        if (allowIps == null || allowIps.isEmpty()) allowIps = List.of("127.0.0.1");
    }
}
