package com.chanakya.vault.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

@ConfigurationProperties(prefix = "vault")
public record VaultProperties(
        String viewerBaseUrl,
        Grants grants,
        Extraction extraction,
        Cors cors
) {
    public record Grants(
            Duration defaultTtl,
            int tokenAttempts
    ) {}

    public record Extraction(
            String baseUrl,
            String apiKey,
            String model,
            Duration timeout
    ) {}

    public record Cors(
            List<String> allowedOrigins
    ) {}
}
