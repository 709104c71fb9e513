package com.sandkev.holdings.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties("coingecko")
public record CoinGeckoProperties(
        String baseUrl,
        String apiKey,
        String apiKeyHeader,
        String userAgent,
        int timeoutMs,
        Duration cacheTtl,
        int maxRetries,
        Duration backoff
) {
    public CoinGeckoProperties {
        if (baseUrl == null || baseUrl.isBlank()) baseUrl = "https://api.coingecko.com/api/v3";
        if (apiKeyHeader == null || apiKeyHeader.isBlank()) apiKeyHeader = "x-cg-demo-api-key";
        if (userAgent == null || userAgent.isBlank()) userAgent = "holdings/0.0.1";
        if (timeoutMs <= 0) timeoutMs = 5_000;
        if (cacheTtl == null) cacheTtl = Duration.ofMinutes(1);
        if (maxRetries < 0) maxRetries = 0;
        if (backoff == null) backoff = Duration.ofMillis(500);
    }
}
