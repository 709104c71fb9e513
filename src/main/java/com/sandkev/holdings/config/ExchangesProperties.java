package com.sandkev.holdings.config;

import com.sandkev.holdings.exchange.ExchangeName;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Endpoint settings per supported exchange. Keys and secrets are never read from here,
 * only from the credential file.
 */
@ConfigurationProperties("exchanges")
public record ExchangesProperties(
        Endpoint kraken,
        Endpoint binance,
        Endpoint poloniex,
        Endpoint bittrex
) {

    public ExchangesProperties {
        if (kraken == null) kraken = new Endpoint("https://api.kraken.com", 0, 0, null);
        if (binance == null) binance = new Endpoint("https://api.binance.com", 0, 0, null);
        if (poloniex == null) poloniex = new Endpoint("https://poloniex.com", 0, 0, null);
        if (bittrex == null) bittrex = new Endpoint("https://bittrex.com", 0, 0, null);
    }

    public Endpoint endpoint(ExchangeName name) {
        return switch (name) {
            case KRAKEN -> kraken;
            case BINANCE -> binance;
            case POLONIEX -> poloniex;
            case BITTREX -> bittrex;
        };
    }

    public record Endpoint(
            String baseUrl,
            int timeoutMs,
            long recvWindow,      // binance only
            Duration cacheTtl     // how long a balance response is reused
    ) {
        public Endpoint {
            if (timeoutMs <= 0) timeoutMs = 10_000;
            if (recvWindow <= 0) recvWindow = 5_000;
            if (cacheTtl == null) cacheTtl = Duration.ofSeconds(60);
        }
    }
}
