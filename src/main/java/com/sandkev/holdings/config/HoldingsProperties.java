package com.sandkev.holdings.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

@ConfigurationProperties("holdings")
public record HoldingsProperties(
        Path dataDir,                 // secret.json and settings.json live here
        Duration syncInterval,        // pause between main-loop passes
        Boolean syncEnabled,
        String defaultMainCurrency,
        Fiat fiat,
        Blockchain blockchain
) {

    public HoldingsProperties {
        if (dataDir == null) dataDir = Path.of(System.getProperty("user.home"), ".holdings");
        if (syncInterval == null) syncInterval = Duration.ofSeconds(10);
        if (syncEnabled == null) syncEnabled = Boolean.TRUE;
        if (defaultMainCurrency == null || defaultMainCurrency.isBlank()) defaultMainCurrency = "USD";
        if (fiat == null) fiat = new Fiat(null, null, 0, null);
        if (blockchain == null) blockchain = new Blockchain(null, null, null, null, 0);
    }

    public Path secretFile() {
        return dataDir.resolve("secret.json");
    }

    public Path settingsFile() {
        return dataDir.resolve("settings.json");
    }

    /** Bank holdings per fiat currency plus the rate endpoint used to value them. */
    public record Fiat(
            Map<String, BigDecimal> balances,
            String ratesBaseUrl,      // e.g. https://api.frankfurter.app
            int timeoutMs,
            Duration cacheTtl
    ) {
        public Fiat {
            if (balances == null) balances = Map.of();
            if (ratesBaseUrl == null || ratesBaseUrl.isBlank()) ratesBaseUrl = "https://api.frankfurter.app";
            if (timeoutMs <= 0) timeoutMs = 5_000;
            if (cacheTtl == null) cacheTtl = Duration.ofMinutes(10);
        }
    }

    public record Blockchain(
            List<String> btcAccounts,
            List<String> ethAccounts,
            String btcExplorerUrl,    // e.g. https://blockchain.info
            String ethRpcUrl,         // any JSON-RPC node
            int timeoutMs
    ) {
        public Blockchain {
            if (btcAccounts == null) btcAccounts = List.of();
            if (ethAccounts == null) ethAccounts = List.of();
            if (btcExplorerUrl == null || btcExplorerUrl.isBlank()) btcExplorerUrl = "https://blockchain.info";
            if (ethRpcUrl == null || ethRpcUrl.isBlank()) ethRpcUrl = "http://localhost:8545";
            if (timeoutMs <= 0) timeoutMs = 5_000;
        }
    }
}
