package com.sandkev.holdings.price;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves ticker symbols (BTC, ETH, ADA.F) to CoinGecko coin ids (bitcoin, ethereum, cardano).
 */
@Component
public class CoinGeckoIdResolver {

    private static final Map<String, String> WELL_KNOWN = Map.ofEntries(
            Map.entry("BTC", "bitcoin"),
            Map.entry("XBT", "bitcoin"),
            Map.entry("ETH", "ethereum"),
            Map.entry("ETC", "ethereum-classic"),
            Map.entry("USDT", "tether"),
            Map.entry("USDC", "usd-coin"),
            Map.entry("DAI", "dai"),
            Map.entry("BNB", "binancecoin"),
            Map.entry("XRP", "ripple"),
            Map.entry("XMR", "monero"),
            Map.entry("XLM", "stellar"),
            Map.entry("XDG", "dogecoin"),
            Map.entry("DOGE", "dogecoin"),
            Map.entry("LTC", "litecoin"),
            Map.entry("BCH", "bitcoin-cash"),
            Map.entry("DASH", "dash"),
            Map.entry("ZEC", "zcash"),
            Map.entry("REP", "augur"),
            Map.entry("GNO", "gnosis"),
            Map.entry("ADA", "cardano"),
            Map.entry("ATOM", "cosmos"),
            Map.entry("DOT", "polkadot"),
            Map.entry("KSM", "kusama"),
            Map.entry("SOL", "solana"),
            Map.entry("LINK", "chainlink"),
            Map.entry("AVAX", "avalanche-2"),
            Map.entry("MATIC", "matic-network"),
            Map.entry("POL", "polygon-ecosystem-token"),
            Map.entry("NEO", "neo"),
            Map.entry("OMG", "omisego"),
            Map.entry("STR", "stellar")           // poloniex name for XLM
    );

    public Optional<String> resolve(String symbol) {
        if (symbol == null || symbol.isBlank()) return Optional.empty();
        String sym = symbol.trim().toUpperCase(Locale.ROOT);
        // staked/earn variants such as ADA.F price like the base asset
        int dot = sym.indexOf('.');
        if (dot > 0) sym = sym.substring(0, dot);
        return Optional.ofNullable(WELL_KNOWN.get(sym));
    }
}
