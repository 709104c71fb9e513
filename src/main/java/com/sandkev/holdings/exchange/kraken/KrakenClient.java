package com.sandkev.holdings.exchange.kraken;

import com.sandkev.holdings.exchange.AbstractExchangeClient;
import com.sandkev.holdings.exchange.ExchangeName;
import com.sandkev.holdings.price.UsdPriceService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import static java.util.Map.entry;

@Slf4j
public class KrakenClient extends AbstractExchangeClient {

    static final String BALANCE_PATH = "/0/private/Balance";

    private final KrakenSignedClient kraken;

    public KrakenClient(KrakenSignedClient kraken, UsdPriceService prices, Duration cacheTtl) {
        super(ExchangeName.KRAKEN, prices, cacheTtl);
        this.kraken = kraken;
    }

    /**
     * Calls POST /0/private/Balance and returns { asset -> balance } for nonzero balances.
     * Kraken symbols are normalised (e.g., XXBT -> BTC, XETH -> ETH).
     */
    @Override
    protected Map<String, BigDecimal> fetchAmounts() {
        // { "error": [..], "result": { "XXBT": "0.1", "ZUSD": "15.0", ... } }
        Map<String, Object> response = kraken.post(
                BALANCE_PATH,
                Map.of(),
                new ParameterizedTypeReference<Map<String, Object>>() {}
        );

        if (response == null) {
            log.warn("Kraken {} returned null body; treating as empty.", BALANCE_PATH);
            return Map.of();
        }

        List<?> errors = (List<?>) response.getOrDefault("error", List.of());
        if (!errors.isEmpty()) {
            // e.g. ["EAPI:Invalid key"]
            throw new RuntimeException("Kraken " + BALANCE_PATH + " error(s): " + errors);
        }

        @SuppressWarnings("unchecked")
        Map<String, Object> result = (Map<String, Object>) response.getOrDefault("result", Map.of());

        var out = new LinkedHashMap<String, BigDecimal>(Math.max(8, result.size()));
        for (var e : result.entrySet()) {
            BigDecimal balance = new BigDecimal(String.valueOf(e.getValue()));
            if (balance.signum() != 0) {
                out.merge(normaliseAsset(e.getKey()), balance, BigDecimal::add);
            }
        }
        return out;
    }

    @Override
    public boolean hasMainLogic() {
        return true;
    }

    @Override
    public void mainLogic() {
        refreshBalances();
    }

    // ---- Kraken's X*/Z* prefixes to common tickers ----
    private static final Map<String, String> ASSET_MAP = Map.ofEntries(
            entry("XXBT", "BTC"),
            entry("XBT", "BTC"),
            entry("XXDG", "DOGE"),
            entry("XETH", "ETH"),
            entry("ZUSD", "USD"),
            entry("ZEUR", "EUR"),
            entry("ZGBP", "GBP"),
            entry("ZCAD", "CAD"),
            entry("ZJPY", "JPY"),
            entry("ZKRW", "KRW"),
            entry("ZUSDT", "USDT"),
            entry("ZUSDC", "USDC"),
            entry("XBT.F", "BTC"),
            entry("ADA.F", "ADA")
    );
    private static final Pattern LEADING_XZ = Pattern.compile("^[XZ](?=[A-Z]{3,}$)");

    static String normaliseAsset(String krakenAsset) {
        if (krakenAsset == null) return null;
        String mapped = ASSET_MAP.get(krakenAsset);
        if (mapped != null) return mapped;
        // four-letter X/Z codes such as XREP -> REP; three-letter names are left alone
        return krakenAsset.length() == 4 ? LEADING_XZ.matcher(krakenAsset).replaceFirst("") : krakenAsset;
    }
}
