package com.sandkev.holdings.exchange.binance;

import com.sandkev.holdings.exchange.AbstractExchangeClient;
import com.sandkev.holdings.exchange.ExchangeName;
import com.sandkev.holdings.price.UsdPriceService;
import org.springframework.core.ParameterizedTypeReference;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class BinanceClient extends AbstractExchangeClient {

    static final String ACCOUNT_PATH = "/api/v3/account";

    private final BinanceSignedClient binance;

    public BinanceClient(BinanceSignedClient binance, UsdPriceService prices, Duration cacheTtl) {
        super(ExchangeName.BINANCE, prices, cacheTtl);
        this.binance = binance;
    }

    /**
     * Calls GET /api/v3/account and returns { asset -> free+locked } for nonzero balances.
     */
    @Override
    protected Map<String, BigDecimal> fetchAmounts() {
        Map<String, Object> body = binance.get(ACCOUNT_PATH, Map.of(),
                new ParameterizedTypeReference<Map<String, Object>>() {});
        if (body == null) return Map.of();

        // balances is an array of { asset, free, locked }
        @SuppressWarnings("unchecked")
        var balances = (List<Map<String, Object>>) body.getOrDefault("balances", List.of());
        var out = new LinkedHashMap<String, BigDecimal>(balances.size());
        for (var b : balances) {
            String asset = String.valueOf(b.get("asset"));
            BigDecimal free = new BigDecimal(String.valueOf(b.getOrDefault("free", "0")));
            BigDecimal locked = new BigDecimal(String.valueOf(b.getOrDefault("locked", "0")));
            BigDecimal total = free.add(locked);
            if (total.signum() != 0) {
                out.merge(asset, total, BigDecimal::add);
            }
        }
        return out;
    }
}
