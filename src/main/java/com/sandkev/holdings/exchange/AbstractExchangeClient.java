package com.sandkev.holdings.exchange;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.sandkev.holdings.balance.Balance;
import com.sandkev.holdings.price.UsdPriceService;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Map;

/**
 * Shared plumbing for the exchange clients: balance responses are cached for a short TTL,
 * priced in USD, and a failed authenticated call becomes an invalid-key result.
 */
@Slf4j
public abstract class AbstractExchangeClient implements ExchangeClient {

    private static final String BALANCES = "balances";

    private final ExchangeName name;
    private final UsdPriceService prices;
    private final Cache<String, Map<String, BigDecimal>> responses;

    protected AbstractExchangeClient(ExchangeName name, UsdPriceService prices, Duration cacheTtl) {
        this.name = name;
        this.prices = prices;
        this.responses = Caffeine.newBuilder()
                .expireAfterWrite(cacheTtl)
                .maximumSize(16)
                .build();
    }

    /** Raw { asset -> amount } straight from the exchange, zero balances removed. */
    protected abstract Map<String, BigDecimal> fetchAmounts();

    @Override
    public ExchangeName name() {
        return name;
    }

    @Override
    public ApiKeyValidation validateApiKey() {
        try {
            Map<String, BigDecimal> amounts = fetchAmounts();
            responses.put(BALANCES, amounts);
            return ApiKeyValidation.valid();
        } catch (RuntimeException e) {
            log.warn("{} API key validation failed: {}", name, e.getMessage());
            return ApiKeyValidation.invalid(String.valueOf(e.getMessage()));
        }
    }

    @Override
    public Map<String, Balance> queryBalances() {
        Map<String, BigDecimal> amounts = responses.get(BALANCES, k -> fetchAmounts());
        return prices.value(amounts);
    }

    /** Refreshes the cached balance response so the next valuation does not wait on the exchange. */
    protected void refreshBalances() {
        responses.put(BALANCES, fetchAmounts());
        log.debug("{} balances refreshed", name);
    }
}
