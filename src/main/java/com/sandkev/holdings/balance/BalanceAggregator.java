package com.sandkev.holdings.balance;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Merges per-source balance maps into one entry per asset.
 * Amounts and USD values are summed exactly, so the result does not depend on source order.
 */
@Component
public class BalanceAggregator {

    public SortedMap<String, Balance> combine(Collection<? extends Map<String, Balance>> sources) {
        var combined = new TreeMap<String, Balance>();
        if (sources == null) return combined;

        for (var source : sources) {
            if (source == null) continue;
            source.forEach((asset, balance) -> {
                if (asset != null && balance != null) {
                    combined.merge(asset, balance, Balance::plus);
                }
            });
        }
        return combined;
    }

    /** Sum of usd_value over a balance map; zero for an empty or null map. */
    public static BigDecimal usdTotal(Map<String, Balance> balances) {
        if (balances == null) return BigDecimal.ZERO;
        return balances.values().stream()
                .map(Balance::usdValue)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
