package com.sandkev.holdings.valuation;

import com.sandkev.holdings.balance.Balance;
import com.sandkev.holdings.balance.BalanceAggregator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Net worth and percentage breakdowns per asset and per location.
 * <p>
 * Percentages are rounded to two decimals. When net value is zero every percentage is
 * reported as 0.00 instead of dividing by zero.
 */
@Component
@RequiredArgsConstructor
public class PortfolioValuator {

    private static final MathContext MC = MathContext.DECIMAL64;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    static final BigDecimal ZERO_PERCENT = BigDecimal.ZERO.setScale(2);

    private final BalanceAggregator aggregator;

    public PortfolioSnapshot value(Map<String, Map<String, Balance>> bySource) {
        Map<String, Map<String, Balance>> sources = bySource == null ? Map.of() : bySource;

        var combined = aggregator.combine(sources.values());
        BigDecimal netUsd = BalanceAggregator.usdTotal(combined);

        var location = new LinkedHashMap<String, LocationValuation>();
        sources.forEach((name, balances) -> {
            BigDecimal total = BalanceAggregator.usdTotal(balances);
            location.put(name, new LocationValuation(total, percentageOf(total, netUsd)));
        });

        var assets = new TreeMap<String, AssetValuation>();
        combined.forEach((asset, b) -> assets.put(asset,
                new AssetValuation(b.amount(), b.usdValue(), percentageOf(b.usdValue(), netUsd), null)));

        return new PortfolioSnapshot(Collections.unmodifiableSortedMap(assets),
                Collections.unmodifiableMap(location), netUsd);
    }

    /** {@code part / whole} as a two-decimal percentage; 0.00 when {@code whole} is zero. */
    public static BigDecimal percentageOf(BigDecimal part, BigDecimal whole) {
        if (whole == null || whole.signum() == 0) return ZERO_PERCENT;
        return part.multiply(HUNDRED).divide(whole, MC).setScale(2, RoundingMode.HALF_UP);
    }
}
