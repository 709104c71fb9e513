package com.sandkev.holdings.tax;

import com.sandkev.holdings.valuation.AssetValuation;
import com.sandkev.holdings.valuation.PortfolioSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Attaches cost-basis fields to the assets of a snapshot. Skipped entirely while the
 * accounting data is not ready. Percent change is undefined for a zero average buy value
 * and for a zero amount.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TaxOverlay {

    private static final MathContext MC = MathContext.DECIMAL64;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final CostBasisProvider costBasis;

    public PortfolioSnapshot apply(PortfolioSnapshot snapshot) {
        Optional<Map<String, CostBasis>> details = costBasis.details();
        if (details.isEmpty()) {
            log.debug("Cost basis not ready; skipping tax overlay");
            return snapshot;
        }

        var assets = new TreeMap<>(snapshot.combined());
        details.get().forEach((asset, basis) -> {
            AssetValuation valuation = assets.get(asset);
            if (valuation == null) return;
            assets.put(asset, valuation.withTax(new TaxDetails(
                    basis.taxFreeAmount(),
                    basis.averageBuyValue(),
                    percentChange(valuation, basis.averageBuyValue()))));
        });
        return snapshot.withCombined(assets);
    }

    static PercentChange percentChange(AssetValuation valuation, BigDecimal averageBuyValue) {
        if (averageBuyValue == null || averageBuyValue.signum() == 0) return PercentChange.UNDEFINED;
        if (valuation.amount().signum() == 0) return PercentChange.UNDEFINED;

        BigDecimal currentPrice = valuation.usdValue().divide(valuation.amount(), MC);
        BigDecimal change = currentPrice.subtract(averageBuyValue)
                .divide(averageBuyValue, MC)
                .multiply(HUNDRED, MC);
        return new PercentChange(change);
    }
}
