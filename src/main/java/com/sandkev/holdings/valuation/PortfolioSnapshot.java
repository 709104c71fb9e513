package com.sandkev.holdings.valuation;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.springframework.lang.Nullable;

import java.math.BigDecimal;
import java.util.Map;
import java.util.SortedMap;

/**
 * Valuation of the whole portfolio. {@code netUsd} equals the sum of {@code usdValue} over
 * {@code combined} and over {@code location}. The main-currency fields are display-only.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PortfolioSnapshot(SortedMap<String, AssetValuation> combined,
                                Map<String, LocationValuation> location,
                                BigDecimal netUsd,
                                @Nullable String mainCurrency,
                                @Nullable BigDecimal netMainCurrency) {

    public PortfolioSnapshot(SortedMap<String, AssetValuation> combined,
                             Map<String, LocationValuation> location,
                             BigDecimal netUsd) {
        this(combined, location, netUsd, null, null);
    }

    public PortfolioSnapshot withCombined(SortedMap<String, AssetValuation> replaced) {
        return new PortfolioSnapshot(replaced, location, netUsd, mainCurrency, netMainCurrency);
    }

    public PortfolioSnapshot inMainCurrency(String currency, BigDecimal netValue) {
        return new PortfolioSnapshot(combined, location, netUsd, currency, netValue);
    }
}
