package com.sandkev.holdings.valuation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.sandkev.holdings.tax.TaxDetails;
import org.springframework.lang.Nullable;

import java.math.BigDecimal;

/** One combined asset: summed amount and USD value, its share of net value, optional cost-basis overlay. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AssetValuation(BigDecimal amount,
                             BigDecimal usdValue,
                             BigDecimal percentageOfNetValue,
                             @Nullable TaxDetails tax) {

    public AssetValuation withTax(TaxDetails details) {
        return new AssetValuation(amount, usdValue, percentageOfNetValue, details);
    }
}
