package com.sandkev.holdings.fiat;

import com.sandkev.holdings.balance.Balance;
import com.sandkev.holdings.balance.BalanceSource;
import com.sandkev.holdings.config.HoldingsProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/** Bank balances from configuration, valued at the current fiat rate to USD. */
@Slf4j
@Component
public class FiatBalanceSource implements BalanceSource {

    public static final String NAME = "banks";

    private final Map<String, BigDecimal> holdings;
    private final FiatRateService rates;

    public FiatBalanceSource(HoldingsProperties props, FiatRateService rates) {
        this.holdings = props.fiat().balances();
        this.rates = rates;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Map<String, Balance> queryBalances() {
        var result = new LinkedHashMap<String, Balance>();
        holdings.forEach((rawCurrency, amount) -> {
            String currency = rawCurrency.toUpperCase(Locale.ROOT);
            if (!FiatCurrencies.isFiat(currency)) {
                log.warn("Ignoring bank balance in unsupported currency {}", rawCurrency);
                return;
            }
            if (amount == null || amount.signum() == 0) return;
            BigDecimal usdRate = rates.queryFiatPair(currency, "USD");
            result.merge(currency, new Balance(amount, amount.multiply(usdRate, MathContext.DECIMAL64)), Balance::plus);
        });
        return result;
    }
}
