package com.sandkev.holdings.price;

import com.sandkev.holdings.balance.Balance;
import com.sandkev.holdings.fiat.FiatCurrencies;
import com.sandkev.holdings.fiat.FiatRateService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;

/**
 * USD price per asset symbol. Fiat goes through the fiat-rate collaborator, crypto through CoinGecko.
 * Assets that cannot be priced are valued at zero and logged.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UsdPriceService {

    private static final MathContext MC = MathContext.DECIMAL64;

    private final CoinGeckoPriceService prices;
    private final CoinGeckoIdResolver ids;
    private final FiatRateService fiatRates;

    public Map<String, BigDecimal> usdPrices(Collection<String> symbols) {
        if (symbols == null || symbols.isEmpty()) return Map.of();

        var out = new LinkedHashMap<String, BigDecimal>();
        var symToId = new LinkedHashMap<String, String>();
        for (String raw : symbols) {
            String sym = raw.toUpperCase(Locale.ROOT);
            if (FiatCurrencies.isFiat(sym)) {
                out.put(raw, fiatRates.queryFiatPair(sym, "USD"));
            } else {
                ids.resolve(sym).ifPresentOrElse(
                        id -> symToId.put(raw, id),
                        () -> log.warn("No CoinGecko id for {}; valuing at zero", raw));
            }
        }

        if (!symToId.isEmpty()) {
            Map<String, BigDecimal> byId = prices.getSimplePrice(new LinkedHashSet<>(symToId.values()), "usd");
            symToId.forEach((sym, id) -> {
                BigDecimal px = byId.get(id);
                if (px == null) log.warn("CoinGecko returned no USD price for {} ({})", sym, id);
                out.put(sym, px == null ? BigDecimal.ZERO : px);
            });
        }
        return out;
    }

    /** Turns { asset -> amount } into { asset -> Balance(amount, amount * usdPrice) }. */
    public Map<String, Balance> value(Map<String, BigDecimal> amounts) {
        if (amounts == null || amounts.isEmpty()) return Map.of();
        Map<String, BigDecimal> px = usdPrices(amounts.keySet());
        var out = new LinkedHashMap<String, Balance>(amounts.size());
        amounts.forEach((asset, amount) -> {
            BigDecimal usd = amount.multiply(px.getOrDefault(asset, BigDecimal.ZERO), MC);
            out.put(asset, new Balance(amount, usd));
        });
        return out;
    }
}
