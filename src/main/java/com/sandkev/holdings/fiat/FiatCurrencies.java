package com.sandkev.holdings.fiat;

import java.util.List;
import java.util.Locale;

/** Fiat currencies the portfolio can hold in banks or use as main currency. */
public final class FiatCurrencies {

    public static final List<String> SUPPORTED = List.of(
            "USD", "EUR", "GBP", "JPY", "CNY", "CAD", "KRW", "INR", "RUB", "BRL", "TRY", "ZAR", "CHF", "AUD"
    );

    private FiatCurrencies() {}

    public static boolean isFiat(String symbol) {
        return symbol != null && SUPPORTED.contains(symbol.toUpperCase(Locale.ROOT));
    }
}
