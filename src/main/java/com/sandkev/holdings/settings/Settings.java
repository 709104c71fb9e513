package com.sandkev.holdings.settings;

/** User-facing preferences persisted in {@code settings.json}. */
public record Settings(String mainCurrency, Integer uiFloatingPrecision) {

    public static final int DEFAULT_FLOATING_PRECISION = 2;

    public Settings {
        if (uiFloatingPrecision == null) uiFloatingPrecision = DEFAULT_FLOATING_PRECISION;
    }

    public Settings withMainCurrency(String currency) {
        return new Settings(currency, uiFloatingPrecision);
    }
}
