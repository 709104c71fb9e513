package com.sandkev.holdings.exchange;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/** The closed set of exchanges a credential can be registered for. */
public enum ExchangeName {
    KRAKEN("kraken"),
    POLONIEX("poloniex"),
    BITTREX("bittrex"),
    BINANCE("binance");

    private final String id;

    ExchangeName(String id) {
        this.id = id;
    }

    /** Lower-case name used in the credential file and as the balance location. */
    public String id() {
        return id;
    }

    public static Optional<ExchangeName> fromId(String name) {
        if (name == null) return Optional.empty();
        String n = name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(e -> e.id.equals(n)).findFirst();
    }

    @Override
    public String toString() {
        return id;
    }
}
