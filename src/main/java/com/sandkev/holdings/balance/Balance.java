package com.sandkev.holdings.balance;

import java.math.BigDecimal;

/**
 * Amount held of one asset and its USD value. The asset symbol is the key of the map the
 * balance lives in. {@code usdValue} is carried as reported by the source, never re-derived
 * from amount times price here.
 */
public record Balance(BigDecimal amount, BigDecimal usdValue) {

    public Balance {
        amount = amount == null ? BigDecimal.ZERO : amount;
        usdValue = usdValue == null ? BigDecimal.ZERO : usdValue;
    }

    public static Balance of(String amount, String usdValue) {
        return new Balance(new BigDecimal(amount), new BigDecimal(usdValue));
    }

    public Balance plus(Balance other) {
        if (other == null) return this;
        return new Balance(amount.add(other.amount), usdValue.add(other.usdValue));
    }
}
