package com.sandkev.holdings.web;

import com.sandkev.holdings.exchange.ExchangeSetupResult;

/** The {@code {result, message}} body returned by every mutating endpoint. */
public record OperationResult(boolean result, String message) {

    public static OperationResult of(ExchangeSetupResult r) {
        return new OperationResult(r.ok(), r.message());
    }

    public static OperationResult ok() {
        return new OperationResult(true, "");
    }
}
