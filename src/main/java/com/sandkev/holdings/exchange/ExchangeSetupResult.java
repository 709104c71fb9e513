package com.sandkev.holdings.exchange;

import org.springframework.lang.Nullable;

/** Outcome of a register/unregister call; {@code failure} is null on success. */
public record ExchangeSetupResult(boolean ok, String message, @Nullable SetupFailure failure) {

    public static ExchangeSetupResult success() {
        return new ExchangeSetupResult(true, "", null);
    }

    public static ExchangeSetupResult failed(SetupFailure failure, String message) {
        return new ExchangeSetupResult(false, message, failure);
    }
}
