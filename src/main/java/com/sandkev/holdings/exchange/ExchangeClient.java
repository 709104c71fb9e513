package com.sandkev.holdings.exchange;

import com.sandkev.holdings.balance.Balance;

import java.util.Map;

/**
 * One authenticated connection to an exchange. Instances are owned by the {@link ExchangeRegistry}.
 */
public interface ExchangeClient {

    ExchangeName name();

    /** Performs an authenticated call and reports whether the key pair works. Never throws. */
    ApiKeyValidation validateApiKey();

    /** { asset -> Balance } for every non-zero holding on the exchange. */
    Map<String, Balance> queryBalances();

    /** Whether {@link #mainLogic()} does anything; only those clients are driven by the sync loop. */
    default boolean hasMainLogic() {
        return false;
    }

    /** Periodic housekeeping hook called by the sync loop. */
    default void mainLogic() {
    }
}
