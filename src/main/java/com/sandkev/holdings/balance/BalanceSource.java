package com.sandkev.holdings.balance;

import java.util.Map;

/** A non-exchange origin of balances (on-chain wallets, bank accounts). */
public interface BalanceSource {

    /** Location name used in the percentage breakdown, e.g. "blockchain" or "banks". */
    String name();

    Map<String, Balance> queryBalances();
}
