package com.sandkev.holdings.exchange.kraken;

import java.util.concurrent.atomic.AtomicLong;

/** Strictly increasing nonce per API key, even for several calls within one millisecond. */
final class KrakenNonce {

    private final AtomicLong last = new AtomicLong();

    String next() {
        return String.valueOf(last.updateAndGet(prev -> Math.max(System.currentTimeMillis(), prev + 1)));
    }
}
