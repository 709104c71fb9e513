package com.sandkev.holdings.balance;

import com.sandkev.holdings.exchange.ExchangeRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Gathers the current balances of every source: connected exchanges first, then the
 * non-exchange sources. An exchange failure propagates; a failing non-exchange source is
 * logged and contributes an empty map.
 */
@Slf4j
@Service
public class BalanceCollector {

    private final ExchangeRegistry registry;
    private final List<BalanceSource> sources;

    public BalanceCollector(ExchangeRegistry registry, List<BalanceSource> sources) {
        this.registry = registry;
        this.sources = sources;
    }

    public Map<String, Map<String, Balance>> collect() {
        var bySource = new LinkedHashMap<String, Map<String, Balance>>(registry.queryConnectedBalances());
        for (BalanceSource source : sources) {
            try {
                bySource.put(source.name(), source.queryBalances());
            } catch (RuntimeException e) {
                log.warn("Balance source {} failed, counting it as empty: {}", source.name(), e.getMessage());
                bySource.put(source.name(), Map.of());
            }
        }
        return bySource;
    }
}
