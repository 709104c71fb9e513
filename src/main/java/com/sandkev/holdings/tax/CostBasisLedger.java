package com.sandkev.holdings.tax;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-process holder of the latest cost-basis details. Stays empty until the accounting side
 * publishes a result through the portfolio API; each publish replaces the whole map.
 */
@Slf4j
@Component
public class CostBasisLedger implements CostBasisProvider {

    private final AtomicReference<Map<String, CostBasis>> latest = new AtomicReference<>();

    /** Replaces the published details. Rejects the whole map if any entry is incomplete or negative. */
    public void publish(Map<String, CostBasis> details) {
        if (details == null) throw new IllegalArgumentException("Cost basis details are required");
        details.forEach(CostBasisLedger::requireValid);
        latest.set(Map.copyOf(details));
        log.info("Cost basis details published for {} assets", details.size());
    }

    private static void requireValid(String asset, CostBasis basis) {
        if (asset == null || asset.isBlank()) {
            throw new IllegalArgumentException("Cost basis entry without an asset");
        }
        if (basis == null || basis.taxFreeAmount() == null || basis.averageBuyValue() == null) {
            throw new IllegalArgumentException("Incomplete cost basis for " + asset);
        }
        if (basis.taxFreeAmount().signum() < 0 || basis.averageBuyValue().signum() < 0) {
            throw new IllegalArgumentException("Negative cost basis for " + asset);
        }
    }

    @Override
    public Optional<Map<String, CostBasis>> details() {
        return Optional.ofNullable(latest.get());
    }
}
