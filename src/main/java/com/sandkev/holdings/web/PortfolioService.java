package com.sandkev.holdings.web;

import com.sandkev.holdings.balance.BalanceCollector;
import com.sandkev.holdings.config.PortfolioLock;
import com.sandkev.holdings.exchange.ExchangeRegistry;
import com.sandkev.holdings.exchange.ExchangeSetupResult;
import com.sandkev.holdings.history.BalanceHistoryDao;
import com.sandkev.holdings.history.NetValuePoint;
import com.sandkev.holdings.loop.ExchangeSyncLoop;
import com.sandkev.holdings.settings.Settings;
import com.sandkev.holdings.settings.SettingsService;
import com.sandkev.holdings.tax.CostBasis;
import com.sandkev.holdings.tax.CostBasisLedger;
import com.sandkev.holdings.tax.TaxOverlay;
import com.sandkev.holdings.valuation.PortfolioSnapshot;
import com.sandkev.holdings.valuation.PortfolioValuator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Entry point for everything the REST layer can ask of the portfolio.
 * <p>
 * A balance query runs collect, value, optional save, tax overlay and main-currency conversion
 * while holding the read lock, so no registration can land halfway through a snapshot. The
 * saved rows never include the tax overlay.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PortfolioService {

    private final PortfolioLock lock;
    private final ExchangeRegistry registry;
    private final BalanceCollector collector;
    private final PortfolioValuator valuator;
    private final TaxOverlay taxOverlay;
    private final CostBasisLedger costBasis;
    private final BalanceHistoryDao history;
    private final SettingsService settings;
    private final ExchangeSyncLoop syncLoop;

    public PortfolioSnapshot queryBalances(boolean saveData) {
        return lock.inReadLock(() -> {
            PortfolioSnapshot snapshot = valuator.value(collector.collect());
            if (saveData) {
                history.save(snapshot, Instant.now());
            }
            PortfolioSnapshot overlaid = taxOverlay.apply(snapshot);
            return overlaid.inMainCurrency(settings.getSettings().mainCurrency(),
                    settings.usdToMainCurrency(snapshot.netUsd()));
        });
    }

    public ExchangeSetupResult setupExchange(String name, String apiKey, String apiSecret) {
        return registry.register(name, apiKey, apiSecret);
    }

    public ExchangeSetupResult removeExchange(String name) {
        return registry.unregister(name);
    }

    public List<String> connectedExchanges() {
        return registry.connectedExchanges();
    }

    public Settings setMainCurrency(String currency) {
        return settings.setMainCurrency(currency);
    }

    public Settings updateSettings(Settings requested) {
        return settings.updateSettings(requested);
    }

    public Settings getSettings() {
        return settings.getSettings();
    }

    /** Takes the accounting collaborator's per-asset details; later balance queries carry the overlay. */
    public void publishCostBasis(Map<String, CostBasis> details) {
        costBasis.publish(details);
    }

    public List<NetValuePoint> history(int limit) {
        return history.latestNetValues(limit);
    }

    public void shutdown() {
        log.info("Shutdown requested");
        syncLoop.stop();
    }
}
