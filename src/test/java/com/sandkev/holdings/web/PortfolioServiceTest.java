package com.sandkev.holdings.web;

import com.sandkev.holdings.balance.Balance;
import com.sandkev.holdings.balance.BalanceAggregator;
import com.sandkev.holdings.balance.BalanceCollector;
import com.sandkev.holdings.config.PortfolioLock;
import com.sandkev.holdings.exchange.ExchangeRegistry;
import com.sandkev.holdings.exchange.ExchangeSetupResult;
import com.sandkev.holdings.history.BalanceHistoryDao;
import com.sandkev.holdings.loop.ExchangeSyncLoop;
import com.sandkev.holdings.settings.Settings;
import com.sandkev.holdings.settings.SettingsService;
import com.sandkev.holdings.tax.CostBasis;
import com.sandkev.holdings.tax.CostBasisLedger;
import com.sandkev.holdings.tax.TaxOverlay;
import com.sandkev.holdings.valuation.PortfolioSnapshot;
import com.sandkev.holdings.valuation.PortfolioValuator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PortfolioServiceTest {

    private final ExchangeRegistry registry = mock(ExchangeRegistry.class);
    private final BalanceCollector collector = mock(BalanceCollector.class);
    private final BalanceHistoryDao history = mock(BalanceHistoryDao.class);
    private final SettingsService settings = mock(SettingsService.class);
    private final ExchangeSyncLoop syncLoop = mock(ExchangeSyncLoop.class);
    private final CostBasisLedger ledger = new CostBasisLedger();

    private PortfolioService portfolio;

    @BeforeEach
    void setUp() {
        portfolio = new PortfolioService(new PortfolioLock(), registry, collector,
                new PortfolioValuator(new BalanceAggregator()), new TaxOverlay(ledger), ledger,
                history, settings, syncLoop);

        var sources = new LinkedHashMap<String, Map<String, Balance>>();
        sources.put("kraken", Map.of("BTC", Balance.of("1", "10000")));
        sources.put("blockchain", Map.of());
        sources.put("banks", Map.of("USD", Balance.of("500", "500")));
        when(collector.collect()).thenReturn(sources);
        when(settings.getSettings()).thenReturn(new Settings("EUR", 2));
        when(settings.usdToMainCurrency(any())).thenAnswer(inv -> inv.<BigDecimal>getArgument(0).multiply(new BigDecimal("0.9")));
    }

    @Test
    void queryBalances_valuesAndConvertsToMainCurrency() {
        PortfolioSnapshot snapshot = portfolio.queryBalances(false);

        assertThat(snapshot.netUsd()).isEqualByComparingTo("10500");
        assertThat(snapshot.location()).containsOnlyKeys("kraken", "blockchain", "banks");
        assertThat(snapshot.mainCurrency()).isEqualTo("EUR");
        assertThat(snapshot.netMainCurrency()).isEqualByComparingTo("9450");
        verify(history, never()).save(any(), any());
    }

    @Test
    void queryBalances_savesBeforeTheTaxOverlay() {
        ledger.publish(Map.of("BTC", new CostBasis(BigDecimal.ZERO, new BigDecimal("8000"))));

        PortfolioSnapshot snapshot = portfolio.queryBalances(true);

        var saved = ArgumentCaptor.forClass(PortfolioSnapshot.class);
        verify(history).save(saved.capture(), any(Instant.class));
        assertThat(saved.getValue().combined().get("BTC").tax()).isNull();
        assertThat(snapshot.combined().get("BTC").tax()).isNotNull();
        assertThat(snapshot.combined().get("BTC").tax().percentChange().value()).isEqualByComparingTo("25");
    }

    @Test
    void publishCostBasis_overlaysLaterQueries() {
        assertThat(portfolio.queryBalances(false).combined().get("BTC").tax()).isNull();

        portfolio.publishCostBasis(Map.of(
                "BTC", new CostBasis(new BigDecimal("0.5"), new BigDecimal("12500")),
                "ETH", new CostBasis(BigDecimal.ZERO, new BigDecimal("2000"))));
        PortfolioSnapshot snapshot = portfolio.queryBalances(false);

        var btc = snapshot.combined().get("BTC").tax();
        assertThat(btc.taxFreeAmount()).isEqualByComparingTo("0.5");
        assertThat(btc.percentChange().value()).isEqualByComparingTo("-20");
        assertThat(snapshot.combined()).doesNotContainKey("ETH");
        assertThat(snapshot.combined().get("USD").tax()).isNull();
    }

    @Test
    void publishCostBasis_rejectsIncompleteEntriesAndKeepsPrevious() {
        portfolio.publishCostBasis(Map.of("BTC", new CostBasis(BigDecimal.ZERO, new BigDecimal("8000"))));

        assertThatThrownBy(() -> portfolio.publishCostBasis(Map.of("BTC", new CostBasis(BigDecimal.ZERO, null))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("BTC");
        assertThatThrownBy(() -> portfolio.publishCostBasis(Map.of("BTC", new CostBasis(BigDecimal.ONE.negate(), BigDecimal.ONE))))
                .isInstanceOf(IllegalArgumentException.class);

        assertThat(portfolio.queryBalances(false).combined().get("BTC").tax().averageBuyValue()).isEqualByComparingTo("8000");
    }

    @Test
    void setupAndRemoveExchange_delegateToRegistry() {
        when(registry.register("kraken", "k", "s")).thenReturn(ExchangeSetupResult.success());
        when(registry.unregister("kraken")).thenReturn(ExchangeSetupResult.success());

        assertThat(portfolio.setupExchange("kraken", "k", "s").ok()).isTrue();
        assertThat(portfolio.removeExchange("kraken").ok()).isTrue();
    }

    @Test
    void shutdown_cancelsTheSyncLoop() {
        portfolio.shutdown();

        verify(syncLoop).stop();
    }
}
