package com.sandkev.holdings.settings;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandkev.holdings.config.HoldingsProperties;
import com.sandkev.holdings.config.PortfolioLock;
import com.sandkev.holdings.fiat.FiatRateService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SettingsServiceTest {

    private final ObjectMapper json = new ObjectMapper();
    private final FiatRateService fiatRates = mock(FiatRateService.class);
    private final PortfolioLock lock = new PortfolioLock();

    @TempDir
    Path dir;

    @Test
    void defaultsWhenNoSettingsFile() {
        var settings = newService();

        assertThat(settings.getSettings()).isEqualTo(new Settings("USD", 2));
        assertThat(settings.usdToMainCurrency(new BigDecimal("10500"))).isEqualByComparingTo("10500");
        verify(fiatRates, never()).queryFiatPair(anyString(), anyString());
    }

    @Test
    void setMainCurrency_persistsAndRefreshesRate() {
        when(fiatRates.queryFiatPair("USD", "EUR")).thenReturn(new BigDecimal("0.9"));
        var settings = newService();

        Settings updated = settings.setMainCurrency("eur");

        assertThat(updated.mainCurrency()).isEqualTo("EUR");
        assertThat(Files.exists(dir.resolve("settings.json"))).isTrue();
        assertThat(settings.usdToMainCurrency(new BigDecimal("100"))).isEqualByComparingTo("90");
        verify(fiatRates, times(1)).queryFiatPair("USD", "EUR");

        assertThat(newService().getSettings().mainCurrency()).isEqualTo("EUR");
    }

    @Test
    void setMainCurrency_rejectsUnsupportedCurrency() {
        var settings = newService();

        assertThatThrownBy(() -> settings.setMainCurrency("DOGE"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("DOGE");
        assertThat(settings.getSettings().mainCurrency()).isEqualTo("USD");
        assertThat(Files.exists(dir.resolve("settings.json"))).isFalse();
    }

    @Test
    void setMainCurrency_failedRateLookupChangesNothing() throws Exception {
        when(fiatRates.queryFiatPair("USD", "GBP")).thenThrow(new IllegalStateException("No USD_GBP rate"));
        var settings = newService();

        assertThatThrownBy(() -> settings.setMainCurrency("GBP")).isInstanceOf(IllegalStateException.class);

        assertThat(settings.getSettings().mainCurrency()).isEqualTo("USD");
        assertThat(Files.exists(dir.resolve("settings.json"))).isFalse();
        // the write side was released: another thread can still take it
        assertThat(CompletableFuture.supplyAsync(() -> lock.inWriteLock(() -> true)).get(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void usdToMainCurrency_fetchesStoredCurrencyRateOnce() throws Exception {
        Files.writeString(dir.resolve("settings.json"), "{\"mainCurrency\":\"JPY\",\"uiFloatingPrecision\":4}");
        when(fiatRates.queryFiatPair("USD", "JPY")).thenReturn(new BigDecimal("150"));
        var settings = newService();

        assertThat(settings.getSettings()).isEqualTo(new Settings("JPY", 4));
        assertThat(settings.usdToMainCurrency(BigDecimal.ONE)).isEqualByComparingTo("150");
        assertThat(settings.usdToMainCurrency(BigDecimal.TEN)).isEqualByComparingTo("1500");
        verify(fiatRates, times(1)).queryFiatPair("USD", "JPY");
    }

    @Test
    void usdToMainCurrency_lazyFillDoesNotOverwriteConcurrentCurrencyChange() throws Exception {
        Files.writeString(dir.resolve("settings.json"), "{\"mainCurrency\":\"JPY\"}");
        var holder = new AtomicReference<SettingsService>();
        when(fiatRates.queryFiatPair("USD", "EUR")).thenReturn(new BigDecimal("0.9"));
        when(fiatRates.queryFiatPair("USD", "JPY")).thenAnswer(inv -> {
            holder.get().setMainCurrency("EUR");
            return new BigDecimal("150");
        });
        var settings = newService();
        holder.set(settings);

        assertThat(settings.usdToMainCurrency(BigDecimal.ONE)).isEqualByComparingTo("150");

        assertThat(settings.usdToMainCurrency(new BigDecimal("100"))).isEqualByComparingTo("90");
        verify(fiatRates, times(1)).queryFiatPair("USD", "JPY");
        verify(fiatRates, times(1)).queryFiatPair("USD", "EUR");
    }

    @Test
    void updateSettings_keepsPrecision() {
        var settings = newService();

        settings.updateSettings(new Settings("usd", 6));

        assertThat(newService().getSettings()).isEqualTo(new Settings("USD", 6));
    }

    private SettingsService newService() {
        var props = new HoldingsProperties(dir, null, null, null, null, null);
        return new SettingsService(props, json, fiatRates, lock);
    }
}
