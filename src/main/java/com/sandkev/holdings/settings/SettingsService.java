package com.sandkev.holdings.settings;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandkev.holdings.config.HoldingsProperties;
import com.sandkev.holdings.config.PortfolioLock;
import com.sandkev.holdings.fiat.FiatCurrencies;
import com.sandkev.holdings.fiat.FiatRateService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the persisted settings and the cached USD to main-currency rate.
 * Mutations run under the portfolio write lock and refresh the rate before the new
 * settings are written, so a failed rate lookup leaves everything unchanged.
 */
@Slf4j
@Service
public class SettingsService {

    private static final String USD = "USD";

    private final Path file;
    private final ObjectMapper json;
    private final FiatRateService fiatRates;
    private final PortfolioLock lock;

    private volatile Settings current;
    // filled lazily on first conversion, replaced on every currency change
    private final AtomicReference<MainCurrencyRate> rate = new AtomicReference<>();

    public SettingsService(HoldingsProperties props, ObjectMapper json, FiatRateService fiatRates, PortfolioLock lock) {
        this.file = props.settingsFile();
        this.json = json;
        this.fiatRates = fiatRates;
        this.lock = lock;
        this.current = load(props.defaultMainCurrency());
    }

    private Settings load(String defaultCurrency) {
        if (!Files.isRegularFile(file)) {
            return new Settings(defaultCurrency.toUpperCase(Locale.ROOT), null);
        }
        try {
            Settings stored = json.readValue(file.toFile(), Settings.class);
            String currency = stored.mainCurrency() == null ? defaultCurrency : stored.mainCurrency();
            return stored.withMainCurrency(currency.toUpperCase(Locale.ROOT));
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read settings file " + file, e);
        }
    }

    public Settings getSettings() {
        return current;
    }

    public Settings setMainCurrency(String currency) {
        return updateSettings(current.withMainCurrency(currency));
    }

    public Settings updateSettings(Settings requested) {
        String currency = requireSupported(requested.mainCurrency());
        Settings next = requested.withMainCurrency(currency);
        return lock.inWriteLock(() -> {
            MainCurrencyRate fresh = fetchRate(currency);
            write(next);
            current = next;
            rate.set(fresh);
            log.info("Main currency set to {}", currency);
            return next;
        });
    }

    /**
     * Converts with the cached rate, fetching it once when absent. Called from balance queries,
     * which hold the read side of the lock, so the fill only installs the fetched rate if no
     * currency change replaced the cache in the meantime.
     */
    public BigDecimal usdToMainCurrency(BigDecimal usdAmount) {
        String currency = current.mainCurrency();
        if (USD.equals(currency)) return usdAmount;
        MainCurrencyRate cached = rate.get();
        if (cached != null && cached.currency().equals(currency)) {
            return usdAmount.multiply(cached.rate());
        }
        MainCurrencyRate fetched = fetchRate(currency);
        if (!rate.compareAndSet(cached, fetched)) {
            log.debug("Rate cache replaced while fetching USD_{}; keeping the newer entry", currency);
        }
        return usdAmount.multiply(fetched.rate());
    }

    private MainCurrencyRate fetchRate(String currency) {
        BigDecimal value = USD.equals(currency) ? BigDecimal.ONE : fiatRates.queryFiatPair(USD, currency);
        return new MainCurrencyRate(currency, value);
    }

    private static String requireSupported(String currency) {
        if (!FiatCurrencies.isFiat(currency)) {
            throw new IllegalArgumentException("Unsupported main currency " + currency);
        }
        return currency.toUpperCase(Locale.ROOT);
    }

    private void write(Settings settings) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Files.writeString(file, json.writeValueAsString(settings));
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write settings file " + file, e);
        }
    }

    private record MainCurrencyRate(String currency, BigDecimal rate) {}
}
