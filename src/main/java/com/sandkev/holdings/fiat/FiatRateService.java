package com.sandkev.holdings.fiat;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.sandkev.holdings.config.HoldingsProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Map;

/**
 * Fiat pair rates from a Frankfurter-style endpoint:
 * {@code GET /latest?from=EUR&to=USD -> {"rates":{"USD":1.08}}}.
 */
@Slf4j
@Service
public class FiatRateService {

    private final WebClient http;
    private final Cache<String, BigDecimal> cache;

    public FiatRateService(@Qualifier("fiatRatesWebClient") WebClient fiatRatesWebClient, HoldingsProperties props) {
        this.http = fiatRatesWebClient;
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(props.fiat().cacheTtl())
                .maximumSize(1_000)
                .build();
    }

    /** How many units of {@code quote} one unit of {@code base} buys. */
    public BigDecimal queryFiatPair(String base, String quote) {
        String b = base.toUpperCase(Locale.ROOT);
        String q = quote.toUpperCase(Locale.ROOT);
        if (b.equals(q)) return BigDecimal.ONE;
        return cache.get(b + "_" + q, k -> fetch(b, q));
    }

    private BigDecimal fetch(String base, String quote) {
        log.debug("Querying fiat pair {}_{}", base, quote);
        Map<String, Object> body = http.get()
                .uri(u -> u.path("/latest").queryParam("from", base).queryParam("to", quote).build())
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .onStatus(s -> s.value() >= 400, r -> r.bodyToMono(String.class)
                        .map(err -> new RuntimeException("Fiat rate " + base + "_" + quote + " error " + r.statusCode().value() + ": " + err)))
                .bodyToMono(new ParameterizedTypeReference<Map<String, Object>>() {})
                .block();

        if (body == null || !(body.get("rates") instanceof Map<?, ?> rates) || rates.get(quote) == null) {
            throw new IllegalStateException("No " + base + "_" + quote + " rate in fiat response: " + body);
        }
        return new BigDecimal(String.valueOf(rates.get(quote)));
    }
}
