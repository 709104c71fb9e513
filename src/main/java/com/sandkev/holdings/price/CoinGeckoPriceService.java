package com.sandkev.holdings.price;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.sandkev.holdings.config.CoinGeckoProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/** CoinGecko {@code /simple/price}, cached per coin id and vs currency. */
@Slf4j
@Service
public class CoinGeckoPriceService {

    private final WebClient http;
    private final Retry retry;
    private final Cache<String, BigDecimal> cache;

    public CoinGeckoPriceService(@Qualifier("coingeckoWebClient") WebClient coingeckoWebClient,
                                 @Qualifier("geckoRetry") Retry geckoRetry,
                                 CoinGeckoProperties props) {
        this.http = coingeckoWebClient;
        this.retry = geckoRetry;
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(props.cacheTtl())
                .maximumSize(10_000)
                .build();
    }

    /** Returns { coinId -> price in vs }. Ids CoinGecko does not know are absent from the result. */
    public Map<String, BigDecimal> getSimplePrice(Set<String> coinIds, String vsCurrency) {
        if (coinIds == null || coinIds.isEmpty()) return Map.of();
        String vs = vsCurrency.toLowerCase(Locale.ROOT);

        var out = new LinkedHashMap<String, BigDecimal>();
        var missing = new TreeSet<String>();
        for (String id : coinIds) {
            BigDecimal hit = cache.getIfPresent(key(id, vs));
            if (hit != null) out.put(id, hit);
            else missing.add(id);
        }
        if (missing.isEmpty()) return out;

        Map<String, Map<String, Object>> fetched = fetchSimplePrice(missing, vs);
        if (fetched == null) fetched = Map.of();
        fetched.forEach((id, byVs) -> {
            Object raw = byVs == null ? null : byVs.get(vs);
            if (raw != null) {
                BigDecimal px = new BigDecimal(String.valueOf(raw));
                cache.put(key(id, vs), px);
                out.put(id, px);
            }
        });
        return out;
    }

    private Map<String, Map<String, Object>> fetchSimplePrice(Collection<String> ids, String vs) {
        log.debug("CoinGecko simple price ids={} vs={}", ids, vs);
        return http.get()
                .uri(uri -> uri.path("/simple/price")
                        .queryParam("ids", String.join(",", ids))
                        .queryParam("vs_currencies", vs)
                        .build())
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .onStatus(s -> s.value() == 429, r -> Mono.error(new RuntimeException("Rate limited by CoinGecko (429)")))
                .bodyToMono(new ParameterizedTypeReference<Map<String, Map<String, Object>>>() {})
                .retryWhen(retry)
                .block();
    }

    private static String key(String id, String vs) {
        return id + "|" + vs;
    }
}
