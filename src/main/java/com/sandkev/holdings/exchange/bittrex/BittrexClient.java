package com.sandkev.holdings.exchange.bittrex;

import com.sandkev.holdings.credential.Credential;
import com.sandkev.holdings.exchange.AbstractExchangeClient;
import com.sandkev.holdings.exchange.ExchangeName;
import com.sandkev.holdings.exchange.HmacSigner;
import com.sandkev.holdings.price.UsdPriceService;
import com.sandkev.holdings.shared.http.HttpRetrySupport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.web.reactive.function.client.WebClient;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bittrex v1.1 market API. The full request URI (including apikey and nonce) is signed with
 * HMAC-SHA512 and sent in the {@code apisign} header.
 */
@Slf4j
public class BittrexClient extends AbstractExchangeClient {

    static final String BALANCES_PATH = "/api/v1.1/account/getbalances";

    private final WebClient http;
    private final String baseUrl;
    private final Credential credential;
    private final AtomicLong lastNonce = new AtomicLong();

    public BittrexClient(WebClient bittrexWebClient, String baseUrl, Credential credential,
                         UsdPriceService prices, Duration cacheTtl) {
        super(ExchangeName.BITTREX, prices, cacheTtl);
        this.http = bittrexWebClient;
        this.baseUrl = baseUrl.replaceAll("/+$", "");
        this.credential = credential;
    }

    @Override
    protected Map<String, BigDecimal> fetchAmounts() {
        Map<String, Object> body = HttpRetrySupport.with429Retry("Bittrex getbalances", this::signedGetBalances);

        if (body == null) return Map.of();
        if (!Boolean.TRUE.equals(body.get("success"))) {
            throw new RuntimeException("Bittrex getbalances failed: " + body.get("message"));
        }

        // result: [ { "Currency": "BTC", "Balance": 0.1, "Available": 0.1, ... } ]
        @SuppressWarnings("unchecked")
        var result = (List<Map<String, Object>>) body.getOrDefault("result", List.of());
        var out = new LinkedHashMap<String, BigDecimal>(result.size());
        for (var row : result) {
            Object raw = row.get("Balance");
            if (raw == null) continue;
            BigDecimal balance = new BigDecimal(String.valueOf(raw));
            if (balance.signum() != 0) {
                out.merge(String.valueOf(row.get("Currency")), balance, BigDecimal::add);
            }
        }
        log.debug("Bittrex balances: {}", out.keySet());
        return out;
    }

    // each attempt carries its own nonce, so a retry is signed again
    private Map<String, Object> signedGetBalances() {
        String pathAndQuery = BALANCES_PATH + "?apikey=" + credential.apiKey() + "&nonce=" + nextNonce();
        return http.get()
                .uri(pathAndQuery)
                .header("apisign", HmacSigner.hmacSha512Hex(credential.apiSecret(), baseUrl + pathAndQuery))
                .retrieve()
                .onStatus(HttpRetrySupport::isNonRetryableError, r -> r.bodyToMono(String.class)
                        .map(err -> new RuntimeException("Bittrex getbalances error " + r.statusCode().value() + ": " + err)))
                .bodyToMono(new ParameterizedTypeReference<Map<String, Object>>() {})
                .block();
    }

    private long nextNonce() {
        return lastNonce.updateAndGet(prev -> Math.max(System.currentTimeMillis(), prev + 1));
    }
}
