package com.sandkev.holdings.exchange.poloniex;

import com.sandkev.holdings.credential.Credential;
import com.sandkev.holdings.exchange.AbstractExchangeClient;
import com.sandkev.holdings.exchange.ExchangeName;
import com.sandkev.holdings.exchange.HmacSigner;
import com.sandkev.holdings.price.UsdPriceService;
import com.sandkev.holdings.shared.http.HttpRetrySupport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Poloniex trading API: POST /tradingApi with form body {@code command=...&nonce=...},
 * headers Key and Sign = hex(HMAC-SHA512(secret, body)).
 */
@Slf4j
public class PoloniexClient extends AbstractExchangeClient {

    static final String TRADING_PATH = "/tradingApi";

    private final WebClient http;
    private final Credential credential;
    private final AtomicLong lastNonce = new AtomicLong();

    public PoloniexClient(WebClient poloniexWebClient, Credential credential, UsdPriceService prices, Duration cacheTtl) {
        super(ExchangeName.POLONIEX, prices, cacheTtl);
        this.http = poloniexWebClient;
        this.credential = credential;
    }

    @Override
    protected Map<String, BigDecimal> fetchAmounts() {
        Map<String, Object> body = tradingApi("returnCompleteBalances");
        if (body == null) return Map.of();
        if (body.containsKey("error")) {
            throw new RuntimeException("Poloniex returnCompleteBalances error: " + body.get("error"));
        }

        // { "BTC": { "available": "0.1", "onOrders": "0.0", "btcValue": "0.1" }, ... }
        var out = new LinkedHashMap<String, BigDecimal>();
        body.forEach((asset, raw) -> {
            if (raw instanceof Map<?, ?> entry) {
                BigDecimal available = new BigDecimal(String.valueOf(((Map<?, Object>) entry).getOrDefault("available", "0")));
                BigDecimal onOrders = new BigDecimal(String.valueOf(((Map<?, Object>) entry).getOrDefault("onOrders", "0")));
                BigDecimal total = available.add(onOrders);
                if (total.signum() != 0) out.put(asset, total);
            }
        });
        return out;
    }

    @Override
    public boolean hasMainLogic() {
        return true;
    }

    @Override
    public void mainLogic() {
        refreshBalances();
    }

    private Map<String, Object> tradingApi(String command) {
        return HttpRetrySupport.with429Retry("Poloniex " + command, () -> {
            String postData = "command=" + command + "&nonce=" + nextNonce();
            log.debug("Poloniex trading API: {}", command);
            return http.post()
                    .uri(TRADING_PATH)
                    .header("Key", credential.apiKey())
                    .header("Sign", HmacSigner.hmacSha512Hex(credential.apiSecret(), postData))
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .bodyValue(postData)
                    .retrieve()
                    .onStatus(HttpRetrySupport::isNonRetryableError, r -> r.bodyToMono(String.class)
                            .map(err -> new RuntimeException("Poloniex " + command + " error " + r.statusCode().value() + ": " + err)))
                    .bodyToMono(new ParameterizedTypeReference<Map<String, Object>>() {})
                    .block();
        });
    }

    private long nextNonce() {
        return lastNonce.updateAndGet(prev -> Math.max(System.currentTimeMillis(), prev + 1));
    }
}
