package com.sandkev.holdings.exchange.binance;

import com.sandkev.holdings.credential.Credential;
import com.sandkev.holdings.exchange.HmacSigner;
import com.sandkev.holdings.shared.http.HttpRetrySupport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.client.WebClient;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.LongSupplier;
import java.util.stream.Collectors;

/**
 * Signed GET for Binance USER_DATA endpoints:
 * adds timestamp and recvWindow, signs the exact query string sent with HMAC-SHA256,
 * sends the key in X-MBX-APIKEY.
 */
@Slf4j
public class BinanceSignedClient {

    private final WebClient http;
    private final Credential credential;
    private final long recvWindow;
    private final LongSupplier clock;

    public BinanceSignedClient(WebClient binanceWebClient, Credential credential, long recvWindow) {
        this(binanceWebClient, credential, recvWindow, System::currentTimeMillis);
    }

    BinanceSignedClient(WebClient binanceWebClient, Credential credential, long recvWindow, LongSupplier clock) {
        this.http = binanceWebClient;
        this.credential = credential;
        this.recvWindow = recvWindow;
        this.clock = clock;
    }

    public <T> T get(String path, Map<String, Object> params, ParameterizedTypeReference<T> bodyType) {
        return HttpRetrySupport.with429Retry("Binance " + path, () -> doSignedGet(path, params, bodyType));
    }

    private <T> T doSignedGet(String path, Map<String, Object> params, ParameterizedTypeReference<T> type) {
        var qp = sign(params);
        log.debug("Binance signed GET: {} {}", path, params);
        return http.get()
                .uri(uri -> uri.path(path).queryParams(qp).build())
                .header("X-MBX-APIKEY", credential.apiKey())
                .retrieve()
                .onStatus(HttpRetrySupport::isNonRetryableError, r -> r.bodyToMono(String.class)
                        .map(body -> new RuntimeException("Binance " + path + " error " + r.statusCode().value() + ": " + body)))
                .bodyToMono(type)
                .block();
    }

    MultiValueMap<String, String> sign(Map<String, Object> params) {
        var ordered = new LinkedHashMap<String, Object>();
        if (params != null) ordered.putAll(params);
        ordered.put("timestamp", clock.getAsLong());
        ordered.put("recvWindow", recvWindow);

        String qs = ordered.entrySet().stream()
                .filter(e -> e.getValue() != null)
                .map(e -> e.getKey() + "=" + URLEncoder.encode(String.valueOf(e.getValue()), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));

        var qpm = new LinkedMultiValueMap<String, String>();
        ordered.forEach((k, v) -> { if (v != null) qpm.add(k, String.valueOf(v)); });
        qpm.add("signature", HmacSigner.hmacSha256Hex(credential.apiSecret(), qs));
        return qpm;
    }
}
