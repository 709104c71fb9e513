package com.sandkev.holdings.exchange.kraken;

import com.sandkev.holdings.credential.Credential;
import com.sandkev.holdings.exchange.HmacSigner;
import com.sandkev.holdings.shared.http.HttpRetrySupport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Kraken private endpoints must be POST with form urlencoded body.
 * Signature: API-Sign = base64( HMAC-SHA512( base64Decode(secret),
 *                                 path + SHA256(nonce + POSTDATA) ) )
 * Headers: API-Key, API-Sign
 */
@Slf4j
public class KrakenSignedClient {

    private final WebClient http;
    private final Credential credential;
    private final KrakenNonce nonces = new KrakenNonce();

    public KrakenSignedClient(WebClient krakenWebClient, Credential credential) {
        this.http = krakenWebClient;
        this.credential = credential;
    }

    public <T> T post(String path, Map<String, Object> params, ParameterizedTypeReference<T> bodyType) {
        return HttpRetrySupport.with429Retry("Kraken " + path, () -> doSignedPost(path, params, bodyType));
    }

    private <T> T doSignedPost(String path, Map<String, Object> params, ParameterizedTypeReference<T> type) {
        String nonce = nonces.next();

        // Kraken signs the exact postdata, so field order must be stable
        var form = new LinkedHashMap<String, String>();
        if (params != null) {
            params.forEach((k, v) -> { if (v != null) form.put(k, String.valueOf(v)); });
        }
        form.put("nonce", nonce);
        String postData = urlEncodeForm(form);

        String canonicalPath = path.startsWith("/") ? path : ("/" + path);
        String apiSign = computeApiSign(canonicalPath, nonce, postData, credential.apiSecret());

        log.debug("Kraken signed POST: {} fields={}", canonicalPath, form.keySet());

        return http.post()
                .uri(canonicalPath)
                .header("API-Key", credential.apiKey().trim())
                .header("API-Sign", apiSign)
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .bodyValue(postData)
                .retrieve()
                .onStatus(HttpRetrySupport::isNonRetryableError, r -> r.bodyToMono(String.class)
                        .map(body -> new RuntimeException("Kraken " + path + " error " + r.statusCode().value() + ": " + body)))
                .bodyToMono(type)
                .block();
    }

    private static String urlEncodeForm(Map<String, String> form) {
        return form.entrySet().stream()
                .map(e -> e.getKey() + "=" + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
    }

    static String computeApiSign(String path, String nonce, String postData, String base64Secret) {
        byte[] secret;
        try {
            secret = Base64.getDecoder().decode(base64Secret.trim());
        } catch (IllegalArgumentException badB64) {
            throw new IllegalStateException("Kraken secret is not valid base64", badB64);
        }
        try {
            byte[] sha256 = MessageDigest.getInstance("SHA-256")
                    .digest((nonce + postData).getBytes(StandardCharsets.UTF_8));

            byte[] pathBytes = path.getBytes(StandardCharsets.UTF_8);
            byte[] message = new byte[pathBytes.length + sha256.length];
            System.arraycopy(pathBytes, 0, message, 0, pathBytes.length);
            System.arraycopy(sha256, 0, message, pathBytes.length, sha256.length);

            return HmacSigner.hmacSha512Base64(secret, message);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Kraken API-Sign computation failed", e);
        }
    }
}
