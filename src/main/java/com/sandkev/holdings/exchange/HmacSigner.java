package com.sandkev.holdings.exchange;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

/** HMAC helpers for the exchange request signatures. */
public final class HmacSigner {

    private HmacSigner() {}

    public static String hmacSha256Hex(String secret, String payload) {
        return hex(hmac("HmacSHA256", secret.getBytes(StandardCharsets.UTF_8), payload.getBytes(StandardCharsets.UTF_8)));
    }

    public static String hmacSha512Hex(String secret, String payload) {
        return hex(hmac("HmacSHA512", secret.getBytes(StandardCharsets.UTF_8), payload.getBytes(StandardCharsets.UTF_8)));
    }

    public static String hmacSha512Base64(byte[] key, byte[] message) {
        return Base64.getEncoder().encodeToString(hmac("HmacSHA512", key, message));
    }

    static byte[] hmac(String algorithm, byte[] key, byte[] message) {
        try {
            Mac mac = Mac.getInstance(algorithm);
            mac.init(new SecretKeySpec(key, algorithm));
            return mac.doFinal(message);
        } catch (Exception e) {
            throw new IllegalStateException(algorithm + " signing failed", e);
        }
    }

    private static String hex(byte[] raw) {
        var sb = new StringBuilder(raw.length * 2);
        for (byte b : raw) sb.append(String.format("%02x", b));
        return sb.toString();
    }
}
