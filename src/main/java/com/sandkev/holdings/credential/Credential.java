package com.sandkev.holdings.credential;

/** API key/secret pair for one exchange. */
public record Credential(String exchange, String apiKey, String apiSecret) {

    @Override
    public String toString() {
        // keep secrets out of logs
        return "Credential[exchange=" + exchange + ", apiKey=" + mask(apiKey) + "]";
    }

    private static String mask(String s) {
        if (s == null || s.length() <= 4) return "****";
        return s.substring(0, 4) + "****";
    }
}
