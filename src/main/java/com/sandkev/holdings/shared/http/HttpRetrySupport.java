package com.sandkev.holdings.shared.http;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/** Blocking retry for exchange calls answered with HTTP 429. Honours Retry-After when present. */
@Slf4j
public final class HttpRetrySupport {

    static final int MAX_RETRIES = 5;
    private static final long INITIAL_BACKOFF_MS = 1_000;
    private static final long MAX_BACKOFF_MS = 15_000;

    private HttpRetrySupport() {}

    /**
     * Error statuses a client may map to its own exception. 429 is left to WebClient's default
     * handler so it surfaces as {@link WebClientResponseException.TooManyRequests} and gets retried.
     */
    public static boolean isNonRetryableError(HttpStatusCode status) {
        return status.isError() && status.value() != HttpStatus.TOO_MANY_REQUESTS.value();
    }

    public static <T> T with429Retry(String label, Supplier<T> call) {
        return with429Retry(label, MAX_RETRIES, call);
    }

    static <T> T with429Retry(String label, int maxRetries, Supplier<T> call) {
        long backoffMs = INITIAL_BACKOFF_MS;
        for (int attempt = 0; ; attempt++) {
            try {
                return call.get();
            } catch (WebClientResponseException.TooManyRequests e) {
                if (attempt >= maxRetries) throw e;

                Long retryAfterMs = parseRetryAfterToMillis(e.getHeaders().getFirst(HttpHeaders.RETRY_AFTER));
                long sleepMs = backoffMs + ThreadLocalRandom.current().nextLong(250, 750);
                if (retryAfterMs != null) sleepMs = Math.max(sleepMs, retryAfterMs);

                log.warn("429 from {} attempt {}/{}; sleeping {} ms", label, attempt + 1, maxRetries, sleepMs);
                if (!sleep(sleepMs)) throw e;
                backoffMs = Math.min((long) (backoffMs * 1.8), MAX_BACKOFF_MS);
            }
        }
    }

    /** Retry-After as either delta-seconds or an HTTP date; null when absent or unparseable. */
    public static Long parseRetryAfterToMillis(String v) {
        if (v == null || v.isBlank()) return null;
        try {
            return Long.parseLong(v.trim()) * 1000L;
        } catch (NumberFormatException notSeconds) {
            // fall through to the date form
        }
        try {
            long target = ZonedDateTime.parse(v.trim(), DateTimeFormatter.RFC_1123_DATE_TIME).toInstant().toEpochMilli();
            return Math.max(target - System.currentTimeMillis(), 0L);
        } catch (RuntimeException notDate) {
            log.debug("Ignoring unparseable Retry-After '{}'", v);
            return null;
        }
    }

    private static boolean sleep(long ms) {
        try {
            Thread.sleep(ms);
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
