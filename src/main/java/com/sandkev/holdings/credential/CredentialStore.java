package com.sandkev.holdings.credential;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandkev.holdings.config.HoldingsProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Flat JSON file of {@code <exchange>_api_key} / {@code <exchange>_secret} entries.
 * <p>
 * A missing file at load time is an empty store. Every mutation rewrites the whole file; if the
 * file was present and has disappeared since, the mutation fails with
 * {@link CredentialFileMissingException}. Not thread-safe on its own: callers serialise
 * mutations through the portfolio lock.
 */
@Slf4j
@Component
public class CredentialStore {

    private static final String API_KEY_SUFFIX = "_api_key";
    private static final String SECRET_SUFFIX = "_secret";

    private final Path file;
    private final ObjectMapper json;
    private final Map<String, String> entries = new TreeMap<>();
    private boolean fileExpected;

    @Autowired
    public CredentialStore(HoldingsProperties props, ObjectMapper json) {
        this(props.secretFile(), json);
    }

    public CredentialStore(Path file, ObjectMapper json) {
        this.file = file;
        this.json = json;
        load();
    }

    private void load() {
        if (!Files.isRegularFile(file)) {
            log.info("No credential file at {}; starting with no exchanges", file);
            fileExpected = false;
            return;
        }
        try {
            Map<String, Object> raw = json.readValue(file.toFile(), new TypeReference<Map<String, Object>>() {});
            // values are kept as plain strings whatever JSON type they were stored as
            raw.forEach((k, v) -> { if (v != null) entries.put(k, String.valueOf(v)); });
            fileExpected = true;
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read credential file " + file, e);
        }
    }

    public boolean has(String exchange) {
        return entries.containsKey(exchange + API_KEY_SUFFIX);
    }

    public Optional<Credential> get(String exchange) {
        String key = entries.get(exchange + API_KEY_SUFFIX);
        if (key == null) return Optional.empty();
        return Optional.of(new Credential(exchange, key, entries.getOrDefault(exchange + SECRET_SUFFIX, "")));
    }

    /** True when a mutation right now would hit a file that vanished after it was loaded or written. */
    public boolean isFileMissing() {
        return fileExpected && !Files.isRegularFile(file);
    }

    public void add(String exchange, String apiKey, String apiSecret) {
        checkFilePresent();
        var next = new TreeMap<>(entries);
        next.put(exchange + API_KEY_SUFFIX, apiKey);
        next.put(exchange + SECRET_SUFFIX, apiSecret);
        write(next);
        entries.clear();
        entries.putAll(next);
    }

    public void remove(String exchange) {
        checkFilePresent();
        var next = new TreeMap<>(entries);
        next.remove(exchange + API_KEY_SUFFIX);
        next.remove(exchange + SECRET_SUFFIX);
        write(next);
        entries.clear();
        entries.putAll(next);
    }

    /** Read-only view of the raw entries as they are persisted. */
    public Map<String, String> entries() {
        return Collections.unmodifiableMap(new TreeMap<>(entries));
    }

    public Path file() {
        return file;
    }

    private void checkFilePresent() {
        if (isFileMissing()) {
            log.error("The secret file can not be found: {}", file);
            throw new CredentialFileMissingException(file);
        }
    }

    private void write(Map<String, String> content) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Files.writeString(file, json.writeValueAsString(content));
            fileExpected = true;
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write credential file " + file, e);
        }
    }
}
