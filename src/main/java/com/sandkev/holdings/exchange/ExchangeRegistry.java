package com.sandkev.holdings.exchange;

import com.sandkev.holdings.balance.Balance;
import com.sandkev.holdings.config.PortfolioLock;
import com.sandkev.holdings.credential.Credential;
import com.sandkev.holdings.credential.CredentialFileMissingException;
import com.sandkev.holdings.credential.CredentialStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Owns the exchange client handles and the list of connected exchanges.
 * <p>
 * Registration validates the key pair outside the lock, then persists the credential, publishes
 * the client and marks the exchange connected inside one write-locked section. The credential is
 * written first, so a failed write leaves the in-memory state untouched.
 */
@Slf4j
@Service
public class ExchangeRegistry {

    private final CredentialStore credentials;
    private final ExchangeClientFactory factory;
    private final PortfolioLock lock;

    private final Map<ExchangeName, ExchangeClient> clients = new EnumMap<>(ExchangeName.class);
    private final List<ExchangeName> connected = new ArrayList<>();

    public ExchangeRegistry(CredentialStore credentials, ExchangeClientFactory factory, PortfolioLock lock) {
        this.credentials = credentials;
        this.factory = factory;
        this.lock = lock;
        lock.runInWriteLock(this::connectStoredExchanges);
    }

    private void connectStoredExchanges() {
        for (ExchangeName name : ExchangeName.values()) {
            Optional<Credential> stored = credentials.get(name.id());
            if (stored.isEmpty()) continue;
            clients.put(name, factory.create(name, stored.get()));
            connected.add(name);
            log.info("Connected {} from stored credentials", name);
        }
    }

    public ExchangeSetupResult register(String name, String apiKey, String apiSecret) {
        Optional<ExchangeName> exchange = ExchangeName.fromId(name);
        if (exchange.isEmpty()) {
            return ExchangeSetupResult.failed(SetupFailure.UNSUPPORTED_EXCHANGE,
                    "Attempted to register unsupported exchange " + name);
        }
        ExchangeName ex = exchange.get();

        ExchangeSetupResult precheck = lock.inReadLock(() -> {
            if (credentials.has(ex.id())) return alreadyRegistered(ex);
            if (credentials.isFileMissing()) return fileMissing(credentials.file().toString());
            return null;
        });
        if (precheck != null) return precheck;

        ExchangeClient candidate = factory.create(ex, new Credential(ex.id(), apiKey, apiSecret));
        ApiKeyValidation validation = candidate.validateApiKey();
        if (!validation.ok()) {
            return ExchangeSetupResult.failed(SetupFailure.VALIDATION_FAILED, validation.message());
        }

        return lock.inWriteLock(() -> {
            // a concurrent register may have won while the key was being validated
            if (credentials.has(ex.id())) return alreadyRegistered(ex);
            try {
                credentials.add(ex.id(), apiKey, apiSecret);
            } catch (CredentialFileMissingException e) {
                return fileMissing(e.getPath().toString());
            }
            clients.put(ex, candidate);
            connected.add(ex);
            log.info("Registered exchange {}", ex);
            return ExchangeSetupResult.success();
        });
    }

    public ExchangeSetupResult unregister(String name) {
        Optional<ExchangeName> exchange = ExchangeName.fromId(name);
        return lock.inWriteLock(() -> {
            if (exchange.isEmpty() || !credentials.has(exchange.get().id())) {
                return ExchangeSetupResult.failed(SetupFailure.NOT_REGISTERED, "Exchange " + name + " is not registered");
            }
            ExchangeName ex = exchange.get();
            try {
                credentials.remove(ex.id());
            } catch (CredentialFileMissingException e) {
                return fileMissing(e.getPath().toString());
            }
            connected.remove(ex);
            // TODO: drop the handle from clients and stop its periodic sync once clients expose a close hook
            log.info("Unregistered exchange {}", ex);
            return ExchangeSetupResult.success();
        });
    }

    public List<String> connectedExchanges() {
        return lock.inReadLock(() -> connected.stream().map(ExchangeName::id).toList());
    }

    /** Queries every connected exchange in connection order. Callers hold the read lock for a consistent view. */
    public Map<String, Map<String, Balance>> queryConnectedBalances() {
        List<ExchangeClient> active = lock.inReadLock(() -> connected.stream().map(clients::get).toList());
        var out = new LinkedHashMap<String, Map<String, Balance>>();
        for (ExchangeClient client : active) {
            out.put(client.name().id(), client.queryBalances());
        }
        return out;
    }

    /**
     * Every retained handle with a periodic hook. Includes handles of exchanges that were
     * unregistered in this process, since unregister does not release them.
     */
    public List<ExchangeClient> periodicClients() {
        return lock.inReadLock(() -> clients.values().stream().filter(ExchangeClient::hasMainLogic).toList());
    }

    Optional<ExchangeClient> client(ExchangeName name) {
        return lock.inReadLock(() -> Optional.ofNullable(clients.get(name)));
    }

    private static ExchangeSetupResult alreadyRegistered(ExchangeName ex) {
        return ExchangeSetupResult.failed(SetupFailure.ALREADY_REGISTERED, "Exchange " + ex + " is already registered");
    }

    private static ExchangeSetupResult fileMissing(String path) {
        log.error("The secret file can not be found: {}", path);
        return ExchangeSetupResult.failed(SetupFailure.CREDENTIAL_FILE_MISSING, "The secret file can not be found");
    }
}
