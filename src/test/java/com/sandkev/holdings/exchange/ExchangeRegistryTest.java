package com.sandkev.holdings.exchange;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandkev.holdings.balance.Balance;
import com.sandkev.holdings.config.PortfolioLock;
import com.sandkev.holdings.credential.Credential;
import com.sandkev.holdings.credential.CredentialStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ExchangeRegistryTest {

    private final ObjectMapper json = new ObjectMapper();
    private final ExchangeClientFactory factory = mock(ExchangeClientFactory.class);
    private final PortfolioLock lock = new PortfolioLock();

    @TempDir
    Path dir;

    private Path secretFile;

    @BeforeEach
    void setUp() {
        secretFile = dir.resolve("secret.json");
    }

    @Test
    void startup_connectsEveryStoredExchange() throws Exception {
        Files.writeString(secretFile, "{\"binance_api_key\":\"bk\",\"binance_secret\":\"bs\","
                + "\"kraken_api_key\":\"kk\",\"kraken_secret\":\"ks\"}");
        ExchangeClient kraken = client(ExchangeName.KRAKEN, ApiKeyValidation.valid());
        ExchangeClient binance = client(ExchangeName.BINANCE, ApiKeyValidation.valid());
        when(factory.create(ExchangeName.KRAKEN, new Credential("kraken", "kk", "ks"))).thenReturn(kraken);
        when(factory.create(ExchangeName.BINANCE, new Credential("binance", "bk", "bs"))).thenReturn(binance);

        var registry = newRegistry();

        assertThat(registry.connectedExchanges()).containsExactly("kraken", "binance");
        assertThat(registry.client(ExchangeName.BINANCE)).contains(binance);
    }

    @Test
    void register_unknownExchangeIsRejected() {
        var registry = newRegistry();

        ExchangeSetupResult result = registry.register("mtgox", "k", "s");

        assertThat(result.ok()).isFalse();
        assertThat(result.failure()).isEqualTo(SetupFailure.UNSUPPORTED_EXCHANGE);
        assertThat(result.message()).isEqualTo("Attempted to register unsupported exchange mtgox");
        assertThat(registry.connectedExchanges()).isEmpty();
        verifyNoInteractions(factory);
    }

    @Test
    void register_failedValidationLeavesEverythingUntouched() throws Exception {
        Files.writeString(secretFile, "{\"binance_api_key\":\"bk\",\"binance_secret\":\"bs\"}");
        ExchangeClient stubbedClient = client(ExchangeName.BINANCE, ApiKeyValidation.valid());
        when(factory.create(eq(ExchangeName.BINANCE), any())).thenReturn(stubbedClient);
        var registry = newRegistry();
        byte[] before = Files.readAllBytes(secretFile);

        ExchangeClient rejected = client(ExchangeName.KRAKEN, ApiKeyValidation.invalid("EAPI:Invalid key"));
        when(factory.create(eq(ExchangeName.KRAKEN), any())).thenReturn(rejected);

        ExchangeSetupResult result = registry.register("kraken", "bad", "c2VjcmV0");

        assertThat(result.failure()).isEqualTo(SetupFailure.VALIDATION_FAILED);
        assertThat(result.message()).isEqualTo("EAPI:Invalid key");
        assertThat(Files.readAllBytes(secretFile)).isEqualTo(before);
        assertThat(registry.connectedExchanges()).containsExactly("binance");
        assertThat(registry.client(ExchangeName.KRAKEN)).isEmpty();
    }

    @Test
    void registerThenUnregister_restoresCredentialFile() throws Exception {
        var registry = newRegistry();
        ExchangeClient kraken = client(ExchangeName.KRAKEN, ApiKeyValidation.valid());
        when(factory.create(eq(ExchangeName.KRAKEN), any())).thenReturn(kraken);

        assertThat(registry.register("kraken", "kk", "ks").ok()).isTrue();
        assertThat(registry.connectedExchanges()).containsExactly("kraken");
        assertThat(Files.readString(secretFile)).contains("kraken_api_key").contains("kraken_secret");

        ExchangeSetupResult removed = registry.unregister("kraken");

        assertThat(removed.ok()).isTrue();
        assertThat(registry.connectedExchanges()).isEmpty();
        assertThat(Files.readString(secretFile)).doesNotContain("kraken");
        // the handle is retained until restart
        assertThat(registry.client(ExchangeName.KRAKEN)).contains(kraken);
    }

    @Test
    void register_twiceIsAlreadyRegistered() {
        var registry = newRegistry();
        ExchangeClient stubbedClient = client(ExchangeName.BITTREX, ApiKeyValidation.valid());
        when(factory.create(eq(ExchangeName.BITTREX), any())).thenReturn(stubbedClient);

        registry.register("bittrex", "k", "s");
        ExchangeSetupResult again = registry.register("bittrex", "k2", "s2");

        assertThat(again.failure()).isEqualTo(SetupFailure.ALREADY_REGISTERED);
        assertThat(again.message()).isEqualTo("Exchange bittrex is already registered");
        assertThat(registry.connectedExchanges()).containsExactly("bittrex");
    }

    @Test
    void unregister_unknownIsNotRegistered() {
        var registry = newRegistry();

        ExchangeSetupResult result = registry.unregister("poloniex");

        assertThat(result.failure()).isEqualTo(SetupFailure.NOT_REGISTERED);
        assertThat(result.message()).isEqualTo("Exchange poloniex is not registered");
    }

    @Test
    void register_failsWhenSecretFileVanished() throws Exception {
        Files.writeString(secretFile, "{\"binance_api_key\":\"bk\",\"binance_secret\":\"bs\"}");
        ExchangeClient stubbedClient = client(ExchangeName.BINANCE, ApiKeyValidation.valid());
        when(factory.create(eq(ExchangeName.BINANCE), any())).thenReturn(stubbedClient);
        var registry = newRegistry();
        Files.delete(secretFile);

        ExchangeSetupResult register = registry.register("kraken", "kk", "ks");
        ExchangeSetupResult unregister = registry.unregister("binance");

        assertThat(register.failure()).isEqualTo(SetupFailure.CREDENTIAL_FILE_MISSING);
        assertThat(register.message()).isEqualTo("The secret file can not be found");
        assertThat(unregister.failure()).isEqualTo(SetupFailure.CREDENTIAL_FILE_MISSING);
        assertThat(registry.connectedExchanges()).containsExactly("binance");
        verify(factory, never()).create(eq(ExchangeName.KRAKEN), any());
    }

    @Test
    void register_failedCredentialWriteLeavesRegistryUntouched() throws Exception {
        // the credential file's parent is a regular file, so the rewrite fails with an I/O error
        Path blocker = Files.writeString(dir.resolve("blocker"), "not a directory");
        var store = new CredentialStore(blocker.resolve("secret.json"), json);
        var registry = new ExchangeRegistry(store, factory, lock);
        ExchangeClient stubbedClient = client(ExchangeName.KRAKEN, ApiKeyValidation.valid());
        when(factory.create(eq(ExchangeName.KRAKEN), any())).thenReturn(stubbedClient);

        assertThatThrownBy(() -> registry.register("kraken", "kk", "ks"))
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining("Could not write credential file");

        assertThat(registry.connectedExchanges()).isEmpty();
        assertThat(registry.client(ExchangeName.KRAKEN)).isEmpty();
        assertThat(registry.periodicClients()).isEmpty();
        assertThat(store.has("kraken")).isFalse();
        assertThat(Files.isRegularFile(blocker)).isTrue();
    }

    @Test
    void queryConnectedBalances_keysByExchangeId() {
        var registry = newRegistry();
        ExchangeClient kraken = client(ExchangeName.KRAKEN, ApiKeyValidation.valid());
        when(kraken.queryBalances()).thenReturn(Map.of("BTC", Balance.of("1", "10000")));
        when(factory.create(eq(ExchangeName.KRAKEN), any())).thenReturn(kraken);
        registry.register("kraken", "kk", "ks");

        assertThat(registry.queryConnectedBalances())
                .containsOnlyKeys("kraken")
                .containsEntry("kraken", Map.of("BTC", Balance.of("1", "10000")));
    }

    @Test
    void periodicClients_includesOnlyClientsWithMainLogic() {
        var registry = newRegistry();
        ExchangeClient kraken = client(ExchangeName.KRAKEN, ApiKeyValidation.valid());
        when(kraken.hasMainLogic()).thenReturn(true);
        ExchangeClient binance = client(ExchangeName.BINANCE, ApiKeyValidation.valid());
        when(factory.create(eq(ExchangeName.KRAKEN), any())).thenReturn(kraken);
        when(factory.create(eq(ExchangeName.BINANCE), any())).thenReturn(binance);
        registry.register("kraken", "kk", "ks");
        registry.register("binance", "bk", "bs");

        assertThat(registry.periodicClients()).containsExactly(kraken);

        registry.unregister("kraken");
        assertThat(registry.periodicClients()).containsExactly(kraken);
    }

    private ExchangeRegistry newRegistry() {
        return new ExchangeRegistry(new CredentialStore(secretFile, json), factory, lock);
    }

    private static ExchangeClient client(ExchangeName name, ApiKeyValidation validation) {
        ExchangeClient client = mock(ExchangeClient.class);
        when(client.name()).thenReturn(name);
        when(client.validateApiKey()).thenReturn(validation);
        return client;
    }
}
