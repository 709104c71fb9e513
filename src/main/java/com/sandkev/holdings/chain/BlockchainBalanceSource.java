package com.sandkev.holdings.chain;

import com.sandkev.holdings.balance.Balance;
import com.sandkev.holdings.balance.BalanceSource;
import com.sandkev.holdings.config.HoldingsProperties;
import com.sandkev.holdings.price.UsdPriceService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * On-chain totals for the configured BTC and ETH accounts.
 * BTC comes from an explorer's plain-text satoshi balance, ETH from {@code eth_getBalance}.
 */
@Slf4j
@Component
public class BlockchainBalanceSource implements BalanceSource {

    public static final String NAME = "blockchain";

    private static final BigDecimal SATOSHI_PER_BTC = BigDecimal.TEN.pow(8);
    private static final BigDecimal WEI_PER_ETH = BigDecimal.TEN.pow(18);

    private final WebClient btcExplorer;
    private final WebClient ethRpc;
    private final List<String> btcAccounts;
    private final List<String> ethAccounts;
    private final UsdPriceService prices;

    public BlockchainBalanceSource(@Qualifier("btcExplorerWebClient") WebClient btcExplorerWebClient,
                                   @Qualifier("ethRpcWebClient") WebClient ethRpcWebClient,
                                   HoldingsProperties props,
                                   UsdPriceService prices) {
        this.btcExplorer = btcExplorerWebClient;
        this.ethRpc = ethRpcWebClient;
        this.btcAccounts = props.blockchain().btcAccounts();
        this.ethAccounts = props.blockchain().ethAccounts();
        this.prices = prices;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Map<String, Balance> queryBalances() {
        var amounts = new LinkedHashMap<String, BigDecimal>();
        for (String account : btcAccounts) {
            amounts.merge("BTC", btcBalance(account), BigDecimal::add);
        }
        for (String account : ethAccounts) {
            amounts.merge("ETH", ethBalance(account), BigDecimal::add);
        }
        amounts.values().removeIf(v -> v.signum() == 0);
        return prices.value(amounts);
    }

    BigDecimal btcBalance(String address) {
        String satoshis = btcExplorer.get()
                .uri("/q/addressbalance/{address}", address)
                .retrieve()
                .onStatus(s -> s.value() >= 400, r -> r.bodyToMono(String.class)
                        .map(err -> new RuntimeException("BTC balance for " + address + " error " + r.statusCode().value() + ": " + err)))
                .bodyToMono(String.class)
                .block();
        if (satoshis == null || satoshis.isBlank()) return BigDecimal.ZERO;
        return new BigDecimal(satoshis.trim()).divide(SATOSHI_PER_BTC);
    }

    BigDecimal ethBalance(String address) {
        Map<String, Object> request = Map.of(
                "jsonrpc", "2.0",
                "id", 1,
                "method", "eth_getBalance",
                "params", List.of(address, "latest"));

        Map<String, Object> response = ethRpc.post()
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .retrieve()
                .bodyToMono(new ParameterizedTypeReference<Map<String, Object>>() {})
                .block();

        if (response == null) return BigDecimal.ZERO;
        if (response.get("error") != null) {
            throw new RuntimeException("eth_getBalance for " + address + " failed: " + response.get("error"));
        }
        String hexWei = String.valueOf(response.getOrDefault("result", "0x0"));
        BigInteger wei = new BigInteger(hexWei.startsWith("0x") ? hexWei.substring(2) : hexWei, 16);
        return new BigDecimal(wei).divide(WEI_PER_ETH);
    }
}
