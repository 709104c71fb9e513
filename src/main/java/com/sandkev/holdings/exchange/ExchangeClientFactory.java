package com.sandkev.holdings.exchange;

import com.sandkev.holdings.config.ExchangesProperties;
import com.sandkev.holdings.credential.Credential;
import com.sandkev.holdings.exchange.binance.BinanceClient;
import com.sandkev.holdings.exchange.binance.BinanceSignedClient;
import com.sandkev.holdings.exchange.bittrex.BittrexClient;
import com.sandkev.holdings.exchange.kraken.KrakenClient;
import com.sandkev.holdings.exchange.kraken.KrakenSignedClient;
import com.sandkev.holdings.exchange.poloniex.PoloniexClient;
import com.sandkev.holdings.price.UsdPriceService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Builds the client variant for an exchange name from a stored or candidate credential. */
@Component
@RequiredArgsConstructor
public class ExchangeClientFactory {

    private final ExchangeWebClients webClients;
    private final ExchangesProperties endpoints;
    private final UsdPriceService prices;

    public ExchangeClient create(ExchangeName name, Credential credential) {
        var endpoint = endpoints.endpoint(name);
        var http = webClients.forExchange(name);
        return switch (name) {
            case KRAKEN -> new KrakenClient(new KrakenSignedClient(http, credential), prices, endpoint.cacheTtl());
            case BINANCE -> new BinanceClient(
                    new BinanceSignedClient(http, credential, endpoint.recvWindow()), prices, endpoint.cacheTtl());
            case POLONIEX -> new PoloniexClient(http, credential, prices, endpoint.cacheTtl());
            case BITTREX -> new BittrexClient(http, endpoint.baseUrl(), credential, prices, endpoint.cacheTtl());
        };
    }
}
