package com.sandkev.holdings.exchange;

import org.springframework.web.reactive.function.client.WebClient;

import java.util.EnumMap;
import java.util.Map;

/** One base-URL-bound WebClient per exchange. */
public class ExchangeWebClients {

    private final Map<ExchangeName, WebClient> clients;

    public ExchangeWebClients(Map<ExchangeName, WebClient> clients) {
        this.clients = new EnumMap<>(clients);
    }

    public WebClient forExchange(ExchangeName name) {
        WebClient client = clients.get(name);
        if (client == null) {
            throw new IllegalStateException("No WebClient configured for " + name);
        }
        return client;
    }
}
