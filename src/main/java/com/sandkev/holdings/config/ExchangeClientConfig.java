package com.sandkev.holdings.config;

import com.sandkev.holdings.exchange.ExchangeName;
import com.sandkev.holdings.exchange.ExchangeWebClients;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.EnumMap;

@Configuration
public class ExchangeClientConfig {

    @Bean
    ExchangeWebClients exchangeWebClients(ExchangesProperties props) {
        var clients = new EnumMap<ExchangeName, WebClient>(ExchangeName.class);
        for (ExchangeName name : ExchangeName.values()) {
            clients.put(name, webClient(props.endpoint(name)));
        }
        return new ExchangeWebClients(clients);
    }

    static WebClient webClient(ExchangesProperties.Endpoint endpoint) {
        HttpClient http = HttpClient.create()
                .responseTimeout(Duration.ofMillis(endpoint.timeoutMs()))
                .compress(true);
        return WebClient.builder()
                .baseUrl(endpoint.baseUrl())
                .clientConnector(new ReactorClientHttpConnector(http))
                .build();
    }
}
