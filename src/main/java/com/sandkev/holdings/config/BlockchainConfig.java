package com.sandkev.holdings.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

@Configuration
public class BlockchainConfig {

    @Bean
    WebClient btcExplorerWebClient(HoldingsProperties p) {
        return build(p.blockchain().btcExplorerUrl(), p.blockchain().timeoutMs());
    }

    @Bean
    WebClient ethRpcWebClient(HoldingsProperties p) {
        return build(p.blockchain().ethRpcUrl(), p.blockchain().timeoutMs());
    }

    private static WebClient build(String baseUrl, int timeoutMs) {
        var http = HttpClient.create().responseTimeout(Duration.ofMillis(timeoutMs));
        return WebClient.builder()
                .baseUrl(baseUrl)
                .clientConnector(new ReactorClientHttpConnector(http))
                .build();
    }
}
