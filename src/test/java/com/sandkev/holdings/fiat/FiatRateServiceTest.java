package com.sandkev.holdings.fiat;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.sandkev.holdings.config.HoldingsProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.math.BigDecimal;
import java.nio.file.Path;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FiatRateServiceTest {

    private WireMockServer wm;
    private FiatRateService rates;

    @BeforeEach
    void setUp() {
        wm = new WireMockServer(0);
        wm.start();
        WebClient webClient = WebClient.builder().baseUrl("http://localhost:" + wm.port()).build();
        rates = new FiatRateService(webClient, new HoldingsProperties(Path.of("build"), null, null, null, null, null));
    }

    @AfterEach
    void tearDown() {
        wm.stop();
    }

    @Test
    void queryFiatPair_readsRateAndCachesIt() {
        wm.stubFor(get(urlPathEqualTo("/latest"))
                .withQueryParam("from", equalTo("EUR"))
                .withQueryParam("to", equalTo("USD"))
                .willReturn(okJson("{\"amount\":1.0,\"base\":\"EUR\",\"date\":\"2024-05-03\",\"rates\":{\"USD\":1.0765}}")));

        assertThat(rates.queryFiatPair("eur", "usd")).isEqualByComparingTo("1.0765");
        assertThat(rates.queryFiatPair("EUR", "USD")).isEqualByComparingTo("1.0765");

        wm.verify(1, getRequestedFor(urlPathEqualTo("/latest")));
    }

    @Test
    void queryFiatPair_sameCurrencyIsOneWithoutRemoteCall() {
        assertThat(rates.queryFiatPair("USD", "usd")).isEqualTo(BigDecimal.ONE);

        assertThat(wm.getAllServeEvents()).isEmpty();
    }

    @Test
    void queryFiatPair_missingRateFails() {
        wm.stubFor(get(urlPathEqualTo("/latest")).willReturn(okJson("{\"rates\":{}}")));

        assertThatThrownBy(() -> rates.queryFiatPair("GBP", "JPY"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("GBP_JPY");
    }

    @Test
    void queryFiatPair_httpErrorCarriesStatus() {
        wm.stubFor(get(urlPathEqualTo("/latest")).willReturn(aResponse().withStatus(404).withBody("{\"message\":\"not found\"}")));

        assertThatThrownBy(() -> rates.queryFiatPair("EUR", "XXX"))
                .hasMessageContaining("404");
    }
}
