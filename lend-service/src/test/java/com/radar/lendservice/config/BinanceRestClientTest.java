package com.radar.lendservice.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BinanceRestClientTest {

    @Mock
    private RestTemplate restTemplate;

    private BinanceRestClient client;

    @BeforeEach
    void setUp() {
        client = new BinanceRestClient(new LendingConfig(), restTemplate);
    }

    @Test
    void parsesTickerPrice() throws Exception {
        when(restTemplate.getForObject(any(URI.class), eq(String.class)))
                .thenReturn("{\"symbol\":\"SOLUSDT\",\"price\":\"142.35000000\"}");

        BigDecimal price = client.getTickerPrice("SOLUSDT");

        assertThat(price).isEqualByComparingTo("142.35");
        ArgumentCaptor<URI> uri = ArgumentCaptor.forClass(URI.class);
        verify(restTemplate).getForObject(uri.capture(), eq(String.class));
        assertThat(uri.getValue().toString())
                .isEqualTo("https://api.binance.com/api/v3/ticker/price?symbol=SOLUSDT");
    }

    @Test
    void missingPriceFieldYieldsNull() throws Exception {
        when(restTemplate.getForObject(any(URI.class), eq(String.class)))
                .thenReturn("{\"code\":-1121,\"msg\":\"Invalid symbol.\"}");

        assertThat(client.getTickerPrice("NOPE")).isNull();
    }
}
