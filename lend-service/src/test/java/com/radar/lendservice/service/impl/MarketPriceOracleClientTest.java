package com.radar.lendservice.service.impl;

import com.radar.lendcommon.enums.ErrorCode;
import com.radar.lendservice.config.BinanceRestClient;
import com.radar.lendservice.config.LendingConfig;
import com.radar.lendservice.service.model.PriceQuote;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.web.client.ResourceAccessException;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MarketPriceOracleClientTest {

    private static final long NOW = 1_700_000_000L;
    private static final List<String> KEYS = List.of("market:price:SOLUSDT", "market:price:ts:SOLUSDT");

    @Mock
    private StringRedisTemplate stringRedisTemplate;
    @Mock
    private ValueOperations<String, String> valueOperations;
    @Mock
    private BinanceRestClient binanceRestClient;

    private final LendingConfig lendingConfig = new LendingConfig();
    private MarketPriceOracleClient oracle;

    @BeforeEach
    void setUp() {
        when(stringRedisTemplate.opsForValue()).thenReturn(valueOperations);
        Clock clock = Clock.fixed(Instant.ofEpochSecond(NOW), ZoneOffset.UTC);
        oracle = new MarketPriceOracleClient(stringRedisTemplate, binanceRestClient, lendingConfig, clock);
    }

    @Test
    void freshRedisPriceIsConvertedToUnitPrice() {
        when(valueOperations.multiGet(KEYS)).thenReturn(Arrays.asList("142.35", String.valueOf((NOW - 5) * 1000)));

        PriceQuote quote = oracle.getPrice("SOLUSDT");

        // 142.35 USDC/SOL -> 0.14235 最小单位之比
        assertThat(quote.price()).isEqualTo(14_235_000L);
        assertThat(quote.scale()).isEqualTo(100_000_000L);
        assertThat(quote.publishedAt()).isEqualTo(NOW - 5);
        assertThat(quote.normalizedTo(10_000L)).isEqualTo(1_423L);
        verifyNoInteractions(binanceRestClient);
    }

    @Test
    void stalePriceFallsBackToRest() throws Exception {
        when(valueOperations.multiGet(KEYS)).thenReturn(Arrays.asList("142.35", String.valueOf((NOW - 600) * 1000)));
        when(binanceRestClient.getTickerPrice("SOLUSDT")).thenReturn(new BigDecimal("150.00000000"));

        PriceQuote quote = oracle.getPrice("SOLUSDT");

        assertThat(quote.price()).isEqualTo(15_000_000L);
        assertThat(quote.publishedAt()).isEqualTo(NOW);
    }

    @Test
    void missingTimestampFallsBackToRest() throws Exception {
        when(valueOperations.multiGet(KEYS)).thenReturn(Arrays.asList("142.35", null));
        when(binanceRestClient.getTickerPrice("SOLUSDT")).thenReturn(new BigDecimal("140"));

        assertThat(oracle.getPrice("SOLUSDT").price()).isEqualTo(14_000_000L);
    }

    @Test
    void missingPriceWithoutFallbackIsUnavailable() {
        lendingConfig.getOracle().setRestFallbackEnabled(false);
        when(valueOperations.multiGet(KEYS)).thenReturn(Arrays.asList(null, null));

        assertThatThrownBy(() -> oracle.getPrice("SOLUSDT"))
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.PRICE_UNAVAILABLE);
    }

    @Test
    void restFailureIsUnavailable() throws Exception {
        when(valueOperations.multiGet(KEYS)).thenReturn(Arrays.asList(null, null));
        when(binanceRestClient.getTickerPrice("SOLUSDT")).thenThrow(new ResourceAccessException("timeout"));

        assertThatThrownBy(() -> oracle.getPrice("SOLUSDT"))
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.PRICE_UNAVAILABLE);
    }

    @Test
    void nonPositivePriceIsUnavailable() {
        when(valueOperations.multiGet(KEYS)).thenReturn(Arrays.asList("0", String.valueOf(NOW * 1000)));

        assertThatThrownBy(() -> oracle.getPrice("SOLUSDT"))
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.PRICE_UNAVAILABLE);
    }

    @Test
    void garbledRedisValueFallsBackToRest() throws Exception {
        when(valueOperations.multiGet(KEYS)).thenReturn(Arrays.asList("n/a", String.valueOf(NOW * 1000)));
        when(binanceRestClient.getTickerPrice("SOLUSDT")).thenReturn(new BigDecimal("150"));

        assertThat(oracle.getPrice("SOLUSDT").price()).isEqualTo(15_000_000L);
    }
}
