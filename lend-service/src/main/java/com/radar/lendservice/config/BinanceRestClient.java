package com.radar.lendservice.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.math.BigDecimal;
import java.net.URI;

/**
 * 交易所REST行情，Redis缺价时兜底
 */
@Slf4j
@Component
public class BinanceRestClient extends BaseRestTemplateConfig {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private final RestTemplate restTemplate;
    private final LendingConfig lendingConfig;

    @Autowired
    public BinanceRestClient(LendingConfig lendingConfig) {
        this.lendingConfig = lendingConfig;
        this.restTemplate = createRestTemplate(3000, 5000);
    }

    BinanceRestClient(LendingConfig lendingConfig, RestTemplate restTemplate) {
        this.lendingConfig = lendingConfig;
        this.restTemplate = restTemplate;
    }

    /**
     * 获取最新成交价
     * 响应形如 {"symbol":"SOLUSDT","price":"142.35000000"}
     *
     * @return 价格，响应缺字段时返回null
     */
    public BigDecimal getTickerPrice(String symbol) throws IOException {
        URI uri = UriComponentsBuilder
                .fromUriString(lendingConfig.getOracle().getRestBaseUrl() + "/api/v3/ticker/price")
                .queryParam("symbol", symbol)
                .build().toUri();
        String json = restTemplate.getForObject(uri, String.class);
        if (json == null || json.isBlank()) {
            return null;
        }
        JsonNode price = MAPPER.readTree(json).get("price");
        if (price == null || price.isNull()) {
            log.warn("ticker响应缺少price字段 symbol={} body={}", symbol, json);
            return null;
        }
        return new BigDecimal(price.asText());
    }
}
