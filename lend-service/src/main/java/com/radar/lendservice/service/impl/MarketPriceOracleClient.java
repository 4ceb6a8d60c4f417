package com.radar.lendservice.service.impl;

import com.radar.lendcommon.enums.ErrorCode;
import com.radar.lendcommon.exception.BizException;
import com.radar.lendservice.config.BinanceRestClient;
import com.radar.lendservice.config.LendingConfig;
import com.radar.lendservice.service.PriceOracleClient;
import com.radar.lendservice.service.model.PriceQuote;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.List;

/**
 * 行情预言机
 * <p>
 * 优先读取行情服务写入Redis的最新价（market:price:{feed}）及其时间戳（market:price:ts:{feed}，毫秒），
 * 无价、无时间戳或超过最大延迟时回退交易所REST行情。
 * 行情为每单位抵押资产的借出资产价格，按两侧最小单位精度换算后以 {@link #QUOTE_SCALE} 报价。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MarketPriceOracleClient implements PriceOracleClient {

    static final String PRICE_KEY_PREFIX = "market:price:";
    static final String PRICE_TS_KEY_PREFIX = "market:price:ts:";
    static final long QUOTE_SCALE = 100_000_000L;
    private static final int QUOTE_DECIMALS = 8;

    private final StringRedisTemplate stringRedisTemplate;
    private final BinanceRestClient binanceRestClient;
    private final LendingConfig lendingConfig;
    private final Clock clock;

    @Override
    public PriceQuote getPrice(String feedReference) {
        long nowSeconds = clock.instant().getEpochSecond();

        PriceQuote cached = fromRedis(feedReference, nowSeconds);
        if (cached != null) {
            return cached;
        }

        LendingConfig.Oracle oracle = lendingConfig.getOracle();
        if (!oracle.isRestFallbackEnabled()) {
            throw new BizException(ErrorCode.PRICE_UNAVAILABLE, feedReference);
        }
        try {
            BigDecimal price = binanceRestClient.getTickerPrice(feedReference);
            if (price == null) {
                throw new BizException(ErrorCode.PRICE_UNAVAILABLE, feedReference);
            }
            log.info("Redis缺价，使用REST行情 feed={} price={}", feedReference, price);
            return toQuote(feedReference, price, nowSeconds);
        } catch (RestClientException | IOException | NumberFormatException e) {
            log.warn("REST行情获取失败 feed={}: {}", feedReference, e.getMessage());
            throw new BizException(ErrorCode.PRICE_UNAVAILABLE, feedReference);
        }
    }

    private PriceQuote fromRedis(String feed, long nowSeconds) {
        List<String> values = stringRedisTemplate.opsForValue()
                .multiGet(List.of(PRICE_KEY_PREFIX + feed, PRICE_TS_KEY_PREFIX + feed));
        if (values == null || values.size() < 2 || values.get(0) == null || values.get(1) == null) {
            return null;
        }
        long publishedAt;
        BigDecimal price;
        try {
            publishedAt = Long.parseLong(values.get(1)) / 1000;
            price = new BigDecimal(values.get(0));
        } catch (NumberFormatException e) {
            log.warn("Redis行情格式错误 feed={} price={} ts={}", feed, values.get(0), values.get(1));
            return null;
        }
        long maxStaleness = lendingConfig.getOracle().getMaxStalenessSeconds();
        if (nowSeconds - publishedAt > maxStaleness) {
            log.warn("Redis行情过期 feed={} publishedAt={} now={}", feed, publishedAt, nowSeconds);
            return null;
        }
        return toQuote(feed, price, publishedAt);
    }

    /**
     * 行情价换算为最小单位之比：price * 10^debtDecimals / 10^collateralDecimals
     */
    PriceQuote toQuote(String feed, BigDecimal marketPrice, long publishedAt) {
        if (marketPrice.signum() <= 0) {
            throw new BizException(ErrorCode.PRICE_UNAVAILABLE, "非正价格 " + feed + "=" + marketPrice);
        }
        LendingConfig.Oracle oracle = lendingConfig.getOracle();
        BigDecimal unitPrice = marketPrice.movePointRight(oracle.getDebtDecimals() - oracle.getCollateralDecimals());
        try {
            long scaled = unitPrice.movePointRight(QUOTE_DECIMALS).setScale(0, RoundingMode.DOWN).longValueExact();
            return new PriceQuote(scaled, QUOTE_SCALE, publishedAt);
        } catch (ArithmeticException e) {
            throw new BizException(ErrorCode.PRICE_UNAVAILABLE, "价格超出范围 " + feed + "=" + marketPrice);
        }
    }
}
