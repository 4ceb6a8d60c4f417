package com.radar.lendservice.service;

import com.radar.lendservice.service.model.PriceQuote;

/**
 * 抵押品现价来源
 * 价格缺失、过期、无法解析时抛出 PRICE_UNAVAILABLE，调用方据此中止整个操作
 */
public interface PriceOracleClient {

    PriceQuote getPrice(String feedReference);
}
