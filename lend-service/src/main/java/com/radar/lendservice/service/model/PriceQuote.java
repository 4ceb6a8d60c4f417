package com.radar.lendservice.service.model;

import com.radar.lendcommon.enums.ErrorCode;
import com.radar.lendcommon.exception.BizException;
import com.radar.lendcommon.util.CheckedMath;

/**
 * 预言机报价：真实价格 = price / scale（借出资产最小单位 / 抵押资产最小单位）
 *
 * @param price       整数价格
 * @param scale       精度
 * @param publishedAt 报价时间（epoch秒）
 */
public record PriceQuote(long price, long scale, long publishedAt) {

    /**
     * 归一到账本精度，截断取整；结果为0视为价格不可用
     */
    public long normalizedTo(long targetScale) {
        if (price <= 0 || scale <= 0) {
            throw new BizException(ErrorCode.PRICE_UNAVAILABLE, "非正价格 " + price + "/" + scale);
        }
        long normalized = scale == targetScale
                ? price
                : CheckedMath.div(CheckedMath.mul(price, targetScale), scale);
        if (normalized == 0) {
            throw new BizException(ErrorCode.PRICE_UNAVAILABLE, "价格低于账本精度");
        }
        return normalized;
    }
}
