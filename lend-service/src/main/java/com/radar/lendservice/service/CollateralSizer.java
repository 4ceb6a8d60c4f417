package com.radar.lendservice.service;

import com.radar.lendcommon.util.CheckedMath;
import org.springframework.stereotype.Component;

/**
 * 按借款额、LTV与抵押品价格计算所需抵押品
 */
@Component
public class CollateralSizer {

    /**
     * debt * 100 / ltv * priceScale / price，严格从左到右，每次除法后截断。
     * 先乘后除的顺序决定截断结果，不可调整。
     */
    public long requiredCollateral(long debtAmount, int ltvRatio, long collateralPrice, long priceScale) {
        long scaledDebt = CheckedMath.div(CheckedMath.mul(debtAmount, 100), ltvRatio);
        return CheckedMath.div(CheckedMath.mul(scaledDebt, priceScale), collateralPrice);
    }
}
