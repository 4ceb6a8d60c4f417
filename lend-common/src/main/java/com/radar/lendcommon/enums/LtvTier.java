package com.radar.lendcommon.enums;

import com.radar.lendcommon.exception.BizException;
import lombok.Getter;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * LTV档位表，每个LTV固定对应一个年化利率（整数百分点）
 */
@Getter
public enum LtvTier {

    LTV_20(20, 0),
    LTV_25(25, 1),
    LTV_33(33, 5),
    LTV_50(50, 8);

    /** 借款价值 / 抵押价值，百分比 */
    private final int ltv;

    /** 年化利率，整数百分点 */
    private final int apy;

    private static final Map<Integer, LtvTier> BY_LTV;

    static {
        Map<Integer, LtvTier> byLtv = new LinkedHashMap<>();
        Set<Integer> apys = new HashSet<>();
        for (LtvTier tier : values()) {
            if (tier.ltv <= 0 || tier.ltv > 100 || tier.apy < 0) {
                throw new IllegalStateException("LTV档位越界: " + tier);
            }
            if (byLtv.put(tier.ltv, tier) != null || !apys.add(tier.apy)) {
                throw new IllegalStateException("LTV档位重复: " + tier);
            }
        }
        BY_LTV = Collections.unmodifiableMap(byLtv);
    }

    LtvTier(int ltv, int apy) {
        this.ltv = ltv;
        this.apy = apy;
    }

    public static LtvTier of(int ltv) {
        LtvTier tier = BY_LTV.get(ltv);
        if (tier == null) {
            throw new BizException(ErrorCode.INVALID_LTV, "ltv=" + ltv);
        }
        return tier;
    }

    public static boolean isValidPair(int ltv, int apy) {
        LtvTier tier = BY_LTV.get(ltv);
        return tier != null && tier.apy == apy;
    }
}
