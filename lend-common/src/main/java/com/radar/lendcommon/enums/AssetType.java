package com.radar.lendcommon.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 账本涉及的两种资产
 */
@Getter
@AllArgsConstructor
public enum AssetType {

    /** 抵押资产（如SOL） */
    COLLATERAL("COLLATERAL"),

    /** 借出资产（如USDC） */
    DEBT("DEBT");

    private final String code;
}
