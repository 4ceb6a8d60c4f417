package com.radar.lendservice.service.model;

/**
 * 单笔贷款在某时刻、某价格下的状态
 */
public record LoanHealth(
        long principal,
        long interest,
        long totalOwed,
        long collateralValue
) {

    public boolean underwater() {
        return collateralValue < totalOwed;
    }
}
