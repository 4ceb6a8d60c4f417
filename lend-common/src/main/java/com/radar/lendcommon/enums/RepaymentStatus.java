package com.radar.lendcommon.enums;

public enum RepaymentStatus {
    FULLY_REPAID,
    PARTIALLY_REPAID
}
