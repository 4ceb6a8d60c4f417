package com.radar.lendcommon.enums;

public enum LoanEventType {
    POSITION_INITIALIZED,
    COLLATERAL_DEPOSITED,
    LOAN_CREATED,
    LOAN_REPAID,
    PARTIAL_REPAYMENT,
    LOAN_LIQUIDATED,
    WITHDRAW,
    LOAN_UNDERWATER
}
