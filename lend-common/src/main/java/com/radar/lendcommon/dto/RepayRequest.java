package com.radar.lendcommon.dto;

import lombok.Data;

@Data
public class RepayRequest {

    private Long loanId;

    /** 还款数量，不得超过本金+应计利息 */
    private Long amount;
}
