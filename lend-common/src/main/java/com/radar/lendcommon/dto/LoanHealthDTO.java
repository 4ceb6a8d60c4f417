package com.radar.lendcommon.dto;

import lombok.Data;

/**
 * 贷款健康度
 */
@Data
public class LoanHealthDTO {

    private Long ownerId;

    private Long loanId;

    /** 使用的抵押品价格（已按 PRICE_SCALE 归一） */
    private Long price;

    /** 抵押品当前价值 */
    private Long collateralValue;

    private Long totalOwed;

    /** collateralValue < totalOwed */
    private Boolean underwater;
}
