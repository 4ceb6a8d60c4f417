package com.radar.lendcommon.dto;

import lombok.Data;

/**
 * 贷款视图，利息按查询时刻计算
 */
@Data
public class LoanDTO {

    private Long loanId;

    private Long borrowerId;

    private Long startDate;

    private Long principal;

    private Integer apy;

    private Integer ltv;

    private Long collateral;

    /** 截至查询时刻的应计利息 */
    private Long accruedInterest;

    /** 本金 + 应计利息 */
    private Long totalOwed;
}
