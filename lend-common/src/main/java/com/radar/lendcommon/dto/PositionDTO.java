package com.radar.lendcommon.dto;

import lombok.Data;

import java.util.List;

/**
 * 借贷账户DTO
 */
@Data
public class PositionDTO {

    private Long ownerId;

    /** 托管抵押品总量 */
    private Long collateralBalance;

    /** 可提取/可用于新贷款的抵押品 */
    private Long freeCollateral;

    /** 未归还本金 */
    private Long debtAssetBalance;

    private Long loanCount;

    private List<LoanDTO> loans;

    /** 视图时间（epoch秒） */
    private Long asOf;
}
