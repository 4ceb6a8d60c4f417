package com.radar.lendcommon.dto;

import com.radar.lendcommon.enums.RepaymentStatus;
import com.radar.lendcommon.event.LoanEvent;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RepaymentResult {

    private RepaymentStatus status;

    private Long loanId;

    /** 实际还款金额 */
    private Long amountPaid;

    private Long interestPaid;

    /** 剩余本金，全额还款为0 */
    private Long remainingPrincipal;

    /** 解锁回可用余额的抵押品，未结清为0 */
    private Long collateralReleased;

    /** 贷款是否已从账户移除 */
    private Boolean loanClosed;

    private List<LoanEvent> events;
}
