package com.radar.lendcommon.dto;

import com.radar.lendcommon.event.LoanEvent;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LiquidationResult {

    private Long ownerId;

    private Long loanId;

    private Long liquidatorId;

    /** 清算人支付的借出资产（本金+利息） */
    private Long debtPaid;

    /** 清算人获得的抵押品 */
    private Long collateralSeized;

    /** 清算时抵押品价值 */
    private Long collateralValue;

    private List<LoanEvent> events;
}
