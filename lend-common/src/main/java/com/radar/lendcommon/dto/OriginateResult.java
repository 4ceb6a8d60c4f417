package com.radar.lendcommon.dto;

import com.radar.lendcommon.event.LoanEvent;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class OriginateResult {

    private LoanDTO loan;

    /** 本次锁定的抵押品 */
    private Long requiredCollateral;

    /** 开仓时使用的价格（PRICE_SCALE） */
    private Long price;

    private List<LoanEvent> events;
}
