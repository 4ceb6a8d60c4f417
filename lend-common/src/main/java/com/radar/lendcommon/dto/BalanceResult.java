package com.radar.lendcommon.dto;

import com.radar.lendcommon.event.LoanEvent;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 开户、存入、提取的结果
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BalanceResult {

    private Long ownerId;

    private Long collateralBalance;

    private Long freeCollateral;

    private List<LoanEvent> events;
}
