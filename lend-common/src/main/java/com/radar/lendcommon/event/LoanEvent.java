package com.radar.lendcommon.event;

import com.radar.lendcommon.enums.LoanEventType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serial;
import java.io.Serializable;

/**
 * 借贷事件
 * 随操作结果返回，提交成功后由 EventPublisher 推送到 event:loan:{ownerId}
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoanEvent implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    private LoanEventType type;

    /** 借贷账户所有者 */
    private Long ownerId;

    /** 贷款编号，账户级事件为null */
    private Long loanId;

    /** 本次划转金额（借出资产或抵押资产，视事件而定） */
    private Long amount;

    /** 涉及的抵押品数量 */
    private Long collateral;

    private Integer ltv;

    private Integer apy;

    /** 本次支付的利息 */
    private Long interestPaid;

    /** 剩余本金 */
    private Long remainingPrincipal;

    /** 对手方（清算人） */
    private Long counterpartyId;

    /** 事件时间（epoch秒） */
    private Long timestamp;
}
