package com.radar.lendcommon.entity;

import com.baomidou.mybatisplus.annotation.*;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 单笔贷款：单一抵押资产、单一借出资产
 */
@Data
@TableName("loan")
public class Loan {

    @TableId(type = IdType.AUTO)
    private Long id;

    /** 所属借贷账户 */
    private Long positionId;

    /** 账户内贷款编号，取自 loanCount */
    private Long loanId;

    /** 借款人，必须等于账户所有者 */
    private Long borrowerId;

    /** 起息时间（epoch秒），部分还款时重置 */
    private Long startDate;

    /** 未偿本金 */
    private Long principal;

    /** 年化利率（整数百分点） */
    private Integer apy;

    /** 开仓时选择的LTV（百分比） */
    private Integer ltv;

    /** 锁定的抵押品数量 */
    private Long collateral;

    @TableField(fill = FieldFill.INSERT)
    private LocalDateTime createdAt;

    @TableField(fill = FieldFill.INSERT_UPDATE)
    private LocalDateTime updatedAt;
}
