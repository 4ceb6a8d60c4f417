package com.radar.lendservice.service;

import com.radar.lendcommon.dto.*;

/**
 * 借贷业务入口
 * 每个写操作为一个事务：锁定账户 → 取价 → 账本操作 → 写回
 */
public interface LendingService {

    /**
     * 开户，重复开户返回 POSITION_ALREADY_EXISTS
     */
    BalanceResult initialize(Long ownerId);

    BalanceResult deposit(Long callerId, long amount);

    /**
     * 开仓借款
     * depositAmount 不为空时先在同一事务内存入抵押品
     */
    OriginateResult originate(Long callerId, long debtAmount, int ltv, Long depositAmount);

    RepaymentResult repay(Long callerId, long loanId, long amount);

    BalanceResult withdraw(Long callerId, long amount);

    /**
     * 清算他人资不抵债的贷款
     */
    LiquidationResult liquidate(Long liquidatorId, Long ownerId, long loanId);

    PositionDTO getPosition(Long ownerId);

    LoanHealthDTO getLoanHealth(Long ownerId, long loanId);

    /**
     * 账户二进制布局的base64
     */
    String getSnapshot(Long ownerId);
}
