package com.radar.lendservice.service;

import com.radar.lendcommon.dto.*;
import com.radar.lendcommon.entity.Loan;
import com.radar.lendcommon.entity.UserPosition;
import com.radar.lendcommon.enums.AssetType;
import com.radar.lendcommon.enums.ErrorCode;
import com.radar.lendcommon.enums.LoanEventType;
import com.radar.lendcommon.enums.LtvTier;
import com.radar.lendcommon.event.LoanEvent;
import com.radar.lendcommon.exception.BizException;
import com.radar.lendcommon.util.CheckedMath;
import com.radar.lendservice.service.model.LedgerParams;
import com.radar.lendservice.service.model.LoanHealth;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;

/**
 * 借贷账本核心
 * <p>
 * 对单个 {@link UserPosition} 聚合执行存入、开仓、还款、提取与清算。
 * 所有校验与受检运算在资产划转之前完成，划转成功后才修改聚合；
 * 任何一步失败都以 {@link BizException} 抛出，调用方的事务负责回滚已发生的划转。
 * 本类不持锁也不落库，调用方须保证同一账户的操作串行。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LoanLedger {

    private final CollateralSizer collateralSizer;
    private final InterestAccrualEngine interestAccrualEngine;
    private final RepaymentProcessor repaymentProcessor;
    private final LiquidationEvaluator liquidationEvaluator;
    private final AssetTransferGateway assetTransferGateway;

    /**
     * 存入抵押品：用户账户 → 托管账户
     */
    public BalanceResult deposit(UserPosition position, Long callerId, long amount, long now, LedgerParams params) {
        requireOwner(position, callerId);
        if (amount <= 0) {
            throw new BizException(ErrorCode.INVALID_AMOUNT);
        }
        long collateralBalance = CheckedMath.add(position.getCollateralBalance(), amount);

        assetTransferGateway.transfer(AssetType.COLLATERAL, LedgerParams.userAccount(callerId),
                params.vaultAccount(), amount);
        position.setCollateralBalance(collateralBalance);

        log.info("存入抵押品 owner={} amount={} collateralBalance={}", callerId, amount, collateralBalance);
        return balanceResult(position, LoanEventType.COLLATERAL_DEPOSITED, amount, now);
    }

    /**
     * 提取可用抵押品：托管账户 → 用户账户，锁定在贷款中的部分不可提取
     */
    public BalanceResult withdraw(UserPosition position, Long callerId, long amount, long now, LedgerParams params) {
        requireOwner(position, callerId);
        if (amount <= 0) {
            throw new BizException(ErrorCode.INVALID_AMOUNT);
        }
        long free = position.freeCollateral();
        if (amount > free) {
            throw new BizException(ErrorCode.INSUFFICIENT_FUNDS, "amount=" + amount + ", free=" + free);
        }
        long collateralBalance = CheckedMath.sub(position.getCollateralBalance(), amount);

        assetTransferGateway.transfer(AssetType.COLLATERAL, params.vaultAccount(),
                LedgerParams.userAccount(callerId), amount);
        position.setCollateralBalance(collateralBalance);

        log.info("提取抵押品 owner={} amount={} collateralBalance={}", callerId, amount, collateralBalance);
        return balanceResult(position, LoanEventType.WITHDRAW, amount, now);
    }

    /**
     * 开仓：按LTV档位与当前价格锁定抵押品，金库放款给借款人
     *
     * @param price 已按 PRICE_SCALE 归一的抵押品价格
     */
    public OriginateResult originate(UserPosition position, Long callerId, long debtAmount, int ltv,
                                     long now, long price, LedgerParams params) {
        requireOwner(position, callerId);
        if (debtAmount <= 0) {
            throw new BizException(ErrorCode.INVALID_AMOUNT);
        }
        if (position.getLoans().size() >= params.maxLoansPerUser()) {
            throw new BizException(ErrorCode.MAX_LOANS_REACHED);
        }
        LtvTier tier = LtvTier.of(ltv);

        long required = collateralSizer.requiredCollateral(debtAmount, tier.getLtv(), price, params.priceScale());
        if (required == 0) {
            // 借款额过小，向零截断后无需抵押
            throw new BizException(ErrorCode.INVALID_AMOUNT, "所需抵押品为0");
        }
        long free = position.freeCollateral();
        if (free < required) {
            throw new BizException(ErrorCode.INSUFFICIENT_COLLATERAL, "required=" + required + ", free=" + free);
        }

        long loanId = CheckedMath.add(position.getLoanCount(), 1);
        long debtAssetBalance = CheckedMath.add(position.getDebtAssetBalance(), debtAmount);

        assetTransferGateway.transfer(AssetType.DEBT, params.treasuryAccount(),
                LedgerParams.userAccount(callerId), debtAmount);

        Loan loan = new Loan();
        loan.setPositionId(position.getId());
        loan.setLoanId(loanId);
        loan.setBorrowerId(callerId);
        loan.setStartDate(now);
        loan.setPrincipal(debtAmount);
        loan.setApy(tier.getApy());
        loan.setLtv(tier.getLtv());
        loan.setCollateral(required);

        position.getLoans().add(loan);
        position.setLoanCount(loanId);
        position.setDebtAssetBalance(debtAssetBalance);

        LoanEvent event = LoanEvent.builder()
                .type(LoanEventType.LOAN_CREATED)
                .ownerId(callerId)
                .loanId(loanId)
                .amount(debtAmount)
                .collateral(required)
                .ltv(tier.getLtv())
                .apy(tier.getApy())
                .timestamp(now)
                .build();

        log.info("开仓成功 owner={} loanId={} debt={} ltv={} apy={} collateral={} price={}",
                callerId, loanId, debtAmount, tier.getLtv(), tier.getApy(), required, price);

        return new OriginateResult(toLoanDTO(loan, now, params), required, price, List.of(event));
    }

    public RepaymentResult repay(UserPosition position, Long callerId, long loanId, long amount,
                                 long now, LedgerParams params) {
        return repaymentProcessor.repay(position, callerId, loanId, amount, now, params);
    }

    /**
     * 任何人都可清算他人的资不抵债贷款，包括所有者本人
     */
    public LiquidationResult liquidate(UserPosition position, long loanId, Long liquidatorId,
                                       long now, long price, LedgerParams params) {
        return liquidationEvaluator.liquidate(position, loanId, liquidatorId, now, price, params);
    }

    public PositionDTO view(UserPosition position, long now, LedgerParams params) {
        PositionDTO dto = new PositionDTO();
        dto.setOwnerId(position.getOwnerId());
        dto.setCollateralBalance(position.getCollateralBalance());
        dto.setFreeCollateral(position.freeCollateral());
        dto.setDebtAssetBalance(position.getDebtAssetBalance());
        dto.setLoanCount(position.getLoanCount());
        dto.setLoans(position.getLoans().stream().map(loan -> toLoanDTO(loan, now, params)).toList());
        dto.setAsOf(now);
        return dto;
    }

    public LoanHealthDTO health(UserPosition position, long loanId, long now, long price, LedgerParams params) {
        Loan loan = position.findLoan(loanId)
                .orElseThrow(() -> new BizException(ErrorCode.LOAN_NOT_FOUND));
        LoanHealth health = liquidationEvaluator.assess(loan, now, price, params);

        LoanHealthDTO dto = new LoanHealthDTO();
        dto.setOwnerId(position.getOwnerId());
        dto.setLoanId(loanId);
        dto.setPrice(price);
        dto.setCollateralValue(health.collateralValue());
        dto.setTotalOwed(health.totalOwed());
        dto.setUnderwater(health.underwater());
        return dto;
    }

    private LoanDTO toLoanDTO(Loan loan, long now, LedgerParams params) {
        long interest = interestAccrualEngine.interestOwed(loan, now, params.secondsPerYear());
        LoanDTO dto = new LoanDTO();
        dto.setLoanId(loan.getLoanId());
        dto.setBorrowerId(loan.getBorrowerId());
        dto.setStartDate(loan.getStartDate());
        dto.setPrincipal(loan.getPrincipal());
        dto.setApy(loan.getApy());
        dto.setLtv(loan.getLtv());
        dto.setCollateral(loan.getCollateral());
        dto.setAccruedInterest(interest);
        dto.setTotalOwed(CheckedMath.add(loan.getPrincipal(), interest));
        return dto;
    }

    private BalanceResult balanceResult(UserPosition position, LoanEventType type, long amount, long now) {
        LoanEvent event = LoanEvent.builder()
                .type(type)
                .ownerId(position.getOwnerId())
                .amount(amount)
                .timestamp(now)
                .build();
        return new BalanceResult(position.getOwnerId(), position.getCollateralBalance(),
                position.freeCollateral(), List.of(event));
    }

    private void requireOwner(UserPosition position, Long callerId) {
        if (!Objects.equals(position.getOwnerId(), callerId)) {
            throw new BizException(ErrorCode.UNAUTHORIZED_ACCESS);
        }
    }
}
