package com.radar.lendservice.service;

import com.radar.lendcommon.dto.LiquidationResult;
import com.radar.lendcommon.entity.Loan;
import com.radar.lendcommon.entity.UserPosition;
import com.radar.lendcommon.enums.AssetType;
import com.radar.lendcommon.enums.ErrorCode;
import com.radar.lendcommon.enums.LoanEventType;
import com.radar.lendcommon.event.LoanEvent;
import com.radar.lendcommon.exception.BizException;
import com.radar.lendcommon.util.CheckedMath;
import com.radar.lendservice.service.model.LedgerParams;
import com.radar.lendservice.service.model.LoanHealth;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 资不抵债判定与强制清算
 * <p>
 * collateralValue = collateral * price / PRICE_SCALE，collateralValue < 本金+应计利息 即可清算。
 * 清算人支付全部应还额并取得全部抵押品，借款人债务随之消灭，差额不向借款人追偿。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LiquidationEvaluator {

    private final InterestAccrualEngine interestAccrualEngine;
    private final AssetTransferGateway assetTransferGateway;

    public LoanHealth assess(Loan loan, long now, long price, LedgerParams params) {
        long interest = interestAccrualEngine.interestOwed(loan, now, params.secondsPerYear());
        long totalOwed = CheckedMath.add(loan.getPrincipal(), interest);
        long collateralValue = CheckedMath.div(CheckedMath.mul(loan.getCollateral(), price), params.priceScale());
        return new LoanHealth(loan.getPrincipal(), interest, totalOwed, collateralValue);
    }

    public boolean isUnderwater(Loan loan, long now, long price, LedgerParams params) {
        return assess(loan, now, price, params).underwater();
    }

    public LiquidationResult liquidate(UserPosition position, long loanId, Long liquidatorId,
                                       long now, long price, LedgerParams params) {
        Loan loan = position.findLoan(loanId)
                .orElseThrow(() -> new BizException(ErrorCode.LOAN_NOT_FOUND));

        LoanHealth health = assess(loan, now, price, params);
        if (!health.underwater()) {
            log.warn("拒绝清算健康贷款 owner={} loanId={} collateralValue={} totalOwed={}",
                    position.getOwnerId(), loanId, health.collateralValue(), health.totalOwed());
            throw new BizException(ErrorCode.LOAN_NOT_UNDERWATER);
        }

        long collateralBalance = CheckedMath.sub(position.getCollateralBalance(), loan.getCollateral());
        long debtAssetBalance = CheckedMath.sub(position.getDebtAssetBalance(), loan.getPrincipal());

        String liquidatorAccount = LedgerParams.userAccount(liquidatorId);
        assetTransferGateway.transfer(AssetType.DEBT, liquidatorAccount, params.treasuryAccount(), health.totalOwed());
        assetTransferGateway.transfer(AssetType.COLLATERAL, params.vaultAccount(), liquidatorAccount, loan.getCollateral());

        position.getLoans().removeIf(l -> l.getLoanId() == loanId);
        position.setCollateralBalance(collateralBalance);
        position.setDebtAssetBalance(debtAssetBalance);

        LoanEvent event = LoanEvent.builder()
                .type(LoanEventType.LOAN_LIQUIDATED)
                .ownerId(position.getOwnerId())
                .loanId(loanId)
                .amount(health.totalOwed())
                .collateral(loan.getCollateral())
                .ltv(loan.getLtv())
                .apy(loan.getApy())
                .interestPaid(health.interest())
                .remainingPrincipal(0L)
                .counterpartyId(liquidatorId)
                .timestamp(now)
                .build();

        log.warn("贷款被清算 owner={} loanId={} liquidator={} debtPaid={} collateralSeized={} collateralValue={}",
                position.getOwnerId(), loanId, liquidatorId, health.totalOwed(), loan.getCollateral(),
                health.collateralValue());

        return new LiquidationResult(position.getOwnerId(), loanId, liquidatorId, health.totalOwed(),
                loan.getCollateral(), health.collateralValue(), List.of(event));
    }
}
