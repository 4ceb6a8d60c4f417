package com.radar.lendservice.service;

import com.radar.lendcommon.dto.RepaymentResult;
import com.radar.lendcommon.entity.Loan;
import com.radar.lendcommon.entity.UserPosition;
import com.radar.lendcommon.enums.AssetType;
import com.radar.lendcommon.enums.ErrorCode;
import com.radar.lendcommon.enums.LoanEventType;
import com.radar.lendcommon.enums.RepaymentStatus;
import com.radar.lendcommon.event.LoanEvent;
import com.radar.lendcommon.exception.BizException;
import com.radar.lendcommon.util.CheckedMath;
import com.radar.lendservice.service.model.LedgerParams;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;

/**
 * 还款处理
 * <ul>
 *   <li>全额（amount == 应还总额）：移除贷款，抵押品回到可用余额</li>
 *   <li>部分：remaining = 应还总额 - amount，remaining > 利息 时新本金 = remaining - 利息，否则为0；
 *       起息时间重置为当前时刻。新本金为0时贷款同样移除</li>
 * </ul>
 * 部分还款重置起息时间会使剩余余额按新的时钟重新计息，保持现有口径，未经产品确认不做修正。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RepaymentProcessor {

    private final InterestAccrualEngine interestAccrualEngine;
    private final AssetTransferGateway assetTransferGateway;

    public RepaymentResult repay(UserPosition position, Long callerId, long loanId, long amount,
                                 long now, LedgerParams params) {
        if (!Objects.equals(position.getOwnerId(), callerId)) {
            throw new BizException(ErrorCode.UNAUTHORIZED_ACCESS);
        }
        Loan loan = position.findLoan(loanId)
                .orElseThrow(() -> new BizException(ErrorCode.LOAN_NOT_FOUND));
        if (!Objects.equals(loan.getBorrowerId(), callerId)) {
            throw new BizException(ErrorCode.UNAUTHORIZED_ACCESS);
        }
        if (amount <= 0) {
            throw new BizException(ErrorCode.INVALID_AMOUNT);
        }

        long principal = loan.getPrincipal();
        long interest = interestAccrualEngine.interestOwed(loan, now, params.secondsPerYear());
        long totalOwed = CheckedMath.add(principal, interest);
        if (amount > totalOwed) {
            throw new BizException(ErrorCode.REPAYMENT_AMOUNT_TOO_HIGH,
                    "amount=" + amount + ", totalOwed=" + totalOwed);
        }

        String borrowerAccount = LedgerParams.userAccount(callerId);

        if (amount == totalOwed) {
            long debtAssetBalance = CheckedMath.sub(position.getDebtAssetBalance(), principal);
            long interestPaid = CheckedMath.sub(totalOwed, principal);

            assetTransferGateway.transfer(AssetType.DEBT, borrowerAccount, params.treasuryAccount(), amount);

            position.getLoans().removeIf(l -> l.getLoanId() == loanId);
            position.setDebtAssetBalance(debtAssetBalance);

            LoanEvent event = LoanEvent.builder()
                    .type(LoanEventType.LOAN_REPAID)
                    .ownerId(position.getOwnerId())
                    .loanId(loanId)
                    .amount(amount)
                    .collateral(loan.getCollateral())
                    .interestPaid(interestPaid)
                    .remainingPrincipal(0L)
                    .timestamp(now)
                    .build();

            log.info("贷款全额还款 owner={} loanId={} amount={} interestPaid={} collateralReleased={}",
                    callerId, loanId, amount, interestPaid, loan.getCollateral());

            return new RepaymentResult(RepaymentStatus.FULLY_REPAID, loanId, amount, interestPaid,
                    0L, loan.getCollateral(), true, List.of(event));
        }

        long remaining = CheckedMath.sub(totalOwed, amount);
        long newPrincipal = remaining > interest ? CheckedMath.sub(remaining, interest) : 0L;
        long principalRetired = CheckedMath.sub(principal, newPrincipal);
        long interestPaid = CheckedMath.sub(amount, principalRetired);
        long debtAssetBalance = CheckedMath.sub(position.getDebtAssetBalance(), principalRetired);

        assetTransferGateway.transfer(AssetType.DEBT, borrowerAccount, params.treasuryAccount(), amount);

        position.setDebtAssetBalance(debtAssetBalance);
        boolean closed = newPrincipal == 0;
        long collateralReleased = 0L;
        if (closed) {
            position.getLoans().removeIf(l -> l.getLoanId() == loanId);
            collateralReleased = loan.getCollateral();
        } else {
            loan.setPrincipal(newPrincipal);
            loan.setStartDate(now);
        }

        LoanEvent event = LoanEvent.builder()
                .type(LoanEventType.PARTIAL_REPAYMENT)
                .ownerId(position.getOwnerId())
                .loanId(loanId)
                .amount(amount)
                .collateral(collateralReleased)
                .interestPaid(interestPaid)
                .remainingPrincipal(newPrincipal)
                .timestamp(now)
                .build();

        log.info("贷款部分还款 owner={} loanId={} amount={} remainingPrincipal={} interestPaid={} closed={}",
                callerId, loanId, amount, newPrincipal, interestPaid, closed);

        return new RepaymentResult(RepaymentStatus.PARTIALLY_REPAID, loanId, amount, interestPaid,
                newPrincipal, collateralReleased, closed, List.of(event));
    }
}
