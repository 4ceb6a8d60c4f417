package com.radar.lendservice.service;

import com.radar.lendcommon.dto.RepaymentResult;
import com.radar.lendcommon.entity.Loan;
import com.radar.lendcommon.entity.UserPosition;
import com.radar.lendcommon.enums.AssetType;
import com.radar.lendcommon.enums.ErrorCode;
import com.radar.lendcommon.enums.LoanEventType;
import com.radar.lendcommon.enums.RepaymentStatus;
import com.radar.lendservice.service.model.LedgerParams;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RepaymentProcessorTest {

    private static final Long OWNER = 7L;
    private static final long START = 1_000L;

    private final LedgerParams params = LedgerParams.defaults();
    private final long oneYearLater = START + params.secondsPerYear();

    private InMemoryAssetTransferGateway gateway;
    private RepaymentProcessor processor;
    private UserPosition position;

    @BeforeEach
    void setUp() {
        gateway = new InMemoryAssetTransferGateway()
                .fund(AssetType.DEBT, "user:7", 2_000_000L);
        processor = new RepaymentProcessor(new InterestAccrualEngine(), gateway);

        // 本金1,000,000，APY 8%，一年后应还 1,080,000
        Loan loan = new Loan();
        loan.setId(11L);
        loan.setLoanId(1L);
        loan.setBorrowerId(OWNER);
        loan.setStartDate(START);
        loan.setPrincipal(1_000_000L);
        loan.setApy(8);
        loan.setLtv(50);
        loan.setCollateral(1_333_333L);

        position = UserPosition.open(OWNER);
        position.setCollateralBalance(2_000_000L);
        position.setDebtAssetBalance(1_000_000L);
        position.setLoanCount(1L);
        position.getLoans().add(loan);
    }

    @Test
    void fullRepaymentClosesLoan() {
        RepaymentResult result = processor.repay(position, OWNER, 1L, 1_080_000L, oneYearLater, params);

        assertThat(result.getStatus()).isEqualTo(RepaymentStatus.FULLY_REPAID);
        assertThat(result.getInterestPaid()).isEqualTo(80_000L);
        assertThat(result.getCollateralReleased()).isEqualTo(1_333_333L);
        assertThat(result.getLoanClosed()).isTrue();
        assertThat(result.getEvents()).singleElement()
                .extracting("type").isEqualTo(LoanEventType.LOAN_REPAID);
        assertThat(position.getLoans()).isEmpty();
        assertThat(position.getDebtAssetBalance()).isZero();
        assertThat(position.freeCollateral()).isEqualTo(2_000_000L);
        assertThat(gateway.balanceOf(AssetType.DEBT, params.treasuryAccount())).isEqualTo(1_080_000L);
    }

    @Test
    void partialRepaymentBelowPrincipalResetsClock() {
        RepaymentResult result = processor.repay(position, OWNER, 1L, 500_000L, oneYearLater, params);

        // remaining 580,000 > interest 80,000 -> new principal 500,000
        assertThat(result.getStatus()).isEqualTo(RepaymentStatus.PARTIALLY_REPAID);
        assertThat(result.getRemainingPrincipal()).isEqualTo(500_000L);
        assertThat(result.getInterestPaid()).isZero();
        assertThat(result.getLoanClosed()).isFalse();
        Loan loan = position.findLoan(1L).orElseThrow();
        assertThat(loan.getPrincipal()).isEqualTo(500_000L);
        assertThat(loan.getStartDate()).isEqualTo(oneYearLater);
        assertThat(loan.getCollateral()).isEqualTo(1_333_333L);
        assertThat(position.getDebtAssetBalance()).isEqualTo(500_000L);
    }

    @Test
    void partialRepaymentCoveringPrincipalClosesLoan() {
        RepaymentResult result = processor.repay(position, OWNER, 1L, 1_050_000L, oneYearLater, params);

        // remaining 30,000 <= interest 80,000 -> new principal 0
        assertThat(result.getStatus()).isEqualTo(RepaymentStatus.PARTIALLY_REPAID);
        assertThat(result.getRemainingPrincipal()).isZero();
        assertThat(result.getInterestPaid()).isEqualTo(50_000L);
        assertThat(result.getLoanClosed()).isTrue();
        assertThat(result.getCollateralReleased()).isEqualTo(1_333_333L);
        assertThat(position.getLoans()).isEmpty();
        assertThat(position.getDebtAssetBalance()).isZero();
    }

    @Test
    void overpaymentIsRejected() {
        assertThatThrownBy(() -> processor.repay(position, OWNER, 1L, 1_080_001L, oneYearLater, params))
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.REPAYMENT_AMOUNT_TOO_HIGH);
        assertThat(position.getLoans()).hasSize(1);
    }

    @Test
    void unknownLoanAndForeignCallerAreRejected() {
        assertThatThrownBy(() -> processor.repay(position, OWNER, 9L, 1_000L, oneYearLater, params))
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.LOAN_NOT_FOUND);
        assertThatThrownBy(() -> processor.repay(position, 8L, 1L, 1_000L, oneYearLater, params))
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.UNAUTHORIZED_ACCESS);
        assertThatThrownBy(() -> processor.repay(position, OWNER, 1L, 0L, oneYearLater, params))
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.INVALID_AMOUNT);
    }

    @Test
    void insufficientBorrowerFundsLeaveLoanUnchanged() {
        gateway = new InMemoryAssetTransferGateway().fund(AssetType.DEBT, "user:7", 100L);
        processor = new RepaymentProcessor(new InterestAccrualEngine(), gateway);

        assertThatThrownBy(() -> processor.repay(position, OWNER, 1L, 500_000L, oneYearLater, params))
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.TRANSFER_FAILED);
        Loan loan = position.findLoan(1L).orElseThrow();
        assertThat(loan.getPrincipal()).isEqualTo(1_000_000L);
        assertThat(loan.getStartDate()).isEqualTo(START);
        assertThat(position.getDebtAssetBalance()).isEqualTo(1_000_000L);
    }
}
