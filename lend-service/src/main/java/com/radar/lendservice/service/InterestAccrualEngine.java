package com.radar.lendservice.service;

import com.radar.lendcommon.entity.Loan;
import com.radar.lendcommon.enums.ErrorCode;
import com.radar.lendcommon.exception.BizException;
import com.radar.lendcommon.util.CheckedMath;
import org.springframework.stereotype.Component;

/**
 * 固定年化单利计息
 * interest = principal * apy * elapsed / (secondsPerYear * 100)，按需计算，不落库
 */
@Component
public class InterestAccrualEngine {

    public long interestOwed(long principal, int apyPercent, long startDate, long now, long secondsPerYear) {
        if (now < startDate) {
            throw new BizException(ErrorCode.ARITHMETIC_OVERFLOW, "now " + now + " < startDate " + startDate);
        }
        long elapsed = CheckedMath.sub(now, startDate);
        if (apyPercent == 0) {
            return 0L;
        }
        long numerator = CheckedMath.mul(CheckedMath.mul(principal, apyPercent), elapsed);
        return CheckedMath.div(numerator, CheckedMath.mul(secondsPerYear, 100));
    }

    public long interestOwed(Loan loan, long now, long secondsPerYear) {
        return interestOwed(loan.getPrincipal(), loan.getApy(), loan.getStartDate(), now, secondsPerYear);
    }

    public long totalOwed(Loan loan, long now, long secondsPerYear) {
        return CheckedMath.add(loan.getPrincipal(), interestOwed(loan, now, secondsPerYear));
    }
}
