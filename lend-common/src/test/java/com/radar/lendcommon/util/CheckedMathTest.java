package com.radar.lendcommon.util;

import com.radar.lendcommon.enums.ErrorCode;
import com.radar.lendcommon.exception.BizException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CheckedMathTest {

    @Test
    void addAndMulWithinRange() {
        assertThat(CheckedMath.add(2, 3)).isEqualTo(5);
        assertThat(CheckedMath.mul(1_000_000, 100)).isEqualTo(100_000_000);
        assertThat(CheckedMath.sub(10, 10)).isZero();
        assertThat(CheckedMath.div(7, 2)).isEqualTo(3);
    }

    @Test
    void overflowIsRejected() {
        assertOverflow(() -> CheckedMath.add(Long.MAX_VALUE, 1));
        assertOverflow(() -> CheckedMath.mul(Long.MAX_VALUE / 2 + 1, 2));
    }

    @Test
    void underflowIsRejected() {
        assertOverflow(() -> CheckedMath.sub(3, 4));
    }

    @Test
    void divisionByZeroIsRejected() {
        assertOverflow(() -> CheckedMath.div(1, 0));
    }

    @Test
    void negativeOperandsAreRejected() {
        assertOverflow(() -> CheckedMath.add(-1, 1));
        assertOverflow(() -> CheckedMath.div(10, -2));
    }

    private static void assertOverflow(Runnable op) {
        assertThatThrownBy(op::run)
                .isInstanceOf(BizException.class)
                .extracting(e -> ((BizException) e).getErrorCode())
                .isEqualTo(ErrorCode.ARITHMETIC_OVERFLOW);
    }
}
