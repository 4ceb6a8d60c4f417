package com.radar.lendcommon.util;

import com.radar.lendcommon.enums.ErrorCode;
import com.radar.lendcommon.exception.BizException;

/**
 * 无符号整数的受检运算
 * <p>
 * 所有金额、数量、时间差均为非负 long。任何溢出、下溢、负数操作数或除零
 * 都抛出 {@link ErrorCode#ARITHMETIC_OVERFLOW}，不做回绕或截断到边界。
 */
public final class CheckedMath {

    private CheckedMath() {
    }

    public static long add(long a, long b) {
        requireUnsigned(a, b);
        try {
            return Math.addExact(a, b);
        } catch (ArithmeticException e) {
            throw overflow("add", a, b);
        }
    }

    public static long sub(long a, long b) {
        requireUnsigned(a, b);
        if (b > a) {
            throw overflow("sub", a, b);
        }
        return a - b;
    }

    public static long mul(long a, long b) {
        requireUnsigned(a, b);
        try {
            return Math.multiplyExact(a, b);
        } catch (ArithmeticException e) {
            throw overflow("mul", a, b);
        }
    }

    /** 整数除法，向零截断 */
    public static long div(long a, long b) {
        requireUnsigned(a, b);
        if (b == 0) {
            throw overflow("div", a, b);
        }
        return a / b;
    }

    private static void requireUnsigned(long a, long b) {
        if (a < 0 || b < 0) {
            throw new BizException(ErrorCode.ARITHMETIC_OVERFLOW, "negative operand " + a + ", " + b);
        }
    }

    private static BizException overflow(String op, long a, long b) {
        return new BizException(ErrorCode.ARITHMETIC_OVERFLOW, op + "(" + a + ", " + b + ")");
    }
}
