package com.radar.lendservice.service.model;

/**
 * 账本级参数
 *
 * @param maxLoansPerUser 单用户贷款上限
 * @param secondsPerYear  计息年长度（秒）
 * @param priceScale      价格精度
 * @param treasuryAccount 借出资产金库账户
 * @param vaultAccount    抵押品托管账户
 */
public record LedgerParams(
        int maxLoansPerUser,
        long secondsPerYear,
        long priceScale,
        String treasuryAccount,
        String vaultAccount
) {

    public static final int DEFAULT_MAX_LOANS_PER_USER = 5;
    public static final long DEFAULT_SECONDS_PER_YEAR = 31_536_000L;
    public static final long DEFAULT_PRICE_SCALE = 10_000L;

    public LedgerParams {
        if (maxLoansPerUser <= 0 || secondsPerYear <= 0 || priceScale <= 0) {
            throw new IllegalArgumentException("账本参数必须为正数");
        }
        if (treasuryAccount == null || vaultAccount == null || treasuryAccount.equals(vaultAccount)) {
            throw new IllegalArgumentException("金库与托管账户必须配置且不同");
        }
    }

    public static LedgerParams defaults() {
        return new LedgerParams(DEFAULT_MAX_LOANS_PER_USER, DEFAULT_SECONDS_PER_YEAR, DEFAULT_PRICE_SCALE,
                "ledger:treasury", "ledger:vault");
    }

    public static String userAccount(Long userId) {
        return "user:" + userId;
    }
}
