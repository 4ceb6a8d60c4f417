package com.radar.lendservice.config;

import com.radar.lendservice.service.model.LedgerParams;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * 借贷配置
 * 包含贷款上限、计息与价格精度、账本账户、预言机与清算扫描配置
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "lending")
public class LendingConfig {

    /** 每个用户最多同时持有的贷款数 */
    private int maxLoansPerUser = 5;

    /** 一年的秒数（365天） */
    private long secondsPerYear = 31_536_000L;

    /** 价格精度：价格为抵押资产单价 × PRICE_SCALE，以借出资产最小单位计 */
    private long priceScale = 10_000L;

    /** 借出资产金库账户（放款与收款） */
    private String treasuryAccount = "ledger:treasury";

    /** 抵押品托管账户 */
    private String vaultAccount = "ledger:vault";

    /** 预言机配置 */
    private Oracle oracle = new Oracle();

    /** 金库初始化配置 */
    private Treasury treasury = new Treasury();

    /** 资不抵债扫描配置 */
    private Scan scan = new Scan();

    @Data
    public static class Oracle {
        /** 抵押品价格源，如 SOLUSDT */
        private String feedReference = "SOLUSDT";
        /** 价格最大允许延迟（秒） */
        private long maxStalenessSeconds = 60;
        /** Redis缺价时是否回退到交易所REST行情 */
        private boolean restFallbackEnabled = true;
        /** 交易所REST地址 */
        private String restBaseUrl = "https://api.binance.com";
        /** 抵押资产最小单位精度（SOL为9） */
        private int collateralDecimals = 9;
        /** 借出资产最小单位精度（USDC为6） */
        private int debtDecimals = 6;
    }

    @Data
    public static class Treasury {
        /** 启动时金库不存在则注入的初始借出资产（1,000,000 USDC，6位精度） */
        private long initialSupply = 1_000_000_000_000L;
    }

    @Data
    public static class Scan {
        /** 是否启用资不抵债扫描 */
        private boolean enabled = true;
        /** 扫描间隔（毫秒） */
        private long intervalMs = 30_000;
    }

    /**
     * 当前配置的不可变快照，随每次账本操作显式传入
     */
    public LedgerParams toParams() {
        return new LedgerParams(maxLoansPerUser, secondsPerYear, priceScale, treasuryAccount, vaultAccount);
    }
}
