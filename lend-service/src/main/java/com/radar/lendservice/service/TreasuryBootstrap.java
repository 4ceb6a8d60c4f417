package com.radar.lendservice.service;

import com.radar.lendcommon.enums.AssetType;
import com.radar.lendservice.config.LendingConfig;
import com.radar.lendservice.mapper.AssetBalanceMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * 启动时初始化金库：金库账户不存在时注入初始借出资产，已存在则不动
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TreasuryBootstrap {

    private final AssetBalanceMapper assetBalanceMapper;
    private final AssetTransferGateway assetTransferGateway;
    private final LendingConfig lendingConfig;

    @EventListener(ApplicationReadyEvent.class)
    public void seedTreasury() {
        long supply = lendingConfig.getTreasury().getInitialSupply();
        if (supply <= 0) {
            log.info("未配置金库初始资产，跳过");
            return;
        }
        String treasury = lendingConfig.getTreasuryAccount();
        int inserted = assetBalanceMapper.insertIfAbsent(treasury, AssetType.DEBT.getCode(), supply);
        if (inserted > 0) {
            log.info("金库初始化完成 account={} supply={}", treasury, supply);
        } else {
            log.info("金库已存在 account={} balance={}", treasury,
                    assetTransferGateway.balanceOf(AssetType.DEBT, treasury));
        }
    }
}
