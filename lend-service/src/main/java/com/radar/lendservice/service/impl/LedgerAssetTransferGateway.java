package com.radar.lendservice.service.impl;

import com.radar.lendcommon.enums.AssetType;
import com.radar.lendcommon.enums.ErrorCode;
import com.radar.lendcommon.exception.BizException;
import com.radar.lendservice.mapper.AssetBalanceMapper;
import com.radar.lendservice.service.AssetTransferGateway;
import com.radar.lendservice.service.model.BalanceKey;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.TreeSet;

/**
 * 基于 asset_balance 表的资产划转
 * 扣减与入账均为单条条件语句，随调用方事务一起提交或回滚
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LedgerAssetTransferGateway implements AssetTransferGateway {

    private final AssetBalanceMapper assetBalanceMapper;

    @Override
    public void lockBalances(Collection<BalanceKey> keys) {
        // 不存在的行先以0余额插入，使其也能被锁住
        for (BalanceKey key : new TreeSet<>(keys)) {
            assetBalanceMapper.insertIfAbsent(key.account(), key.asset().getCode(), 0L);
            assetBalanceMapper.selectAmountForUpdate(key.account(), key.asset().getCode());
        }
    }

    @Override
    public void transfer(AssetType asset, String from, String to, long amount) {
        if (amount < 0 || from == null || to == null || from.equals(to)) {
            throw new BizException(ErrorCode.TRANSFER_FAILED,
                    asset.getCode() + " " + from + " -> " + to + " amount=" + amount);
        }
        if (amount == 0) {
            return;
        }

        int debited = assetBalanceMapper.atomicDebit(from, asset.getCode(), amount);
        if (debited == 0) {
            log.warn("划转失败，来源余额不足 asset={} from={} to={} amount={}", asset.getCode(), from, to, amount);
            throw new BizException(ErrorCode.TRANSFER_FAILED, "来源余额不足 " + from);
        }
        try {
            assetBalanceMapper.upsertCredit(to, asset.getCode(), amount);
        } catch (DataIntegrityViolationException e) {
            // bigint溢出等
            log.warn("划转入账失败 asset={} to={} amount={}: {}", asset.getCode(), to, amount, e.getMessage());
            throw new BizException(ErrorCode.TRANSFER_FAILED, "入账失败 " + to);
        }
        log.debug("资产划转 asset={} {} -> {} amount={}", asset.getCode(), from, to, amount);
    }

    @Override
    public long balanceOf(AssetType asset, String account) {
        Long amount = assetBalanceMapper.selectAmount(account, asset.getCode());
        return amount != null ? amount : 0L;
    }
}
