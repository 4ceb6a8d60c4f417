package com.radar.lendservice.service.model;

import com.radar.lendcommon.enums.AssetType;

import java.util.Comparator;

/**
 * asset_balance 行的主键；按 (account, asset) 排序即为加行锁的统一顺序
 */
public record BalanceKey(AssetType asset, String account) implements Comparable<BalanceKey> {

    private static final Comparator<BalanceKey> LOCK_ORDER = Comparator
            .comparing(BalanceKey::account)
            .thenComparing(k -> k.asset().getCode());

    @Override
    public int compareTo(BalanceKey other) {
        return LOCK_ORDER.compare(this, other);
    }
}
