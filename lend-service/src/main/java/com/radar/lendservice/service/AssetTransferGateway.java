package com.radar.lendservice.service;

import com.radar.lendcommon.enums.AssetType;
import com.radar.lendservice.service.model.BalanceKey;

import java.util.Collection;

/**
 * 资产划转
 * 每次逻辑划转只调用一次；失败抛出 TRANSFER_FAILED 且不留下任何余额变化，
 * 并参与外层事务，外层失败时一并回滚。
 */
public interface AssetTransferGateway {

    /**
     * 在当前事务内按统一顺序锁定一次操作会涉及的全部余额行，须在任何划转之前调用；
     * 所有写事务都先锁完再划转，不会形成锁环
     */
    void lockBalances(Collection<BalanceKey> keys);

    void transfer(AssetType asset, String from, String to, long amount);

    long balanceOf(AssetType asset, String account);
}
