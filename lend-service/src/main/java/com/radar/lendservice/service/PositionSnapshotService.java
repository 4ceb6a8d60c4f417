package com.radar.lendservice.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

/**
 * 账户二进制快照缓存
 * 以base64存放在 lend:position:snapshot:{ownerId}，写操作提交后刷新，供下游只读消费
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PositionSnapshotService {

    static final String SNAPSHOT_KEY_PREFIX = "lend:position:snapshot:";

    private final StringRedisTemplate stringRedisTemplate;
    private final LendingService lendingService;

    /**
     * 读取快照，缓存缺失时从库重建
     */
    public String get(Long ownerId) {
        String cached = stringRedisTemplate.opsForValue().get(SNAPSHOT_KEY_PREFIX + ownerId);
        if (cached != null) {
            return cached;
        }
        return refresh(ownerId);
    }

    /**
     * 按库中最新状态重建快照；缓存写入失败只记录日志，下次读取时重建
     */
    public String refresh(Long ownerId) {
        String snapshot = lendingService.getSnapshot(ownerId);
        try {
            stringRedisTemplate.opsForValue().set(SNAPSHOT_KEY_PREFIX + ownerId, snapshot);
        } catch (DataAccessException e) {
            log.warn("快照写入Redis失败 ownerId={}: {}", ownerId, e.getMessage());
        }
        return snapshot;
    }

    /**
     * 写操作提交后调用，任何失败都不向上抛出；重建失败时尽量删除旧快照，下次读取时重建
     */
    public void refreshAfterCommit(Long ownerId) {
        try {
            refresh(ownerId);
        } catch (RuntimeException e) {
            log.warn("提交后刷新快照失败 ownerId={}: {}", ownerId, e.getMessage());
            try {
                stringRedisTemplate.delete(SNAPSHOT_KEY_PREFIX + ownerId);
            } catch (DataAccessException ex) {
                log.warn("删除旧快照失败 ownerId={}: {}", ownerId, ex.getMessage());
            }
        }
    }
}
