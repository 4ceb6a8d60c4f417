package com.radar.lendservice.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.radar.lendcommon.entity.AssetBalance;
import org.apache.ibatis.annotations.*;

@Mapper
public interface AssetBalanceMapper extends BaseMapper<AssetBalance> {

    /** 原子扣减，返回影响行数（0表示账户不存在或余额不足） */
    @Update("UPDATE asset_balance SET amount = amount - #{amount}, updated_at = NOW() " +
            "WHERE account = #{account} AND asset = #{asset} AND amount >= #{amount}")
    int atomicDebit(@Param("account") String account, @Param("asset") String asset, @Param("amount") long amount);

    /**
     * UPSERT: 入账，账户不存在时新建
     */
    @Insert("INSERT INTO asset_balance (account, asset, amount, created_at, updated_at) " +
            "VALUES (#{account}, #{asset}, #{amount}, NOW(), NOW()) " +
            "ON CONFLICT (account, asset) DO UPDATE SET " +
            "amount = asset_balance.amount + #{amount}, updated_at = NOW()")
    int upsertCredit(@Param("account") String account, @Param("asset") String asset, @Param("amount") long amount);

    /** 仅在账户不存在时写入初始余额，返回影响行数 */
    @Insert("INSERT INTO asset_balance (account, asset, amount, created_at, updated_at) " +
            "VALUES (#{account}, #{asset}, #{amount}, NOW(), NOW()) " +
            "ON CONFLICT (account, asset) DO NOTHING")
    int insertIfAbsent(@Param("account") String account, @Param("asset") String asset, @Param("amount") long amount);

    @Select("SELECT amount FROM asset_balance WHERE account = #{account} AND asset = #{asset}")
    Long selectAmount(@Param("account") String account, @Param("asset") String asset);

    /** 行锁，须先保证行存在 */
    @Select("SELECT amount FROM asset_balance WHERE account = #{account} AND asset = #{asset} FOR UPDATE")
    Long selectAmountForUpdate(@Param("account") String account, @Param("asset") String asset);
}
