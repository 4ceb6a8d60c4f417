package com.radar.lendcommon.entity;

import com.baomidou.mybatisplus.annotation.*;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 资产余额（账户 + 资产 唯一）
 * 用户账户为 user:{id}，账本自身为配置的金库/托管账户
 */
@Data
@TableName("asset_balance")
public class AssetBalance {

    @TableId(type = IdType.AUTO)
    private Long id;

    private String account;

    /** COLLATERAL / DEBT */
    private String asset;

    private Long amount;

    @TableField(fill = FieldFill.INSERT)
    private LocalDateTime createdAt;

    @TableField(fill = FieldFill.INSERT_UPDATE)
    private LocalDateTime updatedAt;
}
