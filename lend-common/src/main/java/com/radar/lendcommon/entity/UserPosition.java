package com.radar.lendcommon.entity;

import com.baomidou.mybatisplus.annotation.*;
import com.radar.lendcommon.util.CheckedMath;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 用户借贷账户
 * 每个用户一条，持有抵押余额与全部未结清贷款
 */
@Data
@TableName("user_position")
public class UserPosition {

    /** 主键 */
    @TableId(type = IdType.AUTO)
    private Long id;

    /** 账户所有者（登录用户ID） */
    private Long ownerId;

    /** 账本托管的抵押资产数量，包含已锁定在贷款中的部分 */
    private Long collateralBalance;

    /** 已发放且未归还的借出资产本金 */
    private Long debtAssetBalance;

    /** 贷款编号计数器，只增不减 */
    private Long loanCount;

    /** 未结清贷款，按loanId升序 */
    @TableField(exist = false)
    private List<Loan> loans = new ArrayList<>();

    /** 创建时间 */
    @TableField(fill = FieldFill.INSERT)
    private LocalDateTime createdAt;

    /** 更新时间 */
    @TableField(fill = FieldFill.INSERT_UPDATE)
    private LocalDateTime updatedAt;

    public static UserPosition open(Long ownerId) {
        UserPosition position = new UserPosition();
        position.setOwnerId(ownerId);
        position.setCollateralBalance(0L);
        position.setDebtAssetBalance(0L);
        position.setLoanCount(0L);
        return position;
    }

    /**
     * 已锁定在贷款中的抵押品总量
     */
    public long committedCollateral() {
        long committed = 0;
        for (Loan loan : loans) {
            committed = CheckedMath.add(committed, loan.getCollateral());
        }
        return committed;
    }

    /**
     * 可用（未锁定）抵押余额
     */
    public long freeCollateral() {
        return CheckedMath.sub(collateralBalance, committedCollateral());
    }

    public Optional<Loan> findLoan(long loanId) {
        return loans.stream()
                .filter(loan -> loan.getLoanId() == loanId)
                .findFirst();
    }
}
