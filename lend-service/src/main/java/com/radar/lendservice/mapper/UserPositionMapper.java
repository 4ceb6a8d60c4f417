package com.radar.lendservice.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.radar.lendcommon.entity.UserPosition;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.util.List;

@Mapper
public interface UserPositionMapper extends BaseMapper<UserPosition> {

    /** 锁定账户行，同一账户的操作在此串行 */
    @Select("SELECT * FROM user_position WHERE owner_id = #{ownerId} FOR UPDATE")
    UserPosition selectByOwnerIdForUpdate(@Param("ownerId") Long ownerId);

    @Select("SELECT * FROM user_position WHERE owner_id = #{ownerId}")
    UserPosition selectByOwnerId(@Param("ownerId") Long ownerId);

    /** 写回账户余额与贷款计数，返回影响行数（0表示账户已被删除） */
    @Update("UPDATE user_position SET collateral_balance = #{collateralBalance}, " +
            "debt_asset_balance = #{debtAssetBalance}, loan_count = #{loanCount}, updated_at = NOW() " +
            "WHERE id = #{id}")
    int updateBalances(@Param("id") Long id,
                       @Param("collateralBalance") Long collateralBalance,
                       @Param("debtAssetBalance") Long debtAssetBalance,
                       @Param("loanCount") Long loanCount);

    /** 持有未结清贷款的账户所有者 */
    @Select("SELECT DISTINCT p.owner_id FROM user_position p JOIN loan l ON l.position_id = p.id ORDER BY p.owner_id")
    List<Long> selectOwnerIdsWithOpenLoans();
}
