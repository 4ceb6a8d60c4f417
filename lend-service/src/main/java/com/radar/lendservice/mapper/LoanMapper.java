package com.radar.lendservice.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.radar.lendcommon.entity.Loan;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Update;

@Mapper
public interface LoanMapper extends BaseMapper<Loan> {

    /** 部分还款后写回本金与新的起息时间 */
    @Update("UPDATE loan SET principal = #{principal}, start_date = #{startDate}, updated_at = NOW() " +
            "WHERE id = #{id}")
    int updatePrincipal(@Param("id") Long id,
                        @Param("principal") Long principal,
                        @Param("startDate") Long startDate);
}
