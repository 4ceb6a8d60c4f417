package com.radar.lendservice.service;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.radar.lendcommon.entity.Loan;
import com.radar.lendcommon.entity.UserPosition;
import com.radar.lendcommon.enums.ErrorCode;
import com.radar.lendcommon.exception.BizException;
import com.radar.lendservice.mapper.LoanMapper;
import com.radar.lendservice.mapper.UserPositionMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 借贷账户持久化
 * 加载账户行（可选行锁）及其全部贷款，操作成功后按差异写回
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PositionStore {

    private final UserPositionMapper userPositionMapper;
    private final LoanMapper loanMapper;

    /**
     * 行锁加载，须在事务内调用
     */
    public UserPosition lockByOwner(Long ownerId) {
        UserPosition position = userPositionMapper.selectByOwnerIdForUpdate(ownerId);
        if (position == null) {
            throw new BizException(ErrorCode.POSITION_NOT_FOUND);
        }
        position.setLoans(loadLoans(position.getId()));
        return position;
    }

    /**
     * 无锁读取，用于查询与扫描
     */
    public UserPosition findByOwner(Long ownerId) {
        UserPosition position = userPositionMapper.selectByOwnerId(ownerId);
        if (position == null) {
            throw new BizException(ErrorCode.POSITION_NOT_FOUND);
        }
        position.setLoans(loadLoans(position.getId()));
        return position;
    }

    public void create(UserPosition position) {
        if (userPositionMapper.selectByOwnerId(position.getOwnerId()) != null) {
            throw new BizException(ErrorCode.POSITION_ALREADY_EXISTS);
        }
        try {
            userPositionMapper.insert(position);
        } catch (DuplicateKeyException e) {
            // 并发开户由唯一约束兜底
            throw new BizException(ErrorCode.POSITION_ALREADY_EXISTS);
        }
    }

    /**
     * 写回账户余额，新增贷款插入、存续贷款更新、已移除贷款删除
     */
    public void save(UserPosition position) {
        int rows = userPositionMapper.updateBalances(position.getId(), position.getCollateralBalance(),
                position.getDebtAssetBalance(), position.getLoanCount());
        if (rows == 0) {
            throw new BizException(ErrorCode.CONCURRENT_UPDATE_FAILED, "positionId=" + position.getId());
        }

        Set<Long> keptRowIds = new HashSet<>();
        for (Loan loan : position.getLoans()) {
            if (loan.getId() == null) {
                loan.setPositionId(position.getId());
                loanMapper.insert(loan);
            } else {
                loanMapper.updatePrincipal(loan.getId(), loan.getPrincipal(), loan.getStartDate());
            }
            keptRowIds.add(loan.getId());
        }

        List<Loan> persisted = loanMapper.selectList(new LambdaQueryWrapper<Loan>()
                .eq(Loan::getPositionId, position.getId())
                .select(Loan::getId, Loan::getLoanId));
        for (Loan row : persisted) {
            if (!keptRowIds.contains(row.getId())) {
                loanMapper.deleteById(row.getId());
                log.debug("删除已结清贷款 positionId={} loanId={}", position.getId(), row.getLoanId());
            }
        }
    }

    /**
     * 持有未结清贷款的账户所有者
     */
    public List<Long> ownersWithOpenLoans() {
        return userPositionMapper.selectOwnerIdsWithOpenLoans();
    }

    private List<Loan> loadLoans(Long positionId) {
        return new ArrayList<>(loanMapper.selectList(new LambdaQueryWrapper<Loan>()
                .eq(Loan::getPositionId, positionId)
                .orderByAsc(Loan::getLoanId)));
    }
}
