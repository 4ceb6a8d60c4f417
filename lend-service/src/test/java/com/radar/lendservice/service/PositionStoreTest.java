package com.radar.lendservice.service;

import com.baomidou.mybatisplus.core.MybatisConfiguration;
import com.baomidou.mybatisplus.core.metadata.TableInfoHelper;
import com.radar.lendcommon.entity.Loan;
import com.radar.lendcommon.entity.UserPosition;
import com.radar.lendcommon.enums.ErrorCode;
import com.radar.lendservice.mapper.LoanMapper;
import com.radar.lendservice.mapper.UserPositionMapper;
import org.apache.ibatis.builder.MapperBuilderAssistant;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DuplicateKeyException;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PositionStoreTest {

    @Mock
    private UserPositionMapper userPositionMapper;
    @Mock
    private LoanMapper loanMapper;

    @InjectMocks
    private PositionStore positionStore;

    @BeforeAll
    static void initLambdaCache() {
        // LambdaQueryWrapper 解析列名依赖实体元数据
        TableInfoHelper.initTableInfo(new MapperBuilderAssistant(new MybatisConfiguration(), ""), Loan.class);
    }

    @Test
    void lockLoadsLoansIntoMutableList() {
        UserPosition row = UserPosition.open(7L);
        row.setId(1L);
        when(userPositionMapper.selectByOwnerIdForUpdate(7L)).thenReturn(row);
        when(loanMapper.selectList(any())).thenReturn(List.of(loan(10L, 1L)));

        UserPosition position = positionStore.lockByOwner(7L);

        assertThat(position.getLoans()).hasSize(1);
        position.getLoans().removeIf(l -> l.getLoanId() == 1L);
        assertThat(position.getLoans()).isEmpty();
    }

    @Test
    void missingPositionIsReported() {
        assertThatThrownBy(() -> positionStore.lockByOwner(7L))
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.POSITION_NOT_FOUND);
        assertThatThrownBy(() -> positionStore.findByOwner(7L))
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.POSITION_NOT_FOUND);
    }

    @Test
    void secondInitializeIsRejected() {
        UserPosition position = UserPosition.open(7L);
        when(userPositionMapper.selectByOwnerId(7L)).thenReturn(position);

        assertThatThrownBy(() -> positionStore.create(UserPosition.open(7L)))
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.POSITION_ALREADY_EXISTS);
        verify(userPositionMapper, never()).insert(any(UserPosition.class));
    }

    @Test
    void concurrentInsertIsRejected() {
        when(userPositionMapper.insert(any(UserPosition.class))).thenThrow(new DuplicateKeyException("uk_user_position_owner"));

        assertThatThrownBy(() -> positionStore.create(UserPosition.open(7L)))
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.POSITION_ALREADY_EXISTS);
    }

    @Test
    void saveInsertsUpdatesAndDeletesLoanRows() {
        UserPosition position = UserPosition.open(7L);
        position.setId(1L);
        position.setCollateralBalance(5_000L);
        position.setDebtAssetBalance(300L);
        position.setLoanCount(3L);
        Loan kept = loan(10L, 1L);
        kept.setPrincipal(100L);
        kept.setStartDate(50L);
        Loan added = loan(null, 3L);
        position.getLoans().add(kept);
        position.getLoans().add(added);

        when(userPositionMapper.updateBalances(1L, 5_000L, 300L, 3L)).thenReturn(1);
        when(loanMapper.selectList(any())).thenReturn(List.of(loan(10L, 1L), loan(11L, 2L)));

        positionStore.save(position);

        verify(loanMapper).insert(added);
        assertThat(added.getPositionId()).isEqualTo(1L);
        verify(loanMapper).updatePrincipal(10L, 100L, 50L);
        verify(loanMapper).deleteById(11L);
        verify(loanMapper, never()).deleteById(10L);
    }

    @Test
    void vanishedPositionRowFailsSave() {
        UserPosition position = UserPosition.open(7L);
        position.setId(1L);

        assertThatThrownBy(() -> positionStore.save(position))
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.CONCURRENT_UPDATE_FAILED);
    }

    private static Loan loan(Long rowId, long loanId) {
        Loan loan = new Loan();
        loan.setId(rowId);
        loan.setLoanId(loanId);
        return loan;
    }
}
