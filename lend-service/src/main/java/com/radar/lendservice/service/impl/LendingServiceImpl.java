package com.radar.lendservice.service.impl;

import com.radar.lendcommon.dto.*;
import com.radar.lendcommon.entity.UserPosition;
import com.radar.lendcommon.enums.AssetType;
import com.radar.lendcommon.enums.LoanEventType;
import com.radar.lendcommon.event.LoanEvent;
import com.radar.lendcommon.util.PositionCodec;
import com.radar.lendservice.config.LendingConfig;
import com.radar.lendservice.service.AssetTransferGateway;
import com.radar.lendservice.service.LendingService;
import com.radar.lendservice.service.LoanLedger;
import com.radar.lendservice.service.PositionStore;
import com.radar.lendservice.service.PriceOracleClient;
import com.radar.lendservice.service.model.BalanceKey;
import com.radar.lendservice.service.model.LedgerParams;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class LendingServiceImpl implements LendingService {

    private final PositionStore positionStore;
    private final LoanLedger loanLedger;
    private final PriceOracleClient priceOracleClient;
    private final AssetTransferGateway assetTransferGateway;
    private final LendingConfig lendingConfig;
    private final Clock clock;

    @Override
    @Transactional(rollbackFor = Exception.class)
    public BalanceResult initialize(Long ownerId) {
        UserPosition position = UserPosition.open(ownerId);
        positionStore.create(position);

        LoanEvent event = LoanEvent.builder()
                .type(LoanEventType.POSITION_INITIALIZED)
                .ownerId(ownerId)
                .timestamp(now())
                .build();
        log.info("借贷账户开户 owner={}", ownerId);
        return new BalanceResult(ownerId, 0L, 0L, List.of(event));
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public BalanceResult deposit(Long callerId, long amount) {
        LedgerParams params = params();
        UserPosition position = positionStore.lockByOwner(callerId);
        assetTransferGateway.lockBalances(collateralRows(callerId, params));
        BalanceResult result = loanLedger.deposit(position, callerId, amount, now(), params);
        positionStore.save(position);
        return result;
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public OriginateResult originate(Long callerId, long debtAmount, int ltv, Long depositAmount) {
        LedgerParams params = params();
        long now = now();
        UserPosition position = positionStore.lockByOwner(callerId);
        boolean withDeposit = depositAmount != null && depositAmount != 0;
        List<BalanceKey> rows = new ArrayList<>(debtRows(callerId, params));
        if (withDeposit) {
            rows.addAll(collateralRows(callerId, params));
        }
        assetTransferGateway.lockBalances(rows);

        List<LoanEvent> events = new ArrayList<>();
        if (withDeposit) {
            events.addAll(loanLedger.deposit(position, callerId, depositAmount, now, params).getEvents());
        }

        long price = currentPrice(params);
        OriginateResult result = loanLedger.originate(position, callerId, debtAmount, ltv, now, price, params);
        positionStore.save(position);

        events.addAll(result.getEvents());
        result.setEvents(events);
        return result;
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public RepaymentResult repay(Long callerId, long loanId, long amount) {
        LedgerParams params = params();
        UserPosition position = positionStore.lockByOwner(callerId);
        assetTransferGateway.lockBalances(debtRows(callerId, params));
        RepaymentResult result = loanLedger.repay(position, callerId, loanId, amount, now(), params);
        positionStore.save(position);
        return result;
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public BalanceResult withdraw(Long callerId, long amount) {
        LedgerParams params = params();
        UserPosition position = positionStore.lockByOwner(callerId);
        assetTransferGateway.lockBalances(collateralRows(callerId, params));
        BalanceResult result = loanLedger.withdraw(position, callerId, amount, now(), params);
        positionStore.save(position);
        return result;
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public LiquidationResult liquidate(Long liquidatorId, Long ownerId, long loanId) {
        LedgerParams params = params();
        UserPosition position = positionStore.lockByOwner(ownerId);
        List<BalanceKey> rows = new ArrayList<>(debtRows(liquidatorId, params));
        rows.addAll(collateralRows(liquidatorId, params));
        assetTransferGateway.lockBalances(rows);
        long price = currentPrice(params);
        LiquidationResult result = loanLedger.liquidate(position, loanId, liquidatorId, now(), price, params);
        positionStore.save(position);
        return result;
    }

    @Override
    public PositionDTO getPosition(Long ownerId) {
        UserPosition position = positionStore.findByOwner(ownerId);
        return loanLedger.view(position, now(), params());
    }

    @Override
    public LoanHealthDTO getLoanHealth(Long ownerId, long loanId) {
        LedgerParams params = params();
        UserPosition position = positionStore.findByOwner(ownerId);
        return loanLedger.health(position, loanId, now(), currentPrice(params), params);
    }

    @Override
    public String getSnapshot(Long ownerId) {
        UserPosition position = positionStore.findByOwner(ownerId);
        return Base64.getEncoder().encodeToString(PositionCodec.encode(position));
    }

    // 加锁顺序：先账户行，再一次锁齐本次涉及的全部余额行
    private static List<BalanceKey> debtRows(Long userId, LedgerParams params) {
        return List.of(new BalanceKey(AssetType.DEBT, LedgerParams.userAccount(userId)),
                new BalanceKey(AssetType.DEBT, params.treasuryAccount()));
    }

    private static List<BalanceKey> collateralRows(Long userId, LedgerParams params) {
        return List.of(new BalanceKey(AssetType.COLLATERAL, LedgerParams.userAccount(userId)),
                new BalanceKey(AssetType.COLLATERAL, params.vaultAccount()));
    }

    private long currentPrice(LedgerParams params) {
        return priceOracleClient.getPrice(lendingConfig.getOracle().getFeedReference())
                .normalizedTo(params.priceScale());
    }

    private LedgerParams params() {
        return lendingConfig.toParams();
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }
}
