package com.radar.lendservice.task;

import com.radar.lendcommon.entity.Loan;
import com.radar.lendcommon.entity.UserPosition;
import com.radar.lendcommon.enums.LoanEventType;
import com.radar.lendcommon.event.LoanEvent;
import com.radar.lendcommon.exception.BizException;
import com.radar.lendservice.config.LendingConfig;
import com.radar.lendservice.service.EventPublisher;
import com.radar.lendservice.service.LiquidationEvaluator;
import com.radar.lendservice.service.PositionStore;
import com.radar.lendservice.service.PriceOracleClient;
import com.radar.lendservice.service.model.LedgerParams;
import com.radar.lendservice.service.model.LoanHealth;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * 资不抵债扫描
 * <p>
 * 定期按当前价格评估全部未结清贷款，对资不抵债的贷款发布 LOAN_UNDERWATER 提醒供清算人处理。
 * 只读：不清算、不修改账户。
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "lending.scan", name = "enabled", havingValue = "true", matchIfMissing = true)
public class UnderwaterLoanScanTask {

    private final PositionStore positionStore;
    private final LiquidationEvaluator liquidationEvaluator;
    private final PriceOracleClient priceOracleClient;
    private final EventPublisher eventPublisher;
    private final LendingConfig lendingConfig;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${lending.scan.interval-ms:30000}")
    public void scan() {
        LedgerParams params = lendingConfig.toParams();
        long now = clock.instant().getEpochSecond();
        long price;
        try {
            price = priceOracleClient.getPrice(lendingConfig.getOracle().getFeedReference())
                    .normalizedTo(params.priceScale());
        } catch (BizException e) {
            log.warn("资不抵债扫描跳过，价格不可用: {}", e.getMsg());
            return;
        }

        List<Long> owners = positionStore.ownersWithOpenLoans();
        int alerts = 0;
        for (Long ownerId : owners) {
            try {
                alerts += scanPosition(positionStore.findByOwner(ownerId), now, price, params);
            } catch (BizException e) {
                log.warn("扫描账户失败 owner={}: {}", ownerId, e.getMsg());
            }
        }
        log.info("资不抵债扫描完成 positions={} underwater={} price={}", owners.size(), alerts, price);
    }

    int scanPosition(UserPosition position, long now, long price, LedgerParams params) {
        int alerts = 0;
        for (Loan loan : position.getLoans()) {
            LoanHealth health = liquidationEvaluator.assess(loan, now, price, params);
            if (!health.underwater()) {
                continue;
            }
            alerts++;
            eventPublisher.publish(LoanEvent.builder()
                    .type(LoanEventType.LOAN_UNDERWATER)
                    .ownerId(position.getOwnerId())
                    .loanId(loan.getLoanId())
                    .amount(health.totalOwed())
                    .collateral(loan.getCollateral())
                    .ltv(loan.getLtv())
                    .apy(loan.getApy())
                    .timestamp(now)
                    .build());
        }
        return alerts;
    }
}
