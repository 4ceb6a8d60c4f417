package com.radar.lendservice.controller;

import cn.dev33.satoken.stp.StpUtil;
import com.radar.lendcommon.dto.*;
import com.radar.lendcommon.enums.ErrorCode;
import com.radar.lendcommon.event.LoanEvent;
import com.radar.lendcommon.exception.BizException;
import com.radar.lendcommon.util.Result;
import com.radar.lendservice.service.EventPublisher;
import com.radar.lendservice.service.LendingService;
import com.radar.lendservice.service.PositionSnapshotService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Tag(name = "抵押借贷接口")
@RestController
@RequestMapping("/api/lend")
@RequiredArgsConstructor
public class LendingController {

    private final LendingService lendingService;
    private final EventPublisher eventPublisher;
    private final PositionSnapshotService positionSnapshotService;

    @PostMapping("/position/init")
    @Operation(summary = "开通借贷账户")
    public Result<BalanceResult> init() {
        Long userId = StpUtil.getLoginIdAsLong();
        BalanceResult result = lendingService.initialize(userId);
        afterCommit(userId, result.getEvents());
        return Result.ok(result);
    }

    @GetMapping("/position")
    @Operation(summary = "查询借贷账户（含实时利息）")
    public Result<PositionDTO> position() {
        Long userId = StpUtil.getLoginIdAsLong();
        return Result.ok(lendingService.getPosition(userId));
    }

    @GetMapping("/position/snapshot")
    @Operation(summary = "账户二进制快照（base64）")
    public Result<String> snapshot() {
        Long userId = StpUtil.getLoginIdAsLong();
        return Result.ok(positionSnapshotService.get(userId));
    }

    @PostMapping("/deposit")
    @Operation(summary = "存入抵押品")
    public Result<BalanceResult> deposit(@RequestBody AmountRequest request) {
        Long userId = StpUtil.getLoginIdAsLong();
        BalanceResult result = lendingService.deposit(userId, required(request.getAmount()));
        afterCommit(userId, result.getEvents());
        return Result.ok(result);
    }

    @PostMapping("/originate")
    @Operation(summary = "抵押借款（可同时存入抵押品）")
    public Result<OriginateResult> originate(@RequestBody OriginateRequest request) {
        Long userId = StpUtil.getLoginIdAsLong();
        OriginateResult result = lendingService.originate(userId, required(request.getDebtAmount()),
                required(request.getLtv()), request.getDepositAmount());
        afterCommit(userId, result.getEvents());
        return Result.ok(result);
    }

    @PostMapping("/repay")
    @Operation(summary = "还款（全额或部分）")
    public Result<RepaymentResult> repay(@RequestBody RepayRequest request) {
        Long userId = StpUtil.getLoginIdAsLong();
        RepaymentResult result = lendingService.repay(userId, required(request.getLoanId()),
                required(request.getAmount()));
        afterCommit(userId, result.getEvents());
        return Result.ok(result);
    }

    @PostMapping("/withdraw")
    @Operation(summary = "提取可用抵押品")
    public Result<BalanceResult> withdraw(@RequestBody AmountRequest request) {
        Long userId = StpUtil.getLoginIdAsLong();
        BalanceResult result = lendingService.withdraw(userId, required(request.getAmount()));
        afterCommit(userId, result.getEvents());
        return Result.ok(result);
    }

    @PostMapping("/liquidate")
    @Operation(summary = "清算资不抵债的贷款")
    public Result<LiquidationResult> liquidate(@RequestBody LiquidateRequest request) {
        Long userId = StpUtil.getLoginIdAsLong();
        Long ownerId = required(request.getOwnerId());
        LiquidationResult result = lendingService.liquidate(userId, ownerId, required(request.getLoanId()));
        afterCommit(ownerId, result.getEvents());
        return Result.ok(result);
    }

    @GetMapping("/loan/health")
    @Operation(summary = "查询贷款健康度")
    public Result<LoanHealthDTO> health(@RequestParam Long ownerId, @RequestParam Long loanId) {
        return Result.ok(lendingService.getLoanHealth(ownerId, loanId));
    }

    private void afterCommit(Long ownerId, List<LoanEvent> events) {
        eventPublisher.publishAll(events);
        positionSnapshotService.refreshAfterCommit(ownerId);
    }

    private static <T> T required(T value) {
        if (value == null) {
            throw new BizException(ErrorCode.PARAM_ERROR);
        }
        return value;
    }
}
