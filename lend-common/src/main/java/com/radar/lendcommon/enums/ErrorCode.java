package com.radar.lendcommon.enums;

import lombok.Getter;
import lombok.AllArgsConstructor;

@Getter
@AllArgsConstructor
public enum ErrorCode {

    SUCCESS(0, "成功"),
    PARAM_ERROR(400, "参数错误"),
    UNAUTHORIZED(401, "未登录"),
    FORBIDDEN(403, "无权限"),
    NOT_FOUND(404, "资源不存在"),
    SYSTEM_ERROR(500, "系统错误"),

    // 账户错误码 1000+
    POSITION_NOT_FOUND(1001, "借贷账户不存在"),
    POSITION_ALREADY_EXISTS(1002, "借贷账户已存在"),
    INSUFFICIENT_FUNDS(1003, "可提取余额不足"),
    INVALID_AMOUNT(1004, "金额无效"),
    UNAUTHORIZED_ACCESS(1005, "无权操作该账户或贷款"),

    // 贷款错误码 1100+
    INVALID_LTV(1101, "LTV比例无效"),
    MAX_LOANS_REACHED(1102, "贷款数量已达上限"),
    INSUFFICIENT_COLLATERAL(1103, "抵押品不足"),
    LOAN_NOT_FOUND(1104, "贷款不存在"),
    REPAYMENT_AMOUNT_TOO_HIGH(1105, "还款金额超过应还总额"),
    LOAN_NOT_UNDERWATER(1106, "贷款未资不抵债，不可清算"),

    // 运算与外部依赖错误码 1200+
    ARITHMETIC_OVERFLOW(1201, "数值运算溢出"),
    PRICE_UNAVAILABLE(1202, "价格暂不可用"),
    TRANSFER_FAILED(1203, "资产划转失败"),

    // 并发控制错误码 1300+
    CONCURRENT_UPDATE_FAILED(1301, "并发更新失败，请重试");

    private final int code;
    private final String msg;
}
