package com.radar.lendcommon.exception;

import com.radar.lendcommon.enums.ErrorCode;
import lombok.Getter;

@Getter
public class BizException extends RuntimeException {

    private final int code;
    private final String msg;
    /** 业务错误码枚举，自定义code构造时为null */
    private final ErrorCode errorCode;

    public BizException(ErrorCode errorCode) {
        super(errorCode.getMsg());
        this.code = errorCode.getCode();
        this.msg = errorCode.getMsg();
        this.errorCode = errorCode;
    }

    public BizException(ErrorCode errorCode, String detail) {
        super(errorCode.getMsg() + ": " + detail);
        this.code = errorCode.getCode();
        this.msg = errorCode.getMsg();
        this.errorCode = errorCode;
    }

    public BizException(int code, String msg) {
        super(msg);
        this.code = code;
        this.msg = msg;
        this.errorCode = null;
    }
}
