package com.radar.lendservice.config;

import cn.dev33.satoken.exception.NotLoginException;
import com.radar.lendcommon.enums.ErrorCode;
import com.radar.lendcommon.exception.BizException;
import com.radar.lendcommon.util.Result;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void businessErrorKeepsItsCode() {
        Result<?> result = handler.handleBizException(
                new BizException(ErrorCode.INSUFFICIENT_COLLATERAL, "required=10, free=5"));

        assertThat(result.getCode()).isNotEqualTo(ErrorCode.SUCCESS.getCode());
        assertThat(result.getCode()).isEqualTo(1103);
        assertThat(result.getMsg()).isEqualTo(ErrorCode.INSUFFICIENT_COLLATERAL.getMsg());
    }

    @Test
    void missingLoginMapsToUnauthorized() {
        Result<?> result = handler.handleNotLoginException(
                new NotLoginException("no token", "login", NotLoginException.NOT_TOKEN));

        assertThat(result.getCode()).isEqualTo(ErrorCode.UNAUTHORIZED.getCode());
        assertThat(result.getMsg()).isEqualTo("未提供token");
    }

    @Test
    void unexpectedErrorHidesDetails() {
        Result<?> result = handler.handleException(new IllegalStateException("boom"));

        assertThat(result.getCode()).isEqualTo(ErrorCode.SYSTEM_ERROR.getCode());
        assertThat(result.getMsg()).doesNotContain("boom");
    }

    @Test
    void malformedRequestIsParamError() {
        Result<?> result = handler.handleParamException(new IllegalArgumentException("bad"));

        assertThat(result.getCode()).isEqualTo(ErrorCode.PARAM_ERROR.getCode());
    }
}
