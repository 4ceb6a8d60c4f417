package com.radar.lendcommon.aspect;

import cn.dev33.satoken.stp.StpUtil;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import jakarta.servlet.http.HttpServletRequest;
import java.util.Arrays;

/**
 * 借贷接口请求日志切面
 * 记录调用人、参数、结果与耗时，业务异常原样抛出
 */
@Slf4j
@Aspect
@Component
@Order(1)
public class LogAspect {

    @Around("execution(public * com.radar..controller.*.*(..))")
    public Object around(ProceedingJoinPoint point) throws Throwable {
        long start = System.currentTimeMillis();

        String httpMethod = "";
        String uri = "";
        ServletRequestAttributes attrs = (ServletRequestAttributes) RequestContextHolder.getRequestAttributes();
        if (attrs != null) {
            HttpServletRequest req = attrs.getRequest();
            httpMethod = req.getMethod();
            uri = req.getRequestURI();
        }

        String caller = resolveCaller();
        String method = point.getSignature().getDeclaringType().getSimpleName() + "." + point.getSignature().getName();
        String args = Arrays.toString(point.getArgs());

        try {
            Object result = point.proceed();
            log.info("""
                            
                            ========== Lend Request ==========
                            {} {} caller={}
                            Method: {}
                            Args: {}
                            Result: {}
                            Cost: {}ms
                            ==================================""",
                    httpMethod, uri, caller, method, args, result, System.currentTimeMillis() - start);
            return result;
        } catch (Throwable e) {
            log.warn("""
                            
                            ========== Lend Request Failed ==========
                            {} {} caller={}
                            Method: {}
                            Args: {}
                            Error: {}
                            Cost: {}ms
                            =========================================""",
                    httpMethod, uri, caller, method, args, e.getMessage(), System.currentTimeMillis() - start);
            throw e;
        }
    }

    private String resolveCaller() {
        try {
            return StpUtil.isLogin() ? String.valueOf(StpUtil.getLoginId()) : "anonymous";
        } catch (Exception e) {
            // 非Web线程或Sa-Token上下文未初始化
            return "unknown";
        }
    }
}
