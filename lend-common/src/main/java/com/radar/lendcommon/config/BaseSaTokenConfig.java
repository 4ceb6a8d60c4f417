package com.radar.lendcommon.config;

import cn.dev33.satoken.config.SaTokenConfig;
import cn.dev33.satoken.interceptor.SaInterceptor;
import cn.dev33.satoken.router.SaRouter;
import cn.dev33.satoken.stp.StpUtil;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.lang.NonNull;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.Arrays;
import java.util.List;

/**
 * Sa-Token 基础配置类
 * 令牌由宿主登录服务签发，本服务通过共享的Redis会话只做校验
 */
public abstract class BaseSaTokenConfig implements WebMvcConfigurer {

    @Bean
    @Primary
    public SaTokenConfig baseSaTokenConfig() {
        SaTokenConfig config = new SaTokenConfig();
        config.setTokenName("satoken");
        config.setActiveTimeout(60 * 60 * 24 * 7);
        config.setIsConcurrent(false);
        config.setIsShare(true);
        config.setTokenStyle("uuid");
        config.setIsLog(false);
        config.setIsReadCookie(false);
        config.setIsReadHeader(true);
        return config;
    }

    protected List<String> getDefaultExcludePaths() {
        return Arrays.asList(
                "/doc.html",
                "/webjars/**",
                "/swagger-ui/**",
                "/swagger-ui.html",
                "/v3/api-docs/**",
                "/favicon.ico",
                "/error"
        );
    }

    protected abstract List<String> getExcludePaths();

    @Override
    public void addInterceptors(@NonNull InterceptorRegistry registry) {
        registry.addInterceptor(new SaInterceptor(handle ->
                SaRouter.match("/**")
                        .notMatch(getExcludePaths())
                        .check(r -> StpUtil.checkLogin())
        )).addPathPatterns("/**");
    }
}
