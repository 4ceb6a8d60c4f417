package com.radar.lendservice.config;

import com.radar.lendcommon.config.BaseSaTokenConfig;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Sa-Token 配置
 * 借贷接口全部要求登录
 */
@Configuration
public class SaTokenConfig extends BaseSaTokenConfig {

    @Override
    protected List<String> getExcludePaths() {
        return getDefaultExcludePaths();
    }
}
