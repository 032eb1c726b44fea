package com.carohub.gameservice.platform.config;

import com.carohub.gameservice.infrastructure.store.StoreProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Random;

/**
 * 平台级公共 Bean：时钟、随机源、存储降级配置。
 * 队列与服务器池的时间判断都走注入的 Clock，测试时可替换。
 */
@Configuration
@EnableConfigurationProperties(StoreProperties.class)
public class PlatformConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** AI 随机落子与匹配分边共用 */
    @Bean
    public Random random() {
        return new Random();
    }
}
