package com.carohub.gameservice.pool.domain;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 服务器池配置（caro.pool.*）
 */
@Data
@ConfigurationProperties(prefix = "caro.pool")
public class PoolProperties {
    /** 心跳存活时间（秒），超时视为宕机 */
    private int heartbeatTtlSeconds = 60;
    /** 清理宕机服务器的周期（秒） */
    private int sweepIntervalSeconds = 30;
    /** 注册未指定区域时的默认区域 */
    private String defaultRegion = "default";
    /** 注册未指定容量时的默认容量 */
    private int defaultCapacity = 100;
}
