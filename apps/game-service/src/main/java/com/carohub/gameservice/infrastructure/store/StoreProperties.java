package com.carohub.gameservice.infrastructure.store;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 共享存储降级配置（caro.store.*）
 */
@Data
@ConfigurationProperties(prefix = "caro.store")
public class StoreProperties {
    /** Redis 出错后改用内存存储的时长（秒），到期再尝试 Redis */
    private int failoverCooldownSeconds = 30;
}
