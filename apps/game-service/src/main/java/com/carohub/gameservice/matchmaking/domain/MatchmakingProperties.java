package com.carohub.gameservice.matchmaking.domain;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 匹配配置（caro.matchmaking.*）
 */
@Data
@ConfigurationProperties(prefix = "caro.matchmaking")
public class MatchmakingProperties {
    /** 基础积分范围（±） */
    private int baseRange = 100;
    /** 每等待多少秒扩大一次 */
    private int expansionStepSeconds = 10;
    /** 每次扩大多少分 */
    private int expansionPerStep = 10;
    /** 扩大上限 */
    private int maxExpansion = 500;
    /** 无心跳多少秒后过期 */
    private int entryTtlSeconds = 300;
    /** 认领失败后的最多尝试次数 */
    private int claimAttempts = 3;
    /** 过期清理周期（秒） */
    private int cleanupIntervalSeconds = 60;
    /** 允许的积分下限 */
    private int minRating = 0;
    /** 允许的积分上限 */
    private int maxRating = 5000;
}
