package com.carohub.gameservice.games.caro.service;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 对局配置（caro.match.*）
 */
@Data
@ConfigurationProperties(prefix = "caro.match")
public class MatchProperties {
    /** 对局快照在 Redis 的保留时长（小时） */
    private int ttlHours = 48;
    /** 已结束对局在内存中的保留时长（分钟），之后只留 Redis 快照 */
    private int finishedRetentionMinutes = 10;
    /** 已结束对局快照的保留时长（天），供战绩查询 */
    private int historyTtlDays = 30;
    /** 每名玩家保留的最近对局条数 */
    private int historyLimit = 50;
}
