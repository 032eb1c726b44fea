package com.carohub.gameservice.matchmaking.domain.model;

import java.util.Map;

/**
 * 队列统计
 *
 * @param ratingDistribution 等待中玩家的积分分布（below_1000 / 1000_1199 / ... / 1800_plus）
 */
public record QueueStats(long currentSize,
                         long totalJoins,
                         long totalLeaves,
                         long totalMatches,
                         Map<String, Long> ratingDistribution) {
}
