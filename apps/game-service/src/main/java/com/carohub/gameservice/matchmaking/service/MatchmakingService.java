package com.carohub.gameservice.matchmaking.service;

import com.carohub.gameservice.matchmaking.domain.model.QueueEntry;
import com.carohub.gameservice.matchmaking.domain.model.QueueStats;

import java.util.Optional;

/**
 * 积分匹配队列。
 * 搜索范围随等待时间扩大；配对以等待池的原子认领为准，认领失败的一方重新找对手。
 */
public interface MatchmakingService {

    /**
     * 加入队列（覆盖旧条目）并立即尝试配对
     *
     * @param rating 为空时取玩家当前积分
     * @throws IllegalArgumentException 积分超出允许范围
     */
    MatchmakingResult join(String playerId, Integer rating);

    /**
     * 退出队列，幂等
     * @return 之前是否在等待
     */
    boolean leave(String playerId);

    /** 轮询：刷新活跃时间，已被配对则返回结果，否则再尝试一次配对 */
    MatchmakingResult status(String playerId);

    /**
     * 为条目找一个对手（未认领，仅候选）：积分在搜索区间内、最早加入者优先
     */
    Optional<QueueEntry> findOpponent(QueueEntry entry);

    /**
     * 认领两人并建局
     * @throws com.carohub.gameservice.matchmaking.domain.QueueRaceLostException 任一方已不在等待集合
     */
    MatchmakingResult createMatch(QueueEntry self, QueueEntry opponent);

    /**
     * 把超过 maxAgeSeconds 未活跃的等待条目置为 EXPIRED，并清掉同样陈旧的已结束条目
     * @return 本次过期的等待条目数
     */
    int cleanupExpired(long maxAgeSeconds);

    QueueStats stats();
}
