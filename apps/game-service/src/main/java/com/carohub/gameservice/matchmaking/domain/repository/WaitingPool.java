package com.carohub.gameservice.matchmaking.domain.repository;

import com.carohub.gameservice.matchmaking.domain.model.QueueEntry;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * WaitingPool
 * ----------------------------------------
 * 匹配等待池
 * - 等待集合：按积分排序，只含 WAITING 玩家；
 * - 条目表：playerId -> QueueEntry（含已配对/已过期条目，供轮询查看结果）；
 * - {@link #claimPair} 是配对的提交点，必须原子；
 * - 条目的后续写入都以"仍在等待集合中"为前提，已配对的条目不会被旧副本覆盖。
 * ----------------------------------------
 */
public interface WaitingPool {

    /** 写入条目并放入等待集合（覆盖同一玩家的旧条目） */
    void enqueue(QueueEntry entry);

    Optional<QueueEntry> get(String playerId);

    /**
     * 仍在等待集合中才覆盖条目（轮询刷新活跃时间）
     * @return 是否写入
     */
    boolean refreshIfWaiting(QueueEntry entry);

    /**
     * 仍在等待集合中才移出，并写入过期条目
     * @return 是否过期成功
     */
    boolean expireIfWaiting(QueueEntry expired);

    /**
     * 不在等待集合中才删除条目（清理已配对 / 已过期的残留）
     * @return 是否删除
     */
    boolean discardIfSettled(String playerId);

    /**
     * 移出等待集合并删除条目
     * @return 之前是否在等待集合中
     */
    boolean remove(String playerId);

    /** 等待集合中积分在 [min, max] 的条目 */
    List<QueueEntry> waitingInRange(int min, int max);

    /** 等待集合中的全部条目 */
    List<QueueEntry> allWaiting();

    /** 条目表中的全部条目 */
    List<QueueEntry> allEntries();

    /**
     * 原子认领：两人都还在等待集合中才一起移出，并在同一步写入双方的 MATCHED 条目；
     * 否则不做任何改动
     */
    boolean claimPair(QueueEntry matchedA, QueueEntry matchedB);

    /**
     * 按积分倒序的位置（0 起）
     * @return 不在等待集合返回 null
     */
    Long positionOf(String playerId);

    long waitingCount();

    void incrementCounter(String counter);

    Map<String, Long> counters();
}
