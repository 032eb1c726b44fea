package com.carohub.gameservice.games.caro.domain.repository;

import com.carohub.gameservice.games.caro.domain.dto.MatchRecord;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * MatchRecordRepository
 * ----------------------------------------
 * 对局快照仓储接口
 * - 每次状态变更后保存；内存丢失时用于恢复；
 * - 已结束对局按玩家建立最近对局索引，供战绩查询；
 * - 当前实现基于 Redis。
 * ----------------------------------------
 */
public interface MatchRecordRepository {

    /**
     * 保存对局快照
     * @param record 快照
     * @param ttl    过期时间
     */
    void save(MatchRecord record, Duration ttl);

    /**
     * 按对局 ID 读取快照
     * @return 不存在则 empty
     */
    Optional<MatchRecord> get(String matchId);

    /**
     * 记入玩家的最近对局索引，只保留最新 keep 条
     */
    void indexForPlayer(String playerId, String matchId, long finishedAt, int keep);

    /**
     * 玩家最近对局，结束时间倒序；快照已过期的跳过
     */
    List<MatchRecord> recentByPlayer(String playerId, int limit);
}
