package com.carohub.gameservice.games.caro.domain.repository;

import com.carohub.gameservice.games.caro.domain.enums.GameResult;
import com.carohub.gameservice.games.caro.domain.model.PlayerRecord;

import java.util.List;
import java.util.Optional;

/**
 * PlayerRecordRepository
 * ----------------------------------------
 * 玩家战绩仓储接口
 * - 积分、胜负和、连胜；
 * - 排名 = 积分严格高于该玩家的人数 + 1；
 * - 结算写入必须是单步原子的增量，同一玩家同时结束多局也不会丢失更新。
 * ----------------------------------------
 */
public interface PlayerRecordRepository {

    Optional<PlayerRecord> find(String playerId);

    /** 不存在则以初始积分建档 */
    PlayerRecord findOrCreate(String playerId);

    /**
     * 原子记一局：积分加 ratingDelta，胜 / 负 / 和计数 +1，trackStreak 时更新连胜，并同步排行榜
     * @return 更新后的积分
     */
    int recordResult(String playerId, int ratingDelta, GameResult result, boolean trackStreak);

    /** 按积分计算当前排名（1 起） */
    long rankOf(int rating);

    /** 按积分降序，从第 offset 名（0 起）开始取 count 名 */
    List<PlayerRecord> top(long offset, int count);
}
