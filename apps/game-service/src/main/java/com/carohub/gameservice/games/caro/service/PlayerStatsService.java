package com.carohub.gameservice.games.caro.service;

import java.util.List;

/**
 * 战绩查询：个人战绩与排名、排行榜、最近对局。
 */
public interface PlayerStatsService {

    int DEFAULT_LEADERBOARD_LIMIT = 50;
    int DEFAULT_HISTORY_LIMIT = 10;

    /**
     * @throws com.carohub.gameservice.games.caro.domain.exception.PlayerNotFoundException 尚无档案
     */
    PlayerStats stats(String playerId);

    /** 至少赢过一局的玩家，积分降序 */
    List<LeaderboardEntry> leaderboard(int limit);

    /** 已结束的对局，最近的在前 */
    List<MatchHistoryItem> recentMatches(String playerId, int limit);
}
