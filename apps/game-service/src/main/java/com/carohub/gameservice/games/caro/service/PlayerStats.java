package com.carohub.gameservice.games.caro.service;

import com.carohub.gameservice.games.caro.domain.model.PlayerRecord;

/**
 * 玩家战绩 + 当前排名
 *
 * @param rank    积分严格高于该玩家的人数 + 1
 * @param winRate 百分比，未对局为 0
 */
public record PlayerStats(String playerId,
                          String username,
                          int rating,
                          long rank,
                          int wins,
                          int losses,
                          int draws,
                          int gamesPlayed,
                          double winRate,
                          int currentStreak,
                          int bestStreak) {

    public static PlayerStats of(PlayerRecord rec, String username, long rank) {
        return new PlayerStats(rec.getPlayerId(), username, rec.getRating(), rank,
                rec.getWins(), rec.getLosses(), rec.getDraws(), rec.getGamesPlayed(), rec.getWinRate(),
                rec.getCurrentStreak(), rec.getBestStreak());
    }
}
