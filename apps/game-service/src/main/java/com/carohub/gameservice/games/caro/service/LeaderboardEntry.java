package com.carohub.gameservice.games.caro.service;

import com.carohub.gameservice.games.caro.domain.model.PlayerRecord;

/**
 * 排行榜一行；rank 为榜单内位置（1 起）
 */
public record LeaderboardEntry(int rank,
                               String playerId,
                               String username,
                               int rating,
                               int wins,
                               int losses,
                               int draws,
                               double winRate) {

    public static LeaderboardEntry of(int rank, PlayerRecord rec, String username) {
        return new LeaderboardEntry(rank, rec.getPlayerId(), username, rec.getRating(),
                rec.getWins(), rec.getLosses(), rec.getDraws(), rec.getWinRate());
    }
}
