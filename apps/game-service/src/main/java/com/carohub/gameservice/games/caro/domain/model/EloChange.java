package com.carohub.gameservice.games.caro.domain.model;

/**
 * 单方积分变化（随终局广播给双方）。
 */
public record EloChange(String userId,
                        String username,
                        int oldElo,
                        int newElo,
                        int change,
                        long oldRank,
                        long newRank) {
}
