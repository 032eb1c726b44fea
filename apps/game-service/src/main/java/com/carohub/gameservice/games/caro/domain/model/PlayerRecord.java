package com.carohub.gameservice.games.caro.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 玩家战绩：积分 + 胜负和 + 连胜。
 * 胜：连胜 +1 并刷新最佳；负 / 和：连胜清零（人机对局不记连胜），增量由仓储原子写入。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PlayerRecord {
    private String playerId;
    private int rating;
    private int wins;
    private int losses;
    private int draws;
    /** 当前连胜 */
    private int currentStreak;
    /** 历史最佳连胜 */
    private int bestStreak;

    public static PlayerRecord fresh(String playerId, int initialRating) {
        return new PlayerRecord(playerId, initialRating, 0, 0, 0, 0, 0);
    }

    @JsonIgnore
    public int getGamesPlayed() {
        return wins + losses + draws;
    }

    /** 胜率（百分比，0-100），未对局为 0 */
    @JsonIgnore
    public double getWinRate() {
        int games = getGamesPlayed();
        return games == 0 ? 0.0 : wins * 100.0 / games;
    }
}
