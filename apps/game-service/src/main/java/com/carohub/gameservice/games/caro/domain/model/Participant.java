package com.carohub.gameservice.games.caro.domain.model;

/**
 * 对局参与者：玩家 ID + 显示名 + 赛前积分快照。
 */
public record Participant(String playerId, String username, int ratingBefore) {

    /** AI 对手的保留 ID */
    public static final String AI_ID = "AI";

    public static Participant ai() {
        return new Participant(AI_ID, AI_ID, 0);
    }

    public boolean isAi() {
        return AI_ID.equals(playerId);
    }
}
