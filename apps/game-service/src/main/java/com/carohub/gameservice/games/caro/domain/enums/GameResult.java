package com.carohub.gameservice.games.caro.domain.enums;

/** 单个玩家视角下的对局结果 */
public enum GameResult {
    WIN(1.0),
    LOSS(0.0),
    DRAW(0.5);

    /** 积分公式中的实际得分 */
    private final double actualScore;

    GameResult(double actualScore) {
        this.actualScore = actualScore;
    }

    public double actualScore() {
        return actualScore;
    }
}
