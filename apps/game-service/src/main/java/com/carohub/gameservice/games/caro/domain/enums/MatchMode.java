package com.carohub.gameservice.games.caro.domain.enums;

/** 对战模式：本地双人 / 在线匹配 / 人机 */
public enum MatchMode {
    /** 同一终端双人对弈，不记录任何玩家数据 */
    LOCAL,
    /** 在线匹配对局，终局结算积分 */
    ONLINE,
    /** 人机对局，只记录真人玩家的胜负场次 */
    AI
}
