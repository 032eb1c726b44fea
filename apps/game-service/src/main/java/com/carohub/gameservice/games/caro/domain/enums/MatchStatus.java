package com.carohub.gameservice.games.caro.domain.enums;

public enum MatchStatus {

    WAITING,      // 在线对局等待第二名玩家
    IN_PROGRESS,  // 对局中（允许落子）
    COMPLETED,    // 已结束（有结果）
    ABANDONED     // 未开局即放弃（无结果）
}
