package com.carohub.gameservice.games.caro.domain.enums;

/** 断线处理结果 */
public enum DisconnectOutcome {
    /** 本次断线结束了对局（对方获胜），需要结算 */
    FINISHED,
    /** 对局尚未开始，直接放弃，无结果 */
    ABANDONED,
    /** 对局已结束，忽略 */
    IGNORED
}
