package com.carohub.gameservice.games.caro.domain.exception;

import lombok.Getter;

/** 内存与持久化中都找不到该对局 */
@Getter
public class SessionNotFoundException extends RuntimeException {

    private final String matchId;

    public SessionNotFoundException(String matchId) {
        super("对局不存在: " + matchId);
        this.matchId = matchId;
    }
}
