package com.carohub.gameservice.games.caro.domain.exception;

import lombok.Getter;

/** 玩家尚无战绩档案（从未进行过计分对局） */
@Getter
public class PlayerNotFoundException extends RuntimeException {

    private final String playerId;

    public PlayerNotFoundException(String playerId) {
        super("玩家不存在: " + playerId);
        this.playerId = playerId;
    }
}
