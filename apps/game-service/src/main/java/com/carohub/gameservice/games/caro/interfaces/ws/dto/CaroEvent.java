package com.carohub.gameservice.games.caro.interfaces.ws.dto;

import com.carohub.gameservice.games.caro.domain.enums.Cell;
import com.carohub.gameservice.games.caro.domain.enums.MatchStatus;
import com.carohub.gameservice.games.caro.domain.model.Coord;
import com.carohub.gameservice.games.caro.domain.model.EloChange;
import com.carohub.gameservice.games.caro.domain.rule.Outcome;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * 对局广播事件（服务端 → /topic/match.{matchId}），按 type 字段区分。
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = CaroEvent.MoveEvent.class, name = "move"),
        @JsonSubTypes.Type(value = CaroEvent.PlayerDisconnected.class, name = "player_disconnected"),
        @JsonSubTypes.Type(value = CaroEvent.GameState.class, name = "game_state"),
        @JsonSubTypes.Type(value = CaroEvent.ErrorEvent.class, name = "error")
})
@JsonInclude(JsonInclude.Include.NON_NULL)
public sealed interface CaroEvent {

    /** 落子（真人或 AI） */
    record MoveEvent(int row, int col, Cell player, MoveOutcome result) implements CaroEvent {
    }

    /**
     * 落子结果
     * @param status SUCCESS 或 GAME_OVER
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record MoveOutcome(String status, Outcome result, List<Coord> winningLine, List<EloChange> eloChanges) {

        public static final String SUCCESS = "SUCCESS";
        public static final String GAME_OVER = "GAME_OVER";
    }

    /**
     * 一方断线或离开
     * @param opponentConnected 另一方是否仍在线
     */
    record PlayerDisconnected(String disconnectedUserId,
                              Outcome result,
                              boolean opponentConnected,
                              List<EloChange> eloChanges) implements CaroEvent {
    }

    /** 当前局面（加入时推送） */
    record GameState(String board, Cell currentTurn, MatchStatus status, Outcome result,
                     List<Coord> winningLine) implements CaroEvent {
    }

    record ErrorEvent(String code, String message) implements CaroEvent {
    }
}
