package com.carohub.gameservice.games.caro.service;

import com.carohub.gameservice.games.caro.domain.enums.GameResult;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 玩家视角的一局历史
 *
 * @param side         该玩家执子 "X" / "O"
 * @param ratingChange 仅在线对局有
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MatchHistoryItem(String matchId,
                               String mode,
                               String side,
                               String opponentId,
                               String opponentName,
                               GameResult result,
                               String outcome,
                               Integer ratingBefore,
                               Integer ratingAfter,
                               Integer ratingChange,
                               int moveCount,
                               long finishedAt) {
}
