package com.carohub.gameservice.games.caro.service;

import com.carohub.gameservice.games.caro.domain.enums.Cell;
import com.carohub.gameservice.games.caro.domain.enums.MatchStatus;
import com.carohub.gameservice.games.caro.domain.model.EloChange;
import com.carohub.gameservice.games.caro.domain.rule.Outcome;

import java.util.List;

/**
 * 认输 / 断线的处理结果
 *
 * @param side         离开方棋色；无法确定时为 null
 * @param finishedHere 本次调用是否结束了对局（只有它做了结算）
 */
public record LeaveResult(String matchId,
                          String playerId,
                          Cell side,
                          MatchStatus status,
                          Outcome outcome,
                          boolean finishedHere,
                          List<EloChange> eloChanges) {
}
