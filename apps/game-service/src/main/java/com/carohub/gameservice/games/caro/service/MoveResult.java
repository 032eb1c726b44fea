package com.carohub.gameservice.games.caro.service;

import com.carohub.gameservice.games.caro.domain.model.Coord;
import com.carohub.gameservice.games.caro.domain.model.EloChange;
import com.carohub.gameservice.games.caro.domain.model.Move;
import com.carohub.gameservice.games.caro.domain.rule.Outcome;

import java.util.List;

/**
 * 一次落子（真人或 AI）的结果
 *
 * @param eloChanges 仅在线对局终局时非空
 */
public record MoveResult(String matchId,
                         Move move,
                         Outcome outcome,
                         List<Coord> winningLine,
                         boolean gameOver,
                         List<EloChange> eloChanges) {
}
