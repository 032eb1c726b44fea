package com.carohub.gameservice.games.caro.domain.model;

import com.carohub.gameservice.games.caro.domain.rule.Outcome;

import java.util.List;

/**
 * 一次成功落子的结果。
 *
 * @param move         已记录的这一步
 * @param outcome      落子后的局面结果
 * @param winningLine  成五时的五个坐标，否则为空列表
 * @param finishedHere 本次调用是否完成了终局认领（只有它负责结算）
 */
public record MoveApplied(Move move, Outcome outcome, List<Coord> winningLine, boolean finishedHere) {
}
