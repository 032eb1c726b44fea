package com.carohub.gameservice.games.caro.domain.model;

import com.carohub.gameservice.games.caro.domain.enums.Cell;

/**
 * 一步棋：第 seq 手在 (row,col) 落下 symbol。
 * 记录后不可变，按顺序追加到对局历史。
 */
public record Move(int row, int col, Cell symbol, int seq) {
}
