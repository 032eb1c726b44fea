package com.carohub.gameservice.games.caro.domain.model;

/** 棋盘坐标 (row, col)，0 起 */
public record Coord(int row, int col) {
}
