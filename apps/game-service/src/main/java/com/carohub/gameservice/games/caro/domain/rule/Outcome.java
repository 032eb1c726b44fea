package com.carohub.gameservice.games.caro.domain.rule;

import com.carohub.gameservice.games.caro.domain.enums.Cell;
import com.carohub.gameservice.games.caro.domain.enums.GameResult;

/** 对局结果：未结束 / 黑胜 / 白胜 / 和棋 */
public enum Outcome {
    /** 对局进行中（尚未分出胜负） */
    ONGOING,
    /** 黑方胜利 */
    BLACK_WIN,
    /** 白方胜利 */
    WHITE_WIN,
    /** 平局 */
    DRAW;

    /**
     * 根据棋子颜色判断胜方。
     *
     * @param side 胜方棋色，BLACK 或 WHITE
     * @return 黑棋返回 {@link #BLACK_WIN}，白棋返回 {@link #WHITE_WIN}
     */
    public static Outcome winOf(Cell side) {
        return switch (side) {
            case BLACK -> BLACK_WIN;
            case WHITE -> WHITE_WIN;
            case EMPTY -> throw new IllegalArgumentException("EMPTY cannot win");
        };
    }

    /** 胜方棋色；和棋/未结束返回 null */
    public Cell winner() {
        return switch (this) {
            case BLACK_WIN -> Cell.BLACK;
            case WHITE_WIN -> Cell.WHITE;
            default -> null;
        };
    }

    public boolean isFinal() {
        return this != ONGOING;
    }

    /** 站在 side 一方看结果（仅对终局有意义） */
    public GameResult resultFor(Cell side) {
        if (this == ONGOING) {
            throw new IllegalStateException("对局尚未结束");
        }
        if (this == DRAW) return GameResult.DRAW;
        return winner() == side ? GameResult.WIN : GameResult.LOSS;
    }
}
