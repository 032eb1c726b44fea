package com.carohub.gameservice.games.caro.domain.rule;

import com.carohub.gameservice.games.caro.domain.constants.GameMessages;
import com.carohub.gameservice.games.caro.domain.enums.Cell;
import com.carohub.gameservice.games.caro.domain.exception.InvalidMoveException;
import com.carohub.gameservice.games.caro.domain.exception.InvalidMoveException.Reason;
import com.carohub.gameservice.games.caro.domain.model.Board;
import com.carohub.gameservice.games.caro.domain.model.Coord;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 核心规则判断
 * Caro 规则判定（15x15，连成五子即胜，不含禁手）。
 * 只包含纯判断逻辑：落子、胜负、和棋。
 */
public final class CaroJudge {

    /** 获胜所需连子数 */
    public static final int WIN_LENGTH = 5;

    // 4 个方向：横、竖、主对角、反对角
    private static final int[][] DIRS = {
            {0, 1},  // →
            {1, 0},  // ↓
            {1, 1},  // ↘
            {1, -1}  // ↙
    };

    private CaroJudge() {
    }

    /** 该落点是否“棋盘内为空” */
    public static boolean isLegal(Board b, int row, int col) {
        return b.isEmpty(row, col);
    }

    /**
     * 落子。失败时棋盘保持原样。
     *
     * @throws InvalidMoveException 越界或该格已有棋子
     */
    public static Board applyMove(Board b, int row, int col, Cell symbol) {
        if (symbol == null || !symbol.isStone()) {
            throw new IllegalArgumentException("落子棋色必须为 BLACK 或 WHITE");
        }
        if (!b.inBounds(row, col)) {
            throw new InvalidMoveException(Reason.OUT_OF_BOUNDS, GameMessages.formatOutOfBounds(row, col));
        }
        if (b.get(row, col) != Cell.EMPTY) {
            throw new InvalidMoveException(Reason.CELL_OCCUPIED, GameMessages.formatCellOccupied(row, col));
        }
        b.place(row, col, symbol);
        return b;
    }

    /**
     * 基于“最后一步”判断是否成五。
     * 只检查经过 (row,col) 的四条轴线；命中时返回该轴上从一端到另一端的前五个坐标。
     */
    public static Optional<List<Coord>> checkWin(Board b, int row, int col, Cell symbol) {
        for (int[] d : DIRS) {
            int back = countOneDir(b, row, col, -d[0], -d[1], symbol);
            int fwd = countOneDir(b, row, col, d[0], d[1], symbol);
            if (1 + back + fwd >= WIN_LENGTH) {
                // 从反方向最远端开始，沿正方向取五格
                int sr = row - back * d[0];
                int sc = col - back * d[1];
                List<Coord> line = new ArrayList<>(WIN_LENGTH);
                for (int i = 0; i < WIN_LENGTH; i++) {
                    line.add(new Coord(sr + i * d[0], sc + i * d[1]));
                }
                return Optional.of(List.copyOf(line));
            }
        }
        return Optional.empty();
    }

    public static boolean isWin(Board b, int row, int col, Cell symbol) {
        return checkWin(b, row, col, symbol).isPresent();
    }

    /** 棋盘是否已满（用于和棋判断） */
    public static boolean isFull(Board b) {
        for (int i = 0; i < Board.SIZE; i++)
            for (int j = 0; j < Board.SIZE; j++)
                if (b.get(i, j) == Cell.EMPTY) return false;
        return true;
    }

    /**
     * 根据“执行完这步棋”后的局面，返回对局结果。先判胜，再判满盘和棋。
     */
    public static Outcome outcomeAfterMove(Board b, int row, int col, Cell symbol) {
        if (isWin(b, row, col, symbol)) {
            return Outcome.winOf(symbol);
        }
        if (isFull(b)) {
            return Outcome.DRAW;
        }
        return Outcome.ONGOING;
    }

    /**
     * 沿某个方向数连续相同棋子（不含起点），直到越界或遇到不同棋子停止
     */
    static int countOneDir(Board b, int row, int col, int dr, int dc, Cell symbol) {
        int c = 0;
        row += dr; col += dc;
        while (b.inBounds(row, col) && b.get(row, col) == symbol) {
            c++; row += dr; col += dc;
        }
        return c;
    }
}
