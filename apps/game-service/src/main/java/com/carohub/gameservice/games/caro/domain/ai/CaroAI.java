package com.carohub.gameservice.games.caro.domain.ai;

import com.carohub.gameservice.games.caro.domain.enums.Cell;
import com.carohub.gameservice.games.caro.domain.enums.Difficulty;
import com.carohub.gameservice.games.caro.domain.model.Board;
import com.carohub.gameservice.games.caro.domain.model.Coord;
import com.carohub.gameservice.games.caro.domain.rule.CaroJudge;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * CaroAI（无状态，难度作为参数传入）：
 * EASY：在所有空位中均匀随机。
 * MEDIUM / HARD：
 * 1) 立即胜利优先（我方一下成五直接下）
 * 2) 立即防守优先（对方一下成五，立刻堵）
 * 3) 候选点只取已有棋子 8 邻域内的空位，按 {@link Evaluator} 打分，同分取行优先顺序中的第一个
 * 4) 没有候选点时随机兜底
 */
public class CaroAI {

    private final Random random;

    public CaroAI(Random random) {
        this.random = random;
    }

    /**
     * 计算 aiSymbol 的下一步。
     *
     * @throws IllegalStateException 棋盘已满
     */
    public Coord selectMove(Board board, Cell aiSymbol, Difficulty difficulty) {
        List<Coord> empties = emptyCells(board);
        if (empties.isEmpty()) {
            throw new IllegalStateException("棋盘已满，无处落子");
        }
        if (difficulty == Difficulty.EASY) {
            return empties.get(random.nextInt(empties.size()));
        }

        // 模拟在副本上进行，不改动调用方棋盘
        Board sim = board.copy();

        // 1) 我方一步即胜
        Coord win = findImmediateWin(sim, aiSymbol);
        if (win != null) return win;

        // 2) 对方一步即胜（先堵）
        Coord block = findImmediateWin(sim, aiSymbol.opponent());
        if (block != null) return block;

        // 3) 候选点打分
        Coord best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (Coord c : candidates(sim)) {
            double s = Evaluator.scoreCandidate(sim, c.row(), c.col(), aiSymbol);
            if (s > bestScore) {
                bestScore = s;
                best = c;
            }
        }
        if (best != null) return best;

        // 4) 随机兜底（空棋盘）
        return empties.get(random.nextInt(empties.size()));
    }

    // ================== 威胁优先 ==================

    private Coord findImmediateWin(Board b, Cell side) {
        for (int r = 0; r < Board.SIZE; r++) {
            for (int c = 0; c < Board.SIZE; c++) {
                if (!b.isEmpty(r, c)) continue;
                b.place(r, c, side);
                boolean win = CaroJudge.isWin(b, r, c, side);
                b.place(r, c, Cell.EMPTY);
                if (win) return new Coord(r, c);
            }
        }
        return null;
    }

    // ================== 候选点生成 ==================

    /** 候选点：行优先扫描，必须有 8 邻域邻居 */
    List<Coord> candidates(Board b) {
        List<Coord> list = new ArrayList<>();
        for (int r = 0; r < Board.SIZE; r++) {
            for (int c = 0; c < Board.SIZE; c++) {
                if (b.isEmpty(r, c) && hasNeighbor(b, r, c)) list.add(new Coord(r, c));
            }
        }
        return list;
    }

    private boolean hasNeighbor(Board b, int row, int col) {
        for (int dr = -1; dr <= 1; dr++) {
            for (int dc = -1; dc <= 1; dc++) {
                if (dr == 0 && dc == 0) continue;
                int r = row + dr, c = col + dc;
                if (b.inBounds(r, c) && b.get(r, c) != Cell.EMPTY) return true;
            }
        }
        return false;
    }

    private List<Coord> emptyCells(Board b) {
        List<Coord> list = new ArrayList<>();
        for (int r = 0; r < Board.SIZE; r++)
            for (int c = 0; c < Board.SIZE; c++)
                if (b.get(r, c) == Cell.EMPTY) list.add(new Coord(r, c));
        return list;
    }
}
