package com.carohub.gameservice.games.caro.domain.ai;

import com.carohub.gameservice.games.caro.domain.enums.Cell;
import com.carohub.gameservice.games.caro.domain.model.Board;

/**
 * 候选点评估函数
 * 站在“假设在 (row,col) 落子”的视角，给该点打分。
 * 分越大表示该点越值得下。
 */
public final class Evaluator {

    /** 防守分权重（略低于进攻） */
    public static final double DEFENSE_WEIGHT = 0.8;
    /** 每个相邻己方棋子的聚集奖励 */
    public static final int ADJACENT_BONUS = 8;

    private static final int[][] DIRS = {{0, 1}, {1, 0}, {1, 1}, {1, -1}};

    private Evaluator() {
    }

    /**
     * 候选点总分 = 四向己方连子强度 + 0.8 × 四向对方连子强度 + 8 × 相邻己方棋子数
     */
    public static double scoreCandidate(Board b, int row, int col, Cell me) {
        Cell opp = me.opponent();
        int attack = 0, defense = 0;
        for (int[] d : DIRS) {
            attack += lineStrength(b, row, col, d[0], d[1], me);
            defense += lineStrength(b, row, col, d[0], d[1], opp);
        }
        return attack + DEFENSE_WEIGHT * defense + ADJACENT_BONUS * adjacentCount(b, row, col, me);
    }

    /**
     * 单轴连子强度：假设 (row,col) 放下 piece，沿轴两向数连续同色子（含自身，从 1 起），
     * 并记录两端是否停在空位（开放端）。
     */
    public static int lineStrength(Board b, int row, int col, int dr, int dc, Cell piece) {
        int count = 1, open = 0;

        // 正向
        int r = row + dr, c = col + dc;
        while (b.inBounds(r, c) && b.get(r, c) == piece) { count++; r += dr; c += dc; }
        if (b.inBounds(r, c) && b.get(r, c) == Cell.EMPTY) open++;

        // 反向
        r = row - dr; c = col - dc;
        while (b.inBounds(r, c) && b.get(r, c) == piece) { count++; r -= dr; c -= dc; }
        if (b.inBounds(r, c) && b.get(r, c) == Cell.EMPTY) open++;

        return valueOf(count, open);
    }

    /** 分值表：(连子数, 开放端数) → 分 */
    static int valueOf(int count, int open) {
        if (count >= 5) return 10000;           // 成五
        if (open == 0) return 0;                // 两端被堵，没有潜力
        boolean both = open == 2;
        return switch (count) {
            case 4 -> both ? 5000 : 1200;       // 活四 / 冲四
            case 3 -> both ? 400 : 120;         // 活三 / 眠三
            case 2 -> both ? 80 : 30;           // 活二 / 眠二
            default -> both ? 15 : 5;           // 单子
        };
    }

    /** 8 邻域内己方棋子数 */
    public static int adjacentCount(Board b, int row, int col, Cell me) {
        int n = 0;
        for (int dr = -1; dr <= 1; dr++) {
            for (int dc = -1; dc <= 1; dc++) {
                if (dr == 0 && dc == 0) continue;
                int r = row + dr, c = col + dc;
                if (b.inBounds(r, c) && b.get(r, c) == me) n++;
            }
        }
        return n;
    }
}
