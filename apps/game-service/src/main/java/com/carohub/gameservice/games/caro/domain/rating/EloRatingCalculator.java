package com.carohub.gameservice.games.caro.domain.rating;

import com.carohub.gameservice.games.caro.domain.enums.Cell;
import com.carohub.gameservice.games.caro.domain.enums.GameResult;
import com.carohub.gameservice.games.caro.domain.rule.Outcome;

/**
 * ELO 积分计算（纯函数，无外部依赖）。
 *
 * 期望得分：E = 1 / (1 + 10^((对手积分 - 自身积分) / 400))
 * 增量：    delta = (int) (K * (实际得分 - E))，向零截断
 */
public class EloRatingCalculator {

    private final int kFactor;

    public EloRatingCalculator(int kFactor) {
        if (kFactor <= 0) {
            throw new IllegalArgumentException("K 系数必须为正数: " + kFactor);
        }
        this.kFactor = kFactor;
    }

    public int kFactor() {
        return kFactor;
    }

    /** self 对 opponent 的期望得分，取值 0..1 */
    public static double expectedScore(int self, int opponent) {
        return 1.0 / (1.0 + Math.pow(10.0, (opponent - self) / 400.0));
    }

    public RatingChange update(int self, int opponent, GameResult result) {
        double expected = expectedScore(self, opponent);
        int delta = (int) (kFactor * (result.actualScore() - expected));
        return new RatingChange(self, self + delta, delta);
    }

    /**
     * 双方结算：两边都以对方的赛前积分为准，互不影响。
     */
    public SettledRatings settle(int blackBefore, int whiteBefore, Outcome outcome) {
        RatingChange black = update(blackBefore, whiteBefore, outcome.resultFor(Cell.BLACK));
        RatingChange white = update(whiteBefore, blackBefore, outcome.resultFor(Cell.WHITE));
        return new SettledRatings(black, white);
    }
}
