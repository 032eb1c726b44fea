package com.carohub.gameservice.games.caro.application;

import com.carohub.gameservice.games.caro.domain.enums.Cell;
import com.carohub.gameservice.games.caro.domain.enums.GameResult;
import com.carohub.gameservice.games.caro.domain.enums.MatchMode;
import com.carohub.gameservice.games.caro.domain.model.EloChange;
import com.carohub.gameservice.games.caro.domain.model.MatchSession;
import com.carohub.gameservice.games.caro.domain.model.Participant;
import com.carohub.gameservice.games.caro.domain.rating.EloRatingCalculator;
import com.carohub.gameservice.games.caro.domain.rating.RatingChange;
import com.carohub.gameservice.games.caro.domain.rating.SettledRatings;
import com.carohub.gameservice.games.caro.domain.repository.MatchRecordRepository;
import com.carohub.gameservice.games.caro.domain.repository.PlayerRecordRepository;
import com.carohub.gameservice.games.caro.domain.rule.Outcome;
import com.carohub.gameservice.games.caro.service.MatchProperties;
import com.carohub.gameservice.pool.service.ServerPoolService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 终局结算（每局只会被终局认领成功的一方调用一次）：
 * - ONLINE：双方按赛前积分快照计算 ELO，更新胜负和与连胜，附带排名变化；
 * - AI：只给真人记胜负和，不动连胜和积分；
 * - LOCAL：不记录。
 * 战绩变化由仓储按玩家原子写入；真人参与的对局记入其最近对局索引。
 * 无论哪种模式，都把对局从所在服务器上释放。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MatchSettlement {

    private final PlayerRecordRepository players;
    private final EloRatingCalculator elo;
    private final ServerPoolService serverPool;
    private final MatchRecordRepository matches;
    private final MatchProperties props;

    public List<EloChange> settle(MatchSession s) {
        List<EloChange> changes = switch (s.getMode()) {
            case ONLINE -> settleOnline(s);
            case AI -> {
                settleAi(s);
                yield List.of();
            }
            case LOCAL -> List.of();
        };
        indexHistory(s);
        releaseServer(s);
        log.info("对局结算完成: matchId={}, mode={}, outcome={}", s.getId(), s.getMode(), s.getOutcome());
        return changes;
    }

    /** 放弃（未开局）的对局只需要释放服务器 */
    public void releaseServer(MatchSession s) {
        if (s.getServerId() != null) {
            serverPool.release(s.getId(), s.getServerId());
        }
    }

    private List<EloChange> settleOnline(MatchSession s) {
        Participant black = s.getBlack();
        Participant white = s.getWhite();
        Outcome outcome = s.getOutcome();
        SettledRatings settled = elo.settle(black.ratingBefore(), white.ratingBefore(), outcome);

        EloChange blackChange = apply(black, settled.black(), outcome.resultFor(Cell.BLACK));
        EloChange whiteChange = apply(white, settled.white(), outcome.resultFor(Cell.WHITE));
        s.recordEloChanges(blackChange, whiteChange);
        return List.of(blackChange, whiteChange);
    }

    private EloChange apply(Participant p, RatingChange change, GameResult result) {
        long oldRank = players.rankOf(players.findOrCreate(p.playerId()).getRating());
        int newElo = players.recordResult(p.playerId(), change.delta(), result, true);
        // 以写入后的积分反推写入前的积分，并发结算的另一局不会混进本局的差值
        int oldElo = newElo - change.delta();
        long newRank = players.rankOf(newElo);
        log.debug("积分更新: playerId={}, {} -> {} ({}), rank {} -> {}",
                p.playerId(), oldElo, newElo, change.delta(), oldRank, newRank);
        return new EloChange(p.playerId(), p.username(), oldElo, newElo, change.delta(), oldRank, newRank);
    }

    private void settleAi(MatchSession s) {
        Cell humanSide = s.getAiSide().opponent();
        Participant human = s.participant(humanSide);
        if (human == null || human.isAi()) {
            return;
        }
        players.recordResult(human.playerId(), 0, s.getOutcome().resultFor(humanSide), false);
    }

    /** 最近对局索引写失败不影响结算结果 */
    private void indexHistory(MatchSession s) {
        if (s.getMode() == MatchMode.LOCAL) {
            return;
        }
        for (Participant p : new Participant[]{s.getBlack(), s.getWhite()}) {
            if (p == null || p.isAi()) {
                continue;
            }
            try {
                matches.indexForPlayer(p.playerId(), s.getId(), s.getUpdatedAt(), props.getHistoryLimit());
            } catch (DataAccessException e) {
                log.warn("最近对局索引写入失败: matchId={}, playerId={}, err={}", s.getId(), p.playerId(), e.getMessage());
            }
        }
    }
}
