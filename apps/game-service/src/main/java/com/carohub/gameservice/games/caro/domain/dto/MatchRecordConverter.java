package com.carohub.gameservice.games.caro.domain.dto;

import com.carohub.gameservice.games.caro.domain.enums.Cell;
import com.carohub.gameservice.games.caro.domain.enums.Difficulty;
import com.carohub.gameservice.games.caro.domain.enums.MatchMode;
import com.carohub.gameservice.games.caro.domain.enums.MatchStatus;
import com.carohub.gameservice.games.caro.domain.model.Board;
import com.carohub.gameservice.games.caro.domain.model.EloChange;
import com.carohub.gameservice.games.caro.domain.model.MatchSession;
import com.carohub.gameservice.games.caro.domain.model.Participant;
import com.carohub.gameservice.games.caro.domain.rule.Outcome;

import java.util.ArrayList;

/**
 * MatchSession ↔ MatchRecord 转换
 */
public final class MatchRecordConverter {

    private MatchRecordConverter() {
    }

    public static MatchRecord toRecord(MatchSession s) {
        MatchRecord r = new MatchRecord();
        r.setId(s.getId());
        r.setMode(s.getMode().name());
        r.setDifficulty(s.getDifficulty() == null ? null : s.getDifficulty().name());
        r.setAiSide(s.getAiSide() == null ? null : s.getAiSide().code());
        r.setBoard(s.boardSnapshot().encode());
        r.setCurrentTurn(s.getCurrentTurn().code());
        r.setStatus(s.getStatus().name());
        r.setOutcome(s.getOutcome().name());
        r.setWinningLine(new ArrayList<>(s.getWinningLine()));
        r.setMoves(new ArrayList<>(s.getMoves()));
        r.setServerId(s.getServerId());
        r.setCreatedAt(s.getCreatedAt());
        r.setUpdatedAt(s.getUpdatedAt());

        Participant b = s.getBlack();
        if (b != null) {
            r.setBlackId(b.playerId());
            r.setBlackName(b.username());
            r.setBlackRatingBefore(b.ratingBefore());
        }
        Participant w = s.getWhite();
        if (w != null) {
            r.setWhiteId(w.playerId());
            r.setWhiteName(w.username());
            r.setWhiteRatingBefore(w.ratingBefore());
        }
        EloChange be = s.getBlackEloChange();
        if (be != null) {
            r.setBlackRatingAfter(be.newElo());
            r.setBlackRatingDelta(be.change());
            r.setBlackRankBefore(be.oldRank());
            r.setBlackRankAfter(be.newRank());
        }
        EloChange we = s.getWhiteEloChange();
        if (we != null) {
            r.setWhiteRatingAfter(we.newElo());
            r.setWhiteRatingDelta(we.change());
            r.setWhiteRankBefore(we.oldRank());
            r.setWhiteRankAfter(we.newRank());
        }
        return r;
    }

    public static MatchSession fromRecord(MatchRecord r) {
        Participant black = r.getBlackId() == null ? null
                : new Participant(r.getBlackId(), r.getBlackName(), r.getBlackRatingBefore());
        Participant white = r.getWhiteId() == null ? null
                : new Participant(r.getWhiteId(), r.getWhiteName(), r.getWhiteRatingBefore());
        return MatchSession.restore()
                .id(r.getId())
                .mode(MatchMode.valueOf(r.getMode()))
                .difficulty(r.getDifficulty() == null ? null : Difficulty.valueOf(r.getDifficulty()))
                .aiSide(r.getAiSide() == null ? null : Cell.of(r.getAiSide()))
                .black(black)
                .white(white)
                .board(r.getBoard() == null ? new Board() : Board.decode(r.getBoard()))
                .currentTurn(r.getCurrentTurn() == null ? Cell.BLACK : Cell.of(r.getCurrentTurn()))
                .status(MatchStatus.valueOf(r.getStatus()))
                .outcome(r.getOutcome() == null ? Outcome.ONGOING : Outcome.valueOf(r.getOutcome()))
                .winningLine(r.getWinningLine())
                .moves(r.getMoves())
                .serverId(r.getServerId())
                .blackEloChange(eloOf(black, r.getBlackRatingAfter(), r.getBlackRatingDelta(),
                        r.getBlackRankBefore(), r.getBlackRankAfter()))
                .whiteEloChange(eloOf(white, r.getWhiteRatingAfter(), r.getWhiteRatingDelta(),
                        r.getWhiteRankBefore(), r.getWhiteRankAfter()))
                .createdAt(r.getCreatedAt())
                .updatedAt(r.getUpdatedAt())
                .build();
    }

    private static EloChange eloOf(Participant p, Integer after, Integer delta, Long rankBefore, Long rankAfter) {
        if (p == null || after == null || delta == null) {
            return null;
        }
        return new EloChange(p.playerId(), p.username(), p.ratingBefore(), after, delta,
                rankBefore == null ? 0 : rankBefore, rankAfter == null ? 0 : rankAfter);
    }
}
