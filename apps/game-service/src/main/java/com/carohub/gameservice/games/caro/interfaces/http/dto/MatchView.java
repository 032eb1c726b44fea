package com.carohub.gameservice.games.caro.interfaces.http.dto;

import com.carohub.gameservice.games.caro.domain.enums.Cell;
import com.carohub.gameservice.games.caro.domain.enums.Difficulty;
import com.carohub.gameservice.games.caro.domain.enums.MatchMode;
import com.carohub.gameservice.games.caro.domain.enums.MatchStatus;
import com.carohub.gameservice.games.caro.domain.model.Coord;
import com.carohub.gameservice.games.caro.domain.model.EloChange;
import com.carohub.gameservice.games.caro.domain.model.MatchSession;
import com.carohub.gameservice.games.caro.domain.model.Move;
import com.carohub.gameservice.games.caro.domain.model.Participant;
import com.carohub.gameservice.games.caro.domain.rule.Outcome;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * 对局只读视图（HTTP 返回）
 *
 * @param board 15 行，每行 15 个字符（'.' / 'X' / 'O'）
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MatchView(String matchId,
                        MatchMode mode,
                        MatchStatus status,
                        Difficulty difficulty,
                        Participant black,
                        Participant white,
                        Cell aiSide,
                        String[] board,
                        Cell currentTurn,
                        Outcome outcome,
                        List<Coord> winningLine,
                        List<Move> moves,
                        String serverId,
                        EloChange blackEloChange,
                        EloChange whiteEloChange) {

    public static MatchView of(MatchSession s) {
        return new MatchView(s.getId(), s.getMode(), s.getStatus(), s.getDifficulty(),
                s.getBlack(), s.getWhite(), s.getAiSide(),
                s.boardSnapshot().rows(), s.getCurrentTurn(), s.getOutcome(), s.getWinningLine(),
                s.getMoves(), s.getServerId(), s.getBlackEloChange(), s.getWhiteEloChange());
    }
}
