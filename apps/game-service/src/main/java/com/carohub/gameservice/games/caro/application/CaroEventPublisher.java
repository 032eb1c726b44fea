package com.carohub.gameservice.games.caro.application;

import com.carohub.gameservice.games.caro.domain.exception.InvalidMoveException;
import com.carohub.gameservice.games.caro.domain.exception.SessionNotFoundException;
import com.carohub.gameservice.games.caro.domain.model.MatchSession;
import com.carohub.gameservice.games.caro.interfaces.ws.dto.CaroEvent;
import com.carohub.gameservice.games.caro.service.LeaveResult;
import com.carohub.gameservice.games.caro.service.MoveResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * 对局事件广播：统一发往 /topic/match.{matchId}
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CaroEventPublisher {

    private final SimpMessagingTemplate messaging;

    public static String topicOf(String matchId) {
        return "/topic/match." + matchId;
    }

    public void moved(MoveResult r) {
        CaroEvent.MoveOutcome outcome = new CaroEvent.MoveOutcome(
                r.gameOver() ? CaroEvent.MoveOutcome.GAME_OVER : CaroEvent.MoveOutcome.SUCCESS,
                r.gameOver() ? r.outcome() : null,
                r.gameOver() ? r.winningLine() : null,
                r.eloChanges().isEmpty() ? null : r.eloChanges());
        send(r.matchId(), new CaroEvent.MoveEvent(r.move().row(), r.move().col(), r.move().symbol(), outcome));
    }

    public void playerLeft(LeaveResult r, boolean opponentConnected) {
        send(r.matchId(), new CaroEvent.PlayerDisconnected(r.playerId(), r.outcome(), opponentConnected,
                r.eloChanges().isEmpty() ? null : r.eloChanges()));
    }

    public void state(MatchSession s) {
        send(s.getId(), new CaroEvent.GameState(s.boardSnapshot().encode(), s.getCurrentTurn(),
                s.getStatus(), s.getOutcome(), s.getWinningLine()));
    }

    public void error(String matchId, Exception e) {
        send(matchId, new CaroEvent.ErrorEvent(errorCodeOf(e), e.getMessage()));
    }

    /** 与 HTTP 映射保持一致的错误码 */
    static String errorCodeOf(Exception e) {
        if (e instanceof InvalidMoveException ime) return ime.getReason().name();
        if (e instanceof SessionNotFoundException) return "NOT_FOUND";
        if (e instanceof IllegalArgumentException) return "BAD_REQUEST";
        if (e instanceof IllegalStateException) return "CONFLICT";
        return "INTERNAL_ERROR";
    }

    private void send(String matchId, CaroEvent event) {
        messaging.convertAndSend(topicOf(matchId), event);
        log.debug("广播对局事件: matchId={}, event={}", matchId, event.getClass().getSimpleName());
    }
}
