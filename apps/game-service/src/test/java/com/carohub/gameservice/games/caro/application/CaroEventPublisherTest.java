package com.carohub.gameservice.games.caro.application;

import com.carohub.gameservice.games.caro.domain.enums.Cell;
import com.carohub.gameservice.games.caro.domain.enums.MatchStatus;
import com.carohub.gameservice.games.caro.domain.exception.InvalidMoveException;
import com.carohub.gameservice.games.caro.domain.exception.SessionNotFoundException;
import com.carohub.gameservice.games.caro.domain.model.Coord;
import com.carohub.gameservice.games.caro.domain.model.EloChange;
import com.carohub.gameservice.games.caro.domain.model.Move;
import com.carohub.gameservice.games.caro.domain.rule.Outcome;
import com.carohub.gameservice.games.caro.interfaces.ws.dto.CaroEvent;
import com.carohub.gameservice.games.caro.service.LeaveResult;
import com.carohub.gameservice.games.caro.service.MoveResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class CaroEventPublisherTest {

    @Mock
    private SimpMessagingTemplate messaging;

    private CaroEventPublisher publisher;
    private final ObjectMapper mapper = new ObjectMapper();

    @BeforeEach
    void setUp() {
        publisher = new CaroEventPublisher(messaging);
    }

    private Object sentTo(String destination) {
        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(messaging).convertAndSend(eq(destination), captor.capture());
        return captor.getValue();
    }

    @Test
    void shouldPublishOrdinaryMoveAsSuccess() throws Exception {
        publisher.moved(new MoveResult("m1", new Move(7, 7, Cell.BLACK, 1), Outcome.ONGOING, List.of(), false, List.of()));

        CaroEvent.MoveEvent e = (CaroEvent.MoveEvent) sentTo("/topic/match.m1");
        assertEquals(CaroEvent.MoveOutcome.SUCCESS, e.result().status());
        assertNull(e.result().result());
        assertNull(e.result().eloChanges());

        JsonNode json = mapper.readTree(mapper.writeValueAsString(e));
        assertEquals("move", json.get("type").asText());
        assertEquals("X", json.get("player").asText());
        assertFalse(json.get("result").has("winningLine"));
    }

    @Test
    void shouldPublishWinningMoveWithLineAndRatings() {
        List<Coord> line = List.of(new Coord(7, 3), new Coord(7, 4), new Coord(7, 5), new Coord(7, 6), new Coord(7, 7));
        List<EloChange> elo = List.of(new EloChange("a", "A", 1200, 1216, 16, 3, 2),
                new EloChange("b", "B", 1200, 1184, -16, 3, 4));

        publisher.moved(new MoveResult("m1", new Move(7, 7, Cell.BLACK, 9), Outcome.BLACK_WIN, line, true, elo));

        CaroEvent.MoveEvent e = (CaroEvent.MoveEvent) sentTo("/topic/match.m1");
        assertEquals(CaroEvent.MoveOutcome.GAME_OVER, e.result().status());
        assertEquals(Outcome.BLACK_WIN, e.result().result());
        assertEquals(5, e.result().winningLine().size());
        assertEquals(2, e.result().eloChanges().size());
    }

    @Test
    void shouldPublishDisconnect() throws Exception {
        publisher.playerLeft(new LeaveResult("m1", "bob", Cell.WHITE, MatchStatus.COMPLETED,
                Outcome.BLACK_WIN, true, List.of()), true);

        CaroEvent.PlayerDisconnected e = (CaroEvent.PlayerDisconnected) sentTo("/topic/match.m1");
        assertEquals("bob", e.disconnectedUserId());
        assertTrue(e.opponentConnected());

        JsonNode json = mapper.readTree(mapper.writeValueAsString(e));
        assertEquals("player_disconnected", json.get("type").asText());
    }

    @Test
    void shouldPublishErrorWithCode() {
        publisher.error("m1", new InvalidMoveException(InvalidMoveException.Reason.NOT_YOUR_TURN, "wait"));

        CaroEvent.ErrorEvent e = (CaroEvent.ErrorEvent) sentTo("/topic/match.m1");
        assertEquals("NOT_YOUR_TURN", e.code());
        assertEquals("wait", e.message());
    }

    @Test
    void shouldMapErrorCodes() {
        assertEquals("NOT_FOUND", CaroEventPublisher.errorCodeOf(new SessionNotFoundException("x")));
        assertEquals("BAD_REQUEST", CaroEventPublisher.errorCodeOf(new IllegalArgumentException()));
        assertEquals("CONFLICT", CaroEventPublisher.errorCodeOf(new IllegalStateException()));
        assertEquals("INTERNAL_ERROR", CaroEventPublisher.errorCodeOf(new RuntimeException()));
    }
}
