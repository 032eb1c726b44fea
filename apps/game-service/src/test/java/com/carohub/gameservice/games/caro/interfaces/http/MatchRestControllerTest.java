package com.carohub.gameservice.games.caro.interfaces.http;

import com.carohub.gameservice.common.WebExceptionAdvice;
import com.carohub.gameservice.games.caro.application.CaroEventPublisher;
import com.carohub.gameservice.games.caro.domain.enums.Cell;
import com.carohub.gameservice.games.caro.domain.enums.Difficulty;
import com.carohub.gameservice.games.caro.domain.exception.InvalidMoveException;
import com.carohub.gameservice.games.caro.domain.exception.SessionNotFoundException;
import com.carohub.gameservice.games.caro.domain.model.MatchSession;
import com.carohub.gameservice.games.caro.domain.model.Move;
import com.carohub.gameservice.games.caro.domain.model.Participant;
import com.carohub.gameservice.games.caro.domain.rule.Outcome;
import com.carohub.gameservice.games.caro.service.MatchService;
import com.carohub.gameservice.games.caro.service.MoveResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class MatchRestControllerTest {

    @Mock
    private MatchService matchService;
    @Mock
    private CaroEventPublisher publisher;

    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        mvc = MockMvcBuilders.standaloneSetup(new MatchRestController(matchService, publisher))
                .setControllerAdvice(new WebExceptionAdvice())
                .build();
    }

    @Test
    void shouldCreateLocalMatch() throws Exception {
        when(matchService.createLocal()).thenReturn(MatchSession.local("m1"));

        mvc.perform(post("/api/caro/matches").contentType(MediaType.APPLICATION_JSON).content("{\"mode\":\"local\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(200))
                .andExpect(jsonPath("$.data.matchId").value("m1"))
                .andExpect(jsonPath("$.data.status").value("IN_PROGRESS"))
                .andExpect(jsonPath("$.data.currentTurn").value("X"))
                .andExpect(jsonPath("$.data.board", hasSize(15)));
    }

    @Test
    void shouldDefaultToAiMatchWithHumanOnBlack() throws Exception {
        when(matchService.createAiMatch("alice", Cell.BLACK, Difficulty.MEDIUM)).thenReturn(
                MatchSession.againstAi("m2", new Participant("alice", "Alice", 1200), Cell.BLACK, Difficulty.MEDIUM));

        mvc.perform(post("/api/caro/matches").contentType(MediaType.APPLICATION_JSON).content("{\"playerId\":\"alice\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.mode").value("AI"))
                .andExpect(jsonPath("$.data.aiSide").value("O"));
    }

    @Test
    void shouldRejectUnknownMode() throws Exception {
        mvc.perform(post("/api/caro/matches").contentType(MediaType.APPLICATION_JSON).content("{\"mode\":\"blitz\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value(400));
    }

    @Test
    void shouldMapInvalidMoveToBadRequestWithReason() throws Exception {
        when(matchService.makeMove("m1", null, 7, 7, null))
                .thenThrow(new InvalidMoveException(InvalidMoveException.Reason.CELL_OCCUPIED, "occupied"));

        mvc.perform(post("/api/caro/matches/m1/moves").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"row\":7,\"col\":7}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message", startsWith("CELL_OCCUPIED")));
        verify(publisher, never()).moved(any());
    }

    @Test
    void shouldLetAiAnswerWithinSameRequest() throws Exception {
        MatchSession s = MatchSession.againstAi("m3", new Participant("alice", "Alice", 1200), Cell.BLACK, Difficulty.MEDIUM);
        s.makeMove(7, 7, Cell.BLACK);
        MoveResult human = new MoveResult("m3", new Move(7, 7, Cell.BLACK, 1), Outcome.ONGOING, List.of(), false, List.of());
        MoveResult ai = new MoveResult("m3", new Move(6, 6, Cell.WHITE, 2), Outcome.ONGOING, List.of(), false, List.of());
        when(matchService.makeMove("m3", "alice", 7, 7, null)).thenReturn(human);
        when(matchService.get("m3")).thenReturn(s);
        when(matchService.aiMove("m3")).thenReturn(ai);

        mvc.perform(post("/api/caro/matches/m3/moves").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"playerId\":\"alice\",\"row\":7,\"col\":7}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.move.move.seq").value(1))
                .andExpect(jsonPath("$.data.aiMove.move.row").value(6))
                .andExpect(jsonPath("$.data.aiMove.move.symbol").value("O"));
        verify(publisher, times(2)).moved(any());
    }

    @Test
    void shouldMapUnknownMatchToNotFound() throws Exception {
        when(matchService.get("ghost")).thenThrow(new SessionNotFoundException("ghost"));

        mvc.perform(get("/api/caro/matches/ghost"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value(404));
    }

    @Test
    void shouldMapFinishedMatchForfeitToConflict() throws Exception {
        when(matchService.forfeit("m1", "alice", null)).thenThrow(new IllegalStateException("over"));

        mvc.perform(post("/api/caro/matches/m1/forfeit").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"playerId\":\"alice\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value(409));
    }
}
