package com.carohub.gameservice.games.caro.service.impl;

import com.carohub.gameservice.application.user.UserDirectoryService;
import com.carohub.gameservice.application.user.UserProfileView;
import com.carohub.gameservice.games.caro.application.MatchSettlement;
import com.carohub.gameservice.games.caro.domain.ai.CaroAI;
import com.carohub.gameservice.games.caro.domain.dto.MatchRecord;
import com.carohub.gameservice.games.caro.domain.dto.MatchRecordConverter;
import com.carohub.gameservice.games.caro.domain.enums.Cell;
import com.carohub.gameservice.games.caro.domain.enums.Difficulty;
import com.carohub.gameservice.games.caro.domain.enums.MatchStatus;
import com.carohub.gameservice.games.caro.domain.exception.InvalidMoveException;
import com.carohub.gameservice.games.caro.domain.exception.SessionNotFoundException;
import com.carohub.gameservice.games.caro.domain.model.EloChange;
import com.carohub.gameservice.games.caro.domain.model.MatchSession;
import com.carohub.gameservice.games.caro.domain.model.Participant;
import com.carohub.gameservice.games.caro.domain.model.PlayerRecord;
import com.carohub.gameservice.games.caro.domain.repository.MatchRecordRepository;
import com.carohub.gameservice.games.caro.domain.repository.PlayerRecordRepository;
import com.carohub.gameservice.games.caro.domain.rule.Outcome;
import com.carohub.gameservice.games.caro.service.LeaveResult;
import com.carohub.gameservice.games.caro.service.MatchProperties;
import com.carohub.gameservice.games.caro.service.MoveResult;
import com.carohub.gameservice.pool.domain.PoolUnavailableException;
import com.carohub.gameservice.pool.domain.model.ServerRecord;
import com.carohub.gameservice.pool.service.ServerPoolService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MatchServiceImplTest {

    @Mock
    private MatchRecordRepository matchRepo;
    @Mock
    private PlayerRecordRepository players;
    @Mock
    private MatchSettlement settlement;
    @Mock
    private ServerPoolService serverPool;
    @Mock
    private UserDirectoryService userDirectory;

    private MatchServiceImpl service;

    @BeforeEach
    void setUp() {
        service = new MatchServiceImpl(matchRepo, players, settlement, serverPool, userDirectory,
                new CaroAI(new Random(7)), new MatchProperties());
        lenient().when(players.findOrCreate(anyString()))
                .thenAnswer(inv -> PlayerRecord.fresh(inv.getArgument(0), 1200));
        lenient().when(userDirectory.getUserInfo("alice"))
                .thenReturn(UserProfileView.builder().userId("alice").nickname("Alice").build());
    }

    @Test
    void shouldCreateLocalMatchAndPersistSnapshot() {
        MatchSession s = service.createLocal();

        assertEquals(MatchStatus.IN_PROGRESS, s.getStatus());
        assertSame(s, service.get(s.getId()));
        verify(matchRepo).save(any(MatchRecord.class), eq(Duration.ofHours(48)));
    }

    @Test
    void shouldFallBackToPlayerIdWhenDirectoryHasNoProfile() {
        MatchSession s = service.createAiMatch("bob", null, Difficulty.EASY);

        assertEquals("bob", s.getBlack().username());
        assertEquals(Cell.WHITE, s.getAiSide());
        assertEquals(1200, s.getBlack().ratingBefore());
    }

    @Test
    void shouldPlaceOnlineMatchOnServerPool() {
        when(serverPool.assign(anyString(), isNull(), isNull()))
                .thenReturn(ServerRecord.builder().serverId("srv-1").build());

        MatchSession s = service.openOnline("alice");

        assertEquals("srv-1", s.getServerId());
        assertEquals("Alice", s.getBlack().username());
        assertEquals(MatchStatus.WAITING, s.getStatus());
    }

    @Test
    void shouldServeLocallyWhenPoolUnavailable() {
        when(serverPool.assign(anyString(), isNull(), isNull())).thenThrow(new PoolUnavailableException("none"));

        MatchSession s = service.startPairedMatch("m1",
                new Participant("alice", "Alice", 1300), new Participant("bob", "Bob", 1250));

        assertNull(s.getServerId());
        assertEquals(MatchStatus.IN_PROGRESS, s.getStatus());
        assertEquals(1300, s.getBlack().ratingBefore());
    }

    @Test
    void shouldSettleOnlyWhenMoveFinishesGame() {
        MatchSession s = service.createLocal();
        for (int i = 0; i < 4; i++) {
            service.makeMove(s.getId(), null, 0, i, null);
            service.makeMove(s.getId(), null, 1, i, null);
        }
        verify(settlement, never()).settle(any());

        MoveResult r = service.makeMove(s.getId(), null, 0, 4, null);

        assertTrue(r.gameOver());
        assertEquals(Outcome.BLACK_WIN, r.outcome());
        verify(settlement, times(1)).settle(s);
    }

    @Test
    void shouldResolveOnlineMoverFromPlayerId() {
        when(serverPool.assign(anyString(), isNull(), isNull())).thenThrow(new PoolUnavailableException("none"));
        MatchSession s = service.startPairedMatch("m1",
                new Participant("alice", "Alice", 1200), new Participant("bob", "Bob", 1200));

        InvalidMoveException e = assertThrows(InvalidMoveException.class,
                () -> service.makeMove("m1", "bob", 7, 7, null));
        assertEquals(InvalidMoveException.Reason.NOT_YOUR_TURN, e.getReason());

        assertThrows(IllegalArgumentException.class, () -> service.makeMove("m1", "mallory", 7, 7, null));
        assertThrows(InvalidMoveException.class, () -> service.makeMove("m1", "alice", 7, 7, Cell.WHITE));

        MoveResult ok = service.makeMove("m1", "alice", 7, 7, null);
        assertEquals(Cell.BLACK, ok.move().symbol());
        assertEquals(Cell.WHITE, s.getCurrentTurn());
    }

    @Test
    void shouldLetAiAnswerOnlyOnItsTurn() {
        MatchSession s = service.createAiMatch("alice", Cell.BLACK, Difficulty.MEDIUM);
        assertThrows(IllegalStateException.class, () -> service.aiMove(s.getId()));

        service.makeMove(s.getId(), "alice", 7, 7, null);
        MoveResult ai = service.aiMove(s.getId());

        assertEquals(Cell.WHITE, ai.move().symbol());
        assertEquals(2, s.getMoves().size());
        assertThrows(IllegalStateException.class, () -> service.aiMove(service.createLocal().getId()));
    }

    @Test
    void shouldSettleForfeitAndRejectSecondForfeit() {
        when(serverPool.assign(anyString(), isNull(), isNull())).thenThrow(new PoolUnavailableException("none"));
        service.startPairedMatch("m1", new Participant("alice", "Alice", 1200), new Participant("bob", "Bob", 1200));
        when(settlement.settle(any())).thenReturn(List.of(new EloChange("bob", "Bob", 1200, 1216, 16, 2, 1)));

        LeaveResult r = service.forfeit("m1", "alice", null);

        assertTrue(r.finishedHere());
        assertEquals(Outcome.WHITE_WIN, r.outcome());
        assertEquals(1, r.eloChanges().size());
        assertThrows(IllegalStateException.class, () -> service.forfeit("m1", "bob", null));
    }

    @Test
    void shouldRequireSideForLocalForfeit() {
        MatchSession s = service.createLocal();
        assertThrows(IllegalArgumentException.class, () -> service.forfeit(s.getId(), null, null));

        LeaveResult r = service.forfeit(s.getId(), null, Cell.WHITE);
        assertEquals(Outcome.BLACK_WIN, r.outcome());
    }

    @Test
    void shouldTreatDisconnectAsIdempotent() {
        when(serverPool.assign(anyString(), isNull(), isNull())).thenThrow(new PoolUnavailableException("none"));
        service.startPairedMatch("m1", new Participant("alice", "Alice", 1200), new Participant("bob", "Bob", 1200));

        LeaveResult first = service.disconnect("m1", "bob");
        LeaveResult second = service.disconnect("m1", "alice");
        LeaveResult stranger = service.disconnect("m1", "mallory");

        assertTrue(first.finishedHere());
        assertEquals(Outcome.BLACK_WIN, first.outcome());
        assertFalse(second.finishedHere());
        assertEquals(Outcome.BLACK_WIN, second.outcome());
        assertFalse(stranger.finishedHere());
        verify(settlement, times(1)).settle(any());
    }

    @Test
    void shouldReleaseServerWhenWaitingMatchIsAbandoned() {
        when(serverPool.assign(anyString(), isNull(), isNull()))
                .thenReturn(ServerRecord.builder().serverId("srv-1").build());
        MatchSession s = service.openOnline("alice");

        LeaveResult r = service.disconnect(s.getId(), "alice");

        assertEquals(MatchStatus.ABANDONED, r.status());
        assertFalse(r.finishedHere());
        verify(settlement).releaseServer(s);
        verify(settlement, never()).settle(any());
    }

    @Test
    void shouldRestoreMissingSessionFromSnapshot() {
        MatchSession original = MatchSession.local("m9");
        original.makeMove(7, 7, Cell.BLACK);
        when(matchRepo.get("m9")).thenReturn(Optional.of(MatchRecordConverter.toRecord(original)));

        MatchSession restored = service.get("m9");

        assertEquals(Cell.BLACK, restored.boardSnapshot().get(7, 7));
        assertSame(restored, service.get("m9"));
        verify(matchRepo, times(1)).get("m9");
    }

    @Test
    void shouldFailWhenSessionUnknownEverywhere() {
        when(matchRepo.get("ghost")).thenReturn(Optional.empty());
        assertThrows(SessionNotFoundException.class, () -> service.get("ghost"));
    }

    @Test
    void shouldKeepPlayingWhenSnapshotWriteFails() {
        doThrow(new QueryTimeoutException("redis down")).when(matchRepo).save(any(), any());

        MatchSession s = service.createLocal();
        MoveResult r = service.makeMove(s.getId(), null, 7, 7, null);

        assertEquals(1, r.move().seq());
    }

    @Test
    void shouldNotLetSlowSnapshotWriteOverwriteNewerOne() throws Exception {
        List<Integer> written = Collections.synchronizedList(new ArrayList<>());
        CountDownLatch firstMoveWriting = new CountDownLatch(1);
        doAnswer(inv -> {
            MatchRecord rec = inv.getArgument(0);
            if (rec.getMoves().size() == 1) {
                firstMoveWriting.countDown();
                // 第一步的快照写得慢，第二步在此期间到达
                Thread.sleep(200);
            }
            written.add(rec.getMoves().size());
            return null;
        }).when(matchRepo).save(any(), any());
        MatchSession s = service.createLocal();

        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<MoveResult> first = pool.submit(() -> service.makeMove(s.getId(), null, 7, 7, null));
            assertTrue(firstMoveWriting.await(2, TimeUnit.SECONDS));
            service.makeMove(s.getId(), null, 7, 8, null);
            first.get(2, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        assertEquals(List.of(0, 1, 2), written);
    }

    @Test
    void shouldKeepFinishedSnapshotForHistory() {
        MatchSession s = service.createLocal();
        service.forfeit(s.getId(), null, Cell.BLACK);

        verify(matchRepo).save(any(MatchRecord.class), eq(Duration.ofDays(30)));
    }

    @Test
    void shouldEvictOnlyLongFinishedSessions() {
        MatchSession live = service.createLocal();
        MatchSession done = service.createLocal();
        service.forfeit(done.getId(), null, Cell.BLACK);

        // 刚结束的不移出
        assertEquals(0, service.evictFinished());
        assertSame(live, service.get(live.getId()));
    }
}
