package com.carohub.gameservice.matchmaking.service.impl;

import com.carohub.gameservice.application.user.UserDirectoryService;
import com.carohub.gameservice.games.caro.domain.model.Participant;
import com.carohub.gameservice.games.caro.domain.model.PlayerRecord;
import com.carohub.gameservice.games.caro.domain.rating.RatingProperties;
import com.carohub.gameservice.games.caro.domain.repository.PlayerRecordRepository;
import com.carohub.gameservice.games.caro.service.MatchService;
import com.carohub.gameservice.matchmaking.domain.MatchmakingProperties;
import com.carohub.gameservice.matchmaking.domain.RangeExpansionPolicy;
import com.carohub.gameservice.matchmaking.domain.model.QueueEntry;
import com.carohub.gameservice.matchmaking.domain.model.QueueStats;
import com.carohub.gameservice.matchmaking.domain.model.QueueStatus;
import com.carohub.gameservice.matchmaking.domain.model.SearchRange;
import com.carohub.gameservice.matchmaking.infrastructure.InMemoryWaitingPool;
import com.carohub.gameservice.matchmaking.service.MatchmakingResult;
import com.carohub.gameservice.matchmaking.service.MatchmakingStatus;
import com.carohub.gameservice.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MatchmakingServiceImplTest {

    private static final long T0 = 1_700_000_000_000L;

    @Mock
    private MatchService matchService;
    @Mock
    private PlayerRecordRepository players;
    @Mock
    private UserDirectoryService userDirectory;

    private InMemoryWaitingPool pool;
    private MutableClock clock;
    private MatchmakingServiceImpl service;

    @BeforeEach
    void setUp() {
        pool = new InMemoryWaitingPool();
        clock = MutableClock.startingAt(T0);
        MatchmakingProperties props = new MatchmakingProperties();
        service = new MatchmakingServiceImpl(pool, new RangeExpansionPolicy(props), props, matchService,
                players, new RatingProperties(), userDirectory, clock, new Random(42));
    }

    @Test
    void shouldMatchPlayersWithinBaseRangeImmediately() {
        MatchmakingResult first = service.join("alice", 1200);
        MatchmakingResult second = service.join("bob", 1290);

        assertEquals(MatchmakingStatus.SEARCHING, first.status());
        assertEquals(MatchmakingStatus.MATCHED, second.status());
        assertEquals("alice", second.opponent().playerId());
        assertEquals(1200, second.opponent().rating());

        MatchmakingResult polled = service.status("alice");
        assertEquals(MatchmakingStatus.MATCHED, polled.status());
        assertEquals(second.matchId(), polled.matchId());
        assertEquals("bob", polled.opponent().playerId());
        verify(matchService, times(1)).startPairedMatch(anyString(), any(), any());
    }

    @Test
    void shouldWidenRangeUntilDistantPlayersMeet() {
        service.join("alice", 1200);
        MatchmakingResult bob = service.join("bob", 1400);
        assertEquals(MatchmakingStatus.SEARCHING, bob.status());
        assertEquals(new SearchRange(1300, 1500), bob.eloRange());

        clock.advanceSeconds(99);
        MatchmakingResult early = service.status("alice");
        assertEquals(MatchmakingStatus.SEARCHING, early.status());
        assertEquals(new SearchRange(1010, 1390), early.eloRange());

        clock.advanceSeconds(1);
        MatchmakingResult matched = service.status("alice");
        assertEquals(MatchmakingStatus.MATCHED, matched.status());
        assertEquals("bob", matched.opponent().playerId());
        assertEquals(MatchmakingStatus.MATCHED, service.status("bob").status());
    }

    @Test
    void shouldPreferLongestWaitingOpponent() {
        pool.enqueue(waiting("second", 1200, T0 - 500));
        pool.enqueue(waiting("first", 1250, T0 - 1000));
        pool.enqueue(waiting("tied", 1150, T0 - 1000));

        MatchmakingResult r = service.join("me", 1200);

        // 加入时间相同按 playerId
        assertEquals("first", r.opponent().playerId());
        assertEquals(2L, pool.waitingCount());
    }

    @Test
    void shouldSeatBothPlayersWithTheirQueuedRatings() {
        service.join("alice", 1200);
        service.join("bob", 1250);

        ArgumentCaptor<Participant> black = ArgumentCaptor.forClass(Participant.class);
        ArgumentCaptor<Participant> white = ArgumentCaptor.forClass(Participant.class);
        verify(matchService).startPairedMatch(anyString(), black.capture(), white.capture());
        Set<String> ids = Set.of(black.getValue().playerId(), white.getValue().playerId());
        assertEquals(Set.of("alice", "bob"), ids);
        int sum = black.getValue().ratingBefore() + white.getValue().ratingBefore();
        assertEquals(2450, sum);
    }

    @Test
    void shouldNeverPairAnyoneTwiceUnderConcurrentJoins() throws Exception {
        int n = 12;
        ExecutorService exec = Executors.newFixedThreadPool(n);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<MatchmakingResult>> futures = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            String id = "p" + i;
            futures.add(exec.submit(() -> {
                start.await();
                return service.join(id, 1200);
            }));
        }
        start.countDown();
        for (Future<MatchmakingResult> f : futures) {
            f.get(10, TimeUnit.SECONDS);
        }
        exec.shutdownNow();

        // 还在等待的人再轮询一次，把剩下的配完
        for (int i = 0; i < n; i++) {
            service.status("p" + i);
        }

        Set<String> matchIds = new HashSet<>();
        for (QueueEntry e : pool.allEntries()) {
            assertEquals(QueueStatus.MATCHED, e.getStatus(), e.getPlayerId());
            QueueEntry partner = pool.get(e.getMatchedWith()).orElseThrow();
            assertEquals(e.getPlayerId(), partner.getMatchedWith());
            assertEquals(e.getMatchId(), partner.getMatchId());
            matchIds.add(e.getMatchId());
        }
        assertEquals(n / 2, matchIds.size());
        assertEquals(0, pool.waitingCount());
        verify(matchService, times(n / 2)).startPairedMatch(anyString(), any(), any());
        assertEquals((long) n / 2, service.stats().totalMatches());
    }

    @Test
    void shouldKeepMatchWhenPairedBetweenPollReadAndRefresh() {
        MatchmakingProperties props = new MatchmakingProperties();
        List<MatchmakingServiceImpl> holder = new ArrayList<>();
        List<MatchmakingResult> bobJoin = new ArrayList<>();
        InMemoryWaitingPool racingPool = new InMemoryWaitingPool() {
            @Override
            public synchronized boolean refreshIfWaiting(QueueEntry entry) {
                // 轮询读出 alice 之后、刷新之前，bob 加入并与她配对
                if (bobJoin.isEmpty() && "alice".equals(entry.getPlayerId())) {
                    bobJoin.add(holder.get(0).join("bob", 1210));
                }
                return super.refreshIfWaiting(entry);
            }
        };
        MatchmakingServiceImpl racing = new MatchmakingServiceImpl(racingPool, new RangeExpansionPolicy(props), props,
                matchService, players, new RatingProperties(), userDirectory, clock, new Random(42));
        holder.add(racing);
        racingPool.enqueue(waiting("alice", 1200, T0));

        MatchmakingResult firstPoll = racing.status("alice");

        assertEquals(MatchmakingStatus.MATCHED, bobJoin.get(0).status());
        assertEquals(MatchmakingStatus.MATCHED, firstPoll.status());
        assertEquals(bobJoin.get(0).matchId(), firstPoll.matchId());
        assertEquals(MatchmakingStatus.MATCHED, racing.status("alice").status());
        QueueEntry alice = racingPool.get("alice").orElseThrow();
        assertEquals(QueueStatus.MATCHED, alice.getStatus());
        assertEquals("bob", alice.getMatchedWith());
    }

    @Test
    void shouldRequeueBothWhenMatchCreationFails() {
        when(matchService.startPairedMatch(anyString(), any(), any())).thenThrow(new IllegalStateException("boom"));
        service.join("alice", 1200);

        MatchmakingResult r = service.join("bob", 1200);

        assertEquals(MatchmakingStatus.SEARCHING, r.status());
        assertEquals(2, pool.waitingCount());
        assertEquals(QueueStatus.WAITING, pool.get("alice").orElseThrow().getStatus());
        assertEquals(0L, service.stats().totalMatches());
    }

    @Test
    void shouldReportOneBasedQueuePosition() {
        service.join("high", 1800);
        MatchmakingResult low = service.join("low", 1000);

        assertEquals(2L, low.queuePosition());
        assertEquals(2L, low.queueSize());
        assertEquals(1L, service.status("high").queuePosition());
    }

    @Test
    void shouldLeaveIdempotently() {
        service.join("alice", 1200);

        assertTrue(service.leave("alice"));
        assertFalse(service.leave("alice"));
        assertFalse(service.leave("nobody"));

        assertEquals(MatchmakingStatus.NOT_IN_QUEUE, service.status("alice").status());
        QueueStats stats = service.stats();
        assertEquals(1L, stats.totalLeaves());
        assertEquals(0L, stats.currentSize());
    }

    @Test
    void shouldRejectRatingOutsideBounds() {
        assertThrows(IllegalArgumentException.class, () -> service.join("alice", -1));
        assertThrows(IllegalArgumentException.class, () -> service.join("alice", 5001));
        assertThrows(IllegalArgumentException.class, () -> service.join(" ", 1200));
        assertEquals(0, pool.waitingCount());
    }

    @Test
    void shouldUseStoredRatingWhenNoneGiven() {
        when(players.findOrCreate("alice")).thenReturn(PlayerRecord.fresh("alice", 1333));

        service.join("alice", null);

        assertEquals(1333, pool.get("alice").orElseThrow().getRating());
    }

    @Test
    void shouldFallBackToInitialRatingWhenStoreFails() {
        when(players.findOrCreate("alice")).thenThrow(new QueryTimeoutException("redis down"));

        service.join("alice", null);

        assertEquals(1200, pool.get("alice").orElseThrow().getRating());
    }

    @Test
    void shouldExpireSilentWaitersAndKeepPollingOnes() {
        service.join("silent", 1000);
        service.join("active", 1800);

        clock.advanceSeconds(200);
        service.status("active");
        clock.advanceSeconds(101);

        assertEquals(1, service.cleanupExpired(300));
        assertEquals(QueueStatus.EXPIRED, pool.get("silent").orElseThrow().getStatus());
        assertEquals(MatchmakingStatus.NOT_IN_QUEUE, service.status("silent").status());
        assertEquals(MatchmakingStatus.SEARCHING, service.status("active").status());

        clock.advanceSeconds(301);
        service.cleanupExpired(300);
        assertTrue(pool.get("silent").isEmpty());
    }

    @Test
    void shouldSkipStaleCandidates() {
        pool.enqueue(waiting("ghost", 1200, T0 - 400_000));

        MatchmakingResult r = service.join("alice", 1200);

        assertEquals(MatchmakingStatus.SEARCHING, r.status());
        verify(matchService, never()).startPairedMatch(anyString(), any(), any());
    }

    @Test
    void shouldBucketWaitingPlayersByRating() {
        service.join("a", 900);
        service.join("b", 1250);
        service.join("c", 1900);

        QueueStats stats = service.stats();
        Map<String, Long> dist = stats.ratingDistribution();

        assertEquals(List.of("below_1000", "1000_1199", "1200_1399", "1400_1599", "1600_1799", "1800_plus"),
                new ArrayList<>(dist.keySet()));
        assertEquals(1L, dist.get("below_1000"));
        assertEquals(0L, dist.get("1000_1199"));
        assertEquals(1L, dist.get("1200_1399"));
        assertEquals(1L, dist.get("1800_plus"));
        assertEquals(3L, stats.totalJoins());
        assertEquals(3L, stats.currentSize());
    }

    @Test
    void shouldMapBucketBoundaries() {
        assertEquals("below_1000", MatchmakingServiceImpl.bucketOf(999));
        assertEquals("1000_1199", MatchmakingServiceImpl.bucketOf(1000));
        assertEquals("1600_1799", MatchmakingServiceImpl.bucketOf(1799));
        assertEquals("1800_plus", MatchmakingServiceImpl.bucketOf(1800));
    }

    @Test
    void shouldReportNotInQueueForUnknownPlayer() {
        MatchmakingResult r = service.status("nobody");
        assertEquals(MatchmakingStatus.NOT_IN_QUEUE, r.status());
        assertNull(r.matchId());
        assertNotNull(service.stats());
    }

    private static QueueEntry waiting(String id, int rating, long joinedAt) {
        return QueueEntry.builder().playerId(id).username(id).rating(rating)
                .joinedAt(joinedAt).lastActiveAt(joinedAt).status(QueueStatus.WAITING).build();
    }
}
