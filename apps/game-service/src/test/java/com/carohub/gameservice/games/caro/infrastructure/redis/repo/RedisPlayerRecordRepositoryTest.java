package com.carohub.gameservice.games.caro.infrastructure.redis.repo;

import com.carohub.gameservice.games.caro.domain.enums.GameResult;
import com.carohub.gameservice.games.caro.domain.model.PlayerRecord;
import com.carohub.gameservice.games.caro.domain.rating.RatingProperties;
import com.carohub.gameservice.infrastructure.redis.RedisOps;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisPlayerRecordRepositoryTest {

    private static final List<String> KEYS = List.of("caro:player:alice", "caro:leaderboard");

    @Mock
    private RedisOps ops;

    private RedisPlayerRecordRepository repo;

    @BeforeEach
    void setUp() {
        repo = new RedisPlayerRecordRepository(ops, new RatingProperties());
    }

    @Test
    void shouldRecordWinThroughSingleScript() {
        when(ops.eval(RedisPlayerRecordRepository.RECORD_RESULT_LUA, KEYS,
                List.of("alice", "1200", "16", "wins", "1"), Long.class)).thenReturn(1216L);

        assertEquals(1216, repo.recordResult("alice", 16, GameResult.WIN, true));
    }

    @Test
    void shouldCountAiResultWithoutStreak() {
        when(ops.eval(RedisPlayerRecordRepository.RECORD_RESULT_LUA, KEYS,
                List.of("alice", "1200", "0", "draws", "0"), Long.class)).thenReturn(1200L);

        assertEquals(1200, repo.recordResult("alice", 0, GameResult.DRAW, false));
    }

    @Test
    void shouldFailWhenScriptReturnsNothing() {
        assertThrows(IllegalStateException.class, () -> repo.recordResult("alice", -16, GameResult.LOSS, true));
    }

    @Test
    void shouldNotResetExistingPlayerOnFindOrCreate() {
        when(ops.hSetIfAbsent("caro:player:alice", "rating", "1200")).thenReturn(false);
        when(ops.hGetAllStrings("caro:player:alice")).thenReturn(Map.of(
                "rating", "1316", "wins", "4", "losses", "1", "currentStreak", "3", "bestStreak", "3"));

        PlayerRecord rec = repo.findOrCreate("alice");

        assertEquals(1316, rec.getRating());
        assertEquals(4, rec.getWins());
        assertEquals(0, rec.getDraws());
        assertEquals(80.0, rec.getWinRate(), 1e-9);
        verify(ops, never()).zAdd(anyString(), anyString(), anyDouble());
    }

    @Test
    void shouldSeedLeaderboardOnlyWhenCreatingPlayer() {
        when(ops.hSetIfAbsent("caro:player:bob", "rating", "1200")).thenReturn(true);
        when(ops.hGetAllStrings("caro:player:bob")).thenReturn(Map.of("rating", "1200"));

        PlayerRecord rec = repo.findOrCreate("bob");

        assertEquals(1200, rec.getRating());
        verify(ops).zAdd("caro:leaderboard", "bob", 1200);
    }

    @Test
    void shouldCountOnlyStrictlyHigherRatingsForRank() {
        when(ops.zCount("caro:leaderboard", 1200.5, Double.POSITIVE_INFINITY)).thenReturn(2L);

        assertEquals(3L, repo.rankOf(1200));
    }

    @Test
    void shouldPageTopPlayersInRatingOrder() {
        when(ops.zRevRange("caro:leaderboard", 10, 12)).thenReturn(List.of("bob", "ghost", "alice"));
        when(ops.hGetAllStrings("caro:player:bob")).thenReturn(Map.of("rating", "1400", "wins", "9"));
        when(ops.hGetAllStrings("caro:player:ghost")).thenReturn(Map.of());
        when(ops.hGetAllStrings("caro:player:alice")).thenReturn(Map.of("rating", "1300", "wins", "2"));

        List<PlayerRecord> top = repo.top(10, 3);

        assertEquals(2, top.size());
        assertEquals("bob", top.get(0).getPlayerId());
        assertEquals("alice", top.get(1).getPlayerId());
        assertTrue(repo.top(0, 0).isEmpty());
    }
}
