package com.carohub.gameservice.infrastructure.store;

import com.carohub.gameservice.matchmaking.domain.model.QueueEntry;
import com.carohub.gameservice.matchmaking.domain.model.QueueStatus;
import com.carohub.gameservice.matchmaking.domain.repository.WaitingPool;
import com.carohub.gameservice.matchmaking.infrastructure.FailoverWaitingPool;
import com.carohub.gameservice.matchmaking.infrastructure.InMemoryWaitingPool;
import com.carohub.gameservice.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StoreFailoverTest {

    @Mock
    private WaitingPool redisPool;

    private InMemoryWaitingPool memoryPool;
    private MutableClock clock;
    private StoreFailover<WaitingPool> failover;

    @BeforeEach
    void setUp() {
        memoryPool = new InMemoryWaitingPool();
        clock = MutableClock.startingAt(1_700_000_000_000L);
        failover = new StoreFailover<>("test", redisPool, memoryPool, clock, Duration.ofSeconds(30));
    }

    @Test
    void shouldUsePrimaryWhileHealthy() {
        when(redisPool.waitingCount()).thenReturn(7L);

        assertEquals(7L, failover.call(WaitingPool::waitingCount));
        assertFalse(failover.isDegraded());
    }

    @Test
    void shouldServeFromFallbackWhenPrimaryFails() {
        doThrow(new QueryTimeoutException("redis down")).when(redisPool).enqueue(any());
        FailoverWaitingPool pool = new FailoverWaitingPool(failover);

        pool.enqueue(QueueEntry.builder().playerId("alice").rating(1200).status(QueueStatus.WAITING).build());

        assertTrue(failover.isDegraded());
        assertEquals(1L, pool.waitingCount());
        assertTrue(pool.get("alice").isPresent());
        verify(redisPool, times(1)).enqueue(any());
    }

    @Test
    void shouldRetryPrimaryAfterCooldown() {
        when(redisPool.waitingCount()).thenThrow(new QueryTimeoutException("redis down")).thenReturn(3L);

        assertEquals(0L, failover.call(WaitingPool::waitingCount));
        clock.advanceSeconds(29);
        assertEquals(0L, failover.call(WaitingPool::waitingCount));
        verify(redisPool, times(1)).waitingCount();

        clock.advanceSeconds(1);
        assertEquals(3L, failover.call(WaitingPool::waitingCount));
        assertFalse(failover.isDegraded());
    }

    @Test
    void shouldNotSwallowNonStoreErrors() {
        when(redisPool.waitingCount()).thenThrow(new IllegalStateException("bug"));

        assertThrows(IllegalStateException.class, () -> failover.call(WaitingPool::waitingCount));
        assertFalse(failover.isDegraded());
    }
}
