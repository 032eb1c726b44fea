package com.carohub.gameservice.platform.maintenance;

import com.carohub.gameservice.games.caro.service.MatchService;
import com.carohub.gameservice.matchmaking.domain.MatchmakingProperties;
import com.carohub.gameservice.matchmaking.service.MatchmakingService;
import com.carohub.gameservice.pool.domain.PoolProperties;
import com.carohub.gameservice.pool.service.ServerPoolService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.concurrent.ScheduledThreadPoolExecutor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class MaintenanceTasksTest {

    @Mock
    private MatchmakingService matchmaking;
    @Mock
    private ServerPoolService serverPool;
    @Mock
    private MatchService matchService;

    private ScheduledThreadPoolExecutor scheduler;
    private MaintenanceTasks tasks;

    @BeforeEach
    void setUp() {
        scheduler = new ScheduledThreadPoolExecutor(1);
        scheduler.setRemoveOnCancelPolicy(true);
        tasks = new MaintenanceTasks(scheduler, matchmaking, serverPool, matchService,
                new MatchmakingProperties(), new PoolProperties());
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    @Test
    void shouldExpireQueueEntriesByConfiguredTtl() {
        tasks.cleanupQueue();
        verify(matchmaking).cleanupExpired(300);
    }

    @Test
    void shouldDelegateSweepAndEviction() {
        tasks.sweepServers();
        tasks.evictMatches();

        verify(serverPool).sweepDead();
        verify(matchService).evictFinished();
    }

    @Test
    void shouldScheduleAndCancelAllTasks() {
        tasks.start();
        assertEquals(3, scheduler.getQueue().size());

        tasks.stop();
        assertTrue(scheduler.getQueue().isEmpty());
    }
}
