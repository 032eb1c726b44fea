package com.carohub.gameservice.platform.maintenance;

import com.carohub.gameservice.games.caro.service.MatchService;
import com.carohub.gameservice.matchmaking.domain.MatchmakingProperties;
import com.carohub.gameservice.matchmaking.service.MatchmakingService;
import com.carohub.gameservice.pool.domain.PoolProperties;
import com.carohub.gameservice.pool.service.ServerPoolService;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * 周期维护任务
 * ----------------------------------------
 * - 匹配队列：把长时间未轮询的等待条目置为过期；
 * - 服务器池：清理心跳超时的服务器；
 * - 对局：把结束已久的对局移出内存（Redis 快照仍在）。
 * 单次任务失败只记日志，不影响下一个周期。
 * ----------------------------------------
 */
@Slf4j
@Component
public class MaintenanceTasks {

    /** 对局内存清理周期（秒） */
    private static final long EVICT_INTERVAL_SECONDS = 60;

    private final ScheduledThreadPoolExecutor scheduler;
    private final MatchmakingService matchmaking;
    private final ServerPoolService serverPool;
    private final MatchService matchService;
    private final MatchmakingProperties mmProps;
    private final PoolProperties poolProps;

    private final List<ScheduledFuture<?>> futures = new ArrayList<>();

    public MaintenanceTasks(@Qualifier("maintenanceScheduler") ScheduledThreadPoolExecutor scheduler,
                            MatchmakingService matchmaking,
                            ServerPoolService serverPool,
                            MatchService matchService,
                            MatchmakingProperties mmProps,
                            PoolProperties poolProps) {
        this.scheduler = scheduler;
        this.matchmaking = matchmaking;
        this.serverPool = serverPool;
        this.matchService = matchService;
        this.mmProps = mmProps;
        this.poolProps = poolProps;
    }

    @PostConstruct
    public void start() {
        schedule("queue-cleanup", mmProps.getCleanupIntervalSeconds(), this::cleanupQueue);
        schedule("pool-sweep", poolProps.getSweepIntervalSeconds(), this::sweepServers);
        schedule("match-evict", EVICT_INTERVAL_SECONDS, this::evictMatches);
        log.info("维护任务已启动: queueCleanup={}s, poolSweep={}s, matchEvict={}s",
                mmProps.getCleanupIntervalSeconds(), poolProps.getSweepIntervalSeconds(), EVICT_INTERVAL_SECONDS);
    }

    @PreDestroy
    public void stop() {
        futures.forEach(f -> f.cancel(false));
        futures.clear();
    }

    void cleanupQueue() {
        int expired = matchmaking.cleanupExpired(mmProps.getEntryTtlSeconds());
        if (expired > 0) {
            log.info("匹配队列过期清理: {} 条", expired);
        }
    }

    void sweepServers() {
        serverPool.sweepDead();
    }

    void evictMatches() {
        matchService.evictFinished();
    }

    private void schedule(String name, long periodSeconds, Runnable task) {
        futures.add(scheduler.scheduleWithFixedDelay(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.warn("维护任务执行失败: task={}, err={}", name, e.toString(), e);
            }
        }, periodSeconds, periodSeconds, TimeUnit.SECONDS));
    }
}
