package com.carohub.gameservice.infrastructure.scheduler;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 维护任务线程池：队列过期清理、宕机服务器清理、已结束对局移出内存。
 *
 * 线程命名为 maintenance-N，守护线程；队列满时丢弃（下个周期会再跑）。
 */
@Configuration
public class MaintenanceSchedulerConfig {

    @Value("${scheduler.maintenance.corePoolSize:1}")
    private int corePoolSize;

    @Bean(name = "maintenanceScheduler", destroyMethod = "shutdownNow")
    public ScheduledThreadPoolExecutor maintenanceScheduler() {
        ThreadFactory tf = new ThreadFactory() {
            private final AtomicInteger seq = new AtomicInteger(1);
            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, "maintenance-" + seq.getAndIncrement());
                t.setDaemon(true);
                return t;
            }
        };
        ScheduledThreadPoolExecutor executor =
                new ScheduledThreadPoolExecutor(corePoolSize, tf, new ThreadPoolExecutor.DiscardPolicy());
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }
}
