package com.carohub.gameservice.infrastructure.scheduler;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * AI 模式下 AI 落子的“思考延迟”调度器，与维护任务的线程池分开，避免互相拖慢。
 */
@Configuration
public class AiSchedulerConfig {

	@Bean("aiScheduler")
	public ScheduledExecutorService aiScheduler() {
		int poolSize = Math.max(2, Runtime.getRuntime().availableProcessors() / 2);
		ScheduledThreadPoolExecutor exec = new ScheduledThreadPoolExecutor(poolSize, new ThreadFactory() {
			private final AtomicInteger idx = new AtomicInteger(1);
			@Override
			public Thread newThread(Runnable r) {
				Thread t = new Thread(r, "ai-delay-" + idx.getAndIncrement());
				t.setDaemon(true);
				return t;
			}
		});
		exec.setRemoveOnCancelPolicy(true);
		return exec;
	}
}
