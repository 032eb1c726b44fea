package com.carohub.gameservice.matchmaking.infrastructure;

import com.carohub.gameservice.infrastructure.redis.RedisOps;
import com.carohub.gameservice.infrastructure.store.StoreFailover;
import com.carohub.gameservice.infrastructure.store.StoreProperties;
import com.carohub.gameservice.matchmaking.domain.MatchmakingProperties;
import com.carohub.gameservice.matchmaking.domain.RangeExpansionPolicy;
import com.carohub.gameservice.matchmaking.domain.repository.WaitingPool;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * 等待池装配：Redis 为主，内存兜底。
 */
@Configuration
@EnableConfigurationProperties(MatchmakingProperties.class)
public class MatchmakingStoreConfig {

    @Bean
    public WaitingPool waitingPool(RedisOps ops, StoreProperties storeProps, Clock clock) {
        StoreFailover<WaitingPool> failover = new StoreFailover<>(
                "waiting-pool",
                new RedisWaitingPool(ops),
                new InMemoryWaitingPool(),
                clock,
                Duration.ofSeconds(storeProps.getFailoverCooldownSeconds()));
        return new FailoverWaitingPool(failover);
    }

    @Bean
    public RangeExpansionPolicy rangeExpansionPolicy(MatchmakingProperties props) {
        return new RangeExpansionPolicy(props);
    }
}
