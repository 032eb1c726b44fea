package com.carohub.gameservice.pool.infrastructure;

import com.carohub.gameservice.infrastructure.redis.RedisOps;
import com.carohub.gameservice.infrastructure.store.StoreFailover;
import com.carohub.gameservice.infrastructure.store.StoreProperties;
import com.carohub.gameservice.pool.domain.PoolProperties;
import com.carohub.gameservice.pool.domain.repository.ServerRegistry;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * 服务器登记存储装配：Redis 为主，内存兜底。
 */
@Configuration
@EnableConfigurationProperties(PoolProperties.class)
public class PoolStoreConfig {

    @Bean
    public ServerRegistry serverRegistry(RedisOps ops, PoolProperties props,
                                         StoreProperties storeProps, Clock clock) {
        StoreFailover<ServerRegistry> failover = new StoreFailover<>(
                "server-registry",
                new RedisServerRegistry(ops, props, clock),
                new InMemoryServerRegistry(props, clock),
                clock,
                Duration.ofSeconds(storeProps.getFailoverCooldownSeconds()));
        return new FailoverServerRegistry(failover);
    }
}
