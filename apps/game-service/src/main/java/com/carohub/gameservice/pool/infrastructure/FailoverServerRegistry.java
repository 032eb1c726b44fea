package com.carohub.gameservice.pool.infrastructure;

import com.carohub.gameservice.infrastructure.store.StoreFailover;
import com.carohub.gameservice.pool.domain.model.ServerRecord;
import com.carohub.gameservice.pool.domain.repository.ServerRegistry;
import lombok.RequiredArgsConstructor;

import java.util.List;
import java.util.Optional;

/**
 * 带降级的服务器登记：Redis 出错时由内存实现顶上。
 */
@RequiredArgsConstructor
public class FailoverServerRegistry implements ServerRegistry {

    private final StoreFailover<ServerRegistry> failover;

    @Override
    public ServerRecord register(String serverId, String host, int port, int capacity, String region) {
        return failover.call(r -> r.register(serverId, host, port, capacity, region));
    }

    @Override
    public boolean unregister(String serverId) {
        return failover.call(r -> r.unregister(serverId));
    }

    @Override
    public boolean heartbeat(String serverId, Double cpuUsage, Double memoryUsage) {
        return failover.call(r -> r.heartbeat(serverId, cpuUsage, memoryUsage));
    }

    @Override
    public Optional<ServerRecord> find(String serverId) {
        return failover.call(r -> r.find(serverId));
    }

    @Override
    public List<ServerRecord> findAll() {
        return failover.call(ServerRegistry::findAll);
    }

    @Override
    public long tryAddSession(String serverId, String sessionId) {
        return failover.call(r -> r.tryAddSession(serverId, sessionId));
    }

    @Override
    public boolean removeSession(String serverId, String sessionId) {
        return failover.call(r -> r.removeSession(serverId, sessionId));
    }
}
