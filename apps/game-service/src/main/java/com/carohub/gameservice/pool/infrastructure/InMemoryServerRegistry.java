package com.carohub.gameservice.pool.infrastructure;

import com.carohub.gameservice.pool.domain.PoolProperties;
import com.carohub.gameservice.pool.domain.model.ServerRecord;
import com.carohub.gameservice.pool.domain.repository.ServerRegistry;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 服务器登记的进程内实现（Redis 不可用时的降级存储，也用于测试）。
 * 单个服务器的更新通过 ConcurrentHashMap.compute 保证原子；对局集合的增删也在记录的 compute 内完成，
 * 注销与占位因此不会交错。
 */
public class InMemoryServerRegistry implements ServerRegistry {

    private final Map<String, ServerRecord> records = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> sessions = new ConcurrentHashMap<>();
    private final AtomicLong seq = new AtomicLong();
    private final PoolProperties props;
    private final Clock clock;

    public InMemoryServerRegistry(PoolProperties props, Clock clock) {
        this.props = props;
        this.clock = clock;
    }

    @Override
    public ServerRecord register(String serverId, String host, int port, int capacity, String region) {
        long now = clock.millis();
        ServerRecord rec = records.compute(serverId, (id, existing) -> ServerRecord.builder()
                .serverId(id)
                .host(host)
                .port(port)
                .capacity(capacity)
                .region(region)
                .registeredAt(existing != null ? existing.getRegisteredAt() : now)
                .lastHeartbeat(now)
                .registrationSeq(existing != null ? existing.getRegistrationSeq() : seq.incrementAndGet())
                .build());
        return hydrate(rec);
    }

    @Override
    public boolean unregister(String serverId) {
        AtomicBoolean found = new AtomicBoolean(false);
        records.computeIfPresent(serverId, (id, rec) -> {
            found.set(true);
            sessions.remove(id);
            return null;
        });
        return found.get();
    }

    @Override
    public boolean heartbeat(String serverId, Double cpuUsage, Double memoryUsage) {
        AtomicBoolean found = new AtomicBoolean(false);
        records.computeIfPresent(serverId, (id, rec) -> {
            found.set(true);
            ServerRecord.ServerRecordBuilder b = rec.toBuilder().lastHeartbeat(clock.millis());
            if (cpuUsage != null) b.cpuUsage(cpuUsage);
            if (memoryUsage != null) b.memoryUsage(memoryUsage);
            return b.build();
        });
        return found.get();
    }

    @Override
    public Optional<ServerRecord> find(String serverId) {
        return Optional.ofNullable(records.get(serverId)).map(this::hydrate);
    }

    @Override
    public List<ServerRecord> findAll() {
        return records.values().stream()
                .map(this::hydrate)
                .sorted(Comparator.comparingLong(ServerRecord::getRegistrationSeq))
                .toList();
    }

    @Override
    public long tryAddSession(String serverId, String sessionId) {
        AtomicLong active = new AtomicLong(-1);
        records.computeIfPresent(serverId, (id, rec) -> {
            Set<String> set = sessions.computeIfAbsent(id, k -> ConcurrentHashMap.newKeySet());
            if (set.contains(sessionId)) {
                active.set(set.size());
            } else if (isFresh(rec) && set.size() < rec.getCapacity()) {
                set.add(sessionId);
                active.set(set.size());
            }
            return rec;
        });
        return active.get();
    }

    @Override
    public boolean removeSession(String serverId, String sessionId) {
        Set<String> set = sessions.get(serverId);
        return set != null && set.remove(sessionId);
    }

    /** 返回副本，回填对局数与健康状态 */
    private ServerRecord hydrate(ServerRecord rec) {
        Set<String> set = sessions.get(rec.getServerId());
        return rec.toBuilder()
                .activeSessions(set == null ? 0 : set.size())
                .healthy(isFresh(rec))
                .build();
    }

    private boolean isFresh(ServerRecord rec) {
        return clock.millis() - rec.getLastHeartbeat() < props.getHeartbeatTtlSeconds() * 1000L;
    }
}
