package com.carohub.gameservice.pool.infrastructure;

import com.carohub.gameservice.infrastructure.redis.RedisKeys;
import com.carohub.gameservice.infrastructure.redis.RedisOps;
import com.carohub.gameservice.pool.domain.PoolProperties;
import com.carohub.gameservice.pool.domain.model.ServerRecord;
import com.carohub.gameservice.pool.domain.repository.ServerRegistry;
import lombok.RequiredArgsConstructor;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * 服务器登记的 Redis 实现。
 * - caro:servers（Hash）：serverId -> ServerRecord JSON
 * - caro:server:{id}:health（String，TTL=心跳存活时间）：存在即健康
 * - caro:server:{id}:sessions（Set）：该服务器承载的对局 ID，基数即 activeSessions
 * 占位用 Lua 脚本，登记、健康与容量检查和 SADD 在同一步完成。
 */
@RequiredArgsConstructor
public class RedisServerRegistry implements ServerRegistry {

    private static final String HEALTHY = "healthy";

    /**
     * KEYS[1]=servers，KEYS[2]=health，KEYS[3]=sessions；ARGV[1]=serverId，ARGV[2]=sessionId。
     * 返回加入后的 SCARD，未登记 / 不健康 / 已满返回 -1
     */
    static final String TRY_ADD_SESSION_LUA = """
            local raw = redis.call('HGET', KEYS[1], ARGV[1])
            if not raw or redis.call('EXISTS', KEYS[2]) == 0 then
              return -1
            end
            if redis.call('SISMEMBER', KEYS[3], ARGV[2]) == 1 then
              return redis.call('SCARD', KEYS[3])
            end
            local cap = tonumber(cjson.decode(raw)['capacity'])
            if not cap or redis.call('SCARD', KEYS[3]) >= cap then
              return -1
            end
            redis.call('SADD', KEYS[3], ARGV[2])
            return redis.call('SCARD', KEYS[3])
            """;

    private final RedisOps ops;
    private final PoolProperties props;
    private final Clock clock;

    @Override
    public ServerRecord register(String serverId, String host, int port, int capacity, String region) {
        long now = clock.millis();
        ServerRecord existing = ops.hGet(RedisKeys.servers(), serverId, ServerRecord.class);
        long seq = existing != null ? existing.getRegistrationSeq() : ops.incrBy(RedisKeys.serverSeq(), 1);
        ServerRecord rec = ServerRecord.builder()
                .serverId(serverId)
                .host(host)
                .port(port)
                .capacity(capacity)
                .region(region)
                .registeredAt(existing != null ? existing.getRegisteredAt() : now)
                .lastHeartbeat(now)
                .registrationSeq(seq)
                .build();
        ops.hSet(RedisKeys.servers(), serverId, rec);
        ops.setString(RedisKeys.serverHealth(serverId), HEALTHY, ttl());
        return hydrate(rec);
    }

    @Override
    public boolean unregister(String serverId) {
        Long removed = ops.hDel(RedisKeys.servers(), serverId);
        ops.del(RedisKeys.serverHealth(serverId), RedisKeys.serverSessions(serverId));
        return removed != null && removed > 0;
    }

    @Override
    public boolean heartbeat(String serverId, Double cpuUsage, Double memoryUsage) {
        ServerRecord rec = ops.hGet(RedisKeys.servers(), serverId, ServerRecord.class);
        if (rec == null) {
            return false;
        }
        rec.setLastHeartbeat(clock.millis());
        if (cpuUsage != null) rec.setCpuUsage(cpuUsage);
        if (memoryUsage != null) rec.setMemoryUsage(memoryUsage);
        ops.hSet(RedisKeys.servers(), serverId, rec);
        ops.setString(RedisKeys.serverHealth(serverId), HEALTHY, ttl());
        return true;
    }

    @Override
    public Optional<ServerRecord> find(String serverId) {
        ServerRecord rec = ops.hGet(RedisKeys.servers(), serverId, ServerRecord.class);
        return Optional.ofNullable(rec).map(this::hydrate);
    }

    @Override
    public List<ServerRecord> findAll() {
        List<ServerRecord> out = new ArrayList<>();
        for (Object v : ops.hGetAll(RedisKeys.servers()).values()) {
            if (v instanceof ServerRecord rec) {
                out.add(hydrate(rec));
            }
        }
        out.sort(Comparator.comparingLong(ServerRecord::getRegistrationSeq));
        return out;
    }

    @Override
    public long tryAddSession(String serverId, String sessionId) {
        Long res = ops.eval(TRY_ADD_SESSION_LUA,
                List.of(RedisKeys.servers(), RedisKeys.serverHealth(serverId), RedisKeys.serverSessions(serverId)),
                List.of(serverId, sessionId), Long.class);
        return res == null ? -1 : res;
    }

    @Override
    public boolean removeSession(String serverId, String sessionId) {
        Long removed = ops.sRem(RedisKeys.serverSessions(serverId), sessionId);
        return removed != null && removed > 0;
    }

    /** 回填派生字段：对局数取 SCARD，健康取健康标记是否存在 */
    private ServerRecord hydrate(ServerRecord rec) {
        rec.setActiveSessions(ops.sCard(RedisKeys.serverSessions(rec.getServerId())));
        rec.setHealthy(ops.exists(RedisKeys.serverHealth(rec.getServerId())));
        return rec;
    }

    private Duration ttl() {
        return Duration.ofSeconds(props.getHeartbeatTtlSeconds());
    }
}
