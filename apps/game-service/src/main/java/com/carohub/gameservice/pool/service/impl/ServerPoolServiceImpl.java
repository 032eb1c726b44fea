package com.carohub.gameservice.pool.service.impl;

import com.carohub.gameservice.games.caro.domain.constants.GameMessages;
import com.carohub.gameservice.pool.domain.PoolProperties;
import com.carohub.gameservice.pool.domain.PoolUnavailableException;
import com.carohub.gameservice.pool.domain.model.PoolStats;
import com.carohub.gameservice.pool.domain.model.PoolStats.RegionStats;
import com.carohub.gameservice.pool.domain.model.ServerRecord;
import com.carohub.gameservice.pool.domain.repository.ServerRegistry;
import com.carohub.gameservice.pool.service.ServerPoolService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

@Slf4j
@Service
@RequiredArgsConstructor
public class ServerPoolServiceImpl implements ServerPoolService {

    /** 占位竞争失败后的重新选择次数 */
    static final int ASSIGN_ATTEMPTS = 3;

    private final ServerRegistry registry;
    private final PoolProperties props;

    @Override
    public ServerRecord register(String serverId, String host, int port, Integer capacity, String region) {
        if (StringUtils.isBlank(serverId)) {
            throw new IllegalArgumentException("serverId 不能为空");
        }
        if (StringUtils.isBlank(host)) {
            throw new IllegalArgumentException("host 不能为空");
        }
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("端口不合法: " + port);
        }
        int cap = capacity == null ? props.getDefaultCapacity() : capacity;
        if (cap <= 0) {
            throw new IllegalArgumentException("容量必须为正数: " + cap);
        }
        String reg = StringUtils.defaultIfBlank(region, props.getDefaultRegion());
        ServerRecord rec = registry.register(serverId, host, port, cap, reg);
        log.info("服务器已登记: serverId={}, addr={}:{}, capacity={}, region={}", serverId, host, port, cap, reg);
        return rec;
    }

    @Override
    public boolean unregister(String serverId) {
        boolean removed = registry.unregister(serverId);
        if (removed) {
            log.info("服务器已注销: serverId={}", serverId);
        }
        return removed;
    }

    @Override
    public boolean heartbeat(String serverId, Double cpuUsage, Double memoryUsage) {
        boolean ok = registry.heartbeat(serverId, cpuUsage, memoryUsage);
        if (ok) {
            log.debug("心跳: serverId={}, cpu={}, mem={}", serverId, cpuUsage, memoryUsage);
        } else {
            log.warn("未登记服务器的心跳: serverId={}", serverId);
        }
        return ok;
    }

    @Override
    public Optional<ServerRecord> selectBestServer(String region, int minFreeCapacity) {
        return registry.findAll().stream()
                .filter(ServerRecord::isHealthy)
                .filter(s -> StringUtils.isBlank(region) || region.equals(s.getRegion()))
                .filter(s -> s.getFreeCapacity() >= minFreeCapacity)
                .min(Comparator.comparingLong(ServerRecord::getActiveSessions)
                        .thenComparingLong(ServerRecord::getRegistrationSeq));
    }

    /**
     * 选择与占位分两步：选出的快照可能已过时，占位由登记存储原子校验，失败则重新选择。
     */
    @Override
    public ServerRecord assign(String sessionId, String serverId, String region) {
        if (StringUtils.isBlank(sessionId)) {
            throw new IllegalArgumentException("sessionId 不能为空");
        }
        if (StringUtils.isNotBlank(serverId)) {
            ServerRecord target = registry.find(serverId)
                    .filter(ServerRecord::isHealthy)
                    .filter(s -> s.getFreeCapacity() >= 1)
                    .orElseThrow(() -> new PoolUnavailableException(GameMessages.formatServerNotAvailable(serverId)));
            if (!reserve(target, sessionId)) {
                throw new PoolUnavailableException(GameMessages.formatServerNotAvailable(serverId));
            }
            return target;
        }
        for (int attempt = 1; attempt <= ASSIGN_ATTEMPTS; attempt++) {
            Optional<ServerRecord> best = selectBestServer(region, 1);
            if (best.isEmpty()) {
                break;
            }
            if (reserve(best.get(), sessionId)) {
                return best.get();
            }
            log.debug("占位失败，重新选择服务器: sessionId={}, serverId={}, 第 {} 次",
                    sessionId, best.get().getServerId(), attempt);
        }
        log.warn("无可用服务器: sessionId={}, region={}", sessionId, region);
        throw new PoolUnavailableException(GameMessages.NO_SERVER_AVAILABLE);
    }

    private boolean reserve(ServerRecord target, String sessionId) {
        long active = registry.tryAddSession(target.getServerId(), sessionId);
        if (active < 0) {
            return false;
        }
        target.setActiveSessions(active);
        log.info("对局已分配: sessionId={}, serverId={}, load={}/{}",
                sessionId, target.getServerId(), active, target.getCapacity());
        return true;
    }

    @Override
    public boolean release(String sessionId, String serverId) {
        if (StringUtils.isAnyBlank(sessionId, serverId)) {
            return false;
        }
        boolean removed = registry.removeSession(serverId, sessionId);
        if (removed) {
            log.info("对局已释放: sessionId={}, serverId={}", sessionId, serverId);
        } else {
            log.debug("对局不在该服务器上: sessionId={}, serverId={}", sessionId, serverId);
        }
        return removed;
    }

    @Override
    public int sweepDead() {
        int removed = 0;
        for (ServerRecord s : registry.findAll()) {
            if (!s.isHealthy() && registry.unregister(s.getServerId())) {
                removed++;
                log.warn("清理宕机服务器: serverId={}, lastHeartbeat={}", s.getServerId(), s.getLastHeartbeat());
            }
        }
        if (removed > 0) {
            log.info("本轮共清理 {} 台宕机服务器", removed);
        }
        return removed;
    }

    @Override
    public PoolStats stats() {
        List<ServerRecord> all = registry.findAll();
        int healthy = 0;
        long capacity = 0, active = 0;
        Map<String, RegionStats> regions = new TreeMap<>();
        for (ServerRecord s : all) {
            if (s.isHealthy()) healthy++;
            capacity += s.getCapacity();
            active += s.getActiveSessions();
            String region = StringUtils.defaultIfBlank(s.getRegion(), "unknown");
            regions.merge(region, new RegionStats(1, s.getCapacity(), s.getActiveSessions()),
                    (a, b) -> new RegionStats(a.servers() + b.servers(),
                            a.capacity() + b.capacity(),
                            a.activeSessions() + b.activeSessions()));
        }
        double utilization = capacity > 0 ? Math.round(active * 10000.0 / capacity) / 100.0 : 0.0;
        return new PoolStats(all.size(), healthy, all.size() - healthy, capacity, active, utilization, regions);
    }

    @Override
    public List<ServerRecord> listServers() {
        return registry.findAll();
    }
}
