package com.carohub.gameservice.pool.service;

import com.carohub.gameservice.pool.domain.model.PoolStats;
import com.carohub.gameservice.pool.domain.model.ServerRecord;

import java.util.List;
import java.util.Optional;

/**
 * 游戏服务器池 / 负载均衡
 */
public interface ServerPoolService {

    /** 登记服务器；capacity/region 为空时取默认值 */
    ServerRecord register(String serverId, String host, int port, Integer capacity, String region);

    boolean unregister(String serverId);

    /**
     * 心跳
     * @return 服务器未登记返回 false
     */
    boolean heartbeat(String serverId, Double cpuUsage, Double memoryUsage);

    /**
     * 选择最空闲的服务器：健康、区域匹配、剩余容量 ≥ minFreeCapacity，
     * 对局数最少者优先，同数按注册先后。
     */
    Optional<ServerRecord> selectBestServer(String region, int minFreeCapacity);

    /**
     * 把对局分配到服务器；serverId 为空时自动选择。
     * @throws com.carohub.gameservice.pool.domain.PoolUnavailableException 无可用服务器
     */
    ServerRecord assign(String sessionId, String serverId, String region);

    /** 对局结束，释放服务器容量 */
    boolean release(String sessionId, String serverId);

    /**
     * 清理心跳过期的服务器
     * @return 清理数量
     */
    int sweepDead();

    PoolStats stats();

    List<ServerRecord> listServers();
}
