package com.carohub.gameservice.pool.domain.repository;

import com.carohub.gameservice.pool.domain.model.ServerRecord;

import java.util.List;
import java.util.Optional;

/**
 * ServerRegistry
 * ----------------------------------------
 * 服务器登记存储
 * - 单个服务器的更新各自原子，不需要跨服务器加锁；
 * - 读出的记录已回填 activeSessions（对局集合基数）与 healthy（心跳新鲜度）。
 * ----------------------------------------
 */
public interface ServerRegistry {

    /**
     * 登记（同 ID 重复登记视为重新上线，保留原注册序号与已分配对局）
     * @return 登记后的记录
     */
    ServerRecord register(String serverId, String host, int port, int capacity, String region);

    /** 移除记录、健康标记与对局集合；不存在返回 false */
    boolean unregister(String serverId);

    /**
     * 刷新心跳 TTL 与负载指标
     * @return 服务器未登记返回 false（worker 应重新注册）
     */
    boolean heartbeat(String serverId, Double cpuUsage, Double memoryUsage);

    Optional<ServerRecord> find(String serverId);

    /** 全部记录，按注册序号升序 */
    List<ServerRecord> findAll();

    /**
     * 原子占位：服务器仍登记、仍健康且对局数低于容量时才把对局加入集合
     * （对局已在集合中视为成功）
     * @return 加入后的集合基数；条件不满足返回 -1，集合不变
     */
    long tryAddSession(String serverId, String sessionId);

    /**
     * 从服务器集合移除对局
     * @return 是否确实移除
     */
    boolean removeSession(String serverId, String sessionId);
}
