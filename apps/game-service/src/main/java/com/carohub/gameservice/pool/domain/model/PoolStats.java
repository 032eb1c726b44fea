package com.carohub.gameservice.pool.domain.model;

import java.util.Map;

/**
 * 服务器池统计。
 *
 * @param utilization 承载率百分比，保留两位小数
 * @param regions     按区域汇总
 */
public record PoolStats(int totalServers,
                        int healthyServers,
                        int unhealthyServers,
                        long totalCapacity,
                        long totalActiveSessions,
                        double utilization,
                        Map<String, RegionStats> regions) {

    public record RegionStats(int servers, long capacity, long activeSessions) {
    }
}
