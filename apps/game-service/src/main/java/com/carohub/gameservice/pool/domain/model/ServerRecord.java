package com.carohub.gameservice.pool.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * ServerRecord
 * -------------------------------------------------------
 * 游戏服务器登记信息。
 * - activeSessions 读取时由该服务器的对局集合基数回填，不单独累加；
 * - healthy 读取时由心跳新鲜度回填。
 * -------------------------------------------------------
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ServerRecord {
    private String serverId;
    private String host;
    private int port;
    /** 最大并发对局数 */
    private int capacity;
    /** 区域标签 */
    private String region;
    /** 当前承载对局数 */
    private long activeSessions;
    /** 注册时间（epoch millis） */
    private long registeredAt;
    /** 最近心跳（epoch millis） */
    private long lastHeartbeat;
    /** 注册序号，同负载时先注册者优先 */
    private long registrationSeq;
    private Double cpuUsage;
    private Double memoryUsage;
    private boolean healthy;

    /** 剩余容量 */
    @JsonIgnore
    public long getFreeCapacity() {
        return capacity - activeSessions;
    }
}
