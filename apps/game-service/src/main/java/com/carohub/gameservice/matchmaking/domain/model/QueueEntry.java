package com.carohub.gameservice.matchmaking.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 匹配队列条目，每个玩家至多一条（重复加入会覆盖旧条目）。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class QueueEntry {
    private String playerId;
    private String username;
    private int rating;
    /** 加入时间（epoch millis），搜索范围按它扩展 */
    private long joinedAt;
    /** 最近一次轮询（epoch millis），过期按它判断 */
    private long lastActiveAt;
    private QueueStatus status;
    /** 配对对手 ID */
    private String matchedWith;
    /** 配对后创建的对局 ID */
    private String matchId;
}
