package com.carohub.gameservice.infrastructure.redis;

/**
 * 统一集中管理 Redis Key 的前缀与拼接，避免字符串散落。
 */
public final class RedisKeys {

    private static final String PFX = "caro:";

    private RedisKeys() {}

    // ---- 对局快照 ----
    public static String match(String matchId) {
        return PFX + "match:" + matchId;
    }

    // ---- 玩家战绩 ----

    /** 玩家战绩（Hash：rating / wins / losses / draws / currentStreak / bestStreak） */
    public static String player(String playerId) {
        return PFX + "player:" + playerId;
    }

    /** 玩家最近对局索引（ZSET：matchId -> 结束时间） */
    public static String playerMatches(String playerId) {
        return PFX + "player:" + playerId + ":matches";
    }

    /** 积分排行（ZSET：playerId -> rating），用于计算排名 */
    public static String leaderboard() {
        return PFX + "leaderboard";
    }

    // ---- 匹配队列 ----

    /** 等待池（ZSET：playerId -> rating） */
    public static String queue() {
        return PFX + "mm:queue";
    }

    /** 队列条目（Hash：playerId -> QueueEntry JSON） */
    public static String queueEntries() {
        return PFX + "mm:entries";
    }

    /** 队列计数（Hash：total_joins / total_leaves / total_matches） */
    public static String queueStats() {
        return PFX + "mm:stats";
    }

    // ---- 服务器池 ----

    /** 服务器记录（Hash：serverId -> ServerRecord JSON） */
    public static String servers() {
        return PFX + "servers";
    }

    /** 注册序号（INCR），用于同负载时按注册先后排序 */
    public static String serverSeq() {
        return PFX + "servers:seq";
    }

    /** 心跳健康标记（String，带 TTL） */
    public static String serverHealth(String serverId) {
        return PFX + "server:" + serverId + ":health";
    }

    /** 该服务器承载的对局集合（SET） */
    public static String serverSessions(String serverId) {
        return PFX + "server:" + serverId + ":sessions";
    }
}
