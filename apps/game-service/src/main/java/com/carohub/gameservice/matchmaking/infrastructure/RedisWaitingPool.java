package com.carohub.gameservice.matchmaking.infrastructure;

import com.carohub.gameservice.infrastructure.redis.RedisKeys;
import com.carohub.gameservice.infrastructure.redis.RedisOps;
import com.carohub.gameservice.matchmaking.domain.model.QueueEntry;
import com.carohub.gameservice.matchmaking.domain.repository.WaitingPool;
import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 等待池的 Redis 实现。
 * - caro:mm:queue（ZSET）：playerId -> rating，只含 WAITING 玩家
 * - caro:mm:entries（Hash）：playerId -> QueueEntry JSON
 * - caro:mm:stats（Hash）：total_joins / total_leaves / total_matches
 * 配对认领与条目的条件写入都走 Lua 脚本，以"是否仍在 ZSET 中"为前提，保证同一步完成。
 */
@RequiredArgsConstructor
public class RedisWaitingPool implements WaitingPool {

    /**
     * KEYS[1]=queue，KEYS[2]=entries，ARGV[1..2]=两名玩家，ARGV[3..4]=双方 MATCHED 条目；
     * 都在才移除并写入条目，返回 1，否则 0
     */
    static final String CLAIM_PAIR_LUA = """
            if redis.call('ZSCORE', KEYS[1], ARGV[1]) and redis.call('ZSCORE', KEYS[1], ARGV[2]) then
              redis.call('ZREM', KEYS[1], ARGV[1], ARGV[2])
              redis.call('HSET', KEYS[2], ARGV[1], ARGV[3])
              redis.call('HSET', KEYS[2], ARGV[2], ARGV[4])
              return 1
            end
            return 0
            """;

    /** 仍在等待才覆盖条目 */
    static final String REFRESH_IF_WAITING_LUA = """
            if redis.call('ZSCORE', KEYS[1], ARGV[1]) then
              redis.call('HSET', KEYS[2], ARGV[1], ARGV[2])
              return 1
            end
            return 0
            """;

    /** 仍在等待才移出并写入过期条目 */
    static final String EXPIRE_IF_WAITING_LUA = """
            if redis.call('ZREM', KEYS[1], ARGV[1]) == 1 then
              redis.call('HSET', KEYS[2], ARGV[1], ARGV[2])
              return 1
            end
            return 0
            """;

    /** 不在等待才删除条目 */
    static final String DISCARD_IF_SETTLED_LUA = """
            if redis.call('ZSCORE', KEYS[1], ARGV[1]) then
              return 0
            end
            return redis.call('HDEL', KEYS[2], ARGV[1])
            """;

    private final RedisOps ops;

    @Override
    public void enqueue(QueueEntry entry) {
        ops.hSet(RedisKeys.queueEntries(), entry.getPlayerId(), entry);
        ops.zAdd(RedisKeys.queue(), entry.getPlayerId(), entry.getRating());
    }

    @Override
    public Optional<QueueEntry> get(String playerId) {
        return Optional.ofNullable(ops.hGet(RedisKeys.queueEntries(), playerId, QueueEntry.class));
    }

    @Override
    public boolean refreshIfWaiting(QueueEntry entry) {
        return script(REFRESH_IF_WAITING_LUA, entry.getPlayerId(), ops.toHashJson(entry));
    }

    @Override
    public boolean expireIfWaiting(QueueEntry expired) {
        return script(EXPIRE_IF_WAITING_LUA, expired.getPlayerId(), ops.toHashJson(expired));
    }

    @Override
    public boolean discardIfSettled(String playerId) {
        return script(DISCARD_IF_SETTLED_LUA, playerId);
    }

    @Override
    public boolean remove(String playerId) {
        Long removed = ops.zRem(RedisKeys.queue(), playerId);
        ops.hDel(RedisKeys.queueEntries(), playerId);
        return removed != null && removed > 0;
    }

    @Override
    public List<QueueEntry> waitingInRange(int min, int max) {
        List<QueueEntry> out = new ArrayList<>();
        for (String id : ops.zRangeByScore(RedisKeys.queue(), min, max)) {
            get(id).ifPresent(out::add);
        }
        return out;
    }

    @Override
    public List<QueueEntry> allWaiting() {
        return waitingInRange(Integer.MIN_VALUE, Integer.MAX_VALUE);
    }

    @Override
    public List<QueueEntry> allEntries() {
        List<QueueEntry> out = new ArrayList<>();
        for (Object v : ops.hGetAll(RedisKeys.queueEntries()).values()) {
            if (v instanceof QueueEntry e) {
                out.add(e);
            }
        }
        return out;
    }

    @Override
    public boolean claimPair(QueueEntry matchedA, QueueEntry matchedB) {
        if (matchedA.getPlayerId().equals(matchedB.getPlayerId())) {
            return false;
        }
        return script(CLAIM_PAIR_LUA, matchedA.getPlayerId(), matchedB.getPlayerId(),
                ops.toHashJson(matchedA), ops.toHashJson(matchedB));
    }

    @Override
    public Long positionOf(String playerId) {
        return ops.zRevRank(RedisKeys.queue(), playerId);
    }

    @Override
    public long waitingCount() {
        return ops.zCard(RedisKeys.queue());
    }

    @Override
    public void incrementCounter(String counter) {
        ops.hIncrBy(RedisKeys.queueStats(), counter, 1);
    }

    @Override
    public Map<String, Long> counters() {
        Map<String, Long> out = new HashMap<>();
        ops.hGetAllStrings(RedisKeys.queueStats()).forEach((k, v) -> out.put(k, Long.parseLong(v)));
        return out;
    }

    private boolean script(String lua, String... args) {
        Long res = ops.eval(lua, List.of(RedisKeys.queue(), RedisKeys.queueEntries()), List.of(args), Long.class);
        return res != null && res == 1L;
    }
}
