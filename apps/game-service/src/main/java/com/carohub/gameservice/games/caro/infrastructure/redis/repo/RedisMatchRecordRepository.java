package com.carohub.gameservice.games.caro.infrastructure.redis.repo;

import com.carohub.gameservice.games.caro.domain.dto.MatchRecord;
import com.carohub.gameservice.games.caro.domain.repository.MatchRecordRepository;
import com.carohub.gameservice.infrastructure.redis.RedisKeys;
import com.carohub.gameservice.infrastructure.redis.RedisOps;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 对局快照的 Redis 仓储实现。
 * - caro:match:{id}：MatchRecord JSON，带 TTL
 * - caro:player:{id}:matches：ZSET（matchId -> 结束时间），只保留最新若干条
 */
@Repository
@RequiredArgsConstructor
public class RedisMatchRecordRepository implements MatchRecordRepository {

    private final RedisOps ops;

    @Override
    public void save(MatchRecord record, Duration ttl) {
        ops.setEx(RedisKeys.match(record.getId()), record, ttl);
    }

    @Override
    public Optional<MatchRecord> get(String matchId) {
        return Optional.ofNullable(ops.get(RedisKeys.match(matchId), MatchRecord.class));
    }

    @Override
    public void indexForPlayer(String playerId, String matchId, long finishedAt, int keep) {
        String key = RedisKeys.playerMatches(playerId);
        ops.zAdd(key, matchId, finishedAt);
        // 名次 0 起升序，保留分数最高（最新）的 keep 条
        ops.zRemRangeByRank(key, 0, -(keep + 1L));
    }

    @Override
    public List<MatchRecord> recentByPlayer(String playerId, int limit) {
        List<MatchRecord> out = new ArrayList<>();
        if (limit <= 0) {
            return out;
        }
        for (String matchId : ops.zRevRange(RedisKeys.playerMatches(playerId), 0, limit - 1L)) {
            get(matchId).ifPresent(out::add);
        }
        return out;
    }
}
