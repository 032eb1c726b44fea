package com.carohub.gameservice.games.caro.infrastructure.redis.repo;

import com.carohub.gameservice.games.caro.domain.enums.GameResult;
import com.carohub.gameservice.games.caro.domain.model.PlayerRecord;
import com.carohub.gameservice.games.caro.domain.rating.RatingProperties;
import com.carohub.gameservice.games.caro.domain.repository.PlayerRecordRepository;
import com.carohub.gameservice.infrastructure.redis.RedisKeys;
import com.carohub.gameservice.infrastructure.redis.RedisOps;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 玩家战绩的 Redis 仓储实现。
 * - caro:player:{id}（Hash）：rating / wins / losses / draws / currentStreak / bestStreak
 * - caro:leaderboard：ZSET（playerId -> rating），排名 = ZCOUNT(rating, +inf) + 1
 * 结算用 Lua 脚本在一步内完成增量与排行榜同步。
 */
@Repository
@RequiredArgsConstructor
public class RedisPlayerRecordRepository implements PlayerRecordRepository {

    static final String F_RATING = "rating";
    static final String F_WINS = "wins";
    static final String F_LOSSES = "losses";
    static final String F_DRAWS = "draws";
    static final String F_CURRENT_STREAK = "currentStreak";
    static final String F_BEST_STREAK = "bestStreak";

    /**
     * KEYS[1]=player，KEYS[2]=leaderboard；
     * ARGV[1]=playerId，ARGV[2]=初始积分，ARGV[3]=积分增量，ARGV[4]=计数字段，ARGV[5]=是否记连胜（1/0）。
     * 返回更新后的积分
     */
    static final String RECORD_RESULT_LUA = """
            redis.call('HSETNX', KEYS[1], 'rating', ARGV[2])
            local rating = redis.call('HINCRBY', KEYS[1], 'rating', ARGV[3])
            redis.call('HINCRBY', KEYS[1], ARGV[4], 1)
            if ARGV[5] == '1' then
              if ARGV[4] == 'wins' then
                local cur = redis.call('HINCRBY', KEYS[1], 'currentStreak', 1)
                local best = tonumber(redis.call('HGET', KEYS[1], 'bestStreak') or '0')
                if cur > best then
                  redis.call('HSET', KEYS[1], 'bestStreak', cur)
                end
              else
                redis.call('HSET', KEYS[1], 'currentStreak', 0)
              end
            end
            redis.call('ZADD', KEYS[2], rating, ARGV[1])
            return rating
            """;

    private final RedisOps ops;
    private final RatingProperties ratingProperties;

    @Override
    public Optional<PlayerRecord> find(String playerId) {
        Map<String, String> h = ops.hGetAllStrings(RedisKeys.player(playerId));
        if (h.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new PlayerRecord(playerId,
                intOf(h, F_RATING, ratingProperties.getInitial()),
                intOf(h, F_WINS, 0),
                intOf(h, F_LOSSES, 0),
                intOf(h, F_DRAWS, 0),
                intOf(h, F_CURRENT_STREAK, 0),
                intOf(h, F_BEST_STREAK, 0)));
    }

    @Override
    public PlayerRecord findOrCreate(String playerId) {
        // 只有真正建档的一方写排行榜，避免把已结算的积分覆盖回初始值
        if (ops.hSetIfAbsent(RedisKeys.player(playerId), F_RATING, String.valueOf(ratingProperties.getInitial()))) {
            ops.zAdd(RedisKeys.leaderboard(), playerId, ratingProperties.getInitial());
        }
        return find(playerId).orElseGet(() -> PlayerRecord.fresh(playerId, ratingProperties.getInitial()));
    }

    @Override
    public int recordResult(String playerId, int ratingDelta, GameResult result, boolean trackStreak) {
        Long rating = ops.eval(RECORD_RESULT_LUA,
                List.of(RedisKeys.player(playerId), RedisKeys.leaderboard()),
                List.of(playerId,
                        String.valueOf(ratingProperties.getInitial()),
                        String.valueOf(ratingDelta),
                        counterField(result),
                        trackStreak ? "1" : "0"),
                Long.class);
        if (rating == null) {
            throw new IllegalStateException("结算脚本未返回积分: playerId=" + playerId);
        }
        return rating.intValue();
    }

    @Override
    public long rankOf(int rating) {
        // 积分为整数，rating + 0.5 起算即“严格高于”
        return ops.zCount(RedisKeys.leaderboard(), rating + 0.5, Double.POSITIVE_INFINITY) + 1;
    }

    @Override
    public List<PlayerRecord> top(long offset, int count) {
        List<PlayerRecord> out = new ArrayList<>();
        if (count <= 0) {
            return out;
        }
        for (String id : ops.zRevRange(RedisKeys.leaderboard(), offset, offset + count - 1)) {
            find(id).ifPresent(out::add);
        }
        return out;
    }

    static String counterField(GameResult result) {
        return switch (result) {
            case WIN -> F_WINS;
            case LOSS -> F_LOSSES;
            case DRAW -> F_DRAWS;
        };
    }

    private static int intOf(Map<String, String> h, String field, int dflt) {
        String v = h.get(field);
        return v == null ? dflt : Integer.parseInt(v);
    }
}
