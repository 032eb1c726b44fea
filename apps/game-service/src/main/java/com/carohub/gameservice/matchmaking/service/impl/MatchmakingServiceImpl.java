package com.carohub.gameservice.matchmaking.service.impl;

import com.carohub.gameservice.application.user.UserDirectoryService;
import com.carohub.gameservice.application.user.UserProfileView;
import com.carohub.gameservice.games.caro.domain.constants.GameMessages;
import com.carohub.gameservice.games.caro.domain.model.Participant;
import com.carohub.gameservice.games.caro.domain.rating.RatingProperties;
import com.carohub.gameservice.games.caro.domain.repository.PlayerRecordRepository;
import com.carohub.gameservice.games.caro.service.MatchService;
import com.carohub.gameservice.matchmaking.domain.MatchmakingProperties;
import com.carohub.gameservice.matchmaking.domain.QueueRaceLostException;
import com.carohub.gameservice.matchmaking.domain.RangeExpansionPolicy;
import com.carohub.gameservice.matchmaking.domain.model.QueueEntry;
import com.carohub.gameservice.matchmaking.domain.model.QueueStats;
import com.carohub.gameservice.matchmaking.domain.model.QueueStatus;
import com.carohub.gameservice.matchmaking.domain.model.SearchRange;
import com.carohub.gameservice.matchmaking.domain.repository.WaitingPool;
import com.carohub.gameservice.matchmaking.service.MatchmakingResult;
import com.carohub.gameservice.matchmaking.service.MatchmakingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class MatchmakingServiceImpl implements MatchmakingService {

    static final String TOTAL_JOINS = "total_joins";
    static final String TOTAL_LEAVES = "total_leaves";
    static final String TOTAL_MATCHES = "total_matches";

    private final WaitingPool pool;
    private final RangeExpansionPolicy rangePolicy;
    private final MatchmakingProperties props;
    private final MatchService matchService;
    private final PlayerRecordRepository players;
    private final RatingProperties ratingProps;
    private final UserDirectoryService userDirectory;
    private final Clock clock;
    private final Random random;

    // ================== 入队 / 出队 ==================

    @Override
    public MatchmakingResult join(String playerId, Integer rating) {
        if (StringUtils.isBlank(playerId)) {
            throw new IllegalArgumentException(GameMessages.PLAYER_ID_REQUIRED);
        }
        int r = rating != null ? rating : currentRating(playerId);
        if (r < props.getMinRating() || r > props.getMaxRating()) {
            throw new IllegalArgumentException(
                    GameMessages.formatInvalidRating(r, props.getMinRating(), props.getMaxRating()));
        }

        long now = clock.millis();
        QueueEntry entry = QueueEntry.builder()
                .playerId(playerId)
                .username(UserProfileView.displayNameOr(userDirectory.getUserInfo(playerId), playerId))
                .rating(r)
                .joinedAt(now)
                .lastActiveAt(now)
                .status(QueueStatus.WAITING)
                .build();
        pool.enqueue(entry);
        pool.incrementCounter(TOTAL_JOINS);
        log.info("加入匹配队列: playerId={}, rating={}", playerId, r);
        return attemptMatch(playerId);
    }

    @Override
    public boolean leave(String playerId) {
        boolean wasWaiting = pool.remove(playerId);
        if (wasWaiting) {
            pool.incrementCounter(TOTAL_LEAVES);
            log.info("退出匹配队列: playerId={}", playerId);
        }
        return wasWaiting;
    }

    @Override
    public MatchmakingResult status(String playerId) {
        Optional<QueueEntry> found = pool.get(playerId);
        if (found.isEmpty()) {
            return MatchmakingResult.notInQueue();
        }
        QueueEntry entry = found.get();
        if (entry.getStatus() != QueueStatus.WAITING) {
            return resultOf(entry);
        }
        // 读出后可能已被别人配对：只在仍等待时刷新，否则按最新条目作答
        QueueEntry refreshed = entry.toBuilder().lastActiveAt(clock.millis()).build();
        if (!pool.refreshIfWaiting(refreshed)) {
            return pool.get(playerId).map(this::resultOf).orElseGet(MatchmakingResult::notInQueue);
        }
        return attemptMatch(playerId);
    }

    // ================== 配对 ==================

    /**
     * 每轮重新读取自己的条目：可能已被别人配对。认领失败换下一个候选，尝试次数用完仍留在队列。
     */
    private MatchmakingResult attemptMatch(String playerId) {
        for (int attempt = 1; attempt <= props.getClaimAttempts(); attempt++) {
            Optional<QueueEntry> self = pool.get(playerId);
            if (self.isEmpty() || self.get().getStatus() != QueueStatus.WAITING) {
                return self.map(this::resultOf).orElseGet(MatchmakingResult::notInQueue);
            }
            Optional<QueueEntry> opponent = findOpponent(self.get());
            if (opponent.isEmpty()) {
                break;
            }
            try {
                return createMatch(self.get(), opponent.get());
            } catch (QueueRaceLostException e) {
                log.debug("{}，第 {} 次", e.getMessage(), attempt);
            }
        }
        return pool.get(playerId).map(this::resultOf).orElseGet(MatchmakingResult::notInQueue);
    }

    @Override
    public Optional<QueueEntry> findOpponent(QueueEntry entry) {
        long now = clock.millis();
        SearchRange range = searchRange(entry, now);
        long staleMillis = props.getEntryTtlSeconds() * 1000L;
        return pool.waitingInRange(range.min(), range.max()).stream()
                .filter(c -> !c.getPlayerId().equals(entry.getPlayerId()))
                .filter(c -> c.getStatus() == QueueStatus.WAITING)
                .filter(c -> now - c.getLastActiveAt() <= staleMillis)
                .min(Comparator.comparingLong(QueueEntry::getJoinedAt).thenComparing(QueueEntry::getPlayerId));
    }

    @Override
    public MatchmakingResult createMatch(QueueEntry self, QueueEntry opponent) {
        String matchId = UUID.randomUUID().toString();
        long now = clock.millis();
        QueueEntry selfMatched = self.toBuilder().status(QueueStatus.MATCHED)
                .matchedWith(opponent.getPlayerId()).matchId(matchId).lastActiveAt(now).build();
        QueueEntry oppMatched = opponent.toBuilder().status(QueueStatus.MATCHED)
                .matchedWith(self.getPlayerId()).matchId(matchId).lastActiveAt(now).build();
        if (!pool.claimPair(selfMatched, oppMatched)) {
            throw new QueueRaceLostException(self.getPlayerId(), opponent.getPlayerId());
        }

        boolean selfBlack = random.nextBoolean();
        Participant a = new Participant(self.getPlayerId(), self.getUsername(), self.getRating());
        Participant b = new Participant(opponent.getPlayerId(), opponent.getUsername(), opponent.getRating());
        try {
            matchService.startPairedMatch(matchId, selfBlack ? a : b, selfBlack ? b : a);
        } catch (RuntimeException e) {
            // 建局失败：两人放回队列，保留原加入时间
            pool.enqueue(self);
            pool.enqueue(opponent);
            log.warn("建局失败，双方重新排队: {} vs {}, err={}", self.getPlayerId(), opponent.getPlayerId(), e.toString());
            return searchingResult(self);
        }

        pool.incrementCounter(TOTAL_MATCHES);

        log.info("匹配成功: matchId={}, {}({}) vs {}({})", matchId,
                self.getPlayerId(), self.getRating(), opponent.getPlayerId(), opponent.getRating());
        return MatchmakingResult.matched(matchId, opponentOf(opponent));
    }

    // ================== 维护 / 统计 ==================

    @Override
    public int cleanupExpired(long maxAgeSeconds) {
        long now = clock.millis();
        long maxAgeMillis = maxAgeSeconds * 1000L;
        int expired = 0;
        for (QueueEntry e : pool.allEntries()) {
            if (now - e.getLastActiveAt() <= maxAgeMillis) {
                continue;
            }
            if (e.getStatus() == QueueStatus.WAITING) {
                if (pool.expireIfWaiting(e.toBuilder().status(QueueStatus.EXPIRED).build())) {
                    expired++;
                    log.info("匹配条目过期: playerId={}, rating={}", e.getPlayerId(), e.getRating());
                }
            } else {
                pool.discardIfSettled(e.getPlayerId());
            }
        }
        return expired;
    }

    @Override
    public QueueStats stats() {
        Map<String, Long> dist = new LinkedHashMap<>();
        for (String bucket : List.of("below_1000", "1000_1199", "1200_1399", "1400_1599", "1600_1799", "1800_plus")) {
            dist.put(bucket, 0L);
        }
        for (QueueEntry e : pool.allWaiting()) {
            dist.merge(bucketOf(e.getRating()), 1L, Long::sum);
        }
        Map<String, Long> counters = pool.counters();
        return new QueueStats(pool.waitingCount(),
                counters.getOrDefault(TOTAL_JOINS, 0L),
                counters.getOrDefault(TOTAL_LEAVES, 0L),
                counters.getOrDefault(TOTAL_MATCHES, 0L),
                dist);
    }

    // ================== 内部 ==================

    private MatchmakingResult resultOf(QueueEntry entry) {
        return switch (entry.getStatus()) {
            case MATCHED -> MatchmakingResult.matched(entry.getMatchId(),
                    pool.get(entry.getMatchedWith())
                            .map(this::opponentOf)
                            .orElseGet(() -> new MatchmakingResult.Opponent(entry.getMatchedWith(), entry.getMatchedWith(), 0)));
            case WAITING -> searchingResult(entry);
            case EXPIRED -> MatchmakingResult.notInQueue();
        };
    }

    private MatchmakingResult searchingResult(QueueEntry entry) {
        Long pos = pool.positionOf(entry.getPlayerId());
        return MatchmakingResult.searching(pos == null ? null : pos + 1, pool.waitingCount(),
                searchRange(entry, clock.millis()));
    }

    private SearchRange searchRange(QueueEntry entry, long now) {
        long waitedSeconds = Math.max(0, now - entry.getJoinedAt()) / 1000;
        return SearchRange.around(entry.getRating(), rangePolicy.rangeFor(waitedSeconds));
    }

    private MatchmakingResult.Opponent opponentOf(QueueEntry e) {
        return new MatchmakingResult.Opponent(e.getPlayerId(), e.getUsername(), e.getRating());
    }

    private int currentRating(String playerId) {
        try {
            return players.findOrCreate(playerId).getRating();
        } catch (DataAccessException e) {
            log.warn("读取玩家积分失败，按初始积分入队: playerId={}, err={}", playerId, e.getMessage());
            return ratingProps.getInitial();
        }
    }

    static String bucketOf(int rating) {
        if (rating < 1000) return "below_1000";
        if (rating < 1200) return "1000_1199";
        if (rating < 1400) return "1200_1399";
        if (rating < 1600) return "1400_1599";
        if (rating < 1800) return "1600_1799";
        return "1800_plus";
    }
}
