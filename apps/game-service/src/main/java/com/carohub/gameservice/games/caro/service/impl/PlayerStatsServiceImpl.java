package com.carohub.gameservice.games.caro.service.impl;

import com.carohub.gameservice.application.user.UserDirectoryService;
import com.carohub.gameservice.application.user.UserProfileView;
import com.carohub.gameservice.games.caro.domain.constants.GameMessages;
import com.carohub.gameservice.games.caro.domain.dto.MatchRecord;
import com.carohub.gameservice.games.caro.domain.enums.Cell;
import com.carohub.gameservice.games.caro.domain.enums.MatchMode;
import com.carohub.gameservice.games.caro.domain.enums.MatchStatus;
import com.carohub.gameservice.games.caro.domain.exception.PlayerNotFoundException;
import com.carohub.gameservice.games.caro.domain.model.PlayerRecord;
import com.carohub.gameservice.games.caro.domain.repository.MatchRecordRepository;
import com.carohub.gameservice.games.caro.domain.repository.PlayerRecordRepository;
import com.carohub.gameservice.games.caro.domain.rule.Outcome;
import com.carohub.gameservice.games.caro.service.LeaderboardEntry;
import com.carohub.gameservice.games.caro.service.MatchHistoryItem;
import com.carohub.gameservice.games.caro.service.MatchProperties;
import com.carohub.gameservice.games.caro.service.PlayerStats;
import com.carohub.gameservice.games.caro.service.PlayerStatsService;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * 战绩查询实现：个人战绩和排行榜读玩家档案，最近对局读按玩家建立的对局索引。
 */
@Service
@RequiredArgsConstructor
public class PlayerStatsServiceImpl implements PlayerStatsService {

    static final int MAX_LEADERBOARD_LIMIT = 100;
    /** 排行榜按页扫描积分榜，跳过没有胜局的玩家 */
    static final int SCAN_PAGE = 100;

    private final PlayerRecordRepository players;
    private final MatchRecordRepository matches;
    private final UserDirectoryService userDirectory;
    private final MatchProperties props;

    @Override
    public PlayerStats stats(String playerId) {
        if (StringUtils.isBlank(playerId)) {
            throw new IllegalArgumentException(GameMessages.PLAYER_ID_BLANK);
        }
        PlayerRecord rec = players.find(playerId).orElseThrow(() -> new PlayerNotFoundException(playerId));
        return PlayerStats.of(rec, displayName(playerId), players.rankOf(rec.getRating()));
    }

    @Override
    public List<LeaderboardEntry> leaderboard(int limit) {
        requireLimit(limit, MAX_LEADERBOARD_LIMIT);
        List<LeaderboardEntry> out = new ArrayList<>(limit);
        long offset = 0;
        while (out.size() < limit) {
            List<PlayerRecord> page = players.top(offset, SCAN_PAGE);
            for (PlayerRecord rec : page) {
                if (rec.getWins() > 0 && out.size() < limit) {
                    out.add(LeaderboardEntry.of(out.size() + 1, rec, displayName(rec.getPlayerId())));
                }
            }
            if (page.size() < SCAN_PAGE) {
                break;
            }
            offset += SCAN_PAGE;
        }
        return out;
    }

    @Override
    public List<MatchHistoryItem> recentMatches(String playerId, int limit) {
        if (StringUtils.isBlank(playerId)) {
            throw new IllegalArgumentException(GameMessages.PLAYER_ID_BLANK);
        }
        requireLimit(limit, props.getHistoryLimit());
        List<MatchHistoryItem> out = new ArrayList<>();
        for (MatchRecord r : matches.recentByPlayer(playerId, limit)) {
            // 索引先于终局快照写入，短暂可见的未结束快照跳过
            if (MatchStatus.COMPLETED.name().equals(r.getStatus())) {
                out.add(toItem(playerId, r));
            }
        }
        return out;
    }

    private MatchHistoryItem toItem(String playerId, MatchRecord r) {
        boolean black = playerId.equals(r.getBlackId());
        Cell side = black ? Cell.BLACK : Cell.WHITE;
        boolean rated = MatchMode.ONLINE.name().equals(r.getMode());
        return new MatchHistoryItem(r.getId(), r.getMode(), side.code(),
                black ? r.getWhiteId() : r.getBlackId(),
                black ? r.getWhiteName() : r.getBlackName(),
                Outcome.valueOf(r.getOutcome()).resultFor(side),
                r.getOutcome(),
                rated ? Integer.valueOf(black ? r.getBlackRatingBefore() : r.getWhiteRatingBefore()) : null,
                rated ? (black ? r.getBlackRatingAfter() : r.getWhiteRatingAfter()) : null,
                rated ? (black ? r.getBlackRatingDelta() : r.getWhiteRatingDelta()) : null,
                r.getMoves().size(),
                r.getUpdatedAt());
    }

    private String displayName(String playerId) {
        return UserProfileView.displayNameOr(userDirectory.getUserInfo(playerId), playerId);
    }

    private static void requireLimit(int limit, int max) {
        if (limit < 1 || limit > max) {
            throw new IllegalArgumentException(GameMessages.formatLimitOutOfRange(max, limit));
        }
    }
}
