package com.carohub.gameservice.matchmaking.service;

import com.carohub.gameservice.matchmaking.domain.model.SearchRange;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 加入 / 轮询匹配的返回
 *
 * @param queuePosition 按积分倒序的排位（1 起），仅 SEARCHING
 * @param eloRange      当前搜索区间，仅 SEARCHING
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MatchmakingResult(MatchmakingStatus status,
                                String matchId,
                                Opponent opponent,
                                Long queuePosition,
                                Long queueSize,
                                SearchRange eloRange) {

    public record Opponent(String playerId, String username, int rating) {
    }

    public static MatchmakingResult matched(String matchId, Opponent opponent) {
        return new MatchmakingResult(MatchmakingStatus.MATCHED, matchId, opponent, null, null, null);
    }

    public static MatchmakingResult searching(Long queuePosition, long queueSize, SearchRange range) {
        return new MatchmakingResult(MatchmakingStatus.SEARCHING, null, null, queuePosition, queueSize, range);
    }

    public static MatchmakingResult notInQueue() {
        return new MatchmakingResult(MatchmakingStatus.NOT_IN_QUEUE, null, null, null, null, null);
    }
}
