package com.carohub.gameservice.games.caro.interfaces.http;

import com.carohub.gameservice.games.caro.service.LeaderboardEntry;
import com.carohub.gameservice.games.caro.service.MatchHistoryItem;
import com.carohub.gameservice.games.caro.service.PlayerStats;
import com.carohub.gameservice.games.caro.service.PlayerStatsService;
import com.carohub.web.common.ApiResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Caro 战绩查询接口：个人战绩、最近对局、排行榜
 */
@RestController
@RequestMapping("/api/caro")
@RequiredArgsConstructor
public class PlayerStatsController {

    private final PlayerStatsService statsService;

    @GetMapping("/players/{playerId}")
    public ResponseEntity<ApiResponse<PlayerStats>> stats(@PathVariable String playerId) {
        return ResponseEntity.ok(ApiResponse.success(statsService.stats(playerId)));
    }

    @GetMapping("/players/{playerId}/matches")
    public ResponseEntity<ApiResponse<List<MatchHistoryItem>>> recentMatches(
            @PathVariable String playerId,
            @RequestParam(defaultValue = "" + PlayerStatsService.DEFAULT_HISTORY_LIMIT) int limit) {
        return ResponseEntity.ok(ApiResponse.success(statsService.recentMatches(playerId, limit)));
    }

    @GetMapping("/leaderboard")
    public ResponseEntity<ApiResponse<List<LeaderboardEntry>>> leaderboard(
            @RequestParam(defaultValue = "" + PlayerStatsService.DEFAULT_LEADERBOARD_LIMIT) int limit) {
        return ResponseEntity.ok(ApiResponse.success(statsService.leaderboard(limit)));
    }
}
