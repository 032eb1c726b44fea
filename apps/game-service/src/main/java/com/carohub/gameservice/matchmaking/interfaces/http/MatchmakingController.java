package com.carohub.gameservice.matchmaking.interfaces.http;

import com.carohub.gameservice.matchmaking.domain.model.QueueStats;
import com.carohub.gameservice.matchmaking.service.MatchmakingResult;
import com.carohub.gameservice.matchmaking.service.MatchmakingService;
import com.carohub.web.common.ApiResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * 匹配队列 HTTP 接口（客户端轮询 status 获取结果）
 */
@RestController
@RequestMapping("/api/matchmaking")
@RequiredArgsConstructor
public class MatchmakingController {

    private final MatchmakingService matchmaking;

    /**
     * 加入队列；rating 可空，为空时取玩家当前积分
     */
    @PostMapping("/join")
    public ResponseEntity<ApiResponse<MatchmakingResult>> join(@Valid @RequestBody JoinRequest req) {
        return ResponseEntity.ok(ApiResponse.success(matchmaking.join(req.getPlayerId(), req.getRating())));
    }

    @PostMapping("/leave")
    public ResponseEntity<ApiResponse<Map<String, Boolean>>> leave(@Valid @RequestBody JoinRequest req) {
        boolean left = matchmaking.leave(req.getPlayerId());
        return ResponseEntity.ok(ApiResponse.success(Map.of("left", left)));
    }

    @GetMapping("/status")
    public ResponseEntity<ApiResponse<MatchmakingResult>> status(@RequestParam("playerId") String playerId) {
        return ResponseEntity.ok(ApiResponse.success(matchmaking.status(playerId)));
    }

    @GetMapping("/stats")
    public ResponseEntity<ApiResponse<QueueStats>> stats() {
        return ResponseEntity.ok(ApiResponse.success(matchmaking.stats()));
    }

    @Data
    public static class JoinRequest {
        @NotBlank(message = "playerId is required")
        private String playerId;
        private Integer rating;
    }
}
