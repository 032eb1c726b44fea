package com.carohub.gameservice.games.caro.interfaces.http;

import com.carohub.gameservice.games.caro.application.CaroEventPublisher;
import com.carohub.gameservice.games.caro.domain.enums.Cell;
import com.carohub.gameservice.games.caro.domain.enums.Difficulty;
import com.carohub.gameservice.games.caro.domain.enums.MatchMode;
import com.carohub.gameservice.games.caro.domain.model.MatchSession;
import com.carohub.gameservice.games.caro.interfaces.http.dto.MatchRequests;
import com.carohub.gameservice.games.caro.interfaces.http.dto.MatchView;
import com.carohub.gameservice.games.caro.interfaces.http.dto.MoveResponse;
import com.carohub.gameservice.games.caro.service.LeaveResult;
import com.carohub.gameservice.games.caro.service.MatchService;
import com.carohub.gameservice.games.caro.service.MoveResult;
import com.carohub.web.common.ApiResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Caro 对局 HTTP 接口
 * 落子等变更同时广播到 /topic/match.{matchId}，WebSocket 端也能看到。
 */
@Slf4j
@RestController
@RequestMapping("/api/caro/matches")
@RequiredArgsConstructor
public class MatchRestController {

    private final MatchService matchService;
    private final CaroEventPublisher publisher;

    /**
     * 新建对局：LOCAL / AI（默认）/ ONLINE
     */
    @PostMapping
    public ResponseEntity<ApiResponse<MatchView>> create(@RequestBody MatchRequests.CreateMatch req) {
        MatchMode mode = StringUtils.isBlank(req.getMode()) ? MatchMode.AI : MatchMode.valueOf(req.getMode().trim().toUpperCase());
        MatchSession s = switch (mode) {
            case LOCAL -> matchService.createLocal();
            case AI -> {
                Cell aiSide = StringUtils.isBlank(req.getAiSide()) ? Cell.WHITE : Cell.of(req.getAiSide());
                yield matchService.createAiMatch(req.getPlayerId(), aiSide.opponent(), Difficulty.parse(req.getDifficulty()));
            }
            case ONLINE -> matchService.openOnline(req.getPlayerId());
        };
        return ResponseEntity.ok(ApiResponse.success(MatchView.of(s)));
    }

    @GetMapping("/{matchId}")
    public ResponseEntity<ApiResponse<MatchView>> get(@PathVariable String matchId) {
        return ResponseEntity.ok(ApiResponse.success(MatchView.of(matchService.get(matchId))));
    }

    /** 加入等待中的在线对局 */
    @PostMapping("/{matchId}/join")
    public ResponseEntity<ApiResponse<MatchView>> join(@PathVariable String matchId,
                                                       @RequestBody MatchRequests.PlayerOnly req) {
        MatchSession s = matchService.joinOnline(matchId, req.getPlayerId());
        publisher.state(s);
        return ResponseEntity.ok(ApiResponse.success(MatchView.of(s)));
    }

    /**
     * 落子。AI 对局中 AI 立即应手，一并返回。
     */
    @PostMapping("/{matchId}/moves")
    public ResponseEntity<ApiResponse<MoveResponse>> move(@PathVariable String matchId,
                                                          @RequestBody MatchRequests.PlaceMove req) {
        Cell symbol = StringUtils.isBlank(req.getPlayer()) ? null : Cell.of(req.getPlayer());
        MoveResult r = matchService.makeMove(matchId, req.getPlayerId(), req.getRow(), req.getCol(), symbol);
        publisher.moved(r);
        MoveResult ai = null;
        if (!r.gameOver() && matchService.get(matchId).isAiTurn()) {
            ai = matchService.aiMove(matchId);
            publisher.moved(ai);
        }
        return ResponseEntity.ok(ApiResponse.success(new MoveResponse(r, ai)));
    }

    /** 让 AI 落子（AI 执黑先手时由客户端触发第一步） */
    @PostMapping("/{matchId}/ai-move")
    public ResponseEntity<ApiResponse<MoveResult>> aiMove(@PathVariable String matchId) {
        MoveResult r = matchService.aiMove(matchId);
        publisher.moved(r);
        return ResponseEntity.ok(ApiResponse.success(r));
    }

    @PostMapping("/{matchId}/forfeit")
    public ResponseEntity<ApiResponse<LeaveResult>> forfeit(@PathVariable String matchId,
                                                            @RequestBody MatchRequests.Forfeit req) {
        Cell side = StringUtils.isBlank(req.getSide()) ? null : Cell.of(req.getSide());
        LeaveResult r = matchService.forfeit(matchId, req.getPlayerId(), side);
        publisher.state(matchService.get(matchId));
        return ResponseEntity.ok(ApiResponse.success(r));
    }
}
