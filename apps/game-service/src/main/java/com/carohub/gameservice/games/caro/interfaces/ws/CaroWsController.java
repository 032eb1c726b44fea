package com.carohub.gameservice.games.caro.interfaces.ws;

import com.carohub.gameservice.games.caro.application.CaroEventPublisher;
import com.carohub.gameservice.games.caro.domain.enums.Cell;
import com.carohub.gameservice.games.caro.domain.model.MatchSession;
import com.carohub.gameservice.games.caro.domain.model.Participant;
import com.carohub.gameservice.games.caro.interfaces.ws.dto.CaroMessages.JoinCmd;
import com.carohub.gameservice.games.caro.interfaces.ws.dto.CaroMessages.LeaveCmd;
import com.carohub.gameservice.games.caro.interfaces.ws.dto.CaroMessages.MoveCmd;
import com.carohub.gameservice.games.caro.service.LeaveResult;
import com.carohub.gameservice.games.caro.service.MatchService;
import com.carohub.gameservice.games.caro.service.MoveResult;
import com.carohub.gameservice.platform.ws.MatchConnectionRegistry;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.stereotype.Controller;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Caro WebSocket 控制器
 * ----------------------------------------
 * 接收 /app/caro.* 指令，结果通过 {@link CaroEventPublisher} 广播到 /topic/match.{matchId}。
 *   1. join      → 绑定会话，推送当前局面
 *   2. make_move → 广播落子；AI 对局轮到 AI 时延迟一段时间再让 AI 落子
 *   3. leave     → 按认输处理，广播 player_disconnected
 * 任何异常都转成 error 事件，不向上抛。
 */
@Slf4j
@Controller
public class CaroWsController {

    private final MatchService matchService;
    private final CaroEventPublisher publisher;
    private final MatchConnectionRegistry connections;
    private final ScheduledExecutorService aiScheduler;

    /** AI 思考延迟 */
    @Value("${caro.ai.delay-ms:600}")
    private long aiDelayMs;

    /** 同一对局只保留一个待执行的 AI 任务 */
    private final ConcurrentMap<String, ScheduledFuture<?>> pendingAi = new ConcurrentHashMap<>();

    public CaroWsController(MatchService matchService,
                            CaroEventPublisher publisher,
                            MatchConnectionRegistry connections,
                            @Qualifier("aiScheduler") ScheduledExecutorService aiScheduler) {
        this.matchService = matchService;
        this.publisher = publisher;
        this.connections = connections;
        this.aiScheduler = aiScheduler;
    }

    @MessageMapping("/caro.join")
    public void join(JoinCmd cmd, SimpMessageHeaderAccessor sha) {
        final String matchId = cmd.getMatchId();
        try {
            MatchSession s = matchService.get(matchId);
            if (StringUtils.isNotBlank(cmd.getPlayerId()) && sha.getSessionId() != null) {
                connections.bind(sha.getSessionId(), matchId, cmd.getPlayerId());
            }
            publisher.state(s);
            maybeScheduleAi(s);
        } catch (Exception e) {
            publisher.error(matchId, e);
        }
    }

    @MessageMapping("/caro.make_move")
    public void makeMove(MoveCmd cmd) {
        final String matchId = cmd.getMatchId();
        try {
            Cell symbol = StringUtils.isBlank(cmd.getPlayer()) ? null : Cell.of(cmd.getPlayer());
            MoveResult r = matchService.makeMove(matchId, cmd.getPlayerId(), cmd.getRow(), cmd.getCol(), symbol);
            publisher.moved(r);
            if (!r.gameOver()) {
                maybeScheduleAi(matchService.get(matchId));
            }
        } catch (Exception e) {
            log.debug("落子失败: matchId={}, playerId={}, err={}", matchId, cmd.getPlayerId(), e.getMessage());
            publisher.error(matchId, e);
        }
    }

    @MessageMapping("/caro.leave")
    public void leave(LeaveCmd cmd) {
        final String matchId = cmd.getMatchId();
        try {
            onPlayerLeft(matchId, cmd.getPlayerId());
        } catch (Exception e) {
            publisher.error(matchId, e);
        }
    }

    /**
     * 玩家离开 / 断线：对局进行中则判负并结算，广播给仍在线的一方。
     * 对局已结束或尚未开局时不广播。
     */
    public void onPlayerLeft(String matchId, String playerId) {
        LeaveResult r = matchService.disconnect(matchId, playerId);
        if (!r.finishedHere()) {
            return;
        }
        cancelAi(matchId);
        MatchSession s = matchService.get(matchId);
        Participant opponent = s.participant(r.side().opponent());
        boolean opponentConnected = opponent != null
                && (opponent.isAi() || connections.isConnected(matchId, opponent.playerId()));
        publisher.playerLeft(r, opponentConnected);
    }

    // ================== AI ==================

    private void maybeScheduleAi(MatchSession s) {
        if (!s.isAiTurn()) {
            return;
        }
        final String matchId = s.getId();
        ScheduledFuture<?> f = aiScheduler.schedule(() -> {
            pendingAi.remove(matchId);
            try {
                MoveResult r = matchService.aiMove(matchId);
                publisher.moved(r);
            } catch (Exception e) {
                log.warn("AI 落子失败: matchId={}, err={}", matchId, e.getMessage());
                publisher.error(matchId, e);
            }
        }, aiDelayMs, TimeUnit.MILLISECONDS);
        ScheduledFuture<?> prev = pendingAi.put(matchId, f);
        if (prev != null) {
            prev.cancel(false);
        }
    }

    private void cancelAi(String matchId) {
        ScheduledFuture<?> f = pendingAi.remove(matchId);
        if (f != null) {
            f.cancel(false);
        }
    }
}
