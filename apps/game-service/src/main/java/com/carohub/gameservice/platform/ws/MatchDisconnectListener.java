package com.carohub.gameservice.platform.ws;

import com.carohub.gameservice.games.caro.interfaces.ws.CaroWsController;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

/**
 * STOMP 会话断开 → 视为该玩家离开所绑定的对局。
 * 同一玩家在该对局仍有其他在线会话时不处理。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MatchDisconnectListener {

    private final MatchConnectionRegistry connections;
    private final CaroWsController caroWsController;

    @EventListener
    public void onDisconnect(SessionDisconnectEvent event) {
        connections.unbind(event.getSessionId()).ifPresent(b -> {
            if (connections.isConnected(b.matchId(), b.playerId())) {
                log.debug("玩家仍有其他会话在线，忽略断开: matchId={}, playerId={}", b.matchId(), b.playerId());
                return;
            }
            log.info("WebSocket 断开: sessionId={}, matchId={}, playerId={}",
                    event.getSessionId(), b.matchId(), b.playerId());
            try {
                caroWsController.onPlayerLeft(b.matchId(), b.playerId());
            } catch (RuntimeException e) {
                log.warn("断线处理失败: matchId={}, playerId={}, err={}", b.matchId(), b.playerId(), e.getMessage());
            }
        });
    }
}
