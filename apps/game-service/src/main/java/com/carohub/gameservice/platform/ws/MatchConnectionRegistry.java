package com.carohub.gameservice.platform.ws;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * STOMP 会话与对局的绑定关系
 * ----------------------------------------
 * sessionId -> (matchId, playerId)。一个玩家可能多端连接同一对局，
 * 只有最后一个会话断开时才算该玩家离线。
 * ----------------------------------------
 */
@Component
public class MatchConnectionRegistry {

    public record Binding(String matchId, String playerId) {
    }

    private final Map<String, Binding> bySession = new ConcurrentHashMap<>();

    public void bind(String sessionId, String matchId, String playerId) {
        bySession.put(sessionId, new Binding(matchId, playerId));
    }

    /** 解除绑定，返回原绑定 */
    public Optional<Binding> unbind(String sessionId) {
        return Optional.ofNullable(bySession.remove(sessionId));
    }

    /** 该玩家在该对局是否还有在线会话 */
    public boolean isConnected(String matchId, String playerId) {
        if (playerId == null) return false;
        Binding target = new Binding(matchId, playerId);
        return bySession.containsValue(target);
    }
}
