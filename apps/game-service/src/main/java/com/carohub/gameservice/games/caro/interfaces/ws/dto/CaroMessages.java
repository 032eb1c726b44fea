package com.carohub.gameservice.games.caro.interfaces.ws.dto;

import lombok.Data;

/**
 * WebSocket 入站指令（客户端 → 服务端，/app/caro.*）。
 * 玩家身份由上游认证层解析后以 playerId 明文传入。
 */
public class CaroMessages {

    /**
     * 订阅对局后发送，把当前 STOMP 会话绑定到 (matchId, playerId)，
     * 断线时据此判负；服务端回一个 game_state。
     */
    @Data
    public static class JoinCmd {
        private String matchId;
        private String playerId;
    }

    /**
     * 落子指令
     *   - player：执子方 "X" / "O"，本地对局用它区分双方；其他模式以服务端判断为准
     */
    @Data
    public static class MoveCmd {
        private String matchId;
        private String playerId;
        private int row;
        private int col;
        private String player;
    }

    /** 主动离开（按认输处理） */
    @Data
    public static class LeaveCmd {
        private String matchId;
        private String playerId;
    }
}
