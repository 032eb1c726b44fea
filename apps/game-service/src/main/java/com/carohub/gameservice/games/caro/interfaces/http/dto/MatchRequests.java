package com.carohub.gameservice.games.caro.interfaces.http.dto;

import lombok.Data;

/**
 * HTTP 请求体
 */
public class MatchRequests {

    /**
     * 新建对局
     *   - mode：LOCAL / AI / ONLINE，默认 AI
     *   - difficulty：EASY / MEDIUM / HARD，仅 AI
     *   - aiSide：AI 执子 "X" / "O"，仅 AI，默认 "O"
     */
    @Data
    public static class CreateMatch {
        private String mode;
        private String playerId;
        private String difficulty;
        private String aiSide;
    }

    @Data
    public static class PlayerOnly {
        private String playerId;
    }

    /** 落子；player 可空 */
    @Data
    public static class PlaceMove {
        private String playerId;
        private int row;
        private int col;
        private String player;
    }

    /** 认输；本地对局需要 side */
    @Data
    public static class Forfeit {
        private String playerId;
        private String side;
    }
}
