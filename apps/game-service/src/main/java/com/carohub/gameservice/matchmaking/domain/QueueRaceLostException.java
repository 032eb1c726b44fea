package com.carohub.gameservice.matchmaking.domain;

/**
 * 认领对手失败：对手已被其他请求抢先配对。只在匹配服务内部重试，不外抛。
 */
public class QueueRaceLostException extends RuntimeException {

    public QueueRaceLostException(String playerId, String opponentId) {
        super("认领失败: " + playerId + " vs " + opponentId);
    }
}
