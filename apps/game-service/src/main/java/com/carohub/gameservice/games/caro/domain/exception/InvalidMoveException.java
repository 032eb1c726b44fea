package com.carohub.gameservice.games.caro.domain.exception;

import lombok.Getter;

/**
 * 非法落子：被拒绝且不改变任何状态。
 */
@Getter
public class InvalidMoveException extends IllegalArgumentException {

    public enum Reason {
        /** 目标格已有棋子 */
        CELL_OCCUPIED,
        /** 不是该方回合 */
        NOT_YOUR_TURN,
        /** 坐标越界 */
        OUT_OF_BOUNDS,
        /** 对局不在进行中 */
        NOT_IN_PROGRESS
    }

    private final Reason reason;

    public InvalidMoveException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }
}
