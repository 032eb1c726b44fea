package com.carohub.gameservice.games.caro.domain.constants;

/**
 * Caro 对局相关的提示消息常量
 * 统一管理用户可见的提示，避免硬编码
 */
public final class GameMessages {

    private GameMessages() {
        // 工具类，禁止实例化
    }

    // ========== 落子校验 ==========

    /** 目标格已有棋子 */
    public static final String CELL_OCCUPIED = "该位置已有棋子 (%d,%d)";

    /** 坐标越界 */
    public static final String OUT_OF_BOUNDS = "落子越界 (%d,%d)";

    /** 未轮到该方走棋 */
    public static final String NOT_YOUR_TURN = "未轮到该方走棋（当前应为 %s）";

    /** 对局不在进行中 */
    public static final String NOT_IN_PROGRESS = "对局不在进行中（当前状态 %s）";

    public static String formatCellOccupied(int row, int col) {
        return String.format(CELL_OCCUPIED, row, col);
    }

    public static String formatOutOfBounds(int row, int col) {
        return String.format(OUT_OF_BOUNDS, row, col);
    }

    public static String formatNotYourTurn(String currentSide) {
        return String.format(NOT_YOUR_TURN, currentSide);
    }

    public static String formatNotInProgress(String status) {
        return String.format(NOT_IN_PROGRESS, status);
    }

    // ========== 对局生命周期 ==========

    /** 在线对局已满员或已开始 */
    public static final String MATCH_NOT_JOINABLE = "对局不可加入（当前状态 %s）";

    /** 不能加入自己创建的对局 */
    public static final String CANNOT_JOIN_OWN_MATCH = "不能加入自己创建的对局";

    /** 玩家不属于该对局 */
    public static final String NOT_A_PARTICIPANT = "玩家 %s 不是该对局的参与者";

    /** 当前不是 AI 回合 */
    public static final String NOT_AI_TURN = "当前不是 AI 回合";

    /** 非人机对局 */
    public static final String NOT_AI_MATCH = "该对局不是人机模式";

    /** 缺少玩家 ID */
    public static final String PLAYER_ID_REQUIRED = "该模式需要玩家 ID";

    /** 缺少棋色 */
    public static final String SIDE_REQUIRED = "本地对局需要指定棋色";

    public static String formatNotJoinable(String status) {
        return String.format(MATCH_NOT_JOINABLE, status);
    }

    public static String formatNotParticipant(String playerId) {
        return String.format(NOT_A_PARTICIPANT, playerId);
    }

    // ========== 匹配与服务器池 ==========

    /** 积分不合法 */
    public static final String INVALID_RATING = "积分不合法: %d（允许范围 %d..%d）";

    /** 无可用服务器 */
    public static final String NO_SERVER_AVAILABLE = "暂无可用的游戏服务器";

    /** 指定服务器不存在或不健康 */
    public static final String SERVER_NOT_AVAILABLE = "服务器不可用: %s";

    public static String formatInvalidRating(int rating, int min, int max) {
        return String.format(INVALID_RATING, rating, min, max);
    }

    public static String formatServerNotAvailable(String serverId) {
        return String.format(SERVER_NOT_AVAILABLE, serverId);
    }

    // ========== 战绩查询 ==========

    public static final String PLAYER_ID_BLANK = "玩家 ID 不能为空";

    /** 条数越界 */
    public static final String LIMIT_OUT_OF_RANGE = "limit 取值范围 1..%d: %d";

    public static String formatLimitOutOfRange(int max, int limit) {
        return String.format(LIMIT_OUT_OF_RANGE, max, limit);
    }
}
