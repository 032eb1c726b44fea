package com.carohub.gameservice.games.caro.service;

import com.carohub.gameservice.games.caro.domain.enums.Cell;
import com.carohub.gameservice.games.caro.domain.enums.Difficulty;
import com.carohub.gameservice.games.caro.domain.model.MatchSession;
import com.carohub.gameservice.games.caro.domain.model.Participant;

/**
 * Caro 对局服务：创建、入座、落子、AI 回合、认输、断线。
 * 对局在内存中维护，每次变更后写入 Redis 快照；内存丢失时从快照恢复。
 */
public interface MatchService {

    /** 本地双人对局 */
    MatchSession createLocal();

    /**
     * 人机对局
     * @param humanSide 真人执子，默认 BLACK
     */
    MatchSession createAiMatch(String playerId, Cell humanSide, Difficulty difficulty);

    /** 开一个在线对局，房主执黑，等待第二名玩家 */
    MatchSession openOnline(String hostPlayerId);

    /** 加入等待中的在线对局 */
    MatchSession joinOnline(String matchId, String playerId);

    /**
     * 匹配成功后建局：双方以排队时的积分作为赛前快照，并放到服务器池上
     */
    MatchSession startPairedMatch(String matchId, Participant black, Participant white);

    /**
     * 落子
     * @param playerId 在线/人机对局必填，本地对局可空
     * @param symbol   可空；本地对局为空时取当前回合方
     */
    MoveResult makeMove(String matchId, String playerId, int row, int col, Cell symbol);

    /** 轮到 AI 时让 AI 落子 */
    MoveResult aiMove(String matchId);

    /**
     * 认输
     * @param side 本地对局必填；其他模式按 playerId 判断
     */
    LeaveResult forfeit(String matchId, String playerId, Cell side);

    /** 断线 / 离开，幂等 */
    LeaveResult disconnect(String matchId, String playerId);

    /**
     * 获取对局（内存优先，未命中从 Redis 恢复）
     * @throws com.carohub.gameservice.games.caro.domain.exception.SessionNotFoundException 都不存在
     */
    MatchSession get(String matchId);

    /**
     * 把结束已久的对局移出内存
     * @return 移出数量
     */
    int evictFinished();
}
