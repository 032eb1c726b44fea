package com.carohub.gameservice.games.caro.domain.dto;

import com.carohub.gameservice.games.caro.domain.model.Coord;
import com.carohub.gameservice.games.caro.domain.model.Move;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * MatchRecord
 * -------------------------------------------------------
 * 一局对局的持久化快照（用于 Redis 存储与重启恢复）。
 * - board 为 15x15=225 长度的紧凑字符串（'.','X','O'）；
 * - 枚举均存为名称字符串，便于跨版本兼容。
 * -------------------------------------------------------
 */
@Data
public class MatchRecord {
    private String id;
    /** LOCAL / ONLINE / AI */
    private String mode;
    /** EASY / MEDIUM / HARD，仅 AI 模式 */
    private String difficulty;

    private String blackId;
    private String blackName;
    private String whiteId;
    private String whiteName;
    /** AI 执子："X"/"O"，仅 AI 模式 */
    private String aiSide;

    /** 15x15 棋盘紧凑字符串 */
    private String board;
    /** 当前执子："X"/"O" */
    private String currentTurn;
    private String status;
    /** ONGOING / BLACK_WIN / WHITE_WIN / DRAW */
    private String outcome;
    private List<Coord> winningLine = new ArrayList<>();
    private List<Move> moves = new ArrayList<>();
    private String serverId;

    // ---- 积分快照（赛前 / 赛后 / 增量） ----
    private int blackRatingBefore;
    private Integer blackRatingAfter;
    private Integer blackRatingDelta;
    private Long blackRankBefore;
    private Long blackRankAfter;
    private int whiteRatingBefore;
    private Integer whiteRatingAfter;
    private Integer whiteRatingDelta;
    private Long whiteRankBefore;
    private Long whiteRankAfter;

    private long createdAt;
    private long updatedAt;
}
