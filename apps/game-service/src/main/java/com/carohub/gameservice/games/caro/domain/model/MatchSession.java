package com.carohub.gameservice.games.caro.domain.model;

import com.carohub.gameservice.games.caro.domain.constants.GameMessages;
import com.carohub.gameservice.games.caro.domain.enums.Cell;
import com.carohub.gameservice.games.caro.domain.enums.Difficulty;
import com.carohub.gameservice.games.caro.domain.enums.DisconnectOutcome;
import com.carohub.gameservice.games.caro.domain.enums.MatchMode;
import com.carohub.gameservice.games.caro.domain.enums.MatchStatus;
import com.carohub.gameservice.games.caro.domain.exception.InvalidMoveException;
import com.carohub.gameservice.games.caro.domain.exception.InvalidMoveException.Reason;
import com.carohub.gameservice.games.caro.domain.rule.CaroJudge;
import com.carohub.gameservice.games.caro.domain.rule.Outcome;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 一局 Caro 的权威状态与生命周期。
 * <p>
 * 状态机：WAITING → IN_PROGRESS → COMPLETED | ABANDONED（LOCAL / AI 直接从 IN_PROGRESS 开始）。
 * 所有状态变更都在本局的 {@link ReentrantLock} 内串行执行；
 * 终局通过 status 的 IN_PROGRESS → COMPLETED 比较并交换完成，落子、认输、断线中只有一方能认领成功，
 * 认领成功者负责后续结算。
 */
@Getter
public class MatchSession {

    private final String id;
    private final MatchMode mode;
    /** 仅 AI 模式 */
    private final Difficulty difficulty;
    private volatile Participant black;
    private volatile Participant white;
    /** AI 执子颜色，仅 AI 模式 */
    private final Cell aiSide;

    @Getter(AccessLevel.NONE)
    private final Board board;
    private volatile Cell currentTurn;

    @Getter(AccessLevel.NONE)
    private final AtomicReference<MatchStatus> status;
    private volatile Outcome outcome;
    private volatile List<Coord> winningLine;

    @Getter(AccessLevel.NONE)
    private final List<Move> moves;

    private volatile String serverId;
    private volatile EloChange blackEloChange;
    private volatile EloChange whiteEloChange;
    private final long createdAt;
    private volatile long updatedAt;

    @Getter(AccessLevel.NONE)
    private final ReentrantLock lock = new ReentrantLock();

    @Builder(builderMethodName = "restore")
    private MatchSession(String id, MatchMode mode, Difficulty difficulty,
                         Participant black, Participant white, Cell aiSide,
                         Board board, Cell currentTurn, MatchStatus status, Outcome outcome,
                         List<Coord> winningLine, List<Move> moves, String serverId,
                         EloChange blackEloChange, EloChange whiteEloChange,
                         long createdAt, long updatedAt) {
        this.id = id;
        this.mode = mode;
        this.difficulty = difficulty;
        this.black = black;
        this.white = white;
        this.aiSide = aiSide;
        this.board = board == null ? new Board() : board;
        this.currentTurn = currentTurn == null ? Cell.BLACK : currentTurn;
        this.status = new AtomicReference<>(status == null ? MatchStatus.IN_PROGRESS : status);
        this.outcome = outcome == null ? Outcome.ONGOING : outcome;
        this.winningLine = winningLine == null ? List.of() : List.copyOf(winningLine);
        this.moves = moves == null ? new ArrayList<>() : new ArrayList<>(moves);
        this.serverId = serverId;
        this.blackEloChange = blackEloChange;
        this.whiteEloChange = whiteEloChange;
        long now = System.currentTimeMillis();
        this.createdAt = createdAt > 0 ? createdAt : now;
        this.updatedAt = updatedAt > 0 ? updatedAt : this.createdAt;
    }

    // ================== 创建 ==================

    /** 本地双人对局：不绑定玩家，直接开局 */
    public static MatchSession local(String id) {
        return restore().id(id).mode(MatchMode.LOCAL).status(MatchStatus.IN_PROGRESS).build();
    }

    /** 人机对局：真人执 humanSide，AI 执另一色 */
    public static MatchSession againstAi(String id, Participant human, Cell humanSide, Difficulty difficulty) {
        boolean humanBlack = humanSide != Cell.WHITE;
        return restore().id(id).mode(MatchMode.AI)
                .difficulty(difficulty == null ? Difficulty.MEDIUM : difficulty)
                .black(humanBlack ? human : Participant.ai())
                .white(humanBlack ? Participant.ai() : human)
                .aiSide(humanBlack ? Cell.WHITE : Cell.BLACK)
                .status(MatchStatus.IN_PROGRESS)
                .build();
    }

    /** 在线对局（房主执黑），等待第二名玩家入座 */
    public static MatchSession openOnline(String id, Participant host) {
        return restore().id(id).mode(MatchMode.ONLINE).black(host).status(MatchStatus.WAITING).build();
    }

    /** 匹配成功的在线对局：双方已就位，直接开局 */
    public static MatchSession pairedOnline(String id, Participant black, Participant white) {
        return restore().id(id).mode(MatchMode.ONLINE).black(black).white(white)
                .status(MatchStatus.IN_PROGRESS).build();
    }

    // ================== 状态迁移 ==================

    /**
     * 第二名玩家入座，WAITING → IN_PROGRESS。
     */
    public void seat(Participant guest) {
        lock.lock();
        try {
            MatchStatus cur = status.get();
            if (cur != MatchStatus.WAITING) {
                throw new IllegalStateException(GameMessages.formatNotJoinable(cur.name()));
            }
            if (black != null && black.playerId().equals(guest.playerId())) {
                throw new IllegalArgumentException(GameMessages.CANNOT_JOIN_OWN_MATCH);
            }
            white = guest;
            status.set(MatchStatus.IN_PROGRESS);
            touch();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 落子：校验状态、回合、空位；成功后记录历史、换手、判胜/判和。
     * 任一校验失败都不改变状态。
     */
    public MoveApplied makeMove(int row, int col, Cell symbol) {
        lock.lock();
        try {
            MatchStatus cur = status.get();
            if (cur != MatchStatus.IN_PROGRESS) {
                throw new InvalidMoveException(Reason.NOT_IN_PROGRESS, GameMessages.formatNotInProgress(cur.name()));
            }
            if (symbol != currentTurn) {
                throw new InvalidMoveException(Reason.NOT_YOUR_TURN, GameMessages.formatNotYourTurn(currentTurn.code()));
            }
            CaroJudge.applyMove(board, row, col, symbol);

            Move move = new Move(row, col, symbol, moves.size() + 1);
            moves.add(move);
            currentTurn = symbol.opponent();

            boolean finished = false;
            Optional<List<Coord>> line = CaroJudge.checkWin(board, row, col, symbol);
            if (line.isPresent()) {
                finished = claimFinish(Outcome.winOf(symbol), line.get());
            } else if (CaroJudge.isFull(board)) {
                finished = claimFinish(Outcome.DRAW, List.of());
            }
            touch();
            return new MoveApplied(move, outcome, winningLine, finished);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 认输：仅进行中有效，对方获胜。
     */
    public boolean forfeit(Cell side) {
        lock.lock();
        try {
            MatchStatus cur = status.get();
            if (cur != MatchStatus.IN_PROGRESS) {
                throw new IllegalStateException(GameMessages.formatNotInProgress(cur.name()));
            }
            return claimFinish(Outcome.winOf(side.opponent()), List.of());
        } finally {
            lock.unlock();
        }
    }

    /**
     * 断线：进行中按认输处理；等待中直接放弃；已结束则忽略（断线通知可能晚于终局落子）。
     */
    public DisconnectOutcome disconnect(Cell side) {
        lock.lock();
        try {
            if (status.compareAndSet(MatchStatus.WAITING, MatchStatus.ABANDONED)) {
                touch();
                return DisconnectOutcome.ABANDONED;
            }
            if (side == null) {
                return DisconnectOutcome.IGNORED;
            }
            return claimFinish(Outcome.winOf(side.opponent()), List.of())
                    ? DisconnectOutcome.FINISHED
                    : DisconnectOutcome.IGNORED;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 终局认领：只有把 status 从 IN_PROGRESS 换成 COMPLETED 的调用方返回 true。
     */
    private boolean claimFinish(Outcome result, List<Coord> line) {
        if (!status.compareAndSet(MatchStatus.IN_PROGRESS, MatchStatus.COMPLETED)) {
            return false;
        }
        outcome = result;
        winningLine = List.copyOf(line);
        touch();
        return true;
    }

    // ================== 结算回写 ==================

    public void assignServer(String serverId) {
        this.serverId = serverId;
        touch();
    }

    public void recordEloChanges(EloChange black, EloChange white) {
        this.blackEloChange = black;
        this.whiteEloChange = white;
        touch();
    }

    /**
     * 在本局锁内执行：快照的读取与写出和状态变更互斥，写出的先后与状态的先后一致
     */
    public void underLock(Runnable action) {
        lock.lock();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }

    // ================== 查询 ==================

    public MatchStatus getStatus() {
        return status.get();
    }

    /** 棋盘副本 */
    public Board boardSnapshot() {
        lock.lock();
        try {
            return board.copy();
        } finally {
            lock.unlock();
        }
    }

    public List<Move> getMoves() {
        lock.lock();
        try {
            return List.copyOf(moves);
        } finally {
            lock.unlock();
        }
    }

    public Participant participant(Cell side) {
        return switch (side) {
            case BLACK -> black;
            case WHITE -> white;
            case EMPTY -> null;
        };
    }

    /** 玩家所执颜色；不在本局返回 null */
    public Cell sideOf(String playerId) {
        if (playerId == null) return null;
        if (black != null && playerId.equals(black.playerId())) return Cell.BLACK;
        if (white != null && playerId.equals(white.playerId())) return Cell.WHITE;
        return null;
    }

    /** 当前是否轮到 AI 落子 */
    public boolean isAiTurn() {
        return mode == MatchMode.AI && status.get() == MatchStatus.IN_PROGRESS && currentTurn == aiSide;
    }

    public boolean isFinished() {
        MatchStatus s = status.get();
        return s == MatchStatus.COMPLETED || s == MatchStatus.ABANDONED;
    }

    private void touch() {
        updatedAt = System.currentTimeMillis();
    }
}
