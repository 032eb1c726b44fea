package com.carohub.gameservice.games.caro.service.impl;

import com.carohub.gameservice.application.user.UserDirectoryService;
import com.carohub.gameservice.application.user.UserProfileView;
import com.carohub.gameservice.games.caro.application.MatchSettlement;
import com.carohub.gameservice.games.caro.domain.ai.CaroAI;
import com.carohub.gameservice.games.caro.domain.constants.GameMessages;
import com.carohub.gameservice.games.caro.domain.dto.MatchRecordConverter;
import com.carohub.gameservice.games.caro.domain.enums.Cell;
import com.carohub.gameservice.games.caro.domain.enums.Difficulty;
import com.carohub.gameservice.games.caro.domain.enums.DisconnectOutcome;
import com.carohub.gameservice.games.caro.domain.enums.MatchMode;
import com.carohub.gameservice.games.caro.domain.exception.InvalidMoveException;
import com.carohub.gameservice.games.caro.domain.exception.InvalidMoveException.Reason;
import com.carohub.gameservice.games.caro.domain.exception.SessionNotFoundException;
import com.carohub.gameservice.games.caro.domain.model.Coord;
import com.carohub.gameservice.games.caro.domain.model.EloChange;
import com.carohub.gameservice.games.caro.domain.model.MatchSession;
import com.carohub.gameservice.games.caro.domain.model.MoveApplied;
import com.carohub.gameservice.games.caro.domain.model.Participant;
import com.carohub.gameservice.games.caro.domain.repository.MatchRecordRepository;
import com.carohub.gameservice.games.caro.domain.repository.PlayerRecordRepository;
import com.carohub.gameservice.games.caro.service.LeaveResult;
import com.carohub.gameservice.games.caro.service.MatchProperties;
import com.carohub.gameservice.games.caro.service.MatchService;
import com.carohub.gameservice.games.caro.service.MoveResult;
import com.carohub.gameservice.pool.domain.PoolUnavailableException;
import com.carohub.gameservice.pool.domain.model.ServerRecord;
import com.carohub.gameservice.pool.service.ServerPoolService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Service
@RequiredArgsConstructor
public class MatchServiceImpl implements MatchService {

    // ====== 内存对局表 ======
    private final Map<String, MatchSession> sessions = new ConcurrentHashMap<>();

    private final MatchRecordRepository matchRepo;
    private final PlayerRecordRepository players;
    private final MatchSettlement settlement;
    private final ServerPoolService serverPool;
    private final UserDirectoryService userDirectory;
    private final CaroAI caroAI;
    private final MatchProperties props;

    // ================== 创建 ==================

    @Override
    public MatchSession createLocal() {
        MatchSession s = MatchSession.local(newId());
        register(s);
        log.info("创建本地对局: matchId={}", s.getId());
        return s;
    }

    @Override
    public MatchSession createAiMatch(String playerId, Cell humanSide, Difficulty difficulty) {
        requirePlayer(playerId);
        Participant human = participantOf(playerId);
        MatchSession s = MatchSession.againstAi(newId(), human, humanSide == null ? Cell.BLACK : humanSide, difficulty);
        register(s);
        log.info("创建人机对局: matchId={}, playerId={}, aiSide={}, difficulty={}",
                s.getId(), playerId, s.getAiSide(), s.getDifficulty());
        return s;
    }

    @Override
    public MatchSession openOnline(String hostPlayerId) {
        requirePlayer(hostPlayerId);
        MatchSession s = MatchSession.openOnline(newId(), participantOf(hostPlayerId));
        place(s);
        register(s);
        log.info("创建在线对局: matchId={}, host={}, serverId={}", s.getId(), hostPlayerId, s.getServerId());
        return s;
    }

    @Override
    public MatchSession joinOnline(String matchId, String playerId) {
        requirePlayer(playerId);
        MatchSession s = get(matchId);
        if (s.getMode() != MatchMode.ONLINE) {
            throw new IllegalStateException(GameMessages.formatNotJoinable(s.getStatus().name()));
        }
        s.seat(participantOf(playerId));
        persist(s);
        log.info("玩家入座: matchId={}, playerId={}", matchId, playerId);
        return s;
    }

    @Override
    public MatchSession startPairedMatch(String matchId, Participant black, Participant white) {
        MatchSession s = MatchSession.pairedOnline(matchId, black, white);
        place(s);
        register(s);
        log.info("匹配对局开始: matchId={}, black={}({}), white={}({}), serverId={}", matchId,
                black.playerId(), black.ratingBefore(), white.playerId(), white.ratingBefore(), s.getServerId());
        return s;
    }

    // ================== 对局进行 ==================

    @Override
    public MoveResult makeMove(String matchId, String playerId, int row, int col, Cell symbol) {
        MatchSession s = get(matchId);
        Cell side = resolveMover(s, playerId, symbol);
        MoveApplied applied = s.makeMove(row, col, side);
        log.debug("落子: matchId={}, seq={}, ({},{}) {}", matchId, applied.move().seq(), row, col, side);
        return afterMove(s, applied);
    }

    @Override
    public MoveResult aiMove(String matchId) {
        MatchSession s = get(matchId);
        if (s.getMode() != MatchMode.AI) {
            throw new IllegalStateException(GameMessages.NOT_AI_MATCH);
        }
        if (!s.isAiTurn()) {
            throw new IllegalStateException(GameMessages.NOT_AI_TURN);
        }
        Coord c = caroAI.selectMove(s.boardSnapshot(), s.getAiSide(), s.getDifficulty());
        MoveApplied applied = s.makeMove(c.row(), c.col(), s.getAiSide());
        log.debug("AI 落子: matchId={}, seq={}, ({},{})", matchId, applied.move().seq(), c.row(), c.col());
        return afterMove(s, applied);
    }

    @Override
    public LeaveResult forfeit(String matchId, String playerId, Cell side) {
        MatchSession s = get(matchId);
        Cell leaving;
        if (s.getMode() == MatchMode.LOCAL) {
            if (side == null || !side.isStone()) {
                throw new IllegalArgumentException(GameMessages.SIDE_REQUIRED);
            }
            leaving = side;
        } else {
            leaving = requireSide(s, playerId);
        }
        boolean finished = s.forfeit(leaving);
        List<EloChange> changes = finished ? settlement.settle(s) : List.of();
        persist(s);
        log.info("认输: matchId={}, playerId={}, side={}, outcome={}", matchId, playerId, leaving, s.getOutcome());
        return new LeaveResult(matchId, playerId, leaving, s.getStatus(), s.getOutcome(), finished, changes);
    }

    @Override
    public LeaveResult disconnect(String matchId, String playerId) {
        MatchSession s = get(matchId);
        Cell side = s.sideOf(playerId);
        if (side == null) {
            log.debug("非参与者断线，忽略: matchId={}, playerId={}", matchId, playerId);
            return new LeaveResult(matchId, playerId, null, s.getStatus(), s.getOutcome(), false, List.of());
        }
        DisconnectOutcome result = s.disconnect(side);
        List<EloChange> changes = List.of();
        switch (result) {
            case FINISHED -> changes = settlement.settle(s);
            case ABANDONED -> settlement.releaseServer(s);
            case IGNORED -> {
                log.debug("断线忽略（对局已结束）: matchId={}, playerId={}", matchId, playerId);
                return new LeaveResult(matchId, playerId, side, s.getStatus(), s.getOutcome(), false, List.of());
            }
        }
        persist(s);
        log.info("玩家断线: matchId={}, playerId={}, result={}, outcome={}", matchId, playerId, result, s.getOutcome());
        return new LeaveResult(matchId, playerId, side, s.getStatus(), s.getOutcome(),
                result == DisconnectOutcome.FINISHED, changes);
    }

    // ================== 查询 ==================

    /**
     * 获取对局（内存优先，未命中则从 Redis 加载）
     */
    @Override
    public MatchSession get(String matchId) {
        if (StringUtils.isBlank(matchId)) {
            throw new SessionNotFoundException(matchId);
        }
        MatchSession cached = sessions.get(matchId);
        if (cached != null) return cached;

        MatchSession restored = matchRepo.get(matchId)
                .map(MatchRecordConverter::fromRecord)
                .orElseThrow(() -> new SessionNotFoundException(matchId));
        MatchSession prev = sessions.putIfAbsent(matchId, restored);
        log.info("从 Redis 恢复对局: matchId={}, status={}", matchId, restored.getStatus());
        return prev != null ? prev : restored;
    }

    @Override
    public int evictFinished() {
        long cutoff = System.currentTimeMillis() - Duration.ofMinutes(props.getFinishedRetentionMinutes()).toMillis();
        int before = sessions.size();
        sessions.values().removeIf(s -> s.isFinished() && s.getUpdatedAt() < cutoff);
        int evicted = before - sessions.size();
        if (evicted > 0) {
            log.debug("移出已结束对局 {} 个", evicted);
        }
        return evicted;
    }

    // ================== 内部 ==================

    private MoveResult afterMove(MatchSession s, MoveApplied applied) {
        List<EloChange> changes = applied.finishedHere() ? settlement.settle(s) : List.of();
        persist(s);
        if (applied.finishedHere()) {
            log.info("对局结束: matchId={}, outcome={}, moves={}", s.getId(), s.getOutcome(), applied.move().seq());
        }
        return new MoveResult(s.getId(), applied.move(), applied.outcome(), applied.winningLine(),
                applied.outcome().isFinal(), changes);
    }

    /**
     * 确定落子方：在线按玩家身份；人机只允许真人；本地取传入棋色或当前回合。
     */
    private Cell resolveMover(MatchSession s, String playerId, Cell symbol) {
        Cell side = switch (s.getMode()) {
            case LOCAL -> symbol != null ? symbol : s.getCurrentTurn();
            case AI -> {
                Cell human = s.getAiSide().opponent();
                if (playerId != null && s.sideOf(playerId) != human) {
                    throw new IllegalArgumentException(GameMessages.formatNotParticipant(playerId));
                }
                yield human;
            }
            case ONLINE -> requireSide(s, playerId);
        };
        if (symbol != null && symbol != side) {
            throw new InvalidMoveException(Reason.NOT_YOUR_TURN, GameMessages.formatNotYourTurn(s.getCurrentTurn().code()));
        }
        return side;
    }

    private Cell requireSide(MatchSession s, String playerId) {
        requirePlayer(playerId);
        Cell side = s.sideOf(playerId);
        if (side == null) {
            throw new IllegalArgumentException(GameMessages.formatNotParticipant(playerId));
        }
        return side;
    }

    private void requirePlayer(String playerId) {
        if (StringUtils.isBlank(playerId)) {
            throw new IllegalArgumentException(GameMessages.PLAYER_ID_REQUIRED);
        }
    }

    private Participant participantOf(String playerId) {
        UserProfileView profile = userDirectory.getUserInfo(playerId);
        int rating = players.findOrCreate(playerId).getRating();
        return new Participant(playerId, UserProfileView.displayNameOr(profile, playerId), rating);
    }

    /** 在线对局放到服务器池上；池不可用时本地承载 */
    private void place(MatchSession s) {
        try {
            ServerRecord server = serverPool.assign(s.getId(), null, null);
            s.assignServer(server.getServerId());
        } catch (PoolUnavailableException e) {
            log.warn("服务器池不可用，对局由本节点承载: matchId={}, reason={}", s.getId(), e.getMessage());
        }
    }

    private void register(MatchSession s) {
        sessions.put(s.getId(), s);
        persist(s);
    }

    /**
     * 写 Redis 快照；Redis 不可用时内存仍是权威状态。
     * 取快照与写出都在本局锁内，后写出的快照不会比先写出的旧。
     */
    private void persist(MatchSession s) {
        s.underLock(() -> {
            Duration ttl = s.isFinished()
                    ? Duration.ofDays(props.getHistoryTtlDays())
                    : Duration.ofHours(props.getTtlHours());
            try {
                matchRepo.save(MatchRecordConverter.toRecord(s), ttl);
            } catch (DataAccessException e) {
                log.warn("对局快照写入失败，仅保留内存状态: matchId={}, err={}", s.getId(), e.getMessage());
            }
        });
    }

    private static String newId() {
        return UUID.randomUUID().toString();
    }
}
