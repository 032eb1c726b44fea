package com.carohub.gameservice.infrastructure.store;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;

import java.time.Clock;
import java.time.Duration;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * 共享存储降级器：
 * - 正常时所有操作走 primary（Redis 实现）；
 * - primary 抛出 {@link DataAccessException} 时，本次操作改由 fallback（内存实现）完成，
 *   并在冷却期内后续操作直接走 fallback；
 * - 冷却期过后再次尝试 primary。
 *
 * @param <S> 存储接口类型
 */
@Slf4j
public class StoreFailover<S> {

    private final String name;
    private final S primary;
    private final S fallback;
    private final Clock clock;
    private final Duration cooldown;

    /** 降级截止时间（epoch millis），0 表示未降级 */
    private volatile long degradedUntil;

    public StoreFailover(String name, S primary, S fallback, Clock clock, Duration cooldown) {
        this.name = name;
        this.primary = primary;
        this.fallback = fallback;
        this.clock = clock;
        this.cooldown = cooldown;
    }

    public <T> T call(Function<S, T> op) {
        if (isDegraded()) {
            return op.apply(fallback);
        }
        try {
            return op.apply(primary);
        } catch (DataAccessException e) {
            degrade(e);
            return op.apply(fallback);
        }
    }

    public void run(Consumer<S> op) {
        call(s -> {
            op.accept(s);
            return null;
        });
    }

    public boolean isDegraded() {
        long until = degradedUntil;
        if (until == 0) {
            return false;
        }
        if (clock.millis() >= until) {
            degradedUntil = 0;
            log.info("[{}] 降级冷却结束，恢复使用 Redis", name);
            return false;
        }
        return true;
    }

    private void degrade(DataAccessException e) {
        degradedUntil = clock.millis() + cooldown.toMillis();
        log.warn("[{}] Redis 不可用，{}s 内改用内存存储: {}", name, cooldown.getSeconds(), e.getMessage());
    }
}
