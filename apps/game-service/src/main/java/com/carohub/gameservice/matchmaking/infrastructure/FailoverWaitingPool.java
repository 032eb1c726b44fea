package com.carohub.gameservice.matchmaking.infrastructure;

import com.carohub.gameservice.infrastructure.store.StoreFailover;
import com.carohub.gameservice.matchmaking.domain.model.QueueEntry;
import com.carohub.gameservice.matchmaking.domain.repository.WaitingPool;
import lombok.RequiredArgsConstructor;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 带降级的等待池：Redis 出错时改用内存等待池，加入匹配不会因此失败。
 */
@RequiredArgsConstructor
public class FailoverWaitingPool implements WaitingPool {

    private final StoreFailover<WaitingPool> failover;

    @Override
    public void enqueue(QueueEntry entry) {
        failover.run(p -> p.enqueue(entry));
    }

    @Override
    public Optional<QueueEntry> get(String playerId) {
        return failover.call(p -> p.get(playerId));
    }

    @Override
    public boolean refreshIfWaiting(QueueEntry entry) {
        return failover.call(p -> p.refreshIfWaiting(entry));
    }

    @Override
    public boolean expireIfWaiting(QueueEntry expired) {
        return failover.call(p -> p.expireIfWaiting(expired));
    }

    @Override
    public boolean discardIfSettled(String playerId) {
        return failover.call(p -> p.discardIfSettled(playerId));
    }

    @Override
    public boolean remove(String playerId) {
        return failover.call(p -> p.remove(playerId));
    }

    @Override
    public List<QueueEntry> waitingInRange(int min, int max) {
        return failover.call(p -> p.waitingInRange(min, max));
    }

    @Override
    public List<QueueEntry> allWaiting() {
        return failover.call(WaitingPool::allWaiting);
    }

    @Override
    public List<QueueEntry> allEntries() {
        return failover.call(WaitingPool::allEntries);
    }

    @Override
    public boolean claimPair(QueueEntry matchedA, QueueEntry matchedB) {
        return failover.call(p -> p.claimPair(matchedA, matchedB));
    }

    @Override
    public Long positionOf(String playerId) {
        return failover.call(p -> p.positionOf(playerId));
    }

    @Override
    public long waitingCount() {
        return failover.call(WaitingPool::waitingCount);
    }

    @Override
    public void incrementCounter(String counter) {
        failover.run(p -> p.incrementCounter(counter));
    }

    @Override
    public Map<String, Long> counters() {
        return failover.call(WaitingPool::counters);
    }
}
