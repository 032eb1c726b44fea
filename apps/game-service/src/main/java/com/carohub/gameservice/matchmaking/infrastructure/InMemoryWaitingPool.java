package com.carohub.gameservice.matchmaking.infrastructure;

import com.carohub.gameservice.matchmaking.domain.model.QueueEntry;
import com.carohub.gameservice.matchmaking.domain.repository.WaitingPool;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 等待池的进程内实现（Redis 不可用时的降级存储，也用于测试）。
 * 等待集合的读写都在同一把对象锁下，claimPair 因此是原子的。
 */
public class InMemoryWaitingPool implements WaitingPool {

    private final Map<String, QueueEntry> entries = new HashMap<>();
    private final Set<String> waiting = new HashSet<>();
    private final Map<String, AtomicLong> counters = new ConcurrentHashMap<>();

    @Override
    public synchronized void enqueue(QueueEntry entry) {
        entries.put(entry.getPlayerId(), copy(entry));
        waiting.add(entry.getPlayerId());
    }

    @Override
    public synchronized Optional<QueueEntry> get(String playerId) {
        return Optional.ofNullable(entries.get(playerId)).map(this::copy);
    }

    @Override
    public synchronized boolean refreshIfWaiting(QueueEntry entry) {
        if (!waiting.contains(entry.getPlayerId())) {
            return false;
        }
        entries.put(entry.getPlayerId(), copy(entry));
        return true;
    }

    @Override
    public synchronized boolean expireIfWaiting(QueueEntry expired) {
        if (!waiting.remove(expired.getPlayerId())) {
            return false;
        }
        entries.put(expired.getPlayerId(), copy(expired));
        return true;
    }

    @Override
    public synchronized boolean discardIfSettled(String playerId) {
        if (waiting.contains(playerId)) {
            return false;
        }
        return entries.remove(playerId) != null;
    }

    @Override
    public synchronized boolean remove(String playerId) {
        entries.remove(playerId);
        return waiting.remove(playerId);
    }

    @Override
    public synchronized List<QueueEntry> waitingInRange(int min, int max) {
        List<QueueEntry> out = new ArrayList<>();
        for (String id : waiting) {
            QueueEntry e = entries.get(id);
            if (e != null && e.getRating() >= min && e.getRating() <= max) {
                out.add(copy(e));
            }
        }
        out.sort(Comparator.comparingInt(QueueEntry::getRating));
        return out;
    }

    @Override
    public synchronized List<QueueEntry> allWaiting() {
        return waitingInRange(Integer.MIN_VALUE, Integer.MAX_VALUE);
    }

    @Override
    public synchronized List<QueueEntry> allEntries() {
        return entries.values().stream().map(this::copy).toList();
    }

    @Override
    public synchronized boolean claimPair(QueueEntry matchedA, QueueEntry matchedB) {
        String a = matchedA.getPlayerId();
        String b = matchedB.getPlayerId();
        if (a.equals(b) || !waiting.contains(a) || !waiting.contains(b)) {
            return false;
        }
        waiting.remove(a);
        waiting.remove(b);
        entries.put(a, copy(matchedA));
        entries.put(b, copy(matchedB));
        return true;
    }

    @Override
    public synchronized Long positionOf(String playerId) {
        if (!waiting.contains(playerId)) {
            return null;
        }
        List<QueueEntry> byRatingDesc = new ArrayList<>(allWaiting());
        byRatingDesc.sort(Comparator.comparingInt(QueueEntry::getRating).reversed()
                .thenComparing(QueueEntry::getPlayerId, Comparator.reverseOrder()));
        for (int i = 0; i < byRatingDesc.size(); i++) {
            if (byRatingDesc.get(i).getPlayerId().equals(playerId)) {
                return (long) i;
            }
        }
        return null;
    }

    @Override
    public synchronized long waitingCount() {
        return waiting.size();
    }

    @Override
    public void incrementCounter(String counter) {
        counters.computeIfAbsent(counter, k -> new AtomicLong()).incrementAndGet();
    }

    @Override
    public Map<String, Long> counters() {
        Map<String, Long> out = new HashMap<>();
        counters.forEach((k, v) -> out.put(k, v.get()));
        return out;
    }

    private QueueEntry copy(QueueEntry e) {
        return e.toBuilder().build();
    }
}
