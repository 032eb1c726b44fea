package com.carohub.gameservice.matchmaking.domain;

import lombok.RequiredArgsConstructor;

/**
 * 搜索范围随等待时间扩大：
 * range = baseRange + min(floor(waited / step) * perStep, maxExpansion)
 * 对等待时长单调不减。
 */
@RequiredArgsConstructor
public class RangeExpansionPolicy {

    private final MatchmakingProperties props;

    public int rangeFor(long waitedSeconds) {
        long steps = Math.max(0, waitedSeconds) / Math.max(1, props.getExpansionStepSeconds());
        long expansion = Math.min(steps * props.getExpansionPerStep(), props.getMaxExpansion());
        return props.getBaseRange() + (int) expansion;
    }
}
