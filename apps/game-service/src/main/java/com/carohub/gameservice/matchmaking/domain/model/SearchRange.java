package com.carohub.gameservice.matchmaking.domain.model;

/** 积分搜索区间 [min, max] */
public record SearchRange(int min, int max) {

    public static SearchRange around(int rating, int range) {
        return new SearchRange(rating - range, rating + range);
    }

    public boolean contains(int rating) {
        return rating >= min && rating <= max;
    }
}
