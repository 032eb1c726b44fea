package com.carohub.gameservice.games.caro.domain.rating;

/** 单方积分变化：新积分与增量 */
public record RatingChange(int oldRating, int newRating, int delta) {
}
