package com.carohub.gameservice.games.caro.domain.rating;

/** 一局结算后双方的积分变化（基于同一份赛前快照） */
public record SettledRatings(RatingChange black, RatingChange white) {
}
