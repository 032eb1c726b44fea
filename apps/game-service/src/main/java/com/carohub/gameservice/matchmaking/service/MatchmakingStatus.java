package com.carohub.gameservice.matchmaking.service;

/** 匹配接口返回的状态 */
public enum MatchmakingStatus {
    MATCHED,
    SEARCHING,
    NOT_IN_QUEUE
}
