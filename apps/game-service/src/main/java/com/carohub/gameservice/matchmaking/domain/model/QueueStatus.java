package com.carohub.gameservice.matchmaking.domain.model;

public enum QueueStatus {
    WAITING,  // 在等待池中，可被匹配
    MATCHED,  // 已配对
    EXPIRED   // 长时间无心跳，失去匹配资格
}
