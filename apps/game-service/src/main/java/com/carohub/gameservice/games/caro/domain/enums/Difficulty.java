package com.carohub.gameservice.games.caro.domain.enums;

/**
 * AI 难度。
 * HARD 目前与 MEDIUM 使用同一套启发式，尚未接入更深的搜索。
 */
public enum Difficulty {
    EASY,
    MEDIUM,
    HARD;

    /** 宽松解析，未知值按 MEDIUM 处理 */
    public static Difficulty parse(String value) {
        if (value == null || value.isBlank()) {
            return MEDIUM;
        }
        try {
            return Difficulty.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return MEDIUM;
        }
    }
}
