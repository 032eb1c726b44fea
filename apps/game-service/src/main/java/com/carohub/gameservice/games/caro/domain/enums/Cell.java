package com.carohub.gameservice.games.caro.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 棋盘格状态（封闭枚举）：空 / 黑子 / 白子。
 * 约定：EMPTY='.', BLACK='X'（先手）, WHITE='O'
 */
public enum Cell {
    /** 空位 */
    EMPTY('.'),
    /** 黑子（先手） */
    BLACK('X'),
    /** 白子（后手） */
    WHITE('O');

    private final char symbol;

    Cell(char symbol) {
        this.symbol = symbol;
    }

    /** 单字符标记，用于棋盘紧凑字符串 */
    public char symbol() {
        return symbol;
    }

    /** 对外序列化为 "X" / "O" / "." */
    @JsonValue
    public String code() {
        return String.valueOf(symbol);
    }

    /** 对手棋色；EMPTY 没有对手 */
    public Cell opponent() {
        return switch (this) {
            case BLACK -> WHITE;
            case WHITE -> BLACK;
            case EMPTY -> throw new IllegalStateException("EMPTY has no opponent");
        };
    }

    /** 是否为落子方（非空） */
    public boolean isStone() {
        return this != EMPTY;
    }

    public static Cell fromSymbol(char c) {
        return switch (Character.toUpperCase(c)) {
            case '.' -> EMPTY;
            case 'X' -> BLACK;
            case 'O' -> WHITE;
            default -> throw new IllegalArgumentException("非法棋子标记: " + c);
        };
    }

    /**
     * 兼容 "X" / "O" / "BLACK" / "WHITE" 等写法。
     */
    @JsonCreator
    public static Cell of(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("棋子标记为空");
        }
        String v = value.trim();
        if (v.length() == 1) {
            return fromSymbol(v.charAt(0));
        }
        return Cell.valueOf(v.toUpperCase());
    }
}
