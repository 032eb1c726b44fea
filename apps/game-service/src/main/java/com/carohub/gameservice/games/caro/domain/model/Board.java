package com.carohub.gameservice.games.caro.domain.model;

import com.carohub.gameservice.games.caro.domain.enums.Cell;

import java.util.Arrays;

/**
 * 棋盘：15x15 网格，每格为 {@link Cell}。
 * 只归属于一个对局，由规则层负责合法性校验。
 */
public class Board {
    /** 棋盘尺寸（15x15） */
    public static final int SIZE = 15;

    private final Cell[][] grid = new Cell[SIZE][SIZE];

    public Board() {
        for (int i = 0; i < SIZE; i++) Arrays.fill(grid[i], Cell.EMPTY);
    }

    /** 是否在棋盘内 */
    public boolean inBounds(int row, int col) {
        return row >= 0 && row < SIZE && col >= 0 && col < SIZE;
    }

    public Cell get(int row, int col) { return grid[row][col]; }

    /** 该点是否为空（越界视为非空） */
    public boolean isEmpty(int row, int col) {
        return inBounds(row, col) && grid[row][col] == Cell.EMPTY;
    }

    /** 在(row,col)放置棋子，不做校验 */
    public void place(int row, int col, Cell cell) { grid[row][col] = cell; }

    /** 已落子数 */
    public int stoneCount() {
        int n = 0;
        for (Cell[] line : grid)
            for (Cell c : line)
                if (c != Cell.EMPTY) n++;
        return n;
    }

    /** 深拷贝棋盘（供 AI 模拟使用） */
    public Board copy() {
        Board b = new Board();
        for (int i = 0; i < SIZE; i++) b.grid[i] = grid[i].clone();
        return b;
    }

    /**
     * 紧凑字符串：按行拼接 225 个字符（'.','X','O'），用于持久化。
     */
    public String encode() {
        StringBuilder sb = new StringBuilder(SIZE * SIZE);
        for (Cell[] line : grid)
            for (Cell c : line) sb.append(c.symbol());
        return sb.toString();
    }

    public static Board decode(String encoded) {
        if (encoded == null || encoded.length() != SIZE * SIZE) {
            throw new IllegalArgumentException("棋盘字符串长度必须为 " + (SIZE * SIZE));
        }
        Board b = new Board();
        for (int i = 0; i < encoded.length(); i++) {
            b.grid[i / SIZE][i % SIZE] = Cell.fromSymbol(encoded.charAt(i));
        }
        return b;
    }

    /** 返回行列表视图，每行一个字符串（用于前端渲染/日志） */
    public String[] rows() {
        String[] rows = new String[SIZE];
        String enc = encode();
        for (int i = 0; i < SIZE; i++) rows[i] = enc.substring(i * SIZE, (i + 1) * SIZE);
        return rows;
    }
}
