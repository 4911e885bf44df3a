package com.example.matchthree.logic;

import com.example.matchthree.model.domain.Board;
import com.example.matchthree.model.domain.TileKind;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Converts between boards and rows of kind symbols, top row first.
 * "RRG" is a row of red, red, green; '.' is an empty slot.
 */
public final class BoardParser {

    private BoardParser() {
    }

    public static Board parse(String... rows) {
        return parse(Arrays.asList(rows));
    }

    public static Board parse(List<String> rows) {
        if (rows == null || rows.isEmpty()) {
            throw new IllegalArgumentException("Board needs at least one row");
        }
        int width = rows.get(0).length();
        int height = rows.size();
        if (width < Board.MIN_SIZE || height < Board.MIN_SIZE) {
            throw new IllegalArgumentException(
                    "Board must be at least " + Board.MIN_SIZE + "x" + Board.MIN_SIZE + ", was " + width + "x" + height);
        }

        Board board = new Board(width, height);
        for (int y = 0; y < height; y++) {
            String row = rows.get(y);
            if (row.length() != width) {
                throw new IllegalArgumentException(
                        "Row " + y + " has " + row.length() + " tiles, expected " + width);
            }
            for (int x = 0; x < width; x++) {
                board.getTile(x, y).reset(TileKind.fromSymbol(row.charAt(x)));
            }
        }
        return board;
    }

    public static List<String> render(Board board) {
        List<String> rows = new ArrayList<>(board.getHeight());
        for (int y = 0; y < board.getHeight(); y++) {
            StringBuilder row = new StringBuilder(board.getWidth());
            for (int x = 0; x < board.getWidth(); x++) {
                row.append(board.getTile(x, y).getKind().getSymbol());
            }
            rows.add(row.toString());
        }
        return rows;
    }
}
