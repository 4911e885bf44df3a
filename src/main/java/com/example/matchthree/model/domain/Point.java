package com.example.matchthree.model.domain;

public record Point(int x, int y) {

    public static final Point INVALID = new Point(Board.INVALID_INDEX, Board.INVALID_INDEX);

    public boolean isValid() {
        return x != Board.INVALID_INDEX && y != Board.INVALID_INDEX;
    }
}
