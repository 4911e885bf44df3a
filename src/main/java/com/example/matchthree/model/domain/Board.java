package com.example.matchthree.model.domain;

import lombok.Getter;

/**
 * Row-major tile storage. Slot (x, y) lives at index {@code y * width + x}.
 * Every slot always holds a tile; empty slots hold a tile of kind NONE.
 */
public class Board {
    public static final int INVALID_INDEX = -1;
    public static final int MIN_SIZE = 3;

    @Getter
    private final int width;
    @Getter
    private final int height;
    private final Tile[] tiles;

    public Board(int width, int height) {
        this.width = Math.max(width, MIN_SIZE);
        this.height = Math.max(height, MIN_SIZE);
        this.tiles = new Tile[this.width * this.height];
        for (int i = 0; i < tiles.length; i++) {
            tiles[i] = new Tile();
        }
    }

    public int size() {
        return tiles.length;
    }

    public boolean isValidIndex(int index) {
        return index >= 0 && index < tiles.length;
    }

    public Tile getTile(int index) {
        if (!isValidIndex(index)) {
            return null;
        }
        return tiles[index];
    }

    public Tile getTile(int x, int y) {
        return getTile(indexOf(x, y));
    }

    public int indexOf(int x, int y) {
        if (x < 0 || x >= width || y < 0 || y >= height) {
            return INVALID_INDEX;
        }
        return y * width + x;
    }

    /**
     * Linear scan by reference. Prefer passing the index along when it is known.
     */
    public int indexOf(Tile tile) {
        if (tile == null) {
            return INVALID_INDEX;
        }
        for (int i = 0; i < tiles.length; i++) {
            if (tiles[i] == tile) {
                return i;
            }
        }
        return INVALID_INDEX;
    }

    public Point coordsOf(int index) {
        if (!isValidIndex(index)) {
            return Point.INVALID;
        }
        return new Point(index % width, index / width);
    }

    public Point coordsOf(Tile tile) {
        return coordsOf(indexOf(tile));
    }

    public boolean isAdjacent(int index, int other) {
        if (!isValidIndex(index) || !isValidIndex(other)) {
            return false;
        }
        int x = index % width;
        int y = index / width;
        return other == indexOf(x - 1, y)
                || other == indexOf(x + 1, y)
                || other == indexOf(x, y - 1)
                || other == indexOf(x, y + 1);
    }

    public void swap(int index, int other) {
        if (!isValidIndex(index) || !isValidIndex(other)) {
            return;
        }
        Tile temp = tiles[index];
        tiles[index] = tiles[other];
        tiles[other] = temp;
    }
}
