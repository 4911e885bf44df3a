package com.example.matchthree.model.domain;

import java.util.ArrayList;
import java.util.List;

public enum TileKind {
    NONE('.'),   // hole, only present while gravity is settling
    RED('R'),
    YELLOW('Y'),
    GREEN('G'),
    BLUE('B'),
    PURPLE('P');

    private final char symbol;

    TileKind(char symbol) {
        this.symbol = symbol;
    }

    public char getSymbol() {
        return symbol;
    }

    public boolean isEmpty() {
        return this == NONE;
    }

    /**
     * The kinds a tile can be generated with, in declaration order.
     */
    public static List<TileKind> playable() {
        List<TileKind> kinds = new ArrayList<>();
        for (TileKind kind : values()) {
            if (!kind.isEmpty()) {
                kinds.add(kind);
            }
        }
        return kinds;
    }

    public static TileKind fromSymbol(char symbol) {
        char upper = Character.toUpperCase(symbol);
        for (TileKind kind : values()) {
            if (kind.symbol == upper) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown tile symbol '" + symbol + "'");
    }
}
