package com.example.matchthree.model.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TileKindTest {

    @Test
    void testPlayableExcludesNone() {
        List<TileKind> playable = TileKind.playable();

        assertEquals(5, playable.size());
        assertFalse(playable.contains(TileKind.NONE));
        assertEquals(TileKind.RED, playable.get(0));
    }

    @Test
    void testSymbols() {
        assertEquals(TileKind.GREEN, TileKind.fromSymbol('G'));
        assertEquals(TileKind.PURPLE, TileKind.fromSymbol('p'));
        assertEquals(TileKind.NONE, TileKind.fromSymbol('.'));
        assertThrows(IllegalArgumentException.class, () -> TileKind.fromSymbol('X'));
    }
}
