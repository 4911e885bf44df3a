package com.example.matchthree.logic;

import com.example.matchthree.model.domain.TileKind;

/**
 * Supplies the kind of every tile the engine generates, both when a board is
 * filled and when a tile falls in from above the top row.
 */
@FunctionalInterface
public interface TileKindSource {

    /**
     * @return a playable kind, never {@link TileKind#NONE}
     */
    TileKind next();
}
