package com.example.matchthree.logic;

import com.example.matchthree.model.domain.TileKind;

import java.util.List;
import java.util.Random;

/**
 * Uniform draw over the first {@code kindCount} playable kinds.
 */
public class RandomTileKindSource implements TileKindSource {

    private final Random random;
    private final List<TileKind> kinds;

    public RandomTileKindSource(Random random, int kindCount) {
        List<TileKind> playable = TileKind.playable();
        // A single kind can never yield a board without matches.
        if (kindCount < 2 || kindCount > playable.size()) {
            throw new IllegalArgumentException(
                    "Kind count must be between 2 and " + playable.size() + ", was " + kindCount);
        }
        this.random = random;
        this.kinds = List.copyOf(playable.subList(0, kindCount));
    }

    public RandomTileKindSource(long seed, int kindCount) {
        this(new Random(seed), kindCount);
    }

    public int getKindCount() {
        return kinds.size();
    }

    @Override
    public TileKind next() {
        return kinds.get(random.nextInt(kinds.size()));
    }
}
