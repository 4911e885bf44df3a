package com.example.matchthree.model.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

// No @Data here: tiles are looked up by reference, two RED tiles are not the same tile.
@Getter
@ToString
@NoArgsConstructor
public class Tile {
    @Setter
    private TileKind kind = TileKind.NONE;
    private boolean matched; // set by match detection, cleared when claimed
    private boolean checked; // visited during the current detection sweep

    public Tile(TileKind kind) {
        this.kind = kind;
    }

    public boolean isEmpty() {
        return kind.isEmpty();
    }

    public boolean isSameKind(Tile other) {
        return other != null && other.kind == kind;
    }

    // Raised only by match detection.
    public void markMatched() {
        this.matched = true;
    }

    public void markChecked() {
        this.checked = true;
    }

    public void clearFlags() {
        this.matched = false;
        this.checked = false;
    }

    public void reset(TileKind kind) {
        clearFlags();
        this.kind = kind;
    }
}
