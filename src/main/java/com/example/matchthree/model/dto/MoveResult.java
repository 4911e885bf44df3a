package com.example.matchthree.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MoveResult {
    private int from;
    private int to;
    private boolean accepted;   // false when the swap matched nothing and was undone
    private int matchedTiles;
    private int chains;
    private boolean reshuffled; // the settled board had no moves left and was rebuilt

    public static MoveResult rejected(int from, int to) {
        return new MoveResult(from, to, false, 0, 0, false);
    }
}
