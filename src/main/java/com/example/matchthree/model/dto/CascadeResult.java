package com.example.matchthree.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CascadeResult {
    private int matchedTiles; // tiles claimed over every round
    private int chains;       // rounds after the first that still claimed tiles

    public static CascadeResult none() {
        return new CascadeResult(0, 0);
    }
}
