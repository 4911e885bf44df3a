package com.example.matchthree.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class GridStateDTO {
    private int schemaVersion = 1;

    private int width;
    private int height;
    private List<String> rows = new ArrayList<>(); // top row first, one symbol per tile
    private List<Integer> candidateMoves = new ArrayList<>();
    private boolean solvable;
}
