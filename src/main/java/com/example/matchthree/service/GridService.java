package com.example.matchthree.service;

import com.example.matchthree.logic.BoardParser;
import com.example.matchthree.logic.GridEngine;
import com.example.matchthree.logic.TileKindSource;
import com.example.matchthree.model.domain.Board;
import com.example.matchthree.model.dto.CascadeResult;
import com.example.matchthree.model.dto.GridStateDTO;
import com.example.matchthree.model.dto.MoveResult;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Owns the single grid of the application and applies the player move policy
 * on top of the engine: only adjacent swaps, and a swap that matches nothing is
 * taken back.
 */
@Slf4j
@Service
public class GridService {

    @Value("${match3.grid.width:7}")
    private int width;

    @Value("${match3.grid.height:6}")
    private int height;

    private final TileKindSource tileKindSource;
    private GridEngine engine;

    public GridService(TileKindSource tileKindSource) {
        this.tileKindSource = tileKindSource;
    }

    @PostConstruct
    public synchronized void startNewGrid() {
        if (engine == null) {
            engine = new GridEngine(tileKindSource, width, height);
        } else {
            engine.initialize(width, height);
        }
        log.info("New {}x{} grid ready, {} candidate move(s)",
                engine.getWidth(), engine.getHeight(), engine.findCandidateMoves().size());
    }

    /**
     * Replaces the current board with the given rows, e.g. a puzzle layout.
     * The board is taken as-is, matches and all.
     */
    public synchronized void loadGrid(List<String> rows) {
        Board board = BoardParser.parse(rows);
        if (engine == null) {
            engine = new GridEngine(tileKindSource, board);
        } else {
            engine.load(board);
        }
        log.debug("Loaded {}x{} grid", board.getWidth(), board.getHeight());
    }

    public synchronized MoveResult trySwap(int x1, int y1, int x2, int y2) {
        return trySwap(engine.indexOf(x1, y1), engine.indexOf(x2, y2));
    }

    public synchronized MoveResult trySwap(int from, int to) {
        if (engine.getTile(from) == null || engine.getTile(to) == null) {
            throw new IllegalArgumentException("Slot out of range: " + from + " -> " + to);
        }
        if (!engine.isAdjacent(from, to)) {
            throw new IllegalArgumentException("Slots " + from + " and " + to + " are not adjacent");
        }

        engine.swap(from, to);
        if (!engine.wouldMatch(from) && !engine.wouldMatch(to)) {
            engine.swap(from, to);
            log.debug("Swap {} -> {} matches nothing, undone", from, to);
            return MoveResult.rejected(from, to);
        }

        CascadeResult cascade = engine.runCascade(true);
        boolean reshuffled = false;
        if (!engine.isSolvable()) {
            log.info("No moves left after swap {} -> {}, rebuilding grid", from, to);
            engine.initialize(engine.getWidth(), engine.getHeight());
            reshuffled = true;
        }

        log.info("Swap {} -> {}: {} tile(s) matched, {} chain(s)",
                from, to, cascade.getMatchedTiles(), cascade.getChains());
        return new MoveResult(from, to, true, cascade.getMatchedTiles(), cascade.getChains(), reshuffled);
    }

    public synchronized List<Integer> getHints() {
        return engine.findCandidateMoves();
    }

    public synchronized GridStateDTO getState() {
        return mapToDTO(engine);
    }

    GridEngine getEngine() {
        return engine;
    }

    private GridStateDTO mapToDTO(GridEngine engine) {
        GridStateDTO dto = new GridStateDTO();
        dto.setWidth(engine.getWidth());
        dto.setHeight(engine.getHeight());
        dto.setRows(BoardParser.render(engine.getBoard()));
        List<Integer> candidates = engine.findCandidateMoves();
        dto.setCandidateMoves(candidates);
        dto.setSolvable(!candidates.isEmpty());
        return dto;
    }
}
