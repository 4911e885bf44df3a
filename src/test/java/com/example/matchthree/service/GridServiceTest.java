package com.example.matchthree.service;

import com.example.matchthree.logic.RandomTileKindSource;
import com.example.matchthree.logic.ScriptedTileKindSource;
import com.example.matchthree.logic.TileKindSource;
import com.example.matchthree.model.domain.Tile;
import com.example.matchthree.model.dto.GridStateDTO;
import com.example.matchthree.model.dto.MoveResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;

import static com.example.matchthree.model.domain.TileKind.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.verifyNoInteractions;

class GridServiceTest {

    @Mock
    private TileKindSource tileKindSource;

    private GridService gridService;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        gridService = new GridService(tileKindSource);
    }

    @Test
    void testSwapWithoutMatchIsUndone() {
        gridService.loadGrid(List.of("RYG", "BPR", "GRY"));

        MoveResult result = gridService.trySwap(0, 1);

        assertFalse(result.isAccepted());
        assertEquals(0, result.getMatchedTiles());
        assertEquals(0, result.getChains());
        assertEquals(List.of("RYG", "BPR", "GRY"), gridService.getState().getRows());
        // Nothing was claimed, so nothing had to be generated.
        verifyNoInteractions(tileKindSource);
    }

    @Test
    void testMatchingSwapRunsCascade() {
        gridService = new GridService(new ScriptedTileKindSource(GREEN, BLUE, YELLOW));
        gridService.loadGrid(List.of("RYG", "RBY", "BRG"));

        MoveResult result = gridService.trySwap(6, 7);

        assertTrue(result.isAccepted());
        assertEquals(3, result.getMatchedTiles());
        assertEquals(0, result.getChains());
        assertFalse(result.isReshuffled());
        assertEquals(List.of("YYG", "BBY", "GBG"), gridService.getState().getRows());
        assertEquals(List.of(5), gridService.getHints());
    }

    @Test
    void testSwapByCoordinates() {
        gridService = new GridService(new ScriptedTileKindSource(GREEN, BLUE, YELLOW));
        gridService.loadGrid(List.of("RYG", "RBY", "BRG"));

        MoveResult result = gridService.trySwap(0, 2, 1, 2);

        assertTrue(result.isAccepted());
        assertEquals(6, result.getFrom());
        assertEquals(7, result.getTo());
    }

    @Test
    void testSwapRequiresAdjacentSlots() {
        gridService.loadGrid(List.of("RYG", "BPR", "GRY"));

        assertThrows(IllegalArgumentException.class, () -> gridService.trySwap(0, 2));
        assertThrows(IllegalArgumentException.class, () -> gridService.trySwap(0, 4));
        assertThrows(IllegalArgumentException.class, () -> gridService.trySwap(2, 3));
        assertThrows(IllegalArgumentException.class, () -> gridService.trySwap(-1, 0));
        assertThrows(IllegalArgumentException.class, () -> gridService.trySwap(8, 9));
        assertThrows(IllegalArgumentException.class, () -> gridService.trySwap(2, 0, 3, 0));
        assertEquals(List.of("RYG", "BPR", "GRY"), gridService.getState().getRows());
    }

    @Test
    void testBoardWithoutMovesIsRebuilt() {
        // The refill leaves RYG / BPR / GRY, which has no move at all.
        TileKindSource source = new ScriptedTileKindSource(new RandomTileKindSource(5L, 5), GREEN, YELLOW, RED);
        gridService = new GridService(source);
        gridService.loadGrid(List.of("BBR", "BPB", "GRY"));

        MoveResult result = gridService.trySwap(2, 5);

        assertTrue(result.isAccepted());
        assertEquals(3, result.getMatchedTiles());
        assertTrue(result.isReshuffled());
        GridStateDTO state = gridService.getState();
        assertTrue(state.isSolvable());
        assertEquals(3, state.getWidth());
        assertEquals(3, state.getHeight());
    }

    @Test
    void testStartNewGridUsesConfiguredSize() {
        gridService = new GridService(new RandomTileKindSource(8L, 4));
        ReflectionTestUtils.setField(gridService, "width", 5);
        ReflectionTestUtils.setField(gridService, "height", 4);

        gridService.startNewGrid();

        GridStateDTO state = gridService.getState();
        assertEquals(5, state.getWidth());
        assertEquals(4, state.getHeight());
        assertEquals(4, state.getRows().size());
        state.getRows().forEach(row -> assertEquals(5, row.length()));
        assertTrue(state.isSolvable());
        assertEquals(gridService.getHints(), state.getCandidateMoves());
    }

    @Test
    void testStartNewGridAgainKeepsFlagsClean() {
        gridService = new GridService(new RandomTileKindSource(13L, 5));
        ReflectionTestUtils.setField(gridService, "width", 6);
        ReflectionTestUtils.setField(gridService, "height", 6);
        gridService.startNewGrid();
        gridService.startNewGrid();

        for (int i = 0; i < gridService.getEngine().size(); i++) {
            Tile tile = gridService.getEngine().getTile(i);
            assertFalse(tile.isMatched());
            assertFalse(tile.isChecked());
        }
    }
}
