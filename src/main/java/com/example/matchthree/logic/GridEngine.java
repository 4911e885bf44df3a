package com.example.matchthree.logic;

import com.example.matchthree.model.domain.Board;
import com.example.matchthree.model.domain.Point;
import com.example.matchthree.model.domain.Tile;
import com.example.matchthree.model.domain.TileKind;
import com.example.matchthree.model.dto.CascadeResult;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Pure Java class containing all match-3 grid rules: swapping, match detection
 * and claiming, gravity, cascades and the search for moves that would match.
 * <p>
 * Not thread-safe. The engine assumes a single owner calling it sequentially;
 * every operation runs to completion before returning.
 */
@Slf4j
public class GridEngine {

    private final TileKindSource tileKindSource;
    private Board board;

    public GridEngine(TileKindSource tileKindSource, int width, int height) {
        this.tileKindSource = tileKindSource;
        initialize(width, height);
    }

    /**
     * Adopts a prepared board as-is, without the initialization loop.
     */
    public GridEngine(TileKindSource tileKindSource, Board board) {
        this.tileKindSource = tileKindSource;
        load(board);
    }

    /**
     * Builds a new board with random kinds, clears accidental matches, and
     * throws the whole board away until it has at least one legal move.
     * Dimensions below 3 are raised to 3.
     */
    public void initialize(int width, int height) {
        int attempts = 0;
        do {
            attempts++;
            Board fresh = new Board(width, height);
            for (int i = 0; i < fresh.size(); i++) {
                fresh.getTile(i).reset(tileKindSource.next());
            }
            this.board = fresh;
            runCascade(false);
        } while (!isSolvable());

        log.debug("Initialized {}x{} grid after {} attempt(s)", board.getWidth(), board.getHeight(), attempts);
    }

    public void load(Board board) {
        this.board = board;
        clearFlags();
    }

    public Board getBoard() {
        return board;
    }

    public int getWidth() {
        return board.getWidth();
    }

    public int getHeight() {
        return board.getHeight();
    }

    public int size() {
        return board.size();
    }

    // --- Tile access ---

    public Tile getTile(int index) {
        return board.getTile(index);
    }

    public Tile getTile(int x, int y) {
        return board.getTile(x, y);
    }

    public int indexOf(int x, int y) {
        return board.indexOf(x, y);
    }

    public int indexOf(Tile tile) {
        return board.indexOf(tile);
    }

    public Point coordsOf(Tile tile) {
        return board.coordsOf(tile);
    }

    public Point coordsOf(int index) {
        return board.coordsOf(index);
    }

    public boolean isAdjacent(int index, int other) {
        return board.isAdjacent(index, other);
    }

    public void resetTile(int index) {
        resetTile(index, TileKind.NONE);
    }

    public void resetTile(int index, TileKind kind) {
        Tile tile = board.getTile(index);
        if (tile != null) {
            tile.reset(kind);
        }
    }

    public void resetTile(int x, int y, TileKind kind) {
        resetTile(board.indexOf(x, y), kind);
    }

    /**
     * Exchanges two slots. Does nothing when either index is out of range;
     * adjacency is the caller's concern.
     */
    public void swap(int index, int other) {
        board.swap(index, other);
    }

    // --- Stepwise primitives ---

    /**
     * Marks every tile that is part of a horizontal or vertical run of three
     * centred on some slot. Leaves {@code matched} and {@code checked} set; the
     * caller is expected to follow with {@link #claimMatches()} and
     * {@link #clearFlags()}.
     */
    public void detectMatches() {
        for (int i = 0; i < board.size(); i++) {
            Tile tile = board.getTile(i);
            if (!tile.isChecked()) {
                markCentredRun(i);
            }
        }
    }

    /**
     * Empties every matched tile.
     *
     * @return the number of tiles claimed
     */
    public int claimMatches() {
        int claimed = 0;
        for (int i = 0; i < board.size(); i++) {
            Tile tile = board.getTile(i);
            if (tile.isMatched()) {
                claimed++;
                tile.reset(TileKind.NONE);
            }
        }
        return claimed;
    }

    public void clearFlags() {
        for (int i = 0; i < board.size(); i++) {
            board.getTile(i).clearFlags();
        }
    }

    /**
     * Only meaningful between {@link #detectMatches()} and claiming.
     */
    public boolean hasAnyMatch() {
        for (int i = 0; i < board.size(); i++) {
            if (board.getTile(i).isMatched()) {
                return true;
            }
        }
        return false;
    }

    /**
     * One gravity pass, bottom-right to top-left. A hole on the top row gets a
     * new tile; any other hole trades places with the tile above it.
     *
     * @return holes still left after the pass
     */
    public int gravitySubstep() {
        int holes = 0;
        int width = board.getWidth();
        for (int i = board.size() - 1; i >= 0; i--) {
            Tile tile = board.getTile(i);
            if (!tile.isEmpty()) {
                continue;
            }
            int x = i % width;
            int y = i / width;
            if (y == 0) {
                tile.setKind(tileKindSource.next());
            } else {
                board.swap(i, board.indexOf(x, y - 1));
                if (board.getTile(i).isEmpty()) {
                    holes++;
                }
            }
        }
        return holes;
    }

    /**
     * Runs gravity passes until no hole is left. A board without holes still
     * takes one pass to find that out.
     *
     * @return the number of passes, at least 1 and at most the board height
     */
    public int settle() {
        int passes = 0;
        int holes;
        do {
            holes = gravitySubstep();
            passes++;
        } while (holes > 0);
        return passes;
    }

    // --- Composite step ---

    /**
     * Repeats detect, claim, unmark and settle until a round claims nothing.
     * The first matching round is not a chain; each further round adds one.
     *
     * @param countScores when false the board is resolved the same way but the
     *                    result is always empty
     */
    public CascadeResult runCascade(boolean countScores) {
        int matchedTiles = 0;
        int chainCount = 0;
        int chains = -1;
        int claimed;
        // A loaded board may still have holes; fill them so the first sweep sees every tile.
        if (hasHoles()) {
            settle();
        }
        do {
            detectMatches();
            claimed = claimMatches();
            if (countScores && claimed > 0) {
                matchedTiles += claimed;
                chains++;
                chainCount = chains;
            }
            clearFlags();
            settle();
        } while (claimed > 0);

        if (countScores && matchedTiles > 0) {
            log.debug("Cascade claimed {} tile(s) with {} chain(s)", matchedTiles, chainCount);
        }
        return new CascadeResult(matchedTiles, chainCount);
    }

    // --- Move search ---

    public boolean isSolvable() {
        return !findCandidateMoves().isEmpty();
    }

    /**
     * Tries every slot against its up, down, left and right neighbour. A
     * neighbour is listed when swapping it in makes the slot match. The same
     * neighbour may be listed more than once.
     */
    public List<Integer> findCandidateMoves() {
        List<Integer> candidates = new ArrayList<>();
        int width = board.getWidth();
        for (int i = 0; i < board.size(); i++) {
            int x = i % width;
            int y = i / width;
            int[] neighbours = {
                    board.indexOf(x, y - 1),
                    board.indexOf(x, y + 1),
                    board.indexOf(x - 1, y),
                    board.indexOf(x + 1, y)
            };
            for (int neighbour : neighbours) {
                if (neighbour == Board.INVALID_INDEX) {
                    continue;
                }
                board.swap(i, neighbour);
                boolean match = wouldMatch(i);
                board.swap(i, neighbour);
                if (match) {
                    candidates.add(neighbour);
                }
            }
        }
        return candidates;
    }

    public boolean wouldMatch(int x, int y) {
        return wouldMatch(board.indexOf(x, y));
    }

    /**
     * Whether the tile at {@code index} is part of a run of three, whether it
     * sits in the middle of the run or at either end. Ignores all flags.
     */
    public boolean wouldMatch(int index) {
        Tile tile = board.getTile(index);
        if (tile == null || tile.isEmpty()) {
            return false;
        }
        int x = index % board.getWidth();
        int y = index / board.getWidth();

        Tile above = board.getTile(x, y - 1);
        Tile below = board.getTile(x, y + 1);
        Tile left = board.getTile(x - 1, y);
        Tile right = board.getTile(x + 1, y);

        if (tile.isSameKind(above) && tile.isSameKind(below)) {
            return true;
        }
        if (tile.isSameKind(left) && tile.isSameKind(right)) {
            return true;
        }

        // End of a run: the next two tiles in one direction.
        return (tile.isSameKind(above) && tile.isSameKind(board.getTile(x, y - 2)))
                || (tile.isSameKind(below) && tile.isSameKind(board.getTile(x, y + 2)))
                || (tile.isSameKind(left) && tile.isSameKind(board.getTile(x - 2, y)))
                || (tile.isSameKind(right) && tile.isSameKind(board.getTile(x + 2, y)));
    }

    // --- Private Logic Methods ---

    private boolean hasHoles() {
        for (int i = 0; i < board.size(); i++) {
            if (board.getTile(i).isEmpty()) {
                return true;
            }
        }
        return false;
    }

    private void markCentredRun(int index) {
        Tile tile = board.getTile(index);
        tile.markChecked();
        if (tile.isEmpty()) {
            return;
        }
        int x = index % board.getWidth();
        int y = index / board.getWidth();

        Tile above = board.getTile(x, y - 1);
        Tile below = board.getTile(x, y + 1);
        if (tile.isSameKind(above) && tile.isSameKind(below)) {
            tile.markMatched();
            above.markMatched();
            below.markMatched();
        }

        Tile left = board.getTile(x - 1, y);
        Tile right = board.getTile(x + 1, y);
        if (tile.isSameKind(left) && tile.isSameKind(right)) {
            tile.markMatched();
            left.markMatched();
            right.markMatched();
        }
    }
}
