package ai.tiles.game;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Deterministic 2048 move rules.
 * <p>
 * The whole rule set is one primitive, {@link #mergeRowLeft(int[])}, plus two structural
 * transforms:
 * <ul>
 *   <li><b>LEFT:</b> merge every row left.</li>
 *   <li><b>RIGHT:</b> reverse each row, merge left, reverse back.</li>
 *   <li><b>UP:</b> transpose, merge left, transpose back.</li>
 *   <li><b>DOWN:</b> transpose, apply RIGHT, transpose back.</li>
 * </ul>
 * Every consumer that needs to simulate a move (heuristic strategies, the default move scorer,
 * the training environment, the simulated game host) goes through {@link #apply(Board, Move)}.
 */
public final class BoardEngine {
    private BoardEngine() {
    }

    /**
     * Applies {@code move} to {@code board}.
     * <p>
     * The input board is never modified. If no tile moves or merges, the returned outcome holds
     * the same board instance with {@code moved == false} and a zero score delta.
     *
     * @return the resulting board, whether anything changed, and the merge score delta
     */
    public static MoveOutcome apply(Board board, Move move) {
        int[][] grid = board.toGrid();
        int delta;
        switch (move) {
            case LEFT -> delta = mergeLeft(grid);
            case RIGHT -> delta = mergeRight(grid);
            case UP -> {
                transpose(grid);
                delta = mergeLeft(grid);
                transpose(grid);
            }
            case DOWN -> {
                transpose(grid);
                delta = mergeRight(grid);
                transpose(grid);
            }
            default -> throw new IllegalArgumentException("Unknown move " + move);
        }
        Board result = Board.fromTrustedGrid(grid);
        if (result.equals(board)) {
            return MoveOutcome.unchanged(board);
        }
        return new MoveOutcome(result, true, delta);
    }

    /**
     * Returns true if at least one move would change the board: there is an empty cell or two
     * orthogonally adjacent cells hold the same value.
     */
    public static boolean hasLegalMove(Board board) {
        if (board.emptyCount() > 0) {
            return true;
        }
        for (int row = 0; row < Board.SIZE; row++) {
            for (int col = 0; col < Board.SIZE; col++) {
                int value = board.get(row, col);
                if (value == Board.MAX_TILE) {
                    continue;
                }
                if (col + 1 < Board.SIZE && board.get(row, col + 1) == value) {
                    return true;
                }
                if (row + 1 < Board.SIZE && board.get(row + 1, col) == value) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Moves that would change the board, in {@link Move} declaration order.
     */
    public static List<Move> legalMoves(Board board) {
        if (!hasLegalMove(board)) {
            return Collections.emptyList();
        }
        List<Move> legal = new ArrayList<>(4);
        for (Move move : Move.values()) {
            if (apply(board, move).moved()) {
                legal.add(move);
            }
        }
        return legal;
    }

    /**
     * Merges a single row towards index 0 in place.
     * <p>
     * Non-zero values keep their order; each pair of equal neighbours merges once (so
     * {@code [2,2,2,2]} becomes {@code [4,4,0,0]}, never {@code [8,0,0,0]}); the row is then
     * right-padded with zeros. Pairs of {@link Board#MAX_TILE} stay unmerged.
     *
     * @return sum of the merged tile values
     */
    static int mergeRowLeft(int[] row) {
        int[] packed = new int[row.length];
        int count = 0;
        for (int value : row) {
            if (value != 0) {
                packed[count++] = value;
            }
        }
        int delta = 0;
        int out = 0;
        int i = 0;
        while (i < count) {
            if (i + 1 < count && packed[i] == packed[i + 1] && packed[i] < Board.MAX_TILE) {
                int merged = packed[i] * 2;
                row[out++] = merged;
                delta += merged;
                i += 2;
            } else {
                row[out++] = packed[i];
                i++;
            }
        }
        while (out < row.length) {
            row[out++] = 0;
        }
        return delta;
    }

    private static int mergeLeft(int[][] grid) {
        int delta = 0;
        for (int[] row : grid) {
            delta += mergeRowLeft(row);
        }
        return delta;
    }

    private static int mergeRight(int[][] grid) {
        reverseRows(grid);
        int delta = mergeLeft(grid);
        reverseRows(grid);
        return delta;
    }

    static void reverseRows(int[][] grid) {
        for (int[] row : grid) {
            for (int i = 0, j = row.length - 1; i < j; i++, j--) {
                int tmp = row[i];
                row[i] = row[j];
                row[j] = tmp;
            }
        }
    }

    static void transpose(int[][] grid) {
        for (int i = 0; i < grid.length; i++) {
            for (int j = i + 1; j < grid.length; j++) {
                int tmp = grid[i][j];
                grid[i][j] = grid[j][i];
                grid[j][i] = tmp;
            }
        }
    }
}
