package ai.tiles.heuristic;

import ai.tiles.game.Board;

/**
 * Individual board features combined by {@link HeuristicEvaluator}. Each feature is computed
 * independently and is also reused by the training environment's reward shaping.
 */
public final class BoardFeatures {
    private BoardFeatures() {
    }

    /**
     * Number of empty cells.
     */
    public static int emptyTiles(Board board) {
        return board.emptyCount();
    }

    /**
     * Number of orthogonally adjacent pairs holding the same non-zero value.
     */
    public static int mergePotential(Board board) {
        int pairs = 0;
        for (int row = 0; row < Board.SIZE; row++) {
            for (int col = 0; col < Board.SIZE; col++) {
                int value = board.get(row, col);
                if (value == 0) {
                    continue;
                }
                if (col + 1 < Board.SIZE && board.get(row, col + 1) == value) {
                    pairs++;
                }
                if (row + 1 < Board.SIZE && board.get(row + 1, col) == value) {
                    pairs++;
                }
            }
        }
        return pairs;
    }

    /**
     * 1.0 if the largest tile occupies one of the four corners, otherwise 0.0. The empty board
     * scores 0.0.
     */
    public static double cornerBonus(Board board) {
        int max = board.maxTile();
        if (max == 0) {
            return 0.0;
        }
        int last = Board.SIZE - 1;
        boolean inCorner = board.get(0, 0) == max
                || board.get(0, last) == max
                || board.get(last, 0) == max
                || board.get(last, last) == max;
        return inCorner ? 1.0 : 0.0;
    }

    /**
     * Number of rows and columns (out of eight) whose non-zero values are sorted in either
     * direction. Lines with fewer than two tiles do not count.
     */
    public static int monotonicity(Board board) {
        int lines = 0;
        int[] values = new int[Board.SIZE];
        for (int row = 0; row < Board.SIZE; row++) {
            int count = 0;
            for (int col = 0; col < Board.SIZE; col++) {
                int value = board.get(row, col);
                if (value != 0) {
                    values[count++] = value;
                }
            }
            if (isMonotonic(values, count)) {
                lines++;
            }
        }
        for (int col = 0; col < Board.SIZE; col++) {
            int count = 0;
            for (int row = 0; row < Board.SIZE; row++) {
                int value = board.get(row, col);
                if (value != 0) {
                    values[count++] = value;
                }
            }
            if (isMonotonic(values, count)) {
                lines++;
            }
        }
        return lines;
    }

    /**
     * Value of the largest tile.
     */
    public static int maxTileValue(Board board) {
        return board.maxTile();
    }

    private static boolean isMonotonic(int[] values, int count) {
        if (count < 2) {
            return false;
        }
        boolean nonDecreasing = true;
        boolean nonIncreasing = true;
        for (int i = 1; i < count; i++) {
            if (values[i] < values[i - 1]) {
                nonDecreasing = false;
            }
            if (values[i] > values[i - 1]) {
                nonIncreasing = false;
            }
        }
        return nonDecreasing || nonIncreasing;
    }
}
