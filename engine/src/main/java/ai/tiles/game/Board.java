package ai.tiles.game;

import java.util.Arrays;

/**
 * Immutable 4x4 grid of 2048 tiles.
 * <p>
 * Every cell holds either {@code 0} (empty) or a power of two that is at least {@code 2}.
 * The grid is always fully populated; there is no sparse representation. Boards are never
 * mutated after construction: moves and tile spawns produce a <em>new</em> board value, so a
 * board can be shared freely between strategies, the evaluator and the training environment.
 * <p>
 * <strong>Construction:</strong>
 * <ul>
 *   <li>{@link #of(int[][])} validates a raw grid coming from outside the engine (for example an
 *       observation supplied by the orchestrator) and throws {@link InvalidBoardException} on
 *       malformed input.</li>
 *   <li>{@link #empty()} returns the all-zero board used at the start of a game.</li>
 *   <li>{@link #withTile(int, int, int)} returns a copy with one cell replaced.</li>
 * </ul>
 * <p>
 * <strong>State key:</strong> {@link #stateKey()} is the exact row-major serialisation of the
 * sixteen cells. It is used as the tabular learner's state identifier without any bucketing.
 */
public final class Board {
    /** Number of rows and columns. */
    public static final int SIZE = 4;

    /** Total number of cells on the board. */
    public static final int CELLS = SIZE * SIZE;

    /** Largest tile a 4x4 game can produce (2^17). Two of these never merge. */
    public static final int MAX_TILE = 1 << 17;

    private static final Board EMPTY = new Board(new int[CELLS]);

    /** Row-major cell values; never exposed directly. */
    private final int[] cells;

    private Board(int[] cells) {
        this.cells = cells;
    }

    /**
     * Builds a board from a raw 4x4 grid after validating its shape and contents.
     *
     * @param grid rows of tile values; must be 4 rows of 4 non-negative powers of two (or zero)
     * @return a new immutable board
     * @throws InvalidBoardException if the grid is null, has the wrong shape, or contains an
     *                               invalid tile value
     */
    public static Board of(int[][] grid) {
        if (grid == null) {
            throw new InvalidBoardException("Board grid must not be null");
        }
        if (grid.length != SIZE) {
            throw new InvalidBoardException("Board must have " + SIZE + " rows but had " + grid.length);
        }
        int[] cells = new int[CELLS];
        for (int row = 0; row < SIZE; row++) {
            int[] line = grid[row];
            if (line == null || line.length != SIZE) {
                throw new InvalidBoardException("Row " + row + " must have " + SIZE + " cells but had "
                        + (line == null ? 0 : line.length));
            }
            for (int col = 0; col < SIZE; col++) {
                int value = line[col];
                if (!isValidTile(value)) {
                    throw new InvalidBoardException("Invalid tile value " + value + " at (" + row + "," + col
                            + "); expected 0 or a power of two in [2, " + MAX_TILE + "]");
                }
                cells[row * SIZE + col] = value;
            }
        }
        return new Board(cells);
    }

    /**
     * Returns the empty board (all cells zero).
     */
    public static Board empty() {
        return EMPTY;
    }

    /**
     * Returns true if {@code value} may appear in a cell: zero, or a power of two between 2 and
     * {@link #MAX_TILE}.
     */
    public static boolean isValidTile(int value) {
        if (value == 0) {
            return true;
        }
        return value >= 2 && value <= MAX_TILE && (value & (value - 1)) == 0;
    }

    /**
     * Package-private factory used by the engine for grids it has produced itself and therefore
     * does not need to re-validate.
     */
    static Board fromTrustedGrid(int[][] grid) {
        int[] cells = new int[CELLS];
        for (int row = 0; row < SIZE; row++) {
            System.arraycopy(grid[row], 0, cells, row * SIZE, SIZE);
        }
        return new Board(cells);
    }

    /**
     * Returns the tile value at the given coordinates.
     *
     * @param row zero-based row index (0 is the top row)
     * @param col zero-based column index (0 is the left column)
     */
    public int get(int row, int col) {
        checkCoordinates(row, col);
        return cells[row * SIZE + col];
    }

    /**
     * Returns a copy of this board with one cell replaced.
     *
     * @throws InvalidBoardException if {@code value} is not a valid tile value
     */
    public Board withTile(int row, int col, int value) {
        checkCoordinates(row, col);
        if (!isValidTile(value)) {
            throw new InvalidBoardException("Invalid tile value " + value);
        }
        int[] copy = cells.clone();
        copy[row * SIZE + col] = value;
        return new Board(copy);
    }

    /**
     * Returns a fresh, mutable 4x4 copy of the grid.
     */
    public int[][] toGrid() {
        int[][] grid = new int[SIZE][SIZE];
        for (int row = 0; row < SIZE; row++) {
            System.arraycopy(cells, row * SIZE, grid[row], 0, SIZE);
        }
        return grid;
    }

    /**
     * Returns a fresh copy of the cells in row-major order.
     */
    public int[] toArray() {
        return cells.clone();
    }

    /**
     * Number of empty (zero) cells.
     */
    public int emptyCount() {
        int count = 0;
        for (int value : cells) {
            if (value == 0) {
                count++;
            }
        }
        return count;
    }

    /**
     * Largest tile on the board, or 0 for the empty board.
     */
    public int maxTile() {
        int max = 0;
        for (int value : cells) {
            max = Math.max(max, value);
        }
        return max;
    }

    /**
     * Number of non-empty cells.
     */
    public int tileCount() {
        return CELLS - emptyCount();
    }

    /**
     * Sum of all tile values.
     */
    public int tileSum() {
        int sum = 0;
        for (int value : cells) {
            sum += value;
        }
        return sum;
    }

    /**
     * Exact serialisation of the sixteen cells in row-major order, e.g.
     * {@code "[2, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 2]"}.
     */
    public String stateKey() {
        return Arrays.toString(cells);
    }

    private static void checkCoordinates(int row, int col) {
        if (row < 0 || row >= SIZE || col < 0 || col >= SIZE) {
            throw new IndexOutOfBoundsException("Cell (" + row + "," + col + ") is outside the board");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Board)) {
            return false;
        }
        return Arrays.equals(cells, ((Board) o).cells);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(cells);
    }

    @Override
    public String toString() {
        return BoardFormatter.format(this);
    }
}
