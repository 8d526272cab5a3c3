package ai.tiles.game;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Places new tiles the way the live game does: a uniformly chosen empty cell receives a
 * {@code 2} with 90% probability or a {@code 4} with 10% probability.
 * <p>
 * Holds its own {@link Random} so that training runs and simulated games are reproducible for
 * a fixed seed.
 */
public class TileSpawner {
    /** Probability that a spawned tile is a 2 rather than a 4. */
    public static final double PROBABILITY_OF_TWO = 0.9;

    private final Random random;

    public TileSpawner(Random random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    public TileSpawner(long seed) {
        this(new Random(seed));
    }

    /**
     * Returns a copy of {@code board} with one new tile, or the same board if it is full.
     */
    public Board spawn(Board board) {
        List<int[]> empty = new ArrayList<>();
        for (int row = 0; row < Board.SIZE; row++) {
            for (int col = 0; col < Board.SIZE; col++) {
                if (board.get(row, col) == 0) {
                    empty.add(new int[] {row, col});
                }
            }
        }
        if (empty.isEmpty()) {
            return board;
        }
        int[] cell = empty.get(random.nextInt(empty.size()));
        int value = random.nextDouble() < PROBABILITY_OF_TWO ? 2 : 4;
        return board.withTile(cell[0], cell[1], value);
    }

    /**
     * Starting position: an empty board with two spawned tiles.
     */
    public Board newGame() {
        return spawn(spawn(Board.empty()));
    }

    /**
     * Exposes the underlying random source so that callers sharing a seed (for example
     * epsilon-greedy exploration) draw from the same deterministic stream.
     */
    public Random random() {
        return random;
    }
}
