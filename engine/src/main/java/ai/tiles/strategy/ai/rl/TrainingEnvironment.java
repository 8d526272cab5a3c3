package ai.tiles.strategy.ai.rl;

import ai.tiles.game.Board;
import ai.tiles.game.BoardEngine;
import ai.tiles.game.Move;
import ai.tiles.game.MoveOutcome;
import ai.tiles.game.TileSpawner;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Episodic 2048 simulation for reinforcement learning ({@code reset}/{@code step}/{@code done}).
 * <p>
 * Wraps {@link BoardEngine} with a pluggable {@link RewardFunction}:
 * <ul>
 *   <li>{@link #reset()} clears the board, zeroes the score and spawns two tiles.</li>
 *   <li>{@link #step(Move)} applies the move, computes the reward on the post-move board, spawns
 *       a tile only if the move changed the board, and marks the episode done when no legal move
 *       remains.</li>
 * </ul>
 * Each instance owns its board, score and random source; it is not shared between threads.
 */
public class TrainingEnvironment {
    /** Divisor applied to the running score in the observation vector. */
    public static final double SCORE_SCALE = 10_000.0;

    /** Observation length: sixteen cells plus the scaled score. */
    public static final int OBSERVATION_SIZE = Board.CELLS + 1;

    private final RewardFunction rewardFunction;
    private final TileSpawner spawner;

    private Board board = Board.empty();
    private int score;
    private boolean done;
    private int totalMoves;
    private int highestTile;

    public TrainingEnvironment(RewardFunction rewardFunction, TileSpawner spawner) {
        this.rewardFunction = Objects.requireNonNull(rewardFunction, "rewardFunction");
        this.spawner = Objects.requireNonNull(spawner, "spawner");
    }

    public TrainingEnvironment(long seed) {
        this(new ShapedReward(), new TileSpawner(seed));
    }

    /**
     * Starts a new episode.
     *
     * @return the initial observation
     */
    public double[] reset() {
        board = spawner.newGame();
        score = 0;
        done = false;
        totalMoves = 0;
        highestTile = board.maxTile();
        return observation();
    }

    /**
     * Advances the episode by one action.
     *
     * @throws IllegalStateException if the episode has already finished
     */
    public StepResult step(Move move) {
        if (done) {
            throw new IllegalStateException("Episode is finished. Call reset() to start a new episode.");
        }
        Board before = board;
        MoveOutcome outcome = BoardEngine.apply(before, move);
        totalMoves++;
        double reward = rewardFunction.reward(before, outcome);
        if (outcome.moved()) {
            score += outcome.scoreDelta();
            board = spawner.spawn(outcome.board());
        }
        done = !BoardEngine.hasLegalMove(board);
        highestTile = Math.max(highestTile, board.maxTile());
        StepResult.Info info = new StepResult.Info(
                outcome.moved(),
                highestTile,
                board.emptyCount(),
                totalMoves,
                (double) score / Math.max(totalMoves, 1));
        return new StepResult(observation(), reward, done, info);
    }

    /**
     * Moves that would change the current board.
     */
    public List<Move> validMoves() {
        return BoardEngine.legalMoves(board);
    }

    /**
     * Board flattened row-major with each tile replaced by log2 of its value (empty stays 0),
     * followed by {@code score / 10000}.
     */
    public double[] observation() {
        double[] observation = new double[OBSERVATION_SIZE];
        int[] cells = board.toArray();
        for (int i = 0; i < cells.length; i++) {
            observation[i] = cells[i] == 0 ? 0.0 : ShapedReward.log2(cells[i]);
        }
        observation[Board.CELLS] = score / SCORE_SCALE;
        return observation;
    }

    public Board getBoard() {
        return board;
    }

    public int getScore() {
        return score;
    }

    public boolean isDone() {
        return done;
    }

    public int getTotalMoves() {
        return totalMoves;
    }

    public int getHighestTile() {
        return highestTile;
    }

    /**
     * Random source shared with tile spawning, used for epsilon-greedy exploration so a fixed
     * seed reproduces a whole training run.
     */
    Random random() {
        return spawner.random();
    }
}
