package ai.tiles.strategy;

import ai.tiles.game.Board;
import ai.tiles.game.BoardEngine;
import ai.tiles.game.Move;
import ai.tiles.game.MoveOutcome;
import java.nio.file.Path;

/**
 * A pluggable decision procedure that maps a board to a move.
 * <p>
 * Strategies never decide that the game is over; the orchestrator detects game end from the live
 * game's own signals. {@link #nextMove(Board)} therefore always returns a move, even when no
 * direction changes the board.
 * <p>
 * Training and persistence are optional capabilities. The defaults answer with explicit
 * "unsupported" results so callers can treat every strategy uniformly.
 */
public interface Strategy {

    /**
     * Identity and description of this strategy; constant for the lifetime of the instance.
     */
    StrategyMetadata metadata();

    /**
     * Chooses the next move for {@code board}.
     */
    Move nextMove(Board board);

    /**
     * Scores every move for {@code board}.
     * <p>
     * The default simulates each move with {@link BoardEngine} and scores the result as
     * {@code empty * 10 + maxTile * 0.1}; moves that do not change the board score
     * {@link MoveScores#INVALID_MOVE_SCORE}.
     */
    default MoveScores moveScores(Board board) {
        Move[] moves = Move.values();
        double[] scores = new double[moves.length];
        for (Move move : moves) {
            MoveOutcome outcome = BoardEngine.apply(board, move);
            scores[move.ordinal()] = outcome.moved()
                    ? outcome.board().emptyCount() * 10.0 + outcome.board().maxTile() * 0.1
                    : MoveScores.INVALID_MOVE_SCORE;
        }
        return MoveScores.of(scores);
    }

    /**
     * Cumulative statistics owned by this instance.
     */
    PerformanceRecord performance();

    /**
     * Folds a completed game into {@link #performance()}.
     */
    default void recordGame(GameSummary game) {
        performance().update(game);
    }

    default TrainingResult train(TrainingOptions options) {
        return TrainingResult.unsupported(metadata().name());
    }

    default PersistenceResult save(Path path) {
        return PersistenceResult.unsupported(metadata().name());
    }

    default PersistenceResult load(Path path) {
        return PersistenceResult.unsupported(metadata().name());
    }

    /**
     * Clears per-game state. Stateless strategies do nothing.
     */
    default void reset() {
    }

    /**
     * Whether the strategy has been trained (always true for strategies that need no training).
     */
    default boolean isTrained() {
        return !metadata().trainingRequired();
    }
}
