package ai.tiles.strategy;

import ai.tiles.game.Move;
import java.util.Arrays;
import java.util.List;

/**
 * Per-move scores keyed to {@link Move} (UP, DOWN, LEFT, RIGHT). Immutable.
 */
public final class MoveScores {
    /** Score assigned to a move that does not change the board. */
    public static final double INVALID_MOVE_SCORE = -999.0;

    private final double[] scores;

    private MoveScores(double[] scores) {
        this.scores = scores;
    }

    /**
     * @param scores four values in {@link Move} declaration order
     */
    public static MoveScores of(double... scores) {
        if (scores.length != Move.values().length) {
            throw new IllegalArgumentException("Expected " + Move.values().length + " scores but got " + scores.length);
        }
        return new MoveScores(scores.clone());
    }

    public double get(Move move) {
        return scores[move.ordinal()];
    }

    public double[] toArray() {
        return scores.clone();
    }

    /**
     * Highest-scoring move. Ties go to the move that appears first in {@code tieBreakOrder};
     * moves missing from the order rank after all listed moves, in declaration order.
     */
    public Move best(List<Move> tieBreakOrder) {
        Move best = null;
        for (Move move : Move.values()) {
            if (best == null) {
                best = move;
                continue;
            }
            double candidate = get(move);
            double current = get(best);
            if (candidate > current
                    || (candidate == current && priority(tieBreakOrder, move) < priority(tieBreakOrder, best))) {
                best = move;
            }
        }
        return best;
    }

    private static int priority(List<Move> order, Move move) {
        int index = order.indexOf(move);
        return index < 0 ? order.size() + move.ordinal() : index;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof MoveScores && Arrays.equals(scores, ((MoveScores) o).scores);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(scores);
    }

    @Override
    public String toString() {
        return String.format("UP=%.1f, DOWN=%.1f, LEFT=%.1f, RIGHT=%.1f", scores[0], scores[1], scores[2], scores[3]);
    }
}
