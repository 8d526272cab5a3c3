package ai.tiles.game;

import java.util.Objects;

/**
 * Result of applying a {@link Move} to a {@link Board}.
 *
 * <p>When {@code moved} is false the board is the very instance that was passed in and the
 * score delta is zero.
 *
 * @param board      resulting board
 * @param moved      whether any tile changed position or value
 * @param scoreDelta sum of the values of all tiles created by merges during the move
 */
public record MoveOutcome(Board board, boolean moved, int scoreDelta) {

    public MoveOutcome {
        Objects.requireNonNull(board, "board");
        if (!moved && scoreDelta != 0) {
            throw new IllegalArgumentException("A no-op move cannot produce a score delta");
        }
    }

    static MoveOutcome unchanged(Board board) {
        return new MoveOutcome(board, false, 0);
    }
}
