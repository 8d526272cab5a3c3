package ai.tiles.adapter;

import ai.tiles.game.Move;

/**
 * Sink for moves chosen by a strategy.
 */
public interface MoveExecutor {

    /**
     * Sends {@code move} to the game.
     *
     * @return true if the board changed as a result
     */
    boolean execute(Move move);
}
