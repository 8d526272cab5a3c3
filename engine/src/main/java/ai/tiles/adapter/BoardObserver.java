package ai.tiles.adapter;

import ai.tiles.game.Board;

/**
 * Source of the live game state. Implementations might read a simulated board, a browser page
 * or a remote service; the orchestrator only sees validated {@link Board} values.
 */
public interface BoardObserver {

    /**
     * The board as currently displayed.
     *
     * @throws ai.tiles.game.InvalidBoardException if the host reports a malformed grid
     */
    Board currentBoard();

    /**
     * Score as reported by the host.
     */
    int score();

    /**
     * Whether the host considers the game finished.
     */
    boolean isGameOver();
}
