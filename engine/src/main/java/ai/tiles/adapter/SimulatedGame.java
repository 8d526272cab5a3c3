package ai.tiles.adapter;

import ai.tiles.game.Board;
import ai.tiles.game.BoardEngine;
import ai.tiles.game.Move;
import ai.tiles.game.MoveOutcome;
import ai.tiles.game.TileSpawner;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Headless 2048 game driven by {@link BoardEngine} and {@link TileSpawner}.
 * <p>
 * Moves that change the board add their merge score and spawn one tile; moves that change
 * nothing are accepted and ignored, as in the browser game. The game is over when no move can
 * change the board.
 */
public class SimulatedGame implements BoardObserver, MoveExecutor {
    private static final Logger log = LoggerFactory.getLogger(SimulatedGame.class);

    private final TileSpawner spawner;
    private Board board;
    private int score;
    private int moves;

    public SimulatedGame(TileSpawner spawner) {
        this.spawner = Objects.requireNonNull(spawner, "spawner");
        this.board = spawner.newGame();
    }

    public SimulatedGame(long seed) {
        this(new TileSpawner(seed));
    }

    /**
     * Starts over from a fresh two-tile board.
     */
    public void newGame() {
        board = spawner.newGame();
        score = 0;
        moves = 0;
    }

    /**
     * Continues from an arbitrary position, for tests and replays.
     */
    public void load(Board board, int score) {
        this.board = Objects.requireNonNull(board, "board");
        this.score = score;
        this.moves = 0;
    }

    @Override
    public Board currentBoard() {
        return board;
    }

    @Override
    public int score() {
        return score;
    }

    @Override
    public boolean isGameOver() {
        return !BoardEngine.hasLegalMove(board);
    }

    @Override
    public boolean execute(Move move) {
        MoveOutcome outcome = BoardEngine.apply(board, move);
        if (!outcome.moved()) {
            if (log.isDebugEnabled()) {
                log.debug("Move {} did not change the board", move);
            }
            return false;
        }
        score += outcome.scoreDelta();
        moves++;
        board = spawner.spawn(outcome.board());
        return true;
    }

    /**
     * Moves that changed the board since the last {@link #newGame()}.
     */
    public int getMoves() {
        return moves;
    }
}
