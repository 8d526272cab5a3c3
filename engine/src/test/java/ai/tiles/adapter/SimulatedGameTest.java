package ai.tiles.adapter;

import static org.junit.jupiter.api.Assertions.*;

import ai.tiles.game.Move;
import ai.tiles.unit.helpers.BoardFactory;
import org.junit.jupiter.api.Test;

class SimulatedGameTest {

    @Test
    void startsWithTwoTiles() {
        SimulatedGame game = new SimulatedGame(5L);
        assertEquals(2, game.currentBoard().tileCount());
        assertEquals(0, game.score());
        assertFalse(game.isGameOver());
    }

    @Test
    void mergingMoveScoresAndSpawns() {
        SimulatedGame game = new SimulatedGame(5L);
        game.load(BoardFactory.topPair(), 10);

        assertTrue(game.execute(Move.LEFT));
        assertEquals(14, game.score());
        assertEquals(1, game.getMoves());
        assertEquals(4, game.currentBoard().maxTile());
        assertEquals(2, game.currentBoard().tileCount());
    }

    @Test
    void noOpMoveIsIgnored() {
        SimulatedGame game = new SimulatedGame(5L);
        game.load(BoardFactory.packedTopRow(), 0);

        assertFalse(game.execute(Move.LEFT));
        assertEquals(BoardFactory.packedTopRow(), game.currentBoard());
        assertEquals(0, game.getMoves());
    }

    @Test
    void deadBoardIsGameOver() {
        SimulatedGame game = new SimulatedGame(5L);
        game.load(BoardFactory.deadCheckerboard(), 500);
        assertTrue(game.isGameOver());
        assertFalse(game.execute(Move.UP));
        assertEquals(500, game.score());
    }

    @Test
    void newGameResets() {
        SimulatedGame game = new SimulatedGame(5L);
        game.load(BoardFactory.topPair(), 0);
        game.execute(Move.LEFT);
        game.newGame();
        assertEquals(0, game.score());
        assertEquals(0, game.getMoves());
        assertEquals(2, game.currentBoard().tileCount());
    }

    @Test
    void sameSeedSameGame() {
        SimulatedGame first = new SimulatedGame(77L);
        SimulatedGame second = new SimulatedGame(77L);
        assertEquals(first.currentBoard(), second.currentBoard());
        for (Move move : new Move[] {Move.LEFT, Move.UP, Move.RIGHT, Move.DOWN}) {
            assertEquals(first.execute(move), second.execute(move));
            assertEquals(first.currentBoard(), second.currentBoard());
        }
    }
}
