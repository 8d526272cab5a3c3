package ai.tiles.strategy.ai;

import static org.junit.jupiter.api.Assertions.*;

import ai.tiles.game.Board;
import ai.tiles.game.Move;
import ai.tiles.strategy.GameSummary;
import ai.tiles.strategy.MoveScores;
import ai.tiles.strategy.PersistenceResult;
import ai.tiles.strategy.StrategyCategory;
import ai.tiles.strategy.TrainingOptions;
import ai.tiles.unit.helpers.BoardFactory;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FixedPriorityStrategyTest {

    @Test
    void playsUpFromOppositeCornersWithDefaultOrder() {
        FixedPriorityStrategy strategy = new FixedPriorityStrategy();
        assertEquals(List.of(Move.UP, Move.LEFT, Move.DOWN, Move.RIGHT), strategy.getMovePriority());
        assertEquals(Move.UP, strategy.nextMove(BoardFactory.twoCorners()));
    }

    @Test
    void skipsMovesThatChangeNothing() {
        // UP and LEFT are blocked on a packed top row.
        assertEquals(Move.DOWN, new FixedPriorityStrategy().nextMove(BoardFactory.packedTopRow()));
    }

    @Test
    void fallsBackToFirstPriorityWhenNothingIsLegal() {
        assertEquals(Move.UP, new FixedPriorityStrategy().nextMove(BoardFactory.deadCheckerboard()));
    }

    @Test
    void scoresFollowPriorityIndex() {
        MoveScores scores = new FixedPriorityStrategy().moveScores(BoardFactory.packedTopRow());
        assertEquals(MoveScores.INVALID_MOVE_SCORE, scores.get(Move.UP));
        assertEquals(MoveScores.INVALID_MOVE_SCORE, scores.get(Move.LEFT));
        assertEquals(MoveScores.INVALID_MOVE_SCORE, scores.get(Move.RIGHT));
        assertEquals(80.0, scores.get(Move.DOWN));
    }

    @Test
    void customOrderFromMoveNames() {
        FixedPriorityStrategy strategy = new FixedPriorityStrategy(
                Map.of(FixedPriorityStrategy.PARAM_MOVE_PRIORITY, List.of("right", "DOWN")));
        assertEquals(Move.RIGHT, strategy.nextMove(BoardFactory.twoCorners()));

        MoveScores scores = strategy.moveScores(BoardFactory.twoCorners());
        assertEquals(100.0, scores.get(Move.RIGHT));
        assertEquals(90.0, scores.get(Move.DOWN));
        // Valid but unlisted.
        assertEquals(50.0, scores.get(Move.UP));
        assertEquals(50.0, scores.get(Move.LEFT));
    }

    @Test
    void invalidOrdersAreRejected() {
        FixedPriorityStrategy strategy = new FixedPriorityStrategy();
        assertThrows(IllegalArgumentException.class, () -> strategy.setMovePriority(List.of()));
        assertThrows(IllegalArgumentException.class, () -> strategy.setMovePriority(List.of(Move.UP, Move.UP)));
        assertThrows(IllegalArgumentException.class, () -> new FixedPriorityStrategy(
                Map.of(FixedPriorityStrategy.PARAM_MOVE_PRIORITY, List.of("UP", "NORTH"))));
        assertThrows(IllegalArgumentException.class, () -> new FixedPriorityStrategy(
                Map.of(FixedPriorityStrategy.PARAM_MOVE_PRIORITY, "UP")));
    }

    @Test
    void setMovePriorityChangesDecisions() {
        FixedPriorityStrategy strategy = new FixedPriorityStrategy();
        strategy.setMovePriority(List.of(Move.LEFT, Move.UP));
        assertEquals(Move.LEFT, strategy.nextMove(BoardFactory.twoCorners()));
        assertEquals(List.of(Move.LEFT, Move.UP), strategy.getConfig().get(FixedPriorityStrategy.PARAM_MOVE_PRIORITY));
        assertEquals(List.of(Move.LEFT, Move.UP),
                strategy.metadata().parameters().get(FixedPriorityStrategy.PARAM_MOVE_PRIORITY));
    }

    @Test
    void metadataAndOptionalCapabilities() {
        FixedPriorityStrategy strategy = new FixedPriorityStrategy();
        assertEquals("Basic Priority_1.0", strategy.metadata().id());
        assertEquals(StrategyCategory.RULE_BASED, strategy.metadata().category());
        assertEquals(1.8, strategy.metadata().baseline().getAsDouble());
        assertTrue(strategy.isTrained());

        assertFalse(strategy.train(TrainingOptions.defaults()).supported());
        PersistenceResult saved = strategy.save(Path.of("unused.json"));
        assertEquals(PersistenceResult.Status.UNSUPPORTED, saved.getStatus());
        assertFalse(saved.isSuccess());
        assertEquals(PersistenceResult.Status.UNSUPPORTED, strategy.load(Path.of("unused.json")).getStatus());
    }

    @Test
    void recordGameUpdatesOwnPerformance() {
        FixedPriorityStrategy strategy = new FixedPriorityStrategy();
        strategy.recordGame(new GameSummary(200, 100, 64));
        strategy.recordGame(new GameSummary(100, 100, 128));
        assertEquals(2, strategy.performance().getGamesPlayed());
        assertEquals(1.5, strategy.performance().getAverageEfficiency(), 1e-9);
        assertEquals(128, strategy.performance().getHighestTile());
    }

    @Test
    void boardIsNotModifiedByDecision() {
        Board board = BoardFactory.twoCorners();
        int[] before = board.toArray();
        new FixedPriorityStrategy().nextMove(board);
        assertArrayEquals(before, board.toArray());
    }
}
