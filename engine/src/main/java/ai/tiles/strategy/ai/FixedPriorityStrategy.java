package ai.tiles.strategy.ai;

import ai.tiles.game.Board;
import ai.tiles.game.Move;
import ai.tiles.strategy.AbstractStrategy;
import ai.tiles.strategy.MoveScores;
import ai.tiles.strategy.StrategyCategory;
import ai.tiles.strategy.StrategyMetadata;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Rule-based baseline: tries directions in a fixed priority order and plays the first one that
 * changes the board.
 *
 * <p>No search and no scoring beyond validity. The default order is UP, LEFT, DOWN, RIGHT, which
 * tends to keep large tiles in the top-left corner. Configure with {@code move_priority} (a list
 * of move names).
 */
public class FixedPriorityStrategy extends AbstractStrategy {

    public static final String PARAM_MOVE_PRIORITY = "move_priority";

    private List<Move> movePriority;

    public FixedPriorityStrategy() {
        this(Collections.emptyMap());
    }

    public FixedPriorityStrategy(List<Move> movePriority) {
        this(Map.of(PARAM_MOVE_PRIORITY, movePriority));
    }

    public FixedPriorityStrategy(Map<String, Object> config) {
        super(config);
        this.movePriority = moveOrderParam(config, PARAM_MOVE_PRIORITY, DEFAULT_PRIORITY);
        putConfig(PARAM_MOVE_PRIORITY, movePriority);
    }

    @Override
    public StrategyMetadata metadata() {
        return new StrategyMetadata(
                "Basic Priority",
                "1.0",
                "Tile Bot Team",
                "Simple rule-based strategy using fixed move priorities. Educational baseline.",
                StrategyCategory.RULE_BASED,
                Map.of(PARAM_MOVE_PRIORITY, movePriority),
                1.8,
                false);
    }

    @Override
    public Move nextMove(Board board) {
        for (Move move : movePriority) {
            if (isMoveValid(board, move)) {
                return move;
            }
        }
        return movePriority.get(0);
    }

    /**
     * Valid moves score {@code 100 - 10 * priorityIndex} (moves missing from the order score
     * 50); invalid moves score {@link MoveScores#INVALID_MOVE_SCORE}.
     */
    @Override
    public MoveScores moveScores(Board board) {
        double[] scores = new double[Move.values().length];
        for (Move move : Move.values()) {
            if (!isMoveValid(board, move)) {
                scores[move.ordinal()] = MoveScores.INVALID_MOVE_SCORE;
                continue;
            }
            int index = movePriority.indexOf(move);
            scores[move.ordinal()] = index < 0 ? 50.0 : 100.0 - index * 10.0;
        }
        return MoveScores.of(scores);
    }

    public List<Move> getMovePriority() {
        return movePriority;
    }

    /**
     * Replaces the priority order.
     *
     * @throws IllegalArgumentException if the order is empty or has duplicates
     */
    public void setMovePriority(List<Move> newPriority) {
        this.movePriority = validateOrder(newPriority);
        putConfig(PARAM_MOVE_PRIORITY, movePriority);
    }
}
