package ai.tiles.strategy.ai;

import ai.tiles.game.Board;
import ai.tiles.game.BoardEngine;
import ai.tiles.game.BoardFormatter;
import ai.tiles.game.Move;
import ai.tiles.game.MoveOutcome;
import ai.tiles.heuristic.FeatureScore;
import ai.tiles.heuristic.HeuristicEvaluator;
import ai.tiles.heuristic.HeuristicWeights;
import ai.tiles.strategy.AbstractStrategy;
import ai.tiles.strategy.MoveScores;
import ai.tiles.strategy.StrategyCategory;
import ai.tiles.strategy.StrategyMetadata;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Greedy (1-ply) heuristic player:
 *
 * - Simulates each of the four moves with {@link BoardEngine}.
 * - Scores every resulting board with {@link HeuristicEvaluator} (empty cells, merge potential,
 *   corner bonus, monotonicity, max tile).
 * - Plays the highest-scoring move. Ties are broken by the fixed priority order
 *   (UP, LEFT, DOWN, RIGHT unless configured otherwise).
 *
 * Notes:
 * - Moves that do not change the board score {@link MoveScores#INVALID_MOVE_SCORE}, so a valid
 *   move is always preferred when one exists.
 * - No look-ahead over tile spawns; this stays greedy.
 *
 * Configuration keys: {@code weights} (map of weight name to value, all five keys required when
 * given), {@code move_priority}.
 */
public class HeuristicStrategy extends AbstractStrategy {
    private static final Logger log = LoggerFactory.getLogger(HeuristicStrategy.class);

    public static final String PARAM_WEIGHTS = "weights";

    private HeuristicEvaluator evaluator;
    private final List<Move> tieBreakOrder;

    public HeuristicStrategy() {
        this(Collections.emptyMap());
    }

    public HeuristicStrategy(HeuristicWeights weights) {
        this(Map.of(PARAM_WEIGHTS, weights.toMap()));
    }

    public HeuristicStrategy(Map<String, Object> config) {
        super(config);
        this.evaluator = new HeuristicEvaluator(weightsParam(config));
        this.tieBreakOrder = moveOrderParam(config, FixedPriorityStrategy.PARAM_MOVE_PRIORITY, DEFAULT_PRIORITY);
        putConfig(PARAM_WEIGHTS, evaluator.getWeights().toMap());
    }

    @Override
    public StrategyMetadata metadata() {
        Map<String, Object> parameters = new LinkedHashMap<>();
        HeuristicWeights weights = evaluator.getWeights();
        parameters.put("empty_tiles_weight", weights.emptyTiles());
        parameters.put("merge_potential_weight", weights.mergePotential());
        parameters.put("corner_bonus_weight", weights.cornerBonus());
        parameters.put("monotonicity_weight", weights.monotonicity());
        parameters.put("max_tile_weight", weights.maxTileValue());
        parameters.put(FixedPriorityStrategy.PARAM_MOVE_PRIORITY, tieBreakOrder);
        return new StrategyMetadata(
                "Enhanced Heuristic",
                "2.1",
                "Tile Bot Team",
                "Weighted heuristic with corner strategy, monotonicity and merge detection.",
                StrategyCategory.HEURISTIC,
                parameters,
                2.36,
                false);
    }

    @Override
    public Move nextMove(Board board) {
        MoveScores scores = moveScores(board);
        Move best = scores.best(tieBreakOrder);
        if (log.isDebugEnabled()) {
            log.debug("Heuristic scores [{}] -> {}", scores, best);
        }
        return best;
    }

    @Override
    public MoveScores moveScores(Board board) {
        double[] scores = new double[Move.values().length];
        for (Move move : Move.values()) {
            MoveOutcome outcome = BoardEngine.apply(board, move);
            scores[move.ordinal()] = outcome.moved()
                    ? evaluator.score(outcome.board())
                    : MoveScores.INVALID_MOVE_SCORE;
        }
        return MoveScores.of(scores);
    }

    /**
     * Feature breakdown of the board that {@link #nextMove(Board)} would produce, for debugging
     * and reports. Empty if no move changes the board.
     */
    public Map<String, FeatureScore> explain(Board board) {
        Move best = nextMove(board);
        MoveOutcome outcome = BoardEngine.apply(board, best);
        if (!outcome.moved()) {
            return Collections.emptyMap();
        }
        if (log.isDebugEnabled()) {
            log.debug("Explaining {} on board:\n{}", best, BoardFormatter.format(board));
        }
        return evaluator.explain(outcome.board());
    }

    public HeuristicWeights getWeights() {
        return evaluator.getWeights();
    }

    /**
     * Updates some or all weights; unspecified weights keep their current value.
     *
     * @throws ai.tiles.heuristic.InvalidWeightsException if a key is unknown or a value invalid
     */
    public void configureWeights(Map<String, ? extends Number> overrides) {
        this.evaluator = new HeuristicEvaluator(evaluator.getWeights().merge(overrides));
        putConfig(PARAM_WEIGHTS, evaluator.getWeights().toMap());
    }

    private static HeuristicWeights weightsParam(Map<String, Object> config) {
        if (config == null || !config.containsKey(PARAM_WEIGHTS)) {
            return HeuristicWeights.defaults();
        }
        Object value = config.get(PARAM_WEIGHTS);
        if (value instanceof HeuristicWeights) {
            return (HeuristicWeights) value;
        }
        if (value instanceof Map<?, ?>) {
            return HeuristicWeights.fromMap((Map<?, ?>) value);
        }
        throw new IllegalArgumentException("Parameter '" + PARAM_WEIGHTS + "' must be a map of weights but was " + value);
    }
}
