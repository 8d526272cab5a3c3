package ai.tiles.strategy.ai;

import ai.tiles.game.Board;
import ai.tiles.game.BoardEngine;
import ai.tiles.game.Move;
import ai.tiles.strategy.AbstractStrategy;
import ai.tiles.strategy.StrategyCategory;
import ai.tiles.strategy.StrategyMetadata;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Uniformly random choice among the moves that change the board. Baseline for comparisons only.
 *
 * <p>Seed with {@code seed} for reproducible runs.
 */
public class RandomStrategy extends AbstractStrategy {

    public static final String PARAM_SEED = "seed";

    private final Random random;

    public RandomStrategy() {
        this(Collections.emptyMap());
    }

    public RandomStrategy(long seed) {
        this(Map.of(PARAM_SEED, seed));
    }

    public RandomStrategy(Map<String, Object> config) {
        super(config);
        Object seed = config == null ? null : config.get(PARAM_SEED);
        if (seed == null) {
            this.random = new Random();
        } else if (seed instanceof Number) {
            this.random = new Random(((Number) seed).longValue());
        } else {
            throw new IllegalArgumentException("Parameter '" + PARAM_SEED + "' must be a number but was " + seed);
        }
    }

    @Override
    public StrategyMetadata metadata() {
        return new StrategyMetadata(
                "Random",
                "1.0",
                "Tile Bot Team",
                "Random move selection for baseline comparison.",
                StrategyCategory.RULE_BASED,
                Collections.emptyMap(),
                0.5,
                false);
    }

    @Override
    public Move nextMove(Board board) {
        List<Move> valid = BoardEngine.legalMoves(board);
        if (valid.isEmpty()) {
            Move[] all = Move.values();
            return all[random.nextInt(all.length)];
        }
        return valid.get(random.nextInt(valid.size()));
    }
}
