package ai.tiles.strategy.ai.rl;

import ai.tiles.game.Board;
import ai.tiles.game.MoveOutcome;
import ai.tiles.heuristic.BoardFeatures;

/**
 * Default reward shaping for tabular Q-learning on the 4x4 board.
 * <p>
 * A move that changes nothing earns {@code invalidMovePenalty} (-10 by default). Otherwise the
 * reward is the sum of:
 * <ul>
 *   <li>the merge score delta,</li>
 *   <li>empty cells × {@code emptyCellWeight} (2),</li>
 *   <li>log2 of the largest tile, when any tile exists,</li>
 *   <li>monotonic rows/columns × {@code monotonicityWeight} (5).</li>
 * </ul>
 * The constants are tuning starting points, not derived values.
 */
public class ShapedReward implements RewardFunction {
    public static final double DEFAULT_INVALID_MOVE_PENALTY = -10.0;
    public static final double DEFAULT_EMPTY_CELL_WEIGHT = 2.0;
    public static final double DEFAULT_MONOTONICITY_WEIGHT = 5.0;

    private final double invalidMovePenalty;
    private final double emptyCellWeight;
    private final double monotonicityWeight;

    public ShapedReward() {
        this(DEFAULT_INVALID_MOVE_PENALTY, DEFAULT_EMPTY_CELL_WEIGHT, DEFAULT_MONOTONICITY_WEIGHT);
    }

    public ShapedReward(double invalidMovePenalty, double emptyCellWeight, double monotonicityWeight) {
        this.invalidMovePenalty = invalidMovePenalty;
        this.emptyCellWeight = emptyCellWeight;
        this.monotonicityWeight = monotonicityWeight;
    }

    @Override
    public double reward(Board before, MoveOutcome outcome) {
        if (!outcome.moved()) {
            return invalidMovePenalty;
        }
        Board after = outcome.board();
        double reward = outcome.scoreDelta();
        reward += after.emptyCount() * emptyCellWeight;
        int maxTile = after.maxTile();
        if (maxTile > 0) {
            reward += log2(maxTile);
        }
        reward += BoardFeatures.monotonicity(after) * monotonicityWeight;
        return reward;
    }

    static double log2(int value) {
        return 31 - Integer.numberOfLeadingZeros(value);
    }
}
