package ai.tiles.strategy.ai.rl;

import ai.tiles.game.Board;
import ai.tiles.game.MoveOutcome;

/**
 * Reward policy for {@link TrainingEnvironment}. Evaluated after the move is applied and before
 * the new tile spawns.
 */
@FunctionalInterface
public interface RewardFunction {

    /**
     * @param before  board before the move
     * @param outcome result of applying the move to {@code before}
     * @return reward for the transition
     */
    double reward(Board before, MoveOutcome outcome);

    /**
     * Reward equal to the merge score alone.
     */
    static RewardFunction scoreDelta() {
        return (before, outcome) -> outcome.scoreDelta();
    }
}
