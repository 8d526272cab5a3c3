package ai.tiles.strategy.ai.rl;

/**
 * One environment transition.
 *
 * @param observation observation after the step (see {@link TrainingEnvironment#observation()})
 * @param reward      reward from the active {@link RewardFunction}
 * @param done        true once no move can change the board
 * @param info        bookkeeping for logging and statistics
 */
public record StepResult(double[] observation, double reward, boolean done, Info info) {

    /**
     * @param moved       whether the action changed the board
     * @param highestTile largest tile seen during the episode
     * @param emptyTiles  empty cells after the step (including the spawned tile)
     * @param totalMoves  actions taken this episode, including no-ops
     * @param efficiency  score divided by total moves
     */
    public record Info(boolean moved, int highestTile, int emptyTiles, int totalMoves, double efficiency) {
    }
}
