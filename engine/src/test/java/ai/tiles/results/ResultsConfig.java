package ai.tiles.results;

/**
 * Shared knobs for strategy result sweeps.
 *
 * Purpose:
 * - Keep sweep sizing and safety limits consistent across strategy comparisons.
 * - These values directly affect statistical confidence and runtime.
 *
 * How to think about changes:
 * - More games => a steadier average score and highest-tile distribution, but longer sweeps.
 *   The standard error of the mean shrinks ~ 1/sqrt(n).
 * - The move cap protects against runaway runtimes; it should rarely be hit.
 */
public final class ResultsConfig {
    private ResultsConfig() {}

    /**
     * Number of games per strategy in a single sweep.
     *
     * Can be overridden via: -Dtest.games=<number>
     * Example: mvn -pl engine test -Dtest=StrategyResultsTest -Dtest.games=200
     *
     * Use cases:
     * - Smoke run in the normal build: the default.
     * - Comparing heuristic weight sets: a few hundred games per strategy.
     */
    public static final int GAMES = Integer.getInteger("test.games", 10);

    /**
     * Base seed for tile spawning; game {@code i} uses {@code SEED + i} so every strategy sees the
     * same spawn stream.
     *
     * Can be overridden via: -Dtest.seed=<number>
     */
    public static final long SEED = Long.getLong("test.seed", 2048L);

    /**
     * How often to log progress during a sweep.
     *
     * Can be overridden via: -Dtest.progress.log.interval=<number>
     */
    public static final int PROGRESS_LOG_INTERVAL = Integer.getInteger("test.progress.log.interval", 5);

    /**
     * Safety cap on the number of moves allowed per game.
     *
     * Can be overridden via: -Dtest.max.moves.per.game=<number>
     *
     * Typical move counts:
     * - Random play: ~100-250 moves.
     * - Heuristic play reaching 512-1024: ~500-1000 moves.
     * - Anything near the cap points at a strategy that keeps choosing moves that change nothing.
     */
    public static final int MAX_MOVES_PER_GAME = Integer.getInteger("test.max.moves.per.game", 5000);

    /**
     * Q-learning episodes run before the learner joins a sweep. 0 sweeps it untrained.
     *
     * Can be overridden via: -Dtest.training.episodes=<number>
     */
    public static final int TRAINING_EPISODES = Integer.getInteger("test.training.episodes", 20);
}
