package ai.tiles.strategy;

/**
 * Knobs for {@link Strategy#train(TrainingOptions)}.
 *
 * @param episodes           number of episodes to run
 * @param maxStepsPerEpisode safety cap on steps within one episode
 * @param seed               seed for the environment and exploration; {@code null} for a
 *                           time-based seed
 * @param progressInterval   log a progress line every N episodes (0 disables)
 */
public record TrainingOptions(int episodes, int maxStepsPerEpisode, Long seed, int progressInterval) {

    public static final int DEFAULT_EPISODES = 1000;
    public static final int DEFAULT_MAX_STEPS = 1000;
    public static final int DEFAULT_PROGRESS_INTERVAL = 100;

    public TrainingOptions {
        if (episodes < 0) {
            throw new IllegalArgumentException("episodes must be >= 0 but was " + episodes);
        }
        if (maxStepsPerEpisode <= 0) {
            throw new IllegalArgumentException("maxStepsPerEpisode must be > 0 but was " + maxStepsPerEpisode);
        }
        if (progressInterval < 0) {
            throw new IllegalArgumentException("progressInterval must be >= 0 but was " + progressInterval);
        }
    }

    public static TrainingOptions defaults() {
        return new TrainingOptions(DEFAULT_EPISODES, DEFAULT_MAX_STEPS, null, DEFAULT_PROGRESS_INTERVAL);
    }

    public static TrainingOptions episodes(int episodes, long seed) {
        return new TrainingOptions(episodes, DEFAULT_MAX_STEPS, seed, DEFAULT_PROGRESS_INTERVAL);
    }
}
