package ai.tiles.strategy;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of a training request.
 * <p>
 * Strategies that cannot be trained answer with {@link #unsupported(String)} rather than
 * throwing; callers check {@link #supported()} before reading the statistics.
 *
 * @param supported            false when the strategy does not support training
 * @param message              human-readable summary or the reason training was refused
 * @param episodesTrained      episodes run by this call
 * @param totalEpisodes        episodes run over the strategy's lifetime
 * @param averageReward        mean total reward per episode
 * @param averageEpisodeLength mean steps per episode
 * @param averageHighestTile   mean highest tile reached per episode
 * @param maxHighestTile       best tile reached in any episode of this call
 * @param finalEpsilon         exploration rate after the last episode
 * @param epsilonTrace         exploration rate after each episode, in order
 * @param stateCount           number of states in the learned table
 * @param converged            whether exploration has decayed to its floor
 */
public record TrainingResult(
        boolean supported,
        String message,
        int episodesTrained,
        int totalEpisodes,
        double averageReward,
        double averageEpisodeLength,
        double averageHighestTile,
        int maxHighestTile,
        double finalEpsilon,
        List<Double> epsilonTrace,
        int stateCount,
        boolean converged) {

    public TrainingResult {
        epsilonTrace = epsilonTrace == null ? Collections.emptyList() : List.copyOf(epsilonTrace);
    }

    public static TrainingResult unsupported(String strategyName) {
        return new TrainingResult(false, strategyName + " does not support training",
                0, 0, 0.0, 0.0, 0.0, 0, 0.0, Collections.emptyList(), 0, false);
    }
}
