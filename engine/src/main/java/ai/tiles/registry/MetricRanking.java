package ai.tiles.registry;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One row of a single-metric leaderboard.
 *
 * @param rank        1-based position by {@code metric}
 * @param strategyId  registry identifier
 * @param name        display name
 * @param metric      the metric the board is ordered by
 * @param metricValue value of {@code metric} for this strategy
 * @param gamesPlayed total games recorded
 */
@JsonPropertyOrder({"rank", "algorithm_id", "algorithm_name", "metric", "metric_value", "games_played"})
public record MetricRanking(
        @JsonProperty("rank") int rank,
        @JsonProperty("algorithm_id") String strategyId,
        @JsonProperty("algorithm_name") String name,
        @JsonProperty("metric") RankingMetric metric,
        @JsonProperty("metric_value") double metricValue,
        @JsonProperty("games_played") int gamesPlayed) {
}
