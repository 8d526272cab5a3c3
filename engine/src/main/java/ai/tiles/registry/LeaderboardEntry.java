package ai.tiles.registry;

import ai.tiles.strategy.StrategyCategory;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One ranked row of the leaderboard.
 *
 * @param rank              1-based overall rank
 * @param strategyId        registry identifier ({@code name_version})
 * @param name              display name
 * @param category          strategy family
 * @param gamesPlayed       total games recorded, including ones evicted from the bounded history
 * @param averageEfficiency mean points-per-move over the retained history
 * @param averageScore      mean final score over the retained history
 * @param highestTile       best tile in the retained history
 * @param consistency       {@code clamp(1 - stddev / max(mean, 0.1), 0, 1)} of per-game efficiency
 * @param improvementRate   least-squares slope of efficiency over game index
 * @param stabilityIndex    consistency of the last five games (equal to consistency for shorter
 *                          histories)
 * @param compositeScore    weighted sum of the normalised metrics
 * @param percentile        {@code (total - index) / total * 100}
 * @param categoryRank      1-based rank among strategies of the same category
 */
@JsonPropertyOrder({"rank", "algorithm_id", "algorithm_name", "category", "games_played", "average_efficiency",
        "average_score", "highest_tile", "consistency_score", "improvement_rate", "stability_index",
        "composite_score", "percentile", "category_rank"})
public record LeaderboardEntry(
        @JsonProperty("rank") int rank,
        @JsonProperty("algorithm_id") String strategyId,
        @JsonProperty("algorithm_name") String name,
        @JsonProperty("category") StrategyCategory category,
        @JsonProperty("games_played") int gamesPlayed,
        @JsonProperty("average_efficiency") double averageEfficiency,
        @JsonProperty("average_score") double averageScore,
        @JsonProperty("highest_tile") int highestTile,
        @JsonProperty("consistency_score") double consistency,
        @JsonProperty("improvement_rate") double improvementRate,
        @JsonProperty("stability_index") double stabilityIndex,
        @JsonProperty("composite_score") double compositeScore,
        @JsonProperty("percentile") double percentile,
        @JsonProperty("category_rank") int categoryRank) {
}
