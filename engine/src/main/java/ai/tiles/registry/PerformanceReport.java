package ai.tiles.registry;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;

/**
 * Per-strategy trend report over the retained game history.
 *
 * @param strategyId         registry identifier
 * @param gamesAnalysed      games in the retained history
 * @param currentEfficiency  efficiency of the most recent game
 * @param averageEfficiency  mean efficiency
 * @param bestEfficiency     best single-game efficiency
 * @param efficiencyTrend    least-squares slope of efficiency over game index
 * @param recentVsHistorical mean of the last five games minus the mean of the games before them
 *                           (0 when there are at most five)
 * @param consistency        same measure as {@link LeaderboardEntry#consistency()}
 * @param efficiencyHistory  per-game efficiency, oldest first
 * @param recommendations    short advice derived from the level, trend and consistency
 */
@JsonPropertyOrder({"algorithm_id", "games_analysed", "current_efficiency", "average_efficiency",
        "best_efficiency", "efficiency_trend", "recent_vs_historical", "consistency_score",
        "performance_history", "recommendations"})
public record PerformanceReport(
        @JsonProperty("algorithm_id") String strategyId,
        @JsonProperty("games_analysed") int gamesAnalysed,
        @JsonProperty("current_efficiency") double currentEfficiency,
        @JsonProperty("average_efficiency") double averageEfficiency,
        @JsonProperty("best_efficiency") double bestEfficiency,
        @JsonProperty("efficiency_trend") double efficiencyTrend,
        @JsonProperty("recent_vs_historical") double recentVsHistorical,
        @JsonProperty("consistency_score") double consistency,
        @JsonProperty("performance_history") List<Double> efficiencyHistory,
        @JsonProperty("recommendations") List<String> recommendations) {

    public PerformanceReport {
        efficiencyHistory = List.copyOf(efficiencyHistory);
        recommendations = List.copyOf(recommendations);
    }
}
