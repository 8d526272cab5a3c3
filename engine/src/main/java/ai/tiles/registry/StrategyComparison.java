package ai.tiles.registry;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;

/**
 * Side-by-side view of a chosen set of strategies.
 *
 * @param strategies      composite-ranked entries of the compared strategies that have history
 * @param byEfficiency    ids ordered by average efficiency, best first
 * @param byHighestTile   ids ordered by highest tile, best first
 * @param byConsistency   ids ordered by consistency, best first
 */
@JsonPropertyOrder({"algorithms", "by_efficiency", "by_highest_tile", "by_consistency"})
public record StrategyComparison(
        @JsonProperty("algorithms") List<LeaderboardEntry> strategies,
        @JsonProperty("by_efficiency") List<String> byEfficiency,
        @JsonProperty("by_highest_tile") List<String> byHighestTile,
        @JsonProperty("by_consistency") List<String> byConsistency) {

    public StrategyComparison {
        strategies = List.copyOf(strategies);
        byEfficiency = List.copyOf(byEfficiency);
        byHighestTile = List.copyOf(byHighestTile);
        byConsistency = List.copyOf(byConsistency);
    }

    public boolean isEmpty() {
        return strategies.isEmpty();
    }
}
