package ai.tiles.registry;

import java.util.Locale;
import java.util.Optional;
import java.util.function.ToDoubleFunction;

/**
 * Single metrics a leaderboard can be ordered by. Higher is better for every metric.
 */
public enum RankingMetric {
    AVERAGE_EFFICIENCY("average_efficiency", LeaderboardEntry::averageEfficiency),
    AVERAGE_SCORE("average_score", LeaderboardEntry::averageScore),
    HIGHEST_TILE("highest_tile", LeaderboardEntry::highestTile),
    CONSISTENCY("consistency_score", LeaderboardEntry::consistency),
    IMPROVEMENT_RATE("improvement_rate", LeaderboardEntry::improvementRate),
    STABILITY("stability_index", LeaderboardEntry::stabilityIndex),
    GAMES_PLAYED("games_played", LeaderboardEntry::gamesPlayed),
    COMPOSITE("composite_score", LeaderboardEntry::compositeScore);

    private final String key;
    private final ToDoubleFunction<LeaderboardEntry> extractor;

    RankingMetric(String key, ToDoubleFunction<LeaderboardEntry> extractor) {
        this.key = key;
        this.extractor = extractor;
    }

    /**
     * Field name of this metric in exports.
     */
    public String key() {
        return key;
    }

    public double extract(LeaderboardEntry entry) {
        return extractor.applyAsDouble(entry);
    }

    /**
     * Matches either the export key ({@code average_efficiency}) or the constant name, ignoring
     * case.
     */
    public static Optional<RankingMetric> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String normalised = text.trim().toLowerCase(Locale.ROOT);
        for (RankingMetric metric : values()) {
            if (metric.key.equals(normalised) || metric.name().toLowerCase(Locale.ROOT).equals(normalised)) {
                return Optional.of(metric);
            }
        }
        return Optional.empty();
    }
}
