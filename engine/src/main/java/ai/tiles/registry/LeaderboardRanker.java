package ai.tiles.registry;

import ai.tiles.strategy.GameSummary;
import ai.tiles.strategy.StrategyCategory;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Composite ranking of strategies from their recorded game histories.
 * <p>
 * Each strategy is reduced to four metrics, every metric is min-max normalised across the
 * candidates, and the composite is the weighted sum:
 * <ul>
 *   <li>average efficiency (0.4)</li>
 *   <li>consistency (0.3)</li>
 *   <li>log2 of the highest tile (0.2)</li>
 *   <li>improvement slope (0.1)</li>
 * </ul>
 * When all candidates share the same value the normalised metric is 1.0, except improvement
 * which becomes 0.5. The order is total: composite descending, then the order in which the
 * candidates were supplied (registration order).
 */
public final class LeaderboardRanker {
    public static final double EFFICIENCY_WEIGHT = 0.4;
    public static final double CONSISTENCY_WEIGHT = 0.3;
    public static final double HIGHEST_TILE_WEIGHT = 0.2;
    public static final double IMPROVEMENT_WEIGHT = 0.1;

    /** Floor for the mean in the consistency ratio. */
    static final double MIN_MEAN = 0.1;

    /** Window for the stability index and the recent-versus-historical comparison. */
    static final int STABILITY_WINDOW = 5;

    /** Slope magnitude below which a report calls the trend stable. */
    static final double TREND_THRESHOLD = 0.01;

    /** Consistency below which a report flags erratic play. */
    static final double CONSISTENCY_THRESHOLD = 0.7;

    static final String ADVICE_BASICS = "Review the basics: keep cells empty and anchor the largest tile in a corner";
    static final String ADVICE_STRUCTURE = "Add board-structure terms such as monotonicity";
    static final String ADVICE_TUNE = "Tune the weights for a better balance between terms";
    static final String ADVICE_STRONG = "Strong efficiency; a good baseline for other strategies";
    static final String ADVICE_DECLINING = "Efficiency is declining; review recent changes";
    static final String ADVICE_IMPROVING = "Efficiency is improving; keep the current approach";
    static final String ADVICE_STABLE = "Efficiency is stable; try a new idea to move it";
    static final String ADVICE_ERRATIC = "Results vary a lot between games; work on consistency";

    private LeaderboardRanker() {
    }

    /**
     * Weights keyed by metric name, as written to exports.
     */
    public static Map<String, Double> weights() {
        Map<String, Double> weights = new LinkedHashMap<>();
        weights.put("efficiency", EFFICIENCY_WEIGHT);
        weights.put("consistency", CONSISTENCY_WEIGHT);
        weights.put("highest_tile", HIGHEST_TILE_WEIGHT);
        weights.put("improvement", IMPROVEMENT_WEIGHT);
        return weights;
    }

    /**
     * Ranks the candidates. Candidates with an empty history are skipped.
     *
     * @param candidates in registration order
     */
    public static List<LeaderboardEntry> rank(List<Candidate> candidates) {
        List<Metrics> metrics = new ArrayList<>();
        for (Candidate candidate : candidates) {
            if (!candidate.history().isEmpty()) {
                metrics.add(measure(candidate));
            }
        }
        if (metrics.isEmpty()) {
            return List.of();
        }

        double[] efficiency = normalise(metrics.stream().mapToDouble(Metrics::averageEfficiency).toArray(), 1.0);
        double[] consistency = normalise(metrics.stream().mapToDouble(Metrics::consistency).toArray(), 1.0);
        double[] tiles = normalise(metrics.stream().mapToDouble(m -> log2(Math.max(m.highestTile(), 1))).toArray(), 1.0);
        double[] improvement = normalise(metrics.stream().mapToDouble(Metrics::improvementRate).toArray(), 0.5);

        for (int i = 0; i < metrics.size(); i++) {
            metrics.get(i).composite = efficiency[i] * EFFICIENCY_WEIGHT
                    + consistency[i] * CONSISTENCY_WEIGHT
                    + tiles[i] * HIGHEST_TILE_WEIGHT
                    + improvement[i] * IMPROVEMENT_WEIGHT;
        }

        // List.sort is stable, so equal composites keep registration order.
        List<Metrics> ranked = new ArrayList<>(metrics);
        ranked.sort(Comparator.comparingDouble((Metrics m) -> m.composite).reversed());

        int total = ranked.size();
        Map<StrategyCategory, Integer> categoryCounters = new EnumMap<>(StrategyCategory.class);
        List<LeaderboardEntry> entries = new ArrayList<>(total);
        for (int i = 0; i < total; i++) {
            Metrics m = ranked.get(i);
            int categoryRank = categoryCounters.merge(m.candidate.category(), 1, Integer::sum);
            entries.add(new LeaderboardEntry(
                    i + 1,
                    m.candidate.id(),
                    m.candidate.name(),
                    m.candidate.category(),
                    m.candidate.gamesPlayed(),
                    m.averageEfficiency(),
                    m.averageScore,
                    m.highestTile(),
                    m.consistency(),
                    m.improvementRate(),
                    m.stabilityIndex,
                    m.composite,
                    (double) (total - i) / total * 100.0,
                    categoryRank));
        }
        return entries;
    }

    /**
     * Reorders {@code entries} by one metric, best first, keeping at most {@code limit} rows.
     * Equal values keep the order of {@code entries}.
     *
     * @throws IllegalArgumentException if {@code limit} is negative
     */
    public static List<MetricRanking> rankBy(List<LeaderboardEntry> entries, RankingMetric metric, int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0 but was " + limit);
        }
        List<LeaderboardEntry> sorted = sortedBy(entries, metric);
        int size = Math.min(limit, sorted.size());
        List<MetricRanking> rows = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            LeaderboardEntry entry = sorted.get(i);
            rows.add(new MetricRanking(i + 1, entry.strategyId(), entry.name(), metric, metric.extract(entry),
                    entry.gamesPlayed()));
        }
        return rows;
    }

    /**
     * Ranks the candidates and also orders them separately by efficiency, highest tile and
     * consistency.
     */
    public static StrategyComparison compare(List<Candidate> candidates) {
        List<LeaderboardEntry> ranked = rank(candidates);
        return new StrategyComparison(
                ranked,
                ids(sortedBy(ranked, RankingMetric.AVERAGE_EFFICIENCY)),
                ids(sortedBy(ranked, RankingMetric.HIGHEST_TILE)),
                ids(sortedBy(ranked, RankingMetric.CONSISTENCY)));
    }

    /**
     * Trend report for one strategy.
     *
     * @throws IllegalArgumentException if the candidate has no history
     */
    public static PerformanceReport report(Candidate candidate) {
        List<GameSummary> history = candidate.history();
        if (history.isEmpty()) {
            throw new IllegalArgumentException("No games recorded for " + candidate.id());
        }
        int n = history.size();
        double[] efficiencies = new double[n];
        List<Double> trace = new ArrayList<>(n);
        double best = 0.0;
        for (int i = 0; i < n; i++) {
            efficiencies[i] = history.get(i).efficiency();
            trace.add(efficiencies[i]);
            best = Math.max(best, efficiencies[i]);
        }
        double average = mean(efficiencies);
        double trend = slope(efficiencies);
        double consistency = consistency(efficiencies);

        double recentVsHistorical = 0.0;
        if (n > STABILITY_WINDOW) {
            double[] earlier = new double[n - STABILITY_WINDOW];
            double[] recent = new double[STABILITY_WINDOW];
            System.arraycopy(efficiencies, 0, earlier, 0, earlier.length);
            System.arraycopy(efficiencies, earlier.length, recent, 0, STABILITY_WINDOW);
            recentVsHistorical = mean(recent) - mean(earlier);
        }

        return new PerformanceReport(
                candidate.id(),
                n,
                efficiencies[n - 1],
                average,
                best,
                trend,
                recentVsHistorical,
                consistency,
                trace,
                recommendations(average, trend, consistency, n));
    }

    static List<String> recommendations(double averageEfficiency, double trend, double consistency, int games) {
        List<String> advice = new ArrayList<>();
        if (averageEfficiency < 1.0) {
            advice.add(ADVICE_BASICS);
        } else if (averageEfficiency < 2.0) {
            advice.add(ADVICE_STRUCTURE);
            advice.add(ADVICE_TUNE);
        } else {
            advice.add(ADVICE_STRONG);
        }
        if (trend < -TREND_THRESHOLD) {
            advice.add(ADVICE_DECLINING);
        } else if (trend > TREND_THRESHOLD) {
            advice.add(ADVICE_IMPROVING);
        } else {
            advice.add(ADVICE_STABLE);
        }
        if (games > 1 && consistency < CONSISTENCY_THRESHOLD) {
            advice.add(ADVICE_ERRATIC);
        }
        return advice;
    }

    private static List<LeaderboardEntry> sortedBy(List<LeaderboardEntry> entries, RankingMetric metric) {
        List<LeaderboardEntry> sorted = new ArrayList<>(entries);
        sorted.sort(Comparator.comparingDouble((LeaderboardEntry entry) -> metric.extract(entry)).reversed());
        return sorted;
    }

    private static List<String> ids(List<LeaderboardEntry> entries) {
        List<String> ids = new ArrayList<>(entries.size());
        for (LeaderboardEntry entry : entries) {
            ids.add(entry.strategyId());
        }
        return ids;
    }

    /**
     * {@code clamp(1 - stddev / max(mean, 0.1), 0, 1)} using the population standard deviation.
     */
    static double consistency(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double mean = mean(values);
        double ratio = standardDeviation(values, mean) / Math.max(mean, MIN_MEAN);
        return Math.max(0.0, Math.min(1.0, 1.0 - ratio));
    }

    /**
     * Least-squares slope of {@code values} against their index; 0 for fewer than two values.
     */
    static double slope(double[] values) {
        int n = values.length;
        if (n < 2) {
            return 0.0;
        }
        double meanX = (n - 1) / 2.0;
        double meanY = mean(values);
        double numerator = 0.0;
        double denominator = 0.0;
        for (int i = 0; i < n; i++) {
            double dx = i - meanX;
            numerator += dx * (values[i] - meanY);
            denominator += dx * dx;
        }
        return numerator / denominator;
    }

    /**
     * Min-max normalisation to [0, 1]; every value maps to {@code degenerate} when all values are
     * equal.
     */
    static double[] normalise(double[] values, double degenerate) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double value : values) {
            min = Math.min(min, value);
            max = Math.max(max, value);
        }
        double[] normalised = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            normalised[i] = max == min ? degenerate : (values[i] - min) / (max - min);
        }
        return normalised;
    }

    private static Metrics measure(Candidate candidate) {
        List<GameSummary> history = candidate.history();
        double[] efficiencies = new double[history.size()];
        double scoreSum = 0.0;
        int highestTile = 0;
        for (int i = 0; i < history.size(); i++) {
            GameSummary game = history.get(i);
            efficiencies[i] = game.efficiency();
            scoreSum += game.finalScore();
            highestTile = Math.max(highestTile, game.highestTile());
        }
        double consistency = consistency(efficiencies);
        double stability = efficiencies.length >= STABILITY_WINDOW
                ? stability(efficiencies)
                : consistency;
        return new Metrics(
                candidate,
                mean(efficiencies),
                scoreSum / history.size(),
                highestTile,
                consistency,
                slope(efficiencies),
                stability);
    }

    private static double stability(double[] efficiencies) {
        double[] recent = new double[STABILITY_WINDOW];
        System.arraycopy(efficiencies, efficiencies.length - STABILITY_WINDOW, recent, 0, STABILITY_WINDOW);
        double ratio = standardDeviation(recent, mean(recent)) / Math.max(mean(efficiencies), MIN_MEAN);
        return 1.0 - Math.min(ratio, 1.0);
    }

    private static double mean(double[] values) {
        double sum = 0.0;
        for (double value : values) {
            sum += value;
        }
        return values.length == 0 ? 0.0 : sum / values.length;
    }

    private static double standardDeviation(double[] values, double mean) {
        double sum = 0.0;
        for (double value : values) {
            sum += (value - mean) * (value - mean);
        }
        return Math.sqrt(sum / values.length);
    }

    private static double log2(int value) {
        return Math.log(value) / Math.log(2);
    }

    /**
     * A strategy as seen by the ranker.
     *
     * @param history retained games, oldest first
     */
    public record Candidate(String id, String name, StrategyCategory category, int gamesPlayed,
                            List<GameSummary> history) {
        public Candidate {
            history = List.copyOf(history);
        }
    }

    private static final class Metrics {
        private final Candidate candidate;
        private final double averageEfficiency;
        private final double averageScore;
        private final int highestTile;
        private final double consistency;
        private final double improvementRate;
        private final double stabilityIndex;
        private double composite;

        private Metrics(Candidate candidate, double averageEfficiency, double averageScore, int highestTile,
                        double consistency, double improvementRate, double stabilityIndex) {
            this.candidate = candidate;
            this.averageEfficiency = averageEfficiency;
            this.averageScore = averageScore;
            this.highestTile = highestTile;
            this.consistency = consistency;
            this.improvementRate = improvementRate;
            this.stabilityIndex = stabilityIndex;
        }

        double averageEfficiency() {
            return averageEfficiency;
        }

        int highestTile() {
            return highestTile;
        }

        double consistency() {
            return consistency;
        }

        double improvementRate() {
            return improvementRate;
        }
    }
}
