package ai.tiles.registry;

import ai.tiles.strategy.GameSummary;
import ai.tiles.strategy.PersistenceResult;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the registry's leaderboard and game history as JSON, and reads the history back.
 * <p>
 * Export shape:
 * <pre>
 * {
 *   "exported_at": "2024-05-01T12:00:00Z",
 *   "ranking_weights": { "efficiency": 0.4, ... },
 *   "leaderboard": [ { "rank": 1, "algorithm_id": "Enhanced Heuristic_2.1", "games_played": 10,
 *                      "average_efficiency": 2.4, "highest_tile": 512, "consistency_score": 0.8, ... } ],
 *   "history": [ { "algorithm_id": "...", "games_played": 10,
 *                  "games": [ { "final_score": 2400, "moves_completed": 1000, "highest_tile": 256,
 *                               "timestamp": 1714564800000 } ] } ]
 * }
 * </pre>
 */
public class PerformanceExporter {
    private static final Logger log = LoggerFactory.getLogger(PerformanceExporter.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final StrategyRegistry registry;

    public PerformanceExporter(StrategyRegistry registry) {
        this.registry = registry;
    }

    /**
     * Snapshot of the current leaderboard and history.
     */
    public ExportDocument snapshot() {
        ExportDocument document = new ExportDocument();
        document.setExportedAt(Instant.now().toString());
        document.setRankingWeights(LeaderboardRanker.weights());
        document.setLeaderboard(registry.leaderboard());
        List<StrategyHistory> history = new ArrayList<>();
        for (String id : registry.ids()) {
            List<GameSummary> games = registry.history(id);
            if (games.isEmpty()) {
                continue;
            }
            StrategyHistory entry = new StrategyHistory();
            entry.setStrategyId(id);
            entry.setGamesPlayed(registry.gamesPlayed(id));
            List<GameRecord> records = new ArrayList<>(games.size());
            for (GameSummary game : games) {
                records.add(GameRecord.from(game));
            }
            entry.setGames(records);
            history.add(entry);
        }
        document.setHistory(history);
        return document;
    }

    public String toJson() throws JsonProcessingException {
        return OBJECT_MAPPER.writeValueAsString(snapshot());
    }

    /**
     * Writes {@link #snapshot()} to {@code path}, creating parent directories as needed.
     */
    public PersistenceResult export(Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            ExportDocument document = snapshot();
            OBJECT_MAPPER.writeValue(path.toFile(), document);
            log.info("Exported leaderboard with {} strategies to {}", document.getLeaderboard().size(), path);
            return PersistenceResult.ok(path);
        } catch (IOException e) {
            log.warn("Failed to export performance data to {}: {}", path, e.toString());
            return PersistenceResult.ioError(path, e.getMessage());
        }
    }

    /**
     * Restores recorded history from an export written by {@link #export(Path)}. Histories of
     * strategies that are not registered are skipped; the leaderboard section is ignored and
     * recomputed on demand.
     */
    public PersistenceResult importHistory(Path path) {
        byte[] content;
        try {
            content = Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            return PersistenceResult.fileMissing(path);
        } catch (IOException e) {
            log.warn("Failed to read performance data from {}: {}", path, e.toString());
            return PersistenceResult.ioError(path, e.getMessage());
        }

        List<StrategyHistory> histories;
        try {
            JsonNode root = OBJECT_MAPPER.readTree(content);
            if (root == null || !root.has("history")) {
                return PersistenceResult.corrupt(path, "missing history");
            }
            histories = OBJECT_MAPPER.convertValue(root.get("history"), new TypeReference<List<StrategyHistory>>() {
            });
        } catch (JsonProcessingException e) {
            return PersistenceResult.corrupt(path, e.getOriginalMessage());
        } catch (IllegalArgumentException e) {
            return PersistenceResult.corrupt(path, e.getMessage());
        } catch (IOException e) {
            return PersistenceResult.ioError(path, e.getMessage());
        }

        if (histories == null) {
            return PersistenceResult.corrupt(path, "history is null");
        }
        Map<StrategyHistory, List<GameSummary>> decoded = new LinkedHashMap<>();
        for (StrategyHistory history : histories) {
            if (history == null || history.getStrategyId() == null) {
                return PersistenceResult.corrupt(path, "history entry without algorithm_id");
            }
            List<GameSummary> games = new ArrayList<>(history.getGames().size());
            try {
                for (GameRecord record : history.getGames()) {
                    if (record == null) {
                        return PersistenceResult.corrupt(path, "null game in history of " + history.getStrategyId());
                    }
                    games.add(record.toSummary());
                }
            } catch (IllegalArgumentException e) {
                return PersistenceResult.corrupt(path, e.getMessage());
            }
            decoded.put(history, games);
        }

        // nothing is restored until every entry has decoded
        int restored = 0;
        for (Map.Entry<StrategyHistory, List<GameSummary>> entry : decoded.entrySet()) {
            StrategyHistory history = entry.getKey();
            if (registry.restoreHistory(history.getStrategyId(), entry.getValue(), history.getGamesPlayed())) {
                restored++;
            } else {
                log.warn("Skipping history for unregistered strategy {}", history.getStrategyId());
            }
        }
        log.info("Imported history for {} strategies from {}", restored, path);
        return PersistenceResult.ok(path);
    }

    @JsonPropertyOrder({"exported_at", "ranking_weights", "leaderboard", "history"})
    public static class ExportDocument {
        private String exportedAt;
        private Map<String, Double> rankingWeights;
        private List<LeaderboardEntry> leaderboard = new ArrayList<>();
        private List<StrategyHistory> history = new ArrayList<>();

        @JsonProperty("exported_at")
        public String getExportedAt() {
            return exportedAt;
        }

        public void setExportedAt(String exportedAt) {
            this.exportedAt = exportedAt;
        }

        @JsonProperty("ranking_weights")
        public Map<String, Double> getRankingWeights() {
            return rankingWeights;
        }

        public void setRankingWeights(Map<String, Double> rankingWeights) {
            this.rankingWeights = rankingWeights;
        }

        @JsonProperty("leaderboard")
        public List<LeaderboardEntry> getLeaderboard() {
            return leaderboard;
        }

        public void setLeaderboard(List<LeaderboardEntry> leaderboard) {
            this.leaderboard = leaderboard;
        }

        @JsonProperty("history")
        public List<StrategyHistory> getHistory() {
            return history;
        }

        public void setHistory(List<StrategyHistory> history) {
            this.history = history;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonPropertyOrder({"algorithm_id", "games_played", "games"})
    public static class StrategyHistory {
        private String strategyId;
        private int gamesPlayed;
        private List<GameRecord> games = new ArrayList<>();

        @JsonProperty("algorithm_id")
        public String getStrategyId() {
            return strategyId;
        }

        public void setStrategyId(String strategyId) {
            this.strategyId = strategyId;
        }

        @JsonProperty("games_played")
        public int getGamesPlayed() {
            return gamesPlayed;
        }

        public void setGamesPlayed(int gamesPlayed) {
            this.gamesPlayed = gamesPlayed;
        }

        @JsonProperty("games")
        public List<GameRecord> getGames() {
            return games;
        }

        public void setGames(List<GameRecord> games) {
            this.games = games == null ? new ArrayList<>() : games;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonPropertyOrder({"final_score", "moves_completed", "highest_tile", "timestamp"})
    public static class GameRecord {
        private int finalScore;
        private int movesCompleted;
        private int highestTile;
        private long timestamp;

        static GameRecord from(GameSummary game) {
            GameRecord record = new GameRecord();
            record.setFinalScore(game.finalScore());
            record.setMovesCompleted(game.movesCompleted());
            record.setHighestTile(game.highestTile());
            record.setTimestamp(game.timestampMillis());
            return record;
        }

        GameSummary toSummary() {
            return new GameSummary(finalScore, movesCompleted, highestTile, timestamp);
        }

        @JsonProperty("final_score")
        public int getFinalScore() {
            return finalScore;
        }

        public void setFinalScore(int finalScore) {
            this.finalScore = finalScore;
        }

        @JsonProperty("moves_completed")
        public int getMovesCompleted() {
            return movesCompleted;
        }

        public void setMovesCompleted(int movesCompleted) {
            this.movesCompleted = movesCompleted;
        }

        @JsonProperty("highest_tile")
        public int getHighestTile() {
            return highestTile;
        }

        public void setHighestTile(int highestTile) {
            this.highestTile = highestTile;
        }

        @JsonProperty("timestamp")
        public long getTimestamp() {
            return timestamp;
        }

        public void setTimestamp(long timestamp) {
            this.timestamp = timestamp;
        }
    }
}
