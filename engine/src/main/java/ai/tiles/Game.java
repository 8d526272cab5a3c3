package ai.tiles;

import ai.tiles.adapter.BoardObserver;
import ai.tiles.adapter.MoveExecutor;
import ai.tiles.adapter.SimulatedGame;
import ai.tiles.config.GameProperties;
import ai.tiles.config.TrainingProperties;
import ai.tiles.game.Board;
import ai.tiles.game.BoardEngine;
import ai.tiles.game.BoardFormatter;
import ai.tiles.game.Move;
import ai.tiles.registry.LeaderboardEntry;
import ai.tiles.registry.PerformanceExporter;
import ai.tiles.registry.StrategyRegistry;
import ai.tiles.strategy.GameSummary;
import ai.tiles.strategy.PersistenceResult;
import ai.tiles.strategy.Strategy;
import ai.tiles.strategy.TrainingResult;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class Game implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(Game.class);
    /** When true, emit structured per-move episode logs. */
    private static final boolean EPISODE_LOG_ENABLED = EpisodeLogger.isEnabled();

    private final StrategyRegistry registry;
    private final PerformanceExporter exporter;
    private final GameProperties gameProperties;
    private final TrainingProperties trainingProperties;

    public Game(
            StrategyRegistry registry,
            PerformanceExporter exporter,
            GameProperties gameProperties,
            TrainingProperties trainingProperties) {
        this.registry = registry;
        this.exporter = exporter;
        this.gameProperties = gameProperties;
        this.trainingProperties = trainingProperties;
    }

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Game.class);
        app.setWebApplicationType(WebApplicationType.NONE);
        app.run(args);
    }

    @Override
    public void run(String... args) {
        // CLI entrypoint ignores the results; tests call playAll() or play() directly.
        playAll();
    }

    /**
     * Resolves the configured strategy, prepares it (load and/or train when it supports that),
     * plays {@code game.games} headless games, then logs the leaderboard and writes the export.
     *
     * @return one result per game played; empty if the strategy id is unknown
     */
    public List<GameResult> playAll() {
        String strategyId = gameProperties.getStrategy();
        Optional<Strategy> resolved = registry.create(strategyId);
        if (resolved.isEmpty()) {
            log.error("Unknown strategy '{}'; registered strategies: {}", strategyId, registry.ids());
            return List.of();
        }
        Strategy strategy = resolved.get();
        prepare(strategy);

        int games = gameProperties.getGames();
        List<GameResult> results = new ArrayList<>(games);
        Long baseSeed = gameProperties.getSeed();
        for (int i = 0; i < games; i++) {
            System.setProperty("game.index", String.valueOf(i + 1));
            long seed = baseSeed != null ? baseSeed + i : System.nanoTime();
            SimulatedGame game = new SimulatedGame(seed);
            GameResult result = play(strategy, game, game);
            results.add(result);
            GameSummary summary = result.toSummary();
            strategy.recordGame(summary);
            registry.recordPerformance(strategy.metadata().id(), summary);
            log.info("Game {}/{} with {}: score {}, moves {}, highest tile {}{}",
                    i + 1, games, strategy.metadata().id(), result.getScore(), result.getMoves(),
                    result.getHighestTile(), result.isStalled() ? " (stalled)" : "");
        }
        System.clearProperty("game.index");

        logLeaderboard();
        logReport(strategy.metadata().id());
        String exportPath = gameProperties.getExportPath();
        if (exportPath != null && !exportPath.isBlank()) {
            PersistenceResult exported = exporter.export(Path.of(exportPath));
            if (!exported.isSuccess()) {
                log.warn("Leaderboard export failed: {}", exported.getMessage());
            }
        }
        return results;
    }

    /**
     * Core game loop used by both the CLI runner and automated tests.
     *
     * <p>Each turn reads the board from {@code observer}, asks the strategy for a move and sends
     * it through {@code executor}. The loop ends when the observer reports game over, when the
     * move cap is reached, or when the strategy keeps choosing moves that change nothing.
     */
    public GameResult play(Strategy strategy, BoardObserver observer, MoveExecutor executor) {
        String strategyId = strategy.metadata().id();
        strategy.reset();
        long startNanos = System.nanoTime();
        final int maxMoves = gameProperties.getMaxMoves();
        final int stallLimit = gameProperties.getStallLimit();
        int moves = 0;
        int iterations = 0;
        int consecutiveNoOps = 0;
        int highestTile = observer.currentBoard().maxTile();
        boolean stalled = false;

        while (!observer.isGameOver()) {
            if (iterations >= maxMoves) {
                if (log.isDebugEnabled()) {
                    log.debug("Maximum move limit reached ({}); stopping game loop for {}.", maxMoves, strategyId);
                }
                break;
            }
            Board before = observer.currentBoard();
            int scoreBefore = observer.score();
            Move move = strategy.nextMove(before);
            boolean moved = executor.execute(move);
            iterations++;
            Board after = observer.currentBoard();
            highestTile = Math.max(highestTile, after.maxTile());

            if (EPISODE_LOG_ENABLED) {
                EpisodeLogger.logStep(before, after, strategyId, iterations - 1,
                        BoardEngine.legalMoves(before), move, moved, observer.score() - scoreBefore);
            }
            if (log.isDebugEnabled()) {
                log.debug("{} played {} ({}):\n{}", strategyId, move, moved ? "moved" : "no change",
                        BoardFormatter.format(after));
            }

            if (moved) {
                moves++;
                consecutiveNoOps = 0;
            } else if (++consecutiveNoOps >= stallLimit) {
                stalled = true;
                log.warn("{} made {} consecutive moves that changed nothing; abandoning game", strategyId,
                        consecutiveNoOps);
                break;
            }
        }

        long durationNanos = System.nanoTime() - startNanos;
        int score = observer.score();
        if (EPISODE_LOG_ENABLED) {
            EpisodeLogger.logSummary(strategyId, moves, score, highestTile, stalled, durationNanos);
        }
        return new GameResult(score, moves, highestTile, durationNanos, stalled, observer.isGameOver());
    }

    /**
     * Loads a saved model and trains when configured. Strategies without training or
     * persistence answer "unsupported", which is only logged.
     */
    private void prepare(Strategy strategy) {
        String modelPath = trainingProperties.getModelPath();
        boolean hasModelPath = modelPath != null && !modelPath.isBlank();
        if (hasModelPath) {
            PersistenceResult loaded = strategy.load(Path.of(modelPath));
            if (loaded.isSuccess()) {
                log.info("Loaded model for {} from {}", strategy.metadata().id(), modelPath);
            } else if (log.isDebugEnabled()) {
                log.debug("No model loaded for {}: {}", strategy.metadata().id(), loaded.getMessage());
            }
        }
        if (!trainingProperties.isEnabled()) {
            if (strategy.metadata().trainingRequired() && !strategy.isTrained()) {
                log.warn("{} requires training but is untrained; enable training.enabled to train it first",
                        strategy.metadata().id());
            }
            return;
        }
        TrainingResult training = strategy.train(trainingProperties.toOptions());
        if (!training.supported()) {
            log.info(training.message());
            return;
        }
        if (hasModelPath) {
            PersistenceResult saved = strategy.save(Path.of(modelPath));
            if (!saved.isSuccess()) {
                log.warn("Failed to save model: {}", saved.getMessage());
            }
        }
    }

    private void logLeaderboard() {
        List<LeaderboardEntry> leaderboard = registry.leaderboard();
        if (leaderboard.isEmpty()) {
            return;
        }
        log.info(String.format("%-5s %-28s %-22s %-8s %-11s %-12s %-9s %-10s",
                "Rank", "Strategy", "Category", "Games", "Efficiency", "Consistency", "Max Tile", "Percentile"));
        for (LeaderboardEntry entry : leaderboard) {
            log.info(String.format("%-5d %-28s %-22s %-8d %-11.3f %-12.3f %-9d %-9.1f%%",
                    entry.rank(),
                    entry.strategyId(),
                    entry.category(),
                    entry.gamesPlayed(),
                    entry.averageEfficiency(),
                    entry.consistency(),
                    entry.highestTile(),
                    entry.percentile()));
        }
    }

    private void logReport(String strategyId) {
        registry.report(strategyId).ifPresent(report -> {
            log.info(String.format("%s over %d games: efficiency %.3f (best %.3f), trend %+.4f per game, recent vs earlier %+.3f",
                    report.strategyId(),
                    report.gamesAnalysed(),
                    report.averageEfficiency(),
                    report.bestEfficiency(),
                    report.efficiencyTrend(),
                    report.recentVsHistorical()));
            for (String advice : report.recommendations()) {
                log.info("  - {}", advice);
            }
        });
    }

    public static final class GameResult {
        private final int score;
        private final int moves;
        private final int highestTile;
        private final long durationNanos;
        private final boolean stalled;
        private final boolean gameOver;

        public GameResult(int score, int moves, int highestTile, long durationNanos, boolean stalled,
                          boolean gameOver) {
            this.score = score;
            this.moves = moves;
            this.highestTile = highestTile;
            this.durationNanos = durationNanos;
            this.stalled = stalled;
            this.gameOver = gameOver;
        }

        public int getScore() {
            return score;
        }

        public int getMoves() {
            return moves;
        }

        public int getHighestTile() {
            return highestTile;
        }

        public long getDurationNanos() {
            return durationNanos;
        }

        public boolean isStalled() {
            return stalled;
        }

        /**
         * True if the game ended because no move was left, rather than a limit.
         */
        public boolean isGameOver() {
            return gameOver;
        }

        public double getEfficiency() {
            return moves == 0 ? 0.0 : (double) score / moves;
        }

        public GameSummary toSummary() {
            return new GameSummary(score, moves, highestTile);
        }
    }
}
