package ai.tiles.registry;

import ai.tiles.strategy.GameSummary;
import ai.tiles.strategy.Strategy;
import ai.tiles.strategy.StrategyCategory;
import ai.tiles.strategy.StrategyMetadata;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.ConcurrentModificationException;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Catalogue of available strategies plus their recorded game history.
 * <p>
 * Strategies are registered explicitly through a {@link StrategyFactory}; there is no
 * classpath scanning and no global instance. The identifier of each entry is
 * {@link StrategyMetadata#id()} of a default-configured instance.
 * <p>
 * <strong>History:</strong> {@link #recordPerformance(String, GameSummary)} keeps the most recent
 * {@value #HISTORY_LIMIT} games per strategy; the total game count is kept separately and is not
 * capped.
 * <p>
 * <strong>Threading:</strong> the registry has a single-writer contract. Any call that overlaps
 * with a mutation in progress fails fast with {@link ConcurrentModificationException} instead of
 * interleaving.
 */
public class StrategyRegistry {
    private static final Logger log = LoggerFactory.getLogger(StrategyRegistry.class);

    /** Retained games per strategy. */
    public static final int HISTORY_LIMIT = 100;

    /** Keyed by id; iteration order is registration order. */
    private final Map<String, Registration> registrations = new LinkedHashMap<>();
    private final AtomicInteger writers = new AtomicInteger();

    /**
     * Registers a factory unless its id is already taken.
     *
     * @return true if registered, false if the id was a duplicate
     */
    public boolean register(StrategyFactory factory) {
        return register(factory, false);
    }

    /**
     * Registers a factory. With {@code override}, an existing entry with the same id has its
     * factory and metadata replaced while keeping its position and recorded history.
     *
     * @return true if the factory is now registered under its id
     * @throws IllegalArgumentException if the factory cannot build a default instance
     */
    public boolean register(StrategyFactory factory, boolean override) {
        Objects.requireNonNull(factory, "factory");
        return write(() -> {
            Strategy prototype = factory.create(Collections.emptyMap());
            if (prototype == null) {
                throw new IllegalArgumentException("Factory returned no strategy");
            }
            StrategyMetadata metadata = prototype.metadata();
            String id = metadata.id();
            Registration existing = registrations.get(id);
            if (existing != null) {
                if (!override) {
                    log.warn("Strategy {} is already registered; ignoring duplicate registration", id);
                    return false;
                }
                existing.factory = factory;
                existing.metadata = metadata;
                log.info("Replaced strategy {}", id);
                return true;
            }
            registrations.put(id, new Registration(factory, metadata));
            log.info("Registered strategy {} ({})", id, metadata.category());
            return true;
        });
    }

    /**
     * Creates a default-configured instance of {@code id}.
     */
    public Optional<Strategy> create(String id) {
        return create(id, Collections.emptyMap());
    }

    /**
     * Creates a new instance of {@code id} with the given configuration.
     *
     * @return the instance, or empty if no strategy is registered under {@code id}
     * @throws IllegalArgumentException if the configuration is rejected by the strategy
     */
    public Optional<Strategy> create(String id, Map<String, Object> config) {
        StrategyFactory factory = read(() -> {
            Registration registration = registrations.get(id);
            return registration == null ? null : registration.factory;
        });
        if (factory == null) {
            log.warn("Strategy {} not found; available: {}", id, ids());
            return Optional.empty();
        }
        Strategy strategy = factory.create(config == null ? Collections.emptyMap() : config);
        if (log.isDebugEnabled()) {
            log.debug("Created {} with config {}", id, config);
        }
        return Optional.of(strategy);
    }

    public boolean isRegistered(String id) {
        return read(() -> registrations.containsKey(id));
    }

    /**
     * Registered ids in registration order.
     */
    public List<String> ids() {
        return read(() -> List.copyOf(registrations.keySet()));
    }

    /**
     * Metadata of every registered strategy, in registration order.
     */
    public List<StrategyMetadata> listStrategies() {
        return read(() -> {
            List<StrategyMetadata> result = new ArrayList<>(registrations.size());
            for (Registration registration : registrations.values()) {
                result.add(registration.metadata);
            }
            return result;
        });
    }

    public List<StrategyMetadata> listStrategies(StrategyCategory category) {
        return read(() -> {
            List<StrategyMetadata> result = new ArrayList<>();
            for (Registration registration : registrations.values()) {
                if (registration.metadata.category() == category) {
                    result.add(registration.metadata);
                }
            }
            return result;
        });
    }

    public Optional<StrategyMetadata> metadata(String id) {
        return read(() -> {
            Registration registration = registrations.get(id);
            return Optional.ofNullable(registration == null ? null : registration.metadata);
        });
    }

    /**
     * Appends a completed game to the history of {@code id}, evicting the oldest entry beyond
     * {@value #HISTORY_LIMIT}.
     *
     * @return false if {@code id} is not registered
     */
    public boolean recordPerformance(String id, GameSummary game) {
        Objects.requireNonNull(game, "game");
        return write(() -> {
            Registration registration = registrations.get(id);
            if (registration == null) {
                log.warn("Cannot record performance for unknown strategy {}", id);
                return false;
            }
            registration.append(game);
            return true;
        });
    }

    /**
     * Retained games of {@code id}, oldest first; empty for unknown ids.
     */
    public List<GameSummary> history(String id) {
        return read(() -> {
            Registration registration = registrations.get(id);
            return registration == null ? List.<GameSummary>of() : List.copyOf(registration.history);
        });
    }

    /**
     * Total games recorded for {@code id}, including evicted ones.
     */
    public int gamesPlayed(String id) {
        return read(() -> {
            Registration registration = registrations.get(id);
            return registration == null ? 0 : registration.gamesPlayed;
        });
    }

    /**
     * Replaces the history of {@code id}. Used when importing an export; only the last
     * {@value #HISTORY_LIMIT} games are kept.
     *
     * @return false if {@code id} is not registered
     */
    public boolean restoreHistory(String id, List<GameSummary> games, int gamesPlayed) {
        return write(() -> {
            Registration registration = registrations.get(id);
            if (registration == null) {
                return false;
            }
            registration.history.clear();
            registration.gamesPlayed = 0;
            for (GameSummary game : games) {
                registration.append(game);
            }
            registration.gamesPlayed = Math.max(gamesPlayed, registration.gamesPlayed);
            return true;
        });
    }

    /**
     * Ranks the given strategies. Unknown ids and strategies without history are left out.
     */
    public List<LeaderboardEntry> rank(Collection<String> ids) {
        return LeaderboardRanker.rank(candidates(ids));
    }

    /**
     * Ranks every strategy with recorded history.
     */
    public List<LeaderboardEntry> leaderboard() {
        return rank(ids());
    }

    /**
     * Single-metric leaderboard over every strategy with history, best first, at most
     * {@code limit} rows.
     *
     * @throws IllegalArgumentException if {@code limit} is negative
     */
    public List<MetricRanking> leaderboard(RankingMetric metric, int limit) {
        Objects.requireNonNull(metric, "metric");
        return LeaderboardRanker.rankBy(leaderboard(), metric, limit);
    }

    /**
     * Compares the given strategies. Unknown ids and strategies without history are left out.
     */
    public StrategyComparison compare(Collection<String> ids) {
        return LeaderboardRanker.compare(candidates(ids));
    }

    /**
     * Trend report for {@code id}; empty when the id is unknown or has no recorded games.
     */
    public Optional<PerformanceReport> report(String id) {
        LeaderboardRanker.Candidate candidate = read(() -> {
            Registration registration = registrations.get(id);
            return registration == null ? null : registration.candidate(id);
        });
        if (candidate == null || candidate.history().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(LeaderboardRanker.report(candidate));
    }

    public int size() {
        return read(registrations::size);
    }

    private List<LeaderboardRanker.Candidate> candidates(Collection<String> ids) {
        return read(() -> {
            List<LeaderboardRanker.Candidate> result = new ArrayList<>();
            for (Map.Entry<String, Registration> entry : registrations.entrySet()) {
                if (ids.contains(entry.getKey())) {
                    result.add(entry.getValue().candidate(entry.getKey()));
                }
            }
            return result;
        });
    }

    private <T> T write(Supplier<T> action) {
        if (writers.incrementAndGet() != 1) {
            writers.decrementAndGet();
            throw new ConcurrentModificationException("StrategyRegistry is being modified by another thread");
        }
        try {
            return action.get();
        } finally {
            writers.decrementAndGet();
        }
    }

    private <T> T read(Supplier<T> action) {
        if (writers.get() != 0) {
            throw new ConcurrentModificationException("StrategyRegistry is being modified by another thread");
        }
        return action.get();
    }

    private static final class Registration {
        private StrategyFactory factory;
        private StrategyMetadata metadata;
        private final Deque<GameSummary> history = new ArrayDeque<>();
        private int gamesPlayed;

        private Registration(StrategyFactory factory, StrategyMetadata metadata) {
            this.factory = factory;
            this.metadata = metadata;
        }

        private void append(GameSummary game) {
            history.addLast(game);
            while (history.size() > HISTORY_LIMIT) {
                history.removeFirst();
            }
            gamesPlayed++;
        }

        private LeaderboardRanker.Candidate candidate(String id) {
            return new LeaderboardRanker.Candidate(id, metadata.name(), metadata.category(), gamesPlayed,
                    new ArrayList<>(history));
        }
    }
}
