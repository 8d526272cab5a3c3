package ai.tiles.strategy;

import ai.tiles.game.Board;
import ai.tiles.game.BoardEngine;
import ai.tiles.game.Move;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base class for strategies with shared configuration handling and simulation helpers.
 */
public abstract class AbstractStrategy implements Strategy {

    /** Default tie-break order: UP, LEFT, DOWN, RIGHT. */
    public static final List<Move> DEFAULT_PRIORITY = List.of(Move.UP, Move.LEFT, Move.DOWN, Move.RIGHT);

    private final PerformanceRecord performance = new PerformanceRecord();
    private final Map<String, Object> config;

    protected AbstractStrategy(Map<String, Object> config) {
        this.config = new LinkedHashMap<>(config == null ? Collections.emptyMap() : config);
    }

    @Override
    public PerformanceRecord performance() {
        return performance;
    }

    /**
     * Effective configuration of this instance (constructor values plus later updates).
     */
    public Map<String, Object> getConfig() {
        return Collections.unmodifiableMap(config);
    }

    protected void putConfig(String key, Object value) {
        config.put(key, value);
    }

    protected boolean isMoveValid(Board board, Move move) {
        return BoardEngine.apply(board, move).moved();
    }

    /**
     * Reads a numeric configuration value, falling back to {@code defaultValue} when absent.
     *
     * @throws IllegalArgumentException if the value is present but not a number
     */
    protected static double doubleParam(Map<String, Object> config, String key, double defaultValue) {
        if (config == null || !config.containsKey(key)) {
            return defaultValue;
        }
        Object value = config.get(key);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String) {
            try {
                return Double.parseDouble(((String) value).trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Parameter '" + key + "' is not a number: " + value, e);
            }
        }
        throw new IllegalArgumentException("Parameter '" + key + "' is not a number: " + value);
    }

    /**
     * Reads a move order from configuration. Accepts a list of {@link Move} values or of move
     * names.
     *
     * @throws IllegalArgumentException if the order contains an unknown or duplicate move
     */
    protected static List<Move> moveOrderParam(Map<String, Object> config, String key, List<Move> defaultValue) {
        if (config == null || !config.containsKey(key)) {
            return defaultValue;
        }
        Object value = config.get(key);
        if (!(value instanceof List<?>)) {
            throw new IllegalArgumentException("Parameter '" + key + "' must be a list of moves but was " + value);
        }
        List<?> raw = (List<?>) value;
        Move[] parsed = new Move[raw.size()];
        for (int i = 0; i < raw.size(); i++) {
            Object element = raw.get(i);
            if (element instanceof Move) {
                parsed[i] = (Move) element;
            } else {
                parsed[i] = Move.parse(String.valueOf(element))
                        .orElseThrow(() -> new IllegalArgumentException("Invalid move in '" + key + "': " + element));
            }
        }
        return validateOrder(List.of(parsed));
    }

    protected static List<Move> validateOrder(List<Move> order) {
        if (order.isEmpty()) {
            throw new IllegalArgumentException("Move order must not be empty");
        }
        if (order.stream().distinct().count() != order.size()) {
            throw new IllegalArgumentException("Move order contains duplicates: " + order);
        }
        return List.copyOf(order);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + metadata().id() + ")";
    }
}
