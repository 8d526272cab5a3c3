package ai.tiles.heuristic;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Weight set for {@link HeuristicEvaluator}.
 * <p>
 * The defaults (empty=150, merge=100, corner=250, monotonicity=75, max tile=15) are empirically
 * tuned starting points, not derived optima. They are supplied through configuration
 * ({@code heuristic.weights.*}) and can be overridden per strategy instance.
 *
 * @param emptyTiles     weight per empty cell
 * @param mergePotential weight per adjacent equal pair
 * @param cornerBonus    weight applied when the largest tile sits in a corner
 * @param monotonicity   weight per monotonic row or column
 * @param maxTileValue   weight per unit of the largest tile's value
 */
public record HeuristicWeights(
        double emptyTiles,
        double mergePotential,
        double cornerBonus,
        double monotonicity,
        double maxTileValue) {

    public static final String EMPTY_TILES = "empty_tiles";
    public static final String MERGE_POTENTIAL = "merge_potential";
    public static final String CORNER_BONUS = "corner_bonus";
    public static final String MONOTONICITY = "monotonicity";
    public static final String MAX_TILE_VALUE = "max_tile_value";

    private static final HeuristicWeights DEFAULTS = new HeuristicWeights(150.0, 100.0, 250.0, 75.0, 15.0);

    public HeuristicWeights {
        requireUsable(EMPTY_TILES, emptyTiles);
        requireUsable(MERGE_POTENTIAL, mergePotential);
        requireUsable(CORNER_BONUS, cornerBonus);
        requireUsable(MONOTONICITY, monotonicity);
        requireUsable(MAX_TILE_VALUE, maxTileValue);
    }

    public static HeuristicWeights defaults() {
        return DEFAULTS;
    }

    /**
     * Builds a weight set from a keyed map. All five keys are required. Values may be numbers or
     * numeric strings, as they arrive from bound configuration.
     *
     * @throws InvalidWeightsException if a key is missing or a value is not a number, negative or not finite
     */
    public static HeuristicWeights fromMap(Map<?, ?> weights) {
        if (weights == null) {
            throw new InvalidWeightsException("Weights must not be null");
        }
        return new HeuristicWeights(
                require(weights, EMPTY_TILES),
                require(weights, MERGE_POTENTIAL),
                require(weights, CORNER_BONUS),
                require(weights, MONOTONICITY),
                require(weights, MAX_TILE_VALUE));
    }

    /**
     * Returns a copy with the given keys replaced; keys not present keep their current value.
     *
     * @throws InvalidWeightsException if an unknown key is supplied
     */
    public HeuristicWeights merge(Map<String, ? extends Number> overrides) {
        Map<String, Number> combined = new LinkedHashMap<>(toMap());
        for (Map.Entry<String, ? extends Number> entry : overrides.entrySet()) {
            if (!combined.containsKey(entry.getKey())) {
                throw new InvalidWeightsException("Unknown heuristic weight '" + entry.getKey() + "'");
            }
            combined.put(entry.getKey(), entry.getValue());
        }
        return fromMap(combined);
    }

    /**
     * Multiplies every weight by {@code factor}.
     */
    public HeuristicWeights scaled(double factor) {
        return new HeuristicWeights(
                emptyTiles * factor,
                mergePotential * factor,
                cornerBonus * factor,
                monotonicity * factor,
                maxTileValue * factor);
    }

    public Map<String, Double> toMap() {
        Map<String, Double> map = new LinkedHashMap<>();
        map.put(EMPTY_TILES, emptyTiles);
        map.put(MERGE_POTENTIAL, mergePotential);
        map.put(CORNER_BONUS, cornerBonus);
        map.put(MONOTONICITY, monotonicity);
        map.put(MAX_TILE_VALUE, maxTileValue);
        return map;
    }

    private static double require(Map<?, ?> weights, String key) {
        Object value = weights.get(key);
        if (value == null) {
            throw new InvalidWeightsException("Missing required heuristic weight '" + key + "'");
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String) {
            try {
                return Double.parseDouble(((String) value).trim());
            } catch (NumberFormatException e) {
                throw new InvalidWeightsException("Heuristic weight '" + key + "' is not a number: " + value);
            }
        }
        throw new InvalidWeightsException("Heuristic weight '" + key + "' is not a number: " + value);
    }

    private static void requireUsable(String key, double value) {
        if (!Double.isFinite(value) || value < 0.0) {
            throw new InvalidWeightsException("Heuristic weight '" + key + "' must be finite and >= 0 but was " + value);
        }
    }
}
