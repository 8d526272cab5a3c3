package ai.tiles.strategy.ai.rl;

import ai.tiles.game.Move;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * State-key to action-value table for tabular Q-learning.
 * <p>
 * Reads of an unknown state return all-zero values without inserting the state, so a freshly
 * loaded table behaves exactly like one whose missing states were never visited. Writes insert
 * on demand; the table only grows.
 */
public class QTable {
    private static final int ACTIONS = Move.values().length;

    private final Map<String, double[]> values = new HashMap<>();

    /**
     * Copy of the action values for {@code stateKey}, in {@link Move} order.
     */
    public double[] get(String stateKey) {
        double[] stored = values.get(stateKey);
        return stored == null ? new double[ACTIONS] : stored.clone();
    }

    public double get(String stateKey, Move move) {
        double[] stored = values.get(stateKey);
        return stored == null ? 0.0 : stored[move.ordinal()];
    }

    public void set(String stateKey, Move move, double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Q-value must be finite but was " + value + " for " + stateKey);
        }
        values.computeIfAbsent(stateKey, key -> new double[ACTIONS])[move.ordinal()] = value;
    }

    /**
     * Replaces all four values for a state.
     */
    public void put(String stateKey, double[] actionValues) {
        if (actionValues.length != ACTIONS) {
            throw new IllegalArgumentException("Expected " + ACTIONS + " action values but got " + actionValues.length);
        }
        for (double value : actionValues) {
            if (!Double.isFinite(value)) {
                throw new IllegalArgumentException("Q-value must be finite but was " + value + " for " + stateKey);
            }
        }
        values.put(stateKey, actionValues.clone());
    }

    /**
     * Largest action value for {@code stateKey}; 0 for unknown states.
     */
    public double max(String stateKey) {
        double[] stored = values.get(stateKey);
        if (stored == null) {
            return 0.0;
        }
        double max = stored[0];
        for (int i = 1; i < stored.length; i++) {
            max = Math.max(max, stored[i]);
        }
        return max;
    }

    public boolean contains(String stateKey) {
        return values.containsKey(stateKey);
    }

    public int size() {
        return values.size();
    }

    public void clear() {
        values.clear();
    }

    /**
     * Read-only snapshot view used for persistence.
     */
    Map<String, double[]> asMap() {
        return Collections.unmodifiableMap(values);
    }
}
