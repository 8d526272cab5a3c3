package ai.tiles.strategy;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Optional;

/**
 * Broad family a strategy belongs to. Used for registry listings and per-category ranks.
 */
public enum StrategyCategory {
    HEURISTIC("heuristic"),
    RULE_BASED("rule_based"),
    REINFORCEMENT_LEARNING("reinforcement_learning"),
    DEEP_LEARNING("deep_learning"),
    MINIMAX("minimax"),
    MONTE_CARLO("monte_carlo"),
    STUDENT_SUBMISSION("student_submission");

    private final String label;

    StrategyCategory(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public static Optional<StrategyCategory> byLabel(String label) {
        return Arrays.stream(values())
                .filter(category -> category.label.equalsIgnoreCase(label))
                .findFirst();
    }

    @Override
    public String toString() {
        return label;
    }
}
