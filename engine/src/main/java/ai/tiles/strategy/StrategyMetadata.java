package ai.tiles.strategy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Identity and descriptive record for a strategy. Immutable; the parameter map is copied on
 * construction.
 *
 * @param name                display name, part of the registry identifier
 * @param version             version string, part of the registry identifier
 * @param author              author or team
 * @param description         free-text description
 * @param category            strategy family
 * @param parameters          effective configuration parameters of the instance
 * @param performanceBaseline expected points-per-move, or {@code null} if unknown
 * @param trainingRequired    whether the strategy must be trained before it plays well
 */
public record StrategyMetadata(
        String name,
        String version,
        String author,
        String description,
        StrategyCategory category,
        Map<String, Object> parameters,
        Double performanceBaseline,
        boolean trainingRequired) {

    public StrategyMetadata {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(category, "category");
        author = author == null ? "" : author;
        description = description == null ? "" : description;
        parameters = parameters == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    /**
     * Stable registry identifier: {@code name + "_" + version}, e.g. {@code "Enhanced Heuristic_2.1"}.
     */
    public String id() {
        return name + "_" + version;
    }

    public OptionalDouble baseline() {
        return performanceBaseline == null ? OptionalDouble.empty() : OptionalDouble.of(performanceBaseline);
    }
}
