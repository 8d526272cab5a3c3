package ai.tiles.registry;

import ai.tiles.strategy.Strategy;
import java.util.Map;

/**
 * Builds a fresh strategy instance from a configuration map. An empty map yields the default
 * configuration.
 *
 * @throws IllegalArgumentException from {@link #create(Map)} when the configuration is invalid
 */
@FunctionalInterface
public interface StrategyFactory {
    Strategy create(Map<String, Object> config);
}
