package ai.tiles.config;

import ai.tiles.registry.PerformanceExporter;
import ai.tiles.registry.StrategyRegistry;
import ai.tiles.strategy.ai.FixedPriorityStrategy;
import ai.tiles.strategy.ai.HeuristicStrategy;
import ai.tiles.strategy.ai.RandomStrategy;
import ai.tiles.strategy.ai.rl.QLearningStrategy;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the strategy catalogue. Every available strategy is listed here explicitly; property
 * values become the defaults, and per-call configuration passed to
 * {@link StrategyRegistry#create(String, Map)} overrides them.
 */
@Configuration
public class StrategyConfiguration {

  @Bean
  public StrategyRegistry strategyRegistry(HeuristicWeightsProperties weights, TrainingProperties training) {
    return createRegistry(weights, training);
  }

  @Bean
  public PerformanceExporter performanceExporter(StrategyRegistry registry) {
    return new PerformanceExporter(registry);
  }

  /**
   * Registry with the built-in strategies, usable without a Spring context.
   */
  public static StrategyRegistry createRegistry(HeuristicWeightsProperties weights, TrainingProperties training) {
    StrategyRegistry registry = new StrategyRegistry();
    registry.register(FixedPriorityStrategy::new);
    registry.register(RandomStrategy::new);
    registry.register(config -> new HeuristicStrategy(
        withDefaults(Map.<String, Object>of(HeuristicStrategy.PARAM_WEIGHTS, weights.toWeights().toMap()), config)));
    registry.register(config -> new QLearningStrategy(withDefaults(training.toStrategyConfig(), config)));
    return registry;
  }

  private static Map<String, Object> withDefaults(Map<String, Object> defaults, Map<String, Object> overrides) {
    Map<String, Object> merged = new LinkedHashMap<>(defaults);
    if (overrides != null) {
      merged.putAll(overrides);
    }
    return merged;
  }
}
