package ai.tiles.config;

import ai.tiles.heuristic.HeuristicWeights;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for the heuristic evaluator weights.
 *
 * Usage:
 * {@code --heuristic.weights.corner-bonus=300 --heuristic.weights.monotonicity=90}
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "heuristic.weights")
public class HeuristicWeightsProperties {
  private double emptyTiles = HeuristicWeights.defaults().emptyTiles();
  private double mergePotential = HeuristicWeights.defaults().mergePotential();
  private double cornerBonus = HeuristicWeights.defaults().cornerBonus();
  private double monotonicity = HeuristicWeights.defaults().monotonicity();
  private double maxTileValue = HeuristicWeights.defaults().maxTileValue();

  /**
   * Validated weights built from the bound values.
   * @throws ai.tiles.heuristic.InvalidWeightsException if any weight is negative or not finite
   */
  public HeuristicWeights toWeights() {
    return new HeuristicWeights(emptyTiles, mergePotential, cornerBonus, monotonicity, maxTileValue);
  }

  public double getEmptyTiles() {
    return emptyTiles;
  }

  public void setEmptyTiles(double emptyTiles) {
    this.emptyTiles = emptyTiles;
  }

  public double getMergePotential() {
    return mergePotential;
  }

  public void setMergePotential(double mergePotential) {
    this.mergePotential = mergePotential;
  }

  public double getCornerBonus() {
    return cornerBonus;
  }

  public void setCornerBonus(double cornerBonus) {
    this.cornerBonus = cornerBonus;
  }

  public double getMonotonicity() {
    return monotonicity;
  }

  public void setMonotonicity(double monotonicity) {
    this.monotonicity = monotonicity;
  }

  public double getMaxTileValue() {
    return maxTileValue;
  }

  public void setMaxTileValue(double maxTileValue) {
    this.maxTileValue = maxTileValue;
  }
}
