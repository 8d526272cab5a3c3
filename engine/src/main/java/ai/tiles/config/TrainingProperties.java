package ai.tiles.config;

import ai.tiles.strategy.TrainingOptions;
import ai.tiles.strategy.ai.rl.QLearningStrategy;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for training the Q-learning strategy.
 *
 * When enabled, the selected strategy is trained before play and the learned table is written
 * to {@code training.model-path}. An existing model at that path is loaded first.
 *
 * Usage:
 * {@code --game.strategy=Q-Learning_1.0 --training.enabled=true --training.episodes=5000 --training.model-path=models/q.json}
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "training")
public class TrainingProperties {
  private boolean enabled = false;
  private int episodes = TrainingOptions.DEFAULT_EPISODES;
  private int maxStepsPerEpisode = TrainingOptions.DEFAULT_MAX_STEPS;
  private int progressInterval = TrainingOptions.DEFAULT_PROGRESS_INTERVAL;
  private Long seed;
  private double learningRate = QLearningStrategy.DEFAULT_LEARNING_RATE;
  private double discountFactor = QLearningStrategy.DEFAULT_DISCOUNT_FACTOR;
  private double epsilon = QLearningStrategy.DEFAULT_EPSILON;
  private double epsilonDecay = QLearningStrategy.DEFAULT_EPSILON_DECAY;
  private double minEpsilon = QLearningStrategy.DEFAULT_MIN_EPSILON;

  /** Where the Q-table is loaded from and saved to; blank disables persistence. */
  private String modelPath = "";

  /**
   * Learner hyperparameters as a strategy configuration map.
   */
  public Map<String, Object> toStrategyConfig() {
    Map<String, Object> config = new LinkedHashMap<>();
    config.put(QLearningStrategy.PARAM_LEARNING_RATE, learningRate);
    config.put(QLearningStrategy.PARAM_DISCOUNT_FACTOR, discountFactor);
    config.put(QLearningStrategy.PARAM_EPSILON, epsilon);
    config.put(QLearningStrategy.PARAM_EPSILON_DECAY, epsilonDecay);
    config.put(QLearningStrategy.PARAM_MIN_EPSILON, minEpsilon);
    return config;
  }

  public TrainingOptions toOptions() {
    return new TrainingOptions(episodes, maxStepsPerEpisode, seed, progressInterval);
  }

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public int getEpisodes() {
    return episodes;
  }

  public void setEpisodes(int episodes) {
    this.episodes = episodes;
  }

  public int getMaxStepsPerEpisode() {
    return maxStepsPerEpisode;
  }

  public void setMaxStepsPerEpisode(int maxStepsPerEpisode) {
    this.maxStepsPerEpisode = maxStepsPerEpisode;
  }

  public int getProgressInterval() {
    return progressInterval;
  }

  public void setProgressInterval(int progressInterval) {
    this.progressInterval = progressInterval;
  }

  public Long getSeed() {
    return seed;
  }

  public void setSeed(Long seed) {
    this.seed = seed;
  }

  public double getLearningRate() {
    return learningRate;
  }

  public void setLearningRate(double learningRate) {
    this.learningRate = learningRate;
  }

  public double getDiscountFactor() {
    return discountFactor;
  }

  public void setDiscountFactor(double discountFactor) {
    this.discountFactor = discountFactor;
  }

  public double getEpsilon() {
    return epsilon;
  }

  public void setEpsilon(double epsilon) {
    this.epsilon = epsilon;
  }

  public double getEpsilonDecay() {
    return epsilonDecay;
  }

  public void setEpsilonDecay(double epsilonDecay) {
    this.epsilonDecay = epsilonDecay;
  }

  public double getMinEpsilon() {
    return minEpsilon;
  }

  public void setMinEpsilon(double minEpsilon) {
    this.minEpsilon = minEpsilon;
  }

  public String getModelPath() {
    return modelPath;
  }

  public void setModelPath(String modelPath) {
    this.modelPath = modelPath;
  }
}
