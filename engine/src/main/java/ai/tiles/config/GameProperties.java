package ai.tiles.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for headless play.
 *
 * Usage:
 * {@code mvn -pl engine spring-boot:run -Dspring-boot.run.arguments="--game.strategy=Q-Learning_1.0 --game.games=20"}
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "game")
public class GameProperties {
  /** Registry id of the strategy to play with. */
  private String strategy = "Enhanced Heuristic_2.1";

  /** Number of games to play. */
  private int games = 1;

  /** Base seed for tile spawning; game {@code i} uses {@code seed + i}. Null for a time-based seed. */
  private Long seed;

  /** Hard cap on moves per game. */
  private int maxMoves = 10_000;

  /** Consecutive moves that change nothing before the game is abandoned. */
  private int stallLimit = 50;

  /** Where to write the leaderboard export; blank disables the export. */
  private String exportPath = "";

  public String getStrategy() {
    return strategy;
  }

  public void setStrategy(String strategy) {
    this.strategy = strategy;
  }

  public int getGames() {
    return games;
  }

  public void setGames(int games) {
    this.games = games;
  }

  public Long getSeed() {
    return seed;
  }

  public void setSeed(Long seed) {
    this.seed = seed;
  }

  public int getMaxMoves() {
    return maxMoves;
  }

  public void setMaxMoves(int maxMoves) {
    this.maxMoves = maxMoves;
  }

  public int getStallLimit() {
    return stallLimit;
  }

  public void setStallLimit(int stallLimit) {
    this.stallLimit = stallLimit;
  }

  public String getExportPath() {
    return exportPath;
  }

  public void setExportPath(String exportPath) {
    this.exportPath = exportPath;
  }
}
