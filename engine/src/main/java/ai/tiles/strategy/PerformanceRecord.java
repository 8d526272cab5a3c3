package ai.tiles.strategy;

/**
 * Cumulative statistics for one strategy instance.
 * <p>
 * Owned by the strategy that produced it and updated after every completed game. Not
 * thread-safe: the game loop is the single writer.
 */
public class PerformanceRecord {
    private int gamesPlayed;
    private long totalScore;
    private long totalMoves;
    private int highestTile;

    /**
     * Folds one completed game into the totals.
     */
    public void update(GameSummary game) {
        gamesPlayed++;
        totalScore += game.finalScore();
        totalMoves += game.movesCompleted();
        highestTile = Math.max(highestTile, game.highestTile());
    }

    public void reset() {
        gamesPlayed = 0;
        totalScore = 0;
        totalMoves = 0;
        highestTile = 0;
    }

    public int getGamesPlayed() {
        return gamesPlayed;
    }

    public long getTotalScore() {
        return totalScore;
    }

    public long getTotalMoves() {
        return totalMoves;
    }

    public int getHighestTile() {
        return highestTile;
    }

    /**
     * Total score divided by total moves across all games, or 0 before any move.
     */
    public double getAverageEfficiency() {
        return totalMoves == 0 ? 0.0 : (double) totalScore / totalMoves;
    }

    @Override
    public String toString() {
        return String.format("PerformanceRecord(games=%d, score=%d, moves=%d, highestTile=%d, efficiency=%.3f)",
                gamesPlayed, totalScore, totalMoves, highestTile, getAverageEfficiency());
    }
}
