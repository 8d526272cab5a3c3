package ai.tiles.strategy;

/**
 * Result of one completed game, as recorded on a strategy's {@link PerformanceRecord} and in the
 * registry's performance history.
 *
 * @param finalScore     total merge score at game end
 * @param movesCompleted number of moves that changed the board
 * @param highestTile    largest tile reached
 * @param timestampMillis wall-clock time the game finished
 */
public record GameSummary(int finalScore, int movesCompleted, int highestTile, long timestampMillis) {

    public GameSummary {
        if (finalScore < 0 || movesCompleted < 0 || highestTile < 0) {
            throw new IllegalArgumentException("Game summary values must be non-negative");
        }
    }

    public GameSummary(int finalScore, int movesCompleted, int highestTile) {
        this(finalScore, movesCompleted, highestTile, System.currentTimeMillis());
    }

    /**
     * Points per move, or 0 if no moves were made.
     */
    public double efficiency() {
        return movesCompleted == 0 ? 0.0 : (double) finalScore / movesCompleted;
    }
}
