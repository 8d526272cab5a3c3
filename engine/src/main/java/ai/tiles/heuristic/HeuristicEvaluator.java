package ai.tiles.heuristic;

import ai.tiles.game.Board;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Scores a board as a weighted sum of {@link BoardFeatures}. Higher is better.
 * <p>
 * Scoring is pure: the same board and weights always produce the same value, and the evaluator
 * keeps no state besides its default weight set. Raw grids are validated before scoring, so a
 * malformed observation surfaces as an {@link ai.tiles.game.InvalidBoardException} instead of a
 * sentinel score.
 */
public class HeuristicEvaluator {

    private final HeuristicWeights weights;

    public HeuristicEvaluator() {
        this(HeuristicWeights.defaults());
    }

    public HeuristicEvaluator(HeuristicWeights weights) {
        this.weights = Objects.requireNonNull(weights, "weights");
    }

    public HeuristicWeights getWeights() {
        return weights;
    }

    /**
     * Scores {@code board} with this evaluator's weights.
     */
    public double score(Board board) {
        return score(board, weights);
    }

    /**
     * Validates {@code grid} and scores it with the given weights.
     *
     * @throws ai.tiles.game.InvalidBoardException if the grid is not a valid board
     */
    public static double score(int[][] grid, HeuristicWeights weights) {
        return score(Board.of(grid), weights);
    }

    /**
     * Weighted sum of the five features for {@code board}.
     */
    public static double score(Board board, HeuristicWeights weights) {
        Objects.requireNonNull(board, "board");
        Objects.requireNonNull(weights, "weights");
        double score = 0.0;
        score += BoardFeatures.emptyTiles(board) * weights.emptyTiles();
        score += BoardFeatures.mergePotential(board) * weights.mergePotential();
        score += BoardFeatures.cornerBonus(board) * weights.cornerBonus();
        score += BoardFeatures.monotonicity(board) * weights.monotonicity();
        score += BoardFeatures.maxTileValue(board) * weights.maxTileValue();
        return score;
    }

    /**
     * Per-feature breakdown for {@code board}, keyed by the weight names in
     * {@link HeuristicWeights}. The weighted scores sum to {@link #score(Board)}.
     */
    public Map<String, FeatureScore> explain(Board board) {
        Map<String, FeatureScore> breakdown = new LinkedHashMap<>();
        breakdown.put(HeuristicWeights.EMPTY_TILES,
                FeatureScore.of(BoardFeatures.emptyTiles(board), weights.emptyTiles()));
        breakdown.put(HeuristicWeights.MERGE_POTENTIAL,
                FeatureScore.of(BoardFeatures.mergePotential(board), weights.mergePotential()));
        breakdown.put(HeuristicWeights.CORNER_BONUS,
                FeatureScore.of(BoardFeatures.cornerBonus(board), weights.cornerBonus()));
        breakdown.put(HeuristicWeights.MONOTONICITY,
                FeatureScore.of(BoardFeatures.monotonicity(board), weights.monotonicity()));
        breakdown.put(HeuristicWeights.MAX_TILE_VALUE,
                FeatureScore.of(BoardFeatures.maxTileValue(board), weights.maxTileValue()));
        return breakdown;
    }
}
