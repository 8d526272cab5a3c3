package ai.tiles.heuristic;

/**
 * One feature's contribution to a heuristic score.
 *
 * @param rawValue      feature value before weighting
 * @param weight        weight applied
 * @param weightedScore {@code rawValue * weight}
 */
public record FeatureScore(double rawValue, double weight, double weightedScore) {

    static FeatureScore of(double rawValue, double weight) {
        return new FeatureScore(rawValue, weight, rawValue * weight);
    }
}
