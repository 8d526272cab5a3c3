package ai.tiles.heuristic;

/**
 * Thrown when a heuristic weight set is incomplete or contains unusable values.
 */
public class InvalidWeightsException extends IllegalArgumentException {

    public InvalidWeightsException(String message) {
        super(message);
    }
}
