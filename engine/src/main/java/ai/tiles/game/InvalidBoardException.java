package ai.tiles.game;

/**
 * Thrown when a grid handed to the engine is not a valid 2048 board: wrong dimensions,
 * negative values, or non-zero values that are not a power of two.
 */
public class InvalidBoardException extends IllegalArgumentException {

    public InvalidBoardException(String message) {
        super(message);
    }
}
