package ai.tiles.game;

import java.util.Arrays;
import java.util.Optional;

/**
 * The four directions a board can be shifted in.
 * <p>
 * Declaration order (UP, DOWN, LEFT, RIGHT) is the canonical order for per-move score
 * vectors and Q-table action indices.
 */
public enum Move {
    UP,
    DOWN,
    LEFT,
    RIGHT;

    /**
     * Parse a move name case-insensitively (e.g. "up", "Left").
     */
    public static Optional<Move> parse(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String trimmed = name.trim();
        return Arrays.stream(values())
                .filter(move -> move.name().equalsIgnoreCase(trimmed))
                .findFirst();
    }
}
