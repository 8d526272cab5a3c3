package ai.tiles.game;

/**
 * Renders a {@link Board} as a bordered, fixed-width text grid for console output and logs.
 * <p>
 * Empty cells are shown as {@code .}; tiles are right-aligned in a cell wide enough for the
 * largest value on the board (minimum four characters), e.g.
 * <pre>
 * +------+------+------+------+
 * |    2 |    . |    . |    . |
 * ...
 * </pre>
 */
public final class BoardFormatter {
    private static final int MIN_CELL_WIDTH = 4;

    private BoardFormatter() {
    }

    /**
     * Formats the board as a multi-line string.
     */
    public static String format(Board board) {
        int width = Math.max(MIN_CELL_WIDTH, String.valueOf(board.maxTile()).length());
        String border = buildBorder(width);
        StringBuilder sb = new StringBuilder();
        sb.append(border).append('\n');
        for (int row = 0; row < Board.SIZE; row++) {
            sb.append('|');
            for (int col = 0; col < Board.SIZE; col++) {
                int value = board.get(row, col);
                String text = value == 0 ? "." : String.valueOf(value);
                sb.append(' ').append(" ".repeat(width - text.length())).append(text).append(" |");
            }
            sb.append('\n').append(border).append('\n');
        }
        return sb.toString();
    }

    private static String buildBorder(int width) {
        StringBuilder sb = new StringBuilder("+");
        for (int col = 0; col < Board.SIZE; col++) {
            sb.append("-".repeat(width + 2)).append('+');
        }
        return sb.toString();
    }
}
