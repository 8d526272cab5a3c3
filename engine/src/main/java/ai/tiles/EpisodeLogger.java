package ai.tiles;

import ai.tiles.game.Board;
import ai.tiles.game.Move;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Responsible for emitting structured JSON logs for episode data.
 *
 * <p>Each record is a single line prefixed with {@code EPISODE_STEP} or {@code EPISODE_SUMMARY}
 * so downstream tools can filter it out of mixed logs easily.</p>
 */
public class EpisodeLogger {
    private static final Logger log = LoggerFactory.getLogger(EpisodeLogger.class);
    private static final boolean ENABLED = Boolean.getBoolean("log.episodes");

    private EpisodeLogger() {
    }

    /**
     * Return true if episode logging is enabled via -Dlog.episodes=true.
     */
    public static boolean isEnabled() {
        return ENABLED;
    }

    /**
     * Emit one line describing the board BEFORE a move, the legal moves available, the chosen
     * move and what it produced.
     *
     * <p>Move quality signals computed from the before/after boards:
     * <ul>
     *   <li><strong>moved:</strong> the move changed the board.</li>
     *   <li><strong>score_delta:</strong> merge score gained by the move.</li>
     *   <li><strong>new_max_tile:</strong> the move created a larger tile than any before it.</li>
     *   <li><strong>empty_delta:</strong> change in empty cells, measured after the spawn.</li>
     * </ul>
     */
    public static void logStep(
            Board before,
            Board after,
            String strategyId,
            int stepIndex,
            List<Move> legalMoves,
            Move chosen,
            boolean moved,
            int scoreDelta) {

        try {
            String gameIndex = System.getProperty("game.index");

            StringBuilder sb = new StringBuilder();
            sb.append("{\"type\":\"step\"");
            if (gameIndex != null) {
                sb.append(",\"game_index\":").append(gameIndex);
            }
            sb.append(",\"strategy\":");
            appendString(sb, strategyId);
            sb.append(",\"step_index\":").append(stepIndex);
            sb.append(",\"chosen_move\":\"").append(chosen).append('"');

            sb.append(",\"board\":[");
            int[] cells = before.toArray();
            for (int i = 0; i < cells.length; i++) {
                if (i > 0) {
                    sb.append(',');
                }
                sb.append(cells[i]);
            }
            sb.append(']');

            sb.append(",\"legal_moves\":[");
            for (int i = 0; i < legalMoves.size(); i++) {
                if (i > 0) {
                    sb.append(',');
                }
                sb.append('"').append(legalMoves.get(i)).append('"');
            }
            sb.append(']');

            sb.append(",\"moved\":").append(moved);
            sb.append(",\"score_delta\":").append(scoreDelta);
            sb.append(",\"new_max_tile\":").append(after.maxTile() > before.maxTile());
            sb.append(",\"empty_delta\":").append(after.emptyCount() - before.emptyCount());
            sb.append('}');

            if (log.isInfoEnabled()) {
                log.info("EPISODE_STEP {}", sb);
            }
        } catch (Exception e) {
            // Logging must never interfere with gameplay.
            if (log.isDebugEnabled()) {
                log.debug("Failed to log episode step", e);
            }
        }
    }

    /**
     * Emit a single structured JSON line summarising the whole game.
     */
    public static void logSummary(
            String strategyId,
            int moves,
            int score,
            int highestTile,
            boolean stalled,
            long durationNanos) {

        try {
            String gameIndex = System.getProperty("game.index");

            StringBuilder sb = new StringBuilder();
            sb.append("{\"type\":\"summary\"");
            if (gameIndex != null) {
                sb.append(",\"game_index\":").append(gameIndex);
            }
            sb.append(",\"strategy\":");
            appendString(sb, strategyId);
            sb.append(",\"moves\":").append(moves);
            sb.append(",\"score\":").append(score);
            sb.append(",\"highest_tile\":").append(highestTile);
            sb.append(",\"stalled\":").append(stalled);
            sb.append(",\"duration_nanos\":").append(durationNanos);
            sb.append('}');

            if (log.isInfoEnabled()) {
                log.info("EPISODE_SUMMARY {}", sb);
            }
        } catch (Exception e) {
            if (log.isDebugEnabled()) {
                log.debug("Failed to log episode summary", e);
            }
        }
    }

    /**
     * Appends {@code value} as a JSON string literal, escaping quotes, backslashes and control
     * characters.
     */
    private static void appendString(StringBuilder sb, String value) {
        if (value == null) {
            sb.append("null");
            return;
        }
        sb.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"':
                    sb.append("\\\"");
                    break;
                case '\\':
                    sb.append("\\\\");
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                case '\r':
                    sb.append("\\r");
                    break;
                case '\t':
                    sb.append("\\t");
                    break;
                default:
                    if (c < 0x20) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
            }
        }
        sb.append('"');
    }
}
