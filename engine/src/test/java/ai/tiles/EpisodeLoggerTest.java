package ai.tiles;

import static org.junit.jupiter.api.Assertions.*;

import ai.tiles.game.Board;
import ai.tiles.game.BoardEngine;
import ai.tiles.game.Move;
import ai.tiles.unit.helpers.BoardFactory;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class EpisodeLoggerTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Logger logger = (Logger) LoggerFactory.getLogger(EpisodeLogger.class);
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();

    @BeforeEach
    void attach() {
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void detach() {
        logger.detachAppender(appender);
        System.clearProperty("game.index");
    }

    private JsonNode lastRecord(String prefix) throws Exception {
        String message = appender.list.get(appender.list.size() - 1).getFormattedMessage();
        assertTrue(message.startsWith(prefix + " "), message);
        return MAPPER.readTree(message.substring(prefix.length() + 1));
    }

    @Test
    void stepRecordIsSingleLineJson() throws Exception {
        System.setProperty("game.index", "3");
        Board before = BoardFactory.topPair();
        Board after = BoardEngine.apply(before, Move.LEFT).board();

        EpisodeLogger.logStep(before, after, "Enhanced Heuristic_2.1", 7, BoardEngine.legalMoves(before),
                Move.LEFT, true, 4);

        JsonNode step = lastRecord("EPISODE_STEP");
        assertEquals("step", step.get("type").asText());
        assertEquals(3, step.get("game_index").asInt());
        assertEquals("Enhanced Heuristic_2.1", step.get("strategy").asText());
        assertEquals(7, step.get("step_index").asInt());
        assertEquals("LEFT", step.get("chosen_move").asText());
        assertEquals(16, step.get("board").size());
        assertEquals(2, step.get("board").get(0).asInt());
        assertEquals(3, step.get("legal_moves").size());
        assertTrue(step.get("moved").asBoolean());
        assertEquals(4, step.get("score_delta").asInt());
        assertTrue(step.get("new_max_tile").asBoolean());
        assertEquals(1, step.get("empty_delta").asInt());
    }

    @Test
    void summaryRecordCarriesTotals() throws Exception {
        EpisodeLogger.logSummary("Random_1.0", 120, 1460, 128, false, 5_000_000L);

        JsonNode summary = lastRecord("EPISODE_SUMMARY");
        assertEquals("summary", summary.get("type").asText());
        assertFalse(summary.has("game_index"));
        assertEquals(120, summary.get("moves").asInt());
        assertEquals(1460, summary.get("score").asInt());
        assertEquals(128, summary.get("highest_tile").asInt());
        assertFalse(summary.get("stalled").asBoolean());
    }

    @Test
    void strategyNamesAreEscaped() throws Exception {
        String name = "Quote\"d \\ Strategy\n_1.0";
        Board before = BoardFactory.topPair();
        Board after = BoardEngine.apply(before, Move.LEFT).board();

        EpisodeLogger.logStep(before, after, name, 0, BoardEngine.legalMoves(before), Move.LEFT, true, 4);
        assertEquals(name, lastRecord("EPISODE_STEP").get("strategy").asText());

        EpisodeLogger.logSummary(name, 1, 4, 4, false, 1L);
        assertEquals(name, lastRecord("EPISODE_SUMMARY").get("strategy").asText());
    }

    @Test
    void brokenInputDoesNotEscape() {
        assertDoesNotThrow(() -> EpisodeLogger.logStep(null, null, "x", 0, null, Move.UP, false, 0));
    }
}
