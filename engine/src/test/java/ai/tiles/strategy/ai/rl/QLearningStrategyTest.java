package ai.tiles.strategy.ai.rl;

import static org.junit.jupiter.api.Assertions.*;

import ai.tiles.game.Board;
import ai.tiles.game.BoardEngine;
import ai.tiles.game.Move;
import ai.tiles.strategy.MoveScores;
import ai.tiles.strategy.PersistenceResult;
import ai.tiles.strategy.StrategyCategory;
import ai.tiles.strategy.TrainingOptions;
import ai.tiles.strategy.TrainingResult;
import ai.tiles.unit.helpers.BoardFactory;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Random;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class QLearningStrategyTest {

    private static TrainingOptions quick(int episodes, long seed) {
        return new TrainingOptions(episodes, 300, seed, 0);
    }

    @Nested
    @DisplayName("Untrained play")
    class Untrained {

        @Test
        void playsFirstLegalMoveWhenAllValuesAreZero() {
            QLearningStrategy strategy = new QLearningStrategy();
            assertEquals(Move.UP, strategy.nextMove(BoardFactory.twoCorners()));
            assertEquals(Move.DOWN, strategy.nextMove(BoardFactory.packedTopRow()));
            assertEquals(Move.UP, strategy.nextMove(BoardFactory.deadCheckerboard()));
        }

        @Test
        void moveScoresAreRawQValues() {
            QLearningStrategy strategy = new QLearningStrategy();
            assertEquals(MoveScores.of(0, 0, 0, 0), strategy.moveScores(BoardFactory.twoCorners()));
            assertFalse(strategy.isTrained());
            assertEquals(0, strategy.getStateCount());
        }

        @Test
        void metadataDescribesReinforcementLearner() {
            QLearningStrategy strategy = new QLearningStrategy();
            assertEquals("Q-Learning_1.0", strategy.metadata().id());
            assertEquals(StrategyCategory.REINFORCEMENT_LEARNING, strategy.metadata().category());
            assertTrue(strategy.metadata().trainingRequired());
            assertNull(strategy.metadata().performanceBaseline());
            assertEquals(0.1, strategy.metadata().parameters().get(QLearningStrategy.PARAM_EPSILON));
        }

        @Test
        void greedyPlayIgnoresIllegalMovesWithHighValues() {
            QLearningStrategy strategy = new QLearningStrategy();
            String key = BoardFactory.packedTopRow().stateKey();
            strategy.table().set(key, Move.UP, 100.0);
            strategy.table().set(key, Move.DOWN, -5.0);
            assertEquals(Move.DOWN, strategy.nextMove(BoardFactory.packedTopRow()));
            assertEquals(100.0, strategy.moveScores(BoardFactory.packedTopRow()).get(Move.UP));
        }
    }

    @Nested
    @DisplayName("Q update")
    class Update {

        @Test
        void terminalUpdateUsesRewardOnly() {
            QLearningStrategy strategy = new QLearningStrategy();
            strategy.update("s", Move.UP, 10.0, "t", true);
            assertEquals(1.0, strategy.qValues("s")[Move.UP.ordinal()], 1e-12);
        }

        @Test
        void nonTerminalUpdateBootstrapsFromNextState() {
            QLearningStrategy strategy = new QLearningStrategy();
            strategy.update("s", Move.UP, 10.0, "t", true);
            // target = 10 + 0.95 * 1.0; Q = 1.0 + 0.1 * (10.95 - 1.0)
            strategy.update("s", Move.UP, 10.0, "s", false);
            assertEquals(1.995, strategy.qValues("s")[Move.UP.ordinal()], 1e-12);
        }

        @Test
        void unseenStatesAreNotInserted() {
            QLearningStrategy strategy = new QLearningStrategy();
            assertArrayEquals(new double[4], strategy.qValues("unknown"));
            assertEquals(0, strategy.getStateCount());
        }
    }

    @Nested
    @DisplayName("Training")
    class Training {

        @Test
        void epsilonDecaysEveryEpisode() {
            QLearningStrategy strategy = new QLearningStrategy();
            TrainingResult result = strategy.train(quick(50, 7L));

            assertTrue(result.supported());
            assertEquals(50, result.episodesTrained());
            assertEquals(50, result.epsilonTrace().size());
            for (int i = 1; i < result.epsilonTrace().size(); i++) {
                assertTrue(result.epsilonTrace().get(i) <= result.epsilonTrace().get(i - 1));
            }
            assertEquals(0.1 * Math.pow(0.995, 50), strategy.getEpsilon(), 1e-9);
            assertEquals(strategy.getEpsilon(), result.finalEpsilon());
            assertFalse(result.converged());
            assertTrue(strategy.isTrained());
            assertTrue(result.stateCount() > 0);
            assertEquals(strategy.getStateCount(), result.stateCount());
        }

        @Test
        void learnedValuesAreFinite() {
            QLearningStrategy strategy = new QLearningStrategy();
            strategy.train(quick(30, 3L));
            for (double[] values : strategy.table().asMap().values()) {
                assertEquals(4, values.length);
                for (double value : values) {
                    assertTrue(Double.isFinite(value));
                }
            }
        }

        @Test
        void epsilonStopsAtFloor() {
            QLearningStrategy strategy = new QLearningStrategy(Map.of(QLearningStrategy.PARAM_EPSILON_DECAY, 0.5));
            TrainingResult result = strategy.train(quick(10, 1L));
            assertEquals(QLearningStrategy.DEFAULT_MIN_EPSILON, strategy.getEpsilon(), 1e-12);
            assertTrue(result.converged());
        }

        @Test
        void episodeCountAccumulatesAcrossCalls() {
            QLearningStrategy strategy = new QLearningStrategy();
            strategy.train(quick(5, 1L));
            TrainingResult second = strategy.train(quick(5, 2L));
            assertEquals(5, second.episodesTrained());
            assertEquals(10, second.totalEpisodes());
            assertEquals(10, strategy.getTrainingEpisodes());
        }

        @Test
        void sameSeedGivesSameTable() {
            QLearningStrategy first = new QLearningStrategy();
            QLearningStrategy second = new QLearningStrategy();
            TrainingResult a = first.train(quick(20, 11L));
            TrainingResult b = second.train(quick(20, 11L));

            assertEquals(a.averageReward(), b.averageReward());
            assertEquals(a.stateCount(), b.stateCount());
            for (Map.Entry<String, double[]> entry : first.table().asMap().entrySet()) {
                assertArrayEquals(entry.getValue(), second.qValues(entry.getKey()));
            }
        }

        @Test
        void stepCapBoundsEpisodeLength() {
            QLearningStrategy strategy = new QLearningStrategy();
            TrainingResult result = strategy.train(new TrainingOptions(3, 5, 4L, 0));
            assertTrue(result.averageEpisodeLength() <= 5.0);
        }

        @Test
        void exploitationMayPickANoOpAndLearnsItsPenalty() {
            QLearningStrategy strategy = new QLearningStrategy(Map.of(
                    QLearningStrategy.PARAM_EPSILON, 0.0,
                    QLearningStrategy.PARAM_MIN_EPSILON, 0.0));
            Board board = BoardFactory.packedTopRow();
            String key = board.stateKey();
            strategy.table().set(key, Move.UP, 100.0);

            Move chosen = strategy.chooseTrainingMove(key, BoardEngine.legalMoves(board), new Random(1L));
            assertEquals(Move.UP, chosen);

            double reward = new ShapedReward().reward(board, BoardEngine.apply(board, chosen));
            assertEquals(ShapedReward.DEFAULT_INVALID_MOVE_PENALTY, reward);

            // target = -10 + 0.95 * 100; Q = 100 + 0.1 * (85 - 100)
            strategy.update(key, chosen, reward, key, false);
            assertEquals(98.5, strategy.qValues(key)[Move.UP.ordinal()], 1e-12);
        }

        @Test
        void explorationOnlyDrawsValidMoves() {
            QLearningStrategy strategy = new QLearningStrategy(Map.of(QLearningStrategy.PARAM_EPSILON, 1.0));
            Board board = BoardFactory.packedTopRow();
            strategy.table().set(board.stateKey(), Move.UP, 100.0);
            Random random = new Random(5L);
            for (int i = 0; i < 20; i++) {
                assertEquals(Move.DOWN, strategy.chooseTrainingMove(board.stateKey(), BoardEngine.legalMoves(board), random));
            }
        }

        @Test
        void zeroEpisodesIsHarmless() {
            QLearningStrategy strategy = new QLearningStrategy();
            TrainingResult result = strategy.train(quick(0, 1L));
            assertEquals(0, result.episodesTrained());
            assertEquals(0.0, result.averageReward());
            assertEquals(List.of(), result.epsilonTrace());
        }
    }

    @Nested
    @DisplayName("Configuration")
    class Configuration {

        @Test
        void rejectsOutOfRangeParameters() {
            assertThrows(IllegalArgumentException.class,
                    () -> new QLearningStrategy(Map.of(QLearningStrategy.PARAM_LEARNING_RATE, 0.0)));
            assertThrows(IllegalArgumentException.class,
                    () -> new QLearningStrategy(Map.of(QLearningStrategy.PARAM_DISCOUNT_FACTOR, 1.5)));
            assertThrows(IllegalArgumentException.class,
                    () -> new QLearningStrategy(Map.of(QLearningStrategy.PARAM_EPSILON_DECAY, 0.0)));
            assertThrows(IllegalArgumentException.class,
                    () -> new QLearningStrategy(Map.of(QLearningStrategy.PARAM_MIN_EPSILON, 0.5)));
            assertThrows(IllegalArgumentException.class,
                    () -> new QLearningStrategy(Map.of(QLearningStrategy.PARAM_EPSILON, "lots")));
        }

        @Test
        void configIsReportedBack() {
            QLearningStrategy strategy = new QLearningStrategy(Map.of(
                    QLearningStrategy.PARAM_LEARNING_RATE, 0.2,
                    QLearningStrategy.PARAM_EPSILON, 0.3));
            assertEquals(0.2, strategy.getConfig().get(QLearningStrategy.PARAM_LEARNING_RATE));
            assertEquals(0.3, strategy.getConfig().get(QLearningStrategy.PARAM_EPSILON));
            assertEquals(0.3, strategy.getEpsilon());
        }

        @Test
        void resetKeepsTableButForgetClearsIt() {
            QLearningStrategy strategy = new QLearningStrategy();
            strategy.train(quick(3, 5L));
            int states = strategy.getStateCount();

            strategy.reset();
            assertEquals(states, strategy.getStateCount());
            assertTrue(strategy.isTrained());

            strategy.forget();
            assertEquals(0, strategy.getStateCount());
            assertEquals(0, strategy.getTrainingEpisodes());
            assertFalse(strategy.isTrained());
            assertEquals(QLearningStrategy.DEFAULT_EPSILON, strategy.getEpsilon());
        }
    }

    @Nested
    @DisplayName("Persistence")
    class Persistence {

        @TempDir
        Path dir;

        @Test
        void saveThenLoadRestoresEverything() {
            QLearningStrategy trained = new QLearningStrategy();
            trained.train(quick(10, 21L));
            Path file = dir.resolve("models").resolve("q.json");

            PersistenceResult saved = trained.save(file);
            assertTrue(saved.isSuccess(), saved.toString());
            assertTrue(Files.exists(file));

            QLearningStrategy restored = new QLearningStrategy();
            PersistenceResult loaded = restored.load(file);
            assertTrue(loaded.isSuccess(), loaded.toString());
            assertEquals(trained.getStateCount(), restored.getStateCount());
            assertEquals(trained.getTrainingEpisodes(), restored.getTrainingEpisodes());
            assertEquals(trained.getEpsilon(), restored.getEpsilon(), 1e-12);
            assertTrue(restored.isTrained());
            for (Map.Entry<String, double[]> entry : trained.table().asMap().entrySet()) {
                assertArrayEquals(entry.getValue(), restored.qValues(entry.getKey()), 1e-12);
            }
        }

        @Test
        void savedFileUsesDocumentedFieldNames() throws Exception {
            QLearningStrategy strategy = new QLearningStrategy();
            strategy.update("s", Move.LEFT, 4.0, "t", true);
            Path file = dir.resolve("q.json");
            assertTrue(strategy.save(file).isSuccess());

            JsonNode root = new ObjectMapper().readTree(file.toFile());
            assertTrue(root.has("q_table"));
            assertTrue(root.has("config"));
            assertTrue(root.has("training_episodes"));
            assertTrue(root.has("is_trained"));
            assertTrue(root.has("epsilon"));
            assertEquals(0.4, root.get("q_table").get("s").get(Move.LEFT.ordinal()).asDouble(), 1e-12);
            assertEquals(0.1, root.get("config").get(QLearningStrategy.PARAM_LEARNING_RATE).asDouble());
        }

        @Test
        void missingFileIsReported() {
            QLearningStrategy strategy = new QLearningStrategy();
            PersistenceResult result = strategy.load(dir.resolve("nope.json"));
            assertEquals(PersistenceResult.Status.FILE_MISSING, result.getStatus());
            assertFalse(result.isSuccess());
        }

        @Test
        void invalidJsonIsCorrupt() throws Exception {
            Path file = dir.resolve("broken.json");
            Files.writeString(file, "{ this is not json");
            PersistenceResult result = new QLearningStrategy().load(file);
            assertEquals(PersistenceResult.Status.CORRUPT_DATA, result.getStatus());
        }

        @Test
        void missingTableIsCorrupt() throws Exception {
            Path file = dir.resolve("empty.json");
            Files.writeString(file, "{\"training_episodes\": 3}");
            PersistenceResult result = new QLearningStrategy().load(file);
            assertEquals(PersistenceResult.Status.CORRUPT_DATA, result.getStatus());
        }

        @Test
        void badRowLeavesCurrentStateUntouched() throws Exception {
            QLearningStrategy strategy = new QLearningStrategy();
            strategy.update("s", Move.UP, 10.0, "t", true);
            Path file = dir.resolve("short.json");
            Files.writeString(file, "{\"q_table\": {\"a\": [1.0, 2.0, 3.0]}, \"training_episodes\": 9}");

            PersistenceResult result = strategy.load(file);
            assertEquals(PersistenceResult.Status.CORRUPT_DATA, result.getStatus());
            assertEquals(1, strategy.getStateCount());
            assertEquals(1.0, strategy.qValues("s")[Move.UP.ordinal()], 1e-12);
            assertEquals(0, strategy.getTrainingEpisodes());
        }

        @Test
        void outOfRangeSavedEpsilonIsCorrupt() throws Exception {
            QLearningStrategy strategy = new QLearningStrategy();
            Path file = dir.resolve("epsilon.json");
            Files.writeString(file, "{\"q_table\": {\"a\": [1.0, 2.0, 3.0, 4.0]}, \"epsilon\": 7.0}");

            PersistenceResult result = strategy.load(file);
            assertEquals(PersistenceResult.Status.CORRUPT_DATA, result.getStatus());
            assertEquals(0, strategy.getStateCount());
            assertEquals(QLearningStrategy.DEFAULT_EPSILON, strategy.getEpsilon());
        }

        @Test
        void forgetAfterLoadReturnsToConstructedEpsilon() {
            QLearningStrategy trained = new QLearningStrategy(Map.of(QLearningStrategy.PARAM_EPSILON_DECAY, 0.5));
            trained.train(quick(3, 8L));
            Path file = dir.resolve("decayed.json");
            assertTrue(trained.save(file).isSuccess());

            QLearningStrategy restored = new QLearningStrategy(Map.of(QLearningStrategy.PARAM_EPSILON, 0.4));
            assertTrue(restored.load(file).isSuccess());
            assertEquals(trained.getEpsilon(), restored.getEpsilon(), 1e-12);

            restored.forget();
            assertEquals(0.4, restored.getEpsilon());
        }

        @Test
        void invalidSavedConfigIsCorrupt() throws Exception {
            Path file = dir.resolve("config.json");
            Files.writeString(file, "{\"q_table\": {}, \"config\": {\"learning_rate\": 7}}");
            PersistenceResult result = new QLearningStrategy().load(file);
            assertEquals(PersistenceResult.Status.CORRUPT_DATA, result.getStatus());
        }
    }
}
