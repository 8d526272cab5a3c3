package ai.tiles.strategy.ai.rl;

import ai.tiles.game.Board;
import ai.tiles.game.BoardEngine;
import ai.tiles.game.Move;
import ai.tiles.strategy.AbstractStrategy;
import ai.tiles.strategy.MoveScores;
import ai.tiles.strategy.PersistenceResult;
import ai.tiles.strategy.StrategyCategory;
import ai.tiles.strategy.StrategyMetadata;
import ai.tiles.strategy.TrainingOptions;
import ai.tiles.strategy.TrainingResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tabular Q-learning player.
 * <p>
 * The state is the exact board ({@link Board#stateKey()}), the action is one of the four moves.
 * Training runs episodes in a {@link TrainingEnvironment}:
 * <ol>
 *   <li>Pick a move epsilon-greedily: with probability epsilon a uniformly random valid move,
 *       otherwise the move with the highest Q-value among all four (ties in {@link Move} order).
 *       A move that changes nothing is stepped like any other and earns the no-op penalty.</li>
 *   <li>Step the environment and read the shaped reward.</li>
 *   <li>Update {@code Q(s,a) += alpha * (r + gamma * max Q(s') - Q(s,a))}; the bootstrap term is
 *       dropped when the step ends the episode.</li>
 * </ol>
 * Epsilon decays multiplicatively after every episode and never drops below its floor.
 * <p>
 * Play is greedy: {@link #nextMove(Board)} returns the valid move with the highest Q-value (ties
 * in {@link Move} declaration order). Unseen states have all-zero values, so an untrained
 * instance still plays legal moves.
 * <p>
 * Configuration keys: {@code learning_rate}, {@code discount_factor}, {@code epsilon},
 * {@code epsilon_decay}, {@code min_epsilon}.
 */
public class QLearningStrategy extends AbstractStrategy {
    private static final Logger log = LoggerFactory.getLogger(QLearningStrategy.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    public static final String PARAM_LEARNING_RATE = "learning_rate";
    public static final String PARAM_DISCOUNT_FACTOR = "discount_factor";
    public static final String PARAM_EPSILON = "epsilon";
    public static final String PARAM_EPSILON_DECAY = "epsilon_decay";
    public static final String PARAM_MIN_EPSILON = "min_epsilon";

    public static final double DEFAULT_LEARNING_RATE = 0.1;
    public static final double DEFAULT_DISCOUNT_FACTOR = 0.95;
    public static final double DEFAULT_EPSILON = 0.1;
    public static final double DEFAULT_EPSILON_DECAY = 0.995;
    public static final double DEFAULT_MIN_EPSILON = 0.01;

    private static final List<Move> ALL_MOVES = List.of(Move.values());

    private final QTable qTable = new QTable();

    private double learningRate;
    private double discountFactor;
    private double initialEpsilon;
    private double epsilon;
    private double epsilonDecay;
    private double minEpsilon;
    private int trainingEpisodes;
    private boolean trained;

    public QLearningStrategy() {
        this(Collections.emptyMap());
    }

    public QLearningStrategy(Map<String, Object> config) {
        super(config);
        applyParameters(config);
    }

    @Override
    public StrategyMetadata metadata() {
        return new StrategyMetadata(
                "Q-Learning",
                "1.0",
                "Tile Bot Team",
                "Tabular Q-learning over exact board states with epsilon-greedy exploration.",
                StrategyCategory.REINFORCEMENT_LEARNING,
                parameters(initialEpsilon),
                null,
                true);
    }

    @Override
    public Move nextMove(Board board) {
        Move move = greedyMove(board.stateKey(), BoardEngine.legalMoves(board));
        if (log.isDebugEnabled()) {
            log.debug("Q-values [{}] -> {}", MoveScores.of(qTable.get(board.stateKey())), move);
        }
        return move;
    }

    /**
     * Raw Q-values for {@code board}; all zero for unseen states.
     */
    @Override
    public MoveScores moveScores(Board board) {
        return MoveScores.of(qTable.get(board.stateKey()));
    }

    @Override
    public TrainingResult train(TrainingOptions options) {
        long seed = options.seed() != null ? options.seed() : System.nanoTime();
        TrainingEnvironment env = new TrainingEnvironment(seed);
        Random random = env.random();

        List<Double> epsilonTrace = new ArrayList<>(options.episodes());
        double rewardSum = 0.0;
        long lengthSum = 0;
        long highestTileSum = 0;
        int maxHighestTile = 0;

        log.info("Training {} for {} episodes (alpha={}, gamma={}, epsilon={})",
                metadata().id(), options.episodes(), learningRate, discountFactor, epsilon);

        for (int episode = 1; episode <= options.episodes(); episode++) {
            env.reset();
            double episodeReward = 0.0;
            int steps = 0;
            while (!env.isDone() && steps < options.maxStepsPerEpisode()) {
                String state = env.getBoard().stateKey();
                Move action = chooseTrainingMove(state, env.validMoves(), random);
                StepResult step = env.step(action);
                String nextState = env.getBoard().stateKey();
                update(state, action, step.reward(), nextState, step.done());
                episodeReward += step.reward();
                steps++;
            }
            epsilon = Math.max(minEpsilon, epsilon * epsilonDecay);
            epsilonTrace.add(epsilon);
            trainingEpisodes++;

            rewardSum += episodeReward;
            lengthSum += steps;
            highestTileSum += env.getHighestTile();
            maxHighestTile = Math.max(maxHighestTile, env.getHighestTile());

            if (options.progressInterval() > 0 && episode % options.progressInterval() == 0) {
                log.info("Episode {}/{}: avg reward {}, avg length {}, avg highest tile {}, epsilon {}, states {}",
                        episode,
                        options.episodes(),
                        String.format("%.2f", rewardSum / episode),
                        String.format("%.1f", (double) lengthSum / episode),
                        String.format("%.1f", (double) highestTileSum / episode),
                        String.format("%.4f", epsilon),
                        qTable.size());
            }
        }
        trained = true;
        putConfig(PARAM_EPSILON, epsilon);

        int episodes = options.episodes();
        double averageReward = episodes == 0 ? 0.0 : rewardSum / episodes;
        double averageLength = episodes == 0 ? 0.0 : (double) lengthSum / episodes;
        double averageHighestTile = episodes == 0 ? 0.0 : (double) highestTileSum / episodes;
        String message = String.format("Trained %d episodes (%d total), %d states, epsilon %.4f",
                episodes, trainingEpisodes, qTable.size(), epsilon);
        log.info(message);
        return new TrainingResult(
                true,
                message,
                episodes,
                trainingEpisodes,
                averageReward,
                averageLength,
                averageHighestTile,
                maxHighestTile,
                epsilon,
                epsilonTrace,
                qTable.size(),
                epsilon <= minEpsilon);
    }

    /**
     * Writes the table, hyperparameters, episode count, trained flag and current epsilon as
     * JSON, creating parent directories as needed.
     */
    @Override
    public PersistenceResult save(Path path) {
        QTableDocument document = new QTableDocument();
        document.setQTable(new LinkedHashMap<>(qTable.asMap()));
        document.setConfig(parameters(epsilon));
        document.setTrainingEpisodes(trainingEpisodes);
        document.setTrained(trained);
        document.setEpsilon(epsilon);
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            OBJECT_MAPPER.writeValue(path.toFile(), document);
            log.info("Saved Q-table with {} states to {}", qTable.size(), path);
            return PersistenceResult.ok(path);
        } catch (IOException e) {
            log.warn("Failed to save Q-table to {}: {}", path, e.toString());
            return PersistenceResult.ioError(path, e.getMessage());
        }
    }

    /**
     * Replaces the current table and hyperparameters with the contents of {@code path}. On any
     * failure the current state is left untouched.
     */
    @Override
    public PersistenceResult load(Path path) {
        byte[] content;
        try {
            content = Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            log.warn("Q-table file {} does not exist", path);
            return PersistenceResult.fileMissing(path);
        } catch (IOException e) {
            log.warn("Failed to read Q-table from {}: {}", path, e.toString());
            return PersistenceResult.ioError(path, e.getMessage());
        }

        QTableDocument document;
        try {
            document = OBJECT_MAPPER.readValue(content, QTableDocument.class);
        } catch (JsonProcessingException e) {
            log.warn("Q-table file {} is not valid JSON: {}", path, e.getOriginalMessage());
            return PersistenceResult.corrupt(path, e.getOriginalMessage());
        } catch (IOException e) {
            return PersistenceResult.ioError(path, e.getMessage());
        }
        if (document == null || document.getQTable() == null) {
            return PersistenceResult.corrupt(path, "missing q_table");
        }

        Double savedEpsilon = document.getEpsilon();
        if (savedEpsilon != null && !(savedEpsilon >= 0.0 && savedEpsilon <= 1.0)) {
            return PersistenceResult.corrupt(path, "epsilon must be in [0, 1] but was " + savedEpsilon);
        }

        QTable loaded = new QTable();
        double configuredEpsilon = initialEpsilon;
        try {
            for (Map.Entry<String, double[]> entry : document.getQTable().entrySet()) {
                if (entry.getValue() == null) {
                    return PersistenceResult.corrupt(path, "state " + entry.getKey() + " has no values");
                }
                loaded.put(entry.getKey(), entry.getValue());
            }
            Map<String, Object> config = document.getConfig() == null
                    ? Collections.emptyMap()
                    : document.getConfig();
            applyParameters(config);
        } catch (IllegalArgumentException e) {
            return PersistenceResult.corrupt(path, e.getMessage());
        }
        // the saved config holds the decayed epsilon; forget() returns to the constructed one
        initialEpsilon = configuredEpsilon;

        qTable.clear();
        for (Map.Entry<String, double[]> entry : loaded.asMap().entrySet()) {
            qTable.put(entry.getKey(), entry.getValue());
        }
        trainingEpisodes = document.getTrainingEpisodes();
        trained = document.isTrained();
        if (savedEpsilon != null) {
            epsilon = Math.max(minEpsilon, savedEpsilon);
            putConfig(PARAM_EPSILON, epsilon);
        }
        log.info("Loaded Q-table with {} states from {}", qTable.size(), path);
        return PersistenceResult.ok(path);
    }

    /**
     * Forgets everything learned: empty table, zero episodes, epsilon back to its configured
     * starting value. Unlike this, {@link #reset()} leaves the table intact.
     */
    public void forget() {
        qTable.clear();
        trainingEpisodes = 0;
        trained = false;
        epsilon = Math.max(minEpsilon, initialEpsilon);
        putConfig(PARAM_EPSILON, epsilon);
    }

    @Override
    public boolean isTrained() {
        return trained;
    }

    public double getEpsilon() {
        return epsilon;
    }

    public int getTrainingEpisodes() {
        return trainingEpisodes;
    }

    public int getStateCount() {
        return qTable.size();
    }

    /**
     * Q-values for an exact state key, in {@link Move} order.
     */
    public double[] qValues(String stateKey) {
        return qTable.get(stateKey);
    }

    QTable table() {
        return qTable;
    }

    void update(String state, Move action, double reward, String nextState, boolean done) {
        double current = qTable.get(state, action);
        double target = done ? reward : reward + discountFactor * qTable.max(nextState);
        qTable.set(state, action, current + learningRate * (target - current));
    }

    Move chooseTrainingMove(String state, List<Move> validMoves, Random random) {
        if (!validMoves.isEmpty() && random.nextDouble() < epsilon) {
            return validMoves.get(random.nextInt(validMoves.size()));
        }
        return greedyMove(state, ALL_MOVES);
    }

    /**
     * Argmax over {@code validMoves}; over all moves when none is valid.
     */
    private Move greedyMove(String state, List<Move> validMoves) {
        double[] values = qTable.get(state);
        List<Move> candidates = validMoves.isEmpty() ? List.of(Move.values()) : validMoves;
        Move best = candidates.get(0);
        for (Move move : candidates) {
            if (values[move.ordinal()] > values[best.ordinal()]) {
                best = move;
            }
        }
        return best;
    }

    private void applyParameters(Map<String, Object> config) {
        double alpha = doubleParam(config, PARAM_LEARNING_RATE, DEFAULT_LEARNING_RATE);
        double gamma = doubleParam(config, PARAM_DISCOUNT_FACTOR, DEFAULT_DISCOUNT_FACTOR);
        double eps = doubleParam(config, PARAM_EPSILON, DEFAULT_EPSILON);
        double decay = doubleParam(config, PARAM_EPSILON_DECAY, DEFAULT_EPSILON_DECAY);
        double floor = doubleParam(config, PARAM_MIN_EPSILON, DEFAULT_MIN_EPSILON);
        requireRange(PARAM_LEARNING_RATE, alpha, 0.0, 1.0, false);
        requireRange(PARAM_DISCOUNT_FACTOR, gamma, 0.0, 1.0, true);
        requireRange(PARAM_EPSILON, eps, 0.0, 1.0, true);
        requireRange(PARAM_EPSILON_DECAY, decay, 0.0, 1.0, false);
        requireRange(PARAM_MIN_EPSILON, floor, 0.0, 1.0, true);
        if (floor > eps) {
            throw new IllegalArgumentException(PARAM_MIN_EPSILON + " (" + floor + ") must not exceed "
                    + PARAM_EPSILON + " (" + eps + ")");
        }
        this.learningRate = alpha;
        this.discountFactor = gamma;
        this.initialEpsilon = eps;
        this.epsilon = eps;
        this.epsilonDecay = decay;
        this.minEpsilon = floor;
        for (Map.Entry<String, Object> entry : parameters(eps).entrySet()) {
            putConfig(entry.getKey(), entry.getValue());
        }
    }

    private static void requireRange(String key, double value, double low, double high, boolean lowInclusive) {
        boolean aboveLow = lowInclusive ? value >= low : value > low;
        if (!Double.isFinite(value) || !aboveLow || value > high) {
            throw new IllegalArgumentException("Parameter '" + key + "' must be in "
                    + (lowInclusive ? "[" : "(") + low + ", " + high + "] but was " + value);
        }
    }

    private Map<String, Object> parameters(double currentEpsilon) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put(PARAM_LEARNING_RATE, learningRate);
        parameters.put(PARAM_DISCOUNT_FACTOR, discountFactor);
        parameters.put(PARAM_EPSILON, currentEpsilon);
        parameters.put(PARAM_EPSILON_DECAY, epsilonDecay);
        parameters.put(PARAM_MIN_EPSILON, minEpsilon);
        return parameters;
    }
}
