package ai.tiles.strategy.ai.rl;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON shape of a saved Q-learning model.
 *
 * <pre>
 * {
 *   "q_table": { "[2, 0, ...]": [0.0, 1.5, 0.0, 0.0], ... },
 *   "config": { "learning_rate": 0.1, ... },
 *   "training_episodes": 1000,
 *   "is_trained": true,
 *   "epsilon": 0.01
 * }
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class QTableDocument {

    private Map<String, double[]> qTable;

    private Map<String, Object> config = new LinkedHashMap<>();

    private int trainingEpisodes;

    private boolean trained;

    private Double epsilon;

    public QTableDocument() {
    }

    @JsonProperty("q_table")
    public Map<String, double[]> getQTable() {
        return qTable;
    }

    public void setQTable(Map<String, double[]> qTable) {
        this.qTable = qTable;
    }

    @JsonProperty("config")
    public Map<String, Object> getConfig() {
        return config;
    }

    public void setConfig(Map<String, Object> config) {
        this.config = config;
    }

    @JsonProperty("training_episodes")
    public int getTrainingEpisodes() {
        return trainingEpisodes;
    }

    public void setTrainingEpisodes(int trainingEpisodes) {
        this.trainingEpisodes = trainingEpisodes;
    }

    @JsonProperty("is_trained")
    public boolean isTrained() {
        return trained;
    }

    public void setTrained(boolean trained) {
        this.trained = trained;
    }

    @JsonProperty("epsilon")
    public Double getEpsilon() {
        return epsilon;
    }

    public void setEpsilon(Double epsilon) {
        this.epsilon = epsilon;
    }
}
