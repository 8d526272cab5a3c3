package ai.tiles;

import static org.junit.jupiter.api.Assertions.*;

import ai.tiles.config.GameProperties;
import ai.tiles.config.HeuristicWeightsProperties;
import ai.tiles.registry.StrategyRegistry;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(properties = {"game.games=0", "heuristic.weights.corner-bonus=300"})
class GameContextTest {

    @Autowired
    private StrategyRegistry registry;

    @Autowired
    private GameProperties gameProperties;

    @Autowired
    private HeuristicWeightsProperties weights;

    @Test
    void wiresRegistryFromProperties() {
        assertEquals(List.of("Basic Priority_1.0", "Random_1.0", "Enhanced Heuristic_2.1", "Q-Learning_1.0"),
                registry.ids());
        assertEquals("Enhanced Heuristic_2.1", gameProperties.getStrategy());
        assertEquals(50, gameProperties.getStallLimit());
        assertEquals(300.0, weights.getCornerBonus());
        assertEquals(300.0, weights.toWeights().cornerBonus());
    }
}
