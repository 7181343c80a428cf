package com.tundrafire.server.classifier;

import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RandomForestClassifierTest {

    private RandomForestClassifier loadSmall() throws Exception {
        try (InputStream in = getClass().getResourceAsStream("/forest_small.json")) {
            assertNotNull(in, "forest_small.json missing from test resources");
            return RandomForestClassifier.load(in);
        }
    }

    @Test
    void testLoadAndPredict() throws Exception {
        RandomForestClassifier forest = loadSmall();
        assertEquals(List.of("dNBR2", "dTCG", "dTCB"), forest.getFeatureNames());
        assertEquals(3, forest.getSettings().numberOfTrees);
        assertNull(forest.getSettings().variablesPerSplit);

        assertEquals(2.5 / 3, forest.probability(new double[] { 200, -10, 0 }), 1e-9);
        assertEquals(0.7 / 3, forest.probability(new double[] { 50, 0, 0 }), 1e-9);
        // split goes left on equality
        assertEquals(0.7 / 3, forest.probability(new double[] { 100, 0, 0 }), 1e-9);
    }

    @Test
    void testDefaultSettings() {
        ForestSettings s = ForestSettings.defaults();
        assertEquals(100, s.numberOfTrees);
        assertEquals(1, s.minLeafPopulation);
        assertEquals(0.7, s.bagFraction);
        assertEquals(560, s.maxNodes);
        assertEquals(1, s.seed);
    }

    @Test
    void testTreeCountMustMatchSettings() throws Exception {
        RandomForestClassifier small = loadSmall();
        assertThrows(IllegalArgumentException.class,
                () -> new RandomForestClassifier(ForestSettings.defaults(), small.getFeatureNames(),
                        List.of(leaf(0.5))));
    }

    @Test
    void testInvalidTreesRejected() {
        ForestSettings one = new ForestSettings(1, null, 1, 0.7, 560, 1);
        assertThrows(IllegalArgumentException.class,
                () -> new RandomForestClassifier(one, List.of("dNBR2"), List.of(leaf(1.5))));

        DecisionTree backwards = new DecisionTree();
        DecisionTree.Node split = new DecisionTree.Node();
        split.feature = 0;
        split.threshold = 0.0;
        split.left = 0;
        split.right = 0;
        backwards.nodes = List.of(split);
        assertThrows(IllegalArgumentException.class,
                () -> new RandomForestClassifier(one, List.of("dNBR2"), List.of(backwards)));
    }

    @Test
    void testFeatureCountChecked() throws Exception {
        RandomForestClassifier forest = loadSmall();
        assertThrows(IllegalArgumentException.class, () -> forest.probability(new double[] { 1, 2 }));
    }

    static DecisionTree leaf(double p) {
        DecisionTree tree = new DecisionTree();
        DecisionTree.Node node = new DecisionTree.Node();
        node.probability = p;
        tree.nodes = List.of(node);
        return tree;
    }
}
