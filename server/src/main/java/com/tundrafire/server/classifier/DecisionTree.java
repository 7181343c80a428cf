package com.tundrafire.server.classifier;

import java.util.List;

/**
 * Binary regression tree stored as a flat node array; node 0 is the root.
 */
public class DecisionTree {

    public static class Node {
        // split nodes
        public Integer feature;
        public Double threshold;
        public Integer left;
        public Integer right;
        // leaves: fraction of burnt training samples
        public Double probability;

        public boolean isLeaf() {
            return probability != null;
        }
    }

    public List<Node> nodes;

    /**
     * Walks from the root, going left when {@code features[feature] <= threshold}.
     */
    public double predict(double[] features) {
        Node node = nodes.get(0);
        int steps = 0;
        while (!node.isLeaf()) {
            int next = features[node.feature] <= node.threshold ? node.left : node.right;
            node = nodes.get(next);
            if (++steps > nodes.size()) {
                throw new IllegalStateException("Cycle in decision tree");
            }
        }
        return node.probability;
    }

    void validate(int featureCount) {
        if (nodes == null || nodes.isEmpty()) {
            throw new IllegalArgumentException("Tree has no nodes");
        }
        for (int i = 0; i < nodes.size(); i++) {
            Node n = nodes.get(i);
            if (n.isLeaf()) {
                if (n.probability < 0.0 || n.probability > 1.0) {
                    throw new IllegalArgumentException("Leaf " + i + " probability out of range: " + n.probability);
                }
                continue;
            }
            if (n.feature == null || n.threshold == null || n.left == null || n.right == null) {
                throw new IllegalArgumentException("Split node " + i + " is incomplete");
            }
            if (n.feature < 0 || n.feature >= featureCount) {
                throw new IllegalArgumentException("Split node " + i + " uses unknown feature " + n.feature);
            }
            if (n.left <= i || n.right <= i || n.left >= nodes.size() || n.right >= nodes.size()) {
                throw new IllegalArgumentException("Split node " + i + " has invalid children");
            }
        }
    }
}
